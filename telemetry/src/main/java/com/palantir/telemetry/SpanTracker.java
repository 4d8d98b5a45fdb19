/*
 * (c) Copyright 2026 Palantir Technologies Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.palantir.telemetry;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CheckReturnValue;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.telemetry.api.AlertHandler;
import com.palantir.telemetry.api.ApmConfig;
import com.palantir.telemetry.api.HandlerFailure;
import com.palantir.telemetry.api.OpenSpan;
import com.palantir.telemetry.api.PercentileStats;
import com.palantir.telemetry.api.Span;
import com.palantir.telemetry.api.SpanStatus;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * Opens and closes hierarchical spans and keeps a bounded, sampled history of completed spans from which latency
 * percentiles and error rates are reported.
 *
 * <p>A completed span is retained only if the {@link TraceSampler} accepts it when the span ends; either way it leaves
 * the set of open spans. Once more than {@link ApmConfig#getMaxSpans()} spans are retained, the oldest are evicted.
 * Observers registered with {@link #subscribe} are notified of every retained span, after it has been recorded.
 *
 * <p>This class is thread-safe.
 */
public final class SpanTracker {

    private static final SafeLogger log = SafeLoggerFactory.get(SpanTracker.class);

    private final ApmConfig config;
    private final TraceSampler sampler;
    private final Clock clock;
    private final Map<String, SpanHandle> openSpans = new ConcurrentHashMap<>();
    private final AlertDispatcher<Span> observers;

    // guarded by this
    private final Deque<Span> completedSpans = new ArrayDeque<>();

    @VisibleForTesting
    SpanTracker(ApmConfig config, TraceSampler sampler, Clock clock) {
        this.config = Preconditions.checkNotNull(config, "config must not be null");
        this.sampler = Preconditions.checkNotNull(sampler, "sampler must not be null");
        this.clock = Preconditions.checkNotNull(clock, "clock must not be null");
        this.observers = new AlertDispatcher<>("spans", clock);
    }

    public static SpanTracker create(ApmConfig config) {
        return create(config, Clock.systemUTC());
    }

    public static SpanTracker create(ApmConfig config, Clock clock) {
        return new SpanTracker(config, RandomSampler.create(config.getSampleRate()), clock);
    }

    /** Opens the root span of a new trace. */
    @CheckReturnValue
    public SpanHandle startTrace(String name) {
        return startTrace(name, ImmutableMap.of());
    }

    @CheckReturnValue
    public SpanHandle startTrace(String name, Map<String, String> attributes) {
        return open(Ids.randomId(), Optional.empty(), name, attributes);
    }

    /** Opens a child of the given span, sharing its trace id. */
    @CheckReturnValue
    public SpanHandle startSpan(SpanHandle parent, String name) {
        return startSpan(parent, name, ImmutableMap.of());
    }

    @CheckReturnValue
    public SpanHandle startSpan(SpanHandle parent, String name, Map<String, String> attributes) {
        Preconditions.checkNotNull(parent, "parent must not be null");
        return open(parent.getTraceId(), Optional.of(parent.getSpanId()), name, attributes);
    }

    /** Ends the span with the status currently set on the handle. */
    public Optional<Span> endSpan(SpanHandle handle) {
        Preconditions.checkNotNull(handle, "handle must not be null");
        return endSpan(handle, handle.getStatus());
    }

    /**
     * Ends the span, stamping its end time with the tracker's clock. Returns the completed span whether or not it was
     * sampled into the history. A span which has already been ended is left untouched: a warning is logged and an
     * empty result returned, so no second record is ever produced.
     */
    public Optional<Span> endSpan(SpanHandle handle, SpanStatus status) {
        Preconditions.checkNotNull(handle, "handle must not be null");
        Preconditions.checkNotNull(status, "status must not be null");
        if (handle.tracker() != this) {
            throw new SafeIllegalArgumentException(
                    "Span was started by a different tracker", SafeArg.of("spanId", handle.getSpanId()));
        }
        if (!handle.markEnded()) {
            log.warn("Attempted to end span {} which has already been ended", SafeArg.of("span", handle));
            return Optional.empty();
        }
        openSpans.remove(handle.getSpanId());

        OpenSpan openSpan = handle.getOpenSpan();
        Span span = Span.builder()
                .traceId(openSpan.getTraceId())
                .parentSpanId(openSpan.getParentSpanId())
                .spanId(openSpan.getSpanId())
                .name(openSpan.getName())
                .service(openSpan.getService())
                .startTime(openSpan.getStartTime())
                .endTime(clock.instant())
                .status(status)
                .putAllAttributes(handle.getAttributes())
                .build();

        if (sampler.sample()) {
            commit(span);
            observers.dispatch(span);
        }
        return Optional.of(span);
    }

    /** Latency percentiles over every retained span. */
    public PercentileStats getStats() {
        return Percentiles.compute(durations(snapshot()));
    }

    /** Latency percentiles over the retained spans with the given name. */
    public PercentileStats getStats(String name) {
        return Percentiles.compute(durations(named(name)));
    }

    /** Fraction of retained spans with {@link SpanStatus#ERROR}, or 0 if none are retained. */
    public double getErrorRate() {
        return errorRate(snapshot());
    }

    public double getErrorRate(String name) {
        return errorRate(named(name));
    }

    public synchronized int getCompletedSpanCount() {
        return completedSpans.size();
    }

    public int getOpenSpanCount() {
        return openSpans.size();
    }

    /** Retained spans, oldest first. */
    public List<Span> getCompletedSpans() {
        return snapshot();
    }

    /** Retained spans of the given trace, oldest first. */
    public List<Span> getTrace(String traceId) {
        return snapshot().stream()
                .filter(span -> span.getTraceId().equals(traceId))
                .collect(ImmutableList.toImmutableList());
    }

    /** Drops all retained spans. Open spans are unaffected. */
    public synchronized void clear() {
        completedSpans.clear();
    }

    /**
     * Subscribes the given observer to every retained span. Returns the observer previously registered under the
     * same name, or null if there was none.
     */
    @Nullable
    public AlertHandler<? super Span> subscribe(String name, AlertHandler<? super Span> observer) {
        return observers.subscribe(name, observer);
    }

    @Nullable
    public AlertHandler<? super Span> unsubscribe(String name) {
        return observers.unsubscribe(name);
    }

    public List<HandlerFailure> drainHandlerFailures() {
        return observers.drainFailures();
    }

    private SpanHandle open(
            String traceId, Optional<String> parentSpanId, String name, Map<String, String> attributes) {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "name must be non-empty");
        Preconditions.checkNotNull(attributes, "attributes must not be null");
        OpenSpan openSpan =
                OpenSpan.of(traceId, Ids.randomId(), parentSpanId, name, config.getServiceName(), clock.instant());
        SpanHandle handle = new SpanHandle(this, openSpan, attributes);
        openSpans.put(openSpan.getSpanId(), handle);
        return handle;
    }

    private synchronized void commit(Span span) {
        completedSpans.addLast(span);
        while (completedSpans.size() > config.getMaxSpans()) {
            completedSpans.removeFirst();
        }
    }

    private synchronized List<Span> snapshot() {
        return ImmutableList.copyOf(completedSpans);
    }

    private List<Span> named(String name) {
        Preconditions.checkNotNull(name, "name must not be null");
        return snapshot().stream()
                .filter(span -> span.getName().equals(name))
                .collect(Collectors.toList());
    }

    private static List<Double> durations(List<Span> spans) {
        return spans.stream().map(Span::getDurationMillis).collect(Collectors.toList());
    }

    private static double errorRate(List<Span> spans) {
        if (spans.isEmpty()) {
            return 0;
        }
        long errors = spans.stream()
                .filter(span -> span.getStatus() == SpanStatus.ERROR)
                .count();
        return (double) errors / spans.size();
    }
}
