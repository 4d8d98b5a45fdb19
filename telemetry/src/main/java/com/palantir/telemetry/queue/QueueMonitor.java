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

package com.palantir.telemetry.queue;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.telemetry.AlertDispatcher;
import com.palantir.telemetry.api.AlertHandler;
import com.palantir.telemetry.api.HandlerFailure;
import com.palantir.telemetry.api.queue.QueueAlert;
import com.palantir.telemetry.api.queue.QueueAlertType;
import com.palantir.telemetry.api.queue.QueueConfig;
import com.palantir.telemetry.api.queue.QueueStats;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Tracks throughput, failures, depth and job age of named job queues. Every mutating call re-derives the queue's stats
 * and checks the four alert conditions (depth, failure ratio, stale jobs, slow processing) against their thresholds,
 * each strictly exceeded. Queues are created on first use.
 *
 * <p>This class is thread-safe.
 */
public final class QueueMonitor {

    private static final SafeLogger log = SafeLoggerFactory.get(QueueMonitor.class);

    private final QueueConfig config;
    private final Clock clock;
    private final AlertDispatcher<QueueAlert> alerts;

    // guarded by this
    private final Map<String, QueueTracker> queues = new LinkedHashMap<>();

    public QueueMonitor(QueueConfig config, Clock clock) {
        this.config = Preconditions.checkNotNull(config, "config must not be null");
        this.clock = Preconditions.checkNotNull(clock, "clock must not be null");
        this.alerts = new AlertDispatcher<>("queues", clock);
    }

    @CanIgnoreReturnValue
    public List<QueueAlert> recordProcessed(String queue, long processingTimeMs) {
        Preconditions.checkArgument(
                processingTimeMs >= 0,
                "processingTimeMs must not be negative",
                SafeArg.of("processingTimeMs", processingTimeMs));
        return mutate(queue, (tracker, now) -> tracker.recordProcessed(processingTimeMs, now));
    }

    @CanIgnoreReturnValue
    public List<QueueAlert> recordFailed(String queue) {
        return mutate(queue, (tracker, now) -> tracker.recordFailed(now));
    }

    @CanIgnoreReturnValue
    public List<QueueAlert> updateDepth(String queue, long depth) {
        Preconditions.checkArgument(depth >= 0, "depth must not be negative", SafeArg.of("depth", depth));
        return mutate(queue, (tracker, now) -> tracker.updateDepth(depth, now));
    }

    /** Records the enqueue time of the oldest job still waiting in the queue. */
    @CanIgnoreReturnValue
    public List<QueueAlert> setOldestJobTimestamp(String queue, Instant timestamp) {
        Preconditions.checkNotNull(timestamp, "timestamp must not be null");
        return mutate(queue, (tracker, now) -> tracker.setOldestJobTimestamp(timestamp, now));
    }

    /** Marks the queue as having no waiting jobs. */
    @CanIgnoreReturnValue
    public List<QueueAlert> clearOldestJobTimestamp(String queue) {
        return mutate(queue, (tracker, now) -> tracker.setOldestJobTimestamp(null, now));
    }

    public synchronized Optional<QueueStats> getStats(String queue) {
        QueueTracker tracker = queues.get(queue);
        if (tracker == null) {
            return Optional.empty();
        }
        return Optional.of(tracker.stats(clock.instant(), config.getStaleThresholdMs()));
    }

    public synchronized List<QueueStats> getAllStats() {
        Instant now = clock.instant();
        return queues.values().stream()
                .map(tracker -> tracker.stats(now, config.getStaleThresholdMs()))
                .collect(ImmutableList.toImmutableList());
    }

    /** Clears the queue's counters and processing samples and starts a new rate window. */
    public synchronized void resetWindow(String queue) {
        QueueTracker tracker = queues.get(queue);
        if (tracker != null) {
            tracker.resetWindow(clock.instant());
        }
    }

    public synchronized boolean removeQueue(String queue) {
        return queues.remove(queue) != null;
    }

    @Nullable
    public AlertHandler<? super QueueAlert> subscribe(String name, AlertHandler<? super QueueAlert> handler) {
        return alerts.subscribe(name, handler);
    }

    @Nullable
    public AlertHandler<? super QueueAlert> unsubscribe(String name) {
        return alerts.unsubscribe(name);
    }

    public List<HandlerFailure> drainHandlerFailures() {
        return alerts.drainFailures();
    }

    private List<QueueAlert> mutate(String queue, Mutation mutation) {
        Preconditions.checkArgument(queue != null && !queue.isEmpty(), "queue must be non-empty");
        List<QueueAlert> raised;
        synchronized (this) {
            Instant now = clock.instant();
            QueueTracker tracker = queues.computeIfAbsent(queue, name -> new QueueTracker(name, now));
            mutation.apply(tracker, now);
            raised = check(tracker.stats(now, config.getStaleThresholdMs()), now);
        }
        for (QueueAlert alert : raised) {
            log.info(
                    "Queue alert raised",
                    SafeArg.of("queue", alert.getQueue()),
                    SafeArg.of("type", alert.getType()),
                    SafeArg.of("value", alert.getValue()),
                    SafeArg.of("threshold", alert.getThreshold()));
            alerts.dispatch(alert);
        }
        return raised;
    }

    private List<QueueAlert> check(QueueStats stats, Instant now) {
        ImmutableList.Builder<QueueAlert> raised = ImmutableList.builder();
        if (stats.getDepth() > config.getDepthThreshold()) {
            raised.add(alert(
                    stats,
                    QueueAlertType.DEPTH_EXCEEDED,
                    "Queue depth " + stats.getDepth() + " exceeds threshold " + config.getDepthThreshold(),
                    stats.getDepth(),
                    config.getDepthThreshold(),
                    now));
        }
        if (stats.getFailureRatio() > config.getFailureRateThreshold()) {
            raised.add(alert(
                    stats,
                    QueueAlertType.HIGH_FAILURE_RATE,
                    String.format(
                            Locale.ROOT,
                            "Failure rate %.1f%% exceeds threshold %.1f%%",
                            stats.getFailureRatio() * 100, config.getFailureRateThreshold() * 100),
                    stats.getFailureRatio(),
                    config.getFailureRateThreshold(),
                    now));
        }
        if (stats.hasStaleJobs()) {
            long age = stats.getOldestJobAgeMs().getAsLong();
            raised.add(alert(
                    stats,
                    QueueAlertType.STALE_JOBS,
                    "Oldest job is " + age / 1000 + "s old, threshold " + config.getStaleThresholdMs() / 1000 + "s",
                    age,
                    config.getStaleThresholdMs(),
                    now));
        }
        if (stats.getAvgProcessingTimeMs() > config.getProcessingTimeThresholdMs()) {
            raised.add(alert(
                    stats,
                    QueueAlertType.PROCESSING_SLOW,
                    String.format(
                            Locale.ROOT,
                            "Average processing time %.0fms exceeds threshold %dms",
                            stats.getAvgProcessingTimeMs(), config.getProcessingTimeThresholdMs()),
                    stats.getAvgProcessingTimeMs(),
                    config.getProcessingTimeThresholdMs(),
                    now));
        }
        return raised.build();
    }

    private static QueueAlert alert(
            QueueStats stats, QueueAlertType type, String message, double value, double threshold, Instant now) {
        return QueueAlert.builder()
                .queue(stats.getName())
                .type(type)
                .message(message)
                .value(value)
                .threshold(threshold)
                .timestamp(now)
                .build();
    }

    private interface Mutation {
        void apply(QueueTracker tracker, Instant now);
    }
}
