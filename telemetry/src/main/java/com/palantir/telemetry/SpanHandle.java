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

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.telemetry.api.OpenSpan;
import com.palantir.telemetry.api.Span;
import com.palantir.telemetry.api.SpanStatus;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

/**
 * A caller's handle on an open span owned by a {@link SpanTracker}. Attributes and status may be changed until the span
 * is ended; ending is idempotent and only the first call produces a completed {@link Span}.
 */
public final class SpanHandle {

    private static final SafeLogger log = SafeLoggerFactory.get(SpanHandle.class);

    private static final int NOT_ENDED = 0;
    private static final int ENDED = 1;

    private static final AtomicIntegerFieldUpdater<SpanHandle> endedUpdater =
            AtomicIntegerFieldUpdater.newUpdater(SpanHandle.class, "ended");

    private final SpanTracker tracker;
    private final OpenSpan openSpan;
    private final Map<String, String> attributes = new ConcurrentHashMap<>();
    private volatile SpanStatus status = SpanStatus.OK;
    private volatile int ended = NOT_ENDED;

    SpanHandle(SpanTracker tracker, OpenSpan openSpan, Map<String, String> attributes) {
        this.tracker = tracker;
        this.openSpan = openSpan;
        this.attributes.putAll(attributes);
    }

    public OpenSpan getOpenSpan() {
        return openSpan;
    }

    public String getTraceId() {
        return openSpan.getTraceId();
    }

    public String getSpanId() {
        return openSpan.getSpanId();
    }

    public SpanStatus getStatus() {
        return status;
    }

    public Map<String, String> getAttributes() {
        return ImmutableMap.copyOf(attributes);
    }

    public boolean isEnded() {
        return ended == ENDED;
    }

    @CanIgnoreReturnValue
    public SpanHandle setAttribute(String key, String value) {
        Preconditions.checkNotNull(key, "key must not be null");
        Preconditions.checkNotNull(value, "value must not be null");
        warnIfEnded("setAttribute");
        attributes.put(key, value);
        return this;
    }

    @CanIgnoreReturnValue
    public SpanHandle setStatus(SpanStatus newStatus) {
        Preconditions.checkNotNull(newStatus, "status must not be null");
        warnIfEnded("setStatus");
        this.status = newStatus;
        return this;
    }

    /** Ends the span with its current status, see {@link SpanTracker#endSpan(SpanHandle)}. */
    @CanIgnoreReturnValue
    public Optional<Span> end() {
        return tracker.endSpan(this);
    }

    @CanIgnoreReturnValue
    public Optional<Span> end(SpanStatus endStatus) {
        return tracker.endSpan(this, endStatus);
    }

    SpanTracker tracker() {
        return tracker;
    }

    /** Returns true for exactly one caller, the first to end this span. */
    boolean markEnded() {
        return NOT_ENDED == endedUpdater.getAndSet(this, ENDED);
    }

    private void warnIfEnded(String feature) {
        if (isEnded()) {
            log.warn("{} called after span {} ended", SafeArg.of("feature", feature), SafeArg.of("span", this));
        }
    }

    @Override
    public String toString() {
        return "SpanHandle{ended=" + isEnded() + ", status=" + status + ", openSpan=" + openSpan + '}';
    }
}
