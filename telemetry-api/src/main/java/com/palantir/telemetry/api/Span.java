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

package com.palantir.telemetry.api;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/** A value class representing a completed Span, see {@link OpenSpan} for a description of the fields. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class Span {

    public abstract String getTraceId();

    public abstract Optional<String> getParentSpanId();

    public abstract String getSpanId();

    public abstract String getName();

    public abstract String getService();

    public abstract Instant getStartTime();

    public abstract Instant getEndTime();

    @Value.Default
    public SpanStatus getStatus() {
        return SpanStatus.OK;
    }

    /**
     * Returns a map of custom key-value attributes with which spans will be annotated. For example, a "campaignId" key
     * could be added to associate spans with the campaign being processed.
     */
    public abstract Map<String, String> getAttributes();

    /** Elapsed time between start and end, in (fractional) milliseconds. */
    @Value.Derived
    public double getDurationMillis() {
        return Duration.between(getStartTime(), getEndTime()).toNanos() / 1_000_000.0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableSpan.Builder {}
}
