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

import java.time.Instant;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * A value object representing an open (i.e., non-completed) span. Once completed, the span is represented by a {@link
 * Span} object.
 */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class OpenSpan {

    /** Returns the identifier shared by every span of one logical request. */
    @Value.Parameter
    public abstract String getTraceId();

    /** Returns a globally unique identifier representing a single span within the call trace. */
    @Value.Parameter
    public abstract String getSpanId();

    /** Returns the identifier of the parent span for the current span, if one exists. */
    @Value.Parameter
    public abstract Optional<String> getParentSpanId();

    /** Returns a description of the operation for this span. */
    @Value.Parameter
    public abstract String getName();

    /** Returns the name of the service which owns the span. */
    @Value.Parameter
    public abstract String getService();

    /** Returns the wall-clock start time of the span. */
    @Value.Parameter
    public abstract Instant getStartTime();

    public static OpenSpan of(
            String traceId,
            String spanId,
            Optional<String> parentSpanId,
            String name,
            String service,
            Instant startTime) {
        return ImmutableOpenSpan.of(traceId, spanId, parentSpanId, name, service, startTime);
    }

    /** Returns true if this span has no parent, i.e. it is the root span of its trace. */
    public final boolean isRoot() {
        return getParentSpanId().isEmpty();
    }
}
