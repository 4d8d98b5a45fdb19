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

import static com.palantir.logsafe.Preconditions.checkArgument;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.palantir.logsafe.SafeArg;
import org.immutables.value.Value;

/** Configuration of span tracking: owning service, sampling and retention bound. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
@JsonDeserialize(as = ImmutableApmConfig.class)
public abstract class ApmConfig {

    public static final String DEFAULT_SERVICE_NAME = "telemetry";
    public static final double DEFAULT_SAMPLE_RATE = 1.0;
    public static final int DEFAULT_MAX_SPANS = 10_000;

    @Value.Default
    public String getServiceName() {
        return DEFAULT_SERVICE_NAME;
    }

    /** Probability in {@code [0, 1]} that a completed span is retained. */
    @Value.Default
    public double getSampleRate() {
        return DEFAULT_SAMPLE_RATE;
    }

    /** Maximum number of completed spans retained; the oldest are evicted first. */
    @Value.Default
    public int getMaxSpans() {
        return DEFAULT_MAX_SPANS;
    }

    @Value.Check
    protected final void check() {
        checkArgument(!getServiceName().isEmpty(), "serviceName must be non-empty");
        checkArgument(
                getSampleRate() >= 0 && getSampleRate() <= 1,
                "sampleRate should be between 0 and 1",
                SafeArg.of("sampleRate", getSampleRate()));
        checkArgument(getMaxSpans() > 0, "maxSpans must be positive", SafeArg.of("maxSpans", getMaxSpans()));
    }

    public static ApmConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableApmConfig.Builder {}
}
