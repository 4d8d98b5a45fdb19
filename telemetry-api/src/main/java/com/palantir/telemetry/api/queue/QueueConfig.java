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

package com.palantir.telemetry.api.queue;

import static com.palantir.logsafe.Preconditions.checkArgument;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.palantir.logsafe.SafeArg;
import org.immutables.value.Value;

/** Thresholds for the four independent queue-health alert conditions. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
@JsonDeserialize(as = ImmutableQueueConfig.class)
public abstract class QueueConfig {

    public static final long DEFAULT_DEPTH_THRESHOLD = 1000;
    public static final double DEFAULT_FAILURE_RATE_THRESHOLD = 0.1;
    public static final long DEFAULT_STALE_THRESHOLD_MS = 300_000;
    public static final long DEFAULT_PROCESSING_TIME_THRESHOLD_MS = 60_000;

    @Value.Default
    public long getDepthThreshold() {
        return DEFAULT_DEPTH_THRESHOLD;
    }

    /** Highest tolerated ratio of failed jobs to all finished jobs. */
    @Value.Default
    public double getFailureRateThreshold() {
        return DEFAULT_FAILURE_RATE_THRESHOLD;
    }

    @Value.Default
    public long getStaleThresholdMs() {
        return DEFAULT_STALE_THRESHOLD_MS;
    }

    @Value.Default
    public long getProcessingTimeThresholdMs() {
        return DEFAULT_PROCESSING_TIME_THRESHOLD_MS;
    }

    @Value.Check
    protected final void check() {
        checkArgument(
                getDepthThreshold() >= 0,
                "depthThreshold must not be negative",
                SafeArg.of("depthThreshold", getDepthThreshold()));
        checkArgument(
                getFailureRateThreshold() >= 0 && getFailureRateThreshold() <= 1,
                "failureRateThreshold should be between 0 and 1",
                SafeArg.of("failureRateThreshold", getFailureRateThreshold()));
        checkArgument(
                getStaleThresholdMs() > 0,
                "staleThresholdMs must be positive",
                SafeArg.of("staleThresholdMs", getStaleThresholdMs()));
        checkArgument(
                getProcessingTimeThresholdMs() > 0,
                "processingTimeThresholdMs must be positive",
                SafeArg.of("processingTimeThresholdMs", getProcessingTimeThresholdMs()));
    }

    public static QueueConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableQueueConfig.Builder {}
}
