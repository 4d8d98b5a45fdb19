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

import java.time.Instant;
import java.util.OptionalLong;
import org.immutables.value.Value;

/** Point-in-time health of one job queue, derived from its raw counters when requested. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class QueueStats {

    public abstract String getName();

    public abstract long getDepth();

    public abstract long getProcessedCount();

    public abstract long getFailedCount();

    /** Jobs processed per second since the tracking window started. */
    public abstract double getProcessingRate();

    /** Jobs failed per second since the tracking window started. */
    public abstract double getFailureRate();

    /** Failed jobs divided by all finished (processed or failed) jobs; zero when nothing finished yet. */
    public abstract double getFailureRatio();

    public abstract double getAvgProcessingTimeMs();

    public abstract OptionalLong getOldestJobAgeMs();

    public abstract long getStaleThresholdMs();

    @Value.Derived
    public boolean hasStaleJobs() {
        return getOldestJobAgeMs().isPresent() && getOldestJobAgeMs().getAsLong() > getStaleThresholdMs();
    }

    public abstract Instant getWindowStart();

    public abstract Instant getLastUpdated();

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableQueueStats.Builder {}
}
