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

package com.palantir.telemetry.api.ratelimit;

import java.time.Instant;
import java.util.Optional;
import org.immutables.value.Value;

/** Raised when the used share of a rate limit reaches the configured alert threshold. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class RateLimitAlert {

    public abstract String getService();

    public abstract Optional<String> getEndpoint();

    public abstract double getUsagePercent();

    public abstract long getLimit();

    public abstract long getRemaining();

    /** Threshold fraction in {@code [0, 1]} that was crossed. */
    public abstract double getThreshold();

    public abstract Instant getTimestamp();

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableRateLimitAlert.Builder {}
}
