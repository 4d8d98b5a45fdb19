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

import static com.palantir.logsafe.Preconditions.checkArgument;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.palantir.logsafe.SafeArg;
import org.immutables.value.Value;

@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
@JsonDeserialize(as = ImmutableRateLimitConfig.class)
public abstract class RateLimitConfig {

    public static final double DEFAULT_ALERT_THRESHOLD = 0.8;

    /** Fraction of a limit which, once used, raises an alert. */
    @Value.Default
    public double getAlertThreshold() {
        return DEFAULT_ALERT_THRESHOLD;
    }

    @Value.Check
    protected final void check() {
        checkArgument(
                getAlertThreshold() >= 0 && getAlertThreshold() <= 1,
                "alertThreshold should be between 0 and 1",
                SafeArg.of("alertThreshold", getAlertThreshold()));
    }

    public static RateLimitConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableRateLimitConfig.Builder {}
}
