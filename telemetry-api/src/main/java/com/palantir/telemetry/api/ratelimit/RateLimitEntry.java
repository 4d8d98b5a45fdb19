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

import com.palantir.logsafe.SafeArg;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import org.immutables.value.Value;

/**
 * Rate-limit usage last reported by an upstream API for one service (and optionally one endpoint of it). Usage is
 * derived from the raw counters on every read unless the upstream reported a usage figure itself.
 */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class RateLimitEntry {

    public abstract String getService();

    public abstract Optional<String> getEndpoint();

    public abstract long getLimit();

    public abstract long getRemaining();

    /** Time at which the upstream resets the window. */
    public abstract Instant getResetAt();

    /** Usage percentage as reported by the upstream, when it reports one (e.g. usage headers). */
    public abstract OptionalDouble getReportedUsagePercent();

    public abstract OptionalLong getWindowMs();

    /** Usage of the limit in percent, {@code 0..100}. */
    public final double getUsagePercent() {
        if (getReportedUsagePercent().isPresent()) {
            return getReportedUsagePercent().getAsDouble();
        }
        return (getLimit() - getRemaining()) * 100.0 / getLimit();
    }

    /** Key under which the entry is tracked: the service, or {@code service:endpoint}. */
    public final String getKey() {
        return keyOf(getService(), getEndpoint());
    }

    public static String keyOf(String service, Optional<String> endpoint) {
        return endpoint.map(value -> service + ':' + value).orElse(service);
    }

    @Value.Check
    protected final void check() {
        checkArgument(!getService().isEmpty(), "service must be non-empty");
        checkArgument(getLimit() > 0, "limit must be positive", SafeArg.of("limit", getLimit()));
        checkArgument(
                getRemaining() >= 0 && getRemaining() <= getLimit(),
                "remaining must be between 0 and limit",
                SafeArg.of("remaining", getRemaining()),
                SafeArg.of("limit", getLimit()));
        if (getReportedUsagePercent().isPresent()) {
            double reported = getReportedUsagePercent().getAsDouble();
            checkArgument(
                    reported >= 0 && !Double.isNaN(reported),
                    "reportedUsagePercent must not be negative",
                    SafeArg.of("reportedUsagePercent", reported));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableRateLimitEntry.Builder {}
}
