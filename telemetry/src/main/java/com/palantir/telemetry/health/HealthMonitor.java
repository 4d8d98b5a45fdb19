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

package com.palantir.telemetry.health;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.telemetry.api.health.ComponentHealth;
import com.palantir.telemetry.api.health.ComponentStatus;
import com.palantir.telemetry.api.health.HealthCheck;
import com.palantir.telemetry.api.health.HealthCheckResult;
import com.palantir.telemetry.api.health.HealthReport;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Runs registered health checks and aggregates them into a {@link HealthReport}. A check that throws is reported as an
 * unhealthy component carrying the exception message.
 *
 * <p>This class is thread-safe.
 */
public final class HealthMonitor {

    private static final SafeLogger log = SafeLoggerFactory.get(HealthMonitor.class);

    private final Clock clock;
    private final Optional<String> version;
    private final Instant startedAt;

    // guarded by this
    private final Map<String, HealthCheck> checks = new LinkedHashMap<>();

    public HealthMonitor(Clock clock, Optional<String> version) {
        this.clock = Preconditions.checkNotNull(clock, "clock must not be null");
        this.version = Preconditions.checkNotNull(version, "version must not be null");
        this.startedAt = clock.instant();
    }

    /** Registers a check under the given name. Returns the check it replaced, or null if there was none. */
    @Nullable
    @CanIgnoreReturnValue
    public synchronized HealthCheck register(String name, HealthCheck check) {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "name must be non-empty");
        Preconditions.checkNotNull(check, "check must not be null");
        return checks.put(name, check);
    }

    @Nullable
    @CanIgnoreReturnValue
    public synchronized HealthCheck unregister(String name) {
        return checks.remove(name);
    }

    /** Runs every check, in registration order, on the calling thread. */
    public HealthReport runChecks() {
        Map<String, HealthCheck> current;
        synchronized (this) {
            current = ImmutableMap.copyOf(checks);
        }

        ImmutableList.Builder<ComponentHealth> components = ImmutableList.builder();
        for (Map.Entry<String, HealthCheck> entry : current.entrySet()) {
            components.add(run(entry.getKey(), entry.getValue()));
        }

        Instant now = clock.instant();
        HealthReport report = HealthReport.builder()
                .components(components.build())
                .timestamp(now)
                .uptimeMs(now.toEpochMilli() - startedAt.toEpochMilli())
                .version(version)
                .build();
        if (report.getStatus() != ComponentStatus.HEALTHY) {
            log.warn("Health checks report a problem", SafeArg.of("status", report.getStatus()));
        }
        return report;
    }

    private ComponentHealth run(String name, HealthCheck check) {
        long start = clock.millis();
        HealthCheckResult result;
        try {
            result = Preconditions.checkNotNull(check.check(), "health check returned null");
        } catch (RuntimeException e) {
            log.warn("Health check {} threw", SafeArg.of("name", name), e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            result = HealthCheckResult.unhealthy(message);
        }
        long elapsed = clock.millis() - start;
        return ComponentHealth.builder()
                .name(name)
                .status(result.getStatus())
                .message(result.getMessage())
                .lastChecked(clock.instant())
                .responseTimeMs(
                        result.getResponseTimeMs().isPresent()
                                ? result.getResponseTimeMs().getAsLong()
                                : elapsed)
                .build();
    }
}
