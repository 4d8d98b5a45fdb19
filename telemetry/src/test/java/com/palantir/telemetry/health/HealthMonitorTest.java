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

import static org.assertj.core.api.Assertions.assertThat;

import com.palantir.telemetry.MutableClock;
import com.palantir.telemetry.api.health.ComponentHealth;
import com.palantir.telemetry.api.health.ComponentStatus;
import com.palantir.telemetry.api.health.HealthCheckResult;
import com.palantir.telemetry.api.health.HealthReport;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class HealthMonitorTest {

    private final MutableClock clock = MutableClock.at("2024-03-01T12:00:00Z");
    private final HealthMonitor monitor = new HealthMonitor(clock, Optional.of("1.4.0"));

    @Test
    void emptyMonitorIsHealthy() {
        clock.advance(Duration.ofMinutes(2));

        HealthReport report = monitor.runChecks();

        assertThat(report.getStatus()).isEqualTo(ComponentStatus.HEALTHY);
        assertThat(report.httpStatusCode()).isEqualTo(200);
        assertThat(report.getComponents()).isEmpty();
        assertThat(report.getUptimeMs()).isEqualTo(120_000);
        assertThat(report.getVersion()).contains("1.4.0");
    }

    @Test
    void degradedComponentKeepsServing() {
        monitor.register("database", HealthCheckResult::healthy);
        monitor.register("redis", () -> HealthCheckResult.degraded("high latency"));

        HealthReport report = monitor.runChecks();

        assertThat(report.getStatus()).isEqualTo(ComponentStatus.DEGRADED);
        assertThat(report.httpStatusCode()).isEqualTo(200);
        assertThat(report.getComponents()).extracting(ComponentHealth::getName).containsExactly("database", "redis");
        assertThat(report.getComponents().get(1).getMessage()).contains("high latency");
    }

    @Test
    void throwingCheckIsUnhealthy() {
        monitor.register("redis", () -> HealthCheckResult.degraded("high latency"));
        monitor.register("queue", () -> {
            throw new IllegalStateException("connection refused");
        });

        HealthReport report = monitor.runChecks();

        assertThat(report.getStatus()).isEqualTo(ComponentStatus.UNHEALTHY);
        assertThat(report.httpStatusCode()).isEqualTo(503);
        assertThat(report.getComponents().get(1)).satisfies(component -> {
            assertThat(component.getStatus()).isEqualTo(ComponentStatus.UNHEALTHY);
            assertThat(component.getMessage()).contains("connection refused");
        });
    }

    @Test
    void measuresResponseTimeUnlessReported() {
        monitor.register("slow", () -> {
            clock.advanceMillis(15);
            return HealthCheckResult.healthy();
        });
        monitor.register("self-timed", () -> HealthCheckResult.builder()
                .status(ComponentStatus.HEALTHY)
                .responseTimeMs(3)
                .build());

        HealthReport report = monitor.runChecks();

        assertThat(report.getComponents().get(0).getResponseTimeMs()).hasValue(15);
        assertThat(report.getComponents().get(1).getResponseTimeMs()).hasValue(3);
        assertThat(report.getComponents().get(0).getLastChecked()).isEqualTo(clock.instant());
    }

    @Test
    void registerReplacesAndUnregisterRemoves() {
        monitor.register("redis", () -> HealthCheckResult.unhealthy("down"));

        assertThat(monitor.register("redis", HealthCheckResult::healthy)).isNotNull();
        assertThat(monitor.runChecks().getStatus()).isEqualTo(ComponentStatus.HEALTHY);
        assertThat(monitor.unregister("redis")).isNotNull();
        assertThat(monitor.unregister("redis")).isNull();
        assertThat(monitor.runChecks().getComponents()).isEmpty();
    }
}
