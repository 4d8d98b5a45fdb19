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

package com.palantir.telemetry.api.health;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class HealthReportTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    void worstComponentWins() {
        assertThat(report()).satisfies(report -> {
            assertThat(report.getStatus()).isEqualTo(ComponentStatus.HEALTHY);
            assertThat(report.httpStatusCode()).isEqualTo(200);
        });
        assertThat(report(ComponentStatus.HEALTHY, ComponentStatus.DEGRADED)).satisfies(report -> {
            assertThat(report.getStatus()).isEqualTo(ComponentStatus.DEGRADED);
            assertThat(report.httpStatusCode()).isEqualTo(200);
        });
        assertThat(report(ComponentStatus.UNHEALTHY, ComponentStatus.DEGRADED)).satisfies(report -> {
            assertThat(report.getStatus()).isEqualTo(ComponentStatus.UNHEALTHY);
            assertThat(report.httpStatusCode()).isEqualTo(503);
        });
    }

    @Test
    void worst() {
        assertThat(ComponentStatus.HEALTHY.worst(ComponentStatus.DEGRADED)).isEqualTo(ComponentStatus.DEGRADED);
        assertThat(ComponentStatus.UNHEALTHY.worst(ComponentStatus.HEALTHY)).isEqualTo(ComponentStatus.UNHEALTHY);
        assertThat(ComponentStatus.DEGRADED.worst(ComponentStatus.DEGRADED)).isEqualTo(ComponentStatus.DEGRADED);
    }

    private static HealthReport report(ComponentStatus... statuses) {
        HealthReport.Builder builder = HealthReport.builder().timestamp(NOW).uptimeMs(0);
        for (int i = 0; i < statuses.length; i++) {
            builder.addComponents(ComponentHealth.builder()
                    .name("component-" + i)
                    .status(statuses[i])
                    .lastChecked(NOW)
                    .build());
        }
        return builder.build();
    }
}
