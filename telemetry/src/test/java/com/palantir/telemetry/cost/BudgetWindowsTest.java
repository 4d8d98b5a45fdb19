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

package com.palantir.telemetry.cost;

import static org.assertj.core.api.Assertions.assertThat;

import com.palantir.telemetry.api.cost.BudgetPeriod;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class BudgetWindowsTest {

    // a Wednesday
    private static final Instant NOW = Instant.parse("2024-03-06T10:15:30Z");

    @Test
    void windowsContainingInstant() {
        assertThat(BudgetWindows.windowStart(BudgetPeriod.HOURLY, NOW, ZoneOffset.UTC))
                .isEqualTo(Instant.parse("2024-03-06T10:00:00Z"));
        assertThat(BudgetWindows.windowStart(BudgetPeriod.DAILY, NOW, ZoneOffset.UTC))
                .isEqualTo(Instant.parse("2024-03-06T00:00:00Z"));
        assertThat(BudgetWindows.windowStart(BudgetPeriod.WEEKLY, NOW, ZoneOffset.UTC))
                .isEqualTo(Instant.parse("2024-03-04T00:00:00Z"));
        assertThat(BudgetWindows.windowStart(BudgetPeriod.MONTHLY, NOW, ZoneOffset.UTC))
                .isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
    }

    @Test
    void mondayStartsItsOwnWeek() {
        Instant monday = Instant.parse("2024-03-04T00:00:00Z");

        assertThat(BudgetWindows.windowStart(BudgetPeriod.WEEKLY, monday, ZoneOffset.UTC)).isEqualTo(monday);
        assertThat(BudgetWindows.windowEnd(BudgetPeriod.WEEKLY, monday, ZoneOffset.UTC))
                .isEqualTo(Instant.parse("2024-03-11T00:00:00Z"));
    }

    @Test
    void monthlyWindowFollowsCalendar() {
        Instant february = Instant.parse("2024-02-01T00:00:00Z");

        assertThat(BudgetWindows.windowEnd(BudgetPeriod.MONTHLY, february, ZoneOffset.UTC))
                .isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
    }

    @Test
    void windowsFollowTheZone() {
        ZoneId berlin = ZoneId.of("Europe/Berlin");

        assertThat(BudgetWindows.windowStart(BudgetPeriod.DAILY, Instant.parse("2024-03-05T23:30:00Z"), berlin))
                .isEqualTo(Instant.parse("2024-03-05T23:00:00Z"));
    }
}
