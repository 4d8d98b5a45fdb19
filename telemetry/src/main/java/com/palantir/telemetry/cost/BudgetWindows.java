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

import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import com.palantir.telemetry.api.cost.BudgetPeriod;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/** Calendar-anchored budget windows: the hour, day, ISO week (from Monday) or month containing an instant. */
final class BudgetWindows {

    private BudgetWindows() {}

    static Instant windowStart(BudgetPeriod period, Instant instant, ZoneId zone) {
        ZonedDateTime time = instant.atZone(zone);
        switch (period) {
            case HOURLY:
                return time.truncatedTo(ChronoUnit.HOURS).toInstant();
            case DAILY:
                return time.truncatedTo(ChronoUnit.DAYS).toInstant();
            case WEEKLY:
                return time.truncatedTo(ChronoUnit.DAYS)
                        .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                        .toInstant();
            case MONTHLY:
                return time.truncatedTo(ChronoUnit.DAYS)
                        .with(TemporalAdjusters.firstDayOfMonth())
                        .toInstant();
        }
        throw new SafeIllegalStateException("Unknown budget period", SafeArg.of("period", period));
    }

    /** Exclusive end of the window starting at {@code start}. */
    static Instant windowEnd(BudgetPeriod period, Instant start, ZoneId zone) {
        ZonedDateTime time = start.atZone(zone);
        switch (period) {
            case HOURLY:
                return time.plusHours(1).toInstant();
            case DAILY:
                return time.plusDays(1).toInstant();
            case WEEKLY:
                return time.plusWeeks(1).toInstant();
            case MONTHLY:
                return time.plusMonths(1).toInstant();
        }
        throw new SafeIllegalStateException("Unknown budget period", SafeArg.of("period", period));
    }
}
