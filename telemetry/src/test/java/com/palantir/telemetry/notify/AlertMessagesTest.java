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

package com.palantir.telemetry.notify;

import static org.assertj.core.api.Assertions.assertThat;

import com.palantir.telemetry.api.audience.AudienceSyncRecord;
import com.palantir.telemetry.api.audience.AudienceSyncStatus;
import com.palantir.telemetry.api.cost.BudgetAlert;
import com.palantir.telemetry.api.cost.BudgetPeriod;
import com.palantir.telemetry.api.ratelimit.RateLimitAlert;
import com.palantir.telemetry.api.session.SessionLimitEvent;
import com.palantir.telemetry.api.session.SessionLimitType;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class AlertMessagesTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    void rateLimit() {
        RateLimitAlert alert = RateLimitAlert.builder()
                .service("meta")
                .endpoint("/ads")
                .usagePercent(85)
                .limit(200)
                .remaining(30)
                .threshold(0.8)
                .timestamp(NOW)
                .build();

        assertThat(AlertMessages.rateLimit(alert))
                .isEqualTo("Rate limit warning: meta /ads at 85.0% of its limit (30 of 200 remaining)");
    }

    @Test
    void budget() {
        BudgetAlert alert = BudgetAlert.builder()
                .service("runway")
                .product("video")
                .currentSpend(412.5)
                .budgetLimit(500)
                .usagePercent(82.5)
                .threshold(0.8)
                .period(BudgetPeriod.WEEKLY)
                .periodStart(NOW)
                .timestamp(NOW)
                .build();

        assertThat(AlertMessages.budget(alert))
                .isEqualTo("Budget warning: runway/video spent 412.50 of 500.00 (82.5%) this weekly period");
    }

    @Test
    void sessionLimits() {
        SessionLimitEvent.Builder event =
                SessionLimitEvent.builder().userId("user-1").current(5).limit(5).timestamp(NOW);

        assertThat(AlertMessages.sessionLimit(event.type(SessionLimitType.MAX_PER_USER).build()))
                .isEqualTo("Session rejected: user already has 5 of 5 allowed sessions");
        assertThat(AlertMessages.sessionLimit(event.type(SessionLimitType.MAX_CONCURRENT).build()))
                .isEqualTo("Session rejected: 5 of 5 concurrent sessions in use");
    }

    @Test
    void failedAudienceSync() {
        AudienceSyncRecord record = AudienceSyncRecord.builder()
                .audienceId("a1")
                .platform("tiktok")
                .status(AudienceSyncStatus.FAILED)
                .errorMessage("token expired")
                .updatedAt(NOW)
                .build();

        assertThat(AlertMessages.audienceSync(record)).isEqualTo("Audience a1 on tiktok is failed: token expired");
    }
}
