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

import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import com.palantir.telemetry.api.audience.AudienceSyncRecord;
import com.palantir.telemetry.api.cost.BudgetAlert;
import com.palantir.telemetry.api.queue.QueueAlert;
import com.palantir.telemetry.api.ratelimit.RateLimitAlert;
import com.palantir.telemetry.api.session.SessionLimitEvent;
import java.util.Locale;

/** Plain-text renderings of alerts for chat notifications. */
public final class AlertMessages {

    public static final String RATE_LIMITS = "rate-limits";
    public static final String COSTS = "costs";
    public static final String QUEUES = "queues";
    public static final String SESSIONS = "sessions";
    public static final String AUDIENCES = "audiences";

    private AlertMessages() {}

    public static String rateLimit(RateLimitAlert alert) {
        return String.format(
                Locale.ROOT,
                "Rate limit warning: %s at %.1f%% of its limit (%d of %d remaining)",
                alert.getEndpoint().map(endpoint -> alert.getService() + " " + endpoint).orElse(alert.getService()),
                alert.getUsagePercent(),
                alert.getRemaining(),
                alert.getLimit());
    }

    public static String budget(BudgetAlert alert) {
        return String.format(
                Locale.ROOT,
                "Budget warning: %s spent %.2f of %.2f (%.1f%%) this %s period",
                alert.getProduct().map(product -> alert.getService() + "/" + product).orElse(alert.getService()),
                alert.getCurrentSpend(),
                alert.getBudgetLimit(),
                alert.getUsagePercent(),
                alert.getPeriod().jsonValue());
    }

    public static String queue(QueueAlert alert) {
        return "Queue " + alert.getQueue() + ": " + alert.getMessage();
    }

    public static String sessionLimit(SessionLimitEvent event) {
        switch (event.getType()) {
            case MAX_CONCURRENT:
                return "Session rejected: " + event.getCurrent() + " of " + event.getLimit()
                        + " concurrent sessions in use";
            case MAX_PER_USER:
                return "Session rejected: user already has " + event.getCurrent() + " of " + event.getLimit()
                        + " allowed sessions";
        }
        throw new SafeIllegalArgumentException("Unknown session limit type", SafeArg.of("type", event.getType()));
    }

    public static String audienceSync(AudienceSyncRecord record) {
        StringBuilder text = new StringBuilder()
                .append("Audience ")
                .append(record.getAudienceId())
                .append(" on ")
                .append(record.getPlatform())
                .append(" is ")
                .append(record.getStatus().name().toLowerCase(Locale.ROOT));
        record.getErrorMessage().ifPresent(error -> text.append(": ").append(error));
        return text.toString();
    }
}
