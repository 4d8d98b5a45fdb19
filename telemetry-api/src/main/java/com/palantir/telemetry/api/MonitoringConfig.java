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

package com.palantir.telemetry.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.palantir.telemetry.api.audience.AudienceSyncConfig;
import com.palantir.telemetry.api.cost.CostConfig;
import com.palantir.telemetry.api.notify.NotificationConfig;
import com.palantir.telemetry.api.queue.QueueConfig;
import com.palantir.telemetry.api.ratelimit.RateLimitConfig;
import com.palantir.telemetry.api.session.SessionConfig;
import java.util.Optional;
import org.immutables.value.Value;

/** Root configuration of the kernel. Every section is optional and falls back to its defaults. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
@JsonDeserialize(as = ImmutableMonitoringConfig.class)
public abstract class MonitoringConfig {

    /** Version reported by health reports, if known. */
    public abstract Optional<String> getVersion();

    @Value.Default
    public ApmConfig getApm() {
        return ApmConfig.defaults();
    }

    @Value.Default
    public RateLimitConfig getRateLimits() {
        return RateLimitConfig.defaults();
    }

    @Value.Default
    public CostConfig getCosts() {
        return CostConfig.defaults();
    }

    @Value.Default
    public QueueConfig getQueues() {
        return QueueConfig.defaults();
    }

    @Value.Default
    public SessionConfig getSessions() {
        return SessionConfig.defaults();
    }

    @Value.Default
    public NotificationConfig getNotifications() {
        return NotificationConfig.defaults();
    }

    @Value.Default
    public AudienceSyncConfig getAudienceSync() {
        return AudienceSyncConfig.defaults();
    }

    public static MonitoringConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableMonitoringConfig.Builder {}
}
