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

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class HealthReport {

    private static final int OK = 200;
    private static final int SERVICE_UNAVAILABLE = 503;

    public abstract List<ComponentHealth> getComponents();

    /** Any unhealthy component makes the report unhealthy; otherwise any degraded one makes it degraded. */
    @Value.Derived
    public ComponentStatus getStatus() {
        ComponentStatus status = ComponentStatus.HEALTHY;
        for (ComponentHealth component : getComponents()) {
            status = status.worst(component.getStatus());
        }
        return status;
    }

    public abstract Instant getTimestamp();

    public abstract long getUptimeMs();

    public abstract Optional<String> getVersion();

    /** HTTP status a health endpoint should answer with: degraded services still serve traffic. */
    public final int httpStatusCode() {
        return getStatus() == ComponentStatus.UNHEALTHY ? SERVICE_UNAVAILABLE : OK;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableHealthReport.Builder {}
}
