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

import java.util.Optional;
import java.util.OptionalLong;
import org.immutables.value.Value;

@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class HealthCheckResult {

    public abstract ComponentStatus getStatus();

    public abstract Optional<String> getMessage();

    /** Response time measured by the check itself; the runner measures one when absent. */
    public abstract OptionalLong getResponseTimeMs();

    public static HealthCheckResult healthy() {
        return builder().status(ComponentStatus.HEALTHY).build();
    }

    public static HealthCheckResult degraded(String message) {
        return builder().status(ComponentStatus.DEGRADED).message(message).build();
    }

    public static HealthCheckResult unhealthy(String message) {
        return builder().status(ComponentStatus.UNHEALTHY).message(message).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableHealthCheckResult.Builder {}
}
