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

package com.palantir.telemetry.api.queue;

import java.time.Instant;
import org.immutables.value.Value;

@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class QueueAlert {

    public abstract String getQueue();

    public abstract QueueAlertType getType();

    public abstract String getMessage();

    public abstract double getValue();

    public abstract double getThreshold();

    public abstract Instant getTimestamp();

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableQueueAlert.Builder {}
}
