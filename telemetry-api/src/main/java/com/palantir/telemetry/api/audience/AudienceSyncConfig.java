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

package com.palantir.telemetry.api.audience;

import static com.palantir.logsafe.Preconditions.checkArgument;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.palantir.logsafe.SafeArg;
import org.immutables.value.Value;

@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
@JsonDeserialize(as = ImmutableAudienceSyncConfig.class)
public abstract class AudienceSyncConfig {

    public static final long DEFAULT_RESYNC_INTERVAL_MS = 86_400_000;

    /** Delay after a successful sync at which the next sync is scheduled. */
    @Value.Default
    public long getResyncIntervalMs() {
        return DEFAULT_RESYNC_INTERVAL_MS;
    }

    @Value.Check
    protected final void check() {
        checkArgument(
                getResyncIntervalMs() > 0,
                "resyncIntervalMs must be positive",
                SafeArg.of("resyncIntervalMs", getResyncIntervalMs()));
    }

    public static AudienceSyncConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableAudienceSyncConfig.Builder {}
}
