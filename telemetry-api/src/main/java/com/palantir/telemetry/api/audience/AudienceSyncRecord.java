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

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;
import org.immutables.value.Value;

/** Sync state of one (audience, platform) pair. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class AudienceSyncRecord {

    public abstract String getAudienceId();

    public abstract String getPlatform();

    public abstract AudienceSyncStatus getStatus();

    @Value.Default
    public long getMemberCount() {
        return 0;
    }

    public abstract Optional<Instant> getLastSyncedAt();

    public abstract Optional<Instant> getNextSyncAt();

    public abstract Optional<String> getErrorMessage();

    public abstract OptionalLong getSyncDurationMs();

    public abstract Instant getUpdatedAt();

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableAudienceSyncRecord.Builder {}
}
