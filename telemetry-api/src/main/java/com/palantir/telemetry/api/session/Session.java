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

package com.palantir.telemetry.api.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.immutables.value.Value;

@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class Session {

    public abstract String getId();

    public abstract String getUserId();

    public abstract Instant getStartedAt();

    public abstract Instant getLastActivityAt();

    public abstract Optional<Instant> getEndedAt();

    public abstract Map<String, String> getMetadata();

    /** Duration from start to end, present once the session has ended. */
    @Value.Derived
    public OptionalLong getDurationMs() {
        return getEndedAt()
                .map(end -> OptionalLong.of(Duration.between(getStartedAt(), end).toMillis()))
                .orElseGet(OptionalLong::empty);
    }

    public final boolean isActive() {
        return getEndedAt().isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableSession.Builder {}
}
