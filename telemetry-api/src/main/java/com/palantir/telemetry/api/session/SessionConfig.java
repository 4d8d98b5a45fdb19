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

import static com.palantir.logsafe.Preconditions.checkArgument;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.palantir.logsafe.SafeArg;
import org.immutables.value.Value;

@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
@JsonDeserialize(as = ImmutableSessionConfig.class)
public abstract class SessionConfig {

    public static final int DEFAULT_MAX_CONCURRENT_SESSIONS = 100;
    public static final int DEFAULT_MAX_SESSIONS_PER_USER = 5;
    public static final long DEFAULT_SESSION_TIMEOUT_MS = 3_600_000;

    @Value.Default
    public int getMaxConcurrentSessions() {
        return DEFAULT_MAX_CONCURRENT_SESSIONS;
    }

    @Value.Default
    public int getMaxSessionsPerUser() {
        return DEFAULT_MAX_SESSIONS_PER_USER;
    }

    /** Inactivity after which a session is force-ended by the expiry sweep. */
    @Value.Default
    public long getSessionTimeoutMs() {
        return DEFAULT_SESSION_TIMEOUT_MS;
    }

    @Value.Check
    protected final void check() {
        checkArgument(
                getMaxConcurrentSessions() > 0,
                "maxConcurrentSessions must be positive",
                SafeArg.of("maxConcurrentSessions", getMaxConcurrentSessions()));
        checkArgument(
                getMaxSessionsPerUser() > 0,
                "maxSessionsPerUser must be positive",
                SafeArg.of("maxSessionsPerUser", getMaxSessionsPerUser()));
        checkArgument(
                getSessionTimeoutMs() > 0,
                "sessionTimeoutMs must be positive",
                SafeArg.of("sessionTimeoutMs", getSessionTimeoutMs()));
    }

    public static SessionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableSessionConfig.Builder {}
}
