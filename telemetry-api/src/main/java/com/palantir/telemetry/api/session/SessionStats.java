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

import java.time.Instant;
import java.util.Map;
import org.immutables.value.Value;

@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class SessionStats {

    public abstract int getActiveSessions();

    /** Sessions started since the monitor was created. */
    public abstract long getTotalSessions();

    /** Average duration of ended sessions. */
    public abstract double getAvgDurationMs();

    public abstract int getConcurrentPeak();

    /** Active session count per user. */
    public abstract Map<String, Integer> getSessionsByUser();

    public abstract Instant getTimestamp();

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableSessionStats.Builder {}
}
