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

/**
 * Replication state of one audience on one advertising platform.
 *
 * <pre>
 * (none)  -> PENDING  (adapter registered for the platform, or audience created while it is registered)
 * PENDING -> SYNCING -> SYNCED | FAILED
 * SYNCED  -> STALE    (audience definition updated)
 * SYNCED | FAILED | STALE -> SYNCING (next sync)
 * </pre>
 */
public enum AudienceSyncStatus {
    PENDING,
    SYNCING,
    SYNCED,
    FAILED,
    STALE
}
