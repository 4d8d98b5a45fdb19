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

package com.palantir.telemetry.audience;

import com.palantir.telemetry.api.audience.AudienceDefinition;
import com.palantir.telemetry.api.audience.AudienceSyncRecord;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for audience definitions and their per-platform sync records. Implementations must be safe for
 * concurrent use; {@link AudienceSyncManager} provides any atomicity needed across several calls.
 */
public interface AudienceStore {

    Optional<AudienceDefinition> findAudience(String audienceId);

    /** Every stored audience, in creation order. */
    List<AudienceDefinition> listAudiences();

    /** Inserts or replaces the audience with the same id. */
    void saveAudience(AudienceDefinition audience);

    /** Removes the audience and every sync record of it. Returns false if there was no such audience. */
    boolean deleteAudience(String audienceId);

    Optional<AudienceSyncRecord> findSyncRecord(String audienceId, String platform);

    List<AudienceSyncRecord> findSyncRecords(String audienceId);

    /** Inserts or replaces the record for the same audience and platform. */
    void saveSyncRecord(AudienceSyncRecord record);
}
