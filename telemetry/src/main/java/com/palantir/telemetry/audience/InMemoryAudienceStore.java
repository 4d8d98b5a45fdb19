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

import com.google.common.collect.ImmutableList;
import com.palantir.telemetry.api.audience.AudienceDefinition;
import com.palantir.telemetry.api.audience.AudienceSyncRecord;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** An {@link AudienceStore} that keeps everything on the heap. Contents are lost when the process exits. */
public final class InMemoryAudienceStore implements AudienceStore {

    // guarded by this
    private final Map<String, AudienceDefinition> audiences = new LinkedHashMap<>();
    private final Map<String, Map<String, AudienceSyncRecord>> syncRecords = new LinkedHashMap<>();

    @Override
    public synchronized Optional<AudienceDefinition> findAudience(String audienceId) {
        return Optional.ofNullable(audiences.get(audienceId));
    }

    @Override
    public synchronized List<AudienceDefinition> listAudiences() {
        return ImmutableList.copyOf(audiences.values());
    }

    @Override
    public synchronized void saveAudience(AudienceDefinition audience) {
        audiences.put(audience.getId(), audience);
    }

    @Override
    public synchronized boolean deleteAudience(String audienceId) {
        syncRecords.remove(audienceId);
        return audiences.remove(audienceId) != null;
    }

    @Override
    public synchronized Optional<AudienceSyncRecord> findSyncRecord(String audienceId, String platform) {
        Map<String, AudienceSyncRecord> byPlatform = syncRecords.get(audienceId);
        return byPlatform == null ? Optional.empty() : Optional.ofNullable(byPlatform.get(platform));
    }

    @Override
    public synchronized List<AudienceSyncRecord> findSyncRecords(String audienceId) {
        Map<String, AudienceSyncRecord> byPlatform = syncRecords.get(audienceId);
        return byPlatform == null ? ImmutableList.of() : ImmutableList.copyOf(byPlatform.values());
    }

    @Override
    public synchronized void saveSyncRecord(AudienceSyncRecord record) {
        syncRecords
                .computeIfAbsent(record.getAudienceId(), _id -> new LinkedHashMap<>())
                .put(record.getPlatform(), record);
    }
}
