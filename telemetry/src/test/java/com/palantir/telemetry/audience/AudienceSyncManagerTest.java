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

import static com.palantir.logsafe.testing.Assertions.assertThatLoggableExceptionThrownBy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

import com.google.common.collect.ImmutableList;
import com.palantir.logsafe.SafeArg;
import com.palantir.telemetry.MutableClock;
import com.palantir.telemetry.api.AlertHandler;
import com.palantir.telemetry.api.audience.AudienceDefinition;
import com.palantir.telemetry.api.audience.AudienceRule;
import com.palantir.telemetry.api.audience.AudienceSyncConfig;
import com.palantir.telemetry.api.audience.AudienceSyncRecord;
import com.palantir.telemetry.api.audience.AudienceSyncStatus;
import com.palantir.telemetry.api.audience.PlatformSyncAdapter;
import com.palantir.telemetry.api.audience.RuleOperator;
import com.palantir.telemetry.api.audience.SyncResult;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AudienceSyncManagerTest {

    private static final List<AudienceRule> RULES =
            ImmutableList.of(AudienceRule.of("country", RuleOperator.IN, ImmutableList.of("US", "CA")));

    @Mock
    private AlertHandler<AudienceSyncRecord> handler;

    @Captor
    private ArgumentCaptor<AudienceSyncRecord> records;

    private final MutableClock clock = MutableClock.at("2024-03-01T12:00:00Z");
    private final AudienceSyncManager manager = AudienceSyncManager.inMemory(AudienceSyncConfig.defaults(), clock);

    @Test
    void createsAndListsAudiences() {
        AudienceDefinition audience = manager.createAudience("Lookalikes", Optional.of("US and CA"), RULES);

        assertThat(audience.getId()).isNotEmpty();
        assertThat(audience.getCreatedAt()).isEqualTo(clock.instant());
        assertThat(audience.getUpdatedAt()).isEmpty();
        assertThat(manager.getAudience(audience.getId())).contains(audience);
        assertThat(manager.listAudiences()).containsExactly(audience);
    }

    @Test
    void successfulSyncRecordsMembersAndSchedulesResync() {
        AudienceDefinition audience = manager.createAudience("Buyers", Optional.empty(), RULES);
        QueuedAdapter meta = new QueuedAdapter("meta");
        manager.registerAdapter(meta);
        manager.subscribe("handler", handler);

        CompletableFuture<AudienceSyncRecord> sync = manager.syncToPlatform(audience.getId(), "meta");

        assertThat(sync).isNotDone();
        assertThat(manager.getSyncRecord(audience.getId(), "meta"))
                .hasValueSatisfying(record -> assertThat(record.getStatus()).isEqualTo(AudienceSyncStatus.SYNCING));

        clock.advance(Duration.ofSeconds(2));
        meta.complete(SyncResult.success(1234));

        AudienceSyncRecord record = sync.join();
        assertThat(record.getStatus()).isEqualTo(AudienceSyncStatus.SYNCED);
        assertThat(record.getMemberCount()).isEqualTo(1234);
        assertThat(record.getLastSyncedAt()).contains(clock.instant());
        assertThat(record.getNextSyncAt())
                .contains(clock.instant().plusMillis(AudienceSyncConfig.DEFAULT_RESYNC_INTERVAL_MS));
        assertThat(record.getSyncDurationMs()).hasValue(2000);
        assertThat(manager.getSyncRecords(audience.getId())).containsExactly(record);

        verify(handler, atLeastOnce()).handle(records.capture());
        assertThat(records.getAllValues())
                .extracting(AudienceSyncRecord::getStatus)
                .containsExactly(AudienceSyncStatus.SYNCING, AudienceSyncStatus.SYNCED);
        assertThat(manager.inFlightCount()).isZero();
    }

    @Test
    void failedResultKeepsPreviousMemberCount() {
        AudienceDefinition audience = manager.createAudience("Buyers", Optional.empty(), RULES);
        QueuedAdapter meta = new QueuedAdapter("meta");
        manager.registerAdapter(meta);
        CompletableFuture<AudienceSyncRecord> first = manager.syncToPlatform(audience.getId(), "meta");
        meta.complete(SyncResult.success(500));
        first.join();

        CompletableFuture<AudienceSyncRecord> second = manager.syncToPlatform(audience.getId(), "meta");
        meta.complete(SyncResult.failure("token expired"));

        AudienceSyncRecord record = second.join();
        assertThat(record.getStatus()).isEqualTo(AudienceSyncStatus.FAILED);
        assertThat(record.getMemberCount()).isEqualTo(500);
        assertThat(record.getErrorMessage()).contains("token expired");
        assertThat(record.getLastSyncedAt()).isEqualTo(first.join().getLastSyncedAt());
    }

    @Test
    void adapterExceptionsBecomeFailedRecords() {
        AudienceDefinition audience = manager.createAudience("Buyers", Optional.empty(), RULES);
        manager.registerAdapter(new PlatformSyncAdapter() {
            @Override
            public String platform() {
                return "tiktok";
            }

            @Override
            public CompletableFuture<SyncResult> sync(AudienceDefinition _audience) {
                throw new IllegalStateException("connection refused");
            }
        });
        QueuedAdapter meta = new QueuedAdapter("meta");
        manager.registerAdapter(meta);

        AudienceSyncRecord thrown = manager.syncToPlatform(audience.getId(), "tiktok").join();
        CompletableFuture<AudienceSyncRecord> completedExceptionally =
                manager.syncToPlatform(audience.getId(), "meta");
        meta.fail(new IllegalStateException("rate limited"));

        assertThat(thrown.getStatus()).isEqualTo(AudienceSyncStatus.FAILED);
        assertThat(thrown.getErrorMessage()).contains("connection refused");
        assertThat(completedExceptionally.join().getErrorMessage()).contains("rate limited");
    }

    @Test
    void missingResultBecomesFailedRecord() {
        AudienceDefinition audience = manager.createAudience("Buyers", Optional.empty(), RULES);
        QueuedAdapter meta = new QueuedAdapter("meta");
        manager.registerAdapter(meta);

        CompletableFuture<AudienceSyncRecord> sync = manager.syncToPlatform(audience.getId(), "meta");
        meta.complete(null);

        assertThat(sync).isCompleted();
        AudienceSyncRecord record = sync.join();
        assertThat(record.getStatus()).isEqualTo(AudienceSyncStatus.FAILED);
        assertThat(record.getErrorMessage()).contains("adapter returned no result");
        assertThat(manager.getSyncRecord(audience.getId(), "meta")).contains(record);
        assertThat(manager.inFlightCount()).isZero();
    }

    @Test
    void retryAfterFailureClearsPreviousError() {
        AudienceDefinition audience = manager.createAudience("Buyers", Optional.empty(), RULES);
        QueuedAdapter meta = new QueuedAdapter("meta");
        manager.registerAdapter(meta);
        CompletableFuture<AudienceSyncRecord> first = manager.syncToPlatform(audience.getId(), "meta");
        meta.complete(SyncResult.success(300));
        first.join();
        CompletableFuture<AudienceSyncRecord> second = manager.syncToPlatform(audience.getId(), "meta");
        clock.advance(Duration.ofSeconds(1));
        meta.complete(SyncResult.failure("token expired"));
        assertThat(second.join().getSyncDurationMs()).hasValue(1000);

        CompletableFuture<AudienceSyncRecord> retry = manager.syncToPlatform(audience.getId(), "meta");

        assertThat(retry).isNotDone();
        assertThat(manager.getSyncRecord(audience.getId(), "meta")).hasValueSatisfying(record -> {
            assertThat(record.getStatus()).isEqualTo(AudienceSyncStatus.SYNCING);
            assertThat(record.getErrorMessage()).isEmpty();
            assertThat(record.getSyncDurationMs()).isEmpty();
            assertThat(record.getMemberCount()).isEqualTo(300);
            assertThat(record.getLastSyncedAt()).isEqualTo(first.join().getLastSyncedAt());
        });

        meta.complete(SyncResult.failure("quota exceeded"));

        assertThat(retry.join().getErrorMessage()).contains("quota exceeded");
    }

    @Test
    void audiencesStartPendingOnRegisteredPlatforms() {
        AudienceDefinition existing = manager.createAudience("Buyers", Optional.empty(), RULES);
        manager.subscribe("handler", handler);
        QueuedAdapter meta = new QueuedAdapter("meta");

        manager.registerAdapter(meta);
        AudienceDefinition created = manager.createAudience("Browsers", Optional.empty(), RULES);

        assertThat(manager.getSyncRecord(existing.getId(), "meta")).hasValueSatisfying(record -> {
            assertThat(record.getStatus()).isEqualTo(AudienceSyncStatus.PENDING);
            assertThat(record.getMemberCount()).isZero();
            assertThat(record.getLastSyncedAt()).isEmpty();
        });
        assertThat(manager.getSyncRecord(created.getId(), "meta"))
                .hasValueSatisfying(record -> assertThat(record.getStatus()).isEqualTo(AudienceSyncStatus.PENDING));

        CompletableFuture<AudienceSyncRecord> sync = manager.syncToPlatform(existing.getId(), "meta");
        meta.complete(SyncResult.success(42));
        sync.join();
        manager.registerAdapter(new QueuedAdapter("meta"));

        assertThat(manager.getSyncRecord(existing.getId(), "meta").get().getStatus())
                .isEqualTo(AudienceSyncStatus.SYNCED);
        verify(handler, atLeastOnce()).handle(records.capture());
        assertThat(records.getAllValues())
                .filteredOn(record -> record.getAudienceId().equals(existing.getId()))
                .extracting(AudienceSyncRecord::getStatus)
                .containsExactly(AudienceSyncStatus.PENDING, AudienceSyncStatus.SYNCING, AudienceSyncStatus.SYNCED);
    }

    @Test
    void platformWithoutAdapterIsSyncedWithNoMembers() {
        AudienceDefinition audience = manager.createAudience("Buyers", Optional.empty(), RULES);

        AudienceSyncRecord record = manager.syncToPlatform(audience.getId(), "snapchat").join();

        assertThat(record.getStatus()).isEqualTo(AudienceSyncStatus.SYNCED);
        assertThat(record.getMemberCount()).isZero();
    }

    @Test
    void syncsOfSameKeyRunOneAtATime() {
        AudienceDefinition audience = manager.createAudience("Buyers", Optional.empty(), RULES);
        QueuedAdapter meta = new QueuedAdapter("meta");
        manager.registerAdapter(meta);

        CompletableFuture<AudienceSyncRecord> first = manager.syncToPlatform(audience.getId(), "meta");
        CompletableFuture<AudienceSyncRecord> second = manager.syncToPlatform(audience.getId(), "meta");

        assertThat(meta.calls).isEqualTo(1);
        assertThat(manager.inFlightCount()).isEqualTo(1);

        meta.complete(SyncResult.success(10));

        assertThat(first.join().getMemberCount()).isEqualTo(10);
        assertThat(second).isNotDone();
        assertThat(meta.calls).isEqualTo(2);

        meta.complete(SyncResult.success(20));

        assertThat(second.join().getMemberCount()).isEqualTo(20);
        assertThat(manager.getSyncRecord(audience.getId(), "meta").get().getMemberCount())
                .isEqualTo(20);
        assertThat(manager.inFlightCount()).isZero();
    }

    @Test
    void syncsOfDifferentPlatformsRunConcurrently() {
        AudienceDefinition audience = manager.createAudience("Buyers", Optional.empty(), RULES);
        QueuedAdapter meta = new QueuedAdapter("meta");
        QueuedAdapter tiktok = new QueuedAdapter("tiktok");
        manager.registerAdapter(meta);
        manager.registerAdapter(tiktok);

        manager.syncToPlatform(audience.getId(), "meta");
        manager.syncToPlatform(audience.getId(), "tiktok");

        assertThat(meta.calls).isEqualTo(1);
        assertThat(tiktok.calls).isEqualTo(1);
        assertThat(manager.inFlightCount()).isEqualTo(2);
    }

    @Test
    void updateMarksOnlySyncedRecordsStale() {
        AudienceDefinition audience = manager.createAudience("Buyers", Optional.empty(), RULES);
        QueuedAdapter failing = new QueuedAdapter("tiktok");
        manager.registerAdapter(failing);
        manager.syncToPlatform(audience.getId(), "meta").join();
        CompletableFuture<AudienceSyncRecord> failed = manager.syncToPlatform(audience.getId(), "tiktok");
        failing.complete(SyncResult.failure("bad audience"));
        failed.join();
        clock.advance(Duration.ofMinutes(5));

        AudienceDefinition updated = manager.updateAudience(audience.getId(), "Buyers v2", Optional.empty(), RULES);

        assertThat(updated.getName()).isEqualTo("Buyers v2");
        assertThat(updated.getCreatedAt()).isEqualTo(audience.getCreatedAt());
        assertThat(updated.getUpdatedAt()).contains(clock.instant());
        assertThat(manager.getSyncRecord(audience.getId(), "meta").get().getStatus())
                .isEqualTo(AudienceSyncStatus.STALE);
        assertThat(manager.getSyncRecord(audience.getId(), "tiktok").get().getStatus())
                .isEqualTo(AudienceSyncStatus.FAILED);
    }

    @Test
    void deleteCascadesToSyncRecords() {
        AudienceDefinition audience = manager.createAudience("Buyers", Optional.empty(), RULES);
        manager.syncToPlatform(audience.getId(), "meta").join();

        assertThat(manager.deleteAudience(audience.getId())).isTrue();

        assertThat(manager.getAudience(audience.getId())).isEmpty();
        assertThat(manager.getSyncRecords(audience.getId())).isEmpty();
        assertThat(manager.deleteAudience(audience.getId())).isFalse();
    }

    @Test
    void recordsOfAudienceDeletedMidSyncAreDropped() {
        AudienceDefinition audience = manager.createAudience("Buyers", Optional.empty(), RULES);
        QueuedAdapter meta = new QueuedAdapter("meta");
        manager.registerAdapter(meta);
        CompletableFuture<AudienceSyncRecord> sync = manager.syncToPlatform(audience.getId(), "meta");

        manager.deleteAudience(audience.getId());
        meta.complete(SyncResult.success(10));

        assertThat(sync.join().getStatus()).isEqualTo(AudienceSyncStatus.SYNCED);
        assertThat(manager.getSyncRecords(audience.getId())).isEmpty();
    }

    @Test
    void rejectsUnknownAudience() {
        assertThatLoggableExceptionThrownBy(() -> manager.syncToPlatform("missing", "meta"))
                .hasLogMessage("Audience not found")
                .hasExactlyArgs(SafeArg.of("audienceId", "missing"));
        assertThatLoggableExceptionThrownBy(
                        () -> manager.updateAudience("missing", "name", Optional.empty(), RULES))
                .hasLogMessage("Audience not found")
                .hasExactlyArgs(SafeArg.of("audienceId", "missing"));
    }

    @Test
    void registeringAdapterReturnsPrevious() {
        QueuedAdapter first = new QueuedAdapter("meta");

        assertThat(manager.registerAdapter(first)).isNull();
        assertThat(manager.registerAdapter(new QueuedAdapter("meta"))).isSameAs(first);
    }

    /** Adapter whose syncs complete only when the test says so, in call order. */
    private static final class QueuedAdapter implements PlatformSyncAdapter {
        private final String platform;
        private final Deque<CompletableFuture<SyncResult>> pending = new ArrayDeque<>();
        private int calls;

        QueuedAdapter(String platform) {
            this.platform = platform;
        }

        @Override
        public String platform() {
            return platform;
        }

        @Override
        public CompletableFuture<SyncResult> sync(AudienceDefinition _audience) {
            calls++;
            CompletableFuture<SyncResult> future = new CompletableFuture<>();
            pending.addLast(future);
            return future;
        }

        void complete(SyncResult result) {
            pending.removeFirst().complete(result);
        }

        void fail(Throwable error) {
            pending.removeFirst().completeExceptionally(error);
        }
    }
}
