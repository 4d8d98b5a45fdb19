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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.telemetry.AlertDispatcher;
import com.palantir.telemetry.Ids;
import com.palantir.telemetry.api.AlertHandler;
import com.palantir.telemetry.api.HandlerFailure;
import com.palantir.telemetry.api.audience.AudienceDefinition;
import com.palantir.telemetry.api.audience.AudienceRule;
import com.palantir.telemetry.api.audience.AudienceSyncConfig;
import com.palantir.telemetry.api.audience.AudienceSyncRecord;
import com.palantir.telemetry.api.audience.AudienceSyncStatus;
import com.palantir.telemetry.api.audience.PlatformSyncAdapter;
import com.palantir.telemetry.api.audience.SyncResult;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nullable;

/**
 * Owns audience definitions and drives their replication to advertising platforms through registered
 * {@link PlatformSyncAdapter}s. Each (audience, platform) pair has one {@link AudienceSyncRecord} whose status follows
 * the transitions documented on {@link AudienceSyncStatus}; every transition is reported to status handlers.
 *
 * <p>Syncs of the same audience to the same platform run one at a time, in call order. Adapter failures, whether
 * reported as a failed {@link SyncResult}, an exceptionally completed future or a thrown exception, are recorded on the
 * sync record and never propagate to the caller.
 *
 * <p>This class is thread-safe.
 */
public final class AudienceSyncManager {

    private static final SafeLogger log = SafeLoggerFactory.get(AudienceSyncManager.class);

    private final AudienceSyncConfig config;
    private final AudienceStore store;
    private final Clock clock;
    private final Map<String, PlatformSyncAdapter> adapters = new ConcurrentHashMap<>();
    private final AlertDispatcher<AudienceSyncRecord> statusChanges;

    // guarded by this
    private final Map<SyncKey, CompletableFuture<AudienceSyncRecord>> inFlight = new HashMap<>();

    public AudienceSyncManager(AudienceSyncConfig config, AudienceStore store, Clock clock) {
        this.config = Preconditions.checkNotNull(config, "config must not be null");
        this.store = Preconditions.checkNotNull(store, "store must not be null");
        this.clock = Preconditions.checkNotNull(clock, "clock must not be null");
        this.statusChanges = new AlertDispatcher<>("audienceSync", clock);
    }

    public static AudienceSyncManager inMemory(AudienceSyncConfig config, Clock clock) {
        return new AudienceSyncManager(config, new InMemoryAudienceStore(), clock);
    }

    public AudienceDefinition createAudience(String name, Optional<String> description, List<AudienceRule> rules) {
        AudienceDefinition audience = AudienceDefinition.builder()
                .id(Ids.randomId())
                .name(name)
                .description(description)
                .rules(rules)
                .createdAt(clock.instant())
                .build();
        List<AudienceSyncRecord> pending;
        synchronized (this) {
            store.saveAudience(audience);
            pending = markPending(ImmutableList.of(audience), ImmutableList.copyOf(adapters.keySet()));
        }
        log.info("Created audience", SafeArg.of("audienceId", audience.getId()), UnsafeArg.of("name", name));
        pending.forEach(statusChanges::dispatch);
        return audience;
    }

    public Optional<AudienceDefinition> getAudience(String audienceId) {
        return store.findAudience(audienceId);
    }

    public List<AudienceDefinition> listAudiences() {
        return store.listAudiences();
    }

    /**
     * Replaces the name, description and rules of an existing audience. Every platform on which the audience was
     * {@link AudienceSyncStatus#SYNCED synced} becomes {@link AudienceSyncStatus#STALE stale}; records in any other
     * status are left as they are.
     */
    public AudienceDefinition updateAudience(
            String audienceId, String name, Optional<String> description, List<AudienceRule> rules) {
        ImmutableList.Builder<AudienceSyncRecord> staled = ImmutableList.builder();
        AudienceDefinition updated;
        synchronized (this) {
            AudienceDefinition existing = requireAudience(audienceId);
            Instant now = clock.instant();
            updated = AudienceDefinition.builder()
                    .from(existing)
                    .name(name)
                    .description(description)
                    .rules(rules)
                    .updatedAt(now)
                    .build();
            store.saveAudience(updated);
            for (AudienceSyncRecord record : store.findSyncRecords(audienceId)) {
                if (record.getStatus() == AudienceSyncStatus.SYNCED) {
                    AudienceSyncRecord stale = AudienceSyncRecord.builder()
                            .from(record)
                            .status(AudienceSyncStatus.STALE)
                            .updatedAt(now)
                            .build();
                    store.saveSyncRecord(stale);
                    staled.add(stale);
                }
            }
        }
        staled.build().forEach(statusChanges::dispatch);
        return updated;
    }

    /** Deletes the audience together with all of its sync records. */
    @CanIgnoreReturnValue
    public synchronized boolean deleteAudience(String audienceId) {
        boolean deleted = store.deleteAudience(audienceId);
        if (deleted) {
            log.info("Deleted audience", SafeArg.of("audienceId", audienceId));
        }
        return deleted;
    }

    /**
     * Registers the adapter for its platform. Every audience without a record on that platform gets a
     * {@link AudienceSyncStatus#PENDING pending} one. Returns the adapter it replaced, or null if there was none.
     */
    @Nullable
    @CanIgnoreReturnValue
    public PlatformSyncAdapter registerAdapter(PlatformSyncAdapter adapter) {
        Preconditions.checkNotNull(adapter, "adapter must not be null");
        String platform = adapter.platform();
        PlatformSyncAdapter previous;
        List<AudienceSyncRecord> pending;
        synchronized (this) {
            previous = adapters.put(platform, adapter);
            pending = markPending(store.listAudiences(), ImmutableList.of(platform));
        }
        pending.forEach(statusChanges::dispatch);
        if (previous != null) {
            log.warn(
                    "Overwriting existing sync adapter for platform {}",
                    SafeArg.of("platform", platform),
                    SafeArg.of("previous", previous),
                    SafeArg.of("adapter", adapter));
        }
        return previous;
    }

    /**
     * Syncs the audience to the platform. The returned future completes with the final record, {@code SYNCED} or
     * {@code FAILED}; it never completes exceptionally because of the adapter. A platform without a registered adapter
     * is recorded as synced with no members.
     *
     * @throws SafeIllegalArgumentException if the audience does not exist
     */
    public CompletableFuture<AudienceSyncRecord> syncToPlatform(String audienceId, String platform) {
        Preconditions.checkArgument(platform != null && !platform.isEmpty(), "platform must be non-empty");
        requireAudience(audienceId);
        SyncKey key = new SyncKey(audienceId, platform);
        // the gate keeps the adapter call and handler notifications off this lock
        CompletableFuture<Void> gate = new CompletableFuture<>();
        CompletableFuture<AudienceSyncRecord> next;
        synchronized (this) {
            CompletableFuture<AudienceSyncRecord> previous = inFlight.get(key);
            CompletableFuture<Void> ready;
            if (previous == null) {
                ready = gate;
            } else {
                ready = previous.handle((_record, _error) -> (Void) null).thenCombine(gate, (_first, _second) -> null);
            }
            next = ready.thenCompose(_ignored -> runSync(key));
            inFlight.put(key, next);
        }
        next.whenComplete((_record, _error) -> forget(key, next));
        gate.complete(null);
        return next;
    }

    public List<AudienceSyncRecord> getSyncRecords(String audienceId) {
        return store.findSyncRecords(audienceId);
    }

    public Optional<AudienceSyncRecord> getSyncRecord(String audienceId, String platform) {
        return store.findSyncRecord(audienceId, platform);
    }

    @Nullable
    public AlertHandler<? super AudienceSyncRecord> subscribe(
            String name, AlertHandler<? super AudienceSyncRecord> handler) {
        return statusChanges.subscribe(name, handler);
    }

    @Nullable
    public AlertHandler<? super AudienceSyncRecord> unsubscribe(String name) {
        return statusChanges.unsubscribe(name);
    }

    public List<HandlerFailure> drainHandlerFailures() {
        return statusChanges.drainFailures();
    }

    @VisibleForTesting
    synchronized int inFlightCount() {
        return inFlight.size();
    }

    private CompletableFuture<AudienceSyncRecord> runSync(SyncKey key) {
        Optional<AudienceDefinition> audience = store.findAudience(key.audienceId);
        if (audience.isEmpty()) {
            // deleted while an earlier sync of the same key was running
            return CompletableFuture.failedFuture(
                    new SafeIllegalArgumentException("Audience not found", SafeArg.of("audienceId", key.audienceId)));
        }

        Optional<AudienceSyncRecord> prior = store.findSyncRecord(key.audienceId, key.platform);
        long priorMembers = prior.map(AudienceSyncRecord::getMemberCount).orElse(0L);
        Instant started = clock.instant();
        // the error and duration of an earlier attempt do not describe this one
        transition(AudienceSyncRecord.builder()
                .audienceId(key.audienceId)
                .platform(key.platform)
                .status(AudienceSyncStatus.SYNCING)
                .memberCount(priorMembers)
                .lastSyncedAt(prior.flatMap(AudienceSyncRecord::getLastSyncedAt))
                .nextSyncAt(prior.flatMap(AudienceSyncRecord::getNextSyncAt))
                .updatedAt(started)
                .build());

        PlatformSyncAdapter adapter = adapters.get(key.platform);
        if (adapter == null) {
            log.warn("No sync adapter registered for platform {}", SafeArg.of("platform", key.platform));
            return CompletableFuture.completedFuture(succeeded(key, SyncResult.success(0), started));
        }

        CompletableFuture<SyncResult> result;
        try {
            result = Preconditions.checkNotNull(adapter.sync(audience.get()), "adapter returned a null future");
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return result.handle((syncResult, error) -> {
            if (error != null) {
                return failed(key, priorMembers, messageOf(error), started);
            }
            if (syncResult == null) {
                return failed(key, priorMembers, "adapter returned no result", started);
            }
            if (!syncResult.isSuccess()) {
                return failed(key, priorMembers, syncResult.getError().orElse("Sync failed"), started);
            }
            return succeeded(key, syncResult, started);
        });
    }

    private AudienceSyncRecord succeeded(SyncKey key, SyncResult result, Instant started) {
        Instant now = clock.instant();
        return transition(AudienceSyncRecord.builder()
                .audienceId(key.audienceId)
                .platform(key.platform)
                .status(AudienceSyncStatus.SYNCED)
                .memberCount(result.getMemberCount())
                .lastSyncedAt(now)
                .nextSyncAt(now.plusMillis(config.getResyncIntervalMs()))
                .syncDurationMs(now.toEpochMilli() - started.toEpochMilli())
                .updatedAt(now)
                .build());
    }

    private AudienceSyncRecord failed(SyncKey key, long priorMembers, String message, Instant started) {
        Instant now = clock.instant();
        log.warn(
                "Audience sync failed",
                SafeArg.of("audienceId", key.audienceId),
                SafeArg.of("platform", key.platform),
                UnsafeArg.of("error", message));
        AudienceSyncRecord.Builder builder = AudienceSyncRecord.builder();
        store.findSyncRecord(key.audienceId, key.platform).ifPresent(builder::from);
        return transition(builder.audienceId(key.audienceId)
                .platform(key.platform)
                .status(AudienceSyncStatus.FAILED)
                .memberCount(priorMembers)
                .errorMessage(message)
                .syncDurationMs(now.toEpochMilli() - started.toEpochMilli())
                .updatedAt(now)
                .build());
    }

    /** Saves the record unless its audience has been deleted meanwhile, then notifies status handlers. */
    private AudienceSyncRecord transition(AudienceSyncRecord record) {
        synchronized (this) {
            if (store.findAudience(record.getAudienceId()).isEmpty()) {
                return record;
            }
            store.saveSyncRecord(record);
        }
        log.debug(
                "Audience sync status changed",
                SafeArg.of("audienceId", record.getAudienceId()),
                SafeArg.of("platform", record.getPlatform()),
                SafeArg.of("status", record.getStatus()));
        statusChanges.dispatch(record);
        return record;
    }

    /** Saves a pending record for every audience and platform pair that has none yet. Callers hold the lock. */
    private List<AudienceSyncRecord> markPending(List<AudienceDefinition> audiences, List<String> platforms) {
        Instant now = clock.instant();
        ImmutableList.Builder<AudienceSyncRecord> pending = ImmutableList.builder();
        for (AudienceDefinition audience : audiences) {
            for (String platform : platforms) {
                if (store.findSyncRecord(audience.getId(), platform).isEmpty()) {
                    AudienceSyncRecord record = AudienceSyncRecord.builder()
                            .audienceId(audience.getId())
                            .platform(platform)
                            .status(AudienceSyncStatus.PENDING)
                            .updatedAt(now)
                            .build();
                    store.saveSyncRecord(record);
                    pending.add(record);
                }
            }
        }
        return pending.build();
    }

    private synchronized void forget(SyncKey key, CompletableFuture<AudienceSyncRecord> future) {
        inFlight.remove(key, future);
    }

    private AudienceDefinition requireAudience(String audienceId) {
        return store.findAudience(audienceId)
                .orElseThrow(() ->
                        new SafeIllegalArgumentException("Audience not found", SafeArg.of("audienceId", audienceId)));
    }

    private static String messageOf(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }

    private static final class SyncKey {
        private final String audienceId;
        private final String platform;

        SyncKey(String audienceId, String platform) {
            this.audienceId = audienceId;
            this.platform = platform;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof SyncKey)) {
                return false;
            }
            SyncKey that = (SyncKey) other;
            return audienceId.equals(that.audienceId) && platform.equals(that.platform);
        }

        @Override
        public int hashCode() {
            return 31 * audienceId.hashCode() + platform.hashCode();
        }

        @Override
        public String toString() {
            return audienceId + ':' + platform;
        }
    }
}
