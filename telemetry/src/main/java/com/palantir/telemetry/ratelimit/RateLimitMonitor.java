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

package com.palantir.telemetry.ratelimit;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.telemetry.AlertDispatcher;
import com.palantir.telemetry.api.AlertHandler;
import com.palantir.telemetry.api.HandlerFailure;
import com.palantir.telemetry.api.ratelimit.RateLimitAlert;
import com.palantir.telemetry.api.ratelimit.RateLimitConfig;
import com.palantir.telemetry.api.ratelimit.RateLimitEntry;
import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Tracks the latest usage reported for each upstream rate limit, keyed by service and optional endpoint, and alerts
 * when the used fraction of a limit reaches the configured threshold.
 *
 * <p>This class is thread-safe.
 */
public final class RateLimitMonitor {

    private static final SafeLogger log = SafeLoggerFactory.get(RateLimitMonitor.class);

    private final RateLimitConfig config;
    private final Clock clock;
    private final AlertDispatcher<RateLimitAlert> alerts;

    // guarded by this
    private final Map<String, RateLimitEntry> entries = new LinkedHashMap<>();

    public RateLimitMonitor(RateLimitConfig config, Clock clock) {
        this.config = Preconditions.checkNotNull(config, "config must not be null");
        this.clock = Preconditions.checkNotNull(clock, "clock must not be null");
        this.alerts = new AlertDispatcher<>("rateLimits", clock);
    }

    /**
     * Records the latest usage of one limit, replacing any earlier entry with the same key. Returns the alert raised,
     * if usage is at or above the threshold; handlers have been invoked by the time this method returns.
     */
    @CanIgnoreReturnValue
    public Optional<RateLimitAlert> recordUsage(RateLimitEntry entry) {
        Preconditions.checkNotNull(entry, "entry must not be null");
        Optional<RateLimitAlert> alert;
        synchronized (this) {
            entries.put(entry.getKey(), entry);
            alert = check(entry);
        }
        alert.ifPresent(value -> {
            log.info(
                    "Rate limit usage above threshold",
                    SafeArg.of("service", value.getService()),
                    SafeArg.of("endpoint", value.getEndpoint()),
                    SafeArg.of("usagePercent", value.getUsagePercent()),
                    SafeArg.of("threshold", value.getThreshold()));
            alerts.dispatch(value);
        });
        return alert;
    }

    public synchronized Optional<RateLimitEntry> getEntry(String service, Optional<String> endpoint) {
        return Optional.ofNullable(entries.get(RateLimitEntry.keyOf(service, endpoint)));
    }

    /** Every tracked entry, in the order its key was first recorded. */
    public synchronized List<RateLimitEntry> getAllStatus() {
        return ImmutableList.copyOf(entries.values());
    }

    public synchronized List<RateLimitEntry> getEntriesAboveThreshold() {
        return entries.values().stream()
                .filter(this::isAboveThreshold)
                .collect(ImmutableList.toImmutableList());
    }

    /** Forgets every entry whose reset time has passed. Returns the number of entries removed. */
    @CanIgnoreReturnValue
    public synchronized int pruneExpired() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<RateLimitEntry> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().getResetAt().isBefore(now)) {
                iterator.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Pruned expired rate limit entries", SafeArg.of("removed", removed));
        }
        return removed;
    }

    @Nullable
    public AlertHandler<? super RateLimitAlert> subscribe(String name, AlertHandler<? super RateLimitAlert> handler) {
        return alerts.subscribe(name, handler);
    }

    @Nullable
    public AlertHandler<? super RateLimitAlert> unsubscribe(String name) {
        return alerts.unsubscribe(name);
    }

    public List<HandlerFailure> drainHandlerFailures() {
        return alerts.drainFailures();
    }

    private Optional<RateLimitAlert> check(RateLimitEntry entry) {
        if (!isAboveThreshold(entry)) {
            return Optional.empty();
        }
        return Optional.of(RateLimitAlert.builder()
                .service(entry.getService())
                .endpoint(entry.getEndpoint())
                .usagePercent(entry.getUsagePercent())
                .limit(entry.getLimit())
                .remaining(entry.getRemaining())
                .threshold(config.getAlertThreshold())
                .timestamp(clock.instant())
                .build());
    }

    private boolean isAboveThreshold(RateLimitEntry entry) {
        return entry.getUsagePercent() / 100 >= config.getAlertThreshold();
    }
}
