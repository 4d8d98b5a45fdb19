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

package com.palantir.telemetry.session;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.telemetry.AlertDispatcher;
import com.palantir.telemetry.Ids;
import com.palantir.telemetry.api.AlertHandler;
import com.palantir.telemetry.api.HandlerFailure;
import com.palantir.telemetry.api.session.Session;
import com.palantir.telemetry.api.session.SessionConfig;
import com.palantir.telemetry.api.session.SessionLimitEvent;
import com.palantir.telemetry.api.session.SessionLimitType;
import com.palantir.telemetry.api.session.SessionStats;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import javax.annotation.Nullable;

/**
 * Tracks user sessions and enforces a global and a per-user cap on concurrently active sessions. A session start which
 * would exceed either cap is rejected and reported to limit handlers as a single {@link SessionLimitEvent}.
 *
 * <p>Ended sessions are kept in a bounded history (the most recent {@value #MAX_HISTORY}) for statistics.
 *
 * <p>This class is thread-safe.
 */
public final class SessionMonitor {

    private static final SafeLogger log = SafeLoggerFactory.get(SessionMonitor.class);

    static final int MAX_HISTORY = 1000;

    private final SessionConfig config;
    private final Clock clock;
    private final AlertDispatcher<SessionLimitEvent> limitEvents;

    // guarded by this
    private final Map<String, Session> active = new LinkedHashMap<>();
    private final Deque<Session> history = new ArrayDeque<>();
    private long totalSessions;
    private int concurrentPeak;

    public SessionMonitor(SessionConfig config, Clock clock) {
        this.config = Preconditions.checkNotNull(config, "config must not be null");
        this.clock = Preconditions.checkNotNull(clock, "clock must not be null");
        this.limitEvents = new AlertDispatcher<>("sessions", clock);
    }

    /**
     * Starts a session for the user, or returns empty if the global or the user's cap on active sessions has been
     * reached. The global cap is checked first, so a rejection raises exactly one event.
     */
    @CanIgnoreReturnValue
    public Optional<Session> startSession(String userId, Map<String, String> metadata) {
        Preconditions.checkArgument(userId != null && !userId.isEmpty(), "userId must be non-empty");
        Preconditions.checkNotNull(metadata, "metadata must not be null");
        SessionLimitEvent rejection;
        synchronized (this) {
            Instant now = clock.instant();
            rejection = checkLimits(userId, now);
            if (rejection == null) {
                Session session = Session.builder()
                        .id(Ids.randomId())
                        .userId(userId)
                        .startedAt(now)
                        .lastActivityAt(now)
                        .putAllMetadata(metadata)
                        .build();
                active.put(session.getId(), session);
                totalSessions++;
                concurrentPeak = Math.max(concurrentPeak, active.size());
                return Optional.of(session);
            }
        }
        log.warn(
                "Session limit reached",
                SafeArg.of("type", rejection.getType()),
                SafeArg.of("current", rejection.getCurrent()),
                SafeArg.of("limit", rejection.getLimit()),
                UnsafeArg.of("userId", userId));
        limitEvents.dispatch(rejection);
        return Optional.empty();
    }

    /** Marks activity on an active session. Returns false if no such session is active. */
    @CanIgnoreReturnValue
    public synchronized boolean recordActivity(String sessionId) {
        Session session = active.get(sessionId);
        if (session == null) {
            return false;
        }
        active.put(
                sessionId,
                Session.builder().from(session).lastActivityAt(clock.instant()).build());
        return true;
    }

    /** Ends an active session and moves it to history. Returns the ended session, or empty if it was not active. */
    @CanIgnoreReturnValue
    public synchronized Optional<Session> endSession(String sessionId) {
        Session session = active.remove(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        return Optional.of(archive(session, clock.instant()));
    }

    /** Ends every session whose last activity is older than the session timeout. Returns the expired sessions. */
    @CanIgnoreReturnValue
    public List<Session> expireInactiveSessions() {
        List<Session> expired;
        synchronized (this) {
            Instant now = clock.instant();
            Instant cutoff = now.minusMillis(config.getSessionTimeoutMs());
            ImmutableList.Builder<Session> builder = ImmutableList.builder();
            Iterator<Session> iterator = active.values().iterator();
            while (iterator.hasNext()) {
                Session session = iterator.next();
                if (session.getLastActivityAt().isBefore(cutoff)) {
                    iterator.remove();
                    builder.add(archive(session, now));
                }
            }
            expired = builder.build();
        }
        if (!expired.isEmpty()) {
            log.info("Expired inactive sessions", SafeArg.of("count", expired.size()));
        }
        return expired;
    }

    public synchronized List<Session> getActiveSessions() {
        return ImmutableList.copyOf(active.values());
    }

    public synchronized List<Session> getActiveSessions(String userId) {
        return active.values().stream()
                .filter(session -> session.getUserId().equals(userId))
                .collect(ImmutableList.toImmutableList());
    }

    /** Looks up an active session, or an ended one still in history. */
    public synchronized Optional<Session> getSession(String sessionId) {
        Session session = active.get(sessionId);
        if (session != null) {
            return Optional.of(session);
        }
        return history.stream()
                .filter(ended -> ended.getId().equals(sessionId))
                .findFirst();
    }

    public synchronized SessionStats getStats() {
        Map<String, Integer> byUser = new TreeMap<>();
        for (Session session : active.values()) {
            byUser.merge(session.getUserId(), 1, Integer::sum);
        }
        double avgDuration = history.stream()
                .mapToLong(session -> session.getDurationMs().orElse(0))
                .average()
                .orElse(0);
        return SessionStats.builder()
                .activeSessions(active.size())
                .totalSessions(totalSessions)
                .avgDurationMs(avgDuration)
                .concurrentPeak(concurrentPeak)
                .sessionsByUser(ImmutableMap.copyOf(byUser))
                .timestamp(clock.instant())
                .build();
    }

    @Nullable
    public AlertHandler<? super SessionLimitEvent> subscribe(
            String name, AlertHandler<? super SessionLimitEvent> handler) {
        return limitEvents.subscribe(name, handler);
    }

    @Nullable
    public AlertHandler<? super SessionLimitEvent> unsubscribe(String name) {
        return limitEvents.unsubscribe(name);
    }

    public List<HandlerFailure> drainHandlerFailures() {
        return limitEvents.drainFailures();
    }

    @Nullable
    private SessionLimitEvent checkLimits(String userId, Instant now) {
        if (active.size() >= config.getMaxConcurrentSessions()) {
            return limitEvent(
                    SessionLimitType.MAX_CONCURRENT, userId, active.size(), config.getMaxConcurrentSessions(), now);
        }
        int userSessions = (int) active.values().stream()
                .filter(session -> session.getUserId().equals(userId))
                .count();
        if (userSessions >= config.getMaxSessionsPerUser()) {
            return limitEvent(
                    SessionLimitType.MAX_PER_USER, userId, userSessions, config.getMaxSessionsPerUser(), now);
        }
        return null;
    }

    private Session archive(Session session, Instant endedAt) {
        Session ended = Session.builder().from(session).endedAt(endedAt).build();
        history.addLast(ended);
        while (history.size() > MAX_HISTORY) {
            history.removeFirst();
        }
        return ended;
    }

    private static SessionLimitEvent limitEvent(
            SessionLimitType type, String userId, int current, int limit, Instant now) {
        return SessionLimitEvent.builder()
                .type(type)
                .userId(userId)
                .current(current)
                .limit(limit)
                .timestamp(now)
                .build();
    }
}
