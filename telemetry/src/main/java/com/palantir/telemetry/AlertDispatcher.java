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

package com.palantir.telemetry;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.telemetry.api.AlertHandler;
import com.palantir.telemetry.api.DispatchReport;
import com.palantir.telemetry.api.HandlerFailure;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Delivers events from one source to a set of named handlers.
 *
 * <p>Handlers run synchronously, in subscription order, on the thread calling {@link #dispatch}. A handler that
 * throws is logged and recorded as a {@link HandlerFailure}; the remaining handlers still receive the event. The most
 * recent failures are retained (up to {@value #MAX_RECENT_FAILURES}) until the owner drains them.
 *
 * <p>This class is thread-safe.
 */
public final class AlertDispatcher<T> {

    private static final SafeLogger log = SafeLoggerFactory.get(AlertDispatcher.class);

    static final int MAX_RECENT_FAILURES = 100;

    private final String source;
    private final Clock clock;

    // guarded by this
    private final Map<String, AlertHandler<? super T>> handlers = new LinkedHashMap<>();

    // rebuilt on every change so dispatch never takes the lock
    private volatile ImmutableMap<String, AlertHandler<? super T>> snapshot = ImmutableMap.of();

    // guarded by itself
    private final Deque<HandlerFailure> recentFailures = new ArrayDeque<>();

    public AlertDispatcher(String source, Clock clock) {
        this.source = Preconditions.checkNotNull(source, "source must not be null");
        this.clock = Preconditions.checkNotNull(clock, "clock must not be null");
    }

    /**
     * Registers the given handler under the given name. A handler already registered under the name is replaced, keeps
     * its position in the invocation order, and is returned; returns null if there was none.
     */
    @Nullable
    public synchronized AlertHandler<? super T> subscribe(String name, AlertHandler<? super T> handler) {
        Preconditions.checkNotNull(name, "name must not be null");
        Preconditions.checkNotNull(handler, "handler must not be null");
        if (handlers.containsKey(name)) {
            log.warn(
                    "Overwriting existing {} handler with name {} by new handler: {}",
                    SafeArg.of("source", source),
                    SafeArg.of("name", name),
                    SafeArg.of("handler", handler));
        }
        AlertHandler<? super T> previous = handlers.put(name, handler);
        snapshot = ImmutableMap.copyOf(handlers);
        return previous;
    }

    /**
     * The inverse of {@link #subscribe}: removes the handler registered for the given name. Returns the removed handler
     * if it existed, or null otherwise.
     */
    @Nullable
    public synchronized AlertHandler<? super T> unsubscribe(String name) {
        AlertHandler<? super T> removed = handlers.remove(name);
        snapshot = ImmutableMap.copyOf(handlers);
        return removed;
    }

    public Set<String> handlerNames() {
        return snapshot.keySet();
    }

    public DispatchReport dispatch(T event) {
        Preconditions.checkNotNull(event, "event must not be null");
        ImmutableMap<String, AlertHandler<? super T>> current = snapshot;
        if (current.isEmpty()) {
            return DispatchReport.none();
        }

        ImmutableList.Builder<HandlerFailure> failures = ImmutableList.builder();
        for (Map.Entry<String, AlertHandler<? super T>> entry : current.entrySet()) {
            try {
                entry.getValue().handle(event);
            } catch (RuntimeException e) {
                log.error(
                        "Failed to invoke {} handler {} registered as {}",
                        SafeArg.of("source", source),
                        SafeArg.of("handler", entry.getValue()),
                        SafeArg.of("name", entry.getKey()),
                        e);
                HandlerFailure failure = HandlerFailure.of(source, entry.getKey(), e, clock.instant());
                failures.add(failure);
                recordFailure(failure);
            }
        }

        return DispatchReport.builder()
                .handlerCount(current.size())
                .failures(failures.build())
                .build();
    }

    /** Returns and forgets the handler failures recorded since the last drain, oldest first. */
    public List<HandlerFailure> drainFailures() {
        synchronized (recentFailures) {
            List<HandlerFailure> drained = ImmutableList.copyOf(recentFailures);
            recentFailures.clear();
            return drained;
        }
    }

    private void recordFailure(HandlerFailure failure) {
        synchronized (recentFailures) {
            recentFailures.addLast(failure);
            while (recentFailures.size() > MAX_RECENT_FAILURES) {
                recentFailures.removeFirst();
            }
        }
    }

    @Override
    public String toString() {
        return "AlertDispatcher{source=" + source + ", handlers=" + snapshot.keySet() + '}';
    }
}
