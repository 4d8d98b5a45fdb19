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
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.telemetry.api.HandlerFailure;
import com.palantir.telemetry.api.MonitoringConfig;
import com.palantir.telemetry.api.audience.AudienceSyncStatus;
import com.palantir.telemetry.api.notify.NotificationTransport;
import com.palantir.telemetry.audience.AudienceStore;
import com.palantir.telemetry.audience.AudienceSyncManager;
import com.palantir.telemetry.audience.InMemoryAudienceStore;
import com.palantir.telemetry.cost.CostMonitor;
import com.palantir.telemetry.health.HealthMonitor;
import com.palantir.telemetry.notify.AlertMessages;
import com.palantir.telemetry.notify.NotificationDispatcher;
import com.palantir.telemetry.queue.QueueMonitor;
import com.palantir.telemetry.ratelimit.RateLimitMonitor;
import com.palantir.telemetry.session.SessionMonitor;
import java.time.Clock;
import java.util.List;

/**
 * Every telemetry component built from one {@link MonitoringConfig}, sharing one clock. Alerts from each monitor, and
 * failed audience syncs, are forwarded to the {@link NotificationDispatcher} under the handler name
 * {@value #NOTIFICATION_HANDLER}.
 */
public final class TelemetryKernel {

    private static final SafeLogger log = SafeLoggerFactory.get(TelemetryKernel.class);

    public static final String NOTIFICATION_HANDLER = "notifications";

    private final MonitoringConfig config;
    private final SpanTracker spans;
    private final RateLimitMonitor rateLimits;
    private final CostMonitor costs;
    private final QueueMonitor queues;
    private final SessionMonitor sessions;
    private final AudienceSyncManager audiences;
    private final HealthMonitor health;
    private final NotificationDispatcher notifications;

    private TelemetryKernel(
            MonitoringConfig config, Clock clock, NotificationTransport transport, AudienceStore audienceStore) {
        this.config = config;
        this.spans = SpanTracker.create(config.getApm(), clock);
        this.rateLimits = new RateLimitMonitor(config.getRateLimits(), clock);
        this.costs = new CostMonitor(config.getCosts(), clock);
        this.queues = new QueueMonitor(config.getQueues(), clock);
        this.sessions = new SessionMonitor(config.getSessions(), clock);
        this.audiences = new AudienceSyncManager(config.getAudienceSync(), audienceStore, clock);
        this.health = new HealthMonitor(clock, config.getVersion());
        this.notifications = new NotificationDispatcher(config.getNotifications(), transport, clock);

        rateLimits.subscribe(
                NOTIFICATION_HANDLER, notifications.handlerFor(AlertMessages.RATE_LIMITS, AlertMessages::rateLimit));
        costs.subscribe(NOTIFICATION_HANDLER, notifications.handlerFor(AlertMessages.COSTS, AlertMessages::budget));
        queues.subscribe(NOTIFICATION_HANDLER, notifications.handlerFor(AlertMessages.QUEUES, AlertMessages::queue));
        sessions.subscribe(
                NOTIFICATION_HANDLER, notifications.handlerFor(AlertMessages.SESSIONS, AlertMessages::sessionLimit));
        audiences.subscribe(NOTIFICATION_HANDLER, record -> {
            if (record.getStatus() == AudienceSyncStatus.FAILED) {
                notifications.send(AlertMessages.AUDIENCES, AlertMessages.audienceSync(record));
            }
        });
    }

    public static TelemetryKernel create(MonitoringConfig config, Clock clock, NotificationTransport transport) {
        return create(config, clock, transport, new InMemoryAudienceStore());
    }

    public static TelemetryKernel create(
            MonitoringConfig config, Clock clock, NotificationTransport transport, AudienceStore audienceStore) {
        Preconditions.checkNotNull(config, "config must not be null");
        Preconditions.checkNotNull(clock, "clock must not be null");
        Preconditions.checkNotNull(transport, "transport must not be null");
        Preconditions.checkNotNull(audienceStore, "audienceStore must not be null");
        TelemetryKernel kernel = new TelemetryKernel(config, clock, transport, audienceStore);
        log.info(
                "Telemetry kernel started",
                SafeArg.of("service", config.getApm().getServiceName()),
                SafeArg.of("version", config.getVersion()),
                SafeArg.of("budgets", config.getCosts().getBudgets().size()));
        return kernel;
    }

    public MonitoringConfig config() {
        return config;
    }

    public SpanTracker spans() {
        return spans;
    }

    public RateLimitMonitor rateLimits() {
        return rateLimits;
    }

    public CostMonitor costs() {
        return costs;
    }

    public QueueMonitor queues() {
        return queues;
    }

    public SessionMonitor sessions() {
        return sessions;
    }

    public AudienceSyncManager audiences() {
        return audiences;
    }

    public HealthMonitor health() {
        return health;
    }

    public NotificationDispatcher notifications() {
        return notifications;
    }

    /** Drains the handler failures recorded by every component since the last drain. */
    public List<HandlerFailure> drainHandlerFailures() {
        return ImmutableList.<HandlerFailure>builder()
                .addAll(spans.drainHandlerFailures())
                .addAll(rateLimits.drainHandlerFailures())
                .addAll(costs.drainHandlerFailures())
                .addAll(queues.drainHandlerFailures())
                .addAll(sessions.drainHandlerFailures())
                .addAll(audiences.drainHandlerFailures())
                .build();
    }
}
