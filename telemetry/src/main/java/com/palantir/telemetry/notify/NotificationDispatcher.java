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

package com.palantir.telemetry.notify;

import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.telemetry.TokenBucket;
import com.palantir.telemetry.api.AlertHandler;
import com.palantir.telemetry.api.notify.DeliveryOutcome;
import com.palantir.telemetry.api.notify.NotificationConfig;
import com.palantir.telemetry.api.notify.NotificationMessage;
import com.palantir.telemetry.api.notify.NotificationTransport;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Routes alert notifications to chat channels by category and throttles them with a {@link TokenBucket}, so an alert
 * storm cannot flood the channel. Messages over the per-minute allowance are dropped, not queued.
 */
public final class NotificationDispatcher {

    private static final SafeLogger log = SafeLoggerFactory.get(NotificationDispatcher.class);

    private final NotificationConfig config;
    private final NotificationTransport transport;
    private final TokenBucket bucket;

    public NotificationDispatcher(NotificationConfig config, NotificationTransport transport, Clock clock) {
        this.config = Preconditions.checkNotNull(config, "config must not be null");
        this.transport = Preconditions.checkNotNull(transport, "transport must not be null");
        this.bucket = TokenBucket.perMinute(config.getRateLimitPerMinute(), clock);
    }

    /** Sends the text to the channel routed for the category. Transport failures complete as {@code FAILED}. */
    public CompletableFuture<DeliveryOutcome> send(String category, String text) {
        Preconditions.checkNotNull(category, "category must not be null");
        Preconditions.checkNotNull(text, "text must not be null");
        if (!config.isEnabled()) {
            return CompletableFuture.completedFuture(DeliveryOutcome.DISABLED);
        }
        if (!bucket.tryAcquire()) {
            log.warn("Dropping notification, rate limit exceeded", SafeArg.of("category", category));
            return CompletableFuture.completedFuture(DeliveryOutcome.RATE_LIMITED);
        }

        NotificationMessage message = NotificationMessage.of(config.channelFor(category), category, text);
        CompletableFuture<Void> delivery;
        try {
            delivery = Preconditions.checkNotNull(transport.send(message), "transport returned a null future");
        } catch (RuntimeException e) {
            delivery = CompletableFuture.failedFuture(e);
        }
        return delivery.handle((_result, error) -> {
            if (error != null) {
                log.warn(
                        "Failed to deliver notification",
                        SafeArg.of("channel", message.getChannel()),
                        SafeArg.of("category", category),
                        error);
                return DeliveryOutcome.FAILED;
            }
            return DeliveryOutcome.SENT;
        });
    }

    /**
     * Adapts this dispatcher into an alert handler that renders each event with the formatter and sends it under the
     * category. The handler does not wait for delivery.
     */
    public <T> AlertHandler<T> handlerFor(String category, Function<? super T, String> formatter) {
        Preconditions.checkNotNull(category, "category must not be null");
        Preconditions.checkNotNull(formatter, "formatter must not be null");
        return new AlertHandler<T>() {
            @Override
            public void handle(T event) {
                send(category, formatter.apply(event));
            }

            @Override
            public String toString() {
                return "NotificationHandler{category=" + category + '}';
            }
        };
    }
}
