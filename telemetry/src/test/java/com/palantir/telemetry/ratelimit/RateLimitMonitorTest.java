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

import static com.palantir.logsafe.testing.Assertions.assertThatLoggableExceptionThrownBy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.palantir.logsafe.SafeArg;
import com.palantir.telemetry.MutableClock;
import com.palantir.telemetry.api.AlertHandler;
import com.palantir.telemetry.api.ratelimit.RateLimitAlert;
import com.palantir.telemetry.api.ratelimit.RateLimitConfig;
import com.palantir.telemetry.api.ratelimit.RateLimitEntry;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RateLimitMonitorTest {

    @Mock
    private AlertHandler<RateLimitAlert> handler;

    private final MutableClock clock = MutableClock.at("2024-03-01T12:00:00Z");
    private final RateLimitMonitor monitor = new RateLimitMonitor(RateLimitConfig.defaults(), clock);

    @Test
    void alertsAtEightyFivePercentUsage() {
        monitor.subscribe("handler", handler);

        Optional<RateLimitAlert> alert = monitor.recordUsage(entry("openai", 100, 15));

        assertThat(alert).hasValueSatisfying(value -> {
            assertThat(value.getService()).isEqualTo("openai");
            assertThat(value.getUsagePercent()).isEqualTo(85.0);
            assertThat(value.getThreshold()).isEqualTo(0.8);
            assertThat(value.getRemaining()).isEqualTo(15);
            assertThat(value.getTimestamp()).isEqualTo(clock.instant());
        });
        verify(handler).handle(alert.get());
    }

    @Test
    void noAlertAtFiftyPercentUsage() {
        monitor.subscribe("handler", handler);

        assertThat(monitor.recordUsage(entry("openai", 100, 50))).isEmpty();

        verify(handler, never()).handle(any());
        assertThat(monitor.getEntry("openai", Optional.empty()))
                .hasValueSatisfying(value -> assertThat(value.getUsagePercent()).isEqualTo(50.0));
    }

    @Test
    void alertsExactlyAtThreshold() {
        assertThat(monitor.recordUsage(entry("openai", 100, 20))).isPresent();
    }

    @Test
    void reportedUsageOverridesDerivedUsage() {
        RateLimitEntry reported = RateLimitEntry.builder()
                .from(entry("meta", 100, 90))
                .reportedUsagePercent(95.0)
                .build();

        assertThat(monitor.recordUsage(reported))
                .hasValueSatisfying(value -> assertThat(value.getUsagePercent()).isEqualTo(95.0));
    }

    @Test
    void entriesAreKeyedByServiceAndEndpoint() {
        monitor.recordUsage(entry("meta", 100, 90));
        monitor.recordUsage(RateLimitEntry.builder()
                .from(entry("meta", 200, 10))
                .endpoint("/ads")
                .build());
        monitor.recordUsage(entry("meta", 100, 70));

        assertThat(monitor.getAllStatus()).extracting(RateLimitEntry::getKey).containsExactly("meta", "meta:/ads");
        assertThat(monitor.getEntry("meta", Optional.empty()))
                .hasValueSatisfying(value -> assertThat(value.getRemaining()).isEqualTo(70));
        assertThat(monitor.getEntriesAboveThreshold())
                .extracting(RateLimitEntry::getKey)
                .containsExactly("meta:/ads");
    }

    @Test
    void pruneExpiredRemovesEntriesPastReset() {
        monitor.recordUsage(RateLimitEntry.builder()
                .from(entry("short", 100, 100))
                .resetAt(clock.instant().plusSeconds(30))
                .build());
        monitor.recordUsage(entry("long", 100, 100));

        clock.advance(Duration.ofMinutes(1));

        assertThat(monitor.pruneExpired()).isEqualTo(1);
        assertThat(monitor.getAllStatus()).extracting(RateLimitEntry::getService).containsExactly("long");
    }

    @Test
    void failingHandlerDoesNotFailIngestion() {
        monitor.subscribe("broken", _alert -> {
            throw new IllegalStateException("chat is down");
        });
        monitor.subscribe("handler", handler);

        Optional<RateLimitAlert> alert = monitor.recordUsage(entry("openai", 10, 0));

        verify(handler).handle(alert.get());
        assertThat(monitor.drainHandlerFailures()).hasSize(1);
    }

    @Test
    void rejectsInvalidEntry() {
        assertThatLoggableExceptionThrownBy(() -> entry("openai", 0, 0))
                .hasLogMessage("limit must be positive")
                .hasExactlyArgs(SafeArg.of("limit", 0L));
        assertThatLoggableExceptionThrownBy(() -> entry("openai", 10, 11))
                .hasLogMessage("remaining must be between 0 and limit")
                .hasExactlyArgs(SafeArg.of("remaining", 11L), SafeArg.of("limit", 10L));
    }

    private RateLimitEntry entry(String service, long limit, long remaining) {
        return RateLimitEntry.builder()
                .service(service)
                .limit(limit)
                .remaining(remaining)
                .resetAt(clock.instant().plus(Duration.ofHours(1)))
                .build();
    }
}
