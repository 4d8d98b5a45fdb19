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

import static com.palantir.logsafe.testing.Assertions.assertThatLoggableExceptionThrownBy;
import static org.assertj.core.api.Assertions.assertThat;

import com.palantir.logsafe.SafeArg;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class TokenBucketTest {

    private final MutableClock clock = MutableClock.at("2024-03-01T12:00:00Z");

    @Test
    void startsFull() {
        TokenBucket bucket = TokenBucket.perMinute(10, clock);

        assertThat(bucket.availableTokens()).isEqualTo(10);
        for (int i = 0; i < 10; i++) {
            assertThat(bucket.tryAcquire()).isTrue();
        }
        assertThat(bucket.tryAcquire()).isFalse();
    }

    @Test
    void refillsOneTokenAfterSixSecondsAtTenPerMinute() {
        TokenBucket bucket = TokenBucket.perMinute(10, clock);
        for (int i = 0; i < 10; i++) {
            bucket.tryAcquire();
        }

        clock.advance(Duration.ofSeconds(6));

        assertThat(bucket.tryAcquire()).isTrue();
        assertThat(bucket.tryAcquire()).isFalse();
    }

    @Test
    void partialRefillDoesNotGrantToken() {
        TokenBucket bucket = TokenBucket.perMinute(10, clock);
        for (int i = 0; i < 10; i++) {
            bucket.tryAcquire();
        }

        clock.advance(Duration.ofSeconds(5));

        assertThat(bucket.tryAcquire()).isFalse();
        assertThat(bucket.availableTokens()).isGreaterThan(0.8).isLessThan(1);
    }

    @Test
    void refillIsCappedAtCapacity() {
        TokenBucket bucket = TokenBucket.perMinute(5, clock);
        bucket.tryAcquire();

        clock.advance(Duration.ofHours(1));

        assertThat(bucket.availableTokens()).isEqualTo(bucket.capacity());
    }

    @Test
    void rejectsNonPositiveRate() {
        assertThatLoggableExceptionThrownBy(() -> TokenBucket.perMinute(0, clock))
                .hasLogMessage("tokensPerMinute must be positive")
                .hasExactlyArgs(SafeArg.of("tokensPerMinute", 0));
    }
}
