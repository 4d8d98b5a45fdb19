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

import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import java.time.Clock;

/**
 * A token bucket which starts full and refills continuously at a fixed rate. Refill is computed lazily from the
 * elapsed clock time whenever the bucket is consulted; no timer is involved.
 *
 * <p>This class is thread-safe.
 */
public final class TokenBucket {

    private static final double MILLIS_PER_MINUTE = 60_000.0;

    private final double capacity;
    private final double tokensPerMinute;
    private final Clock clock;

    // guarded by this
    private double tokens;
    private long lastRefillMillis;

    private TokenBucket(double capacity, double tokensPerMinute, Clock clock) {
        this.capacity = capacity;
        this.tokensPerMinute = tokensPerMinute;
        this.clock = clock;
        this.tokens = capacity;
        this.lastRefillMillis = clock.millis();
    }

    /** A bucket holding at most {@code tokensPerMinute} tokens, refilled at that many tokens per minute. */
    public static TokenBucket perMinute(int tokensPerMinute, Clock clock) {
        Preconditions.checkArgument(
                tokensPerMinute > 0,
                "tokensPerMinute must be positive",
                SafeArg.of("tokensPerMinute", tokensPerMinute));
        Preconditions.checkNotNull(clock, "clock must not be null");
        return new TokenBucket(tokensPerMinute, tokensPerMinute, clock);
    }

    /** Consumes one token if at least one is available. */
    public synchronized boolean tryAcquire() {
        refill();
        if (tokens >= 1) {
            tokens -= 1;
            return true;
        }
        return false;
    }

    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    public double capacity() {
        return capacity;
    }

    private void refill() {
        long now = clock.millis();
        long elapsed = now - lastRefillMillis;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * tokensPerMinute / MILLIS_PER_MINUTE);
            lastRefillMillis = now;
        }
    }

    @Override
    public String toString() {
        return "TokenBucket{capacity=" + capacity + ", tokensPerMinute=" + tokensPerMinute + '}';
    }
}
