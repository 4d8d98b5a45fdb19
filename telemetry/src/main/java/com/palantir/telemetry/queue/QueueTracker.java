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

package com.palantir.telemetry.queue;

import com.palantir.telemetry.api.queue.QueueStats;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalLong;
import javax.annotation.Nullable;

/** Raw counters of one queue. Not thread-safe; owned and guarded by {@link QueueMonitor}. */
final class QueueTracker {

    static final int MAX_PROCESSING_SAMPLES = 1000;

    private final String name;
    private final Deque<Long> processingTimesMs = new ArrayDeque<>();
    private long processingTimeSumMs;
    private long processedCount;
    private long failedCount;
    private long depth;

    @Nullable
    private Instant oldestJobTimestamp;

    private Instant windowStart;
    private Instant lastUpdated;

    QueueTracker(String name, Instant now) {
        this.name = name;
        this.windowStart = now;
        this.lastUpdated = now;
    }

    void recordProcessed(long processingTimeMs, Instant now) {
        processedCount++;
        processingTimesMs.addLast(processingTimeMs);
        processingTimeSumMs += processingTimeMs;
        while (processingTimesMs.size() > MAX_PROCESSING_SAMPLES) {
            processingTimeSumMs -= processingTimesMs.removeFirst();
        }
        lastUpdated = now;
    }

    void recordFailed(Instant now) {
        failedCount++;
        lastUpdated = now;
    }

    void updateDepth(long newDepth, Instant now) {
        depth = newDepth;
        lastUpdated = now;
    }

    void setOldestJobTimestamp(@Nullable Instant timestamp, Instant now) {
        oldestJobTimestamp = timestamp;
        lastUpdated = now;
    }

    /** Starts a new rate window: counters and samples are cleared, depth and oldest job are kept. */
    void resetWindow(Instant now) {
        processedCount = 0;
        failedCount = 0;
        processingTimesMs.clear();
        processingTimeSumMs = 0;
        windowStart = now;
        lastUpdated = now;
    }

    int sampleCount() {
        return processingTimesMs.size();
    }

    QueueStats stats(Instant now, long staleThresholdMs) {
        double elapsedSeconds = Math.max(1, Duration.between(windowStart, now).toMillis()) / 1000.0;
        long finished = processedCount + failedCount;
        return QueueStats.builder()
                .name(name)
                .depth(depth)
                .processedCount(processedCount)
                .failedCount(failedCount)
                .processingRate(processedCount / elapsedSeconds)
                .failureRate(failedCount / elapsedSeconds)
                .failureRatio(finished == 0 ? 0 : (double) failedCount / finished)
                .avgProcessingTimeMs(
                        processingTimesMs.isEmpty() ? 0 : (double) processingTimeSumMs / processingTimesMs.size())
                .oldestJobAgeMs(
                        oldestJobTimestamp == null
                                ? OptionalLong.empty()
                                : OptionalLong.of(Duration.between(oldestJobTimestamp, now).toMillis()))
                .staleThresholdMs(staleThresholdMs)
                .windowStart(windowStart)
                .lastUpdated(lastUpdated)
                .build();
    }
}
