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
import com.palantir.telemetry.api.PercentileStats;
import java.util.Arrays;
import java.util.Collection;

/**
 * Nearest-rank percentiles over a sample set. The rank for percentile {@code r} of {@code n} sorted samples is
 * {@code ceil(r / 100 * n) - 1}, clamped to {@code [0, n - 1]}.
 */
public final class Percentiles {

    private Percentiles() {}

    public static PercentileStats compute(Collection<? extends Number> samples) {
        Preconditions.checkNotNull(samples, "samples must not be null");
        if (samples.isEmpty()) {
            return PercentileStats.empty();
        }

        double[] sorted = new double[samples.size()];
        int index = 0;
        double sum = 0;
        for (Number sample : samples) {
            sorted[index++] = sample.doubleValue();
            sum += sample.doubleValue();
        }
        Arrays.sort(sorted);

        return PercentileStats.builder()
                .p50(percentile(sorted, 50))
                .p75(percentile(sorted, 75))
                .p90(percentile(sorted, 90))
                .p95(percentile(sorted, 95))
                .p99(percentile(sorted, 99))
                .min(sorted[0])
                .max(sorted[sorted.length - 1])
                .avg(sum / sorted.length)
                .count(sorted.length)
                .build();
    }

    static double percentile(double[] sorted, double rank) {
        int index = (int) Math.ceil(rank * sorted.length / 100) - 1;
        return sorted[Math.max(0, Math.min(index, sorted.length - 1))];
    }
}
