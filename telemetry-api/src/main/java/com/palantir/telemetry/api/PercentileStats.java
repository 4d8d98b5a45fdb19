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

package com.palantir.telemetry.api;

import org.immutables.value.Value;

/** Latency distribution summary of a sample set. All values are zero when {@link #getCount()} is zero. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class PercentileStats {

    private static final PercentileStats EMPTY = builder()
            .p50(0)
            .p75(0)
            .p90(0)
            .p95(0)
            .p99(0)
            .min(0)
            .max(0)
            .avg(0)
            .count(0)
            .build();

    public abstract double getP50();

    public abstract double getP75();

    public abstract double getP90();

    public abstract double getP95();

    public abstract double getP99();

    public abstract double getMin();

    public abstract double getMax();

    public abstract double getAvg();

    public abstract int getCount();

    public static PercentileStats empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutablePercentileStats.Builder {}
}
