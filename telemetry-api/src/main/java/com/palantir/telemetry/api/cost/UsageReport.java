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

package com.palantir.telemetry.api.cost;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.immutables.value.Value;

/** Spend aggregated over an arbitrary, inclusive time range. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class UsageReport {

    public abstract Instant getStartDate();

    public abstract Instant getEndDate();

    public abstract double getTotalSpend();

    public abstract String getCurrency();

    public abstract Map<String, Double> getByService();

    /** Totals of entries that name a product; entries without one only count towards {@link #getByService()}. */
    public abstract Map<String, Double> getByProduct();

    public abstract List<CostEntry> getEntries();

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableUsageReport.Builder {}
}
