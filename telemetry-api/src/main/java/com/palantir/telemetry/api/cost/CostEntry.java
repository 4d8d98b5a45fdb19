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

import static com.palantir.logsafe.Preconditions.checkArgument;

import com.palantir.logsafe.SafeArg;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/** One spend event, e.g. a paid AI generation call or an ad-platform charge. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class CostEntry {

    public abstract String getId();

    public abstract String getService();

    public abstract Optional<String> getProduct();

    public abstract double getAmount();

    @Value.Default
    public String getCurrency() {
        return CostConfig.DEFAULT_CURRENCY;
    }

    public abstract Instant getTimestamp();

    public abstract Map<String, String> getMetadata();

    @Value.Check
    protected final void check() {
        checkArgument(!getId().isEmpty(), "cost entry id must be non-empty");
        checkArgument(!getService().isEmpty(), "cost entry service must be non-empty");
        checkArgument(
                Double.isFinite(getAmount()) && getAmount() >= 0,
                "cost amount must be a finite, non-negative number",
                SafeArg.of("amount", getAmount()));
        checkArgument(!getCurrency().isEmpty(), "currency must be non-empty");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableCostEntry.Builder {}
}
