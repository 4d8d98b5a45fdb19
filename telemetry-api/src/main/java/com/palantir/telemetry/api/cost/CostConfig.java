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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.List;
import org.immutables.value.Value;

@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
@JsonDeserialize(as = ImmutableCostConfig.class)
public abstract class CostConfig {

    public static final String DEFAULT_CURRENCY = "USD";

    public abstract List<BudgetDefinition> getBudgets();

    @Value.Default
    public String getDefaultCurrency() {
        return DEFAULT_CURRENCY;
    }

    @Value.Check
    protected final void check() {
        checkArgument(!getDefaultCurrency().isEmpty(), "defaultCurrency must be non-empty");
    }

    public static CostConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableCostConfig.Builder {}
}
