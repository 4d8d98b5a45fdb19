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
import com.palantir.logsafe.SafeArg;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * A spend limit for one service, optionally narrowed to a single product of that service. Spend is evaluated over the
 * current calendar {@link BudgetPeriod}.
 */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
@JsonDeserialize(as = ImmutableBudgetDefinition.class)
public abstract class BudgetDefinition {

    public static final BudgetPeriod DEFAULT_PERIOD = BudgetPeriod.MONTHLY;
    public static final double DEFAULT_ALERT_THRESHOLD = 0.8;

    public abstract String getService();

    public abstract Optional<String> getProduct();

    public abstract double getLimit();

    @Value.Default
    public BudgetPeriod getPeriod() {
        return DEFAULT_PERIOD;
    }

    @Value.Default
    public double getAlertThreshold() {
        return DEFAULT_ALERT_THRESHOLD;
    }

    /** True iff a cost recorded for {@code service} and {@code product} counts against this budget. */
    public final boolean covers(String service, Optional<String> product) {
        if (!getService().equals(service)) {
            return false;
        }
        return getProduct().isEmpty() || getProduct().equals(product);
    }

    @Value.Check
    protected final void check() {
        checkArgument(!getService().isEmpty(), "budget service must be non-empty");
        checkArgument(getLimit() > 0, "budget limit must be positive", SafeArg.of("limit", getLimit()));
        checkArgument(
                getAlertThreshold() >= 0 && getAlertThreshold() <= 1,
                "alertThreshold should be between 0 and 1",
                SafeArg.of("alertThreshold", getAlertThreshold()));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableBudgetDefinition.Builder {}
}
