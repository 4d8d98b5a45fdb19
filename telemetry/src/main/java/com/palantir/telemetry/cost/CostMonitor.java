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

package com.palantir.telemetry.cost;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.telemetry.AlertDispatcher;
import com.palantir.telemetry.Ids;
import com.palantir.telemetry.api.AlertHandler;
import com.palantir.telemetry.api.HandlerFailure;
import com.palantir.telemetry.api.cost.BudgetAlert;
import com.palantir.telemetry.api.cost.BudgetDefinition;
import com.palantir.telemetry.api.cost.BudgetStatus;
import com.palantir.telemetry.api.cost.CostConfig;
import com.palantir.telemetry.api.cost.CostEntry;
import com.palantir.telemetry.api.cost.UsageReport;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import javax.annotation.Nullable;

/**
 * Records spend per service and product, and evaluates every configured budget which covers a new entry against the
 * spend in the budget's current calendar window (in the zone of the monitor's clock).
 *
 * <p>Entries are kept, and scanned on every evaluation, until {@link #pruneEntriesBefore(Instant)} removes them. Owners
 * should prune periodically with a cutoff no later than the start of the longest budget window still needed for
 * evaluation or usage reports.
 *
 * <p>This class is thread-safe.
 */
public final class CostMonitor {

    private static final SafeLogger log = SafeLoggerFactory.get(CostMonitor.class);

    private final CostConfig config;
    private final Clock clock;
    private final AlertDispatcher<BudgetAlert> alerts;

    // guarded by this
    private final List<CostEntry> entries = new ArrayList<>();

    public CostMonitor(CostConfig config, Clock clock) {
        this.config = Preconditions.checkNotNull(config, "config must not be null");
        this.clock = Preconditions.checkNotNull(clock, "clock must not be null");
        this.alerts = new AlertDispatcher<>("costs", clock);
    }

    /** Records a cost incurred now, in the default currency. */
    @CanIgnoreReturnValue
    public List<BudgetAlert> recordCost(String service, Optional<String> product, double amount) {
        return recordCost(CostEntry.builder()
                .id(Ids.randomId())
                .service(service)
                .product(product)
                .amount(amount)
                .currency(config.getDefaultCurrency())
                .timestamp(clock.instant())
                .build());
    }

    /**
     * Records the entry and returns one alert for each covering budget whose window spend has reached its threshold.
     * Handlers have been invoked by the time this method returns.
     */
    @CanIgnoreReturnValue
    public List<BudgetAlert> recordCost(CostEntry entry) {
        Preconditions.checkNotNull(entry, "entry must not be null");
        List<BudgetAlert> raised;
        synchronized (this) {
            entries.add(entry);
            Instant now = clock.instant();
            raised = config.getBudgets().stream()
                    .filter(budget -> budget.covers(entry.getService(), entry.getProduct()))
                    .map(budget -> status(budget, now))
                    .filter(BudgetStatus::isAboveThreshold)
                    .map(status -> toAlert(status, now))
                    .collect(ImmutableList.toImmutableList());
        }
        for (BudgetAlert alert : raised) {
            log.info(
                    "Budget usage above threshold",
                    SafeArg.of("service", alert.getService()),
                    SafeArg.of("product", alert.getProduct()),
                    SafeArg.of("period", alert.getPeriod()),
                    SafeArg.of("usagePercent", alert.getUsagePercent()));
            alerts.dispatch(alert);
        }
        return raised;
    }

    /** Spend counted against the budget in its current window. */
    public synchronized double getCurrentSpend(BudgetDefinition budget) {
        Preconditions.checkNotNull(budget, "budget must not be null");
        return status(budget, clock.instant()).getCurrentSpend();
    }

    public synchronized List<BudgetStatus> getBudgetStatuses() {
        Instant now = clock.instant();
        return config.getBudgets().stream()
                .map(budget -> status(budget, now))
                .collect(ImmutableList.toImmutableList());
    }

    /** Totals for every entry with a timestamp between {@code start} and {@code end}, both inclusive. */
    public synchronized UsageReport generateUsageReport(Instant start, Instant end) {
        Preconditions.checkNotNull(start, "start must not be null");
        Preconditions.checkNotNull(end, "end must not be null");
        Preconditions.checkArgument(
                !end.isBefore(start),
                "end must not be before start",
                SafeArg.of("start", start),
                SafeArg.of("end", end));

        List<CostEntry> inRange = entries.stream()
                .filter(entry -> !entry.getTimestamp().isBefore(start)
                        && !entry.getTimestamp().isAfter(end))
                .collect(ImmutableList.toImmutableList());

        double total = 0;
        Map<String, Double> byService = new TreeMap<>();
        Map<String, Double> byProduct = new TreeMap<>();
        for (CostEntry entry : inRange) {
            total += entry.getAmount();
            byService.merge(entry.getService(), entry.getAmount(), Double::sum);
            entry.getProduct().ifPresent(product -> byProduct.merge(product, entry.getAmount(), Double::sum));
        }

        return UsageReport.builder()
                .startDate(start)
                .endDate(end)
                .totalSpend(total)
                .currency(config.getDefaultCurrency())
                .byService(ImmutableMap.copyOf(byService))
                .byProduct(ImmutableMap.copyOf(byProduct))
                .entries(inRange)
                .build();
    }

    /**
     * Forgets every entry with a timestamp before {@code cutoff}. Later budget evaluations and usage reports no longer
     * count them. Returns the number of entries removed.
     */
    @CanIgnoreReturnValue
    public synchronized int pruneEntriesBefore(Instant cutoff) {
        Preconditions.checkNotNull(cutoff, "cutoff must not be null");
        int before = entries.size();
        entries.removeIf(entry -> entry.getTimestamp().isBefore(cutoff));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("Pruned cost entries", SafeArg.of("removed", removed), SafeArg.of("cutoff", cutoff));
        }
        return removed;
    }

    @Nullable
    public AlertHandler<? super BudgetAlert> subscribe(String name, AlertHandler<? super BudgetAlert> handler) {
        return alerts.subscribe(name, handler);
    }

    @Nullable
    public AlertHandler<? super BudgetAlert> unsubscribe(String name) {
        return alerts.unsubscribe(name);
    }

    public List<HandlerFailure> drainHandlerFailures() {
        return alerts.drainFailures();
    }

    private BudgetStatus status(BudgetDefinition budget, Instant now) {
        Instant windowStart = BudgetWindows.windowStart(budget.getPeriod(), now, clock.getZone());
        Instant windowEnd = BudgetWindows.windowEnd(budget.getPeriod(), windowStart, clock.getZone());
        double spend = 0;
        for (CostEntry entry : entries) {
            if (budget.covers(entry.getService(), entry.getProduct())
                    && !entry.getTimestamp().isBefore(windowStart)
                    && entry.getTimestamp().isBefore(windowEnd)) {
                spend += entry.getAmount();
            }
        }
        return BudgetStatus.builder()
                .budget(budget)
                .periodStart(windowStart)
                .currentSpend(spend)
                .build();
    }

    private static BudgetAlert toAlert(BudgetStatus status, Instant now) {
        BudgetDefinition budget = status.getBudget();
        return BudgetAlert.builder()
                .service(budget.getService())
                .product(budget.getProduct())
                .currentSpend(status.getCurrentSpend())
                .budgetLimit(budget.getLimit())
                .usagePercent(status.getCurrentSpend() * 100 / budget.getLimit())
                .threshold(budget.getAlertThreshold())
                .period(budget.getPeriod())
                .periodStart(status.getPeriodStart())
                .timestamp(now)
                .build();
    }
}
