package com.relaygate.cost;

import com.relaygate.config.GatewayProperties;
import com.relaygate.metrics.GatewayMetrics;
import com.relaygate.model.ComplexityClass;
import com.relaygate.model.CostTier;
import com.relaygate.model.ProviderDescriptor;
import com.relaygate.model.UsageRecord;
import com.relaygate.model.dto.CostProjection;
import com.relaygate.model.dto.CostSummary;
import com.relaygate.registry.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Estimates call cost, records actual usage and aggregates spend.
 *
 * Month-to-date tenant totals and per-provider daily totals are kept apart from the
 * bounded usage log, so trimming the log never changes what the guardrail sees.
 * Calendar boundaries are UTC.
 */
@Slf4j
@Service
public class CostTracker {

    private static final double ALERT_THRESHOLD = 0.90;

    private final GatewayProperties.BudgetConfig config;
    private final ProviderRegistry registry;
    private final GatewayMetrics metrics;
    private final Clock clock;
    private final UsageLog usageLog;

    /** month -> tenant -> spend; only the current month is kept */
    private final ConcurrentMap<YearMonth, ConcurrentMap<String, DoubleAdder>> tenantMonthTotals = new ConcurrentHashMap<>();
    /** day -> provider -> spend; only the current day is kept */
    private final ConcurrentMap<LocalDate, ConcurrentMap<String, DoubleAdder>> providerDayTotals = new ConcurrentHashMap<>();
    private final ConcurrentMap<LocalDate, Set<String>> raisedAlerts = new ConcurrentHashMap<>();

    public CostTracker(GatewayProperties properties,
                       ProviderRegistry registry,
                       GatewayMetrics metrics,
                       Clock clock) {
        this.config = properties.getBudget();
        this.registry = registry;
        this.metrics = metrics;
        this.clock = clock;
        this.usageLog = new UsageLog(config.getUsageRetention());
    }

    /**
     * Estimated cost of one call to a provider for a prompt of the given complexity.
     *
     * @throws IllegalArgumentException for an unknown provider
     */
    public double estimate(String providerId, ComplexityClass complexity) {
        return estimate(requireProvider(providerId), complexity.getCostTier());
    }

    public double estimate(ProviderDescriptor provider, ComplexityClass complexity) {
        return estimate(provider, complexity.getCostTier());
    }

    public double estimate(ProviderDescriptor provider, CostTier tier) {
        return baseUnitCost(provider) * tier.getMultiplier();
    }

    /**
     * Cost of {@code estimate-units} split evenly between input and output.
     */
    public double baseUnitCost(ProviderDescriptor provider) {
        double half = config.getEstimateUnits() / 2.0;
        return costOf(provider, half, half);
    }

    /**
     * Actual cost of a completed call.
     */
    public double costOf(ProviderDescriptor provider, double inputUnits, double outputUnits) {
        return (inputUnits / 1000.0) * provider.getPriceInputPer1k()
                + (outputUnits / 1000.0) * provider.getPriceOutputPer1k();
    }

    /**
     * Append a usage record and roll it into the tenant and provider totals.
     */
    public void record(UsageRecord record) {
        usageLog.append(record);

        YearMonth month = YearMonth.from(record.getTimestamp().atZone(ZoneOffset.UTC));
        tenantMonthTotals.computeIfAbsent(month, m -> new ConcurrentHashMap<>())
                .computeIfAbsent(record.getTenantId(), k -> new DoubleAdder())
                .add(record.getCostUSD());

        LocalDate day = LocalDate.ofInstant(record.getTimestamp(), ZoneOffset.UTC);
        DoubleAdder daySpend = providerDayTotals.computeIfAbsent(day, d -> new ConcurrentHashMap<>())
                .computeIfAbsent(record.getProviderId(), k -> new DoubleAdder());
        daySpend.add(record.getCostUSD());

        metrics.recordUsage(record.getTenantId(), record.getInputUnits(), record.getOutputUnits(),
                record.getCostUSD());
        checkProviderLimit(day, record.getProviderId(), daySpend.sum());
        pruneExpiredPeriods();

        log.debug("Cost tracked: tenant={}, provider={}, cost=${}",
                record.getTenantId(), record.getProviderId(), String.format("%.6f", record.getCostUSD()));
    }

    public double monthToDateSpend(String tenantId) {
        Map<String, DoubleAdder> totals = tenantMonthTotals.get(currentMonth());
        DoubleAdder total = totals == null ? null : totals.get(tenantId);
        return total == null ? 0.0 : total.sum();
    }

    public double todaySpend(String providerId) {
        Map<String, DoubleAdder> totals = providerDayTotals.get(today());
        DoubleAdder total = totals == null ? null : totals.get(providerId);
        return total == null ? 0.0 : total.sum();
    }

    /**
     * Whether a provider has used up its configured daily limit. Providers without a
     * limit are never exhausted.
     */
    public boolean isProviderBudgetExhausted(String providerId) {
        Double limit = config.getProviderDailyLimits().get(providerId);
        if (limit == null) {
            return false;
        }
        return todaySpend(providerId) >= limit;
    }

    public CostSummary summary(UsagePeriod period) {
        Instant from = clock.instant().minus(period.getLength());
        List<UsageRecord> recent = usageLog.since(from);

        Map<String, CostSummary.ProviderUsage> byProvider = new LinkedHashMap<>();
        double total = 0.0;
        for (UsageRecord record : recent) {
            CostSummary.ProviderUsage usage = byProvider.computeIfAbsent(record.getProviderId(),
                    id -> new CostSummary.ProviderUsage(0.0, 0, 0));
            usage.setCost(usage.getCost() + record.getCostUSD());
            usage.setCalls(usage.getCalls() + 1);
            usage.setUnits(usage.getUnits() + record.totalUnits());
            total += record.getCostUSD();
        }

        return CostSummary.builder()
                .period(period.name().toLowerCase())
                .total(total)
                .callCount(recent.size())
                .avgCostPerCall(recent.isEmpty() ? 0.0 : total / recent.size())
                .byProvider(byProvider)
                .build();
    }

    public CostProjection projection() {
        double hourly = summary(UsagePeriod.HOUR).getTotal();
        double daily = summary(UsagePeriod.DAY).getTotal();

        return CostProjection.builder()
                .nextHour(hourly)
                .nextDay(hourly * 24)
                .nextWeek(daily * 7)
                .nextMonth(daily * 30)
                .build();
    }

    public UsageLog getUsageLog() {
        return usageLog;
    }

    private void checkProviderLimit(LocalDate day, String providerId, double spent) {
        Double limit = config.getProviderDailyLimits().get(providerId);
        if (limit == null || limit <= 0) {
            return;
        }

        Set<String> alerts = raisedAlerts.computeIfAbsent(day, d -> ConcurrentHashMap.newKeySet());
        double fraction = spent / limit;
        if (fraction >= 1.0 && alerts.add(providerId + ":100")) {
            log.error("Provider {} exceeded its daily limit (${}/${}), excluded from routing until {}",
                    providerId, String.format("%.2f", spent), String.format("%.2f", limit), day.plusDays(1));
        } else if (fraction >= ALERT_THRESHOLD && alerts.add(providerId + ":90")) {
            log.warn("Provider {} at {}% of its daily limit", providerId, String.format("%.1f", fraction * 100));
        }
    }

    private ProviderDescriptor requireProvider(String providerId) {
        return registry.get(providerId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + providerId));
    }

    /**
     * Drop totals and alert markers of past days and months. Nothing reads them once
     * their period has rolled over.
     */
    void pruneExpiredPeriods() {
        YearMonth month = currentMonth();
        LocalDate today = today();
        tenantMonthTotals.keySet().removeIf(m -> m.isBefore(month));
        providerDayTotals.keySet().removeIf(d -> d.isBefore(today));
        raisedAlerts.keySet().removeIf(d -> d.isBefore(today));
    }

    int trackedPeriods() {
        return tenantMonthTotals.size() + providerDayTotals.size() + raisedAlerts.size();
    }

    private YearMonth currentMonth() {
        return YearMonth.now(clock.withZone(ZoneOffset.UTC));
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }
}
