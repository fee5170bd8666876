package io.marketlens.analytics.attribution;

import io.marketlens.analytics.model.CampaignPerformanceFact;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Campaign performance facts grouped by tenant and sorted by date, for window lookups.
 */
public final class CampaignActivityIndex {
    private static final Comparator<CampaignPerformanceFact> BY_DATE = Comparator
            .comparing((CampaignPerformanceFact fact) -> fact.performanceDate)
            .thenComparing(fact -> fact.platform)
            .thenComparing(fact -> fact.campaignId);

    private final Map<String, List<CampaignPerformanceFact>> byTenant = new HashMap<>();

    public CampaignActivityIndex(Collection<CampaignPerformanceFact> facts) {
        for (CampaignPerformanceFact fact : facts) {
            if (fact.tenantId == null || fact.performanceDate == null || fact.campaignId == null
                    || fact.platform == null) {
                continue;
            }
            byTenant.computeIfAbsent(fact.tenantId, k -> new ArrayList<>()).add(fact);
        }
        for (List<CampaignPerformanceFact> tenantFacts : byTenant.values()) {
            tenantFacts.sort(BY_DATE);
        }
    }

    public List<CampaignPerformanceFact> forTenant(String tenantId) {
        return byTenant.getOrDefault(tenantId, List.of());
    }

    /**
     * Rows of the tenant with spend above zero dated in {@code [orderDate - windowDays, orderDate]},
     * ordered by date.
     */
    public List<WindowEntry> windowEntries(String tenantId, LocalDate orderDate, int windowDays) {
        List<WindowEntry> entries = new ArrayList<>();
        if (orderDate == null) {
            return entries;
        }
        LocalDate windowStart = orderDate.minusDays(windowDays);
        for (CampaignPerformanceFact fact : forTenant(tenantId)) {
            if (fact.performanceDate.isBefore(windowStart)) {
                continue;
            }
            if (fact.performanceDate.isAfter(orderDate)) {
                break;
            }
            if (fact.spend != null && fact.spend.signum() > 0) {
                int days = (int) ChronoUnit.DAYS.between(fact.performanceDate, orderDate);
                entries.add(new WindowEntry(fact, days));
            }
        }
        return entries;
    }
}
