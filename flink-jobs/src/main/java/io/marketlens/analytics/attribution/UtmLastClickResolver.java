package io.marketlens.analytics.attribution;

import io.marketlens.analytics.model.CampaignPerformanceFact;
import io.marketlens.analytics.model.OrderFact;
import io.marketlens.analytics.util.StringSemantics;

import java.io.Serializable;
import java.util.Comparator;
import java.util.List;

/**
 * Matches an order's {@code utm_campaign} against campaign ids and names, case-insensitively.
 *
 * <p>Among matching campaign-date rows on or before the order date, the most recent date wins,
 * then the higher spend, then the lower campaign id.</p>
 */
public class UtmLastClickResolver implements LastClickResolver, Serializable {
    private static final long serialVersionUID = 1L;

    private static final Comparator<CampaignPerformanceFact> PREFERENCE = Comparator
            .comparing((CampaignPerformanceFact fact) -> fact.performanceDate)
            .thenComparing(fact -> fact.spend)
            .thenComparing(fact -> fact.campaignId, Comparator.reverseOrder());

    @Override
    public LastClickAssignment resolve(OrderFact order, List<CampaignPerformanceFact> tenantCampaigns) {
        String utmCampaign = StringSemantics.trimToNull(order.utmCampaign);
        if (utmCampaign == null || order.orderDate == null) {
            return LastClickAssignment.unattributed(order);
        }
        CampaignPerformanceFact best = null;
        for (CampaignPerformanceFact fact : tenantCampaigns) {
            if (!order.tenantId.equals(fact.tenantId)
                    || fact.performanceDate == null
                    || fact.performanceDate.isAfter(order.orderDate)
                    || !matches(utmCampaign, fact)) {
                continue;
            }
            if (best == null || PREFERENCE.compare(fact, best) > 0) {
                best = fact;
            }
        }
        return best == null ? LastClickAssignment.unattributed(order) : LastClickAssignment.attributed(order, best);
    }

    private static boolean matches(String utmCampaign, CampaignPerformanceFact fact) {
        return utmCampaign.equalsIgnoreCase(fact.campaignId)
                || (fact.campaignName != null && utmCampaign.equalsIgnoreCase(fact.campaignName.trim()));
    }
}
