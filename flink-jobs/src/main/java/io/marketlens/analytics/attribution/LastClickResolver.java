package io.marketlens.analytics.attribution;

import io.marketlens.analytics.model.CampaignPerformanceFact;
import io.marketlens.analytics.model.OrderFact;

import java.util.List;

/**
 * Assigns an order to its last-click campaign.
 *
 * <p>Implementations receive only the campaign facts of the order's own tenant.</p>
 */
public interface LastClickResolver {
    LastClickAssignment resolve(OrderFact order, List<CampaignPerformanceFact> tenantCampaigns);
}
