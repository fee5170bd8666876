package io.marketlens.analytics.attribution;

import io.marketlens.analytics.model.CampaignPerformanceFact;
import io.marketlens.analytics.model.OrderFact;

import java.util.Objects;

/**
 * An order's last-click campaign, or the absence of one.
 */
public final class LastClickAssignment {
    private final OrderFact order;
    private final CampaignPerformanceFact campaign;

    private LastClickAssignment(OrderFact order, CampaignPerformanceFact campaign) {
        this.order = Objects.requireNonNull(order, "order");
        this.campaign = campaign;
    }

    public static LastClickAssignment attributed(OrderFact order, CampaignPerformanceFact campaign) {
        return new LastClickAssignment(order, Objects.requireNonNull(campaign, "campaign"));
    }

    public static LastClickAssignment unattributed(OrderFact order) {
        return new LastClickAssignment(order, null);
    }

    public OrderFact order() {
        return order;
    }

    /**
     * @return the assigned campaign fact, or null for an unattributed order
     */
    public CampaignPerformanceFact campaign() {
        return campaign;
    }

    public boolean isAttributed() {
        return campaign != null;
    }
}
