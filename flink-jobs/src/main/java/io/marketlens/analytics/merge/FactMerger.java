package io.marketlens.analytics.merge;

import io.marketlens.analytics.model.AdSpendFact;
import io.marketlens.analytics.model.CampaignPerformanceFact;
import io.marketlens.analytics.model.OrderFact;
import io.marketlens.analytics.model.StagedAdRow;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Objects;

/**
 * Pure {@code merge(existing, incoming)} functions used for every upsert. Each returns the row to
 * store; returning {@code existing} itself means the stored row is unchanged.
 */
public final class FactMerger {
    /** Orders rows by emission time, then ingestion id, so the latest emission sorts last. */
    public static final Comparator<StagedAdRow> EMISSION_ORDER = Comparator
            .comparingLong((StagedAdRow row) -> row.emittedAtMillis)
            .thenComparing(row -> row.ingestionId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private FactMerger() {}

    /**
     * Latest emission wins; a replay of the stored emission keeps the stored row.
     */
    public static StagedAdRow latestStaged(StagedAdRow existing, StagedAdRow incoming) {
        return EMISSION_ORDER.compare(incoming, existing) > 0 ? incoming : existing;
    }

    /**
     * The incoming aggregate is recomputed from every staging row of the key, so it replaces the
     * stored metrics outright, unless it was built from older emissions than the stored row.
     */
    public static CampaignPerformanceFact mergeCampaign(CampaignPerformanceFact existing, CampaignPerformanceFact incoming) {
        if (incoming.ingestedAtMillis < existing.ingestedAtMillis) {
            return existing;
        }
        return sameCampaignContent(existing, incoming) ? existing : incoming;
    }

    public static AdSpendFact mergeAdSpend(AdSpendFact existing, AdSpendFact incoming) {
        if (incoming.ingestedAtMillis < existing.ingestedAtMillis) {
            return existing;
        }
        return sameAdSpendContent(existing, incoming) ? existing : incoming;
    }

    /**
     * Older emissions never replace newer ones. Once an order is finalized (cancelled or closed),
     * only its status fields and status timestamps follow later emissions.
     */
    public static OrderFact mergeOrder(OrderFact existing, OrderFact incoming) {
        if (incoming.ingestedAtMillis <= existing.ingestedAtMillis) {
            return existing;
        }
        if (!existing.isFinalized()) {
            return incoming;
        }
        OrderFact merged = existing.copy();
        merged.updatedAt = incoming.updatedAt != null ? incoming.updatedAt : existing.updatedAt;
        merged.cancelledAt = incoming.cancelledAt != null ? incoming.cancelledAt : existing.cancelledAt;
        merged.closedAt = incoming.closedAt != null ? incoming.closedAt : existing.closedAt;
        if (incoming.financialStatus != null) {
            merged.financialStatus = incoming.financialStatus;
            merged.validOrder = incoming.validOrder;
        }
        if (incoming.fulfillmentStatus != null) {
            merged.fulfillmentStatus = incoming.fulfillmentStatus;
        }
        merged.ingestedAtMillis = incoming.ingestedAtMillis;
        return merged;
    }

    private static boolean sameCampaignContent(CampaignPerformanceFact a, CampaignPerformanceFact b) {
        return a.ingestedAtMillis == b.ingestedAtMillis
                && a.impressions == b.impressions
                && a.clicks == b.clicks
                && sameAmount(a.spend, b.spend)
                && sameAmount(a.conversions, b.conversions)
                && sameAmount(a.conversionValue, b.conversionValue)
                && Objects.equals(a.campaignName, b.campaignName)
                && Objects.equals(a.canonicalChannel, b.canonicalChannel)
                && Objects.equals(a.currency, b.currency);
    }

    private static boolean sameAdSpendContent(AdSpendFact a, AdSpendFact b) {
        return a.ingestedAtMillis == b.ingestedAtMillis
                && a.impressions == b.impressions
                && a.clicks == b.clicks
                && sameAmount(a.spend, b.spend)
                && sameAmount(a.conversions, b.conversions)
                && sameAmount(a.conversionValue, b.conversionValue)
                && Objects.equals(a.canonicalChannel, b.canonicalChannel)
                && Objects.equals(a.currency, b.currency);
    }

    private static boolean sameAmount(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.compareTo(b) == 0;
    }
}
