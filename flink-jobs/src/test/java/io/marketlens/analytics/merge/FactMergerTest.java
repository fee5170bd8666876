package io.marketlens.analytics.merge;

import org.junit.jupiter.api.Test;

import io.marketlens.analytics.model.AdSpendFact;
import io.marketlens.analytics.model.CampaignPerformanceFact;
import io.marketlens.analytics.model.OrderFact;
import io.marketlens.analytics.model.StagedAdRow;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class FactMergerTest {

    @Test
    void latestStagedPrefersLaterEmissionThenIngestionId() {
        StagedAdRow early = staged("a", 100L);
        StagedAdRow late = staged("a", 200L);
        StagedAdRow tieHigherId = staged("b", 200L);

        assertSame(late, FactMerger.latestStaged(early, late));
        assertSame(late, FactMerger.latestStaged(late, early));
        assertSame(tieHigherId, FactMerger.latestStaged(late, tieHigherId));
        assertSame(late, FactMerger.latestStaged(late, staged("a", 200L)));
    }

    @Test
    void olderOrderEmissionNeverReplacesNewer() {
        OrderFact existing = order(200L, "paid");
        OrderFact incoming = order(100L, "pending");

        assertSame(existing, FactMerger.mergeOrder(existing, incoming));
    }

    @Test
    void openOrderIsReplacedByNewerEmission() {
        OrderFact existing = order(100L, "pending");
        OrderFact incoming = order(200L, "paid");
        incoming.revenueGross = new BigDecimal("95.00");

        assertSame(incoming, FactMerger.mergeOrder(existing, incoming));
    }

    @Test
    void finalizedOrderKeepsAttributesButTakesStatusUpdates() {
        OrderFact existing = order(100L, "paid");
        existing.closedAt = Instant.parse("2024-03-06T00:00:00Z");
        OrderFact incoming = order(200L, "refunded");
        incoming.revenueGross = new BigDecimal("1.00");
        incoming.utmCampaign = "rewritten";
        incoming.updatedAt = Instant.parse("2024-03-07T00:00:00Z");
        incoming.cancelledAt = Instant.parse("2024-03-07T00:00:00Z");
        incoming.validOrder = false;

        OrderFact merged = FactMerger.mergeOrder(existing, incoming);

        assertNotSame(existing, merged);
        assertEquals(0, new BigDecimal("90.00").compareTo(merged.revenueGross));
        assertEquals("c1", merged.utmCampaign);
        assertEquals("refunded", merged.financialStatus);
        assertFalse(merged.validOrder);
        assertEquals(incoming.cancelledAt, merged.cancelledAt);
        assertEquals(existing.closedAt, merged.closedAt);
        assertEquals(incoming.updatedAt, merged.updatedAt);
        assertEquals(200L, merged.ingestedAtMillis);
        assertEquals("paid", existing.financialStatus);
    }

    @Test
    void olderCampaignAggregateNeverReplacesNewer() {
        CampaignPerformanceFact newer = campaignFact(2000L, "150");
        CampaignPerformanceFact older = campaignFact(1000L, "100");

        assertSame(newer, FactMerger.mergeCampaign(newer, older));
        assertSame(newer, FactMerger.mergeCampaign(older, newer));
    }

    @Test
    void campaignAggregateWithSameWatermarkButNewContentReplaces() {
        CampaignPerformanceFact stored = campaignFact(2000L, "150");
        CampaignPerformanceFact widened = campaignFact(2000L, "170");

        assertSame(widened, FactMerger.mergeCampaign(stored, widened));
        assertSame(stored, FactMerger.mergeCampaign(stored, campaignFact(2000L, "150.00")));
    }

    @Test
    void olderAdSpendNeverReplacesNewer() {
        AdSpendFact newer = new AdSpendFact();
        newer.ingestedAtMillis = 2000L;
        newer.spend = new BigDecimal("150");
        AdSpendFact older = new AdSpendFact();
        older.ingestedAtMillis = 1000L;
        older.spend = new BigDecimal("100");

        assertSame(newer, FactMerger.mergeAdSpend(newer, older));
    }

    private static CampaignPerformanceFact campaignFact(long ingestedAt, String spend) {
        CampaignPerformanceFact fact = new CampaignPerformanceFact();
        fact.id = "campaign-key";
        fact.tenantId = "tenant-a";
        fact.spend = new BigDecimal(spend);
        fact.ingestedAtMillis = ingestedAt;
        return fact;
    }

    private static StagedAdRow staged(String ingestionId, long emittedAt) {
        StagedAdRow row = new StagedAdRow();
        row.ingestionId = ingestionId;
        row.emittedAtMillis = emittedAt;
        return row;
    }

    private static OrderFact order(long ingestedAt, String financialStatus) {
        OrderFact order = new OrderFact();
        order.id = "order-key";
        order.tenantId = "tenant-a";
        order.orderId = "1001";
        order.revenueGross = new BigDecimal("90.00");
        order.utmCampaign = "c1";
        order.financialStatus = financialStatus;
        order.validOrder = "paid".equals(financialStatus);
        order.ingestedAtMillis = ingestedAt;
        return order;
    }
}
