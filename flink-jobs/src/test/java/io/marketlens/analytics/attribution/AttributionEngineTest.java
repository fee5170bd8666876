package io.marketlens.analytics.attribution;

import org.junit.jupiter.api.Test;

import io.marketlens.analytics.model.AttributionRecord;
import io.marketlens.analytics.model.CampaignPerformanceFact;
import io.marketlens.analytics.model.OrderFact;
import io.marketlens.analytics.util.IdentifierNormalizer;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AttributionEngineTest {

    private static final LocalDate ORDER_DATE = LocalDate.of(2024, 3, 10);

    private final AttributionEngine engine = new AttributionEngine(AttributionSettings.defaults(), new UtmLastClickResolver());

    @Test
    void singleCampaignInWindowGetsFullCredit() {
        OrderFact order = order("tenant-a", "o1", "100.00", "c1");
        List<AttributionRecord> records = engine.attribute(
                List.of(order), List.of(campaign("tenant-a", "c1", ORDER_DATE.minusDays(2), "50")));

        assertEquals(3, records.size());
        for (String model : List.of("last_click", "multi_touch_linear", "time_decay")) {
            AttributionRecord record = only(records, model);
            assertEquals("c1", record.campaignId);
            assertEquals(1.0, record.attributionWeight, 1e-9);
            assertEquals(new BigDecimal("100.0000"), record.attributedRevenue);
            assertEquals(AttributionRecord.STATUS_ATTRIBUTED, record.attributionStatus);
            assertEquals(1, record.totalCampaignsInWindow);
        }
    }

    @Test
    void twoCampaignsSplitLinearlyAndByDecay() {
        OrderFact order = order("tenant-a", "o1", "90.00", "c2");
        List<AttributionRecord> records = engine.attribute(List.of(order), List.of(
                campaign("tenant-a", "c1", ORDER_DATE.minusDays(3), "20"),
                campaign("tenant-a", "c2", ORDER_DATE.minusDays(1), "30")));

        List<AttributionRecord> linear = byModel(records, "multi_touch_linear");
        assertEquals(2, linear.size());
        for (AttributionRecord record : linear) {
            assertEquals(0.5, record.attributionWeight, 1e-9);
            assertEquals(new BigDecimal("45.0000"), record.attributedRevenue);
            assertEquals(2, record.totalCampaignsInWindow);
        }

        double raw1 = Math.exp(-0.5 * 3);
        double raw2 = Math.exp(-0.5 * 1);
        AttributionRecord c1 = find(records, "time_decay", "c1");
        AttributionRecord c2 = find(records, "time_decay", "c2");
        assertEquals(raw1 / (raw1 + raw2), c1.attributionWeight, 1e-9);
        assertEquals(raw2 / (raw1 + raw2), c2.attributionWeight, 1e-9);
        assertEquals(0.2689, c1.attributionWeight, 1e-4);
        assertEquals(0.7311, c2.attributionWeight, 1e-4);
        assertEquals(new BigDecimal("24.2047"), c1.attributedRevenue);
        assertEquals(new BigDecimal("65.7953"), c2.attributedRevenue);
        assertEquals(3, c1.daysBeforeOrder.intValue());
        assertEquals(1, c2.daysBeforeOrder.intValue());

        AttributionRecord lastClick = only(records, "last_click");
        assertEquals("c2", lastClick.campaignId);
    }

    @Test
    void weightsSumToOnePerOrderAndModel() {
        List<CampaignPerformanceFact> campaigns = new ArrayList<>();
        for (int day = 0; day <= 7; day++) {
            campaigns.add(campaign("tenant-a", "c" + (day % 3), ORDER_DATE.minusDays(day), "10"));
        }
        List<AttributionRecord> records = engine.attribute(List.of(order("tenant-a", "o1", "77.77", "c0")), campaigns);

        for (String model : List.of("multi_touch_linear", "time_decay")) {
            double sum = 0.0;
            BigDecimal revenue = BigDecimal.ZERO;
            for (AttributionRecord record : byModel(records, model)) {
                sum += record.attributionWeight;
                revenue = revenue.add(record.attributedRevenue);
                assertEquals(8, record.windowEntries);
                assertEquals(3, record.totalCampaignsInWindow);
            }
            assertEquals(1.0, sum, 1e-4);
            assertEquals(77.77, revenue.doubleValue(), 0.0005);
        }
    }

    @Test
    void entriesOfOneCampaignCollapseIntoOneRecord() {
        List<AttributionRecord> records = engine.attribute(List.of(order("tenant-a", "o1", "30.00", "c1")), List.of(
                campaign("tenant-a", "c1", ORDER_DATE.minusDays(2), "10"),
                campaign("tenant-a", "c1", ORDER_DATE.minusDays(1), "10"),
                campaign("tenant-a", "c2", ORDER_DATE, "10")));

        AttributionRecord c1 = find(records, "multi_touch_linear", "c1");
        assertEquals(2.0 / 3.0, c1.attributionWeight, 1e-9);
        assertEquals(new BigDecimal("20.0000"), c1.attributedRevenue);
        assertEquals(1, c1.daysBeforeOrder.intValue());
        assertEquals(ORDER_DATE.minusDays(1), c1.campaignPerformanceDate);
        assertEquals(3, c1.windowEntries);
        assertEquals(2, c1.totalCampaignsInWindow);

        Set<String> ids = new HashSet<>();
        for (AttributionRecord record : records) {
            assertTrue(ids.add(record.id), "duplicate record id " + record.id);
        }
    }

    @Test
    void laterEntriesEarnMoreUnderTimeDecay() {
        TimeDecayAttribution decay = new TimeDecayAttribution(0.5);
        CampaignPerformanceFact fact = campaign("tenant-a", "c1", ORDER_DATE, "1");

        double previous = Double.MAX_VALUE;
        for (int days = 0; days <= 7; days++) {
            double weight = decay.rawWeight(new WindowEntry(fact, days));
            assertTrue(weight < previous);
            previous = weight;
        }
    }

    @Test
    void zeroSpendAndOutOfWindowRowsAreNotEntries() {
        List<AttributionRecord> records = engine.attribute(List.of(order("tenant-a", "o1", "50.00", "c1")), List.of(
                campaign("tenant-a", "c1", ORDER_DATE.minusDays(1), "10"),
                campaign("tenant-a", "c2", ORDER_DATE.minusDays(1), "0"),
                campaign("tenant-a", "c3", ORDER_DATE.minusDays(8), "10"),
                campaign("tenant-a", "c4", ORDER_DATE.plusDays(1), "10")));

        List<AttributionRecord> linear = byModel(records, "multi_touch_linear");
        assertEquals(1, linear.size());
        assertEquals("c1", linear.get(0).campaignId);
        assertEquals(1, linear.get(0).windowEntries);
    }

    @Test
    void emptyWindowFallsBackToLastClickCampaign() {
        List<AttributionRecord> records = engine.attribute(List.of(order("tenant-a", "o1", "60.00", "c1")),
                List.of(campaign("tenant-a", "c1", ORDER_DATE.minusDays(20), "10")));

        for (String model : List.of("multi_touch_linear", "time_decay")) {
            AttributionRecord record = only(records, model);
            assertEquals("c1", record.campaignId);
            assertEquals(1.0, record.attributionWeight, 1e-9);
            assertEquals(new BigDecimal("60.0000"), record.attributedRevenue);
            assertEquals(1, record.totalCampaignsInWindow);
            assertEquals(20, record.daysBeforeOrder.intValue());
        }
    }

    @Test
    void orderWithoutLastClickIsUnattributed() {
        List<AttributionRecord> records = engine.attribute(List.of(order("tenant-a", "o1", "60.00", "unknown-campaign")),
                List.of(campaign("tenant-a", "c1", ORDER_DATE.minusDays(1), "10")));

        assertEquals(1, records.size());
        AttributionRecord record = records.get(0);
        assertEquals(AttributionRecord.STATUS_UNATTRIBUTED, record.attributionStatus);
        assertEquals("last_click", record.attributionModel);
        assertNull(record.campaignId);
        assertEquals(0.0, record.attributionWeight, 0.0);
        assertEquals(new BigDecimal("0.0000"), record.attributedRevenue);
        assertEquals(0, record.totalCampaignsInWindow);
        assertEquals(AttributionRecord.recordId("o1", AttributionRecord.NO_CAMPAIGN, "tenant-a", "last_click"), record.id);
    }

    @Test
    void otherTenantsCampaignsAreInvisible() {
        List<AttributionRecord> records = engine.attribute(List.of(order("tenant-a", "o1", "40.00", "c1")), List.of(
                campaign("tenant-a", "c1", ORDER_DATE.minusDays(1), "10"),
                campaign("tenant-b", "c9", ORDER_DATE.minusDays(1), "10"),
                campaign("tenant-b", "c1", ORDER_DATE, "10")));

        for (AttributionRecord record : records) {
            assertEquals("tenant-a", record.tenantId);
            assertEquals("c1", record.campaignId);
            assertEquals(1.0, record.attributionWeight, 1e-9);
        }
        assertEquals(ORDER_DATE.minusDays(1), only(records, "last_click").campaignPerformanceDate);
    }

    @Test
    void utmMatchesCampaignNameCaseInsensitively() {
        CampaignPerformanceFact fact = campaign("tenant-a", "c1", ORDER_DATE.minusDays(1), "10");
        fact.campaignName = "Spring Sale";
        OrderFact order = order("tenant-a", "o1", "10.00", "spring sale");

        LastClickAssignment assignment = new UtmLastClickResolver().resolve(order, List.of(fact));

        assertTrue(assignment.isAttributed());
        assertSame(fact, assignment.campaign());
    }

    @Test
    void sameNativeCampaignIdOnTwoPlatformsKeepsDistinctRecords() {
        CampaignPerformanceFact meta = campaign("tenant-a", "123", ORDER_DATE.minusDays(1), "10");
        CampaignPerformanceFact google = campaign("tenant-a", "123", ORDER_DATE.minusDays(1), "10");
        google.platform = "google_ads";
        meta.internalCampaignId = IdentifierNormalizer.campaignId("tenant-a", meta.platform, "123");
        google.internalCampaignId = IdentifierNormalizer.campaignId("tenant-a", google.platform, "123");

        List<AttributionRecord> records = engine.attribute(
                List.of(order("tenant-a", "o1", "100.00", "123")), List.of(meta, google));

        assertEquals(5, records.size());
        Map<String, AttributionRecord> upserted = new HashMap<>();
        for (AttributionRecord record : records) {
            upserted.put(record.id, record);
        }
        assertEquals(5, upserted.size());

        double linearSum = 0.0;
        Set<String> linearPlatforms = new HashSet<>();
        for (AttributionRecord record : byModel(new ArrayList<>(upserted.values()), "multi_touch_linear")) {
            linearSum += record.attributionWeight;
            linearPlatforms.add(record.platform);
            assertEquals(2, record.totalCampaignsInWindow);
        }
        assertEquals(1.0, linearSum, 1e-9);
        assertEquals(Set.of("meta_ads", "google_ads"), linearPlatforms);
    }

    @Test
    void factsWithoutPlatformAreSkipped() {
        CampaignPerformanceFact orphan = campaign("tenant-a", "c2", ORDER_DATE.minusDays(2), "10");
        orphan.platform = null;

        List<AttributionRecord> records = engine.attribute(List.of(order("tenant-a", "o1", "50.00", "c1")), List.of(
                campaign("tenant-a", "c1", ORDER_DATE.minusDays(1), "10"),
                orphan));

        assertEquals(3, records.size());
        for (AttributionRecord record : records) {
            assertEquals("c1", record.campaignId);
            assertEquals(1.0, record.attributionWeight, 1e-9);
        }
    }

    @Test
    void settingsRejectNegativeValues() {
        assertThrows(IllegalArgumentException.class, () -> new AttributionSettings(-1, 0.5));
        assertThrows(IllegalArgumentException.class, () -> new AttributionSettings(7, -0.1));
    }

    private static OrderFact order(String tenantId, String orderId, String revenue, String utmCampaign) {
        OrderFact order = new OrderFact();
        order.tenantId = tenantId;
        order.orderId = orderId;
        order.id = OrderFact.surrogateKey(tenantId, orderId, "shop-1");
        order.orderDate = ORDER_DATE;
        order.createdAt = ORDER_DATE.atTime(12, 0).toInstant(ZoneOffset.UTC);
        order.revenueGross = new BigDecimal(revenue);
        order.currency = "USD";
        order.utmCampaign = utmCampaign;
        order.validOrder = true;
        return order;
    }

    private static CampaignPerformanceFact campaign(String tenantId, String campaignId, LocalDate date, String spend) {
        CampaignPerformanceFact fact = new CampaignPerformanceFact();
        fact.tenantId = tenantId;
        fact.platform = "meta_ads";
        fact.campaignId = campaignId;
        fact.campaignName = "Campaign " + campaignId;
        fact.performanceDate = date;
        fact.spend = new BigDecimal(spend);
        fact.id = CampaignPerformanceFact.surrogateKey(tenantId, fact.platform, campaignId, date);
        return fact;
    }

    private static List<AttributionRecord> byModel(List<AttributionRecord> records, String model) {
        List<AttributionRecord> matches = new ArrayList<>();
        for (AttributionRecord record : records) {
            if (model.equals(record.attributionModel)) {
                matches.add(record);
            }
        }
        return matches;
    }

    private static AttributionRecord only(List<AttributionRecord> records, String model) {
        List<AttributionRecord> matches = byModel(records, model);
        assertEquals(1, matches.size(), model);
        return matches.get(0);
    }

    private static AttributionRecord find(List<AttributionRecord> records, String model, String campaignId) {
        for (AttributionRecord record : byModel(records, model)) {
            if (campaignId.equals(record.campaignId)) {
                return record;
            }
        }
        fail("no " + model + " record for " + campaignId);
        return null;
    }
}
