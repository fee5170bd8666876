package io.marketlens.analytics.pipeline;

import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.streaming.util.KeyedOneInputStreamOperatorTestHarness;
import org.apache.flink.streaming.util.ProcessFunctionTestHarnesses;
import org.apache.flink.util.OutputTag;
import org.junit.jupiter.api.Test;

import io.marketlens.analytics.config.PipelineConfig;
import io.marketlens.analytics.model.AdSpendFact;
import io.marketlens.analytics.model.CampaignPerformanceFact;
import io.marketlens.analytics.model.StagedAdRow;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CampaignFactUpsertFunctionTest {

    @Test
    void lateCorrectionReplacesCampaignTotal() throws Exception {
        OutputTag<AdSpendFact> adSpendTag = new OutputTag<AdSpendFact>("ad-spend"){};
        CampaignFactUpsertFunction function =
                new CampaignFactUpsertFunction(PipelineConfig.fromMap(Map.of()), adSpendTag);

        try (KeyedOneInputStreamOperatorTestHarness<String, StagedAdRow, CampaignPerformanceFact> harness =
                ProcessFunctionTestHarnesses.forKeyedProcessFunction(
                        function,
                        StagedAdRow::campaignDateKey,
                        Types.STRING)) {

            harness.open();

            harness.processElement(row("ad-1", "i1", 100L, "10.00"), 0L);
            harness.processElement(row("ad-2", "i2", 100L, "5.00"), 0L);
            harness.processElement(row("ad-1", "i3", 200L, "12.00"), 0L);

            List<CampaignPerformanceFact> facts = harness.extractOutputValues();
            assertEquals(3, facts.size());
            assertEquals(0, new BigDecimal("10.00").compareTo(facts.get(0).spend));
            assertEquals(0, new BigDecimal("15.00").compareTo(facts.get(1).spend));
            assertEquals(0, new BigDecimal("17.00").compareTo(facts.get(2).spend));
            assertEquals(3, harness.getSideOutput(adSpendTag).size());
        }
    }

    @Test
    void staleEmissionIsIgnored() throws Exception {
        OutputTag<AdSpendFact> adSpendTag = new OutputTag<AdSpendFact>("ad-spend"){};
        CampaignFactUpsertFunction function =
                new CampaignFactUpsertFunction(PipelineConfig.fromMap(Map.of()), adSpendTag);

        try (KeyedOneInputStreamOperatorTestHarness<String, StagedAdRow, CampaignPerformanceFact> harness =
                ProcessFunctionTestHarnesses.forKeyedProcessFunction(
                        function,
                        StagedAdRow::campaignDateKey,
                        Types.STRING)) {

            harness.open();

            harness.processElement(row("ad-1", "i2", 200L, "12.00"), 0L);
            harness.processElement(row("ad-1", "i1", 100L, "10.00"), 0L);
            harness.processElement(row("ad-1", "i2", 200L, "12.00"), 0L);

            List<CampaignPerformanceFact> facts = harness.extractOutputValues();
            assertEquals(1, facts.size());
            assertEquals(0, new BigDecimal("12.00").compareTo(facts.get(0).spend));
            assertEquals(1, harness.getSideOutput(adSpendTag).size());
        }
    }

    private static StagedAdRow row(String adId, String ingestionId, long emittedAt, String spend) {
        StagedAdRow row = new StagedAdRow();
        row.tenantId = "tenant-a";
        row.platform = "meta_ads";
        row.reportDate = LocalDate.of(2024, 3, 5);
        row.platformAccountId = "act-1";
        row.platformCampaignId = "cmp-1";
        row.platformAdId = adId;
        row.canonicalChannel = "paid_social";
        row.spend = new BigDecimal(spend);
        row.impressions = 1000;
        row.clicks = 10;
        row.ingestionId = ingestionId;
        row.emittedAtMillis = emittedAt;
        return row;
    }
}
