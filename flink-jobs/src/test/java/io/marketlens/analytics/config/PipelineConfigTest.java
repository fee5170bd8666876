package io.marketlens.analytics.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigTest {

    @Test
    void defaultsApplyWhenNothingIsSet() {
        PipelineConfig config = PipelineConfig.fromMap(Map.of());

        assertEquals(3, config.defaultLookbackDays);
        assertEquals(7, config.attributionWindowDays);
        assertEquals(0.5, config.timeDecayRate, 1e-12);
        assertEquals(1.0, config.reconciliationTolerancePct, 1e-12);
        assertEquals(1440, config.dedupTtlMinutes);
        assertNull(config.tenantRegistryPath);
        assertEquals(3, config.lookbackDays("meta_ads"));
    }

    @Test
    void perSourceLookbackOverridesDefault() {
        PipelineConfig config = PipelineConfig.fromMap(Map.of(
                "MARKETLENS_DEFAULT_LOOKBACK_DAYS", "2",
                "MARKETLENS_LOOKBACK_DAYS", "meta_ads=7, google_ads = 5,broken,tiktok_ads=x"));

        assertEquals(7, config.lookbackDays("meta_ads"));
        assertEquals(5, config.lookbackDays("google_ads"));
        assertEquals(2, config.lookbackDays("tiktok_ads"));
        assertEquals(2, config.lookbackDays(null));
    }

    @Test
    void unparseableNumbersFallBackToDefaults() {
        PipelineConfig config = PipelineConfig.fromMap(Map.of(
                "MARKETLENS_ATTRIBUTION_WINDOW_DAYS", "seven",
                "MARKETLENS_TIME_DECAY_RATE", "0.25",
                "MARKETLENS_MERGE_PARALLELISM", "0"));

        assertEquals(7, config.attributionWindowDays);
        assertEquals(0.25, config.timeDecayRate, 1e-12);
        assertEquals(1, config.mergeParallelism);
    }
}
