package io.marketlens.analytics.config;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration for the merge, attribution and streaming pipeline, sourced from
 * environment variables.
 */
public class PipelineConfig implements java.io.Serializable {
    private static final long serialVersionUID = 1L;

    public final String kafkaBootstrap;
    public final String inputTopic;
    public final String dlqTopic;
    public final String quarantineTopic;
    public final String kafkaGroupId;
    public final String campaignFactTopic;
    public final String adSpendFactTopic;
    public final String orderFactTopic;
    public final int dedupTtlMinutes;
    public final int factStateTtlDays;

    public final int defaultLookbackDays;
    public final Map<String, Integer> lookbackDaysBySource;
    public final int mergeParallelism;

    public final int attributionWindowDays;
    public final double timeDecayRate;
    public final double reconciliationTolerancePct;

    public final String tenantRegistryPath;
    public final Duration metricsRateWindow;

    private PipelineConfig(
            String kafkaBootstrap,
            String inputTopic,
            String dlqTopic,
            String quarantineTopic,
            String kafkaGroupId,
            String campaignFactTopic,
            String adSpendFactTopic,
            String orderFactTopic,
            int dedupTtlMinutes,
            int factStateTtlDays,
            int defaultLookbackDays,
            Map<String, Integer> lookbackDaysBySource,
            int mergeParallelism,
            int attributionWindowDays,
            double timeDecayRate,
            double reconciliationTolerancePct,
            String tenantRegistryPath,
            Duration metricsRateWindow) {
        this.kafkaBootstrap = kafkaBootstrap;
        this.inputTopic = inputTopic;
        this.dlqTopic = dlqTopic;
        this.quarantineTopic = quarantineTopic;
        this.kafkaGroupId = kafkaGroupId;
        this.campaignFactTopic = campaignFactTopic;
        this.adSpendFactTopic = adSpendFactTopic;
        this.orderFactTopic = orderFactTopic;
        this.dedupTtlMinutes = dedupTtlMinutes;
        this.factStateTtlDays = factStateTtlDays;
        this.defaultLookbackDays = defaultLookbackDays;
        this.lookbackDaysBySource = lookbackDaysBySource;
        this.mergeParallelism = mergeParallelism;
        this.attributionWindowDays = attributionWindowDays;
        this.timeDecayRate = timeDecayRate;
        this.reconciliationTolerancePct = reconciliationTolerancePct;
        this.tenantRegistryPath = tenantRegistryPath;
        this.metricsRateWindow = metricsRateWindow;
    }

    public static PipelineConfig fromEnv() {
        return fromMap(System.getenv());
    }

    /**
     * Builds the configuration from an explicit variable map; missing or unparseable values fall
     * back to their defaults.
     */
    public static PipelineConfig fromMap(Map<String, String> vars) {
        String kafkaBootstrap = env(vars, "MARKETLENS_KAFKA_BOOTSTRAP", "kafka:9092");
        String inputTopic = env(vars, "MARKETLENS_INPUT_TOPIC", "marketing.raw_records.v1");
        String dlqTopic = env(vars, "MARKETLENS_DLQ_TOPIC", "marketing.dlq.raw_records.v1");
        String quarantineTopic = env(vars, "MARKETLENS_QUARANTINE_TOPIC", "marketing.quarantine.raw_records.v1");
        String kafkaGroupId = env(vars, "MARKETLENS_GROUP_ID", "flink-marketing-facts-v1");
        String campaignFactTopic = env(vars, "MARKETLENS_CAMPAIGN_FACT_TOPIC", "marketing.fact_campaign_performance.v1");
        String adSpendFactTopic = env(vars, "MARKETLENS_AD_SPEND_FACT_TOPIC", "marketing.fact_ad_spend.v1");
        String orderFactTopic = env(vars, "MARKETLENS_ORDER_FACT_TOPIC", "marketing.fact_orders.v1");
        int dedupTtlMinutes = envInt(vars, "MARKETLENS_DEDUP_TTL_MINUTES", 1440);
        int factStateTtlDays = envInt(vars, "MARKETLENS_FACT_STATE_TTL_DAYS", 120);

        int defaultLookbackDays = envInt(vars, "MARKETLENS_DEFAULT_LOOKBACK_DAYS", 3);
        Map<String, Integer> lookbackDaysBySource = envIntMap(vars, "MARKETLENS_LOOKBACK_DAYS");
        int mergeParallelism = Math.max(1, envInt(vars, "MARKETLENS_MERGE_PARALLELISM", 2));

        int attributionWindowDays = envInt(vars, "MARKETLENS_ATTRIBUTION_WINDOW_DAYS", 7);
        double timeDecayRate = envDouble(vars, "MARKETLENS_TIME_DECAY_RATE", 0.5);
        double reconciliationTolerancePct = envDouble(vars, "MARKETLENS_RECONCILIATION_TOLERANCE_PCT", 1.0);

        String tenantRegistryPath = env(vars, "MARKETLENS_TENANT_REGISTRY_PATH", null);
        Duration metricsRateWindow = Duration.ofSeconds(envInt(vars, "MARKETLENS_METRICS_RATE_WINDOW_SEC", 60));

        return new PipelineConfig(
                kafkaBootstrap,
                inputTopic,
                dlqTopic,
                quarantineTopic,
                kafkaGroupId,
                campaignFactTopic,
                adSpendFactTopic,
                orderFactTopic,
                dedupTtlMinutes,
                factStateTtlDays,
                defaultLookbackDays,
                lookbackDaysBySource,
                mergeParallelism,
                attributionWindowDays,
                timeDecayRate,
                reconciliationTolerancePct,
                tenantRegistryPath,
                metricsRateWindow);
    }

    /**
     * Lookback for a source; sources without an explicit entry use the default.
     */
    public int lookbackDays(String sourceName) {
        Integer days = sourceName == null ? null : lookbackDaysBySource.get(sourceName);
        return days == null ? defaultLookbackDays : days;
    }

    private static String env(Map<String, String> vars, String key, String defaultValue) {
        String value = vars.get(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static int envInt(Map<String, String> vars, String key, int defaultValue) {
        String value = vars.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    private static double envDouble(Map<String, String> vars, String key, double defaultValue) {
        String value = vars.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    // Format: "meta_ads=7,google_ads=5"; malformed entries are skipped.
    private static Map<String, Integer> envIntMap(Map<String, String> vars, String key) {
        String raw = vars.get(key);
        if (raw == null || raw.trim().isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Integer> values = new HashMap<>();
        for (String entry : raw.split("\\s*,\\s*")) {
            int eq = entry.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            try {
                values.put(entry.substring(0, eq).trim(), Integer.parseInt(entry.substring(eq + 1).trim()));
            } catch (NumberFormatException ex) {
                continue;
            }
        }
        return Collections.unmodifiableMap(values);
    }
}
