package io.marketlens.analytics.pipeline;

import org.apache.flink.api.common.state.MapState;
import org.apache.flink.api.common.state.MapStateDescriptor;
import org.apache.flink.api.common.state.StateTtlConfig;
import org.apache.flink.api.common.time.Time;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.metrics.Counter;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.marketlens.analytics.config.PipelineConfig;
import io.marketlens.analytics.merge.AdSpendFacts;
import io.marketlens.analytics.merge.CampaignPerformanceAggregator;
import io.marketlens.analytics.merge.FactMerger;
import io.marketlens.analytics.model.AdSpendFact;
import io.marketlens.analytics.model.CampaignPerformanceFact;
import io.marketlens.analytics.model.StagedAdRow;

import java.util.ArrayList;
import java.util.List;

/**
 * Keyed by campaign-date key. Holds the latest staging row per ad-grain key and emits the
 * recomputed campaign fact whenever a newer row arrives, so late corrections replace totals.
 * Each accepted staging row is also emitted as an ad spend fact on {@code adSpendTag}.
 */
public class CampaignFactUpsertFunction extends KeyedProcessFunction<String, StagedAdRow, CampaignPerformanceFact> {
    private static final Logger LOG = LoggerFactory.getLogger(CampaignFactUpsertFunction.class);

    private final PipelineConfig config;
    private final OutputTag<AdSpendFact> adSpendTag;
    private transient MapState<String, StagedAdRow> stagingRows;
    private transient Counter upsertCounter;
    private transient Counter staleCounter;

    public CampaignFactUpsertFunction(PipelineConfig config, OutputTag<AdSpendFact> adSpendTag) {
        this.config = config;
        this.adSpendTag = adSpendTag;
    }

    @Override
    public void open(org.apache.flink.configuration.Configuration parameters) {
        StateTtlConfig ttlConfig = StateTtlConfig
                .newBuilder(Time.days(config.factStateTtlDays))
                .setUpdateType(StateTtlConfig.UpdateType.OnCreateAndWrite)
                .setStateVisibility(StateTtlConfig.StateVisibility.NeverReturnExpired)
                .build();
        MapStateDescriptor<String, StagedAdRow> descriptor = new MapStateDescriptor<>(
                "campaign-staging-rows", Types.STRING, TypeInformation.of(StagedAdRow.class));
        descriptor.enableTimeToLive(ttlConfig);
        stagingRows = getRuntimeContext().getMapState(descriptor);

        org.apache.flink.metrics.MetricGroup metrics = getRuntimeContext().getMetricGroup().addGroup("campaign_upsert");
        upsertCounter = metrics.counter("upserts");
        staleCounter = metrics.counter("stale_rows");
        LOG.info("Campaign fact upsert initialized (stateTtlDays={})", config.factStateTtlDays);
    }

    @Override
    public void processElement(StagedAdRow row, Context ctx, Collector<CampaignPerformanceFact> out) throws Exception {
        String stagingKey = row.stagingKey();
        StagedAdRow existing = stagingRows.get(stagingKey);
        if (existing != null && FactMerger.latestStaged(existing, row) == existing) {
            staleCounter.inc();
            LOG.debug("Ignoring stale staging row (ingestionId={}, key={})", row.ingestionId, stagingKey);
            return;
        }
        stagingRows.put(stagingKey, row);
        ctx.output(adSpendTag, AdSpendFacts.fromStaged(row));

        List<StagedAdRow> group = new ArrayList<>();
        for (StagedAdRow staged : stagingRows.values()) {
            group.add(staged);
        }
        upsertCounter.inc();
        out.collect(CampaignPerformanceAggregator.aggregate(group));
    }
}
