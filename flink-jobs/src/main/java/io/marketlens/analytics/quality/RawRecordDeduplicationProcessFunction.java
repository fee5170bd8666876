package io.marketlens.analytics.quality;

import org.apache.flink.api.common.state.StateTtlConfig;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.time.Time;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.MeterView;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.marketlens.analytics.config.PipelineConfig;
import io.marketlens.analytics.model.RawRecord;
import io.marketlens.analytics.model.RejectedRecordEnvelope;

/**
 * Drops redelivered raw records, keyed by ingestion id with state TTL; duplicates go to quarantine.
 */
public class RawRecordDeduplicationProcessFunction extends KeyedProcessFunction<String, RawRecord, RawRecord> {
    private static final Logger LOG = LoggerFactory.getLogger(RawRecordDeduplicationProcessFunction.class);

    private final PipelineConfig config;
    private final OutputTag<RejectedRecordEnvelope> quarantineTag;
    private transient ValueState<Long> seenState;
    private transient Counter duplicateCounter;
    private transient Counter acceptedCounter;

    public RawRecordDeduplicationProcessFunction(PipelineConfig config, OutputTag<RejectedRecordEnvelope> quarantineTag) {
        this.config = config;
        this.quarantineTag = quarantineTag;
    }

    @Override
    public void open(org.apache.flink.configuration.Configuration parameters) {
        StateTtlConfig ttlConfig = StateTtlConfig
                .newBuilder(Time.minutes(config.dedupTtlMinutes))
                .setUpdateType(StateTtlConfig.UpdateType.OnCreateAndWrite)
                .setStateVisibility(StateTtlConfig.StateVisibility.NeverReturnExpired)
                .build();

        ValueStateDescriptor<Long> descriptor = new ValueStateDescriptor<>("raw-dedup-seen", Long.class);
        descriptor.enableTimeToLive(ttlConfig);
        seenState = getRuntimeContext().getState(descriptor);

        org.apache.flink.metrics.MetricGroup metrics = getRuntimeContext().getMetricGroup().addGroup("raw_gate").addGroup("dedup");
        duplicateCounter = metrics.counter("duplicates");
        acceptedCounter = metrics.counter("accepted");
        metrics.meter("duplicate_rate", new MeterView(duplicateCounter, (int) config.metricsRateWindow.getSeconds()));
        LOG.info("Raw record deduplication initialized (ttlMinutes={})", config.dedupTtlMinutes);
    }

    @Override
    public void processElement(RawRecord record, Context ctx, org.apache.flink.util.Collector<RawRecord> out) throws Exception {
        if (record == null) {
            return;
        }

        if (seenState.value() != null) {
            duplicateCounter.inc();
            LOG.debug("Duplicate delivery (ingestionId={}, source={})", record.ingestionId, record.sourceName);
            ctx.output(quarantineTag, RejectedRecordEnvelopeFactory.forDuplicate(record));
            return;
        }

        seenState.update(System.currentTimeMillis());
        acceptedCounter.inc();
        out.collect(record);
    }
}
