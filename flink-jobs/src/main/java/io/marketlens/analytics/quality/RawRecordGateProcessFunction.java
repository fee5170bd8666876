package io.marketlens.analytics.quality;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.MeterView;
import org.apache.flink.streaming.api.functions.ProcessFunction;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.marketlens.analytics.config.PipelineConfig;
import io.marketlens.analytics.model.RawRecord;
import io.marketlens.analytics.model.RejectedRecordEnvelope;
import io.marketlens.analytics.source.SourceCatalog;
import io.marketlens.analytics.util.StringSemantics;

/**
 * Admits raw records that carry a payload and name a known source; everything else goes to the
 * DLQ with a failure class.
 */
public class RawRecordGateProcessFunction extends ProcessFunction<RawRecord, RawRecord> {
    private static final Logger LOG = LoggerFactory.getLogger(RawRecordGateProcessFunction.class);

    private final PipelineConfig config;
    private final SourceCatalog catalog;
    private final OutputTag<RejectedRecordEnvelope> dlqTag;
    private transient Counter inputCounter;
    private transient Counter acceptedCounter;
    private transient Counter dlqCounter;
    private transient long lastDlqLogMs;
    private transient long dlqSinceLastLog;

    public RawRecordGateProcessFunction(PipelineConfig config, SourceCatalog catalog, OutputTag<RejectedRecordEnvelope> dlqTag) {
        this.config = config;
        this.catalog = catalog;
        this.dlqTag = dlqTag;
    }

    @Override
    public void open(org.apache.flink.configuration.Configuration parameters) {
        org.apache.flink.metrics.MetricGroup metrics = getRuntimeContext().getMetricGroup().addGroup("raw_gate");
        this.inputCounter = metrics.counter("input");
        this.acceptedCounter = metrics.counter("accepted");
        this.dlqCounter = metrics.counter("dlq");
        int windowSec = (int) config.metricsRateWindow.getSeconds();
        metrics.meter("input_rate", new MeterView(inputCounter, windowSec));
        metrics.meter("dlq_rate", new MeterView(dlqCounter, windowSec));
        this.lastDlqLogMs = System.currentTimeMillis();
        this.dlqSinceLastLog = 0;
        LOG.info("Raw record gate initialized (catalogVersion={}, sources={})", catalog.version(), catalog.size());
    }

    @Override
    public void processElement(RawRecord record, Context ctx, org.apache.flink.util.Collector<RawRecord> out) {
        inputCounter.inc();

        if (record == null || StringSemantics.isBlank(record.payload)) {
            emitDlq(ctx, RejectedRecordEnvelopeFactory.forGateFailure(
                    record, "DESERIALIZATION_FAILED", "null_payload", "Record value is empty"));
            return;
        }
        if (catalog.find(record.sourceName) == null) {
            LOG.debug("Unknown source (ingestionId={}, source={})", record.ingestionId, record.sourceName);
            emitDlq(ctx, RejectedRecordEnvelopeFactory.forGateFailure(
                    record, "SOURCE_UNKNOWN", "unknown_source", "No source definition for '" + record.sourceName + "'"));
            return;
        }

        acceptedCounter.inc();
        out.collect(record);
    }

    private void emitDlq(Context ctx, RejectedRecordEnvelope envelope) {
        dlqCounter.inc();
        dlqSinceLastLog++;
        long now = System.currentTimeMillis();
        if (now - lastDlqLogMs >= 60000) {
            LOG.warn("DLQ rate summary: {} rejects in last 60s", dlqSinceLastLog);
            lastDlqLogMs = now;
            dlqSinceLastLog = 0;
        }
        ctx.output(dlqTag, envelope);
    }
}
