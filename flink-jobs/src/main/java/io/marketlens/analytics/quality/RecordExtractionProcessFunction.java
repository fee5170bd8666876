package io.marketlens.analytics.quality;

import org.apache.flink.metrics.Counter;
import org.apache.flink.streaming.api.functions.ProcessFunction;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.marketlens.analytics.model.OrderFact;
import io.marketlens.analytics.model.RawRecord;
import io.marketlens.analytics.model.RejectedRecordEnvelope;
import io.marketlens.analytics.model.StagedAdRow;
import io.marketlens.analytics.parse.AdRecordExtractor;
import io.marketlens.analytics.parse.DropReason;
import io.marketlens.analytics.parse.Extraction;
import io.marketlens.analytics.parse.OrderRecordExtractor;
import io.marketlens.analytics.source.SourceCatalog;
import io.marketlens.analytics.source.SourceDefinition;
import io.marketlens.analytics.source.SourceEntityType;
import io.marketlens.analytics.tenant.AmbiguousTenantMappingException;
import io.marketlens.analytics.tenant.TenantResolver;

/**
 * Extracts admitted raw records. Ad rows are the main output, orders go to {@code orderTag}, and
 * dropped records go to the DLQ with their drop reason.
 *
 * <p>An ambiguous tenant mapping is routed to the DLQ rather than restarting the job on every
 * delivery; a tenant registry outage still fails the task.</p>
 */
public class RecordExtractionProcessFunction extends ProcessFunction<RawRecord, StagedAdRow> {
    private static final Logger LOG = LoggerFactory.getLogger(RecordExtractionProcessFunction.class);

    private final SourceCatalog catalog;
    private final TenantResolver tenantResolver;
    private final OutputTag<OrderFact> orderTag;
    private final OutputTag<RejectedRecordEnvelope> dlqTag;
    private transient AdRecordExtractor adExtractor;
    private transient OrderRecordExtractor orderExtractor;
    private transient Counter adRowCounter;
    private transient Counter orderCounter;
    private transient Counter droppedCounter;

    public RecordExtractionProcessFunction(
            SourceCatalog catalog,
            TenantResolver tenantResolver,
            OutputTag<OrderFact> orderTag,
            OutputTag<RejectedRecordEnvelope> dlqTag) {
        this.catalog = catalog;
        this.tenantResolver = tenantResolver;
        this.orderTag = orderTag;
        this.dlqTag = dlqTag;
    }

    @Override
    public void open(org.apache.flink.configuration.Configuration parameters) {
        adExtractor = new AdRecordExtractor(tenantResolver);
        orderExtractor = new OrderRecordExtractor(tenantResolver);
        org.apache.flink.metrics.MetricGroup metrics = getRuntimeContext().getMetricGroup().addGroup("extraction");
        adRowCounter = metrics.counter("ad_rows");
        orderCounter = metrics.counter("orders");
        droppedCounter = metrics.counter("dropped");
    }

    @Override
    public void processElement(RawRecord record, Context ctx, org.apache.flink.util.Collector<StagedAdRow> out) {
        SourceDefinition definition = catalog.find(record.sourceName);
        if (definition == null) {
            drop(ctx, record, DropReason.UNKNOWN_SOURCE, record.sourceName);
            return;
        }
        try {
            if (definition.entityType() == SourceEntityType.ORDER) {
                Extraction<OrderFact> extraction = orderExtractor.extract(definition, record);
                if (extraction.isDropped()) {
                    drop(ctx, record, extraction.dropReason(), extraction.detail());
                    return;
                }
                orderCounter.inc();
                ctx.output(orderTag, extraction.row());
            } else {
                Extraction<StagedAdRow> extraction = adExtractor.extract(definition, record);
                if (extraction.isDropped()) {
                    drop(ctx, record, extraction.dropReason(), extraction.detail());
                    return;
                }
                adRowCounter.inc();
                out.collect(extraction.row());
            }
        } catch (AmbiguousTenantMappingException ex) {
            LOG.warn("Ambiguous tenant mapping (ingestionId={}, source={}): {}",
                    record.ingestionId, record.sourceName, ex.getMessage());
            droppedCounter.inc();
            ctx.output(dlqTag, RejectedRecordEnvelopeFactory.forAmbiguousTenant(record, ex.getMessage()));
        }
    }

    private void drop(Context ctx, RawRecord record, DropReason reason, String detail) {
        droppedCounter.inc();
        LOG.debug("Dropped record (ingestionId={}, source={}, reason={})", record.ingestionId, record.sourceName, reason.code());
        ctx.output(dlqTag, RejectedRecordEnvelopeFactory.forDrop(record, reason, detail));
    }
}
