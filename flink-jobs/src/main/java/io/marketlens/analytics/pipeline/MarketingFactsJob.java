package io.marketlens.analytics.pipeline;

import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.serialization.SimpleStringSchema;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.util.OutputTag;

import io.marketlens.analytics.config.PipelineConfig;
import io.marketlens.analytics.model.AdSpendFact;
import io.marketlens.analytics.model.CampaignPerformanceFact;
import io.marketlens.analytics.model.OrderFact;
import io.marketlens.analytics.model.RawRecord;
import io.marketlens.analytics.model.RejectedRecordEnvelope;
import io.marketlens.analytics.model.StagedAdRow;
import io.marketlens.analytics.quality.RawRecordDeduplicationProcessFunction;
import io.marketlens.analytics.quality.RawRecordGateProcessFunction;
import io.marketlens.analytics.quality.RecordExtractionProcessFunction;
import io.marketlens.analytics.source.SourceCatalog;
import io.marketlens.analytics.source.SourceCatalogLoader;
import io.marketlens.analytics.tenant.InMemoryTenantRegistry;
import io.marketlens.analytics.tenant.TenantRegistryLoader;
import io.marketlens.analytics.tenant.TenantResolver;
import io.marketlens.analytics.util.BuildMetadata;
import io.marketlens.analytics.util.JsonSupport;

import java.nio.file.Path;

/**
 * Streaming fact pipeline:
 * - Ingest raw records from Kafka
 * - Gate on payload presence and known source
 * - Deduplicate redeliveries with state TTL
 * - Extract staging rows and orders
 * - Keyed upserts into campaign, ad spend and order facts
 * - Sink facts and DLQ/quarantine envelopes to Kafka as JSON
 */
public class MarketingFactsJob {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(MarketingFactsJob.class);

    static final OutputTag<RejectedRecordEnvelope> DLQ_TAG = new OutputTag<RejectedRecordEnvelope>("dlq"){};
    static final OutputTag<RejectedRecordEnvelope> QUARANTINE_TAG = new OutputTag<RejectedRecordEnvelope>("quarantine"){};
    static final OutputTag<OrderFact> ORDER_TAG = new OutputTag<OrderFact>("orders"){};
    static final OutputTag<AdSpendFact> AD_SPEND_TAG = new OutputTag<AdSpendFact>("ad-spend"){};

    public static void main(String[] args) throws Exception {
        final StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.enableCheckpointing(60000);

        PipelineConfig config = PipelineConfig.fromEnv();
        if (config.tenantRegistryPath == null) {
            throw new IllegalStateException("MARKETLENS_TENANT_REGISTRY_PATH must point at the tenant registry export");
        }
        SourceCatalog catalog = SourceCatalogLoader.loadDefault();
        InMemoryTenantRegistry registry = TenantRegistryLoader.loadFromFile(Path.of(config.tenantRegistryPath));
        TenantResolver tenantResolver = new TenantResolver(registry);
        LOG.info("Starting marketing facts job (build={}, inputTopic={}, dlqTopic={}, sources={}, connections={})",
                BuildMetadata.current().identity(), config.inputTopic, config.dlqTopic, catalog.size(), registry.size());

        KafkaSource<RawRecord> kafkaSource = KafkaSource.<RawRecord>builder()
                .setBootstrapServers(config.kafkaBootstrap)
                .setTopics(config.inputTopic)
                .setGroupId(config.kafkaGroupId)
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setDeserializer(new RawRecordDeserializationSchema())
                .build();

        SingleOutputStreamOperator<RawRecord> gatedStream = env
                .fromSource(kafkaSource, WatermarkStrategy.noWatermarks(), "Kafka Source")
                .process(new RawRecordGateProcessFunction(config, catalog, DLQ_TAG))
                .returns(RawRecord.class)
                .name("Raw Gate");

        SingleOutputStreamOperator<RawRecord> dedupedStream = gatedStream
                .keyBy(record -> record.ingestionId)
                .process(new RawRecordDeduplicationProcessFunction(config, QUARANTINE_TAG))
                .returns(RawRecord.class)
                .name("Dedup");

        SingleOutputStreamOperator<StagedAdRow> stagedStream = dedupedStream
                .process(new RecordExtractionProcessFunction(catalog, tenantResolver, ORDER_TAG, DLQ_TAG))
                .returns(StagedAdRow.class)
                .name("Extract");

        SingleOutputStreamOperator<CampaignPerformanceFact> campaignFacts = stagedStream
                .keyBy(StagedAdRow::campaignDateKey)
                .process(new CampaignFactUpsertFunction(config, AD_SPEND_TAG))
                .returns(CampaignPerformanceFact.class)
                .name("Upsert: Campaign Performance");

        SingleOutputStreamOperator<OrderFact> orderFacts = stagedStream.getSideOutput(ORDER_TAG)
                .keyBy(order -> order.id)
                .process(new OrderFactUpsertFunction(config))
                .returns(OrderFact.class)
                .name("Upsert: Orders");

        DataStream<AdSpendFact> adSpendFacts = campaignFacts.getSideOutput(AD_SPEND_TAG);
        DataStream<RejectedRecordEnvelope> dlqStream = gatedStream.getSideOutput(DLQ_TAG)
                .union(stagedStream.getSideOutput(DLQ_TAG));
        DataStream<RejectedRecordEnvelope> quarantineStream = dedupedStream.getSideOutput(QUARANTINE_TAG);

        campaignFacts.map(JsonSupport::toJson).sinkTo(jsonSink(config, config.campaignFactTopic)).name("Kafka: Campaign Facts");
        adSpendFacts.map(JsonSupport::toJson).sinkTo(jsonSink(config, config.adSpendFactTopic)).name("Kafka: Ad Spend Facts");
        orderFacts.map(JsonSupport::toJson).sinkTo(jsonSink(config, config.orderFactTopic)).name("Kafka: Order Facts");
        dlqStream.map(JsonSupport::toJson).sinkTo(jsonSink(config, config.dlqTopic)).name("Kafka: DLQ");
        quarantineStream.map(JsonSupport::toJson).sinkTo(jsonSink(config, config.quarantineTopic)).name("Kafka: Quarantine");

        env.execute("MarketLens Marketing Facts");
    }

    private static KafkaSink<String> jsonSink(PipelineConfig config, String topic) {
        return KafkaSink.<String>builder()
                .setBootstrapServers(config.kafkaBootstrap)
                .setRecordSerializer(KafkaRecordSerializationSchema.builder()
                        .setTopic(topic)
                        .setValueSerializationSchema(new SimpleStringSchema())
                        .build())
                .build();
    }
}
