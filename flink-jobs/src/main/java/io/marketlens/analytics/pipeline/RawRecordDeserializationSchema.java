package io.marketlens.analytics.pipeline;

import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.connector.kafka.source.reader.deserializer.KafkaRecordDeserializationSchema;
import org.apache.flink.util.Collector;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;

import io.marketlens.analytics.model.RawRecord;

import java.nio.charset.StandardCharsets;

/**
 * Reads raw records from Kafka. The value is the source payload; ingestion metadata travels in
 * headers. Without an {@code ingestion_id} header the Kafka coordinates identify the record, and
 * without {@code emitted_at} the Kafka record timestamp is the emission time.
 */
public class RawRecordDeserializationSchema implements KafkaRecordDeserializationSchema<RawRecord> {
    public static final String HEADER_SOURCE = "source";
    public static final String HEADER_CONNECTION_ID = "connection_id";
    public static final String HEADER_INGESTION_ID = "ingestion_id";
    public static final String HEADER_EMITTED_AT = "emitted_at";

    @Override
    public void deserialize(ConsumerRecord<byte[], byte[]> record, Collector<RawRecord> out) {
        RawRecord raw = new RawRecord();
        raw.ingestionId = record.topic() + "-" + record.partition() + "-" + record.offset();
        raw.emittedAtMillis = record.timestamp();
        raw.payload = record.value() == null ? null : new String(record.value(), StandardCharsets.UTF_8);
        if (record.headers() != null) {
            for (Header header : record.headers()) {
                if (header.value() == null) {
                    continue;
                }
                String value = new String(header.value(), StandardCharsets.UTF_8).trim();
                if (value.isEmpty()) {
                    continue;
                }
                switch (header.key()) {
                    case HEADER_SOURCE:
                        raw.sourceName = value;
                        break;
                    case HEADER_CONNECTION_ID:
                        raw.connectionId = value;
                        break;
                    case HEADER_INGESTION_ID:
                        raw.ingestionId = value;
                        break;
                    case HEADER_EMITTED_AT:
                        raw.emittedAtMillis = parseMillis(value, raw.emittedAtMillis);
                        break;
                    default:
                        break;
                }
            }
        }
        out.collect(raw);
    }

    static long parseMillis(String value, long fallback) {
        if (!value.matches("\\d+")) {
            return fallback;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    @Override
    public TypeInformation<RawRecord> getProducedType() {
        return TypeInformation.of(RawRecord.class);
    }
}
