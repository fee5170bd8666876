package io.marketlens.analytics.quality;

import io.marketlens.analytics.model.RawRecord;
import io.marketlens.analytics.model.RejectedRecordEnvelope;
import io.marketlens.analytics.parse.DropReason;

/**
 * Builds DLQ/quarantine envelopes for the failure modes of the raw record pipeline.
 */
public final class RejectedRecordEnvelopeFactory {
    public static final String STAGE_GATE = "GATE";
    public static final String STAGE_EXTRACT = "EXTRACT";
    public static final String STAGE_DEDUP = "DEDUP";

    private RejectedRecordEnvelopeFactory() {}

    public static RejectedRecordEnvelope forGateFailure(RawRecord record, String failureClass, String reason, String details) {
        RejectedRecordEnvelope envelope = baseEnvelope(record);
        envelope.failure = buildFailure(STAGE_GATE, failureClass, reason, details);
        return envelope;
    }

    public static RejectedRecordEnvelope forDrop(RawRecord record, DropReason reason, String details) {
        RejectedRecordEnvelope envelope = baseEnvelope(record);
        envelope.failure = buildFailure(STAGE_EXTRACT, failureClass(reason), reason.code(), details);
        return envelope;
    }

    public static RejectedRecordEnvelope forAmbiguousTenant(RawRecord record, String details) {
        RejectedRecordEnvelope envelope = baseEnvelope(record);
        envelope.failure = buildFailure(STAGE_EXTRACT, "TENANT_AMBIGUOUS", "ambiguous_tenant_mapping", details);
        return envelope;
    }

    public static RejectedRecordEnvelope forDuplicate(RawRecord record) {
        RejectedRecordEnvelope envelope = baseEnvelope(record);
        envelope.failure = buildFailure(STAGE_DEDUP, "DUPLICATE", "duplicate_ingestion_id",
                "Duplicate delivery of ingestion id: " + record.ingestionId);
        return envelope;
    }

    static String failureClass(DropReason reason) {
        switch (reason) {
            case UNKNOWN_SOURCE:
                return "SOURCE_UNKNOWN";
            case MALFORMED_PAYLOAD:
                return "DESERIALIZATION_FAILED";
            case UNRESOLVED_TENANT:
                return "TENANT_UNRESOLVED";
            default:
                return "REQUIRED_KEY_MISSING";
        }
    }

    private static RejectedRecordEnvelope baseEnvelope(RawRecord record) {
        RejectedRecordEnvelope envelope = new RejectedRecordEnvelope();
        envelope.schemaVersion = "v1";
        envelope.identity = new RejectedRecordEnvelope.Identity();
        envelope.payload = new RejectedRecordEnvelope.Payload();
        envelope.payload.encoding = "json";
        if (record != null) {
            envelope.identity.ingestionId = record.ingestionId;
            envelope.identity.sourceName = record.sourceName;
            envelope.identity.connectionId = record.connectionId;
            envelope.payload.body = record.payload;
            envelope.emittedAtMillis = record.emittedAtMillis;
        }
        envelope.rejectedAtMillis = System.currentTimeMillis();
        return envelope;
    }

    private static RejectedRecordEnvelope.FailureDetails buildFailure(String stage, String failureClass, String reason, String details) {
        RejectedRecordEnvelope.FailureDetails failure = new RejectedRecordEnvelope.FailureDetails();
        failure.stage = stage;
        failure.failureClass = failureClass;
        failure.reason = reason;
        failure.details = details;
        return failure;
    }
}
