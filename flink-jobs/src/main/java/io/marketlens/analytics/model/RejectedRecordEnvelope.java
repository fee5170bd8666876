package io.marketlens.analytics.model;

import java.io.Serializable;

/**
 * DLQ/quarantine envelope containing failure metadata and the original raw record.
 */
public class RejectedRecordEnvelope implements Serializable {
    private static final long serialVersionUID = 1L;

    public String schemaVersion;
    public FailureDetails failure;
    public Identity identity;
    public Payload payload;
    public long rejectedAtMillis;
    public long emittedAtMillis;

    public RejectedRecordEnvelope() {}

    public static class FailureDetails implements Serializable {
        private static final long serialVersionUID = 1L;

        public String stage;
        public String failureClass;
        public String reason;
        public String details;

        public FailureDetails() {}
    }

    public static class Identity implements Serializable {
        private static final long serialVersionUID = 1L;

        public String ingestionId;
        public String sourceName;
        public String connectionId;

        public Identity() {}
    }

    public static class Payload implements Serializable {
        private static final long serialVersionUID = 1L;

        public String encoding;
        public String body;

        public Payload() {}
    }
}
