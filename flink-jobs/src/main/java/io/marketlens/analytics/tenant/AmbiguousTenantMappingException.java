package io.marketlens.analytics.tenant;

import java.util.List;

/**
 * Raised when a record cannot be tied to exactly one tenant because several active connections
 * exist for its source type and the record carries no connection id.
 */
public class AmbiguousTenantMappingException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String sourceType;
    private final List<String> candidateConnectionIds;

    public AmbiguousTenantMappingException(String sourceType, List<String> candidateConnectionIds) {
        super("Ambiguous tenant mapping for source type '" + sourceType + "': "
                + candidateConnectionIds.size() + " active connections " + candidateConnectionIds
                + "; records must carry an explicit connection id");
        this.sourceType = sourceType;
        this.candidateConnectionIds = List.copyOf(candidateConnectionIds);
    }

    public String sourceType() {
        return sourceType;
    }

    public List<String> candidateConnectionIds() {
        return candidateConnectionIds;
    }
}
