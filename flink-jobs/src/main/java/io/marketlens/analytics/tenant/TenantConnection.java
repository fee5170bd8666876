package io.marketlens.analytics.tenant;

import java.io.Serializable;
import java.util.Objects;

/**
 * Registry entry binding an ingestion connection to exactly one tenant.
 */
public final class TenantConnection implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String STATUS_ACTIVE = "active";

    private final String connectionId;
    private final String tenantId;
    private final String sourceType;
    private final String status;
    private final boolean enabled;

    public TenantConnection(String connectionId, String tenantId, String sourceType, String status, boolean enabled) {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.tenantId = tenantId;
        this.sourceType = sourceType;
        this.status = status;
        this.enabled = enabled;
    }

    public static TenantConnection active(String connectionId, String tenantId, String sourceType) {
        return new TenantConnection(connectionId, tenantId, sourceType, STATUS_ACTIVE, true);
    }

    public String connectionId() {
        return connectionId;
    }

    public String tenantId() {
        return tenantId;
    }

    public String sourceType() {
        return sourceType;
    }

    public String status() {
        return status;
    }

    public boolean enabled() {
        return enabled;
    }

    public boolean isActive() {
        return enabled && STATUS_ACTIVE.equalsIgnoreCase(status);
    }
}
