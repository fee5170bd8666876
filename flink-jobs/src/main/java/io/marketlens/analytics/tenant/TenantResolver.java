package io.marketlens.analytics.tenant;

import io.marketlens.analytics.util.StringSemantics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the tenant owning a record from its ingestion connection.
 *
 * <p>Resolution order:
 * 1) explicit connection id on the record, looked up in the registry;
 * 2) when the record has no connection id, the single active connection for the source type.
 * An inactive or disabled connection never resolves. Several active connections for the source
 * type without an explicit id raise {@link AmbiguousTenantMappingException} instead of guessing.
 * An unresolved record yields null and is excluded downstream.</p>
 */
public class TenantResolver implements Serializable {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(TenantResolver.class);

    private final TenantRegistry registry;

    public TenantResolver(TenantRegistry registry) {
        this.registry = registry;
    }

    public String resolve(String sourceType, String connectionId) {
        String explicitId = StringSemantics.trimToNull(connectionId);
        if (explicitId != null) {
            return resolveExplicit(sourceType, explicitId);
        }
        return resolveBySourceType(sourceType);
    }

    private String resolveExplicit(String sourceType, String connectionId) {
        Optional<TenantConnection> connection = registry.findByConnectionId(connectionId);
        if (connection.isEmpty()) {
            LOG.debug("Unknown connection (connectionId={}, sourceType={})", connectionId, sourceType);
            return null;
        }
        TenantConnection c = connection.get();
        if (!c.isActive()) {
            LOG.debug("Connection not active (connectionId={}, status={}, enabled={})",
                    connectionId, c.status(), c.enabled());
            return null;
        }
        if (sourceType != null && c.sourceType() != null && !sourceType.equals(c.sourceType())) {
            LOG.warn("Connection source type mismatch (connectionId={}, expected={}, registered={})",
                    connectionId, sourceType, c.sourceType());
            return null;
        }
        return StringSemantics.trimToNull(c.tenantId());
    }

    private String resolveBySourceType(String sourceType) {
        if (StringSemantics.isBlank(sourceType)) {
            return null;
        }
        List<TenantConnection> active = new ArrayList<>();
        for (TenantConnection c : registry.findBySourceType(sourceType)) {
            if (c.isActive() && !StringSemantics.isBlank(c.tenantId())) {
                active.add(c);
            }
        }
        if (active.isEmpty()) {
            return null;
        }
        if (active.size() > 1) {
            List<String> ids = new ArrayList<>(active.size());
            for (TenantConnection c : active) {
                ids.add(c.connectionId());
            }
            throw new AmbiguousTenantMappingException(sourceType, ids);
        }
        return active.get(0).tenantId().trim();
    }
}
