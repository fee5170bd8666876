package io.marketlens.analytics.tenant;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry snapshot held in memory, loaded once per run or job start.
 */
public final class InMemoryTenantRegistry implements TenantRegistry, Serializable {
    private static final long serialVersionUID = 1L;

    private final Map<String, TenantConnection> byConnectionId;

    public InMemoryTenantRegistry(Collection<TenantConnection> connections) {
        Map<String, TenantConnection> map = new LinkedHashMap<>();
        for (TenantConnection connection : connections) {
            TenantConnection previous = map.put(connection.connectionId(), connection);
            if (previous != null && !sameTenant(previous, connection)) {
                throw new IllegalArgumentException("Connection " + connection.connectionId()
                        + " is mapped to more than one tenant");
            }
        }
        this.byConnectionId = Collections.unmodifiableMap(map);
    }

    @Override
    public Optional<TenantConnection> findByConnectionId(String connectionId) {
        if (connectionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byConnectionId.get(connectionId));
    }

    @Override
    public List<TenantConnection> findBySourceType(String sourceType) {
        List<TenantConnection> matches = new ArrayList<>();
        for (TenantConnection connection : byConnectionId.values()) {
            if (sourceType != null && sourceType.equals(connection.sourceType())) {
                matches.add(connection);
            }
        }
        return matches;
    }

    public int size() {
        return byConnectionId.size();
    }

    private static boolean sameTenant(TenantConnection a, TenantConnection b) {
        return a.tenantId() == null ? b.tenantId() == null : a.tenantId().equals(b.tenantId());
    }
}
