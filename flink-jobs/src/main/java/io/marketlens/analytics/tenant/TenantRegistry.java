package io.marketlens.analytics.tenant;

import java.util.List;
import java.util.Optional;

/**
 * Connection registry owned by the platform back end.
 *
 * <p>Implementations throw {@link TenantRegistryUnavailableException} when the registry cannot be
 * read; callers treat that as a systemic failure and abort the run.</p>
 */
public interface TenantRegistry {

    Optional<TenantConnection> findByConnectionId(String connectionId);

    List<TenantConnection> findBySourceType(String sourceType);
}
