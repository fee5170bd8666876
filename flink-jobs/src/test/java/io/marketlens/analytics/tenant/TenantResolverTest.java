package io.marketlens.analytics.tenant;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TenantResolverTest {

    private static final String META = "source-facebook-marketing";

    @Test
    void explicitConnectionResolvesToItsTenant() {
        TenantResolver resolver = resolver(
                TenantConnection.active("conn-1", "tenant-a", META),
                TenantConnection.active("conn-2", "tenant-b", META));

        assertEquals("tenant-a", resolver.resolve(META, "conn-1"));
        assertEquals("tenant-b", resolver.resolve(META, " conn-2 "));
    }

    @Test
    void unknownConnectionDoesNotResolve() {
        TenantResolver resolver = resolver(TenantConnection.active("conn-1", "tenant-a", META));

        assertNull(resolver.resolve(META, "conn-404"));
    }

    @Test
    void inactiveOrDisabledConnectionNeverResolves() {
        TenantResolver resolver = resolver(
                new TenantConnection("conn-1", "tenant-a", META, "inactive", true),
                new TenantConnection("conn-2", "tenant-b", META, "active", false));

        assertNull(resolver.resolve(META, "conn-1"));
        assertNull(resolver.resolve(META, "conn-2"));
        assertNull(resolver.resolve(META, null));
    }

    @Test
    void connectionRegisteredForAnotherSourceTypeDoesNotResolve() {
        TenantResolver resolver = resolver(TenantConnection.active("conn-1", "tenant-a", "source-google-ads"));

        assertNull(resolver.resolve(META, "conn-1"));
    }

    @Test
    void missingConnectionIdFallsBackToSingleActiveConnection() {
        TenantResolver resolver = resolver(
                TenantConnection.active("conn-1", "tenant-a", META),
                new TenantConnection("conn-2", "tenant-b", META, "inactive", true));

        assertEquals("tenant-a", resolver.resolve(META, null));
        assertEquals("tenant-a", resolver.resolve(META, "  "));
    }

    @Test
    void severalActiveConnectionsWithoutIdAreAmbiguous() {
        TenantResolver resolver = resolver(
                TenantConnection.active("conn-1", "tenant-a", META),
                TenantConnection.active("conn-2", "tenant-b", META));

        AmbiguousTenantMappingException ex = assertThrows(
                AmbiguousTenantMappingException.class, () -> resolver.resolve(META, null));
        assertEquals(META, ex.sourceType());
        assertEquals(List.of("conn-1", "conn-2"), ex.candidateConnectionIds());
    }

    @Test
    void registryOutagePropagates() {
        TenantRegistry failing = new TenantRegistry() {
            @Override
            public Optional<TenantConnection> findByConnectionId(String connectionId) {
                throw new TenantRegistryUnavailableException("registry down", null);
            }

            @Override
            public List<TenantConnection> findBySourceType(String sourceType) {
                throw new TenantRegistryUnavailableException("registry down", null);
            }
        };
        TenantResolver resolver = new TenantResolver(failing);

        assertThrows(TenantRegistryUnavailableException.class, () -> resolver.resolve(META, "conn-1"));
        assertThrows(TenantRegistryUnavailableException.class, () -> resolver.resolve(META, null));
    }

    @Test
    void registryRejectsConnectionMappedToTwoTenants() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryTenantRegistry(List.of(
                TenantConnection.active("conn-1", "tenant-a", META),
                TenantConnection.active("conn-1", "tenant-b", META))));
    }

    private static TenantResolver resolver(TenantConnection... connections) {
        return new TenantResolver(new InMemoryTenantRegistry(List.of(connections)));
    }
}
