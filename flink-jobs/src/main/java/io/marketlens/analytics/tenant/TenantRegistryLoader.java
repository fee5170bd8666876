package io.marketlens.analytics.tenant;

import com.fasterxml.jackson.databind.JsonNode;

import io.marketlens.analytics.util.JsonSupport;
import io.marketlens.analytics.util.StringSemantics;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a connection registry snapshot exported from the platform database.
 *
 * <p>Expected shape:
 * {@code {"connections": [{"connection_id": "...", "tenant_id": "...", "source_type": "...",
 * "status": "active", "is_enabled": true}]}}</p>
 */
public final class TenantRegistryLoader {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(TenantRegistryLoader.class);

    private TenantRegistryLoader() {}

    public static InMemoryTenantRegistry loadFromFile(Path path) {
        if (!Files.exists(path)) {
            throw new TenantRegistryUnavailableException("Tenant registry snapshot not found: " + path, null);
        }
        try (InputStream in = Files.newInputStream(path)) {
            InMemoryTenantRegistry registry = parse(JsonSupport.MAPPER.readTree(in));
            LOG.info("Loaded tenant registry entries={} from {}", registry.size(), path);
            return registry;
        } catch (IOException ex) {
            throw new TenantRegistryUnavailableException("Failed to read tenant registry snapshot: " + path, ex);
        }
    }

    public static InMemoryTenantRegistry loadFromClasspath(String resourcePath) {
        try (InputStream in = TenantRegistryLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new TenantRegistryUnavailableException("Tenant registry resource not found: " + resourcePath, null);
            }
            return parse(JsonSupport.MAPPER.readTree(in));
        } catch (IOException ex) {
            throw new TenantRegistryUnavailableException("Failed to read tenant registry resource: " + resourcePath, ex);
        }
    }

    static InMemoryTenantRegistry parse(JsonNode root) {
        if (root == null || !root.path("connections").isArray()) {
            throw new TenantRegistryUnavailableException("Tenant registry snapshot missing connections array", null);
        }
        List<TenantConnection> connections = new ArrayList<>();
        for (JsonNode node : root.path("connections")) {
            String connectionId = StringSemantics.trimToNull(node.path("connection_id").asText(null));
            if (connectionId == null) {
                LOG.warn("Skipping registry entry without connection_id: {}", node);
                continue;
            }
            connections.add(new TenantConnection(
                    connectionId,
                    StringSemantics.trimToNull(node.path("tenant_id").asText(null)),
                    StringSemantics.trimToNull(node.path("source_type").asText(null)),
                    node.path("status").asText(""),
                    node.path("is_enabled").asBoolean(false)));
        }
        return new InMemoryTenantRegistry(connections);
    }
}
