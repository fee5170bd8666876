package io.marketlens.analytics.source;

import com.fasterxml.jackson.databind.JsonNode;

import io.marketlens.analytics.channel.Platform;
import io.marketlens.analytics.util.JsonSupport;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads source definitions from classpath or filesystem.
 *
 * Lookup order:
 * 1) JVM property `marketlens.source.catalog.path`
 * 2) classpath resource `reference/source_catalog.v1.json`
 */
public final class SourceCatalogLoader {
    public static final String CATALOG_PROPERTY = "marketlens.source.catalog.path";
    public static final String DEFAULT_CLASSPATH_RESOURCE = "reference/source_catalog.v1.json";

    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(SourceCatalogLoader.class);

    private SourceCatalogLoader() {}

    public static SourceCatalog loadDefault() {
        String overridePath = System.getProperty(CATALOG_PROPERTY);
        if (overridePath != null && !overridePath.isBlank()) {
            return loadFromFile(Path.of(overridePath));
        }
        SourceCatalog fromClasspath = loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
        if (fromClasspath == null) {
            throw new IllegalStateException("Source catalog resource not found: " + DEFAULT_CLASSPATH_RESOURCE);
        }
        return fromClasspath;
    }

    static SourceCatalog loadFromClasspath(String resourcePath) {
        try (InputStream in = SourceCatalogLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                return null;
            }
            return parseCatalog(JsonSupport.MAPPER.readTree(in));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load source catalog from classpath: " + resourcePath, ex);
        }
    }

    static SourceCatalog loadFromFile(Path path) {
        try {
            if (!Files.exists(path)) {
                throw new IllegalStateException("Source catalog file not found: " + path);
            }
            SourceCatalog catalog = parseCatalog(JsonSupport.MAPPER.readTree(path.toFile()));
            LOG.info("Loaded source catalog version={} entries={} from {}", catalog.version(), catalog.size(), path);
            return catalog;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load source catalog from file: " + path, ex);
        }
    }

    static SourceCatalog parseCatalog(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Source catalog is not a JSON object");
        }
        String version = root.path("catalog_version").asText("unknown");
        JsonNode sources = root.path("sources");
        if (!sources.isArray()) {
            throw new IllegalStateException("Source catalog missing sources array");
        }

        Map<String, SourceDefinition> byName = new LinkedHashMap<>();
        for (JsonNode source : sources) {
            SourceDefinition definition = parseDefinition(source);
            if (byName.put(definition.name(), definition) != null) {
                throw new IllegalStateException("Duplicate source definition: " + definition.name());
            }
        }
        return new SourceCatalog(version, byName);
    }

    private static SourceDefinition parseDefinition(JsonNode source) {
        String name = source.path("name").asText("");
        if (name.isBlank()) {
            throw new IllegalStateException("Source definition without name: " + source);
        }
        String platform = source.path("platform").asText("");
        if (Platform.fromKey(platform) == null) {
            throw new IllegalStateException("Source " + name + " references unknown platform '" + platform + "'");
        }
        SourceEntityType entityType;
        try {
            entityType = SourceEntityType.valueOf(source.path("entity_type").asText("").toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Source " + name + " has invalid entity_type", ex);
        }

        Map<SourceField, List<String>> fields = new EnumMap<>(SourceField.class);
        Iterator<Map.Entry<String, JsonNode>> it = source.path("fields").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            SourceField field = SourceField.fromKey(entry.getKey());
            if (field == null) {
                throw new IllegalStateException("Source " + name + " maps unknown field '" + entry.getKey() + "'");
            }
            fields.put(field, paths(entry.getValue()));
        }

        return new SourceDefinition(
                name,
                platform,
                entityType,
                source.path("registry_source_type").asText(null),
                source.path("channel_default").asText(null),
                fields);
    }

    private static List<String> paths(JsonNode node) {
        List<String> paths = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode path : node) {
                paths.add(path.asText());
            }
        } else if (node.isTextual()) {
            paths.add(node.asText());
        }
        return paths;
    }
}
