package io.marketlens.analytics.source;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Typed configuration for one ingestion source: which platform it belongs to, how its payload
 * fields map onto canonical fields, and how its records are tied to a tenant.
 *
 * <p>Each canonical field maps to an ordered list of payload paths; the first non-blank value
 * wins. Paths may address nested objects with dots, e.g. {@code customer.id}.</p>
 */
public final class SourceDefinition implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String name;
    private final String platform;
    private final SourceEntityType entityType;
    private final String registrySourceType;
    private final String channelDefault;
    private final Map<SourceField, List<String>> fields;

    public SourceDefinition(
            String name,
            String platform,
            SourceEntityType entityType,
            String registrySourceType,
            String channelDefault,
            Map<SourceField, List<String>> fields) {
        this.name = name;
        this.platform = platform;
        this.entityType = entityType;
        this.registrySourceType = registrySourceType;
        this.channelDefault = channelDefault;
        EnumMap<SourceField, List<String>> copy = new EnumMap<>(SourceField.class);
        for (Map.Entry<SourceField, List<String>> entry : fields.entrySet()) {
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        this.fields = Collections.unmodifiableMap(copy);
    }

    public String name() {
        return name;
    }

    public String platform() {
        return platform;
    }

    public SourceEntityType entityType() {
        return entityType;
    }

    public String registrySourceType() {
        return registrySourceType;
    }

    /** Raw channel used when the payload has none; classified like any other raw value. */
    public String channelDefault() {
        return channelDefault;
    }

    public List<String> paths(SourceField field) {
        return fields.getOrDefault(field, List.of());
    }

    public boolean maps(SourceField field) {
        return !paths(field).isEmpty();
    }
}
