package io.marketlens.analytics.source;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-memory lookup for source definitions loaded from a versioned catalog.
 */
public final class SourceCatalog implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String version;
    private final Map<String, SourceDefinition> byName;

    public SourceCatalog(String version, Map<String, SourceDefinition> byName) {
        this.version = version == null || version.isBlank() ? "unknown" : version;
        this.byName = Collections.unmodifiableMap(new LinkedHashMap<>(byName));
    }

    public String version() {
        return version;
    }

    /**
     * @return the definition, or null for an unknown source name
     */
    public SourceDefinition find(String sourceName) {
        return sourceName == null ? null : byName.get(sourceName);
    }

    public Collection<SourceDefinition> definitions() {
        return byName.values();
    }

    public int size() {
        return byName.size();
    }
}
