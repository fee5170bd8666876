package io.marketlens.analytics.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.util.Properties;

/**
 * Version and commit of the running build, read from the filtered {@code build-info.properties}.
 * Unfiltered placeholders fall back to {@code dev}/{@code unknown}.
 */
public final class BuildMetadata implements Serializable {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(BuildMetadata.class);

    static final String RESOURCE = "build-info.properties";
    static final String VERSION_KEY = "build.version";
    static final String COMMIT_KEY = "build.git.commit";

    private static final BuildMetadata CURRENT = loadFromClasspath();

    private final String version;
    private final String gitCommit;

    private BuildMetadata(String version, String gitCommit) {
        this.version = orFallback(version, "dev");
        this.gitCommit = orFallback(gitCommit, "unknown");
    }

    public static BuildMetadata current() {
        return CURRENT;
    }

    static BuildMetadata fromProperties(Properties props) {
        return new BuildMetadata(props.getProperty(VERSION_KEY), props.getProperty(COMMIT_KEY));
    }

    public String version() {
        return version;
    }

    public String gitCommit() {
        return gitCommit;
    }

    /** {@code version+commit}, attached to job startup logs and batch reports. */
    public String identity() {
        return version + "+" + gitCommit;
    }

    private static BuildMetadata loadFromClasspath() {
        Properties props = new Properties();
        try (InputStream in = BuildMetadata.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException ex) {
            LOG.warn("Unable to read {}, using fallback build metadata: {}", RESOURCE, ex.getMessage());
        }
        return fromProperties(props);
    }

    private static String orFallback(String value, String fallback) {
        String trimmed = StringSemantics.trimToNull(value);
        if (trimmed == null || (trimmed.startsWith("${") && trimmed.endsWith("}"))) {
            return fallback;
        }
        return trimmed;
    }
}
