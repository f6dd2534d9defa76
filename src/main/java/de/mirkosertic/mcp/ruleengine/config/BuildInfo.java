package de.mirkosertic.mcp.ruleengine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version, artifact name and build time of the running engine, read from the Maven-filtered
 * build-info.properties. Unfiltered runs (IDE, tests without resource processing) report "dev"/"unknown".
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";

    private static final Properties properties = loadProperties();

    private BuildInfo() {
    }

    private static Properties loadProperties() {
        final Properties props = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input == null) {
                logger.debug("No {} on the classpath, reporting development build", BUILD_INFO_FILE);
                return props;
            }
            props.load(input);
        } catch (final IOException e) {
            logger.warn("Could not read {}, reporting development build", BUILD_INFO_FILE, e);
        }
        return props;
    }

    private static String valueOf(final String key, final String fallback) {
        final String value = properties.getProperty(key);
        // Unfiltered resources still contain the raw ${...} placeholder
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return fallback;
        }
        return value;
    }

    public static String getVersion() {
        return valueOf("build.version", "dev");
    }

    public static String getBuildTimestamp() {
        return valueOf("build.timestamp", "unknown");
    }

    public static String getArtifactId() {
        return valueOf("build.artifact", "mcp-rule-engine");
    }

    /**
     * One-line description used in startup logs and the MCP server info.
     */
    public static String describe() {
        return getArtifactId() + " " + getVersion() + " (built " + getBuildTimestamp() + ")";
    }
}
