package org.corpussearch.search.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Typed configuration for the Search Service.
 *
 * <p>Loads {@code application.properties}, then overlays environment variables. If {@code CORPUS_PATH}
 * is set, it overrides {@code corpus.path}. Missing required keys fail fast with
 * {@link IllegalStateException}.</p>
 */
public record SearchConfig(
    int serverPort,
    int defaultLimit,
    int maxResults,
    Corpus corpus
) {
    /** Location of the document collection indexed at startup. */
    public record Corpus(String path) {}

    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @return a fully-initialized {@link SearchConfig}
     */
    public static SearchConfig load() {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties);
        return fromProperties(properties);
    }

    /**
     * Builds configuration from an already-merged property set.
     */
    public static SearchConfig fromProperties(Properties properties) {
        normalizeCorpusPath(properties);
        return from(properties);
    }

    private static SearchConfig from(Properties p) {
        int defaultLimit = requireNonNegativeInt(p, "search.default.limit");
        int maxResults = requireNonNegativeInt(p, "search.max.results");
        if (defaultLimit > maxResults) {
            throw new IllegalStateException(
                "search.default.limit (" + defaultLimit + ") exceeds search.max.results (" + maxResults + ")");
        }

        return new SearchConfig(
            requirePort(p, "server.port"),
            defaultLimit,
            maxResults,
            new Corpus(requireString(p, "corpus.path"))
        );
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = SearchConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return properties;
    }

    private static void overlayEnvironment(Properties properties) {
        properties.putAll(System.getenv());
    }

    private static void normalizeCorpusPath(Properties properties) {
        String override = trimToNull(properties.getProperty("CORPUS_PATH"));
        if (override != null) {
            properties.setProperty("corpus.path", override);
        }
    }

    private static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    private static int requireInt(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static int requireNonNegativeInt(Properties properties, String key) {
        int value = requireInt(properties, key);
        if (value < 0) {
            throw new IllegalStateException("Configuration '" + key + "' must not be negative: " + value);
        }
        return value;
    }

    private static int requirePort(Properties properties, String key) {
        int port = requireInt(properties, key);
        if (port < 0 || port > 65535) {
            throw new IllegalStateException("Configuration '" + key + "' is not a valid port: " + port);
        }
        return port;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
