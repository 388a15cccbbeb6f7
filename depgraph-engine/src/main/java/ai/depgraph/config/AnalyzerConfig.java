package ai.depgraph.config;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/**
 * Settings of one analysis run.
 *
 * <p>Values are layered: {@value #DEFAULTS_RESOURCE} on the classpath, then an optional external properties file,
 * then {@code depgraph.*} system properties. Later layers win.
 *
 * @param parallelism number of project worker threads; 0 means one per available processor
 * @param excludedScopes regular expressions of scope names whose dependencies are not added to the graph
 * @param projectTimeoutSeconds per-project time limit after which its traversal is cancelled; 0 disables it
 */
@NullMarked
public record AnalyzerConfig(int parallelism, List<String> excludedScopes, long projectTimeoutSeconds) {
    private static final Logger logger = LogManager.getLogger(AnalyzerConfig.class);

    public static final String DEFAULTS_RESOURCE = "depgraph.properties";
    public static final String PARALLELISM = "depgraph.parallelism";
    public static final String EXCLUDED_SCOPES = "depgraph.excludedScopes";
    public static final String PROJECT_TIMEOUT_SECONDS = "depgraph.projectTimeoutSeconds";

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    public AnalyzerConfig {
        if (parallelism < 0) {
            throw new IllegalArgumentException(PARALLELISM + " must not be negative: " + parallelism);
        }
        if (projectTimeoutSeconds < 0) {
            throw new IllegalArgumentException(
                    PROJECT_TIMEOUT_SECONDS + " must not be negative: " + projectTimeoutSeconds);
        }
        excludedScopes = List.copyOf(excludedScopes);
    }

    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(0, List.of(), 0);
    }

    /** Loads the classpath defaults overlaid with system properties. */
    public static AnalyzerConfig load() {
        return load(null);
    }

    /**
     * Loads the classpath defaults, overlays {@code externalFile} if it exists, then system properties.
     */
    public static AnalyzerConfig load(@Nullable Path externalFile) {
        var props = new Properties();

        try (InputStream in = AnalyzerConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            logger.warn("Failed to read {} from classpath: {}", DEFAULTS_RESOURCE, e.getMessage());
        }

        if (externalFile != null && Files.exists(externalFile)) {
            try (var reader = Files.newBufferedReader(externalFile)) {
                props.load(reader);
                logger.debug("Loaded analyzer configuration from {}", externalFile);
            } catch (IOException e) {
                logger.error("Failed to load analyzer configuration from {}: {}", externalFile, e.getMessage());
            }
        }

        for (var key : List.of(PARALLELISM, EXCLUDED_SCOPES, PROJECT_TIMEOUT_SECONDS)) {
            var value = System.getProperty(key);
            if (value != null) {
                props.setProperty(key, value);
            }
        }

        return fromProperties(props);
    }

    /**
     * @throws IllegalArgumentException if a numeric value is malformed or negative
     */
    public static AnalyzerConfig fromProperties(Properties props) {
        return new AnalyzerConfig(
                parseInt(props, PARALLELISM, 0),
                LIST_SPLITTER.splitToList(props.getProperty(EXCLUDED_SCOPES, "")),
                parseLong(props, PROJECT_TIMEOUT_SECONDS, 0));
    }

    /** The number of worker threads to actually use. */
    public int effectiveParallelism() {
        return parallelism > 0 ? parallelism : Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public ScopeExcludes scopeExcludes() {
        return ScopeExcludes.of(excludedScopes);
    }

    public AnalyzerConfig withParallelism(int newParallelism) {
        return new AnalyzerConfig(newParallelism, excludedScopes, projectTimeoutSeconds);
    }

    public AnalyzerConfig withExcludedScopes(List<String> patterns) {
        return new AnalyzerConfig(parallelism, patterns, projectTimeoutSeconds);
    }

    public AnalyzerConfig withProjectTimeoutSeconds(long seconds) {
        return new AnalyzerConfig(parallelism, excludedScopes, seconds);
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        var value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": '" + value + "'", e);
        }
    }

    private static long parseLong(Properties props, String key, long defaultValue) {
        var value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": '" + value + "'", e);
        }
    }
}
