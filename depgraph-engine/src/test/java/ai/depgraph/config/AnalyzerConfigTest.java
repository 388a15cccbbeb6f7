package ai.depgraph.config;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AnalyzerConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty(AnalyzerConfig.PARALLELISM);
        System.clearProperty(AnalyzerConfig.EXCLUDED_SCOPES);
        System.clearProperty(AnalyzerConfig.PROJECT_TIMEOUT_SECONDS);
    }

    @Test
    void classpathDefaultsMatchBuiltInDefaults() {
        assertEquals(AnalyzerConfig.defaults(), AnalyzerConfig.load());
    }

    @Test
    void propertiesAreParsed() {
        var props = new Properties();
        props.setProperty(AnalyzerConfig.PARALLELISM, " 3 ");
        props.setProperty(AnalyzerConfig.EXCLUDED_SCOPES, "test, provided ,, system");
        props.setProperty(AnalyzerConfig.PROJECT_TIMEOUT_SECONDS, "120");

        var config = AnalyzerConfig.fromProperties(props);

        assertEquals(3, config.parallelism());
        assertEquals(3, config.effectiveParallelism());
        assertEquals(List.of("test", "provided", "system"), config.excludedScopes());
        assertEquals(120, config.projectTimeoutSeconds());
    }

    @Test
    void externalFileAndSystemPropertiesOverrideDefaults() throws IOException {
        var file = tempDir.resolve("analyzer.properties");
        Files.writeString(file, "depgraph.parallelism=2\ndepgraph.excludedScopes=test.*\n");
        System.setProperty(AnalyzerConfig.PARALLELISM, "6");

        var config = AnalyzerConfig.load(file);

        assertEquals(6, config.parallelism());
        assertEquals(List.of("test.*"), config.excludedScopes());
        assertEquals(0, config.projectTimeoutSeconds());
    }

    @Test
    void missingExternalFileIsIgnored() {
        assertEquals(AnalyzerConfig.defaults(), AnalyzerConfig.load(tempDir.resolve("absent.properties")));
    }

    @Test
    void invalidValuesAreRejected() {
        var props = new Properties();
        props.setProperty(AnalyzerConfig.PARALLELISM, "many");
        assertThrows(IllegalArgumentException.class, () -> AnalyzerConfig.fromProperties(props));

        props.setProperty(AnalyzerConfig.PARALLELISM, "-1");
        assertThrows(IllegalArgumentException.class, () -> AnalyzerConfig.fromProperties(props));

        assertThrows(IllegalArgumentException.class, () -> AnalyzerConfig.defaults().withProjectTimeoutSeconds(-5));
    }

    @Test
    void zeroParallelismUsesAvailableProcessors() {
        assertEquals(
                Runtime.getRuntime().availableProcessors(), AnalyzerConfig.defaults().effectiveParallelism());
    }
}
