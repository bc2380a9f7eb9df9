package io.arithma.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

/**
 * Tests for {@link ConfigLoader}. Loads classpath fixtures, checks that missing keys fall back to
 * the defaults, that environment variables win over the file and that bad input fails with a
 * descriptive {@link ConfigLoadException}.
 */
@DisplayName("Engine configuration loader")
class ConfigLoaderTest {

    private static final Map<String, String> NO_ENV = Map.of();

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class
                .getClassLoader()
                .getResource("config/" + name)
                .toURI());
    }

    @Nested
    @DisplayName("YAML files")
    class YamlFiles {

        @Test
        @DisplayName("Minimal config → explicit key plus defaults")
        void minimalConfig() throws Exception {
            EngineConfig config = ConfigLoader.load(fixture("minimal-config.yaml"), NO_ENV::get);

            assertThat(config.maxUnrollTerms()).isEqualTo(4);
            assertThat(config.inlineBoundVariables()).isFalse();
            assertThat(config.integrationConstant()).isEqualTo(" + C");
            assertThat(config.summationMaxTerms()).isEqualTo(1_000_000L);
        }

        @Test
        @DisplayName("Full config → every field populated")
        void fullConfig() throws Exception {
            EngineConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV::get);

            assertThat(config)
                    .isEqualTo(EngineConfig.builder()
                            .maxUnrollTerms(25)
                            .inlineBoundVariables(true)
                            .integrationConstant(" + K")
                            .summationMaxTerms(5000)
                            .build());
        }

        @Test
        @DisplayName("Empty file → defaults")
        void emptyFile(@TempDir Path tempDir) throws IOException {
            Path empty = Files.writeString(tempDir.resolve("empty.yaml"), "");

            assertThat(ConfigLoader.load(empty, NO_ENV::get)).isEqualTo(EngineConfig.DEFAULT);
        }
    }

    @Nested
    @DisplayName("Environment overrides")
    class EnvironmentOverrides {

        @Test
        @DisplayName("Env vars win over YAML values")
        void envWinsOverFile() throws Exception {
            var env = Map.of(
                    ConfigLoader.ENV_MAX_UNROLL_TERMS, " 7 ",
                    ConfigLoader.ENV_INLINE_BOUND_VARIABLES, "false",
                    ConfigLoader.ENV_SUMMATION_MAX_TERMS, "42");

            EngineConfig config = ConfigLoader.load(fixture("full-config.yaml"), env::get);

            assertThat(config.maxUnrollTerms()).isEqualTo(7);
            assertThat(config.inlineBoundVariables()).isFalse();
            assertThat(config.summationMaxTerms()).isEqualTo(42L);
            assertThat(config.integrationConstant()).isEqualTo(" + K");
        }

        @Test
        @DisplayName("Integration constant is taken verbatim")
        void integrationConstantIsNotTrimmed() {
            EngineConfig config =
                    ConfigLoader.fromEnvironment(Map.of(ConfigLoader.ENV_INTEGRATION_CONSTANT, " + D")::get);

            assertThat(config.integrationConstant()).isEqualTo(" + D");
        }

        @Test
        @DisplayName("Blank env vars are ignored")
        void blankValuesAreIgnored() {
            EngineConfig config = ConfigLoader.fromEnvironment(Map.of(
                            ConfigLoader.ENV_MAX_UNROLL_TERMS, "   ",
                            ConfigLoader.ENV_INTEGRATION_CONSTANT, "")
                    ::get);

            assertThat(config).isEqualTo(EngineConfig.DEFAULT);
        }

        @Test
        @DisplayName("Non-numeric env var → ConfigLoadException")
        void nonNumericEnvVar() {
            var env = Map.of(ConfigLoader.ENV_SUMMATION_MAX_TERMS, "lots");

            assertThatThrownBy(() -> ConfigLoader.fromEnvironment(env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Environment variable ARITHMA_SUMMATION_MAX_TERMS must be an integer, got: lots")
                    .hasCauseInstanceOf(NumberFormatException.class);
        }
    }

    @Nested
    @DisplayName("Error paths")
    class ErrorPaths {

        @Test
        @DisplayName("Missing file → ConfigLoadException")
        void missingFile(@TempDir Path tempDir) {
            Path missing = tempDir.resolve("nope.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(missing, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Configuration file not found: " + missing);
        }

        @Test
        @DisplayName("Malformed YAML → ConfigLoadException with cause")
        void malformedYaml() throws Exception {
            Path path = fixture("malformed-config.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(path, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Failed to parse YAML configuration: " + path)
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("Non-integer value → ConfigLoadException")
        void nonIntegerValue() throws Exception {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("invalid-config.yaml"), NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Configuration key 'max-unroll-terms' must be an integer")
                    .hasMessageContaining("ten");
        }

        @Test
        @DisplayName("Negative unroll limit → ConfigLoadException")
        void negativeUnrollLimit() throws Exception {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("negative-unroll-config.yaml"), NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Invalid engine configuration: maxUnrollTerms must not be negative, got: -1")
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Zero summation limit from env → ConfigLoadException")
        void zeroSummationLimit() {
            var env = Map.of(ConfigLoader.ENV_SUMMATION_MAX_TERMS, "0");

            assertThatThrownBy(() -> ConfigLoader.fromEnvironment(env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Invalid engine configuration: summationMaxTerms must be positive");
        }
    }

    @Nested
    @DisplayName("Logging")
    class Logging {

        private ListAppender<ILoggingEvent> logAppender;
        private Logger loaderLogger;

        @BeforeEach
        void setUp() {
            loaderLogger = (Logger) LoggerFactory.getLogger(ConfigLoader.class);
            logAppender = new ListAppender<>();
            logAppender.start();
            loaderLogger.addAppender(logAppender);
        }

        @AfterEach
        void tearDown() {
            loaderLogger.detachAppender(logAppender);
            logAppender.stop();
        }

        @Test
        @DisplayName("Successful load is logged at INFO with the source path")
        void loadIsLogged() throws Exception {
            Path path = fixture("minimal-config.yaml");

            ConfigLoader.load(path, NO_ENV::get);

            assertThat(logAppender.list).hasSize(1);
            ILoggingEvent event = logAppender.list.get(0);
            assertThat(event.getLevel()).isEqualTo(Level.INFO);
            assertThat(event.getFormattedMessage())
                    .startsWith("Loaded engine configuration from " + path)
                    .contains("maxUnrollTerms=4");
        }
    }
}
