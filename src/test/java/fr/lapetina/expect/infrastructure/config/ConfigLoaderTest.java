package fr.lapetina.expect.infrastructure.config;

import fr.lapetina.expect.infrastructure.config.ConfigLoader.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @TempDir
    Path dir;

    @Nested
    @DisplayName("Loading")
    class LoadingTests {

        @Test
        @DisplayName("should load configuration from the classpath")
        void shouldLoadFromClasspath() {
            ExpectationConfig config = new ConfigLoader("config/custom-expect.yaml").load();

            assertThat(config.getReporter().getVerb()).isEqualTo("I expected");
            assertThat(config.getReporter().getIndent()).isEqualTo(2);
            assertThat(config.getReporter().getRootBullet()).isEqualTo("*");
            assertThat(config.getFormatter().isShowTypes()).isTrue();
            assertThat(config.getFormatter().getMaxStringLength()).isEqualTo(10);
        }

        @Test
        @DisplayName("should keep defaults for settings missing in the file")
        void shouldKeepDefaultsForMissingSettings() {
            ExpectationConfig config = new ConfigLoader("config/custom-expect.yaml").load();

            assertThat(config.getReporter().getType()).isEqualTo("text");
            assertThat(config.getReporter().getThrownVerb()).isEqualTo("expected the thrown exception");
            assertThat(config.getFormatter().getNotAvailablePrefix()).isEqualTo("❗❗");
        }

        @Test
        @DisplayName("should load configuration from the file system")
        void shouldLoadFromFileSystem() throws IOException {
            Path file = Files.writeString(dir.resolve("expect.yaml"), "reporter:\n  indent: 8\n");

            ExpectationConfig config = new ConfigLoader(file.toString()).load();

            assertThat(config.getReporter().getIndent()).isEqualTo(8);
            assertThat(config.getReporter().getVerb()).isEqualTo("expected the subject");
        }

        @Test
        @DisplayName("should use defaults for an empty file")
        void shouldUseDefaultsForEmptyFile() throws IOException {
            Path file = Files.writeString(dir.resolve("empty.yaml"), "");

            ExpectationConfig config = new ConfigLoader(file.toString()).load();

            assertThat(config.getReporter().getIndent()).isEqualTo(4);
            assertThat(config.getFormatter().getMaxStringLength()).isEqualTo(1000);
        }

        @Test
        @DisplayName("should load configuration from a stream")
        void shouldLoadFromStream() {
            String yaml = "formatter:\n  showTypes: true\n";

            ExpectationConfig config = new ConfigLoader("unused").loadFromStream(
                    new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

            assertThat(config.getFormatter().isShowTypes()).isTrue();
        }
    }

    @Nested
    @DisplayName("Missing or invalid configuration")
    class ErrorTests {

        @Test
        @DisplayName("should fail when the configuration does not exist")
        void shouldFailWhenMissing() {
            ConfigLoader loader = new ConfigLoader(dir.resolve("missing.yaml").toString());

            assertThatThrownBy(loader::load)
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageStartingWith("Configuration file not found: ");
        }

        @Test
        @DisplayName("should use defaults when the configuration does not exist")
        void shouldUseDefaultsWhenMissing() {
            ExpectationConfig config = new ConfigLoader(dir.resolve("missing.yaml").toString()).loadOrDefault();

            assertThat(config.getReporter().getType()).isEqualTo("text");
            assertThat(config.getReporter().getRootBullet()).isEqualTo("◆");
        }

        @Test
        @DisplayName("should fail on an unknown property")
        void shouldFailOnUnknownProperty() throws IOException {
            Path file = Files.writeString(dir.resolve("invalid.yaml"), "reporter:\n  colour: red\n");
            ConfigLoader loader = new ConfigLoader(file.toString());

            assertThatThrownBy(loader::loadOrDefault)
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageStartingWith("Invalid configuration in " + file);
        }

        @Test
        @DisplayName("should use defaults for an empty reporter section")
        void shouldUseDefaultsForEmptyReporterSection() throws IOException {
            Path file = Files.writeString(dir.resolve("reporter.yaml"), "reporter:\n");

            ExpectationConfig config = new ConfigLoader(file.toString()).load();

            assertThat(config.getReporter().getType()).isEqualTo("text");
            assertThat(config.getReporter().getIndent()).isEqualTo(4);
        }

        @Test
        @DisplayName("should use defaults for an empty formatter section")
        void shouldUseDefaultsForEmptyFormatterSection() throws IOException {
            Path file = Files.writeString(dir.resolve("formatter.yaml"), "formatter:\n");

            ExpectationConfig config = new ConfigLoader(file.toString()).load();

            assertThat(config.getFormatter().getMaxStringLength()).isEqualTo(1000);
            assertThat(config.getFormatter().getNotAvailablePrefix()).isEqualTo("❗❗");
        }

        @Test
        @DisplayName("should fail on a null reporter type")
        void shouldFailOnNullReporterType() throws IOException {
            Path file = Files.writeString(dir.resolve("type.yaml"), "reporter:\n  type: ~\n");
            ConfigLoader loader = new ConfigLoader(file.toString());

            assertThatThrownBy(loader::loadOrDefault)
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageStartingWith("Invalid configuration in " + file)
                    .hasMessageContaining("reporter.type is required");
        }

        @Test
        @DisplayName("should fail on a negative indent")
        void shouldFailOnNegativeIndent() throws IOException {
            Path file = Files.writeString(dir.resolve("indent.yaml"), "reporter:\n  indent: -2\n");
            ConfigLoader loader = new ConfigLoader(file.toString());

            assertThatThrownBy(loader::load)
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("reporter.indent must not be negative: -2");
        }

        @Test
        @DisplayName("should reject a configuration built in code without a reporter type")
        void shouldRejectConfigurationWithoutType() {
            ExpectationConfig config = ConfigLoader.createDefault();
            config.getReporter().setType(null);

            assertThatThrownBy(() -> ConfigLoader.validate(config))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("reporter.type is required");
        }
    }
}
