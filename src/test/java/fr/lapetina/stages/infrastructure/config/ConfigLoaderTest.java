package fr.lapetina.stages.infrastructure.config;

import fr.lapetina.stages.domain.model.CancelMode;
import fr.lapetina.stages.infrastructure.config.ConfigLoader.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static PipelineConfig parse(String yaml) {
        ConfigLoader loader = new ConfigLoader("unused.yaml");
        return loader.loadFromStream(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Nested
    @DisplayName("loading")
    class LoadingTests {

        @Test
        @DisplayName("should load from the classpath")
        void shouldLoadFromClasspath() {
            try (ConfigLoader loader = new ConfigLoader("test-config.yaml")) {
                PipelineConfig config = loader.load();

                assertThat(config.getServer().getPort()).isZero();
                assertThat(config.getMailbox().getRingBufferSize()).isEqualTo(256);
                assertThat(config.getSubscription().getMinDemand()).isEqualTo(5);
                assertThat(config.getSubscription().getMaxDemand()).isEqualTo(10);
                assertThat(config.getMetrics().getPrefix()).isEqualTo("test_stages");
                assertThat(config.getDemo().isEnabled()).isFalse();
                assertThat(loader.getCurrentConfig()).isSameAs(config);
            }
        }

        @Test
        @DisplayName("should fill missing sections with defaults")
        void shouldApplyDefaults() {
            PipelineConfig config = parse("subscription:\n  minDemand: 1\n  maxDemand: 2\n");

            assertThat(config.getSubscription().getMaxDemand()).isEqualTo(2);
            assertThat(config.getSubscription().getCancelMode()).isEqualTo("permanent");
            assertThat(config.getMailbox().getRingBufferSize()).isEqualTo(1024);
            assertThat(config.getServer().getPort()).isEqualTo(8080);
        }

        @Test
        @DisplayName("should treat an empty document as all defaults")
        void shouldLoadEmptyDocument() {
            PipelineConfig config = parse("");

            assertThat(config.getSubscription().getMinDemand()).isEqualTo(750);
            assertThat(config.getSubscription().getMaxDemand()).isEqualTo(1000);
        }

        @Test
        @DisplayName("should fail on a missing file")
        void shouldFailOnMissingFile() {
            ConfigLoader loader = new ConfigLoader("does-not-exist.yaml");

            assertThatThrownBy(loader::load)
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        @DisplayName("should fail on malformed YAML")
        void shouldFailOnMalformedYaml() {
            assertThatThrownBy(() -> parse("subscription: [unclosed"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Invalid YAML");
        }
    }

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        @Test
        @DisplayName("should reject a min demand not below max demand")
        void shouldRejectInvertedWindow() {
            assertThatThrownBy(() -> parse("subscription:\n  minDemand: 10\n  maxDemand: 10\n"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("minDemand < maxDemand");
        }

        @Test
        @DisplayName("should reject a negative min demand")
        void shouldRejectNegativeMin() {
            assertThatThrownBy(() -> parse("subscription:\n  minDemand: -1\n  maxDemand: 10\n"))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("should reject an unknown cancel mode")
        void shouldRejectCancelMode() {
            assertThatThrownBy(() -> parse("subscription:\n  cancelMode: sometimes\n"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("sometimes");
        }

        @Test
        @DisplayName("should reject a ring buffer size that is not a power of 2")
        void shouldRejectRingBufferSize() {
            assertThatThrownBy(() -> parse("mailbox:\n  ringBufferSize: 1000\n"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("power of 2");
        }

        @Test
        @DisplayName("should reject an unknown demo dispatcher")
        void shouldRejectDispatcher() {
            assertThatThrownBy(() -> parse("demo:\n  dispatcher: roundrobin\n"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("demo.dispatcher");
        }

        @Test
        @DisplayName("should reject an out of range port")
        void shouldRejectPort() {
            assertThatThrownBy(() -> parse("server:\n  port: 70000\n"))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("should parse cancel modes case-insensitively")
        void shouldParseCancelMode() {
            assertThat(ConfigLoader.parseCancelMode("temporary")).isEqualTo(CancelMode.TEMPORARY);
            assertThat(ConfigLoader.parseCancelMode(" Transient ")).isEqualTo(CancelMode.TRANSIENT);
            assertThat(ConfigLoader.parseCancelMode("PERMANENT")).isEqualTo(CancelMode.PERMANENT);
            assertThatThrownBy(() -> ConfigLoader.parseCancelMode(null))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("reload")
    class ReloadTests {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("should notify listeners with the previous and new configuration")
        void shouldNotifyListeners() throws IOException {
            Path file = tempDir.resolve("pipeline.yaml");
            Files.writeString(file, "subscription:\n  minDemand: 5\n  maxDemand: 10\n");
            List<PipelineConfig[]> changes = new ArrayList<>();

            try (ConfigLoader loader = new ConfigLoader(file.toString())) {
                loader.addListener((oldConfig, newConfig) -> changes.add(new PipelineConfig[]{oldConfig, newConfig}));
                loader.load();

                Files.writeString(file, "subscription:\n  minDemand: 50\n  maxDemand: 100\n");
                PipelineConfig reloaded = loader.reload();

                assertThat(reloaded.getSubscription().getMaxDemand()).isEqualTo(100);
                assertThat(changes).hasSize(2);
                assertThat(changes.get(0)[0]).isNull();
                assertThat(changes.get(1)[0].getSubscription().getMaxDemand()).isEqualTo(10);
                assertThat(changes.get(1)[1]).isSameAs(reloaded);
            }
        }

        @Test
        @DisplayName("should keep the current configuration when the new one is invalid")
        void shouldKeepCurrentOnInvalidReload() throws IOException {
            Path file = tempDir.resolve("pipeline.yaml");
            Files.writeString(file, "subscription:\n  minDemand: 5\n  maxDemand: 10\n");

            try (ConfigLoader loader = new ConfigLoader(file.toString())) {
                PipelineConfig original = loader.load();

                Files.writeString(file, "subscription:\n  minDemand: 20\n  maxDemand: 10\n");
                PipelineConfig afterReload = loader.reload();

                assertThat(afterReload).isSameAs(original);
                assertThat(loader.getCurrentConfig()).isSameAs(original);
            }
        }

        @Test
        @DisplayName("should isolate a failing listener")
        void shouldIsolateFailingListener() {
            List<PipelineConfig> seen = new ArrayList<>();
            ConfigLoader loader = new ConfigLoader("unused.yaml");
            loader.addListener((oldConfig, newConfig) -> {
                throw new IllegalStateException("boom");
            });
            loader.addListener((oldConfig, newConfig) -> seen.add(newConfig));

            PipelineConfig config = loader.loadFromStream(new ByteArrayInputStream(new byte[0]));

            assertThat(seen).containsExactly(config);
        }
    }
}
