package fr.lapetina.advisor.llm.infrastructure.config;

import fr.lapetina.advisor.llm.infrastructure.config.ConfigLoader.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @TempDir
    Path dir;

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("load")
    class Load {

        @Test
        @DisplayName("should load from the classpath when no file exists")
        void shouldLoadFromClasspath() {
            AdvisorConfig config = new ConfigLoader("test-config.yaml").load();

            assertThat(config.getServer().getPort()).isZero();
            assertThat(config.getModel().getDevice()).isEqualTo("none");
            assertThat(config.getModel().isAutoResume()).isFalse();
            assertThat(config.getModel().getMaxNewTokens()).isEqualTo(16);
            assertThat(config.getStreaming().getChannelCapacity()).isEqualTo(8);
            assertThat(config.getEvents().getRingBufferSize()).isEqualTo(256);
            assertThat(config.getMetrics().getPrefix()).isEqualTo("test_llm");
            assertThat(config.getCatalog()).singleElement().satisfies(entry -> {
                assertThat(entry.getName()).isEqualTo("Tiny");
                assertThat(entry.getId()).isEqualTo("test/tiny-bigram");
                assertThat(entry.getOfficialWeightBytes()).isEqualTo(1024);
            });
        }

        @Test
        @DisplayName("should prefer the file system over the classpath")
        void shouldLoadFromFile() throws Exception {
            Path file = dir.resolve("config.yaml");
            Files.writeString(file, "server:\n  port: 9999\nmodel:\n  defaultModel: Qwen3-8B\n");

            AdvisorConfig config = new ConfigLoader(file.toString()).load();

            assertThat(config.getServer().getPort()).isEqualTo(9999);
            assertThat(config.getModel().getDefaultModel()).isEqualTo("Qwen3-8B");
            assertThat(config.getModel().getCacheDir()).isEqualTo("models");
        }

        @Test
        @DisplayName("should fail when the configuration cannot be found")
        void shouldFailWhenMissing() {
            assertThatThrownBy(() -> new ConfigLoader(dir.resolve("absent.yaml").toString()).load())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        @DisplayName("should apply defaults for an empty document")
        void shouldApplyDefaultsForEmptyDocument() {
            AdvisorConfig config = new ConfigLoader("unused.yaml").loadFromStream(yaml(""));

            assertThat(config.getServer().getPort()).isEqualTo(8090);
            assertThat(config.getModel().getPersistFile()).isEqualTo("data/llm_config.json");
            assertThat(config.getStreaming().getAbandonTimeoutMs()).isEqualTo(120000);
            assertThat(config.getDownload().isEnabled()).isFalse();
            assertThat(config.getCatalog()).isEmpty();
        }

        @Test
        @DisplayName("should fill in sections explicitly left empty")
        void shouldFillMissingSections() {
            AdvisorConfig config = new ConfigLoader("unused.yaml").loadFromStream(yaml("server:\nmetrics:\n"));

            assertThat(config.getServer()).isNotNull();
            assertThat(config.getMetrics().isEnabled()).isTrue();
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("should reject a ring buffer size that is not a power of two")
        void shouldRejectRingBufferSize() {
            assertThatThrownBy(() -> new ConfigLoader("unused.yaml")
                    .loadFromStream(yaml("events:\n  ringBufferSize: 100\n")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("ringBufferSize");
        }

        @Test
        @DisplayName("should reject a negative default temperature")
        void shouldRejectTemperature() {
            assertThatThrownBy(() -> new ConfigLoader("unused.yaml")
                    .loadFromStream(yaml("model:\n  defaultTemperature: -1.0\n")))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("should reject non-positive stream settings")
        void shouldRejectStreamSettings() {
            assertThatThrownBy(() -> new ConfigLoader("unused.yaml")
                    .loadFromStream(yaml("streaming:\n  channelCapacity: 0\n")))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> new ConfigLoader("unused.yaml")
                    .loadFromStream(yaml("streaming:\n  abandonTimeoutMs: 0\n")))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("should reject catalog entries without an id")
        void shouldRejectCatalogEntries() {
            assertThatThrownBy(() -> new ConfigLoader("unused.yaml")
                    .loadFromStream(yaml("catalog:\n  - name: Broken\n")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Catalog");
        }

        @Test
        @DisplayName("should reject malformed YAML")
        void shouldRejectMalformedYaml() {
            assertThatThrownBy(() -> new ConfigLoader("unused.yaml")
                    .loadFromStream(yaml("server: [unclosed\n")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Malformed");
        }
    }

    @Nested
    @DisplayName("reload")
    class Reload {

        @Test
        @DisplayName("should notify listeners with the previous and new configuration")
        void shouldNotifyListeners() throws Exception {
            Path file = dir.resolve("config.yaml");
            Files.writeString(file, "server:\n  port: 9001\n");
            ConfigLoader loader = new ConfigLoader(file.toString());
            List<String> ports = new ArrayList<>();
            loader.addListener((oldConfig, newConfig) -> ports.add(
                    (oldConfig == null ? "none" : String.valueOf(oldConfig.getServer().getPort()))
                            + "->" + newConfig.getServer().getPort()));

            loader.load();
            Files.writeString(file, "server:\n  port: 9002\n");
            AdvisorConfig reloaded = loader.reload();

            assertThat(reloaded.getServer().getPort()).isEqualTo(9002);
            assertThat(loader.getCurrentConfig()).isSameAs(reloaded);
            assertThat(ports).containsExactly("none->9001", "9001->9002");
        }

        @Test
        @DisplayName("should keep the current configuration when the new one is invalid")
        void shouldKeepCurrentOnError() throws Exception {
            Path file = dir.resolve("config.yaml");
            Files.writeString(file, "server:\n  port: 9001\n");
            ConfigLoader loader = new ConfigLoader(file.toString());
            AdvisorConfig initial = loader.load();

            Files.writeString(file, "events:\n  ringBufferSize: 3\n");

            assertThat(loader.reload()).isSameAs(initial);
            assertThat(loader.getCurrentConfig()).isSameAs(initial);
        }

        @Test
        @DisplayName("should keep notifying when a listener throws")
        void shouldIsolateListenerFailures() {
            ConfigLoader loader = new ConfigLoader("test-config.yaml");
            List<AdvisorConfig> seen = new ArrayList<>();
            loader.addListener((oldConfig, newConfig) -> {
                throw new IllegalStateException("listener failure");
            });
            loader.addListener((oldConfig, newConfig) -> seen.add(newConfig));

            AdvisorConfig config = loader.load();

            assertThat(seen).containsExactly(config);
        }
    }
}
