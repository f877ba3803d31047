package fr.lapetina.consensus.orchestrator.infrastructure.config;

import fr.lapetina.consensus.orchestrator.domain.backend.BackendKind;
import fr.lapetina.consensus.orchestrator.domain.model.BackendConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static ByteArrayInputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should load every section from the classpath")
    void shouldLoadFromClasspath() {
        OrchestratorConfig config = new ConfigLoader("test-config.yaml").load();

        assertThat(config.getBackends()).hasSize(3);
        assertThat(config.getCircuitBreaker().getFailureThreshold()).isEqualTo(3);
        assertThat(config.getCircuitBreaker().getCooldownMs()).isEqualTo(500);
        assertThat(config.getIsolation().getMemoryLimitMb()).isEqualTo(256);
        assertThat(config.getIsolation().getCpuLimitPercent()).isEqualTo(50);
        assertThat(config.getRetry().isEnabled()).isTrue();
        assertThat(config.getRetry().getBackoffMultiplier()).isEqualTo(2.0);
        assertThat(config.getHealthCheck().isEnabled()).isFalse();
        assertThat(config.getMetrics().getPrefix()).isEqualTo("test_orchestrator");
    }

    @Test
    @DisplayName("should map backend settings to validated backend configs")
    void shouldMapBackendSettings() {
        OrchestratorConfig config = new ConfigLoader("test-config.yaml").load();

        BackendConfig fast = config.getBackends().get(0).toBackendConfig();
        assertThat(fast.backendId()).isEqualTo("fast");
        assertThat(fast.kind()).isEqualTo(BackendKind.REFERENCE);
        assertThat(fast.weight()).isEqualTo(2.5);
        assertThat(fast.timeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(fast.maxRetries()).isEqualTo(1);
        assertThat(fast.stringParam("response_pattern", null)).isEqualTo("analytical");

        BackendConfig legacy = config.getBackends().get(1).toBackendConfig();
        assertThat(legacy.kind()).isEqualTo(BackendKind.REFERENCE);

        BackendConfig off = config.getBackends().get(2).toBackendConfig();
        assertThat(off.enabled()).isFalse();
    }

    @Test
    @DisplayName("should prefer a file on disk")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("custom.yaml");
        Files.writeString(file, """
                backends:
                  - id: disk
                circuitBreaker:
                  failureThreshold: 7
                """);

        OrchestratorConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getBackends()).extracting(OrchestratorConfig.BackendSettings::getId)
                .containsExactly("disk");
        assertThat(config.getCircuitBreaker().getFailureThreshold()).isEqualTo(7);
        assertThat(config.getCircuitBreaker().getCooldownMs()).isEqualTo(60000);
    }

    @Test
    @DisplayName("should fill in defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() {
        OrchestratorConfig config = new ConfigLoader("unused.yaml").loadFromStream(yaml(""));

        assertThat(config.getCircuitBreaker().getFailureThreshold()).isEqualTo(5);
        assertThat(config.getIsolation().getMemoryLimitMb()).isEqualTo(500);
        assertThat(config.getIsolation().getCpuLimitPercent()).isEqualTo(70);
        assertThat(config.getRetry().isEnabled()).isFalse();
        assertThat(config.getMetrics().getPrefix()).isEqualTo("model_orchestrator");
    }

    @Test
    @DisplayName("should fail on a missing file")
    void shouldFailOnMissingFile() {
        assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("Configuration file not found");
    }

    @Test
    @DisplayName("should fail on unknown properties")
    void shouldFailOnUnknownProperties() {
        assertThatThrownBy(() -> new ConfigLoader("unused.yaml").loadFromStream(yaml("bogus: true\n")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("Invalid configuration");
    }

    @Test
    @DisplayName("should reject an unsupported backend kind when building the backend config")
    void shouldRejectUnsupportedKind() {
        OrchestratorConfig config = new ConfigLoader("unused.yaml").loadFromStream(yaml("""
                backends:
                  - id: remote
                    kind: openai
                """));

        assertThatThrownBy(() -> config.getBackends().get(0).toBackendConfig())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported backend kind: openai");
    }
}
