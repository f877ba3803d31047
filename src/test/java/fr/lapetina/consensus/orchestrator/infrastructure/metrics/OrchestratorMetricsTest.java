package fr.lapetina.consensus.orchestrator.infrastructure.metrics;

import fr.lapetina.consensus.orchestrator.domain.model.ModelResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class OrchestratorMetricsTest {

    private SimpleMeterRegistry registry;
    private OrchestratorMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new OrchestratorMetrics(registry, "test");
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should count responses per backend and status")
    void shouldCountResponses() {
        metrics.recordResponse(ModelResponse.success("a", "ok", 0.9, Duration.ofMillis(40)));
        metrics.recordResponse(ModelResponse.success("a", "ok", 0.9, Duration.ofMillis(60)));
        metrics.recordResponse(ModelResponse.timeout("a", Duration.ofMillis(500)));

        assertThat(registry.get("test_responses_total").tags("backend", "a", "status", "SUCCESS")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get("test_responses_total").tags("backend", "a", "status", "TIMEOUT")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("test_execution_latency").tag("backend", "a").timer().count()).isEqualTo(3);
        assertThat(registry.get("test_execution_latency").tag("backend", "a").timer()
                .totalTime(TimeUnit.MILLISECONDS)).isEqualTo(600.0);
    }

    @Test
    @DisplayName("should count circuit openings per backend")
    void shouldCountCircuitOpenings() {
        metrics.recordCircuitOpened("b");
        metrics.recordCircuitOpened("b");

        assertThat(registry.get("test_circuit_opened_total").tag("backend", "b").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("should expose health and pool size gauges")
    void shouldExposeGauges() {
        metrics.recordHealth("c", true);
        assertThat(registry.get("test_backend_healthy").tag("backend", "c").gauge().value()).isEqualTo(1.0);

        metrics.recordHealth("c", false);
        assertThat(registry.get("test_backend_healthy").tag("backend", "c").gauge().value()).isZero();

        metrics.setCandidatePoolSize(4);
        assertThat(registry.get("test_candidate_pool_size").gauge().value()).isEqualTo(4.0);
    }

    @Test
    @DisplayName("scrape should be empty without a Prometheus registry")
    void scrapeShouldBeEmptyWithoutPrometheus() {
        assertThat(metrics.scrape()).isEmpty();
    }

    @Test
    @DisplayName("Prometheus metrics should render recorded counters")
    void prometheusShouldRenderCounters() {
        try (OrchestratorMetrics prometheus = OrchestratorMetrics.prometheus("scraped")) {
            prometheus.recordResponse(ModelResponse.error("d", "boom", Duration.ofMillis(5)));

            assertThat(prometheus.scrape())
                    .contains("scraped_responses_total")
                    .contains("backend=\"d\"")
                    .contains("status=\"ERROR\"");
        }
    }
}
