package fr.lapetina.consensus.orchestrator.domain.backend;

import fr.lapetina.consensus.orchestrator.domain.model.BackendConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferenceBackendTest {

    private static ReferenceBackend backend(String pattern, double delaySeconds) {
        return new ReferenceBackend(BackendConfig.builder()
                .backendId("ref-" + pattern)
                .param(ReferenceBackend.PARAM_RESPONSE_PATTERN, pattern)
                .param(ReferenceBackend.PARAM_RESPONSE_DELAY, delaySeconds)
                .build());
    }

    @Nested
    @DisplayName("generateResponse")
    class GenerateResponse {

        @Test
        @DisplayName("should pick the database template on SQL keywords")
        void shouldPickDatabaseTemplate() {
            String response = backend("analytical", 0).generateResponse("Optimize this SQL join", null).join();

            assertThat(response).startsWith("Based on analytical assessment: Optimize this SQL join.");
        }

        @Test
        @DisplayName("should pick the data template on data keywords")
        void shouldPickDataTemplate() {
            String response = backend("creative", 0).generateResponse("Summarize the data", null).join();

            assertThat(response).startsWith("Creative insight on: Summarize the data.");
        }

        @Test
        @DisplayName("should fall back to the generic template")
        void shouldFallBackToGenericTemplate() {
            String response = backend("conservative", 0).generateResponse("Hello there", null).join();

            assertThat(response).startsWith("Conservative response to: Hello there.");
        }

        @Test
        @DisplayName("should sign default answers with the backend id")
        void shouldSignDefaultAnswers() {
            String response = backend("unknown-pattern", 0).generateResponse("Anything", null).join();

            assertThat(response).isEqualTo(
                    "Standard response to: Anything. This is a general-purpose answer from ref-unknown-pattern.");
        }

        @Test
        @DisplayName("should simulate the configured latency")
        void shouldSimulateLatency() throws Exception {
            ReferenceBackend slow = backend("analytical", 0.2);
            long start = System.nanoTime();

            slow.generateResponse("query", null).get(5, TimeUnit.SECONDS);

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertThat(slow.getDelayMillis()).isEqualTo(200);
            assertThat(elapsedMs).isGreaterThanOrEqualTo(190);
        }
    }

    @Nested
    @DisplayName("getConfidence")
    class GetConfidence {

        @Test
        @DisplayName("should stay within [0, 1] for any content")
        void shouldStayWithinBounds() {
            ReferenceBackend generous = new ReferenceBackend(BackendConfig.builder()
                    .backendId("generous")
                    .param(ReferenceBackend.PARAM_BASE_CONFIDENCE, 0.98)
                    .param(ReferenceBackend.PARAM_CONFIDENCE_JITTER, 0.1)
                    .build());
            ReferenceBackend pessimist = new ReferenceBackend(BackendConfig.builder()
                    .backendId("pessimist")
                    .param(ReferenceBackend.PARAM_BASE_CONFIDENCE, 0.02)
                    .build());
            List<String> contents = List.of("", "x", "short answer", "a".repeat(60), "b".repeat(500));

            for (int i = 0; i < 200; i++) {
                for (String content : contents) {
                    assertThat(generous.getConfidence("q", content)).isBetween(0.0, 1.0);
                    assertThat(pessimist.getConfidence("q", content)).isBetween(0.0, 1.0);
                }
            }
        }

        @Test
        @DisplayName("should penalize short and reward long responses")
        void shouldAdjustByLength() {
            ReferenceBackend exact = new ReferenceBackend(BackendConfig.builder()
                    .backendId("exact")
                    .param(ReferenceBackend.PARAM_BASE_CONFIDENCE, 0.5)
                    .param(ReferenceBackend.PARAM_CONFIDENCE_JITTER, 0)
                    .build());

            assertThat(exact.getConfidence("q", "tiny")).isCloseTo(0.4, within());
            assertThat(exact.getConfidence("q", "m".repeat(100))).isCloseTo(0.5, within());
            assertThat(exact.getConfidence("q", "l".repeat(300))).isCloseTo(0.55, within());
        }

        @Test
        @DisplayName("should penalize complex queries")
        void shouldPenalizeComplexQueries() {
            ReferenceBackend exact = new ReferenceBackend(BackendConfig.builder()
                    .backendId("exact")
                    .param(ReferenceBackend.PARAM_BASE_CONFIDENCE, 0.5)
                    .param(ReferenceBackend.PARAM_CONFIDENCE_JITTER, 0)
                    .build());
            String complexQuery = "one two three four five six seven eight nine ten eleven";

            assertThat(exact.getConfidence(complexQuery, "m".repeat(100))).isCloseTo(0.45, within());
        }

        @Test
        @DisplayName("should be reproducible with a seed")
        void shouldBeReproducibleWithSeed() {
            BackendConfig config = BackendConfig.builder()
                    .backendId("seeded")
                    .param(ReferenceBackend.PARAM_SEED, 42)
                    .build();
            ReferenceBackend first = new ReferenceBackend(config);
            ReferenceBackend second = new ReferenceBackend(config);

            for (int i = 0; i < 10; i++) {
                assertThat(first.getConfidence("q", "content"))
                        .isEqualTo(second.getConfidence("q", "content"));
            }
        }

        @Test
        @DisplayName("should reject non-finite confidence settings")
        void shouldRejectNonFiniteSettings() {
            BackendConfig nanBase = BackendConfig.builder()
                    .backendId("nan-base")
                    .param(ReferenceBackend.PARAM_BASE_CONFIDENCE, "NaN")
                    .build();
            BackendConfig infiniteJitter = BackendConfig.builder()
                    .backendId("wild")
                    .param(ReferenceBackend.PARAM_CONFIDENCE_JITTER, Double.POSITIVE_INFINITY)
                    .build();

            assertThatThrownBy(() -> new ReferenceBackend(nanBase))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("base_confidence");
            assertThatThrownBy(() -> new ReferenceBackend(infiniteJitter))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("confidence_jitter");
        }

        private org.assertj.core.data.Offset<Double> within() {
            return org.assertj.core.data.Offset.offset(1e-9);
        }
    }

    @Test
    @DisplayName("default health check should pass for a responding backend")
    void healthCheckShouldPass() {
        assertThat(backend("analytical", 0).healthCheck().join()).isTrue();
    }

    @Test
    @DisplayName("default health check should fail when generation throws")
    void healthCheckShouldFailOnException() {
        ModelBackend broken = new ModelBackend() {
            @Override
            public String getBackendId() {
                return "broken";
            }

            @Override
            public java.util.concurrent.CompletableFuture<String> generateResponse(
                    String query, fr.lapetina.consensus.orchestrator.domain.model.QueryContext context) {
                throw new IllegalStateException("down");
            }

            @Override
            public double getConfidence(String query, String response) {
                return 0;
            }
        };

        assertThat(broken.healthCheck().join()).isFalse();
    }

    @Test
    @DisplayName("default health check should fail on blank answers")
    void healthCheckShouldFailOnBlankAnswer() {
        ModelBackend mute = new ModelBackend() {
            @Override
            public String getBackendId() {
                return "mute";
            }

            @Override
            public java.util.concurrent.CompletableFuture<String> generateResponse(
                    String query, fr.lapetina.consensus.orchestrator.domain.model.QueryContext context) {
                return java.util.concurrent.CompletableFuture.completedFuture("   ");
            }

            @Override
            public double getConfidence(String query, String response) {
                return 0;
            }
        };

        assertThat(mute.healthCheck().join()).isFalse();
    }
}
