package fr.lapetina.consensus.orchestrator.infrastructure.json;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.consensus.orchestrator.domain.backend.BackendKind;
import fr.lapetina.consensus.orchestrator.domain.model.BackendInfo;
import fr.lapetina.consensus.orchestrator.domain.model.ModelResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseJsonTest {

    private final ResponseJson json = new ResponseJson();

    private JsonNode parse(String text) throws Exception {
        return json.getObjectMapper().readTree(text);
    }

    @Test
    @DisplayName("should render responses in order with snake_case keys")
    void shouldRenderResponses() throws Exception {
        List<ModelResponse> responses = List.of(
                ModelResponse.success("a", "answer", 0.8, Duration.ofMillis(1500)),
                ModelResponse.error("b", "boom", Duration.ofMillis(20)),
                ModelResponse.disabled("c", "Model is disabled")
        );

        JsonNode root = parse(json.writeResponses(responses));

        assertThat(root.isArray()).isTrue();
        assertThat(root.size()).isEqualTo(3);

        JsonNode success = root.get(0);
        assertThat(success.get("model_id").asText()).isEqualTo("a");
        assertThat(success.get("status").asText()).isEqualTo("success");
        assertThat(success.get("content").asText()).isEqualTo("answer");
        assertThat(success.get("confidence").asDouble()).isEqualTo(0.8);
        assertThat(success.get("execution_time").asDouble()).isEqualTo(1.5);
        assertThat(success.has("error_message")).isFalse();
        assertThat(success.get("timestamp").isTextual()).isTrue();

        JsonNode error = root.get(1);
        assertThat(error.get("status").asText()).isEqualTo("error");
        assertThat(error.get("error_message").asText()).isEqualTo("boom");
        assertThat(error.has("content")).isFalse();
        assertThat(error.has("confidence")).isFalse();

        assertThat(root.get(2).get("status").asText()).isEqualTo("disabled");
        assertThat(root.get(2).get("execution_time").asDouble()).isZero();
    }

    @Test
    @DisplayName("should render backend descriptions keyed by id")
    void shouldRenderBackends() throws Exception {
        Map<String, BackendInfo> backends = new LinkedHashMap<>();
        backends.put("first", new BackendInfo(BackendKind.REFERENCE, 0.8, Duration.ofSeconds(30), true, 2));
        backends.put("second", new BackendInfo(BackendKind.REFERENCE, 1.0, Duration.ofMillis(500), false, 0));

        JsonNode root = parse(json.writeBackends(backends));

        assertThat(root.fieldNames()).toIterable().containsExactly("first", "second");
        JsonNode first = root.get("first");
        assertThat(first.get("model_type").asText()).isEqualTo("reference");
        assertThat(first.get("weight").asDouble()).isEqualTo(0.8);
        assertThat(first.get("timeout").asDouble()).isEqualTo(30.0);
        assertThat(first.get("enabled").asBoolean()).isTrue();
        assertThat(first.get("max_retries").asInt()).isEqualTo(2);
        assertThat(root.get("second").get("timeout").asDouble()).isEqualTo(0.5);
    }
}
