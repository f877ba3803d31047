package fr.lapetina.consensus.orchestrator.infrastructure.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.consensus.orchestrator.domain.model.BackendInfo;
import fr.lapetina.consensus.orchestrator.domain.model.ModelResponse;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JSON rendering of orchestrator results for the consensus layer.
 *
 * Field names use snake_case; absent optional fields are omitted.
 */
public final class ResponseJson {

    private final ObjectMapper objectMapper;

    public ResponseJson() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Renders responses as a JSON array, in the given order.
     */
    public String writeResponses(List<ModelResponse> responses) {
        List<ResponseView> views = responses.stream().map(ResponseView::of).toList();
        return write(views);
    }

    /**
     * Renders the backend description as a JSON object keyed by backend ID.
     */
    public String writeBackends(Map<String, BackendInfo> backends) {
        Map<String, BackendView> views = new LinkedHashMap<>();
        backends.forEach((backendId, info) -> views.put(backendId, BackendView.of(info)));
        return write(views);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize orchestrator output", e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    record ResponseView(
            @JsonProperty("model_id") String modelId,
            @JsonProperty("status") String status,
            @JsonProperty("content") String content,
            @JsonProperty("confidence") Double confidence,
            @JsonProperty("execution_time") double executionTime,
            @JsonProperty("error_message") String errorMessage,
            @JsonProperty("timestamp") Instant timestamp
    ) {
        static ResponseView of(ModelResponse response) {
            return new ResponseView(
                    response.backendId(),
                    response.status().name().toLowerCase(Locale.ROOT),
                    response.content(),
                    response.confidence(),
                    response.executionSeconds(),
                    response.errorMessage(),
                    response.timestamp()
            );
        }
    }

    record BackendView(
            @JsonProperty("model_type") String modelType,
            @JsonProperty("weight") double weight,
            @JsonProperty("timeout") double timeout,
            @JsonProperty("enabled") boolean enabled,
            @JsonProperty("max_retries") int maxRetries
    ) {
        static BackendView of(BackendInfo info) {
            return new BackendView(
                    info.kind().getName(),
                    info.weight(),
                    info.timeout().toMillis() / 1000.0,
                    info.enabled(),
                    info.maxRetries()
            );
        }
    }
}
