package fr.lapetina.consensus.orchestrator.domain.backend;

import fr.lapetina.consensus.orchestrator.domain.model.BackendConfig;
import fr.lapetina.consensus.orchestrator.domain.model.QueryContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Deterministic test double.
 *
 * Recognised parameters:
 * - response_pattern: analytical, creative, conservative or default
 * - base_confidence: starting confidence, default 0.8
 * - response_delay: simulated latency in seconds, default 0.1
 * - confidence_jitter: half-width of the random confidence jitter, default 0.1
 * - seed: optional seed making the jitter reproducible
 */
public final class ReferenceBackend implements ModelBackend {

    private static final Logger log = LoggerFactory.getLogger(ReferenceBackend.class);

    public static final String PARAM_RESPONSE_PATTERN = "response_pattern";
    public static final String PARAM_BASE_CONFIDENCE = "base_confidence";
    public static final String PARAM_RESPONSE_DELAY = "response_delay";
    public static final String PARAM_CONFIDENCE_JITTER = "confidence_jitter";
    public static final String PARAM_SEED = "seed";

    static final int SHORT_RESPONSE_LENGTH = 50;
    static final int LONG_RESPONSE_LENGTH = 200;
    static final int COMPLEX_QUERY_WORDS = 10;

    private final String backendId;
    private final ResponsePattern pattern;
    private final double baseConfidence;
    private final long delayMillis;
    private final double jitter;
    private final Random random;

    public ReferenceBackend(BackendConfig config) {
        this.backendId = config.backendId();
        this.pattern = ResponsePattern.fromName(config.stringParam(PARAM_RESPONSE_PATTERN, "default"));
        this.baseConfidence = requireFinite(config, PARAM_BASE_CONFIDENCE, 0.8);
        this.delayMillis = Math.max(0, Math.round(requireFinite(config, PARAM_RESPONSE_DELAY, 0.1) * 1000));
        this.jitter = Math.abs(requireFinite(config, PARAM_CONFIDENCE_JITTER, 0.1));
        this.random = config.params().containsKey(PARAM_SEED)
                ? new Random(config.longParam(PARAM_SEED, 0))
                : new Random();
        log.debug("Reference backend created: backendId={}, pattern={}, delayMs={}",
                backendId, pattern, delayMillis);
    }

    private static double requireFinite(BackendConfig config, String key, double defaultValue) {
        double value = config.doubleParam(key, defaultValue);
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(
                    "Parameter '" + key + "' of backend " + config.backendId() + " must be finite, got " + value);
        }
        return value;
    }

    @Override
    public String getBackendId() {
        return backendId;
    }

    @Override
    public CompletableFuture<String> generateResponse(String query, QueryContext context) {
        return CompletableFuture.supplyAsync(
                () -> pattern.render(query, backendId),
                CompletableFuture.delayedExecutor(delayMillis, TimeUnit.MILLISECONDS)
        );
    }

    @Override
    public double getConfidence(String query, String response) {
        double confidence = baseConfidence;

        int length = response != null ? response.length() : 0;
        if (length < SHORT_RESPONSE_LENGTH) {
            confidence *= 0.8;
        } else if (length > LONG_RESPONSE_LENGTH) {
            confidence *= 1.1;
        }

        if (query != null && query.trim().split("\\s+").length > COMPLEX_QUERY_WORDS) {
            confidence *= 0.9;
        }

        if (jitter > 0) {
            confidence += (random.nextDouble() * 2 - 1) * jitter;
        }

        return Math.max(0.0, Math.min(1.0, confidence));
    }

    public ResponsePattern getPattern() {
        return pattern;
    }

    public long getDelayMillis() {
        return delayMillis;
    }

    @Override
    public String toString() {
        return "ReferenceBackend{" +
                "backendId='" + backendId + '\'' +
                ", pattern=" + pattern +
                ", delayMs=" + delayMillis +
                '}';
    }
}
