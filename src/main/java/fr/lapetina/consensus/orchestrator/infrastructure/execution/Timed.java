package fr.lapetina.consensus.orchestrator.infrastructure.execution;

import java.time.Duration;

/**
 * A value together with the time it took to produce.
 */
public record Timed<T>(T value, Duration elapsed) {
}
