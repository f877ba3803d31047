/**
 * Model Orchestrator - parallel execution of one query across several independent backends.
 *
 * <p>A query is dispatched concurrently to every enabled backend whose circuit breaker
 * is closed. Each backend runs inside a resource isolation scope and under its own
 * deadline, and every attempt ends in a uniform
 * {@link fr.lapetina.consensus.orchestrator.domain.model.ModelResponse} (success, timeout
 * or error). The collected responses are handed to the consensus layer.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.consensus.orchestrator.ModelOrchestrator} - Backend registry, circuit
 *       breakers and parallel dispatch</li>
 *   <li>{@link fr.lapetina.consensus.orchestrator.OrchestratorFactory} - Wiring from YAML configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("orchestrator.yaml").start()) {
 *     ModelOrchestrator orchestrator = factory.getOrchestrator();
 *
 *     List<ModelResponse> responses = orchestrator
 *             .executeParallel("Which index speeds up this SQL query?", null, Duration.ofSeconds(5))
 *             .join();
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Per-backend deadlines that never cancel sibling backends</li>
 *   <li>Counter-based circuit breaker with timed recovery</li>
 *   <li>Pluggable resource isolation and optional retry with backoff</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.consensus.orchestrator.ModelOrchestrator
 */
package fr.lapetina.consensus.orchestrator;
