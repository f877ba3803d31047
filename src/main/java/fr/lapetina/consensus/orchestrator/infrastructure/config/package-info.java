/**
 * Configuration loading.
 *
 * <p>This package handles YAML configuration parsing into
 * {@link fr.lapetina.consensus.orchestrator.infrastructure.config.OrchestratorConfig}.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code backends} - Backend pool (id, kind, weight, timeoutMs, maxRetries, enabled, params)</li>
 *   <li>{@code circuitBreaker} - Failure threshold and cooldown</li>
 *   <li>{@code isolation} - Memory and CPU budget per attempt</li>
 *   <li>{@code retry} - Retry policy for failed attempts</li>
 *   <li>{@code healthCheck} - Background health monitoring</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.consensus.orchestrator.infrastructure.config.ConfigLoader
 */
package fr.lapetina.consensus.orchestrator.infrastructure.config;
