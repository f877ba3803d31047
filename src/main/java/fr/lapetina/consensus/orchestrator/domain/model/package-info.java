/**
 * Domain model classes shared by the execution layer and the orchestrator.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.consensus.orchestrator.domain.model.BackendConfig} - Immutable per-backend configuration</li>
 *   <li>{@link fr.lapetina.consensus.orchestrator.domain.model.ModelResponse} - Uniform outcome of one backend attempt</li>
 *   <li>{@link fr.lapetina.consensus.orchestrator.domain.model.ResponseStatus} - SUCCESS, TIMEOUT, ERROR, DISABLED</li>
 *   <li>{@link fr.lapetina.consensus.orchestrator.domain.model.QueryContext} - Opaque side information for backends</li>
 *   <li>{@link fr.lapetina.consensus.orchestrator.domain.model.BackendInfo} - Introspection snapshot</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>All classes in this package are immutable records.
 */
package fr.lapetina.consensus.orchestrator.domain.model;
