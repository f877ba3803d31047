/**
 * Backend capability contract and its implementations.
 *
 * <p>Every backend answers a query asynchronously, scores its own confidence and
 * reports health. Concrete backends are created from configuration by a
 * {@link fr.lapetina.consensus.orchestrator.domain.backend.BackendFactory}.
 *
 * <h2>Available Kinds</h2>
 * <ul>
 *   <li>{@code reference} (alias {@code mock}) - {@link fr.lapetina.consensus.orchestrator.domain.backend.ReferenceBackend},
 *       canned answers with simulated latency</li>
 * </ul>
 *
 * <h2>Adding a Kind</h2>
 * <p>Add a constant to {@link fr.lapetina.consensus.orchestrator.domain.backend.BackendKind} and the matching
 * branch in {@link fr.lapetina.consensus.orchestrator.domain.backend.DefaultBackendFactory}.
 * Nothing else in the orchestrator changes.
 *
 * @see fr.lapetina.consensus.orchestrator.domain.backend.ModelBackend
 */
package fr.lapetina.consensus.orchestrator.domain.backend;
