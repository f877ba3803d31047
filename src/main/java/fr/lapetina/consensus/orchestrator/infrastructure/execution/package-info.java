/**
 * Execution of a single query against a single backend.
 *
 * <p>{@link fr.lapetina.consensus.orchestrator.infrastructure.execution.DeadlineRunner} bounds an
 * asynchronous unit of work by a deadline and measures its duration whatever the outcome.
 * {@link fr.lapetina.consensus.orchestrator.infrastructure.execution.BackendExecutor} combines it with
 * resource isolation, confidence scoring and the optional
 * {@link fr.lapetina.consensus.orchestrator.infrastructure.execution.RetryPolicy}, and is the single place
 * where backend failures become {@code ModelResponse} values.
 */
package fr.lapetina.consensus.orchestrator.infrastructure.execution;
