package fr.lapetina.consensus.orchestrator.domain.model;

/**
 * Outcome taxonomy for a single backend attempt.
 * Every attempt ends in exactly one of these states.
 */
public enum ResponseStatus {
    /** Backend produced content and a confidence score */
    SUCCESS,

    /** Deadline elapsed before the backend answered */
    TIMEOUT,

    /** Generation or scoring failed */
    ERROR,

    /** Backend is switched off in configuration, never invoked */
    DISABLED
}
