package fr.lapetina.consensus.orchestrator.infrastructure.isolation;

/**
 * An entered isolation boundary. Closing it releases whatever the
 * {@link ResourceIsolation} acquired on entry.
 *
 * Implementations must tolerate {@link #close()} being called more than once.
 */
public interface IsolationScope extends AutoCloseable {

    /**
     * Backend this scope was entered for.
     */
    String backendId();

    @Override
    void close();
}
