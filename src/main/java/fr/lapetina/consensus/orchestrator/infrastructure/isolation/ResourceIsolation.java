package fr.lapetina.consensus.orchestrator.infrastructure.isolation;

/**
 * Resource isolation SPI entered around every backend invocation.
 *
 * <p>The executor enters a scope before generation starts and closes it once
 * the attempt is over, whether it succeeded, failed or timed out:
 * <pre>{@code
 * IsolationScope scope = isolation.enter(backendId);
 * runAttempt().whenComplete((result, ex) -> scope.close());
 * }</pre>
 *
 * Quota-enforcing implementations can be substituted without touching the executor.
 */
public interface ResourceIsolation {

    /**
     * Enters the isolation boundary for one attempt.
     *
     * @param backendId Backend about to run
     * @return the entered scope, to be closed exactly once by the caller
     */
    IsolationScope enter(String backendId);

    /**
     * Memory budget per attempt, in megabytes.
     */
    int memoryLimitMb();

    /**
     * CPU budget per attempt, as a percentage of one core.
     */
    int cpuLimitPercent();
}
