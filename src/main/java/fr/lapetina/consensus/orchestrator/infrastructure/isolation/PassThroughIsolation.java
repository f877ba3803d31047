package fr.lapetina.consensus.orchestrator.infrastructure.isolation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Isolation that enforces nothing.
 *
 * Logs entry and exit and keeps a count of open scopes, which makes it useful
 * for checking that every entered scope is eventually closed.
 */
public final class PassThroughIsolation implements ResourceIsolation {

    private static final Logger log = LoggerFactory.getLogger(PassThroughIsolation.class);

    public static final int DEFAULT_MEMORY_LIMIT_MB = 500;
    public static final int DEFAULT_CPU_LIMIT_PERCENT = 70;

    private final int memoryLimitMb;
    private final int cpuLimitPercent;
    private final AtomicInteger openScopes = new AtomicInteger(0);

    public PassThroughIsolation(int memoryLimitMb, int cpuLimitPercent) {
        if (memoryLimitMb <= 0) {
            throw new IllegalArgumentException("Memory limit must be positive, got " + memoryLimitMb);
        }
        if (cpuLimitPercent <= 0 || cpuLimitPercent > 100) {
            throw new IllegalArgumentException("CPU limit must be within (0, 100], got " + cpuLimitPercent);
        }
        this.memoryLimitMb = memoryLimitMb;
        this.cpuLimitPercent = cpuLimitPercent;
    }

    public PassThroughIsolation() {
        this(DEFAULT_MEMORY_LIMIT_MB, DEFAULT_CPU_LIMIT_PERCENT);
    }

    @Override
    public IsolationScope enter(String backendId) {
        openScopes.incrementAndGet();
        log.debug("Entering isolation scope: backendId={}, memoryLimitMb={}, cpuLimitPercent={}",
                backendId, memoryLimitMb, cpuLimitPercent);
        return new Scope(backendId);
    }

    @Override
    public int memoryLimitMb() {
        return memoryLimitMb;
    }

    @Override
    public int cpuLimitPercent() {
        return cpuLimitPercent;
    }

    /**
     * Number of scopes entered and not yet closed.
     */
    public int getOpenScopes() {
        return openScopes.get();
    }

    private final class Scope implements IsolationScope {
        private final String backendId;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private Scope(String backendId) {
            this.backendId = backendId;
        }

        @Override
        public String backendId() {
            return backendId;
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                openScopes.decrementAndGet();
                log.debug("Exiting isolation scope: backendId={}", backendId);
            }
        }
    }
}
