package fr.lapetina.consensus.orchestrator.infrastructure.health;

import fr.lapetina.consensus.orchestrator.ModelOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background health monitor for registered backends.
 *
 * Periodically runs the orchestrator's health checks and keeps the latest
 * result per backend. Purely observational: circuit breaker state is never touched.
 */
public final class BackendHealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackendHealthMonitor.class);

    private final ModelOrchestrator orchestrator;
    private final ScheduledExecutorService scheduler;
    private final Duration checkInterval;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cycleInFlight = new AtomicBoolean(false);
    private final Map<String, Boolean> lastResults = new ConcurrentHashMap<>();

    public BackendHealthMonitor(ModelOrchestrator orchestrator, Duration checkInterval) {
        this.orchestrator = orchestrator;
        this.checkInterval = checkInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "backend-health-monitor");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic health checking.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::checkAll,
                    0,
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health monitor started with interval: {}", checkInterval);
        }
    }

    /**
     * Runs one health check cycle. Skipped while the previous cycle is still
     * running, so results are always applied in cycle order.
     */
    public void checkAll() {
        if (!running.get()) {
            return;
        }
        if (!cycleInFlight.compareAndSet(false, true)) {
            log.debug("Previous health check cycle still running, skipping");
            return;
        }
        log.debug("Starting health check cycle: backendCount={}", orchestrator.size());

        CompletableFuture<Map<String, Boolean>> cycle;
        try {
            cycle = orchestrator.healthCheckAll();
        } catch (RuntimeException e) {
            cycleInFlight.set(false);
            log.error("Health check cycle failed to start", e);
            return;
        }
        cycle.whenComplete((results, ex) -> {
            try {
                if (ex != null) {
                    log.error("Health check cycle failed", ex);
                } else {
                    results.forEach(this::update);
                }
            } finally {
                cycleInFlight.set(false);
            }
        });
    }

    private void update(String backendId, boolean healthy) {
        Boolean previous = lastResults.put(backendId, healthy);
        if (previous == null || previous != healthy) {
            if (healthy) {
                log.info("Backend health changed: backendId={}, previous={}, healthy=true", backendId, previous);
            } else {
                log.warn("Backend health changed: backendId={}, previous={}, healthy=false", backendId, previous);
            }
        }
    }

    /**
     * Latest known health per backend. Backends not checked yet are absent.
     */
    public Map<String, Boolean> lastResults() {
        return Map.copyOf(lastResults);
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Health monitor stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
