package fr.lapetina.consensus.orchestrator.infrastructure.execution;

import fr.lapetina.consensus.orchestrator.infrastructure.execution.exception.AttemptFailedException;
import fr.lapetina.consensus.orchestrator.infrastructure.execution.exception.DeadlineExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Races an asynchronous unit of work against a wall-clock deadline.
 *
 * Outcomes:
 * - completion: the value with its elapsed time
 * - deadline: fails with {@link DeadlineExceededException}, the work is cancelled
 * - failure: fails with {@link AttemptFailedException} wrapping the cause
 *
 * Elapsed time is measured from the moment the work is started, whatever the outcome.
 * Never blocks the calling thread.
 */
public final class DeadlineRunner {

    private static final Logger log = LoggerFactory.getLogger(DeadlineRunner.class);

    private final ScheduledExecutorService timer;

    public DeadlineRunner(ScheduledExecutorService timer) {
        this.timer = Objects.requireNonNull(timer, "Timer is required");
    }

    /**
     * Starts the work and bounds it by the given deadline.
     *
     * @param work    Supplier starting the work; it is invoked exactly once
     * @param timeout Maximum wall-clock time allowed
     * @return Future completing with the timed value or an {@code AttemptException}
     */
    public <T> CompletableFuture<Timed<T>> execute(Supplier<CompletableFuture<T>> work, Duration timeout) {
        long start = System.nanoTime();

        CompletableFuture<T> inFlight;
        try {
            inFlight = Objects.requireNonNull(work.get(), "Unit of work returned no future");
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new AttemptFailedException(elapsedSince(start), e));
        }

        CompletableFuture<Timed<T>> result = new CompletableFuture<>();

        ScheduledFuture<?> deadline = timer.schedule(() -> {
            Duration elapsed = elapsedSince(start);
            if (result.completeExceptionally(new DeadlineExceededException(timeout, elapsed))) {
                log.debug("Deadline reached, cancelling work: timeoutMs={}, elapsedMs={}",
                        timeout.toMillis(), elapsed.toMillis());
                inFlight.cancel(true);
            }
        }, timeout.toNanos(), TimeUnit.NANOSECONDS);

        inFlight.whenComplete((value, ex) -> {
            deadline.cancel(false);
            Duration elapsed = elapsedSince(start);
            if (ex == null) {
                result.complete(new Timed<>(value, elapsed));
            } else {
                result.completeExceptionally(new AttemptFailedException(elapsed, unwrap(ex)));
            }
        });

        return result;
    }

    static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * Strips the wrappers {@code CompletableFuture} puts around failures.
     */
    public static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
