package com.vmreconciler.core.poll;

import com.vmreconciler.core.error.ErrorKind;
import com.vmreconciler.core.error.ReconcileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Fixed-interval polling with a hard attempt bound. Running out of attempts is
 * a fatal {@code REMOTE_FAILURE}, never a silent timeout.
 */
public class BoundedRetry {

    private static final Logger log = LoggerFactory.getLogger(BoundedRetry.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Sleeper sleeper;

    public BoundedRetry(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public static BoundedRetry realTime() {
        return new BoundedRetry(d -> Thread.sleep(d.toMillis()));
    }

    /**
     * Evaluates {@code condition} up to {@code maxAttempts} times, sleeping
     * {@code interval} between evaluations.
     *
     * @return the attempt (1-based) on which the condition held
     */
    public int await(String what, BooleanSupplier condition, Duration interval, int maxAttempts) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (condition.getAsBoolean()) {
                return attempt;
            }
            if (attempt == maxAttempts) {
                break;
            }
            log.debug("Waiting for {} (attempt {}/{}), next check in {}ms",
                    what, attempt, maxAttempts, interval.toMillis());
            try {
                sleeper.sleep(interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ReconcileException(ErrorKind.REMOTE_FAILURE,
                        "Interrupted while waiting for " + what, e);
            }
        }
        throw ReconcileException.remoteFailure(
                "Gave up waiting for %s after %d attempts".formatted(what, maxAttempts));
    }
}
