package com.vmreconciler.core.poll;

import com.vmreconciler.core.error.ErrorKind;
import com.vmreconciler.core.error.ReconcileException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BoundedRetryTest {

    @Test
    @DisplayName("returns the attempt on which the condition held")
    void returnsAttempt() {
        var sleeps = new ArrayList<Duration>();
        var retry = new BoundedRetry(sleeps::add);
        var calls = new AtomicInteger();

        int attempt = retry.await("thing", () -> calls.incrementAndGet() == 3, Duration.ofSeconds(1), 5);

        assertEquals(3, attempt);
        assertEquals(2, sleeps.size());
        assertEquals(Duration.ofSeconds(1), sleeps.get(0));
    }

    @Test
    @DisplayName("giving up is a remote failure naming what was awaited")
    void givesUp() {
        var retry = new BoundedRetry(d -> { });

        var e = assertThrows(ReconcileException.class,
                () -> retry.await("provisioning of web-1", () -> false, Duration.ZERO, 3));

        assertEquals(ErrorKind.REMOTE_FAILURE, e.getKind());
        assertTrue(e.getMessage().contains("provisioning of web-1"));
        assertTrue(e.getMessage().contains("3 attempts"));
    }

    @Test
    @DisplayName("interruption restores the interrupt flag")
    void interrupted() {
        var retry = new BoundedRetry(d -> { throw new InterruptedException(); });

        assertThrows(ReconcileException.class, () -> retry.await("x", () -> false, Duration.ZERO, 2));
        assertTrue(Thread.interrupted());
    }
}
