package io.stagemesh.resilience;

import io.stagemesh.error.CircuitOpenException;
import io.stagemesh.error.FailureKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

final class CircuitBreakerTest {

    @Test
    void opensExactlyAtTheThreshold() {
        AtomicLong now = new AtomicLong(1_000L);
        CircuitBreaker breaker = new CircuitBreaker("build", 3, 5_000L, now::get);

        for (int i = 0; i < 2; i++) {
            breaker.acquire();
            breaker.recordFailure();
            Assertions.assertEquals(CircuitState.CLOSED, breaker.state());
        }
        breaker.acquire();
        breaker.recordFailure();
        Assertions.assertEquals(CircuitState.OPEN, breaker.state());

        CircuitOpenException rejected = Assertions.assertThrows(CircuitOpenException.class, breaker::acquire);
        Assertions.assertEquals(FailureKind.CIRCUIT_OPEN, rejected.kind());
        Assertions.assertEquals("build", rejected.circuitKey());
        Assertions.assertEquals(5_000L, rejected.remainingMs());
        Assertions.assertEquals(1L, breaker.status().rejectedCount());
    }

    @Test
    void successResetsTheFailureCount() {
        AtomicLong now = new AtomicLong(0L);
        CircuitBreaker breaker = new CircuitBreaker("lint", 2, 1_000L, now::get);

        breaker.acquire();
        breaker.recordFailure();
        breaker.acquire();
        breaker.recordSuccess();
        breaker.acquire();
        breaker.recordFailure();

        Assertions.assertEquals(CircuitState.CLOSED, breaker.state());
        Assertions.assertEquals(1, breaker.status().consecutiveFailures());
    }

    @Test
    void halfOpenAdmitsASingleTrialThenClosesOnSuccess() {
        AtomicLong now = new AtomicLong(0L);
        CircuitBreaker breaker = new CircuitBreaker("deploy", 1, 1_000L, now::get);
        breaker.acquire();
        breaker.recordFailure();
        Assertions.assertThrows(CircuitOpenException.class, breaker::acquire);

        now.set(1_000L);
        Assertions.assertEquals(CircuitState.HALF_OPEN, breaker.state());
        breaker.acquire();
        Assertions.assertThrows(CircuitOpenException.class, breaker::acquire);

        breaker.recordSuccess();
        Assertions.assertEquals(CircuitState.CLOSED, breaker.state());
        breaker.acquire();
        breaker.recordSuccess();
    }

    @Test
    void failedTrialReopensAndRestartsTheCooldown() {
        AtomicLong now = new AtomicLong(0L);
        CircuitBreaker breaker = new CircuitBreaker("deploy", 1, 1_000L, now::get);
        breaker.acquire();
        breaker.recordFailure();

        now.set(1_500L);
        breaker.acquire();
        breaker.recordFailure();

        Assertions.assertEquals(CircuitState.OPEN, breaker.state());
        now.set(2_000L);
        CircuitOpenException rejected = Assertions.assertThrows(CircuitOpenException.class, breaker::acquire);
        Assertions.assertEquals(500L, rejected.remainingMs());
    }

    @Test
    void releasedTrialLetsTheNextCallerTry() {
        AtomicLong now = new AtomicLong(0L);
        CircuitBreaker breaker = new CircuitBreaker("deploy", 1, 0L, now::get);
        breaker.acquire();
        breaker.recordFailure();

        breaker.acquire();
        breaker.release();
        breaker.acquire();
        breaker.recordSuccess();
        Assertions.assertEquals(CircuitState.CLOSED, breaker.state());
    }

    @Test
    void registryKeepsOneBreakerPerKind() {
        AtomicLong now = new AtomicLong(0L);
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(1, 10_000L, now::get);

        registry.forKind("a").acquire();
        registry.forKind("a").recordFailure();

        Assertions.assertSame(registry.forKind("a"), registry.forKind("a"));
        Assertions.assertThrows(CircuitOpenException.class, () -> registry.forKind("a").acquire());
        registry.forKind("b").acquire();
        Assertions.assertEquals(CircuitState.OPEN, registry.statuses().get("a").state());
        Assertions.assertEquals(CircuitState.CLOSED, registry.statuses().get("b").state());

        registry.resetAll();
        Assertions.assertEquals(CircuitState.CLOSED, registry.forKind("a").state());
    }

    @Test
    void rejectsInvalidParameters() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new CircuitBreaker("x", 0, 1L, null));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new CircuitBreaker("x", 1, -1L, null));
    }
}
