package com.trade.scalper.exchange;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final List<Long> sleeps = new ArrayList<>();
    private final RetryPolicy policy = RetryPolicy.defaults().withSleeper(sleeps::add);

    @Test
    void backoffMillis_shouldDoubleAndCap() {
        RetryPolicy wide = new RetryPolicy(6, 800, 6000, ExchangeException::isTransient, sleeps::add);

        assertEquals(800, wide.backoffMillis(1));
        assertEquals(1600, wide.backoffMillis(2));
        assertEquals(3200, wide.backoffMillis(3));
        assertEquals(6000, wide.backoffMillis(4));
        assertEquals(6000, wide.backoffMillis(5));
    }

    @Test
    void execute_shouldRetryTransientFailuresUntilSuccess() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = policy.execute("test", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new ExchangeException(ExchangeException.ErrorCode.NETWORK_ERROR, "reset");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(800L, 1600L), sleeps);
    }

    @Test
    void execute_shouldThrowLastErrorAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        ExchangeException error = assertThrows(ExchangeException.class, () -> policy.execute("test", () -> {
            calls.incrementAndGet();
            throw new ExchangeException(ExchangeException.ErrorCode.RATE_LIMIT, "slow down");
        }));

        assertEquals(ExchangeException.ErrorCode.RATE_LIMIT, error.getErrorCode());
        assertEquals(3, calls.get());
        assertEquals(2, sleeps.size());
    }

    @Test
    void execute_shouldNotRetryNonTransientErrors() {
        AtomicInteger calls = new AtomicInteger();

        ExchangeException error = assertThrows(ExchangeException.class, () -> policy.execute("test", () -> {
            calls.incrementAndGet();
            throw new ExchangeException(ExchangeException.ErrorCode.AUTH_FAILED, "bad key");
        }));

        assertEquals(ExchangeException.ErrorCode.AUTH_FAILED, error.getErrorCode());
        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void withRetryable_shouldLimitRetriesToPreSubmissionFailures() {
        RetryPolicy orderPolicy = policy.withRetryable(ExchangeException::isPreSubmission);
        AtomicInteger calls = new AtomicInteger();

        assertThrows(ExchangeException.class, () -> orderPolicy.execute("order", () -> {
            calls.incrementAndGet();
            throw new ExchangeException(ExchangeException.ErrorCode.TIMEOUT, "read timed out");
        }));

        assertEquals(1, calls.get());
    }
}
