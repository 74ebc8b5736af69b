package com.qqsuccubus.pipeline.core.backoff;

import com.qqsuccubus.pipeline.core.error.ErrorKind;
import com.qqsuccubus.pipeline.core.error.MalformedChunkingException;
import com.qqsuccubus.pipeline.core.error.StoreUnavailableException;
import com.qqsuccubus.pipeline.core.error.TransientException;
import com.qqsuccubus.pipeline.core.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackoffPolicyTest {

    private static BackoffPolicy policy(int maxAttempts, double jitter) {
        return new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(1), maxAttempts,
            error -> error instanceof IllegalStateException, () -> jitter);
    }

    @Test
    void testZeroAttempts_StopsImmediately() {
        assertEquals(Optional.empty(), policy(0, 1.0).nextDelay(0));
    }

    @Test
    void testDelays_DoubleUntilCapped() {
        BackoffPolicy policy = policy(10, 1.0);

        assertEquals(Duration.ofMillis(100), policy.nextDelay(0).orElseThrow());
        assertEquals(Duration.ofMillis(200), policy.nextDelay(1).orElseThrow());
        assertEquals(Duration.ofMillis(800), policy.nextDelay(3).orElseThrow());
        assertEquals(Duration.ofSeconds(1), policy.nextDelay(4).orElseThrow());
        assertEquals(Duration.ofSeconds(1), policy.nextDelay(9).orElseThrow());
    }

    @Test
    void testBudgetExhausted_StopsAtMaxAttempts() {
        BackoffPolicy policy = policy(3, 1.0);

        assertTrue(policy.nextDelay(2).isPresent());
        assertTrue(policy.nextDelay(3).isEmpty());
        assertTrue(policy.nextDelay(50).isEmpty());
    }

    @Test
    void testJitter_AppliedAfterCap() {
        assertEquals(Duration.ofMillis(50), policy(5, 0.5).nextDelay(0).orElseThrow());
        assertEquals(Duration.ofMillis(1490), policy(10, 1.49).nextDelay(8).orElseThrow());
    }

    @Test
    void testDefaultJitter_StaysInRange() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(200), Duration.ofSeconds(30), 5, e -> true);
        for (int i = 0; i < 1000; i++) {
            long ms = policy.nextDelay(1).orElseThrow().toMillis();
            assertTrue(ms >= 200 && ms <= 600, "delay out of range: " + ms);
        }
    }

    @Test
    void testClassification_PipelineErrorsPreClassified() {
        BackoffPolicy policy = policy(3, 1.0);

        assertEquals(BackoffPolicy.Classification.RETRYABLE, policy.classify(new TransientException("x")));
        assertEquals(BackoffPolicy.Classification.RETRYABLE, policy.classify(new StoreUnavailableException("x")));
        assertEquals(BackoffPolicy.Classification.RETRYABLE, policy.classify(new TimeoutException("x")));
        assertEquals(BackoffPolicy.Classification.NON_RETRYABLE, policy.classify(new ValidationException("x")));
        assertEquals(BackoffPolicy.Classification.NON_RETRYABLE, policy.classify(new MalformedChunkingException("x")));
    }

    @Test
    void testClassification_ApplicationErrorsUsePredicate() {
        BackoffPolicy policy = policy(3, 1.0);

        assertEquals(ErrorKind.TRANSIENT, policy.kindOf(new IllegalStateException("db down")));
        assertEquals(ErrorKind.VALIDATION, policy.kindOf(new IllegalArgumentException("bad amount")));
    }

    @Test
    void testNegativeMaxAttempts_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> policy(-1, 1.0));
    }
}
