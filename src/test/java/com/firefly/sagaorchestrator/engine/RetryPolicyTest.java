package com.firefly.sagaorchestrator.engine;

import com.firefly.sagaorchestrator.core.StepErrorType;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void exponentialBackoffDoublesUpToCap() {
        RetryPolicy p = RetryPolicy.exponential(5, Duration.ofSeconds(1), Duration.ofSeconds(5));
        assertEquals(Duration.ofSeconds(1), p.delayFor(1));
        assertEquals(Duration.ofSeconds(2), p.delayFor(2));
        assertEquals(Duration.ofSeconds(4), p.delayFor(3));
        assertEquals(Duration.ofSeconds(5), p.delayFor(4));
    }

    @Test
    void linearBackoffGrowsByBase() {
        RetryPolicy p = RetryPolicy.linear(3, Duration.ofMillis(500));
        assertEquals(Duration.ofMillis(500), p.delayFor(1));
        assertEquals(Duration.ofMillis(1000), p.delayFor(2));
        assertEquals(Duration.ofMillis(1500), p.delayFor(3));
    }

    @Test
    void budgetCountsRetriesAfterFirstAttempt() {
        RetryPolicy p = RetryPolicy.exponential(2, Duration.ZERO, Duration.ZERO);
        assertTrue(p.hasAttemptsLeft(1));
        assertTrue(p.hasAttemptsLeft(2));
        assertFalse(p.hasAttemptsLeft(3));
        assertFalse(RetryPolicy.none().hasAttemptsLeft(1));
    }

    @Test
    void classificationFollowsFailureClass() {
        RetryPolicy p = RetryPolicy.exponential(3, Duration.ZERO, Duration.ZERO);
        assertTrue(p.isRetryable(StepErrorType.TRANSPORT, false));
        assertTrue(p.isRetryable(StepErrorType.TIMEOUT, false));
        assertFalse(p.isRetryable(StepErrorType.APPLICATION, false));
        assertTrue(p.isRetryable(StepErrorType.APPLICATION, true));
        assertFalse(p.isRetryable(StepErrorType.TEMPLATE, true));
        assertFalse(p.isRetryable(StepErrorType.SAGA_TIMEOUT, true));
    }

    @Test
    void negativeBudgetIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.none().withMaxRetries(-1));
    }
}
