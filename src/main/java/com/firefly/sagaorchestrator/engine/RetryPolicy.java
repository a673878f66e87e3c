/*
 * Copyright 2025 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.firefly.sagaorchestrator.engine;

import com.firefly.sagaorchestrator.core.StepErrorType;

import java.time.Duration;

/**
 * Retry budget and backoff for remote calls. Failures are described by value; the policy decides whether
 * another attempt is allowed and how long to wait before it.
 *
 * @param maxRetries               retries after the first attempt
 * @param baseDelay                delay unit
 * @param maxDelay                 upper bound for a single delay
 * @param backoff                  growth of the delay between attempts
 * @param retryApplicationFailures retry explicit non-2xx answers even for non-idempotent steps
 */
public record RetryPolicy(
        int maxRetries,
        Duration baseDelay,
        Duration maxDelay,
        Backoff backoff,
        boolean retryApplicationFailures
) {
    public enum Backoff { FIXED, LINEAR, EXPONENTIAL }

    public RetryPolicy {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        baseDelay = baseDelay != null ? baseDelay : Duration.ZERO;
        maxDelay = maxDelay != null ? maxDelay : baseDelay;
        backoff = backoff != null ? backoff : Backoff.FIXED;
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO, Backoff.FIXED, false);
    }

    public static RetryPolicy exponential(int maxRetries, Duration baseDelay, Duration maxDelay) {
        return new RetryPolicy(maxRetries, baseDelay, maxDelay, Backoff.EXPONENTIAL, false);
    }

    public static RetryPolicy linear(int maxRetries, Duration baseDelay) {
        return new RetryPolicy(maxRetries, baseDelay, baseDelay.multipliedBy(Math.max(1, maxRetries)), Backoff.LINEAR, true);
    }

    public RetryPolicy withMaxRetries(int retries) {
        return new RetryPolicy(retries, baseDelay, maxDelay, backoff, retryApplicationFailures);
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     */
    public Duration delayFor(int failedAttempt) {
        int n = Math.max(1, failedAttempt);
        Duration d;
        switch (backoff) {
            case LINEAR:
                d = baseDelay.multipliedBy(n);
                break;
            case EXPONENTIAL:
                d = baseDelay.multipliedBy(1L << Math.min(n - 1, 20));
                break;
            case FIXED:
            default:
                d = baseDelay;
        }
        return d.compareTo(maxDelay) > 0 ? maxDelay : d;
    }

    /** Whether another attempt is permitted after {@code failedAttempt} attempts. */
    public boolean hasAttemptsLeft(int failedAttempt) {
        return failedAttempt <= maxRetries;
    }

    /**
     * Forward-call classification. Transport and per-step timeouts are retried; explicit application failures
     * only when the step is idempotent or the policy says so; template and whole-saga timeouts never.
     */
    public boolean isRetryable(StepErrorType type, boolean idempotent) {
        switch (type) {
            case TRANSPORT:
            case TIMEOUT:
                return true;
            case APPLICATION:
                return idempotent || retryApplicationFailures;
            default:
                return false;
        }
    }
}
