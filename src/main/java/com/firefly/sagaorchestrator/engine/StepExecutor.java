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

import com.firefly.sagaorchestrator.core.StepDefinition;
import com.firefly.sagaorchestrator.core.StepError;
import com.firefly.sagaorchestrator.core.StepErrorType;
import com.firefly.sagaorchestrator.core.StepOutcome;
import com.firefly.sagaorchestrator.observability.SagaEvents;
import com.firefly.sagaorchestrator.util.JsonUtils;
import com.firefly.sagaorchestrator.util.SagaLogUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Calls the forward action of one step under its timeout and retry policy and reports a {@link StepOutcome}.
 * Never signals an error and never touches saga state.
 */
public class StepExecutor {
    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final ActionInvoker invoker;
    private final SagaEvents events;
    private final Clock clock;

    public StepExecutor(ActionInvoker invoker, SagaEvents events, Clock clock) {
        this.invoker = invoker;
        this.events = events;
        this.clock = clock;
    }

    /**
     * @param sagaName     name used in events
     * @param sagaId       owning saga
     * @param step         step definition
     * @param payload      materialized payload
     * @param stepTimeout  per-attempt deadline
     * @param sagaDeadline instant at which the whole saga times out; bounds every attempt
     * @param policy       retry policy for this step
     */
    public Mono<StepOutcome> execute(String sagaName,
                                     String sagaId,
                                     StepDefinition step,
                                     Map<String, Object> payload,
                                     Duration stepTimeout,
                                     Instant sagaDeadline,
                                     RetryPolicy policy) {
        ActionCall call = new ActionCall(sagaId, step.stepId(), step.serviceUrl(), step.action(), payload, false);
        Attempt ctx = new Attempt(sagaName, call, step.idempotent(), stepTimeout, sagaDeadline, policy, clock.instant());
        if (log.isDebugEnabled()) {
            log.debug(JsonUtils.json(
                    "saga_step", "call",
                    "saga", sagaName,
                    "sagaId", sagaId,
                    "stepId", step.stepId(),
                    "url", call.url(),
                    "payload", SagaLogUtil.summarize(payload, SagaLogUtil.PREVIEW_MAX)
            ));
        }
        return attempt(ctx, 1);
    }

    private Mono<StepOutcome> attempt(Attempt ctx, int attempt) {
        Duration remaining = Duration.between(clock.instant(), ctx.sagaDeadline);
        if (remaining.isNegative() || remaining.isZero()) {
            // nothing was sent unless an earlier attempt was
            StepError error = new StepError(StepErrorType.SAGA_TIMEOUT, "Saga deadline reached before the call",
                    null, null, attempt > 1);
            return Mono.just(fail(ctx, error, attempt - 1));
        }
        boolean sagaBound = remaining.compareTo(ctx.stepTimeout) < 0;
        Duration effective = sagaBound ? remaining : ctx.stepTimeout;
        return Mono.defer(() -> invoker.invoke(ctx.call))
                .defaultIfEmpty(ActionInvoker.EMPTY_RESULT)
                .timeout(effective)
                .map(result -> StepOutcome.succeeded(result, attempt, ctx.startedAt, clock.instant()))
                .onErrorResume(err -> {
                    StepError error = StepErrors.classify(err, sagaBound);
                    if (ctx.policy.isRetryable(error.type(), ctx.idempotent) && ctx.policy.hasAttemptsLeft(attempt)) {
                        Duration delay = ctx.policy.delayFor(attempt);
                        Duration left = Duration.between(clock.instant(), ctx.sagaDeadline);
                        if (delay.compareTo(left) > 0) delay = left.isNegative() ? Duration.ZERO : left;
                        events.onStepRetry(ctx.sagaName, ctx.call.sagaId(), ctx.call.stepId(), attempt, error);
                        return Mono.delay(delay).then(Mono.defer(() -> attempt(ctx, attempt + 1)));
                    }
                    return Mono.just(fail(ctx, error, attempt));
                });
    }

    private StepOutcome fail(Attempt ctx, StepError error, int attempts) {
        if (error.possiblyApplied()) {
            log.warn(JsonUtils.json(
                    "saga_step", "possibly_applied",
                    "saga", ctx.sagaName,
                    "sagaId", ctx.call.sagaId(),
                    "stepId", ctx.call.stepId(),
                    "error_type", error.type().name(),
                    "idempotency_key", ctx.call.idempotencyKey()
            ));
        }
        return StepOutcome.failed(error, attempts, ctx.startedAt, clock.instant());
    }

    private static final class Attempt {
        final String sagaName;
        final ActionCall call;
        final boolean idempotent;
        final Duration stepTimeout;
        final Instant sagaDeadline;
        final RetryPolicy policy;
        final Instant startedAt;

        Attempt(String sagaName, ActionCall call, boolean idempotent, Duration stepTimeout,
                Instant sagaDeadline, RetryPolicy policy, Instant startedAt) {
            this.sagaName = sagaName;
            this.call = call;
            this.idempotent = idempotent;
            this.stepTimeout = stepTimeout;
            this.sagaDeadline = sagaDeadline;
            this.policy = policy;
            this.startedAt = startedAt;
        }
    }
}
