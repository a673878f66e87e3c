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

import com.firefly.sagaorchestrator.core.SagaDefinition;
import com.firefly.sagaorchestrator.core.SagaInstance;
import com.firefly.sagaorchestrator.core.StepDefinition;
import com.firefly.sagaorchestrator.core.StepError;
import com.firefly.sagaorchestrator.core.StepErrorType;
import com.firefly.sagaorchestrator.core.StepOutcome;
import com.firefly.sagaorchestrator.core.StepStatus;
import com.firefly.sagaorchestrator.observability.SagaEvents;
import com.firefly.sagaorchestrator.resolver.ResolutionContext;
import com.firefly.sagaorchestrator.resolver.TemplateResolutionException;
import com.firefly.sagaorchestrator.resolver.VariableResolver;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Rolls back the steps whose forward action succeeded, strictly one at a time in reverse execution order.
 * A compensation that keeps failing is recorded as COMPENSATION_FAILED and the rollback moves on to the
 * earlier steps.
 */
public class CompensationRunner {
    static final String ORIGINAL_RESULT = "original_result";

    private final ActionInvoker invoker;
    private final VariableResolver resolver;
    private final SagaEvents events;
    private final RetryPolicy policy;
    private final Duration attemptTimeout;
    private final Clock clock;

    public CompensationRunner(ActionInvoker invoker,
                              VariableResolver resolver,
                              SagaEvents events,
                              RetryPolicy policy,
                              Duration attemptTimeout,
                              Clock clock) {
        this.invoker = invoker;
        this.resolver = resolver;
        this.events = events;
        this.policy = policy;
        this.attemptTimeout = attemptTimeout;
        this.clock = clock;
    }

    /**
     * Compensates every step of {@code instance} still holding a forward result, latest first.
     * Each outcome change is handed to {@code recorder}, which must persist it before the rollback continues.
     *
     * @return true when nothing ended COMPENSATION_FAILED, including failures recorded by an earlier run
     */
    public Mono<Boolean> compensate(SagaInstance instance, BiFunction<String, StepOutcome, Mono<Void>> recorder) {
        SagaDefinition def = instance.definition();
        List<StepDefinition> targets = new ArrayList<>();
        boolean previouslyFailed = false;
        for (StepDefinition step : def.steps()) {
            StepOutcome outcome = instance.outcome(step.stepId());
            if (outcome == null) continue;
            if (outcome.status() == StepStatus.COMPENSATION_FAILED) previouslyFailed = true;
            if (outcome.status().isCompensable()) targets.add(step);
        }
        Collections.reverse(targets);
        boolean carried = previouslyFailed;
        return Flux.fromIterable(targets)
                .concatMap(step -> compensateOne(instance, step, recorder))
                .reduce(Boolean.TRUE, (all, ok) -> all && ok)
                .map(all -> all && !carried);
    }

    private Mono<Boolean> compensateOne(SagaInstance instance,
                                        StepDefinition step,
                                        BiFunction<String, StepOutcome, Mono<Void>> recorder) {
        String sagaName = instance.sagaName();
        String sagaId = instance.sagaId();
        String stepId = step.stepId();
        if (!step.isCompensable()) {
            events.onCompensationSkipped(sagaName, sagaId, stepId, "no compensation action");
            return Mono.just(true);
        }
        StepOutcome forward = instance.outcome(stepId);
        events.onCompensationStarted(sagaName, sagaId, stepId);
        return recorder.apply(stepId, forward.compensating())
                .then(Mono.defer(() -> {
                    Map<String, Object> payload;
                    try {
                        payload = resolver.resolve(step.compensationPayload(),
                                ResolutionContext.compensation(sagaId, instance.definition(), instance.stepResults(), stepId));
                    } catch (TemplateResolutionException e) {
                        StepError error = StepError.of(StepErrorType.TEMPLATE, e.getMessage());
                        return finish(instance, step, forward.compensationFailed(0, error, clock.instant()), recorder);
                    }
                    if (!payload.containsKey(ORIGINAL_RESULT)) {
                        payload.put(ORIGINAL_RESULT, forward.result());
                    }
                    ActionCall call = new ActionCall(sagaId, stepId, step.serviceUrl(), step.compensationAction(), payload, true);
                    return attempt(sagaName, call, 1)
                            .flatMap(result -> {
                                StepOutcome next = result.error == null
                                        ? forward.compensated(result.attempts, clock.instant())
                                        : forward.compensationFailed(result.attempts, result.error, clock.instant());
                                return finish(instance, step, next, recorder);
                            });
                }));
    }

    private Mono<Boolean> finish(SagaInstance instance,
                                 StepDefinition step,
                                 StepOutcome next,
                                 BiFunction<String, StepOutcome, Mono<Void>> recorder) {
        return recorder.apply(step.stepId(), next)
                .then(Mono.fromSupplier(() -> {
                    events.onCompensated(instance.sagaName(), instance.sagaId(), step.stepId(), next.compensationError());
                    return next.status() == StepStatus.COMPENSATED;
                }));
    }

    private Mono<Result> attempt(String sagaName, ActionCall call, int attempt) {
        return Mono.defer(() -> invoker.invoke(call))
                .defaultIfEmpty(ActionInvoker.EMPTY_RESULT)
                .timeout(attemptTimeout)
                .map(ignored -> new Result(attempt, null))
                .onErrorResume(err -> {
                    StepError error = StepErrors.classify(err, false);
                    if (policy.hasAttemptsLeft(attempt)) {
                        events.onCompensationRetry(sagaName, call.sagaId(), call.stepId(), attempt + 1);
                        return Mono.delay(policy.delayFor(attempt)).then(Mono.defer(() -> attempt(sagaName, call, attempt + 1)));
                    }
                    return Mono.just(new Result(attempt, error));
                });
    }

    private static final class Result {
        final int attempts;
        final StepError error;

        Result(int attempts, StepError error) {
            this.attempts = attempts;
            this.error = error;
        }
    }
}
