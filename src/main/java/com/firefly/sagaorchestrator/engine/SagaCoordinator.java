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

import com.firefly.sagaorchestrator.core.FailureReason;
import com.firefly.sagaorchestrator.core.SagaDefinition;
import com.firefly.sagaorchestrator.core.SagaInstance;
import com.firefly.sagaorchestrator.core.SagaNotFoundException;
import com.firefly.sagaorchestrator.core.SagaSnapshot;
import com.firefly.sagaorchestrator.core.SagaStatus;
import com.firefly.sagaorchestrator.core.StepDefinition;
import com.firefly.sagaorchestrator.core.StepError;
import com.firefly.sagaorchestrator.core.StepErrorType;
import com.firefly.sagaorchestrator.core.StepOutcome;
import com.firefly.sagaorchestrator.core.StepStatus;
import com.firefly.sagaorchestrator.observability.SagaEvents;
import com.firefly.sagaorchestrator.persistence.SagaLease;
import com.firefly.sagaorchestrator.persistence.SagaLeaseLostException;
import com.firefly.sagaorchestrator.persistence.SagaStore;
import com.firefly.sagaorchestrator.persistence.SagaStoreException;
import com.firefly.sagaorchestrator.persistence.StaleSagaVersionException;
import com.firefly.sagaorchestrator.registry.DuplicateSagaException;
import com.firefly.sagaorchestrator.registry.SagaDefinitionValidator;
import com.firefly.sagaorchestrator.resolver.ResolutionContext;
import com.firefly.sagaorchestrator.resolver.TemplateResolutionException;
import com.firefly.sagaorchestrator.resolver.VariableResolver;
import com.firefly.sagaorchestrator.util.JsonUtils;
import com.firefly.sagaorchestrator.util.SagaLogUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the saga lifecycle.
 * <p>
 * Submission persists a PENDING record and queues the saga; at most {@code maxConcurrentSagas} sagas are driven
 * at a time, the rest wait in submission order. Driving a saga requires its lease, which a heartbeat renews while
 * the saga is driven and which is checked again before every step and compensation call. Steps run strictly in
 * definition order and every transition is written to the store before the next remote call. A failed step
 * (after its retry budget) or an expired saga deadline turns the saga COMPENSATING and hands it to the
 * {@link CompensationRunner}.
 * <p>
 * Sagas found non-terminal in the store are resumed through {@link #resume(String)}: a step caught in flight is
 * failed as UNKNOWN_OUTCOME and rolled back, a saga whose current step succeeded continues with the next step,
 * and an interrupted rollback picks up where it stopped.
 */
public class SagaCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SagaCoordinator.class);
    private static final String UNKNOWN_SAGA = "saga";
    private static final Duration MIN_HEARTBEAT = Duration.ofMillis(10);

    /**
     * Coordinator-wide defaults.
     *
     * @param defaultStepTimeout per-attempt deadline when a step sets none
     * @param defaultSagaTimeout whole-saga deadline when a definition sets none
     * @param maxConcurrentSagas sagas driven at the same time
     * @param leaseDuration      lifetime of a saga lease; renewed every third of it while the saga is driven
     * @param stepRetryPolicy    forward retry policy; a step's {@code retry_attempts} overrides its budget
     * @param owner              lease owner identity; must survive a restart of this process
     */
    public record Options(
            Duration defaultStepTimeout,
            Duration defaultSagaTimeout,
            int maxConcurrentSagas,
            Duration leaseDuration,
            RetryPolicy stepRetryPolicy,
            String owner
    ) {
    }

    private final SagaStore store;
    private final SagaLease lease;
    private final StepExecutor executor;
    private final CompensationRunner compensationRunner;
    private final VariableResolver resolver;
    private final SagaDefinitionValidator validator;
    private final SagaEvents events;
    private final Clock clock;
    private final Options options;
    private final String owner;
    private final Set<String> driving = ConcurrentHashMap.newKeySet();
    private final Sinks.Many<String> queue = Sinks.many().unicast().onBackpressureBuffer();
    private final Disposable dispatcher;

    public SagaCoordinator(SagaStore store,
                           SagaLease lease,
                           StepExecutor executor,
                           CompensationRunner compensationRunner,
                           VariableResolver resolver,
                           SagaDefinitionValidator validator,
                           SagaEvents events,
                           Clock clock,
                           Options options,
                           Scheduler scheduler) {
        this.store = store;
        this.lease = lease;
        this.executor = executor;
        this.compensationRunner = compensationRunner;
        this.resolver = resolver;
        this.validator = validator;
        this.events = events;
        this.clock = clock;
        this.options = options;
        this.owner = options.owner();
        this.dispatcher = queue.asFlux()
                .flatMap(id -> drive(id).subscribeOn(scheduler), Math.max(1, options.maxConcurrentSagas()))
                .subscribe();
    }

    /**
     * Validates and persists a new saga, then queues it for execution.
     *
     * @return the saga id, emitted once the PENDING record is stored
     */
    public Mono<String> submit(SagaDefinition definition) {
        return Mono.fromCallable(() -> prepare(definition))
                .flatMap(instance -> store.save(instance.toSnapshot())
                        .onErrorMap(StaleSagaVersionException.class, e -> new DuplicateSagaException(instance.sagaId())))
                .map(saved -> {
                    events.onSubmitted(saved.sagaName(), saved.sagaId());
                    enqueue(saved.sagaId());
                    return saved.sagaId();
                });
    }

    public Mono<SagaSnapshot> getStatus(String sagaId) {
        return store.findById(sagaId)
                .switchIfEmpty(Mono.error(() -> new SagaNotFoundException(sagaId)));
    }

    public Flux<SagaSnapshot> listActive() {
        return store.findActive();
    }

    public Mono<Boolean> isStoreHealthy() {
        return store.isHealthy().onErrorReturn(false);
    }

    /**
     * Queues a stored, non-terminal saga for resumption.
     *
     * @return true if the saga was queued, false if it is already terminal
     */
    public Mono<Boolean> resume(String sagaId) {
        return getStatus(sagaId).map(snapshot -> {
            if (snapshot.status().isTerminal()) return false;
            enqueue(sagaId);
            return true;
        });
    }

    /**
     * Queues every active saga in the store. Sagas currently driven elsewhere are skipped when their lease is
     * found held.
     *
     * @return number of sagas queued
     */
    public Mono<Long> resumeActive() {
        return store.findActive()
                .doOnNext(s -> enqueue(s.sagaId()))
                .count();
    }

    @Override
    public void close() {
        queue.tryEmitComplete();
        dispatcher.dispose();
    }

    // --- dispatch ---

    private SagaInstance prepare(SagaDefinition definition) {
        validator.validate(definition);
        String id = definition.sagaId() != null ? definition.sagaId() : newSagaId();
        SagaDefinition effective = definition.withSagaId(id);
        if (effective.timeout() == null) {
            effective = effective.withTimeout(options.defaultSagaTimeout());
        }
        return SagaInstance.create(id, effective, clock.instant());
    }

    private void enqueue(String sagaId) {
        Sinks.EmitResult result;
        synchronized (queue) {
            result = queue.tryEmitNext(sagaId);
        }
        if (result.isFailure()) {
            log.error(JsonUtils.json(
                    "saga_event", "enqueue_failed",
                    "sagaId", sagaId,
                    "reason", result.name()
            ));
        }
    }

    Mono<Void> drive(String sagaId) {
        return Mono.defer(() -> {
            // the lease is re-entrant for this owner, so local exclusion is tracked here
            if (!driving.add(sagaId)) {
                log.info(JsonUtils.json(
                        "saga_event", "already_driving",
                        "sagaId", sagaId
                ));
                return Mono.<Void>empty();
            }
            return lease.tryAcquire(sagaId, owner, options.leaseDuration())
                    .flatMap(acquired -> {
                        if (!acquired) {
                            log.info(JsonUtils.json(
                                    "saga_event", "lease_busy",
                                    "sagaId", sagaId
                            ));
                            return Mono.<Void>empty();
                        }
                        Disposable heartbeat = heartbeat(sagaId);
                        return store.findById(sagaId)
                                .flatMap(snapshot -> {
                                    SagaInstance instance = SagaInstance.fromSnapshot(snapshot);
                                    return advance(instance)
                                            .onErrorResume(err -> halt(instance.sagaName(), sagaId, err));
                                })
                                .onErrorResume(err -> halt(UNKNOWN_SAGA, sagaId, err))
                                .doFinally(signal -> heartbeat.dispose())
                                .then(Mono.defer(() -> lease.release(sagaId, owner)))
                                .onErrorResume(err -> {
                                    log.warn("Failed to release lease for saga {}: {}", sagaId, err.toString());
                                    return Mono.empty();
                                });
                    })
                    .onErrorResume(err -> halt(UNKNOWN_SAGA, sagaId, err))
                    .doFinally(signal -> driving.remove(sagaId));
        });
    }

    private Disposable heartbeat(String sagaId) {
        Duration period = options.leaseDuration().dividedBy(3);
        if (period.compareTo(MIN_HEARTBEAT) < 0) period = MIN_HEARTBEAT;
        return Flux.interval(period, period)
                .concatMap(tick -> lease.renew(sagaId, owner, options.leaseDuration())
                        .onErrorResume(err -> {
                            log.warn("Failed to renew lease for saga {}: {}", sagaId, err.toString());
                            return Mono.just(true);
                        }))
                .takeWhile(Boolean::booleanValue)
                .subscribe();
    }

    /** Renews the lease and fails with {@link SagaLeaseLostException} when another owner holds it. */
    private Mono<Void> holdLease(SagaInstance instance) {
        return lease.renew(instance.sagaId(), owner, options.leaseDuration())
                .flatMap(held -> Boolean.TRUE.equals(held)
                        ? Mono.<Void>empty()
                        : Mono.error(new SagaLeaseLostException(instance.sagaId())));
    }

    private Mono<Void> halt(String sagaName, String sagaId, Throwable err) {
        if (err instanceof SagaStoreException) {
            events.onStoreFailure(sagaName, sagaId, err);
        } else if (err instanceof SagaLeaseLostException) {
            log.warn(JsonUtils.json(
                    "saga_event", "lease_lost",
                    "saga", sagaName,
                    "sagaId", sagaId
            ));
        } else {
            log.error(JsonUtils.json(
                    "saga_event", "halted",
                    "saga", sagaName,
                    "sagaId", sagaId,
                    "error_class", err.getClass().getName(),
                    "error_msg", SagaLogUtil.safeString(err.getMessage(), 500)
            ), err);
        }
        return Mono.empty();
    }

    private Mono<Void> advance(SagaInstance instance) {
        switch (instance.status()) {
            case PENDING:
                return moveTo(instance, SagaStatus.RUNNING)
                        .then(Mono.fromRunnable(() -> events.onStart(instance.sagaName(), instance.sagaId())))
                        .then(Mono.defer(() -> forward(instance, 0)));
            case RUNNING:
                events.onResumed(instance.sagaName(), instance.sagaId(), instance.status());
                return resumeRunning(instance);
            case COMPENSATING:
                events.onResumed(instance.sagaName(), instance.sagaId(), instance.status());
                return compensate(instance);
            default:
                return Mono.empty();
        }
    }

    // --- forward path ---

    private Mono<Void> resumeRunning(SagaInstance instance) {
        int index = instance.currentStepIndex();
        StepDefinition step = instance.definition().step(index);
        StepOutcome outcome = instance.outcome(step.stepId());
        if (outcome == null) {
            return forward(instance, index);
        }
        Instant now = clock.instant();
        switch (outcome.status()) {
            case RUNNING: {
                StepError error = StepError.of(StepErrorType.UNKNOWN_OUTCOME,
                        "Step was in flight when its previous owner stopped");
                StepOutcome failed = StepOutcome.failed(error, outcome.attemptCount(), outcome.startedAt(), now);
                instance.record(step.stepId(), failed, now);
                instance.markFailed(FailureReason.RECOVERED_IN_FLIGHT, step.stepId());
                log.warn(JsonUtils.json(
                        "saga_step", "possibly_applied",
                        "saga", instance.sagaName(),
                        "sagaId", instance.sagaId(),
                        "stepId", step.stepId(),
                        "error_type", error.type().name()
                ));
                events.onStepFailed(instance.sagaName(), instance.sagaId(), step.stepId(), error,
                        outcome.attemptCount(), latency(failed));
                return compensate(instance);
            }
            case SUCCEEDED:
                return forward(instance, index + 1);
            case FAILED:
                instance.markFailed(reasonFor(outcome.error()), step.stepId());
                return compensate(instance);
            default:
                return forward(instance, index);
        }
    }

    private Mono<Void> forward(SagaInstance instance, int index) {
        SagaDefinition def = instance.definition();
        if (index >= def.steps().size()) {
            return moveTo(instance, SagaStatus.COMPLETED).then(Mono.fromRunnable(() -> finish(instance)));
        }
        Instant now = clock.instant();
        Instant deadline = deadline(instance);
        StepDefinition step = def.step(index);
        instance.advanceTo(index, now);
        if (!now.isBefore(deadline)) {
            instance.markFailed(FailureReason.TIMED_OUT, null);
            log.warn(JsonUtils.json(
                    "saga_event", "saga_timeout",
                    "saga", instance.sagaName(),
                    "sagaId", instance.sagaId(),
                    "next_step", step.stepId()
            ));
            return compensate(instance);
        }
        final Map<String, Object> payload;
        try {
            payload = resolver.resolve(step.payload(),
                    ResolutionContext.forward(instance.sagaId(), def, instance.stepResults(), index));
        } catch (TemplateResolutionException e) {
            return stepFailed(instance, step, StepOutcome.failed(StepError.of(StepErrorType.TEMPLATE, e.getMessage()), 0, now, now));
        }
        instance.record(step.stepId(), StepOutcome.running(now), now);
        return holdLease(instance)
                .then(Mono.defer(() -> persist(instance)))
                .then(Mono.defer(() -> {
                    events.onStepStarted(instance.sagaName(), instance.sagaId(), step.stepId());
                    return executor.execute(instance.sagaName(), instance.sagaId(), step, payload,
                            stepTimeout(step), deadline, retryPolicy(step));
                }))
                .flatMap(outcome -> outcome.status() == StepStatus.SUCCEEDED
                        ? stepSucceeded(instance, index, step, outcome)
                        : stepFailed(instance, step, outcome));
    }

    private Mono<Void> stepSucceeded(SagaInstance instance, int index, StepDefinition step, StepOutcome outcome) {
        instance.record(step.stepId(), outcome, clock.instant());
        return persist(instance)
                .then(Mono.fromRunnable(() -> events.onStepSuccess(instance.sagaName(), instance.sagaId(),
                        step.stepId(), outcome.attemptCount(), latency(outcome))))
                .then(Mono.defer(() -> forward(instance, index + 1)));
    }

    private Mono<Void> stepFailed(SagaInstance instance, StepDefinition step, StepOutcome outcome) {
        instance.record(step.stepId(), outcome, clock.instant());
        instance.markFailed(reasonFor(outcome.error()), step.stepId());
        events.onStepFailed(instance.sagaName(), instance.sagaId(), step.stepId(), outcome.error(),
                outcome.attemptCount(), latency(outcome));
        return compensate(instance);
    }

    // --- rollback path ---

    private Mono<Void> compensate(SagaInstance instance) {
        Mono<Void> enter = instance.status() == SagaStatus.COMPENSATING
                ? Mono.empty()
                : moveTo(instance, SagaStatus.COMPENSATING);
        return enter
                .then(Mono.defer(() -> compensationRunner.compensate(instance, (stepId, outcome) -> {
                    instance.record(stepId, outcome, clock.instant());
                    return holdLease(instance).then(Mono.defer(() -> persist(instance)));
                })))
                .flatMap(allCompensated -> moveTo(instance,
                        allCompensated ? SagaStatus.COMPENSATED : SagaStatus.COMPENSATION_FAILED))
                .then(Mono.fromRunnable(() -> finish(instance)));
    }

    // --- helpers ---

    private Mono<Void> moveTo(SagaInstance instance, SagaStatus next) {
        SagaStatus from = instance.status();
        instance.transitionTo(next, clock.instant());
        return persist(instance)
                .then(Mono.fromRunnable(() -> events.onStatusChanged(instance.sagaName(), instance.sagaId(), from, next)));
    }

    private Mono<Void> persist(SagaInstance instance) {
        return store.save(instance.toSnapshot())
                .doOnNext(saved -> instance.setVersion(saved.version()))
                .then();
    }

    private void finish(SagaInstance instance) {
        events.onCompleted(instance.sagaName(), instance.sagaId(), instance.status());
    }

    private Instant deadline(SagaInstance instance) {
        Duration timeout = instance.definition().timeout() != null
                ? instance.definition().timeout()
                : options.defaultSagaTimeout();
        Instant started = instance.startedAt() != null ? instance.startedAt() : clock.instant();
        return started.plus(timeout);
    }

    private Duration stepTimeout(StepDefinition step) {
        return step.timeout() != null ? step.timeout() : options.defaultStepTimeout();
    }

    private RetryPolicy retryPolicy(StepDefinition step) {
        return step.retryAttempts() != null
                ? options.stepRetryPolicy().withMaxRetries(step.retryAttempts())
                : options.stepRetryPolicy();
    }

    private static FailureReason reasonFor(StepError error) {
        return error != null && error.type() == StepErrorType.SAGA_TIMEOUT
                ? FailureReason.TIMED_OUT
                : FailureReason.STEP_FAILED;
    }

    private static long latency(StepOutcome outcome) {
        if (outcome.startedAt() == null || outcome.finishedAt() == null) return 0L;
        return Duration.between(outcome.startedAt(), outcome.finishedAt()).toMillis();
    }

    static String newSagaId() {
        return "saga_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
