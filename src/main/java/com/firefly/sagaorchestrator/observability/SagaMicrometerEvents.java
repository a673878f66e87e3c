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

package com.firefly.sagaorchestrator.observability;

import com.firefly.sagaorchestrator.core.SagaStatus;
import com.firefly.sagaorchestrator.core.StepError;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer-based implementation of SagaEvents that publishes counters, timers,
 * and distribution summaries for steps, compensations and saga completion.
 */
public class SagaMicrometerEvents implements SagaEvents {
    private final MeterRegistry registry;

    public SagaMicrometerEvents(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onStart(String sagaName, String sagaId) {
        registry.counter("saga.run.started", Tags.of(Tag.of("saga", sagaName))).increment();
    }

    @Override
    public void onStepStarted(String sagaName, String sagaId, String stepId) {
        registry.counter("saga.step.started", Tags.of(Tag.of("saga", sagaName), Tag.of("step", stepId))).increment();
    }

    @Override
    public void onStepRetry(String sagaName, String sagaId, String stepId, int attempt, StepError error) {
        String type = error != null ? error.type().name() : "UNKNOWN";
        registry.counter("saga.step.retries", Tags.of(Tag.of("saga", sagaName), Tag.of("step", stepId), Tag.of("error_type", type))).increment();
    }

    @Override
    public void onStepSuccess(String sagaName, String sagaId, String stepId, int attempts, long latencyMs) {
        record(Tags.of(Tag.of("saga", sagaName), Tag.of("step", stepId), Tag.of("outcome", "success")), attempts, latencyMs);
    }

    @Override
    public void onStepFailed(String sagaName, String sagaId, String stepId, StepError error, int attempts, long latencyMs) {
        String type = error != null ? error.type().name() : "UNKNOWN";
        record(Tags.of(Tag.of("saga", sagaName), Tag.of("step", stepId), Tag.of("outcome", "failed"), Tag.of("error_type", type)),
                attempts, latencyMs);
    }

    @Override
    public void onCompensated(String sagaName, String sagaId, String stepId, StepError error) {
        String outcome = error == null ? "success" : "error";
        registry.counter("saga.step.compensated", Tags.of(Tag.of("saga", sagaName), Tag.of("step", stepId), Tag.of("outcome", outcome))).increment();
    }

    @Override
    public void onCompleted(String sagaName, String sagaId, SagaStatus status) {
        registry.counter("saga.run.completed", Tags.of(
                Tag.of("saga", sagaName),
                Tag.of("status", String.valueOf(status)),
                Tag.of("success", String.valueOf(status == SagaStatus.COMPLETED)))).increment();
    }

    @Override
    public void onStoreFailure(String sagaName, String sagaId, Throwable error) {
        registry.counter("saga.store.failures", Tags.of(Tag.of("saga", sagaName))).increment();
    }

    private void record(Tags tags, int attempts, long latencyMs) {
        registry.counter("saga.step.completed", tags).increment();
        Timer.builder("saga.step.latency")
                .tags(tags)
                .register(registry)
                .record(Duration.ofMillis(Math.max(0L, latencyMs)));
        DistributionSummary.builder("saga.step.attempts")
                .baseUnit("attempts")
                .tags(tags)
                .register(registry)
                .record(Math.max(0, attempts));
    }
}
