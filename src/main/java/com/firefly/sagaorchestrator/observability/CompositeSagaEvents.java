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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Fans every event out to a list of sinks. A sink that throws is logged and skipped so the remaining
 * sinks and the saga flow are unaffected.
 */
public class CompositeSagaEvents implements SagaEvents {
    private static final Logger log = LoggerFactory.getLogger(CompositeSagaEvents.class);

    private final List<SagaEvents> delegates;

    public CompositeSagaEvents(List<SagaEvents> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    private void each(String event, Consumer<SagaEvents> call) {
        for (SagaEvents d : delegates) {
            try {
                call.accept(d);
            } catch (RuntimeException e) {
                log.warn("SagaEvents sink {} failed on {}: {}", d.getClass().getSimpleName(), event, e.toString());
            }
        }
    }

    @Override public void onSubmitted(String sagaName, String sagaId) { each("onSubmitted", d -> d.onSubmitted(sagaName, sagaId)); }
    @Override public void onStart(String sagaName, String sagaId) { each("onStart", d -> d.onStart(sagaName, sagaId)); }
    @Override public void onResumed(String sagaName, String sagaId, SagaStatus status) { each("onResumed", d -> d.onResumed(sagaName, sagaId, status)); }
    @Override public void onStatusChanged(String sagaName, String sagaId, SagaStatus from, SagaStatus to) { each("onStatusChanged", d -> d.onStatusChanged(sagaName, sagaId, from, to)); }
    @Override public void onStepStarted(String sagaName, String sagaId, String stepId) { each("onStepStarted", d -> d.onStepStarted(sagaName, sagaId, stepId)); }
    @Override public void onStepRetry(String sagaName, String sagaId, String stepId, int attempt, StepError error) { each("onStepRetry", d -> d.onStepRetry(sagaName, sagaId, stepId, attempt, error)); }
    @Override public void onStepSuccess(String sagaName, String sagaId, String stepId, int attempts, long latencyMs) { each("onStepSuccess", d -> d.onStepSuccess(sagaName, sagaId, stepId, attempts, latencyMs)); }
    @Override public void onStepFailed(String sagaName, String sagaId, String stepId, StepError error, int attempts, long latencyMs) { each("onStepFailed", d -> d.onStepFailed(sagaName, sagaId, stepId, error, attempts, latencyMs)); }
    @Override public void onCompensationStarted(String sagaName, String sagaId, String stepId) { each("onCompensationStarted", d -> d.onCompensationStarted(sagaName, sagaId, stepId)); }
    @Override public void onCompensationRetry(String sagaName, String sagaId, String stepId, int attempt) { each("onCompensationRetry", d -> d.onCompensationRetry(sagaName, sagaId, stepId, attempt)); }
    @Override public void onCompensationSkipped(String sagaName, String sagaId, String stepId, String reason) { each("onCompensationSkipped", d -> d.onCompensationSkipped(sagaName, sagaId, stepId, reason)); }
    @Override public void onCompensated(String sagaName, String sagaId, String stepId, StepError error) { each("onCompensated", d -> d.onCompensated(sagaName, sagaId, stepId, error)); }
    @Override public void onCompleted(String sagaName, String sagaId, SagaStatus status) { each("onCompleted", d -> d.onCompleted(sagaName, sagaId, status)); }
    @Override public void onStoreFailure(String sagaName, String sagaId, Throwable error) { each("onStoreFailure", d -> d.onStoreFailure(sagaName, sagaId, error)); }
}
