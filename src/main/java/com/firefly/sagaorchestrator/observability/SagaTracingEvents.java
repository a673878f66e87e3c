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
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer Tracing implementation for SagaEvents.
 * Creates a span for the overall saga and a child span per step.
 */
public class SagaTracingEvents implements SagaEvents {
    private final Tracer tracer;
    private final Map<String, Span> sagaSpans = new ConcurrentHashMap<>();
    private final Map<String, Span> stepSpans = new ConcurrentHashMap<>(); // key: sagaId:stepId

    public SagaTracingEvents(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void onStart(String sagaName, String sagaId) {
        openSagaSpan(sagaName, sagaId);
    }

    @Override
    public void onResumed(String sagaName, String sagaId, SagaStatus status) {
        openSagaSpan(sagaName, sagaId).tag("resumed_from", String.valueOf(status));
    }

    @Override
    public void onStepStarted(String sagaName, String sagaId, String stepId) {
        Span parent = sagaSpans.get(sagaId);
        Span span = (parent != null ? tracer.nextSpan(parent) : tracer.nextSpan())
                .name("step:" + stepId)
                .start();
        stepSpans.put(key(sagaId, stepId), span);
    }

    @Override
    public void onStepSuccess(String sagaName, String sagaId, String stepId, int attempts, long latencyMs) {
        endStepSpan(sagaId, stepId, null);
    }

    @Override
    public void onStepFailed(String sagaName, String sagaId, String stepId, StepError error, int attempts, long latencyMs) {
        endStepSpan(sagaId, stepId, error);
    }

    @Override
    public void onCompleted(String sagaName, String sagaId, SagaStatus status) {
        Span span = sagaSpans.remove(sagaId);
        if (span != null) {
            span.tag("outcome", status == SagaStatus.COMPLETED ? "success" : "failed");
            span.tag("status", String.valueOf(status));
            span.end();
        }
    }

    @Override
    public void onStoreFailure(String sagaName, String sagaId, Throwable error) {
        String prefix = sagaId + ":";
        stepSpans.entrySet().removeIf(e -> {
            if (!e.getKey().startsWith(prefix)) return false;
            e.getValue().tag("outcome", "halted").error(error).end();
            return true;
        });
        Span span = sagaSpans.remove(sagaId);
        if (span != null) {
            span.tag("outcome", "halted");
            span.error(error);
            span.end();
        }
    }

    private Span openSagaSpan(String sagaName, String sagaId) {
        Span span = tracer.nextSpan().name("saga:" + sagaName).tag("sagaId", sagaId).start();
        Span previous = sagaSpans.put(sagaId, span);
        if (previous != null) {
            previous.end();
        }
        return span;
    }

    private void endStepSpan(String sagaId, String stepId, StepError error) {
        Span span = stepSpans.remove(key(sagaId, stepId));
        if (span != null) {
            if (error != null) {
                span.tag("outcome", "failed");
                span.tag("error_type", String.valueOf(error.type()));
                span.tag("possibly_applied", String.valueOf(error.possiblyApplied()));
            } else {
                span.tag("outcome", "success");
            }
            span.end();
        }
    }

    private static String key(String sagaId, String stepId) {
        return sagaId + ":" + stepId;
    }
}
