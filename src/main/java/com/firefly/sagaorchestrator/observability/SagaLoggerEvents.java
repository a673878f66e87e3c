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
import com.firefly.sagaorchestrator.util.JsonUtils;
import com.firefly.sagaorchestrator.util.SagaLogUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link SagaEvents} implementation that emits single-line JSON logs via SLF4J.
 * Lifecycle at INFO, step failures at WARN, store failures and failed rollbacks at ERROR.
 */
public class SagaLoggerEvents implements SagaEvents {
    private static final Logger log = LoggerFactory.getLogger(SagaLoggerEvents.class);

    @Override
    public void onSubmitted(String sagaName, String sagaId) {
        log.info(JsonUtils.json(
                "saga_event", "submitted",
                "saga", sagaName,
                "sagaId", sagaId
        ));
    }

    @Override
    public void onStart(String sagaName, String sagaId) {
        log.info(JsonUtils.json(
                "saga_event", "start",
                "saga", sagaName,
                "sagaId", sagaId
        ));
    }

    @Override
    public void onResumed(String sagaName, String sagaId, SagaStatus status) {
        log.info(JsonUtils.json(
                "saga_event", "resumed",
                "saga", sagaName,
                "sagaId", sagaId,
                "status", String.valueOf(status)
        ));
    }

    @Override
    public void onStatusChanged(String sagaName, String sagaId, SagaStatus from, SagaStatus to) {
        log.debug(JsonUtils.json(
                "saga_event", "status_changed",
                "saga", sagaName,
                "sagaId", sagaId,
                "from", String.valueOf(from),
                "to", String.valueOf(to)
        ));
    }

    @Override
    public void onStepStarted(String sagaName, String sagaId, String stepId) {
        log.info(JsonUtils.json(
                "saga_event", "step_started",
                "saga", sagaName,
                "sagaId", sagaId,
                "stepId", stepId
        ));
    }

    @Override
    public void onStepRetry(String sagaName, String sagaId, String stepId, int attempt, StepError error) {
        log.info(JsonUtils.json(
                "saga_event", "step_retry",
                "saga", sagaName,
                "sagaId", sagaId,
                "stepId", stepId,
                "attempt", Integer.toString(attempt),
                "error_type", error != null ? String.valueOf(error.type()) : "",
                "error_msg", SagaLogUtil.safeString(error != null ? error.message() : "", 500)
        ));
    }

    @Override
    public void onStepSuccess(String sagaName, String sagaId, String stepId, int attempts, long latencyMs) {
        log.info(JsonUtils.json(
                "saga_event", "step_success",
                "saga", sagaName,
                "sagaId", sagaId,
                "stepId", stepId,
                "attempts", Integer.toString(attempts),
                "latencyMs", Long.toString(latencyMs)
        ));
    }

    @Override
    public void onStepFailed(String sagaName, String sagaId, String stepId, StepError error, int attempts, long latencyMs) {
        log.warn(JsonUtils.json(
                "saga_event", "step_failed",
                "saga", sagaName,
                "sagaId", sagaId,
                "stepId", stepId,
                "attempts", Integer.toString(attempts),
                "latencyMs", Long.toString(latencyMs),
                "error_type", error != null ? String.valueOf(error.type()) : "",
                "error_code", error != null ? error.code() : "",
                "possibly_applied", Boolean.toString(error != null && error.possiblyApplied()),
                "error_msg", SagaLogUtil.safeString(error != null ? error.message() : "", 500)
        ));
    }

    @Override
    public void onCompensationStarted(String sagaName, String sagaId, String stepId) {
        log.info(JsonUtils.json(
                "saga_event", "compensation_started",
                "saga", sagaName,
                "sagaId", sagaId,
                "stepId", stepId
        ));
    }

    @Override
    public void onCompensationRetry(String sagaName, String sagaId, String stepId, int attempt) {
        log.info(JsonUtils.json(
                "saga_event", "compensation_retry",
                "saga", sagaName,
                "sagaId", sagaId,
                "stepId", stepId,
                "attempt", Integer.toString(attempt)
        ));
    }

    @Override
    public void onCompensationSkipped(String sagaName, String sagaId, String stepId, String reason) {
        log.info(JsonUtils.json(
                "saga_event", "compensation_skipped",
                "saga", sagaName,
                "sagaId", sagaId,
                "stepId", stepId,
                "reason", SagaLogUtil.safeString(reason, 300)
        ));
    }

    @Override
    public void onCompensated(String sagaName, String sagaId, String stepId, StepError error) {
        if (error == null) {
            log.info(JsonUtils.json(
                    "saga_event", "compensated",
                    "saga", sagaName,
                    "sagaId", sagaId,
                    "stepId", stepId
            ));
            return;
        }
        log.error(JsonUtils.json(
                "saga_event", "compensation_failed",
                "saga", sagaName,
                "sagaId", sagaId,
                "stepId", stepId,
                "error_type", String.valueOf(error.type()),
                "error_msg", SagaLogUtil.safeString(error.message(), 500)
        ));
    }

    @Override
    public void onCompleted(String sagaName, String sagaId, SagaStatus status) {
        String line = JsonUtils.json(
                "saga_event", "completed",
                "saga", sagaName,
                "sagaId", sagaId,
                "status", String.valueOf(status),
                "success", Boolean.toString(status == SagaStatus.COMPLETED),
                "requires_intervention", Boolean.toString(status == SagaStatus.COMPENSATION_FAILED)
        );
        if (status == SagaStatus.COMPENSATION_FAILED) {
            log.error(line);
        } else {
            log.info(line);
        }
    }

    @Override
    public void onStoreFailure(String sagaName, String sagaId, Throwable error) {
        log.error(JsonUtils.json(
                "saga_event", "store_failure",
                "saga", sagaName,
                "sagaId", sagaId,
                "error_class", error != null ? error.getClass().getName() : "",
                "error_msg", SagaLogUtil.safeString(error != null ? error.getMessage() : "", 500)
        ));
    }
}
