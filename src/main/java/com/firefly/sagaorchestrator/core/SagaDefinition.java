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

package com.firefly.sagaorchestrator.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable description of a saga submitted for execution.
 *
 * @param sagaId   optional caller-chosen id; generated when null
 * @param pattern  coordination style, only ORCHESTRATION is executed
 * @param timeout  whole-saga deadline measured from start; null falls back to the coordinator default
 * @param metadata free-form tracing data; {@code workflow_type} doubles as the saga name in logs and metrics
 * @param steps    ordered steps, executed strictly in this order
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SagaDefinition(
        String sagaId,
        SagaPattern pattern,
        Duration timeout,
        Map<String, String> metadata,
        List<StepDefinition> steps
) {
    public static final String WORKFLOW_TYPE = "workflow_type";
    static final String DEFAULT_NAME = "saga";

    public SagaDefinition {
        pattern = pattern != null ? pattern : SagaPattern.ORCHESTRATION;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    @JsonIgnore
    public String name() {
        String type = metadata.get(WORKFLOW_TYPE);
        return type != null && !type.isBlank() ? type : DEFAULT_NAME;
    }

    public StepDefinition step(int index) {
        return steps.get(index);
    }

    public int indexOf(String stepId) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).stepId().equals(stepId)) return i;
        }
        return -1;
    }

    public SagaDefinition withSagaId(String id) {
        return new SagaDefinition(id, pattern, timeout, metadata, steps);
    }

    public SagaDefinition withTimeout(Duration sagaTimeout) {
        return new SagaDefinition(sagaId, pattern, sagaTimeout, metadata, steps);
    }
}
