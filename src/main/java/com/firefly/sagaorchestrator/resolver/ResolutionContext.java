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

package com.firefly.sagaorchestrator.resolver;

import com.firefly.sagaorchestrator.core.SagaDefinition;
import com.firefly.sagaorchestrator.core.StepOutcome;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values a template may refer to while materializing one payload.
 *
 * @param sagaId          the saga id
 * @param metadata        saga metadata
 * @param currentResult   what {@code step_result} points at
 * @param hasPrevious     whether a preceding step exists
 * @param previousResult  result of the preceding step
 * @param namedResults    results of steps whose forward action succeeded, by step id
 */
public record ResolutionContext(
        String sagaId,
        Map<String, String> metadata,
        Object currentResult,
        boolean hasPrevious,
        Object previousResult,
        Map<String, Object> namedResults
) {

    /**
     * Context for the forward payload of the step at {@code stepIndex}. {@code step_result} is the merge of all
     * earlier successful map results in execution order, later steps overriding earlier keys.
     */
    public static ResolutionContext forward(String sagaId, SagaDefinition definition,
                                            Map<String, StepOutcome> results, int stepIndex) {
        Map<String, Object> named = namedResults(results);
        Map<String, Object> accumulator = new LinkedHashMap<>();
        for (int i = 0; i < stepIndex && i < definition.steps().size(); i++) {
            Object r = named.get(definition.step(i).stepId());
            if (r instanceof Map<?, ?> m) {
                m.forEach((k, v) -> accumulator.put(String.valueOf(k), v));
            }
        }
        boolean hasPrevious = stepIndex > 0;
        Object previous = hasPrevious ? named.get(definition.step(stepIndex - 1).stepId()) : null;
        return new ResolutionContext(sagaId, definition.metadata(), Collections.unmodifiableMap(accumulator),
                hasPrevious, previous, named);
    }

    /** Context for the compensation payload of {@code stepId}; {@code step_result} is that step's own result. */
    public static ResolutionContext compensation(String sagaId, SagaDefinition definition,
                                                 Map<String, StepOutcome> results, String stepId) {
        Map<String, Object> named = namedResults(results);
        int index = definition.indexOf(stepId);
        boolean hasPrevious = index > 0;
        Object previous = hasPrevious ? named.get(definition.step(index - 1).stepId()) : null;
        return new ResolutionContext(sagaId, definition.metadata(), named.get(stepId), hasPrevious, previous, named);
    }

    private static Map<String, Object> namedResults(Map<String, StepOutcome> results) {
        Map<String, Object> named = new LinkedHashMap<>();
        results.forEach((id, outcome) -> {
            if (outcome != null && outcome.status().hasForwardResult()) {
                named.put(id, outcome.result());
            }
        });
        return named;
    }
}
