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

package com.firefly.sagaorchestrator.registry;

import com.firefly.sagaorchestrator.core.SagaDefinition;
import com.firefly.sagaorchestrator.core.SagaPattern;
import com.firefly.sagaorchestrator.core.StepDefinition;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a definition before anything is persisted.
 */
public class SagaDefinitionValidator {
    public static final Duration MAX_STEP_TIMEOUT = Duration.ofSeconds(3600);
    public static final Duration MAX_SAGA_TIMEOUT = Duration.ofSeconds(7200);
    public static final int MAX_RETRY_ATTEMPTS = 10;

    public void validate(SagaDefinition definition) {
        List<String> problems = new ArrayList<>();
        if (definition == null) {
            throw new InvalidSagaDefinitionException(List.of("definition is required"));
        }
        if (definition.pattern() != SagaPattern.ORCHESTRATION) {
            problems.add("pattern " + definition.pattern() + " is not supported, only ORCHESTRATION is executed");
        }
        if (definition.sagaId() != null && definition.sagaId().isBlank()) {
            problems.add("saga_id must not be blank when given");
        }
        checkTimeout(definition.timeout(), MAX_SAGA_TIMEOUT, "saga timeout", problems);
        if (definition.steps().isEmpty()) {
            problems.add("at least one step is required");
        }
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < definition.steps().size(); i++) {
            StepDefinition step = definition.steps().get(i);
            if (step == null) {
                problems.add("step #" + i + " is null");
                continue;
            }
            String label = step.stepId() != null ? "step '" + step.stepId() + "'" : "step #" + i;
            if (step.stepId() == null || step.stepId().isBlank()) {
                problems.add(label + ": step_id is required");
            } else if (!ids.add(step.stepId())) {
                problems.add("duplicate step_id '" + step.stepId() + "'");
            }
            if (step.serviceUrl() == null || step.serviceUrl().isBlank()) {
                problems.add(label + ": service_url is required");
            }
            if (step.action() == null || step.action().isBlank()) {
                problems.add(label + ": action is required");
            }
            checkTimeout(step.timeout(), MAX_STEP_TIMEOUT, label + " timeout", problems);
            Integer retries = step.retryAttempts();
            if (retries != null && (retries < 0 || retries > MAX_RETRY_ATTEMPTS)) {
                problems.add(label + ": retry_attempts must be between 0 and " + MAX_RETRY_ATTEMPTS);
            }
        }
        if (!problems.isEmpty()) {
            throw new InvalidSagaDefinitionException(problems);
        }
    }

    private static void checkTimeout(Duration timeout, Duration max, String what, List<String> problems) {
        if (timeout == null) return;
        if (timeout.isNegative() || timeout.isZero()) {
            problems.add(what + " must be positive");
        } else if (timeout.compareTo(max) > 0) {
            problems.add(what + " must not exceed " + max.getSeconds() + "s");
        }
    }
}
