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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fluent builder for {@link SagaDefinition}s.
 * <pre>
 *   SagaDefinitionBuilder.saga("user_registration")
 *       .step("create_user").service("http://users").action("/create")
 *           .payload(Map.of("email", "a@b.c"))
 *           .compensation("/delete", Map.of("user_id", "${step_result.user_id}"))
 *           .add()
 *       .build();
 * </pre>
 */
public class SagaDefinitionBuilder {
    private final String name;
    private final List<StepDefinition> steps = new ArrayList<>();
    private final Set<String> ids = new HashSet<>();
    private final Map<String, String> metadata = new LinkedHashMap<>();
    private String sagaId;
    private Duration timeout;

    private SagaDefinitionBuilder(String name) {
        this.name = name;
        if (name != null) metadata.put(SagaDefinition.WORKFLOW_TYPE, name);
    }

    public static SagaDefinitionBuilder saga(String name) {
        return new SagaDefinitionBuilder(name);
    }

    public SagaDefinitionBuilder sagaId(String id) { this.sagaId = id; return this; }
    public SagaDefinitionBuilder timeout(Duration timeout) { this.timeout = timeout; return this; }
    public SagaDefinitionBuilder metadata(String key, String value) { this.metadata.put(key, value); return this; }

    public Step step(String id) {
        return new Step(id);
    }

    public SagaDefinition build() {
        return new SagaDefinition(sagaId, SagaPattern.ORCHESTRATION, timeout, metadata, steps);
    }

    public class Step {
        private final String id;
        private String serviceUrl;
        private String action;
        private Map<String, Object> payload = Map.of();
        private String compensationAction;
        private Map<String, Object> compensationPayload = Map.of();
        private Duration timeout;
        private Integer retryAttempts;
        private boolean idempotent;

        private Step(String id) {
            this.id = id;
        }

        public Step service(String url) { this.serviceUrl = url; return this; }
        public Step action(String action) { this.action = action; return this; }
        public Step payload(Map<String, Object> payload) { this.payload = payload; return this; }
        public Step timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Step retry(int attempts) { this.retryAttempts = attempts; return this; }
        public Step idempotent() { this.idempotent = true; return this; }

        public Step compensation(String action, Map<String, Object> payload) {
            this.compensationAction = action;
            this.compensationPayload = payload;
            return this;
        }

        public SagaDefinitionBuilder add() {
            if (!ids.add(id)) {
                throw new IllegalStateException("Duplicate step id '" + id + "' in saga '" + name + "'");
            }
            steps.add(new StepDefinition(id, serviceUrl, action, payload, compensationAction, compensationPayload,
                    timeout, retryAttempts, idempotent));
            return SagaDefinitionBuilder.this;
        }
    }
}
