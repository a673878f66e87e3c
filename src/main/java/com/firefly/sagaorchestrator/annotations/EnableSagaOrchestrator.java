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

package com.firefly.sagaorchestrator.annotations;

import com.firefly.sagaorchestrator.config.SagaOrchestratorConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enables the saga orchestrator in a Spring application.
 * <p>
 * Imports {@link SagaOrchestratorConfiguration} that wires:
 * - {@code SagaCoordinator}: submission, execution, status queries and resumption
 * - {@code SagaStore} / {@code SagaLease}: in-memory unless Redis persistence is enabled
 * - {@code SagaEvents}: logger sink plus Micrometer metrics and tracing when those beans exist
 * - {@code SagaRecoveryService}: resumes unfinished sagas at startup
 * - {@code SagaController}: the REST surface under {@code /sagas}
 * - {@code WebClient.Builder}: used for outbound step calls
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
@Import(SagaOrchestratorConfiguration.class)
public @interface EnableSagaOrchestrator {
}
