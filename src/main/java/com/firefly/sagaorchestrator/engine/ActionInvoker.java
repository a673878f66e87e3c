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

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Transport seam for step and compensation calls.
 * Implementations emit the decoded response body, or signal {@link ActionFailedException} for an explicit
 * non-success answer and any other error for transport problems.
 */
public interface ActionInvoker {

    /** Result recorded when a call succeeds with an empty body. */
    Map<String, Object> EMPTY_RESULT = Map.of("status", "success");

    Mono<Object> invoke(ActionCall call);
}
