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

package com.firefly.sagaorchestrator.http;

import com.firefly.sagaorchestrator.engine.ActionCall;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Tiny helper for propagating saga correlation headers into WebClient calls.
 * Usage:
 *   HttpCall.propagate(client.post().uri(url).bodyValue(body), call).retrieve()...
 */
public final class HttpCall {
    public static final String CORRELATION_HEADER = "X-Transactional-Id";
    public static final String SAGA_ID_HEADER = "X-Saga-Id";
    public static final String STEP_ID_HEADER = "X-Saga-Step-Id";
    public static final String COMPENSATION_HEADER = "X-Saga-Compensation";
    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private HttpCall() {}

    public static WebClient.RequestHeadersSpec<?> propagate(WebClient.RequestHeadersSpec<?> spec, ActionCall call) {
        if (call == null) return spec;
        return spec.header(CORRELATION_HEADER, call.sagaId())
                .header(SAGA_ID_HEADER, call.sagaId())
                .header(STEP_ID_HEADER, call.stepId())
                .header(COMPENSATION_HEADER, Boolean.toString(call.compensation()))
                .header(IDEMPOTENCY_KEY_HEADER, call.idempotencyKey());
    }
}
