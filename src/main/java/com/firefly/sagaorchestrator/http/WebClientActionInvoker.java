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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.sagaorchestrator.engine.ActionCall;
import com.firefly.sagaorchestrator.engine.ActionFailedException;
import com.firefly.sagaorchestrator.engine.ActionInvoker;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Sends step and compensation calls as {@code POST <service_url>/<action>} with a JSON body.
 * A 2xx body is decoded as JSON (an empty body becomes {@link ActionInvoker#EMPTY_RESULT}); any other status
 * signals {@link ActionFailedException} carrying the {@code message}/{@code code} of the error body when present.
 */
public class WebClientActionInvoker implements ActionInvoker {
    private static final String[] MESSAGE_FIELDS = {"message", "error", "detail"};

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public WebClientActionInvoker(WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Object> invoke(ActionCall call) {
        WebClient.RequestHeadersSpec<?> spec = webClient.post()
                .uri(call.url())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(call.payload());
        return HttpCall.propagate(spec, call)
                .exchangeToMono(this::decode);
    }

    private Mono<Object> decode(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        return Mono.just(parseSuccess(body));
                    }
                    return Mono.error(toFailure(status, body));
                });
    }

    private Object parseSuccess(String body) {
        if (body == null || body.isBlank()) return EMPTY_RESULT;
        try {
            return objectMapper.readValue(body, Object.class);
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    ActionFailedException toFailure(int status, String body) {
        String message = null;
        String code = null;
        if (body != null && !body.isBlank()) {
            try {
                JsonNode node = objectMapper.readTree(body);
                if (node != null && node.isObject()) {
                    for (String field : MESSAGE_FIELDS) {
                        JsonNode m = node.get(field);
                        if (m != null && m.isTextual()) {
                            message = m.asText();
                            break;
                        }
                    }
                    JsonNode c = node.get("code");
                    if (c != null && !c.isNull()) code = c.asText();
                }
            } catch (JsonProcessingException e) {
                message = body;
            }
        }
        if (message == null) message = "HTTP " + status;
        return new ActionFailedException(status, code, message);
    }
}
