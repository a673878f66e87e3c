package com.firefly.sagaorchestrator.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.sagaorchestrator.engine.ActionCall;
import com.firefly.sagaorchestrator.engine.ActionFailedException;
import com.firefly.sagaorchestrator.engine.ActionInvoker;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class WebClientActionInvokerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();
    private final ActionCall call = new ActionCall("saga_1", "reserve", "http://inventory/", "/reserve",
            Map.of("sku", "X1"), false);

    private WebClientActionInvoker invoker(HttpStatus status, String body) {
        WebClient client = WebClient.builder()
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    ClientResponse.Builder response = ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
                    if (body != null) response.body(body);
                    return Mono.just(response.build());
                })
                .build();
        return new WebClientActionInvoker(client, mapper);
    }

    @Test
    void postsJsonWithSagaHeaders() {
        StepVerifier.create(invoker(HttpStatus.OK, "{\"reservation_id\":\"r-9\"}").invoke(call))
                .assertNext(result -> assertEquals(Map.of("reservation_id", "r-9"), result))
                .verifyComplete();

        ClientRequest request = lastRequest.get();
        assertEquals(HttpMethod.POST, request.method());
        assertEquals("http://inventory/reserve", request.url().toString());
        assertEquals("saga_1", request.headers().getFirst(HttpCall.CORRELATION_HEADER));
        assertEquals("reserve", request.headers().getFirst(HttpCall.STEP_ID_HEADER));
        assertEquals("false", request.headers().getFirst(HttpCall.COMPENSATION_HEADER));
        assertEquals("saga_1:reserve", request.headers().getFirst(HttpCall.IDEMPOTENCY_KEY_HEADER));
    }

    @Test
    void emptySuccessBodyBecomesMarker() {
        StepVerifier.create(invoker(HttpStatus.NO_CONTENT, null).invoke(call))
                .expectNext(ActionInvoker.EMPTY_RESULT)
                .verifyComplete();
    }

    @Test
    void errorStatusCarriesBodyDetails() {
        StepVerifier.create(invoker(HttpStatus.CONFLICT, "{\"error\":\"out of stock\",\"code\":\"NO_STOCK\"}").invoke(call))
                .expectErrorSatisfies(err -> {
                    ActionFailedException failure = assertInstanceOf(ActionFailedException.class, err);
                    assertEquals(409, failure.getHttpStatus());
                    assertEquals("NO_STOCK", failure.getCode());
                    assertEquals("out of stock", failure.getMessage());
                })
                .verify();
    }

    @Test
    void failureMessageFallsBack() {
        WebClientActionInvoker invoker = invoker(HttpStatus.OK, null);
        assertEquals("HTTP 500", invoker.toFailure(500, "").getMessage());
        assertEquals("gateway down", invoker.toFailure(502, "gateway down").getMessage());
        assertEquals("HTTP 400", invoker.toFailure(400, "{\"status\":400}").getMessage());
        assertNull(invoker.toFailure(400, "{}").getCode());
    }
}
