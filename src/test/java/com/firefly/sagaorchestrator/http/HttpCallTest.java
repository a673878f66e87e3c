package com.firefly.sagaorchestrator.http;

import com.firefly.sagaorchestrator.engine.ActionCall;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HttpCallTest {

    @Test
    void propagatesSagaAndIdempotencyHeaders() {
        // Given
        WebClient.RequestBodyUriSpec request = mock(WebClient.RequestBodyUriSpec.class);
        when(request.header(anyString(), anyString())).thenReturn(request);
        ActionCall call = new ActionCall("saga_1", "charge", "http://payments", "/charge", Map.of(), true);

        // When
        WebClient.RequestHeadersSpec<?> out = HttpCall.propagate(request, call);

        // Then: returns the same request for chaining
        assertSame(request, out);
        verify(request).header(HttpCall.CORRELATION_HEADER, "saga_1");
        verify(request).header(HttpCall.SAGA_ID_HEADER, "saga_1");
        verify(request).header(HttpCall.STEP_ID_HEADER, "charge");
        verify(request).header(HttpCall.COMPENSATION_HEADER, "true");
        verify(request).header(HttpCall.IDEMPOTENCY_KEY_HEADER, "saga_1:charge:compensate");
        verifyNoMoreInteractions(request);
    }

    @Test
    void nullCallIsNoop() {
        WebClient.RequestHeadersSpec<?> request = mock(WebClient.RequestBodyUriSpec.class, RETURNS_DEEP_STUBS);
        WebClient.RequestHeadersSpec<?> out = HttpCall.propagate(request, null);
        assertSame(request, out);
        verifyNoInteractions(request);
    }

    @Test
    void urlJoinsWithSingleSlash() {
        assertEquals("http://svc/api/do", new ActionCall("s", "a", "http://svc/", "/api/do", Map.of(), false).url());
        assertEquals("http://svc/api/do", new ActionCall("s", "a", "http://svc", "api/do", Map.of(), false).url());
        assertEquals("s:a", new ActionCall("s", "a", "http://svc", "x", Map.of(), false).idempotencyKey());
    }
}
