package com.firefly.sagaorchestrator.observability;

import com.firefly.sagaorchestrator.core.SagaStatus;
import com.firefly.sagaorchestrator.core.StepError;
import com.firefly.sagaorchestrator.core.StepErrorType;
import com.firefly.sagaorchestrator.persistence.SagaStoreException;
import io.micrometer.tracing.test.simple.SimpleSpan;
import io.micrometer.tracing.test.simple.SimpleTracer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SagaTracingEventsTest {

    @Test
    void opensSagaAndStepSpans() {
        SimpleTracer tracer = new SimpleTracer();
        SagaTracingEvents events = new SagaTracingEvents(tracer);

        events.onStart("Order", "s1");
        events.onStepStarted("Order", "s1", "a");
        events.onStepFailed("Order", "s1", "a", StepError.of(StepErrorType.TRANSPORT, "refused"), 3, 10);
        events.onCompleted("Order", "s1", SagaStatus.COMPENSATED);

        assertEquals(2, tracer.getSpans().size());
        SimpleSpan step = tracer.getSpans().stream().filter(s -> "step:a".equals(s.getName())).findFirst().orElseThrow();
        assertEquals("failed", step.getTags().get("outcome"));
        assertEquals("true", step.getTags().get("possibly_applied"));
        SimpleSpan saga = tracer.getSpans().stream().filter(s -> "saga:Order".equals(s.getName())).findFirst().orElseThrow();
        assertEquals("COMPENSATED", saga.getTags().get("status"));
        assertEquals("s1", saga.getTags().get("sagaId"));
    }

    @Test
    void storeFailureEndsOpenSpansOfThatSagaOnly() {
        SimpleTracer tracer = new SimpleTracer();
        SagaTracingEvents events = new SagaTracingEvents(tracer);
        RuntimeException failure = new SagaStoreException("store unavailable");

        events.onStart("Order", "s1");
        events.onStepStarted("Order", "s1", "a");
        events.onStart("Order", "s2");
        events.onStepStarted("Order", "s2", "a");
        events.onStoreFailure("Order", "s1", failure);

        List<SimpleSpan> halted = tracer.getSpans().stream()
                .filter(span -> "halted".equals(span.getTags().get("outcome")))
                .toList();
        assertEquals(2, halted.size());
        for (SimpleSpan span : halted) {
            assertSame(failure, span.getError());
        }
        assertTrue(halted.stream().anyMatch(span -> "saga:Order".equals(span.getName())
                && "s1".equals(span.getTags().get("sagaId"))));
        assertTrue(halted.stream().anyMatch(span -> "step:a".equals(span.getName())));

        events.onStepSuccess("Order", "s2", "a", 1, 5);
        events.onCompleted("Order", "s2", SagaStatus.COMPLETED);
        assertEquals(2, tracer.getSpans().stream()
                .filter(span -> "success".equals(span.getTags().get("outcome"))).count());

        // s1 has nothing left to end
        events.onCompleted("Order", "s1", SagaStatus.COMPENSATED);
        assertTrue(tracer.getSpans().stream().noneMatch(span -> "COMPENSATED".equals(span.getTags().get("status"))));
    }
}
