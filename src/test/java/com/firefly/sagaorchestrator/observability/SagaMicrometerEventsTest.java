package com.firefly.sagaorchestrator.observability;

import com.firefly.sagaorchestrator.core.SagaStatus;
import com.firefly.sagaorchestrator.core.StepError;
import com.firefly.sagaorchestrator.core.StepErrorType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SagaMicrometerEventsTest {

    @Test
    void recordsStepAndRunMeters() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        SagaMicrometerEvents events = new SagaMicrometerEvents(registry);

        events.onStart("Order", "s1");
        events.onStepStarted("Order", "s1", "a");
        events.onStepRetry("Order", "s1", "a", 1, StepError.of(StepErrorType.TRANSPORT, "refused"));
        events.onStepSuccess("Order", "s1", "a", 2, 40);
        events.onStepFailed("Order", "s1", "b", StepError.of(StepErrorType.TIMEOUT, "slow"), 1, 100);
        events.onCompensated("Order", "s1", "a", null);
        events.onCompleted("Order", "s1", SagaStatus.COMPENSATED);
        events.onStoreFailure("Order", "s1", new RuntimeException("down"));

        assertEquals(1.0, registry.get("saga.run.started").tag("saga", "Order").counter().count());
        assertEquals(1.0, registry.get("saga.step.retries").tag("error_type", "TRANSPORT").counter().count());
        assertEquals(1.0, registry.get("saga.step.completed").tag("step", "a").tag("outcome", "success").counter().count());
        assertEquals(1.0, registry.get("saga.step.completed").tag("step", "b").tag("error_type", "TIMEOUT").counter().count());
        assertEquals(2.0, registry.get("saga.step.attempts").tag("step", "a").summary().totalAmount());
        assertEquals(1, registry.get("saga.step.latency").tag("step", "b").timer().count());
        assertEquals(1.0, registry.get("saga.step.compensated").tag("outcome", "success").counter().count());
        assertEquals(1.0, registry.get("saga.run.completed").tag("status", "COMPENSATED").tag("success", "false").counter().count());
        assertEquals(1.0, registry.get("saga.store.failures").counter().count());
    }
}
