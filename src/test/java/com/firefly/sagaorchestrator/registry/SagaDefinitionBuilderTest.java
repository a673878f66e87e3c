package com.firefly.sagaorchestrator.registry;

import com.firefly.sagaorchestrator.core.SagaDefinition;
import com.firefly.sagaorchestrator.core.SagaPattern;
import com.firefly.sagaorchestrator.core.StepDefinition;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SagaDefinitionBuilderTest {

    @Test
    void buildsOrderedStepsWithWorkflowType() {
        SagaDefinition def = SagaDefinitionBuilder.saga("Payment")
                .sagaId("p-1")
                .timeout(Duration.ofMinutes(2))
                .metadata("tenant", "acme")
                .step("reserve").service("http://inv").action("/reserve")
                    .payload(Map.of("sku", "X1"))
                    .compensation("/release", Map.of("id", "${step_result.id}"))
                    .add()
                .step("notify").service("http://mail").action("/send")
                    .timeout(Duration.ofSeconds(5)).retry(1).idempotent()
                    .add()
                .build();

        assertEquals("p-1", def.sagaId());
        assertEquals(SagaPattern.ORCHESTRATION, def.pattern());
        assertEquals("Payment", def.name());
        assertEquals("acme", def.metadata().get("tenant"));
        assertEquals(1, def.indexOf("notify"));
        StepDefinition reserve = def.step(0);
        assertTrue(reserve.isCompensable());
        assertEquals(Map.of("id", "${step_result.id}"), reserve.compensationPayload());
        StepDefinition notify = def.step(1);
        assertFalse(notify.isCompensable());
        assertEquals(1, notify.retryAttempts());
        assertTrue(notify.idempotent());
    }

    @Test
    void duplicateStepIdsFailFast() {
        SagaDefinitionBuilder builder = SagaDefinitionBuilder.saga("Dup")
                .step("a").service("http://a").action("/a").add();
        SagaDefinitionBuilder.Step again = builder.step("a").service("http://a").action("/a");
        assertThrows(IllegalStateException.class, again::add);
    }

    @Test
    void unnamedSagaFallsBackToDefaultName() {
        SagaDefinition def = SagaDefinitionBuilder.saga(null)
                .step("a").service("http://a").action("/a").add()
                .build();
        assertEquals("saga", def.name());
    }
}
