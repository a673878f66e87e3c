package com.firefly.sagaorchestrator.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.sagaorchestrator.config.SagaOrchestratorConfiguration;
import com.firefly.sagaorchestrator.core.*;
import com.firefly.sagaorchestrator.registry.SagaDefinitionBuilder;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonSagaStateSerializerTest {

    private final ObjectMapper mapper = new SagaOrchestratorConfiguration().sagaObjectMapper();
    private final JsonSagaStateSerializer serializer = new JsonSagaStateSerializer(mapper);
    private final Instant t0 = Instant.parse("2025-01-01T00:00:00Z");

    private SagaSnapshot snapshot() {
        SagaDefinition def = SagaDefinitionBuilder.saga("order")
                .sagaId("s1")
                .timeout(Duration.ofMinutes(10))
                .step("charge").service("http://payments").action("/charge")
                    .payload(Map.of("amount", 10))
                    .compensation("/refund", Map.of("charge_id", "${step_result.charge_id}"))
                    .timeout(Duration.ofSeconds(20)).retry(2).idempotent().add()
                .build();
        SagaInstance instance = SagaInstance.create("s1", def, t0);
        instance.transitionTo(SagaStatus.RUNNING, t0);
        instance.record("charge", StepOutcome.failed(StepError.application(402, "DECLINED", "no funds"), 1, t0, t0), t0);
        instance.markFailed(FailureReason.STEP_FAILED, "charge");
        instance.setVersion(3);
        return instance.toSnapshot();
    }

    @Test
    void writesSnakeCaseRecord() throws Exception {
        JsonNode json = mapper.readTree(serializer.serialize(snapshot()));

        assertEquals("s1", json.get("saga_id").asText());
        assertEquals("RUNNING", json.get("status").asText());
        assertEquals("STEP_FAILED", json.get("failure_reason").asText());
        assertEquals("2025-01-01T00:00:00Z", json.get("created_at").asText());
        assertFalse(json.get("requires_intervention").asBoolean());
        JsonNode charge = json.get("step_results").get("charge");
        assertEquals("FAILED", charge.get("status").asText());
        assertEquals(402, charge.get("error").get("http_status").asInt());
        assertEquals("/refund", json.get("definition").get("steps").get(0).get("compensation_action").asText());
    }

    @Test
    void readsBackEqualSnapshot() {
        SagaSnapshot original = snapshot();
        SagaSnapshot back = serializer.deserialize(serializer.serialize(original));

        assertEquals(original, back);
        assertEquals(Duration.ofSeconds(20), back.definition().step(0).timeout());
        assertEquals("order", back.sagaName());
    }

    @Test
    void corruptDataIsAStoreError() {
        assertThrows(SagaStoreException.class,
                () -> serializer.deserialize("{not json".getBytes(StandardCharsets.UTF_8)));
    }
}
