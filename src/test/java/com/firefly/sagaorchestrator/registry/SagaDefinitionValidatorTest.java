package com.firefly.sagaorchestrator.registry;

import com.firefly.sagaorchestrator.core.SagaDefinition;
import com.firefly.sagaorchestrator.core.SagaPattern;
import com.firefly.sagaorchestrator.core.StepDefinition;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SagaDefinitionValidatorTest {

    private final SagaDefinitionValidator validator = new SagaDefinitionValidator();

    private static StepDefinition step(String id, String url, String action) {
        return new StepDefinition(id, url, action, Map.of(), null, null, null, null, false);
    }

    @Test
    void acceptsMinimalDefinition() {
        assertDoesNotThrow(() -> validator.validate(SagaDefinitionBuilder.saga("ok")
                .step("a").service("http://a").action("/a").add()
                .build()));
    }

    @Test
    void collectsEveryProblem() {
        SagaDefinition def = new SagaDefinition("", SagaPattern.CHOREOGRAPHY, Duration.ofHours(3), Map.of(), List.of(
                step("a", "http://a", "/a"),
                step("a", null, " "),
                new StepDefinition(null, "http://c", "/c", Map.of(), null, null, Duration.ZERO, 11, false)));

        InvalidSagaDefinitionException e = assertThrows(InvalidSagaDefinitionException.class, () -> validator.validate(def));

        List<String> problems = e.getProblems();
        assertTrue(problems.stream().anyMatch(p -> p.contains("CHOREOGRAPHY")));
        assertTrue(problems.stream().anyMatch(p -> p.contains("saga_id must not be blank")));
        assertTrue(problems.stream().anyMatch(p -> p.contains("saga timeout must not exceed 7200s")));
        assertTrue(problems.contains("duplicate step_id 'a'"));
        assertTrue(problems.contains("step 'a': service_url is required"));
        assertTrue(problems.contains("step 'a': action is required"));
        assertTrue(problems.contains("step #2: step_id is required"));
        assertTrue(problems.contains("step #2 timeout must be positive"));
        assertTrue(problems.contains("step #2: retry_attempts must be between 0 and 10"));
        assertEquals(9, problems.size());
    }

    @Test
    void requiresAtLeastOneStep() {
        InvalidSagaDefinitionException e = assertThrows(InvalidSagaDefinitionException.class,
                () -> validator.validate(SagaDefinitionBuilder.saga("empty").build()));
        assertEquals(List.of("at least one step is required"), e.getProblems());
    }

    @Test
    void stepTimeoutIsCapped() {
        SagaDefinition def = SagaDefinitionBuilder.saga("slow")
                .step("a").service("http://a").action("/a").timeout(Duration.ofSeconds(3601)).add()
                .build();
        InvalidSagaDefinitionException e = assertThrows(InvalidSagaDefinitionException.class, () -> validator.validate(def));
        assertEquals(List.of("step 'a' timeout must not exceed 3600s"), e.getProblems());
    }
}
