package com.firefly.sagaorchestrator.resolver;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VariableReferenceTest {

    @Test
    void parsesEachScope() {
        VariableReference step = VariableReference.parse("steps.create_user.address.city");
        assertEquals(VariableReference.Scope.STEP, step.scope());
        assertEquals("create_user", step.target());
        assertEquals(List.of("address", "city"), step.path());

        VariableReference current = VariableReference.parse("step_result.user_id");
        assertEquals(VariableReference.Scope.STEP_RESULT, current.scope());
        assertEquals(List.of("user_id"), current.path());

        assertEquals(VariableReference.Scope.PREVIOUS_STEP, VariableReference.parse("previous_step").scope());
        assertEquals("tenant", VariableReference.parse("metadata.tenant").target());
        assertEquals(VariableReference.Scope.SAGA, VariableReference.parse(" saga.id ").scope());
    }

    @Test
    void rejectsMalformedExpressions() {
        assertThrows(TemplateResolutionException.class, () -> VariableReference.parse(""));
        assertThrows(TemplateResolutionException.class, () -> VariableReference.parse("step_result..id"));
        assertThrows(TemplateResolutionException.class, () -> VariableReference.parse("env.HOME"));
        assertThrows(TemplateResolutionException.class, () -> VariableReference.parse("steps"));
        assertThrows(TemplateResolutionException.class, () -> VariableReference.parse("metadata"));
        assertThrows(TemplateResolutionException.class, () -> VariableReference.parse("metadata.a.b"));
        TemplateResolutionException e = assertThrows(TemplateResolutionException.class,
                () -> VariableReference.parse("saga.name"));
        assertEquals("saga.name", e.getExpression());
    }
}
