package com.firefly.sagaorchestrator.observability;

import com.firefly.sagaorchestrator.core.SagaStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompositeSagaEventsTest {

    static class CapturingEvents implements SagaEvents {
        final List<String> calls = new ArrayList<>();
        @Override public void onStart(String sagaName, String sagaId) { calls.add("start:"+sagaName+":"+sagaId); }
        @Override public void onStepStarted(String sagaName, String sagaId, String stepId) { calls.add("step:"+stepId); }
        @Override public void onCompleted(String sagaName, String sagaId, SagaStatus status) { calls.add("completed:"+status); }
    }

    static class ExplodingEvents implements SagaEvents {
        @Override public void onStart(String sagaName, String sagaId) { throw new IllegalStateException("boom"); }
    }

    @Test
    void compositeFansOutCalls() {
        CapturingEvents a = new CapturingEvents();
        CapturingEvents b = new CapturingEvents();
        CompositeSagaEvents composite = new CompositeSagaEvents(List.of(a, b));

        composite.onStart("S", "id1");
        composite.onStepStarted("S", "id1", "x");
        composite.onCompleted("S", "id1", SagaStatus.COMPENSATED);

        assertTrue(a.calls.contains("start:S:id1"));
        assertTrue(b.calls.contains("start:S:id1"));
        assertTrue(a.calls.contains("step:x"));
        assertTrue(b.calls.contains("step:x"));
        assertTrue(a.calls.contains("completed:COMPENSATED"));
        assertTrue(b.calls.contains("completed:COMPENSATED"));
    }

    @Test
    void failingSinkDoesNotStopOthers() {
        CapturingEvents after = new CapturingEvents();
        CompositeSagaEvents composite = new CompositeSagaEvents(List.of(new ExplodingEvents(), after));

        composite.onStart("S", "id1");

        assertEquals(List.of("start:S:id1"), after.calls);
    }
}
