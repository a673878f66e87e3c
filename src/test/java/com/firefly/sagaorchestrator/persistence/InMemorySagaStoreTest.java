package com.firefly.sagaorchestrator.persistence;

import com.firefly.sagaorchestrator.core.SagaDefinition;
import com.firefly.sagaorchestrator.core.SagaInstance;
import com.firefly.sagaorchestrator.core.SagaSnapshot;
import com.firefly.sagaorchestrator.core.SagaStatus;
import com.firefly.sagaorchestrator.registry.SagaDefinitionBuilder;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySagaStoreTest {

    private final InMemorySagaStore store = new InMemorySagaStore();
    private final Instant t0 = Instant.parse("2025-01-01T00:00:00Z");
    private final SagaDefinition def = SagaDefinitionBuilder.saga("s")
            .step("a").service("http://a").action("/a").add()
            .build();

    private SagaSnapshot pending(String id, Instant at) {
        return SagaInstance.create(id, def, at).toSnapshot();
    }

    @Test
    void saveBumpsVersionAndRejectsStaleWrites() {
        SagaSnapshot first = store.save(pending("s1", t0)).block();
        assertEquals(1, first.version());

        SagaSnapshot second = store.save(first).block();
        assertEquals(2, second.version());

        StepVerifier.create(store.save(first))
                .expectErrorSatisfies(e -> {
                    StaleSagaVersionException stale = assertInstanceOf(StaleSagaVersionException.class, e);
                    assertEquals("s1", stale.getSagaId());
                    assertEquals(1, stale.getExpectedVersion());
                })
                .verify();
        StepVerifier.create(store.save(pending("s1", t0)))
                .expectError(StaleSagaVersionException.class)
                .verify();
    }

    @Test
    void findActiveSkipsTerminalAndSortsByCreation() {
        store.save(pending("late", t0.plusSeconds(10))).block();
        store.save(pending("early", t0)).block();
        SagaInstance done = SagaInstance.create("done", def, t0);
        done.transitionTo(SagaStatus.RUNNING, t0);
        done.transitionTo(SagaStatus.COMPLETED, t0);
        store.save(done.toSnapshot()).block();

        StepVerifier.create(store.findActive().map(SagaSnapshot::sagaId))
                .expectNext("early", "late")
                .verifyComplete();
        assertEquals(3, store.size());
    }

    @Test
    void missingSagaIsEmpty() {
        StepVerifier.create(store.findById("nope")).verifyComplete();
        StepVerifier.create(store.isHealthy()).expectNext(true).verifyComplete();
    }
}
