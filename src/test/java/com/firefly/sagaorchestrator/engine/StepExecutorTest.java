package com.firefly.sagaorchestrator.engine;

import com.firefly.sagaorchestrator.core.StepDefinition;
import com.firefly.sagaorchestrator.core.StepErrorType;
import com.firefly.sagaorchestrator.core.StepStatus;
import com.firefly.sagaorchestrator.observability.SagaEvents;
import com.firefly.sagaorchestrator.core.StepError;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StepExecutorTest {

    private final RetryEvents events = new RetryEvents();
    private final RetryPolicy twoRetries = RetryPolicy.exponential(2, Duration.ofMillis(1), Duration.ofMillis(5));

    private static StepDefinition step(boolean idempotent) {
        return new StepDefinition("charge", "http://payments", "/charge", Map.of(), null, null,
                null, null, idempotent);
    }

    private StepExecutor executor(ActionInvoker invoker) {
        return new StepExecutor(invoker, events, Clock.systemUTC());
    }

    private static Instant farDeadline() {
        return Instant.now().plusSeconds(60);
    }

    @Test
    void successRecordsResultAndSingleAttempt() {
        ScriptedActionInvoker invoker = new ScriptedActionInvoker().returning("charge", Map.of("charge_id", "c1"));

        StepVerifier.create(executor(invoker).execute("pay", "s1", step(false), Map.of("amount", 10),
                        Duration.ofSeconds(1), farDeadline(), twoRetries))
                .assertNext(outcome -> {
                    assertEquals(StepStatus.SUCCEEDED, outcome.status());
                    assertEquals(Map.of("charge_id", "c1"), outcome.result());
                    assertEquals(1, outcome.attemptCount());
                    assertNull(outcome.error());
                })
                .verifyComplete();
        assertEquals(Map.of("amount", 10), invoker.calls.get(0).payload());
    }

    @Test
    void emptyResponseBecomesSuccessMarker() {
        ScriptedActionInvoker invoker = new ScriptedActionInvoker().on("charge", c -> Mono.empty());

        StepVerifier.create(executor(invoker).execute("pay", "s1", step(false), Map.of(),
                        Duration.ofSeconds(1), farDeadline(), twoRetries))
                .assertNext(outcome -> assertEquals(ActionInvoker.EMPTY_RESULT, outcome.result()))
                .verifyComplete();
    }

    @Test
    void transportFailuresAreRetriedUntilSuccess() {
        ScriptedActionInvoker invoker = new ScriptedActionInvoker();
        invoker.on("charge", c -> invoker.count("charge") < 3
                ? Mono.error(new ConnectException("Connection refused"))
                : Mono.just(Map.of("ok", true)));

        StepVerifier.create(executor(invoker).execute("pay", "s1", step(false), Map.of(),
                        Duration.ofSeconds(1), farDeadline(), twoRetries))
                .assertNext(outcome -> {
                    assertEquals(StepStatus.SUCCEEDED, outcome.status());
                    assertEquals(3, outcome.attemptCount());
                })
                .verifyComplete();
        assertEquals(List.of(1, 2), events.retries);
    }

    @Test
    void exhaustedTransportFailureIsPossiblyApplied() {
        ScriptedActionInvoker invoker = new ScriptedActionInvoker()
                .on("charge", c -> Mono.error(new ConnectException("Connection refused")));

        StepVerifier.create(executor(invoker).execute("pay", "s1", step(false), Map.of(),
                        Duration.ofSeconds(1), farDeadline(), twoRetries))
                .assertNext(outcome -> {
                    assertEquals(StepStatus.FAILED, outcome.status());
                    assertEquals(StepErrorType.TRANSPORT, outcome.error().type());
                    assertTrue(outcome.error().possiblyApplied());
                    assertEquals(3, outcome.attemptCount());
                })
                .verifyComplete();
    }

    @Test
    void applicationFailureIsNotRetriedUnlessIdempotent() {
        ScriptedActionInvoker invoker = new ScriptedActionInvoker()
                .on("charge", c -> ScriptedActionInvoker.applicationError(422, "CARD_DECLINED", "declined"));

        StepVerifier.create(executor(invoker).execute("pay", "s1", step(false), Map.of(),
                        Duration.ofSeconds(1), farDeadline(), twoRetries))
                .assertNext(outcome -> {
                    assertEquals(StepErrorType.APPLICATION, outcome.error().type());
                    assertEquals(422, outcome.error().httpStatus());
                    assertEquals("CARD_DECLINED", outcome.error().code());
                    assertFalse(outcome.error().possiblyApplied());
                    assertEquals(1, outcome.attemptCount());
                })
                .verifyComplete();
        assertEquals(1, invoker.count("charge"));

        ScriptedActionInvoker idempotent = new ScriptedActionInvoker()
                .on("charge", c -> ScriptedActionInvoker.applicationError(503, null, "busy"));
        StepVerifier.create(executor(idempotent).execute("pay", "s1", step(true), Map.of(),
                        Duration.ofSeconds(1), farDeadline(), twoRetries))
                .assertNext(outcome -> assertEquals(3, outcome.attemptCount()))
                .verifyComplete();
        assertEquals(3, idempotent.count("charge"));
    }

    @Test
    void perStepTimeoutFailsWithTimeoutError() {
        ScriptedActionInvoker invoker = new ScriptedActionInvoker().on("charge", c -> Mono.never());

        StepVerifier.create(executor(invoker).execute("pay", "s1", step(false), Map.of(),
                        Duration.ofMillis(50), farDeadline(), RetryPolicy.none()))
                .assertNext(outcome -> {
                    assertEquals(StepStatus.FAILED, outcome.status());
                    assertEquals(StepErrorType.TIMEOUT, outcome.error().type());
                    assertTrue(outcome.error().possiblyApplied());
                })
                .verifyComplete();
    }

    @Test
    void sagaDeadlineBoundsTheAttempt() {
        ScriptedActionInvoker invoker = new ScriptedActionInvoker().on("charge", c -> Mono.never());

        StepVerifier.create(executor(invoker).execute("pay", "s1", step(false), Map.of(),
                        Duration.ofSeconds(30), Instant.now().plusMillis(80), twoRetries))
                .assertNext(outcome -> {
                    assertEquals(StepErrorType.SAGA_TIMEOUT, outcome.error().type());
                    assertTrue(outcome.error().possiblyApplied());
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
        assertEquals(1, invoker.count("charge"));
    }

    @Test
    void expiredSagaDeadlineSkipsTheCall() {
        ScriptedActionInvoker invoker = new ScriptedActionInvoker();

        StepVerifier.create(executor(invoker).execute("pay", "s1", step(false), Map.of(),
                        Duration.ofSeconds(1), Instant.now().minusSeconds(1), twoRetries))
                .assertNext(outcome -> {
                    assertEquals(StepErrorType.SAGA_TIMEOUT, outcome.error().type());
                    assertEquals(0, outcome.attemptCount());
                    assertFalse(outcome.error().possiblyApplied());
                })
                .verifyComplete();
        assertTrue(invoker.calls.isEmpty());
    }

    static class RetryEvents implements SagaEvents {
        final List<Integer> retries = new ArrayList<>();

        @Override
        public void onStepRetry(String sagaName, String sagaId, String stepId, int attempt, StepError error) {
            retries.add(attempt);
        }
    }
}
