/*
 * Copyright 2025 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.firefly.sagaorchestrator.persistence;

import com.firefly.sagaorchestrator.engine.SagaCoordinator;
import com.firefly.sagaorchestrator.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Resumes sagas left non-terminal by a previous process: once at startup and, when an interval is set,
 * periodically so sagas whose lease expired are picked up again.
 */
public class SagaRecoveryService implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(SagaRecoveryService.class);

    private final SagaCoordinator coordinator;
    private final Duration interval;
    private volatile Disposable task;

    public SagaRecoveryService(SagaCoordinator coordinator, Duration interval) {
        this.coordinator = coordinator;
        this.interval = interval;
    }

    /** Runs one recovery pass. */
    public Mono<Long> recover() {
        return coordinator.resumeActive()
                .doOnNext(count -> log.info(JsonUtils.json(
                        "saga_event", "recovery_pass",
                        "queued", Long.toString(count)
                )))
                .onErrorResume(e -> {
                    log.error(JsonUtils.json(
                            "saga_event", "recovery_failed",
                            "error_class", e.getClass().getName(),
                            "error_msg", String.valueOf(e.getMessage())
                    ));
                    return Mono.just(0L);
                });
    }

    @Override
    public void start() {
        if (interval != null && !interval.isZero() && !interval.isNegative()) {
            task = Flux.interval(Duration.ZERO, interval)
                    .concatMap(tick -> recover())
                    .subscribe();
        } else {
            task = recover().subscribe();
        }
    }

    @Override
    public void stop() {
        Disposable t = task;
        if (t != null) t.dispose();
        task = null;
    }

    @Override
    public boolean isRunning() {
        return task != null;
    }
}
