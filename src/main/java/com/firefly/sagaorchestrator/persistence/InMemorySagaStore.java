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

import com.firefly.sagaorchestrator.core.SagaSnapshot;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. State is lost on restart; used when persistence is disabled and in tests.
 */
public class InMemorySagaStore implements SagaStore {
    private final Map<String, SagaSnapshot> sagas = new ConcurrentHashMap<>();

    @Override
    public Mono<SagaSnapshot> save(SagaSnapshot snapshot) {
        return Mono.fromCallable(() -> sagas.compute(snapshot.sagaId(), (id, current) -> {
            long stored = current != null ? current.version() : 0L;
            if (stored != snapshot.version()) {
                throw new StaleSagaVersionException(id, snapshot.version());
            }
            return snapshot.withVersion(stored + 1);
        }));
    }

    @Override
    public Mono<SagaSnapshot> findById(String sagaId) {
        return Mono.justOrEmpty(sagas.get(sagaId));
    }

    @Override
    public Flux<SagaSnapshot> findActive() {
        return Flux.fromStream(() -> sagas.values().stream()
                .filter(s -> s.status().isActive())
                .sorted(Comparator.comparing(SagaSnapshot::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))));
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }

    public int size() {
        return sagas.size();
    }
}
