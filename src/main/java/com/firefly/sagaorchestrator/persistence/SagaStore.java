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

/**
 * Durable record of saga instances, one per saga id.
 * <p>
 * Writes are compare-and-set on {@link SagaSnapshot#version()}: the snapshot's version must equal the stored
 * version (0 for a record that does not exist yet), and the stored copy gets the next version.
 */
public interface SagaStore {

    /**
     * Atomically writes {@code snapshot} if the stored version still matches.
     *
     * @return the stored snapshot carrying its new version
     * @throws StaleSagaVersionException (as error signal) when another writer got there first
     * @throws SagaStoreException (as error signal) when the backend fails
     */
    Mono<SagaSnapshot> save(SagaSnapshot snapshot);

    Mono<SagaSnapshot> findById(String sagaId);

    /** Sagas in PENDING, RUNNING or COMPENSATING. */
    Flux<SagaSnapshot> findActive();

    Mono<Boolean> isHealthy();
}
