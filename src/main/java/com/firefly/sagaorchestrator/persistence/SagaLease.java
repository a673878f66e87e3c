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

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Per-saga exclusive lease. Whoever holds it is the only writer of that saga. A lease that is not
 * released expires after its duration so a crashed owner does not block recovery forever.
 * Owners are stable process identities: an owner may re-acquire a lease it still holds, which lets a
 * restarted process reclaim the sagas it was driving.
 */
public interface SagaLease {

    /** @return true if {@code owner} now holds the lease, including when it already held it */
    Mono<Boolean> tryAcquire(String sagaId, String owner, Duration duration);

    /** Extends the lease if {@code owner} still holds it. */
    Mono<Boolean> renew(String sagaId, String owner, Duration duration);

    /** Releases the lease if {@code owner} holds it; otherwise does nothing. */
    Mono<Void> release(String sagaId, String owner);
}
