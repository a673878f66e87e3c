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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lease table for a single process.
 */
public class InMemorySagaLease implements SagaLease {
    private final Map<String, Holder> leases = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySagaLease(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<Boolean> tryAcquire(String sagaId, String owner, Duration duration) {
        return Mono.fromSupplier(() -> {
            Instant now = clock.instant();
            Holder mine = new Holder(owner, now.plus(duration));
            Holder result = leases.compute(sagaId, (id, current) ->
                    current == null || current.owner.equals(owner) || current.expiresAt.isBefore(now) ? mine : current);
            return result == mine;
        });
    }

    @Override
    public Mono<Boolean> renew(String sagaId, String owner, Duration duration) {
        return Mono.fromSupplier(() -> {
            Instant now = clock.instant();
            Holder result = leases.computeIfPresent(sagaId, (id, current) ->
                    current.owner.equals(owner) && !current.expiresAt.isBefore(now)
                            ? new Holder(owner, now.plus(duration))
                            : current);
            return result != null && result.owner.equals(owner) && !result.expiresAt.isBefore(now);
        });
    }

    @Override
    public Mono<Void> release(String sagaId, String owner) {
        return Mono.fromRunnable(() -> leases.computeIfPresent(sagaId, (id, current) ->
                current.owner.equals(owner) ? null : current));
    }

    public boolean isHeld(String sagaId) {
        Holder h = leases.get(sagaId);
        return h != null && !h.expiresAt.isBefore(clock.instant());
    }

    private static final class Holder {
        final String owner;
        final Instant expiresAt;

        Holder(String owner, Instant expiresAt) {
            this.owner = owner;
            this.expiresAt = expiresAt;
        }
    }
}
