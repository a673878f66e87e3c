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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Redis-backed store. Each saga is a JSON document plus a version key; an index set tracks active sagas.
 * Version check, document write and index update run in one Lua script so a write is all-or-nothing.
 */
public class RedisSagaStore implements SagaStore {
    private static final Logger log = LoggerFactory.getLogger(RedisSagaStore.class);

    static final RedisScript<Long> SAVE_SCRIPT = RedisScript.of(
            "local current = redis.call('GET', KEYS[2])\n" +
            "if current == false then current = '0' end\n" +
            "if current ~= ARGV[1] then return -1 end\n" +
            "redis.call('SET', KEYS[1], ARGV[2])\n" +
            "redis.call('SET', KEYS[2], ARGV[3])\n" +
            "if ARGV[4] == '1' then redis.call('SADD', KEYS[3], ARGV[5]) else redis.call('SREM', KEYS[3], ARGV[5]) end\n" +
            "return tonumber(ARGV[3])",
            Long.class);

    private final ReactiveRedisTemplate<String, byte[]> redisTemplate;
    private final SagaStateSerializer serializer;
    private final String keyPrefix;

    public RedisSagaStore(ReactiveRedisTemplate<String, byte[]> redisTemplate,
                          SagaStateSerializer serializer,
                          String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.serializer = serializer;
        this.keyPrefix = keyPrefix != null ? keyPrefix : "";
    }

    @Override
    public Mono<SagaSnapshot> save(SagaSnapshot snapshot) {
        long expected = snapshot.version();
        SagaSnapshot next = snapshot.withVersion(expected + 1);
        return Mono.fromCallable(() -> serializer.serialize(next))
                .flatMap(json -> redisTemplate.execute(SAVE_SCRIPT,
                                List.of(sagaKey(snapshot.sagaId()), versionKey(snapshot.sagaId()), activeKey()),
                                List.of(bytes(Long.toString(expected)),
                                        json,
                                        bytes(Long.toString(expected + 1)),
                                        bytes(next.status().isActive() ? "1" : "0"),
                                        bytes(snapshot.sagaId())))
                        .next())
                .flatMap(result -> result != null && result > 0
                        ? Mono.just(next)
                        : Mono.<SagaSnapshot>error(new StaleSagaVersionException(snapshot.sagaId(), expected)))
                .onErrorMap(e -> !(e instanceof SagaStoreException),
                        e -> new SagaStoreException("Failed to save saga " + snapshot.sagaId(), e));
    }

    @Override
    public Mono<SagaSnapshot> findById(String sagaId) {
        return redisTemplate.opsForValue().get(sagaKey(sagaId))
                .map(serializer::deserialize)
                .onErrorMap(e -> !(e instanceof SagaStoreException),
                        e -> new SagaStoreException("Failed to load saga " + sagaId, e));
    }

    @Override
    public Flux<SagaSnapshot> findActive() {
        return redisTemplate.opsForSet().members(activeKey())
                .map(raw -> new String(raw, StandardCharsets.UTF_8))
                .concatMap(id -> findById(id)
                        .onErrorResume(SagaStoreException.class, e -> {
                            log.error("Skipping unreadable saga record {}: {}", id, e.getMessage());
                            return Mono.empty();
                        }))
                .filter(s -> s.status().isActive())
                .onErrorMap(e -> !(e instanceof SagaStoreException),
                        e -> new SagaStoreException("Failed to list active sagas", e));
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return redisTemplate.execute(connection -> connection.ping())
                .next()
                .map("PONG"::equalsIgnoreCase)
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.warn("Redis saga store health check failed: {}", e.toString());
                    return Mono.just(false);
                });
    }

    String sagaKey(String sagaId) {
        return keyPrefix + "saga:" + sagaId;
    }

    String versionKey(String sagaId) {
        return keyPrefix + "saga:" + sagaId + ":version";
    }

    String activeKey() {
        return keyPrefix + "sagas:active";
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
