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

import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Lease on Redis: the key is set with a PX ttl when absent or already owned by the caller; renew and release only
 * act when the caller still owns the key.
 */
public class RedisSagaLease implements SagaLease {
    static final RedisScript<Long> ACQUIRE_SCRIPT = RedisScript.of(
            "local v = redis.call('GET', KEYS[1]) "
                    + "if v == false or v == ARGV[1] then redis.call('SET', KEYS[1], ARGV[1], 'PX', ARGV[2]) return 1 end "
                    + "return 0",
            Long.class);
    static final RedisScript<Long> RENEW_SCRIPT = RedisScript.of(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then return redis.call('PEXPIRE', KEYS[1], ARGV[2]) else return 0 end",
            Long.class);
    static final RedisScript<Long> RELEASE_SCRIPT = RedisScript.of(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then return redis.call('DEL', KEYS[1]) else return 0 end",
            Long.class);

    private final ReactiveRedisTemplate<String, byte[]> redisTemplate;
    private final String keyPrefix;

    public RedisSagaLease(ReactiveRedisTemplate<String, byte[]> redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix != null ? keyPrefix : "";
    }

    @Override
    public Mono<Boolean> tryAcquire(String sagaId, String owner, Duration duration) {
        return redisTemplate.execute(ACQUIRE_SCRIPT, List.of(key(sagaId)),
                        List.of(bytes(owner), bytes(Long.toString(duration.toMillis()))))
                .next()
                .map(r -> r != null && r > 0)
                .defaultIfEmpty(false)
                .onErrorMap(e -> new SagaStoreException("Failed to acquire lease for saga " + sagaId, e));
    }

    @Override
    public Mono<Boolean> renew(String sagaId, String owner, Duration duration) {
        return redisTemplate.execute(RENEW_SCRIPT, List.of(key(sagaId)),
                        List.of(bytes(owner), bytes(Long.toString(duration.toMillis()))))
                .next()
                .map(r -> r != null && r > 0)
                .defaultIfEmpty(false)
                .onErrorMap(e -> new SagaStoreException("Failed to renew lease for saga " + sagaId, e));
    }

    @Override
    public Mono<Void> release(String sagaId, String owner) {
        return redisTemplate.execute(RELEASE_SCRIPT, List.of(key(sagaId)), List.of(bytes(owner)))
                .then()
                .onErrorMap(e -> new SagaStoreException("Failed to release lease for saga " + sagaId, e));
    }

    String key(String sagaId) {
        return keyPrefix + "lease:" + sagaId;
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
