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

package com.firefly.sagaorchestrator.config;

import com.firefly.sagaorchestrator.persistence.RedisSagaLease;
import com.firefly.sagaorchestrator.persistence.RedisSagaStore;
import com.firefly.sagaorchestrator.persistence.SagaLease;
import com.firefly.sagaorchestrator.persistence.SagaStateSerializer;
import com.firefly.sagaorchestrator.persistence.SagaStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis-backed saga store and lease.
 * <p>
 * Loaded only when Redis classes are on the classpath and
 * {@code firefly.saga.orchestrator.persistence.enabled=true}.
 */
@AutoConfiguration
@EnableConfigurationProperties(SagaOrchestratorProperties.class)
@ConditionalOnClass({ReactiveRedisConnectionFactory.class, ReactiveRedisTemplate.class})
@ConditionalOnProperty(name = SagaOrchestratorConfiguration.PERSISTENCE_ENABLED, havingValue = "true")
public class SagaRedisAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SagaRedisAutoConfiguration.class);

    /**
     * Lettuce connection factory built from the orchestrator's redis properties.
     * Only created when the application does not provide its own.
     */
    @Bean
    @ConditionalOnMissingBean(ReactiveRedisConnectionFactory.class)
    public LettuceConnectionFactory sagaRedisConnectionFactory(SagaOrchestratorProperties properties) {
        SagaOrchestratorProperties.RedisProperties redis = properties.getPersistence().getRedis();

        log.info("Configuring Redis connection factory for saga persistence: {}:{}",
                redis.getHost(), redis.getPort());

        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(redis.getHost(), redis.getPort());
        standalone.setDatabase(redis.getDatabase());
        if (redis.getPassword() != null) {
            standalone.setPassword(RedisPassword.of(redis.getPassword()));
        }
        return new LettuceConnectionFactory(standalone);
    }

    @Bean
    @ConditionalOnMissingBean(name = "sagaReactiveRedisTemplate")
    public ReactiveRedisTemplate<String, byte[]> sagaReactiveRedisTemplate(ReactiveRedisConnectionFactory connectionFactory) {
        RedisSerializationContext<String, byte[]> context = RedisSerializationContext
                .<String, byte[]>newSerializationContext()
                .key(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
                .value(RedisSerializationContext.SerializationPair.fromSerializer(RedisSerializer.byteArray()))
                .hashKey(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
                .hashValue(RedisSerializationContext.SerializationPair.fromSerializer(RedisSerializer.byteArray()))
                .build();
        return new ReactiveRedisTemplate<>(connectionFactory, context);
    }

    @Bean
    @Primary
    public SagaStore redisSagaStore(ReactiveRedisTemplate<String, byte[]> sagaReactiveRedisTemplate,
                                    SagaStateSerializer serializer,
                                    SagaOrchestratorProperties properties) {
        String prefix = properties.getPersistence().getRedis().getKeyPrefix();
        log.info("Configuring Redis saga store with key prefix: {}", prefix);
        return new RedisSagaStore(sagaReactiveRedisTemplate, serializer, prefix);
    }

    @Bean
    @Primary
    public SagaLease redisSagaLease(ReactiveRedisTemplate<String, byte[]> sagaReactiveRedisTemplate,
                                    SagaOrchestratorProperties properties) {
        return new RedisSagaLease(sagaReactiveRedisTemplate, properties.getPersistence().getRedis().getKeyPrefix());
    }
}
