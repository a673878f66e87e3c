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

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;

/**
 * Configuration properties for the saga orchestrator.
 *
 * Example configuration:
 * <pre>
 * firefly.saga.orchestrator.default-step-timeout=300s
 * firefly.saga.orchestrator.default-saga-timeout=1h
 * firefly.saga.orchestrator.max-concurrent-sagas=100
 * firefly.saga.orchestrator.retry.max-retries=3
 * firefly.saga.orchestrator.compensation.max-retries=3
 * firefly.saga.orchestrator.persistence.enabled=true
 * firefly.saga.orchestrator.persistence.redis.host=localhost
 * firefly.saga.orchestrator.lease.owner=orchestrator-0
 * firefly.saga.orchestrator.recovery.interval=1m
 * </pre>
 */
@ConfigurationProperties(prefix = "firefly.saga.orchestrator")
public class SagaOrchestratorProperties {

    /**
     * Per-attempt deadline for steps that do not set one.
     */
    private Duration defaultStepTimeout = Duration.ofSeconds(300);

    /**
     * Whole-saga deadline for definitions that do not set one.
     */
    private Duration defaultSagaTimeout = Duration.ofSeconds(3600);

    /**
     * Sagas driven at the same time; further submissions wait in order.
     */
    private int maxConcurrentSagas = 100;

    @NestedConfigurationProperty
    private RetryProperties retry = new RetryProperties();

    @NestedConfigurationProperty
    private CompensationProperties compensation = new CompensationProperties();

    @NestedConfigurationProperty
    private PersistenceProperties persistence = new PersistenceProperties();

    @NestedConfigurationProperty
    private LeaseProperties lease = new LeaseProperties();

    @NestedConfigurationProperty
    private RecoveryProperties recovery = new RecoveryProperties();

    @NestedConfigurationProperty
    private WebProperties web = new WebProperties();

    public Duration getDefaultStepTimeout() {
        return defaultStepTimeout;
    }

    public void setDefaultStepTimeout(Duration defaultStepTimeout) {
        this.defaultStepTimeout = defaultStepTimeout;
    }

    public Duration getDefaultSagaTimeout() {
        return defaultSagaTimeout;
    }

    public void setDefaultSagaTimeout(Duration defaultSagaTimeout) {
        this.defaultSagaTimeout = defaultSagaTimeout;
    }

    public int getMaxConcurrentSagas() {
        return maxConcurrentSagas;
    }

    public void setMaxConcurrentSagas(int maxConcurrentSagas) {
        this.maxConcurrentSagas = maxConcurrentSagas;
    }

    public RetryProperties getRetry() {
        return retry;
    }

    public void setRetry(RetryProperties retry) {
        this.retry = retry;
    }

    public CompensationProperties getCompensation() {
        return compensation;
    }

    public void setCompensation(CompensationProperties compensation) {
        this.compensation = compensation;
    }

    public PersistenceProperties getPersistence() {
        return persistence;
    }

    public void setPersistence(PersistenceProperties persistence) {
        this.persistence = persistence;
    }

    public LeaseProperties getLease() {
        return lease;
    }

    public void setLease(LeaseProperties lease) {
        this.lease = lease;
    }

    public RecoveryProperties getRecovery() {
        return recovery;
    }

    public void setRecovery(RecoveryProperties recovery) {
        this.recovery = recovery;
    }

    public WebProperties getWeb() {
        return web;
    }

    public void setWeb(WebProperties web) {
        this.web = web;
    }

    /**
     * Forward retry budget and exponential backoff.
     */
    public static class RetryProperties {
        /**
         * Retries after the first attempt, unless a step sets retry_attempts.
         */
        private int maxRetries = 3;

        /**
         * First backoff delay; doubles on every retry.
         */
        private Duration backoff = Duration.ofSeconds(1);

        private Duration maxBackoff = Duration.ofSeconds(30);

        /**
         * Retry explicit non-2xx answers of steps that are not marked idempotent.
         */
        private boolean retryApplicationFailures = false;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getBackoff() {
            return backoff;
        }

        public void setBackoff(Duration backoff) {
            this.backoff = backoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public boolean isRetryApplicationFailures() {
            return retryApplicationFailures;
        }

        public void setRetryApplicationFailures(boolean retryApplicationFailures) {
            this.retryApplicationFailures = retryApplicationFailures;
        }
    }

    /**
     * Compensation retries use linear backoff.
     */
    public static class CompensationProperties {
        private int maxRetries = 3;
        private Duration backoff = Duration.ofMillis(500);
        /**
         * Per-attempt deadline of a compensation call.
         */
        private Duration timeout = Duration.ofSeconds(600);

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getBackoff() {
            return backoff;
        }

        public void setBackoff(Duration backoff) {
            this.backoff = backoff;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    /**
     * Store selection. Disabled means in-memory state that does not survive a restart.
     */
    public static class PersistenceProperties {
        private boolean enabled = false;

        @NestedConfigurationProperty
        private RedisProperties redis = new RedisProperties();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public RedisProperties getRedis() {
            return redis;
        }

        public void setRedis(RedisProperties redis) {
            this.redis = redis;
        }
    }

    public static class RedisProperties {
        private String host = "localhost";
        private int port = 6379;
        private int database = 0;
        private String password;
        private String keyPrefix = "saga-orchestrator:";

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public int getDatabase() {
            return database;
        }

        public void setDatabase(int database) {
            this.database = database;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    public static class LeaseProperties {
        /**
         * Renewed every third of this while a saga is driven; after a crash other instances wait at most this long.
         */
        private Duration duration = Duration.ofSeconds(60);

        /**
         * Identity this process holds leases under. Must be the same after a restart so the process reclaims the
         * sagas it was driving. Defaults to the host name.
         */
        private String owner;

        public String getOwner() {
            return owner;
        }

        public void setOwner(String owner) {
            this.owner = owner;
        }

        public Duration getDuration() {
            return duration;
        }

        public void setDuration(Duration duration) {
            this.duration = duration;
        }
    }

    public static class RecoveryProperties {
        private boolean enabled = true;

        /**
         * Zero runs recovery once at startup only. Periodic passes pick up sagas whose owner died for good.
         */
        private Duration interval = Duration.ofMinutes(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    public static class WebProperties {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
