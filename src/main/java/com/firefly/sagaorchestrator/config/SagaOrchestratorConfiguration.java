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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.firefly.sagaorchestrator.engine.ActionInvoker;
import com.firefly.sagaorchestrator.engine.CompensationRunner;
import com.firefly.sagaorchestrator.engine.RetryPolicy;
import com.firefly.sagaorchestrator.engine.SagaCoordinator;
import com.firefly.sagaorchestrator.engine.StepExecutor;
import com.firefly.sagaorchestrator.http.WebClientActionInvoker;
import com.firefly.sagaorchestrator.observability.CompositeSagaEvents;
import com.firefly.sagaorchestrator.observability.SagaEvents;
import com.firefly.sagaorchestrator.observability.SagaLoggerEvents;
import com.firefly.sagaorchestrator.observability.SagaMicrometerEvents;
import com.firefly.sagaorchestrator.observability.SagaTracingEvents;
import com.firefly.sagaorchestrator.persistence.InMemorySagaLease;
import com.firefly.sagaorchestrator.persistence.InMemorySagaStore;
import com.firefly.sagaorchestrator.persistence.JsonSagaStateSerializer;
import com.firefly.sagaorchestrator.persistence.SagaLease;
import com.firefly.sagaorchestrator.persistence.SagaRecoveryService;
import com.firefly.sagaorchestrator.persistence.SagaStateSerializer;
import com.firefly.sagaorchestrator.persistence.SagaStore;
import com.firefly.sagaorchestrator.registry.SagaDefinitionValidator;
import com.firefly.sagaorchestrator.resolver.VariableResolver;
import com.firefly.sagaorchestrator.web.SagaController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Schedulers;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Spring configuration that wires the saga orchestrator.
 * Users typically activate it via {@link com.firefly.sagaorchestrator.annotations.EnableSagaOrchestrator}.
 * The in-memory store and lease are used unless {@code firefly.saga.orchestrator.persistence.enabled=true},
 * in which case {@link SagaRedisAutoConfiguration} provides the Redis ones.
 */
@Configuration
@EnableConfigurationProperties(SagaOrchestratorProperties.class)
public class SagaOrchestratorConfiguration {
    private static final Logger log = LoggerFactory.getLogger(SagaOrchestratorConfiguration.class);
    static final String PERSISTENCE_ENABLED = "firefly.saga.orchestrator.persistence.enabled";
    static final String DEFAULT_OWNER = "saga-orchestrator";

    @Bean
    @ConditionalOnMissingBean
    public Clock sagaClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(name = "sagaObjectMapper")
    public ObjectMapper sagaObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaStateSerializer sagaStateSerializer(@Qualifier("sagaObjectMapper") ObjectMapper sagaObjectMapper) {
        return new JsonSagaStateSerializer(sagaObjectMapper);
    }

    @Bean
    public SagaLoggerEvents sagaLoggerEvents() {
        return new SagaLoggerEvents();
    }

    @Bean
    @Primary
    public SagaEvents sagaEventsComposite(SagaLoggerEvents logger,
                                          ObjectProvider<SagaMicrometerEvents> micrometer,
                                          ObjectProvider<SagaTracingEvents> tracing) {
        List<SagaEvents> sinks = new ArrayList<>();
        sinks.add(logger);
        SagaMicrometerEvents m = micrometer.getIfAvailable();
        if (m != null) sinks.add(m);
        SagaTracingEvents t = tracing.getIfAvailable();
        if (t != null) sinks.add(t);
        return new CompositeSagaEvents(sinks);
    }

    @Configuration
    @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
    @ConditionalOnBean(type = "io.micrometer.core.instrument.MeterRegistry")
    static class MicrometerAutoConfig {
        @Bean
        public SagaMicrometerEvents sagaMicrometerEvents(io.micrometer.core.instrument.MeterRegistry registry) {
            return new SagaMicrometerEvents(registry);
        }
    }

    @Configuration
    @ConditionalOnClass(name = "io.micrometer.tracing.Tracer")
    @ConditionalOnBean(type = "io.micrometer.tracing.Tracer")
    static class TracingAutoConfig {
        @Bean
        public SagaTracingEvents sagaTracingEvents(io.micrometer.tracing.Tracer tracer) {
            return new SagaTracingEvents(tracer);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public WebClient.Builder webClientBuilder() {
        return WebClient.builder();
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionInvoker sagaActionInvoker(WebClient.Builder builder,
                                           @Qualifier("sagaObjectMapper") ObjectMapper sagaObjectMapper) {
        return new WebClientActionInvoker(builder.build(), sagaObjectMapper);
    }

    @Bean
    public VariableResolver sagaVariableResolver() {
        return new VariableResolver();
    }

    @Bean
    public SagaDefinitionValidator sagaDefinitionValidator() {
        return new SagaDefinitionValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = PERSISTENCE_ENABLED, havingValue = "false", matchIfMissing = true)
    public SagaStore inMemorySagaStore() {
        log.info("Configuring in-memory saga store (state is not kept across restarts)");
        return new InMemorySagaStore();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = PERSISTENCE_ENABLED, havingValue = "false", matchIfMissing = true)
    public SagaLease inMemorySagaLease(Clock sagaClock) {
        return new InMemorySagaLease(sagaClock);
    }

    @Bean
    public StepExecutor sagaStepExecutor(ActionInvoker invoker, SagaEvents events, Clock sagaClock) {
        return new StepExecutor(invoker, events, sagaClock);
    }

    @Bean
    public CompensationRunner sagaCompensationRunner(ActionInvoker invoker,
                                                     VariableResolver resolver,
                                                     SagaEvents events,
                                                     SagaOrchestratorProperties properties,
                                                     Clock sagaClock) {
        SagaOrchestratorProperties.CompensationProperties c = properties.getCompensation();
        return new CompensationRunner(invoker, resolver, events,
                RetryPolicy.linear(c.getMaxRetries(), c.getBackoff()), c.getTimeout(), sagaClock);
    }

    @Bean
    public SagaCoordinator sagaCoordinator(SagaStore store,
                                           SagaLease lease,
                                           StepExecutor executor,
                                           CompensationRunner compensationRunner,
                                           VariableResolver resolver,
                                           SagaDefinitionValidator validator,
                                           SagaEvents events,
                                           Clock sagaClock,
                                           SagaOrchestratorProperties properties) {
        SagaOrchestratorProperties.RetryProperties r = properties.getRetry();
        RetryPolicy stepPolicy = new RetryPolicy(r.getMaxRetries(), r.getBackoff(), r.getMaxBackoff(),
                RetryPolicy.Backoff.EXPONENTIAL, r.isRetryApplicationFailures());
        SagaCoordinator.Options options = new SagaCoordinator.Options(
                properties.getDefaultStepTimeout(),
                properties.getDefaultSagaTimeout(),
                properties.getMaxConcurrentSagas(),
                properties.getLease().getDuration(),
                stepPolicy,
                leaseOwner(properties.getLease()));
        log.info("Saga coordinator ready: max_concurrent_sagas={}, store={}, lease_owner={}",
                options.maxConcurrentSagas(), store.getClass().getSimpleName(), options.owner());
        return new SagaCoordinator(store, lease, executor, compensationRunner, resolver, validator, events,
                sagaClock, options, Schedulers.boundedElastic());
    }

    static String leaseOwner(SagaOrchestratorProperties.LeaseProperties lease) {
        if (lease.getOwner() != null && !lease.getOwner().isBlank()) {
            return lease.getOwner();
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Cannot resolve host name for the saga lease owner, using '{}': {}", DEFAULT_OWNER, e.toString());
            return DEFAULT_OWNER;
        }
    }

    @Bean
    @ConditionalOnProperty(name = "firefly.saga.orchestrator.recovery.enabled", havingValue = "true", matchIfMissing = true)
    public SagaRecoveryService sagaRecoveryService(SagaCoordinator coordinator, SagaOrchestratorProperties properties) {
        return new SagaRecoveryService(coordinator, properties.getRecovery().getInterval());
    }

    @Bean
    @ConditionalOnProperty(name = "firefly.saga.orchestrator.web.enabled", havingValue = "true", matchIfMissing = true)
    public SagaController sagaController(SagaCoordinator coordinator) {
        return new SagaController(coordinator);
    }
}
