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

import com.firefly.sagaorchestrator.annotations.EnableSagaOrchestrator;
import com.firefly.sagaorchestrator.engine.ActionInvoker;
import com.firefly.sagaorchestrator.engine.SagaCoordinator;
import com.firefly.sagaorchestrator.observability.CompositeSagaEvents;
import com.firefly.sagaorchestrator.observability.SagaEvents;
import com.firefly.sagaorchestrator.persistence.InMemorySagaStore;
import com.firefly.sagaorchestrator.persistence.SagaRecoveryService;
import com.firefly.sagaorchestrator.persistence.SagaStore;
import com.firefly.sagaorchestrator.web.SagaController;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.MapPropertySource;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SagaOrchestratorConfigurationTest {

    @Configuration
    @EnableSagaOrchestrator
    static class AppConfig {
    }

    private static AnnotationConfigApplicationContext context(Map<String, Object> props, Class<?> config) {
        AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext();
        ctx.getEnvironment().getPropertySources().addFirst(new MapPropertySource("test", props));
        ctx.register(config);
        ctx.refresh();
        return ctx;
    }

    @Test
    void beansAreWiredWithInMemoryDefaults() {
        try (AnnotationConfigApplicationContext ctx = context(Map.of(), AppConfig.class)) {
            assertNotNull(ctx.getBean(SagaCoordinator.class));
            assertInstanceOf(CompositeSagaEvents.class, ctx.getBean(SagaEvents.class));
            assertInstanceOf(InMemorySagaStore.class, ctx.getBean(SagaStore.class));
            assertNotNull(ctx.getBean(ActionInvoker.class));
            assertNotNull(ctx.getBean(WebClient.Builder.class));
            assertNotNull(ctx.getBean(SagaController.class));
            assertTrue(ctx.getBean(SagaRecoveryService.class).isRunning());
        }
    }

    @Test
    void propertiesBindAndToggleOptionalBeans() {
        Map<String, Object> props = Map.of(
                "firefly.saga.orchestrator.default-step-timeout", "45s",
                "firefly.saga.orchestrator.retry.max-retries", "5",
                "firefly.saga.orchestrator.lease.owner", "node-7",
                "firefly.saga.orchestrator.recovery.enabled", "false",
                "firefly.saga.orchestrator.web.enabled", "false");
        try (AnnotationConfigApplicationContext ctx = context(props, AppConfig.class)) {
            SagaOrchestratorProperties properties = ctx.getBean(SagaOrchestratorProperties.class);
            assertEquals(Duration.ofSeconds(45), properties.getDefaultStepTimeout());
            assertEquals(5, properties.getRetry().getMaxRetries());
            assertEquals("node-7", SagaOrchestratorConfiguration.leaseOwner(properties.getLease()));
            assertEquals("saga-orchestrator:", properties.getPersistence().getRedis().getKeyPrefix());
            assertTrue(ctx.getBeansOfType(SagaRecoveryService.class).isEmpty());
            assertTrue(ctx.getBeansOfType(SagaController.class).isEmpty());
        }
    }
}
