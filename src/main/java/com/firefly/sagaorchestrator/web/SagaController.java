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

package com.firefly.sagaorchestrator.web;

import com.firefly.sagaorchestrator.core.SagaDefinition;
import com.firefly.sagaorchestrator.core.SagaNotFoundException;
import com.firefly.sagaorchestrator.core.SagaSnapshot;
import com.firefly.sagaorchestrator.core.SagaStatus;
import com.firefly.sagaorchestrator.engine.SagaCoordinator;
import com.firefly.sagaorchestrator.persistence.SagaStoreException;
import com.firefly.sagaorchestrator.registry.DuplicateSagaException;
import com.firefly.sagaorchestrator.registry.InvalidSagaDefinitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST surface of the orchestrator: submit, query and list sagas, and report store health.
 * Submission answers 202 as soon as the saga is stored; execution continues in the background.
 */
@RestController
@RequestMapping("/sagas")
public class SagaController {
    private static final Logger log = LoggerFactory.getLogger(SagaController.class);

    private final SagaCoordinator coordinator;

    public SagaController(SagaCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping
    public Mono<ResponseEntity<Map<String, Object>>> submit(@RequestBody SagaDefinition definition) {
        return coordinator.submit(definition)
                .map(sagaId -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("saga_id", sagaId);
                    body.put("status", SagaStatus.PENDING);
                    return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
                });
    }

    @GetMapping("/{sagaId}")
    public Mono<SagaSnapshot> get(@PathVariable("sagaId") String sagaId) {
        return coordinator.getStatus(sagaId);
    }

    /** Only active sagas can be listed; the store keeps no index of finished ones. */
    @GetMapping
    public Flux<SagaSnapshot> list(@RequestParam(name = "active", defaultValue = "true") boolean active) {
        if (!active) {
            return Flux.error(new ServerWebInputException("Only active=true is supported"));
        }
        return coordinator.listActive();
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return coordinator.isStoreHealthy()
                .map(healthy -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("status", healthy ? "healthy" : "unhealthy");
                    body.put("store", healthy ? "up" : "down");
                    body.put("timestamp", Instant.now().toString());
                    return healthy
                            ? ResponseEntity.ok(body)
                            : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
                });
    }

    @ExceptionHandler(InvalidSagaDefinitionException.class)
    public ResponseEntity<Map<String, Object>> onInvalid(InvalidSagaDefinitionException e) {
        Map<String, Object> body = error("invalid_definition", e.getMessage());
        body.put("problems", e.getProblems());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> onBadInput(ServerWebInputException e) {
        return ResponseEntity.badRequest().body(error("bad_request", e.getReason()));
    }

    @ExceptionHandler(SagaNotFoundException.class)
    public ResponseEntity<Map<String, Object>> onNotFound(SagaNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("not_found", e.getMessage()));
    }

    @ExceptionHandler(DuplicateSagaException.class)
    public ResponseEntity<Map<String, Object>> onDuplicate(DuplicateSagaException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error("duplicate_saga", e.getMessage()));
    }

    @ExceptionHandler(SagaStoreException.class)
    public ResponseEntity<Map<String, Object>> onStore(SagaStoreException e) {
        log.error("Saga store unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error("store_unavailable", e.getMessage()));
    }

    private static Map<String, Object> error(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return body;
    }
}
