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

package com.firefly.sagaorchestrator.core;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Coordination style of a saga. Only {@link #ORCHESTRATION} is executed by this engine: a central coordinator
 * drives every step. {@link #CHOREOGRAPHY} definitions are rejected at submission.
 */
public enum SagaPattern {
    ORCHESTRATION,
    CHOREOGRAPHY;

    /** Accepts either case, e.g. {@code "orchestration"}. */
    @JsonCreator
    public static SagaPattern fromValue(String value) {
        return value == null ? null : SagaPattern.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
