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

/**
 * Lifecycle states of a saga step within a single execution.
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    COMPENSATING,
    COMPENSATED,
    COMPENSATION_FAILED;

    /** Steps in these states had their forward action applied and are eligible for rollback. */
    public boolean isCompensable() {
        return this == SUCCEEDED || this == COMPENSATING;
    }

    /** The forward action succeeded at some point, so the step carries a result. */
    public boolean hasForwardResult() {
        return this == SUCCEEDED || this == COMPENSATING || this == COMPENSATED || this == COMPENSATION_FAILED;
    }
}
