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
 * Classification of a step or compensation failure.
 */
public enum StepErrorType {
    /** Payload template could not be materialized. Never retried, no remote call was made. */
    TEMPLATE(false),
    /** Connection refused, DNS failure, reset. The remote effect is unknown. */
    TRANSPORT(true),
    /** The per-step deadline elapsed and the call was abandoned. The remote effect is unknown. */
    TIMEOUT(true),
    /** The whole-saga deadline elapsed while the step was in flight. */
    SAGA_TIMEOUT(true),
    /** The remote service answered with an explicit non-success status. */
    APPLICATION(false),
    /** Found in flight after a restart. */
    UNKNOWN_OUTCOME(true);

    private final boolean possiblyApplied;

    StepErrorType(boolean possiblyApplied) {
        this.possiblyApplied = possiblyApplied;
    }

    /** Whether the remote side effect may have been applied despite the failure. */
    public boolean possiblyApplied() {
        return possiblyApplied;
    }
}
