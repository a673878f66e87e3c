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

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Structured description of a failed step or compensation call.
 *
 * @param type            failure class
 * @param message         human readable message
 * @param code            machine readable code reported by the remote service, if any
 * @param httpStatus      HTTP status for application failures, otherwise null
 * @param possiblyApplied whether the remote side effect may have happened anyway
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StepError(
        StepErrorType type,
        String message,
        String code,
        Integer httpStatus,
        boolean possiblyApplied
) {

    public static StepError of(StepErrorType type, String message) {
        return new StepError(type, message, null, null, type.possiblyApplied());
    }

    public static StepError application(int httpStatus, String code, String message) {
        return new StepError(StepErrorType.APPLICATION, message, code, httpStatus, false);
    }
}
