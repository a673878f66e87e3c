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

package com.firefly.sagaorchestrator.engine;

import com.firefly.sagaorchestrator.core.StepError;
import com.firefly.sagaorchestrator.core.StepErrorType;
import com.firefly.sagaorchestrator.resolver.TemplateResolutionException;

import java.util.concurrent.TimeoutException;

/**
 * Maps call failures onto {@link StepError} values.
 */
final class StepErrors {
    private StepErrors() {}

    static StepError classify(Throwable error, boolean sagaDeadlineBound) {
        if (error instanceof TimeoutException) {
            return sagaDeadlineBound
                    ? StepError.of(StepErrorType.SAGA_TIMEOUT, "Saga deadline reached while the call was in flight")
                    : StepError.of(StepErrorType.TIMEOUT, "Step timed out");
        }
        if (error instanceof ActionFailedException afe) {
            return StepError.application(afe.getHttpStatus(), afe.getCode(), afe.getMessage());
        }
        if (error instanceof TemplateResolutionException) {
            return StepError.of(StepErrorType.TEMPLATE, error.getMessage());
        }
        String msg = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return StepError.of(StepErrorType.TRANSPORT, msg);
    }
}
