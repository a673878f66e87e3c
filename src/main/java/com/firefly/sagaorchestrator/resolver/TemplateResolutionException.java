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

package com.firefly.sagaorchestrator.resolver;

/**
 * A {@code ${...}} reference could not be materialized. Fatal for the step: nothing was sent and
 * nothing will be retried.
 */
public class TemplateResolutionException extends RuntimeException {
    private final String expression;

    public TemplateResolutionException(String expression, String message) {
        super(message + " in '${" + expression + "}'");
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
