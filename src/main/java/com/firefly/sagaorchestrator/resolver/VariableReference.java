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

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed form of a {@code ${...}} expression.
 * <pre>
 *   step_result[.path]       current step context
 *   previous_step[.path]     result of the step right before the current one
 *   steps.&lt;id&gt;[.path]       result of a named earlier step
 *   metadata.&lt;key&gt;           saga metadata entry
 *   saga.id                  the saga id
 * </pre>
 */
public record VariableReference(Scope scope, String target, List<String> path, String expression) {

    public enum Scope {
        STEP_RESULT("step_result"),
        PREVIOUS_STEP("previous_step"),
        STEP("steps"),
        METADATA("metadata"),
        SAGA("saga");

        private final String prefix;

        Scope(String prefix) {
            this.prefix = prefix;
        }

        static Scope fromPrefix(String prefix) {
            for (Scope s : values()) {
                if (s.prefix.equals(prefix)) return s;
            }
            return null;
        }
    }

    public VariableReference {
        path = List.copyOf(path);
    }

    public static VariableReference parse(String expression) {
        String expr = expression == null ? "" : expression.trim();
        if (expr.isEmpty()) {
            throw new TemplateResolutionException(expression, "Empty reference");
        }
        String[] segments = expr.split("\\.", -1);
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new TemplateResolutionException(expression, "Empty path segment");
            }
        }
        Scope scope = Scope.fromPrefix(segments[0]);
        if (scope == null) {
            throw new TemplateResolutionException(expression, "Unknown scope '" + segments[0] + "'");
        }
        List<String> rest = new ArrayList<>(List.of(segments).subList(1, segments.length));
        switch (scope) {
            case STEP:
                if (rest.isEmpty()) {
                    throw new TemplateResolutionException(expression, "Missing step id");
                }
                return new VariableReference(scope, rest.get(0), rest.subList(1, rest.size()), expr);
            case METADATA:
                if (rest.size() != 1) {
                    throw new TemplateResolutionException(expression, "Expected a single metadata key");
                }
                return new VariableReference(scope, rest.get(0), List.of(), expr);
            case SAGA:
                if (rest.size() != 1 || !"id".equals(rest.get(0))) {
                    throw new TemplateResolutionException(expression, "Only saga.id is supported");
                }
                return new VariableReference(scope, null, List.of(), expr);
            default:
                return new VariableReference(scope, null, rest, expr);
        }
    }
}
