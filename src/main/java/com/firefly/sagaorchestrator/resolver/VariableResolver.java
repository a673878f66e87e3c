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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Materializes payload templates. Walks nested maps and lists and replaces {@code ${...}} references in string
 * leaves. A leaf made of exactly one reference takes the referenced value as-is (numbers stay numbers, maps stay
 * maps); references embedded in longer text are interpolated.
 * <p>
 * Pure: the same template and context always give an equal payload, and inputs are never modified.
 */
public class VariableResolver {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]*)}");
    private static final ObjectMapper TEXT_MAPPER = new ObjectMapper();

    public Map<String, Object> resolve(Map<String, Object> template, ResolutionContext ctx) {
        if (template == null) return new LinkedHashMap<>();
        Map<String, Object> out = new LinkedHashMap<>();
        template.forEach((k, v) -> out.put(k, resolveValue(v, ctx)));
        return out;
    }

    public Object resolveValue(Object value, ResolutionContext ctx) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(String.valueOf(k), resolveValue(v, ctx)));
            return out;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) out.add(resolveValue(item, ctx));
            return out;
        }
        if (value instanceof String s) {
            return resolveString(s, ctx);
        }
        return value;
    }

    private Object resolveString(String s, ResolutionContext ctx) {
        if (s.indexOf("${") < 0) return s;
        Matcher whole = PLACEHOLDER.matcher(s);
        if (whole.matches()) {
            return lookup(VariableReference.parse(whole.group(1)), ctx);
        }
        Matcher m = PLACEHOLDER.matcher(s);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            Object v = lookup(VariableReference.parse(m.group(1)), ctx);
            m.appendReplacement(sb, Matcher.quoteReplacement(asText(v)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    Object lookup(VariableReference ref, ResolutionContext ctx) {
        switch (ref.scope()) {
            case SAGA:
                return ctx.sagaId();
            case METADATA:
                if (!ctx.metadata().containsKey(ref.target())) {
                    throw new TemplateResolutionException(ref.expression(), "Unknown metadata key '" + ref.target() + "'");
                }
                return ctx.metadata().get(ref.target());
            case STEP:
                if (!ctx.namedResults().containsKey(ref.target())) {
                    throw new TemplateResolutionException(ref.expression(), "No result for step '" + ref.target() + "'");
                }
                return walk(ctx.namedResults().get(ref.target()), ref);
            case PREVIOUS_STEP:
                if (!ctx.hasPrevious()) {
                    throw new TemplateResolutionException(ref.expression(), "No previous step");
                }
                return walk(ctx.previousResult(), ref);
            case STEP_RESULT:
            default:
                return walk(ctx.currentResult(), ref);
        }
    }

    private static Object walk(Object root, VariableReference ref) {
        Object current = root;
        for (String segment : ref.path()) {
            if (current instanceof Map<?, ?> map) {
                if (!map.containsKey(segment)) {
                    throw new TemplateResolutionException(ref.expression(), "Missing field '" + segment + "'");
                }
                current = map.get(segment);
            } else if (current instanceof List<?> list) {
                int idx = parseIndex(segment);
                if (idx < 0 || idx >= list.size()) {
                    throw new TemplateResolutionException(ref.expression(), "No list element '" + segment + "'");
                }
                current = list.get(idx);
            } else {
                throw new TemplateResolutionException(ref.expression(), "Cannot read field '" + segment + "'");
            }
        }
        return current;
    }

    private static int parseIndex(String segment) {
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static String asText(Object v) {
        if (v == null) return "null";
        if (v instanceof Map || v instanceof List) {
            try {
                return TEXT_MAPPER.writeValueAsString(v);
            } catch (JsonProcessingException e) {
                return String.valueOf(v);
            }
        }
        return String.valueOf(v);
    }
}
