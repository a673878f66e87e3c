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

package com.firefly.sagaorchestrator.util;

/**
 * Truncation helpers for payload and result previews in log lines.
 */
public final class SagaLogUtil {
    public static final int PREVIEW_MAX = 300;

    private SagaLogUtil() {}

    public static String summarize(Object obj, int max) {
        if (obj == null) return "null";
        return safeString(String.valueOf(obj), max);
    }

    public static String safeString(String s, int max) {
        if (s == null) return "null";
        if (max <= 0) return "";
        if (s.length() <= max) return s;
        return s.substring(0, Math.max(0, max - 3)) + "...";
    }
}
