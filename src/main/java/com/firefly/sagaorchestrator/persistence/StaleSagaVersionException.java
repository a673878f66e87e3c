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

package com.firefly.sagaorchestrator.persistence;

/**
 * A write was based on an outdated version of the saga record.
 */
public class StaleSagaVersionException extends SagaStoreException {
    private final String sagaId;
    private final long expectedVersion;

    public StaleSagaVersionException(String sagaId, long expectedVersion) {
        super("Saga " + sagaId + " was modified concurrently (expected version " + expectedVersion + ")");
        this.sagaId = sagaId;
        this.expectedVersion = expectedVersion;
    }

    public String getSagaId() {
        return sagaId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
