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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.sagaorchestrator.core.SagaSnapshot;

import java.io.IOException;

/**
 * Jackson-based serializer. The mapper must have the JSR-310 module registered.
 */
public class JsonSagaStateSerializer implements SagaStateSerializer {
    private final ObjectMapper objectMapper;

    public JsonSagaStateSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public byte[] serialize(SagaSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsBytes(snapshot);
        } catch (IOException e) {
            throw new SagaStoreException("Failed to serialize saga " + snapshot.sagaId(), e);
        }
    }

    @Override
    public SagaSnapshot deserialize(byte[] data) {
        try {
            return objectMapper.readValue(data, SagaSnapshot.class);
        } catch (IOException e) {
            throw new SagaStoreException("Failed to deserialize saga record", e);
        }
    }
}
