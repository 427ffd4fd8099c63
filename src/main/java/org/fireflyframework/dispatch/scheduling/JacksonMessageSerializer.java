/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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
package org.fireflyframework.dispatch.scheduling;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.dispatch.core.DispatchMessage;
import reactor.core.publisher.Mono;

/**
 * JSON serializer backed by Jackson.
 */
public class JacksonMessageSerializer implements MessageSerializer {

    private final ObjectMapper objectMapper;

    public JacksonMessageSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<String> serialize(DispatchMessage message) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(message));
    }

    @Override
    public Mono<DispatchMessage> deserialize(String payload, Class<? extends DispatchMessage> type) {
        if (payload == null || payload.isBlank()) {
            return Mono.empty();
        }
        return Mono.<DispatchMessage>fromCallable(() -> objectMapper.readValue(payload, type));
    }
}
