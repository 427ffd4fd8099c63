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

import org.fireflyframework.dispatch.core.DispatchMessage;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps stored message names to message classes. Only registered types are ever
 * deserialized from persisted schedules.
 */
public class MessageTypeRegistry {

    private final Map<String, Class<? extends DispatchMessage>> byName = new ConcurrentHashMap<>();
    private final Map<Class<? extends DispatchMessage>, String> byType = new ConcurrentHashMap<>();

    /** Registers the type under its fully qualified class name. */
    public String register(Class<? extends DispatchMessage> type) {
        return register(type.getName(), type);
    }

    public String register(String name, Class<? extends DispatchMessage> type) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        byName.put(name, type);
        byType.putIfAbsent(type, name);
        return name;
    }

    public Optional<Class<? extends DispatchMessage>> resolve(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(byName.get(name));
    }

    public Optional<String> nameOf(Class<? extends DispatchMessage> type) {
        return Optional.ofNullable(byType.get(type));
    }
}
