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
package org.fireflyframework.dispatch.handler;

import org.fireflyframework.dispatch.core.MessageContext;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Produces the handler instance for a registry entry, honouring its {@link HandlerLifetime}.
 */
public class HandlerActivator {

    private final HandlerFactory factory;
    private final Map<Class<?>, Object> singletons = new ConcurrentHashMap<>();

    public HandlerActivator(HandlerFactory factory) {
        this.factory = factory;
    }

    public Object activate(HandlerRegistryEntry entry, MessageContext context) {
        Class<?> handlerType = entry.handlerType();
        return switch (entry.lifetime()) {
            case SINGLETON -> singletons.computeIfAbsent(handlerType, factory::create);
            case SCOPED -> context.getOrCreateScoped(scopedKey(handlerType), () -> factory.create(handlerType));
            case TRANSIENT -> factory.create(handlerType);
        };
    }

    @SuppressWarnings("unchecked")
    private static Class<Object> scopedKey(Class<?> handlerType) {
        return (Class<Object>) handlerType;
    }
}
