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

import org.fireflyframework.dispatch.core.DispatchMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps a message runtime type to its handler.
 * <p>
 * Registering a message type again replaces the previous entry. Lookup is by exact runtime
 * type. The registry is frozen by the dispatcher before the first dispatch; later
 * registrations fail.
 */
public class HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<Class<? extends DispatchMessage>, HandlerRegistryEntry> entries = new ConcurrentHashMap<>();
    private volatile boolean frozen;

    public HandlerRegistryEntry register(Class<? extends DispatchMessage> messageType, Class<?> handlerType) {
        return register(messageType, handlerType, HandlerLifetime.SINGLETON);
    }

    public HandlerRegistryEntry register(Class<? extends DispatchMessage> messageType, Class<?> handlerType,
                                         HandlerLifetime lifetime) {
        Objects.requireNonNull(messageType, "messageType");
        Objects.requireNonNull(handlerType, "handlerType");
        if (frozen) {
            throw new IllegalStateException("Handler registry is frozen; register handlers before the first dispatch");
        }
        boolean expectsResponse = ResponseHandler.class.isAssignableFrom(handlerType);
        if (!expectsResponse && !MessageHandler.class.isAssignableFrom(handlerType)) {
            throw new IllegalArgumentException(handlerType.getName() + " implements neither "
                    + MessageHandler.class.getSimpleName() + " nor " + ResponseHandler.class.getSimpleName());
        }
        HandlerRegistryEntry entry = new HandlerRegistryEntry(messageType, handlerType, expectsResponse, lifetime);
        HandlerRegistryEntry previous = entries.put(messageType, entry);
        if (previous != null && !previous.equals(entry)) {
            log.info("Handler for {} replaced: {} -> {}", messageType.getSimpleName(),
                    previous.handlerType().getSimpleName(), handlerType.getSimpleName());
        }
        return entry;
    }

    public Optional<HandlerRegistryEntry> tryGetHandler(Class<?> messageType) {
        return Optional.ofNullable(entries.get(messageType));
    }

    public Collection<HandlerRegistryEntry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }
}
