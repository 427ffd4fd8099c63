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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process local schedule store. Contents are lost on restart.
 */
public class InMemoryScheduleStore implements ScheduleStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryScheduleStore.class);

    private final Map<String, ScheduledMessage> schedules = new ConcurrentHashMap<>();
    private volatile boolean disposed;

    @Override
    public Flux<ScheduledMessage> getAll() {
        return Flux.defer(() -> Flux.fromIterable(schedules.values()));
    }

    @Override
    public Mono<Void> store(ScheduledMessage message) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(message.getId(), "message.id");
        return Mono.fromRunnable(() -> schedules.put(message.getId(), message));
    }

    @Override
    public Mono<Void> complete(String id) {
        return Mono.fromRunnable(() -> schedules.remove(id));
    }

    @Override
    public void dispose() {
        if (!disposed) {
            disposed = true;
            log.debug("In-memory schedule store disposed with {} schedules", schedules.size());
        }
    }

    @Override
    public boolean isDisposed() {
        return disposed;
    }
}
