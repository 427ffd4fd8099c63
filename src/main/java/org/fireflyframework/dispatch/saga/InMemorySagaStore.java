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
package org.fireflyframework.dispatch.saga;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps saga instances in memory. Saving a saga that reached a terminal state also evicts
 * terminal sagas that finished more than the retention ago, so finished sagas do not
 * accumulate for the lifetime of the process.
 */
public class InMemorySagaStore implements SagaStore {

    public static final Duration DEFAULT_RETENTION = Duration.ofHours(1);

    private static final Logger log = LoggerFactory.getLogger(InMemorySagaStore.class);

    private final Map<String, SagaInstance<?>> sagas = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration retention;

    public InMemorySagaStore() {
        this(Clock.systemUTC(), DEFAULT_RETENTION);
    }

    public InMemorySagaStore(Clock clock, Duration retention) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.retention = Objects.requireNonNull(retention, "retention");
        if (retention.isNegative()) {
            throw new IllegalArgumentException("retention must not be negative");
        }
    }

    @Override
    public Mono<Void> save(SagaInstance<?> instance) {
        Objects.requireNonNull(instance, "instance");
        Mono<Void> put = Mono.fromRunnable(() -> sagas.put(instance.getSagaId(), instance));
        if (!instance.getState().isTerminal()) {
            return put;
        }
        return put.then(cleanupCompleted(retention)).then();
    }

    @Override
    public Mono<SagaInstance<?>> find(String sagaId) {
        return Mono.fromCallable(() -> sagas.get(sagaId));
    }

    @Override
    public Flux<SagaInstance<?>> findByState(SagaState state) {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(sagas.values())))
                .filter(instance -> instance.getState() == state);
    }

    @Override
    public Mono<Boolean> delete(String sagaId) {
        return Mono.fromCallable(() -> sagas.remove(sagaId) != null);
    }

    @Override
    public Mono<Long> cleanupCompleted(Duration olderThan) {
        Objects.requireNonNull(olderThan, "olderThan");
        return Mono.fromCallable(() -> {
            Instant cutoff = clock.instant().minus(olderThan);
            List<String> expired = sagas.values().stream()
                    .filter(instance -> instance.getState().isTerminal())
                    .filter(instance -> instance.getFinishedAt() != null && instance.getFinishedAt().isBefore(cutoff))
                    .map(SagaInstance::getSagaId)
                    .toList();
            long removed = expired.stream().filter(id -> sagas.remove(id) != null).count();
            if (removed > 0) {
                log.debug("Cleaned up {} completed sagas finished before {}", removed, cutoff);
            }
            return removed;
        });
    }

    int size() {
        return sagas.size();
    }
}
