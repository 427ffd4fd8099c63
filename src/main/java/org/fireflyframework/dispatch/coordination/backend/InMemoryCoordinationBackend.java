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
package org.fireflyframework.dispatch.coordination.backend;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single process backend. Expired keys are treated as absent and dropped lazily.
 */
public class InMemoryCoordinationBackend implements CoordinationBackend {

    private record Entry(String value, Instant expiresAt) {
        boolean isLive(Instant now) {
            return expiresAt == null || now.isBefore(expiresAt);
        }
    }

    private final Map<String, Entry> values = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sets = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCoordinationBackend() {
        this(Clock.systemUTC());
    }

    public InMemoryCoordinationBackend(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<Boolean> setIfAbsent(String key, String value, Duration ttl) {
        return Mono.fromCallable(() -> {
            Instant now = clock.instant();
            AtomicBoolean stored = new AtomicBoolean(false);
            values.compute(key, (k, current) -> {
                if (current != null && current.isLive(now)) {
                    return current;
                }
                stored.set(true);
                return new Entry(value, expiry(now, ttl));
            });
            return stored.get();
        });
    }

    @Override
    public Mono<Boolean> renew(String key, String expectedValue, Duration ttl) {
        return Mono.fromCallable(() -> {
            Instant now = clock.instant();
            AtomicBoolean renewed = new AtomicBoolean(false);
            values.computeIfPresent(key, (k, current) -> {
                if (!current.isLive(now)) {
                    return null;
                }
                if (!current.value().equals(expectedValue)) {
                    return current;
                }
                renewed.set(true);
                return new Entry(current.value(), expiry(now, ttl));
            });
            return renewed.get();
        });
    }

    @Override
    public Mono<Boolean> deleteIfValue(String key, String expectedValue) {
        return Mono.fromCallable(() -> {
            Instant now = clock.instant();
            AtomicBoolean deleted = new AtomicBoolean(false);
            values.computeIfPresent(key, (k, current) -> {
                if (!current.isLive(now)) {
                    return null;
                }
                if (current.value().equals(expectedValue)) {
                    deleted.set(true);
                    return null;
                }
                return current;
            });
            return deleted.get();
        });
    }

    @Override
    public Mono<Void> set(String key, String value, Duration ttl) {
        return Mono.fromRunnable(() -> values.put(key, new Entry(value, expiry(clock.instant(), ttl))));
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromCallable(() -> {
            Entry entry = values.get(key);
            if (entry == null) {
                return null;
            }
            if (!entry.isLive(clock.instant())) {
                values.remove(key, entry);
                return null;
            }
            return entry.value();
        });
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return Mono.fromCallable(() -> {
            Entry removed = values.remove(key);
            return removed != null && removed.isLive(clock.instant());
        });
    }

    @Override
    public Mono<Void> addToSet(String key, String member) {
        return Mono.fromRunnable(() -> sets.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(member));
    }

    @Override
    public Mono<Void> removeFromSet(String key, String member) {
        return Mono.fromRunnable(() -> {
            Set<String> members = sets.get(key);
            if (members != null) {
                members.remove(member);
            }
        });
    }

    @Override
    public Flux<String> members(String key) {
        return Flux.defer(() -> {
            Set<String> members = sets.get(key);
            return members == null ? Flux.empty() : Flux.fromIterable(new ArrayList<>(members));
        });
    }

    @Override
    public Mono<Boolean> ping() {
        return Mono.just(true);
    }

    private static Instant expiry(Instant now, Duration ttl) {
        return ttl == null ? null : now.plus(ttl);
    }
}
