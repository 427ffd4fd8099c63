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

import java.time.Duration;

/**
 * Key-value primitives shared by every instance taking part in job coordination.
 * Keys arrive fully qualified; implementations add no prefix of their own.
 */
public interface CoordinationBackend {

    /** Atomically stores the value with a TTL unless the key already exists. */
    Mono<Boolean> setIfAbsent(String key, String value, Duration ttl);

    /** Resets the TTL only while the key still holds {@code expectedValue}. */
    Mono<Boolean> renew(String key, String expectedValue, Duration ttl);

    /** Deletes the key only while it still holds {@code expectedValue}. */
    Mono<Boolean> deleteIfValue(String key, String expectedValue);

    /** Stores the value, with a TTL unless {@code ttl} is null. */
    Mono<Void> set(String key, String value, Duration ttl);

    Mono<String> get(String key);

    Mono<Boolean> delete(String key);

    Mono<Void> addToSet(String key, String member);

    Mono<Void> removeFromSet(String key, String member);

    Flux<String> members(String key);

    /** Emits true when the backend answers. */
    Mono<Boolean> ping();
}
