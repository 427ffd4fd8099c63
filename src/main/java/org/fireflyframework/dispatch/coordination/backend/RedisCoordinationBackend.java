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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Redis backed coordination primitives.
 * <p>
 * Owner-checked renew and delete run as Lua scripts so that the value comparison and the
 * write happen atomically on the server.
 */
public class RedisCoordinationBackend implements CoordinationBackend {

    private static final Logger log = LoggerFactory.getLogger(RedisCoordinationBackend.class);

    static final RedisScript<Long> RENEW_SCRIPT = RedisScript.of(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('pexpire', KEYS[1], ARGV[2]) "
                    + "else return 0 end", Long.class);

    static final RedisScript<Long> DELETE_IF_VALUE_SCRIPT = RedisScript.of(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) "
                    + "else return 0 end", Long.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;

    public RedisCoordinationBackend(ReactiveRedisTemplate<String, String> redisTemplate) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate");
        log.info("Initialized Redis coordination backend");
    }

    @Override
    public Mono<Boolean> setIfAbsent(String key, String value, Duration ttl) {
        return redisTemplate.opsForValue().setIfAbsent(key, value, ttl).defaultIfEmpty(false);
    }

    @Override
    public Mono<Boolean> renew(String key, String expectedValue, Duration ttl) {
        return redisTemplate.execute(RENEW_SCRIPT, List.of(key), List.of(expectedValue, String.valueOf(ttl.toMillis())))
                .next()
                .map(result -> result == 1L)
                .defaultIfEmpty(false);
    }

    @Override
    public Mono<Boolean> deleteIfValue(String key, String expectedValue) {
        return redisTemplate.execute(DELETE_IF_VALUE_SCRIPT, List.of(key), List.of(expectedValue))
                .next()
                .map(result -> result > 0L)
                .defaultIfEmpty(false);
    }

    @Override
    public Mono<Void> set(String key, String value, Duration ttl) {
        Mono<Boolean> op = ttl == null
                ? redisTemplate.opsForValue().set(key, value)
                : redisTemplate.opsForValue().set(key, value, ttl);
        return op.then();
    }

    @Override
    public Mono<String> get(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return redisTemplate.delete(key).map(count -> count > 0);
    }

    @Override
    public Mono<Void> addToSet(String key, String member) {
        return redisTemplate.opsForSet().add(key, member).then();
    }

    @Override
    public Mono<Void> removeFromSet(String key, String member) {
        return redisTemplate.opsForSet().remove(key, member).then();
    }

    @Override
    public Flux<String> members(String key) {
        return redisTemplate.opsForSet().members(key);
    }

    @Override
    public Mono<Boolean> ping() {
        return redisTemplate.execute(connection -> connection.ping())
                .next()
                .map("PONG"::equalsIgnoreCase)
                .defaultIfEmpty(false);
    }
}
