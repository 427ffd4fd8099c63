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
package org.fireflyframework.dispatch.coordination;

import org.fireflyframework.dispatch.coordination.backend.CoordinationBackend;
import org.fireflyframework.dispatch.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Time-bounded ownership of a backend key.
 * <p>
 * The lease is valid while the clock is before {@link #getExpiresAt()}. Only the owner's
 * token can renew or delete the key. Release happens at most once; later calls complete
 * without touching the backend.
 */
public abstract class AbstractLease implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AbstractLease.class);

    private final CoordinationBackend backend;
    private final String backendKey;
    private final String token;
    private final String instanceId;
    private final Instant acquiredAt;
    private final Duration releaseTimeout;
    private final Clock clock;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile Instant expiresAt;

    protected AbstractLease(CoordinationBackend backend, String backendKey, String token, String instanceId,
                            Instant acquiredAt, Instant expiresAt, Duration releaseTimeout, Clock clock) {
        this.backend = backend;
        this.backendKey = backendKey;
        this.token = token;
        this.instanceId = instanceId;
        this.acquiredAt = acquiredAt;
        this.expiresAt = expiresAt;
        this.releaseTimeout = releaseTimeout;
        this.clock = clock;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public Instant getAcquiredAt() {
        return acquiredAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public boolean isValid() {
        return !released.get() && clock.instant().isBefore(expiresAt);
    }

    public boolean isReleased() {
        return released.get();
    }

    String backendKey() {
        return backendKey;
    }

    String token() {
        return token;
    }

    /**
     * Renews the lease for {@code duration} from now.
     *
     * @return true when the backend still held this lease; false after release, after the key
     *         expired or was taken over, or when the backend call failed
     */
    public Mono<Boolean> extend(Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            return Mono.error(new IllegalArgumentException("duration must be positive"));
        }
        return Mono.defer(() -> {
            if (released.get()) {
                return Mono.just(false);
            }
            return backend.renew(backendKey, token, duration)
                    .doOnNext(renewed -> {
                        if (renewed) {
                            expiresAt = clock.instant().plus(duration);
                        }
                    })
                    .onErrorResume(e -> {
                        log.warn(JsonUtils.json(
                                "lease_event", "extend_failed",
                                "key", backendKey,
                                "error", e
                        ));
                        return Mono.just(false);
                    });
        });
    }

    /**
     * Deletes the key if this lease still owns it. Only the first call reaches the backend.
     */
    public Mono<Void> release() {
        return Mono.defer(() -> {
            if (!released.compareAndSet(false, true)) {
                return Mono.empty();
            }
            return backend.deleteIfValue(backendKey, token)
                    .doOnNext(deleted -> log.debug(JsonUtils.json(
                            "lease_event", "released",
                            "key", backendKey,
                            "owned", deleted
                    )))
                    .then();
        });
    }

    /**
     * Releases the lease, bounded by the release timeout. Never signals an error.
     */
    public Mono<Void> disposeAsync() {
        return release()
                .timeout(releaseTimeout)
                .onErrorResume(e -> {
                    log.warn(JsonUtils.json(
                            "lease_event", "release_failed",
                            "key", backendKey,
                            "error", e
                    ));
                    return Mono.empty();
                });
    }

    @Override
    public void close() {
        disposeAsync().block();
    }
}
