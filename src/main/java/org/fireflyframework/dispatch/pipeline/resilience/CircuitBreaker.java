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
package org.fireflyframework.dispatch.pipeline.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Three-state circuit breaker guarding one message type.
 *
 * <p>Circuit breaker states:
 * <ul>
 *   <li><b>CLOSED:</b> Normal operation, calls pass through</li>
 *   <li><b>OPEN:</b> Calls fail immediately until the open duration elapsed</li>
 *   <li><b>HALF_OPEN:</b> A limited number of probe calls test whether the handler recovered</li>
 * </ul>
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration openDuration;
    private final int halfOpenMaxCalls;
    private final Clock clock;

    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicInteger halfOpenSuccesses = new AtomicInteger(0);
    private final AtomicInteger halfOpenPermits = new AtomicInteger(0);
    private final AtomicReference<Instant> openedAt = new AtomicReference<>();
    private final AtomicReference<CircuitState> state = new AtomicReference<>(CircuitState.CLOSED);

    public CircuitBreaker(String name, int failureThreshold, Duration openDuration, int halfOpenMaxCalls, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (halfOpenMaxCalls < 1) {
            throw new IllegalArgumentException("halfOpenMaxCalls must be >= 1");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.openDuration = openDuration;
        this.halfOpenMaxCalls = halfOpenMaxCalls;
        this.clock = clock;
    }

    /**
     * Whether a call may proceed now. Moves OPEN to HALF_OPEN once the open duration elapsed.
     */
    public boolean tryAcquirePermission() {
        CircuitState current = state.get();
        if (current == CircuitState.OPEN) {
            Instant opened = openedAt.get();
            if (opened != null && !clock.instant().isBefore(opened.plus(openDuration))
                    && state.compareAndSet(CircuitState.OPEN, CircuitState.HALF_OPEN)) {
                halfOpenSuccesses.set(0);
                halfOpenPermits.set(0);
                log.info("Circuit breaker '{}' transitioning to HALF_OPEN for recovery testing", name);
            }
            current = state.get();
        }
        return switch (current) {
            case CLOSED -> true;
            case OPEN -> false;
            case HALF_OPEN -> halfOpenPermits.incrementAndGet() <= halfOpenMaxCalls;
        };
    }

    public void onSuccess() {
        CircuitState current = state.get();
        if (current == CircuitState.HALF_OPEN) {
            if (halfOpenSuccesses.incrementAndGet() >= halfOpenMaxCalls
                    && state.compareAndSet(CircuitState.HALF_OPEN, CircuitState.CLOSED)) {
                failureCount.set(0);
                log.info("Circuit breaker '{}' closed after successful recovery", name);
            }
        } else if (current == CircuitState.CLOSED) {
            failureCount.set(0);
        }
    }

    public void onFailure(Throwable error) {
        CircuitState current = state.get();
        int failures = failureCount.incrementAndGet();
        log.debug("Circuit breaker '{}' recorded failure #{} in state {}: {}", name, failures, current,
                error != null ? error.getMessage() : "failed result");

        if (current == CircuitState.HALF_OPEN) {
            if (state.compareAndSet(CircuitState.HALF_OPEN, CircuitState.OPEN)) {
                openedAt.set(clock.instant());
                log.warn("Circuit breaker '{}' reopened due to failure during recovery testing", name);
            }
        } else if (current == CircuitState.CLOSED && failures >= failureThreshold
                && state.compareAndSet(CircuitState.CLOSED, CircuitState.OPEN)) {
            openedAt.set(clock.instant());
            log.warn("Circuit breaker '{}' opened due to {} failures (threshold: {})", name, failures, failureThreshold);
        }
    }

    public CircuitState getState() {
        return state.get();
    }

    public String getName() {
        return name;
    }

    public void reset() {
        state.set(CircuitState.CLOSED);
        failureCount.set(0);
        halfOpenSuccesses.set(0);
        halfOpenPermits.set(0);
        openedAt.set(null);
        log.info("Circuit breaker '{}' manually reset to CLOSED state", name);
    }

    public enum CircuitState {
        CLOSED,
        OPEN,
        HALF_OPEN
    }
}
