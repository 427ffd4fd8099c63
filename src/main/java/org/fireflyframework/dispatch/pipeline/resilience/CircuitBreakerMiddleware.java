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

import org.fireflyframework.dispatch.core.DispatchMessage;
import org.fireflyframework.dispatch.core.MessageContext;
import org.fireflyframework.dispatch.core.MessageResult;
import org.fireflyframework.dispatch.pipeline.DispatchDelegate;
import org.fireflyframework.dispatch.pipeline.DispatchMiddleware;
import org.fireflyframework.dispatch.pipeline.MiddlewareStage;
import org.fireflyframework.dispatch.validation.InputValidationException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fails fast with {@link CircuitBreakerOpenException} while the circuit of a message type is open.
 * Error signals and failed results count as failures; validation failures do not.
 */
public class CircuitBreakerMiddleware implements DispatchMiddleware {

    private final int failureThreshold;
    private final Duration openDuration;
    private final int halfOpenMaxCalls;
    private final Clock clock;
    private final Map<Class<?>, CircuitBreaker> circuits = new ConcurrentHashMap<>();

    public CircuitBreakerMiddleware(int failureThreshold, Duration openDuration, int halfOpenMaxCalls) {
        this(failureThreshold, openDuration, halfOpenMaxCalls, Clock.systemUTC());
    }

    public CircuitBreakerMiddleware(int failureThreshold, Duration openDuration, int halfOpenMaxCalls, Clock clock) {
        this.failureThreshold = failureThreshold;
        this.openDuration = openDuration;
        this.halfOpenMaxCalls = halfOpenMaxCalls;
        this.clock = clock;
    }

    @Override
    public MiddlewareStage stage() {
        return MiddlewareStage.RESILIENCE;
    }

    @Override
    public Mono<MessageResult> invoke(DispatchMessage message, MessageContext context, DispatchDelegate next) {
        CircuitBreaker circuit = circuits.computeIfAbsent(message.getClass(),
                type -> new CircuitBreaker(type.getSimpleName(), failureThreshold, openDuration, halfOpenMaxCalls, clock));
        if (!circuit.tryAcquirePermission()) {
            return Mono.error(new CircuitBreakerOpenException(circuit.getName(),
                    "Circuit breaker for " + circuit.getName() + " is " + circuit.getState()));
        }
        return next.invoke(message, context)
                .doOnNext(result -> {
                    if (result.isSuccess()) {
                        circuit.onSuccess();
                    } else if (!result.isValidationFailure()) {
                        circuit.onFailure(result.error());
                    }
                })
                .doOnError(error -> {
                    if (!(error instanceof InputValidationException)) {
                        circuit.onFailure(error);
                    }
                });
    }

    public Optional<CircuitBreaker> circuitFor(Class<? extends DispatchMessage> messageType) {
        return Optional.ofNullable(circuits.get(messageType));
    }
}
