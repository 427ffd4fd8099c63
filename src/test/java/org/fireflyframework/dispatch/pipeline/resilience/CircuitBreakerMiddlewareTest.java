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

import org.fireflyframework.dispatch.MutableClock;
import org.fireflyframework.dispatch.core.DispatchMessage;
import org.fireflyframework.dispatch.core.MessageContext;
import org.fireflyframework.dispatch.core.MessageResult;
import org.fireflyframework.dispatch.pipeline.DispatchDelegate;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerMiddlewareTest {

    record Quote(String symbol) implements DispatchMessage {}

    record Trade(String symbol) implements DispatchMessage {}

    private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
    private final CircuitBreakerMiddleware middleware =
            new CircuitBreakerMiddleware(2, Duration.ofSeconds(30), 1, clock);

    private static final DispatchDelegate FAILING = (m, c) -> Mono.error(new IllegalStateException("upstream down"));
    private static final DispatchDelegate OK = (m, c) -> Mono.just(MessageResult.success());

    @Test
    void opensAfterThresholdAndRejectsCalls() {
        middleware.invoke(new Quote("A"), MessageContext.create(), FAILING).onErrorResume(e -> Mono.empty()).block();
        middleware.invoke(new Quote("A"), MessageContext.create(), FAILING).onErrorResume(e -> Mono.empty()).block();

        assertThat(middleware.circuitFor(Quote.class)).get()
                .extracting(CircuitBreaker::getState).isEqualTo(CircuitBreaker.CircuitState.OPEN);

        StepVerifier.create(middleware.invoke(new Quote("A"), MessageContext.create(), OK))
                .expectError(CircuitBreakerOpenException.class)
                .verify();
    }

    @Test
    void circuitsArePerMessageType() {
        middleware.invoke(new Quote("A"), MessageContext.create(), FAILING).onErrorResume(e -> Mono.empty()).block();
        middleware.invoke(new Quote("A"), MessageContext.create(), FAILING).onErrorResume(e -> Mono.empty()).block();

        StepVerifier.create(middleware.invoke(new Trade("A"), MessageContext.create(), OK))
                .assertNext(r -> assertThat(r.isSuccess()).isTrue())
                .verifyComplete();
    }

    @Test
    void halfOpenSuccessClosesCircuit() {
        middleware.invoke(new Quote("A"), MessageContext.create(), FAILING).onErrorResume(e -> Mono.empty()).block();
        middleware.invoke(new Quote("A"), MessageContext.create(), FAILING).onErrorResume(e -> Mono.empty()).block();

        clock.advance(Duration.ofSeconds(31));

        StepVerifier.create(middleware.invoke(new Quote("A"), MessageContext.create(), OK))
                .expectNextCount(1)
                .verifyComplete();
        assertThat(middleware.circuitFor(Quote.class).orElseThrow().getState())
                .isEqualTo(CircuitBreaker.CircuitState.CLOSED);
    }

    @Test
    void validationFailuresDoNotTrip() {
        DispatchDelegate invalid = (m, c) -> Mono.just(MessageResult.validationFailed(List.of("bad")));
        for (int i = 0; i < 5; i++) {
            middleware.invoke(new Quote("A"), MessageContext.create(), invalid).block();
        }

        assertThat(middleware.circuitFor(Quote.class).orElseThrow().getState())
                .isEqualTo(CircuitBreaker.CircuitState.CLOSED);
    }

    @Test
    void failureDuringHalfOpenReopens() {
        CircuitBreaker breaker = new CircuitBreaker("direct", 1, Duration.ofSeconds(10), 1, clock);
        breaker.onFailure(new RuntimeException("x"));
        assertThat(breaker.tryAcquirePermission()).isFalse();

        clock.advance(Duration.ofSeconds(10));
        assertThat(breaker.tryAcquirePermission()).isTrue();
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.CircuitState.HALF_OPEN);
        assertThat(breaker.tryAcquirePermission()).isFalse();

        breaker.onFailure(new RuntimeException("y"));
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.CircuitState.OPEN);

        breaker.reset();
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.CircuitState.CLOSED);
    }
}
