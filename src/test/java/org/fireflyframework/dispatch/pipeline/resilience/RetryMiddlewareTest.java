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
import org.fireflyframework.dispatch.validation.InputValidationException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RetryMiddlewareTest {

    record Charge(long amount) implements DispatchMessage {}

    private final RetryMiddleware middleware = new RetryMiddleware(RetryPolicy.fixedDelay(3, Duration.ofMillis(5)));

    @Test
    void retriesFailedResultUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        StepVerifier.create(middleware.invoke(new Charge(10), MessageContext.create(), (m, c) ->
                        Mono.fromSupplier(() -> calls.incrementAndGet() < 3
                                ? MessageResult.failure(new IllegalStateException("transient"))
                                : MessageResult.success("charged"))))
                .assertNext(r -> assertThat(r.valueAs(String.class)).contains("charged"))
                .verifyComplete();

        assertThat(calls).hasValue(3);
    }

    @Test
    void givesUpAfterMaxAttemptsAndPropagatesError() {
        AtomicInteger calls = new AtomicInteger();

        StepVerifier.create(middleware.invoke(new Charge(10), MessageContext.create(), (m, c) -> {
                    calls.incrementAndGet();
                    return Mono.error(new IllegalStateException("down"));
                }))
                .expectErrorMessage("down")
                .verify();

        assertThat(calls).hasValue(3);
    }

    @Test
    void validationFailuresAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        StepVerifier.create(middleware.invoke(new Charge(10), MessageContext.create(), (m, c) -> {
                    calls.incrementAndGet();
                    return Mono.error(new InputValidationException(List.of("bad")));
                }))
                .expectError(InputValidationException.class)
                .verify();

        StepVerifier.create(middleware.invoke(new Charge(10), MessageContext.create(), (m, c) -> {
                    calls.incrementAndGet();
                    return Mono.just(MessageResult.validationFailed(List.of("bad")));
                }))
                .assertNext(r -> assertThat(r.isValidationFailure()).isTrue())
                .verifyComplete();

        assertThat(calls).hasValue(2);
    }
}
