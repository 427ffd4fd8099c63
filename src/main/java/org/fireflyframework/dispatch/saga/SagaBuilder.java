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

import org.fireflyframework.dispatch.pipeline.resilience.RetryPolicy;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Fluent builder for {@link SagaDefinition}s.
 * <pre>{@code
 * SagaDefinition<Order> saga = SagaBuilder.<Order>named("place-order")
 *     .step("reserve").handler(inventory::reserve).compensation(inventory::release)
 *         .retry(RetryPolicy.fixedDelay(3, Duration.ofMillis(200))).add()
 *     .step("charge").handler(payments::charge).compensation(payments::refund).add()
 *     .build();
 * }</pre>
 */
public class SagaBuilder<D> {

    private final String name;
    private final List<SagaStep<D>> steps = new ArrayList<>();
    private final Set<String> stepIds = new HashSet<>();

    private SagaBuilder(String name) {
        this.name = name;
    }

    public static <D> SagaBuilder<D> named(String name) {
        return new SagaBuilder<>(name);
    }

    public Step step(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("step id");
        }
        return new Step(id);
    }

    /** Adds a hand-written step implementation. */
    public SagaBuilder<D> step(SagaStep<D> step) {
        register(step);
        return this;
    }

    public SagaDefinition<D> build() {
        return new SagaDefinition<>(name, steps);
    }

    private void register(SagaStep<D> step) {
        if (!stepIds.add(step.name())) {
            throw new IllegalStateException("Duplicate step id '" + step.name() + "' in saga '" + name + "'");
        }
        steps.add(step);
    }

    public class Step {
        private final String id;
        private Function<D, Mono<StepResult>> handler;
        private Function<D, Mono<StepResult>> compensation;
        private RetryPolicy retryPolicy = RetryPolicy.none();
        private Duration timeout;
        private Duration scheduleAfter;

        private Step(String id) {
            this.id = id;
        }

        public Step handler(Function<D, Mono<StepResult>> fn) {
            if (fn == null) throw new IllegalArgumentException("handler");
            this.handler = fn;
            return this;
        }

        /** Runs a side effect on the saga data; a thrown exception fails the step. */
        public Step action(Consumer<D> action) {
            if (action == null) throw new IllegalArgumentException("action");
            this.handler = data -> Mono.fromRunnable(() -> action.accept(data)).thenReturn(StepResult.success());
            return this;
        }

        public Step compensation(Function<D, Mono<StepResult>> fn) {
            this.compensation = fn;
            return this;
        }

        public Step compensationAction(Consumer<D> action) {
            this.compensation = action == null ? null
                    : data -> Mono.fromRunnable(() -> action.accept(data)).thenReturn(StepResult.success());
            return this;
        }

        public Step retry(RetryPolicy policy) {
            this.retryPolicy = policy != null ? policy : RetryPolicy.none();
            return this;
        }

        public Step timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Step timeoutMs(long ms) { this.timeout = (ms >= 0 ? Duration.ofMillis(ms) : null); return this; }
        public Step scheduleAfter(Duration delay) { this.scheduleAfter = delay; return this; }

        public SagaBuilder<D> add() {
            if (handler == null) {
                throw new IllegalStateException("Missing handler for step '" + id + "' in saga '" + name + "'");
            }
            register(new DefinedStep<>(id, handler, compensation, retryPolicy, timeout, scheduleAfter));
            return SagaBuilder.this;
        }
    }

    private record DefinedStep<D>(String name, Function<D, Mono<StepResult>> handler,
                                  Function<D, Mono<StepResult>> compensation, RetryPolicy retryPolicy,
                                  Duration timeout, Duration scheduleAfter) implements SagaStep<D> {

        @Override
        public Mono<StepResult> execute(D data) {
            return handler.apply(data);
        }

        @Override
        public Mono<StepResult> compensate(D data) {
            return compensation == null ? Mono.just(StepResult.success()) : compensation.apply(data);
        }
    }
}
