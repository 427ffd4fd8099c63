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

import org.fireflyframework.dispatch.core.DispatchException;
import org.fireflyframework.dispatch.saga.observability.SagaEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * Runs sagas step by step and compensates completed steps in reverse order when one fails.
 * <p>
 * A failed forward step is retried according to its {@link org.fireflyframework.dispatch.pipeline.resilience.RetryPolicy}.
 * Compensations run once each; all of them are attempted even after one fails, and any failure
 * ends the saga in {@link SagaState#COMPENSATION_FAILED}. A cancelled saga stops before its next
 * step without compensating.
 */
public class SagaOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SagaOrchestrator.class);

    private final SagaStore store;
    private final SagaEvents events;
    private final Clock clock;

    private record Attempt(StepResult result, int attempts) {
    }

    public SagaOrchestrator(SagaStore store, SagaEvents events, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public <D> Mono<SagaResult<D>> execute(SagaDefinition<D> definition, D data) {
        Objects.requireNonNull(definition, "definition");
        return Mono.defer(() -> {
            SagaInstance<D> instance = new SagaInstance<>(UUID.randomUUID().toString(), definition.getName(), data, clock);
            return store.save(instance)
                    .then(Mono.defer(() -> {
                        notify(() -> events.onStart(instance.getSagaType(), instance.getSagaId()));
                        if (!instance.tryTransitionTo(SagaState.RUNNING)) {
                            return Mono.<Void>empty();
                        }
                        return runSteps(definition, instance, 0);
                    }))
                    .then(Mono.defer(() -> finish(instance)));
        });
    }

    /**
     * Cancels a saga that has not reached a terminal state.
     *
     * @return whether the saga was cancelled by this call
     */
    public Mono<Boolean> cancel(String sagaId) {
        return store.find(sagaId)
                .map(instance -> instance.tryTransitionTo(SagaState.CANCELLED))
                .defaultIfEmpty(false);
    }

    public Mono<SagaInstance<?>> getSaga(String sagaId) {
        return store.find(sagaId);
    }

    private <D> Mono<Void> runSteps(SagaDefinition<D> definition, SagaInstance<D> instance, int index) {
        if (instance.getState() != SagaState.RUNNING) {
            return Mono.empty();
        }
        List<SagaStep<D>> steps = definition.getSteps();
        if (index >= steps.size()) {
            instance.tryTransitionTo(SagaState.COMPLETED);
            return Mono.empty();
        }
        SagaStep<D> step = steps.get(index);
        long started = System.nanoTime();
        notify(() -> events.onStepStarted(instance.getSagaType(), instance.getSagaId(), step.name()));
        return runWithRetry(instance, step, 1).flatMap(attempt -> {
            if (instance.getState() != SagaState.RUNNING) {
                return Mono.<Void>empty();
            }
            long latencyMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
            StepResult result = attempt.result();
            if (result.isSuccess()) {
                instance.stepCompleted(step.name(), result.outputData().orElse(null));
                notify(() -> events.onStepSuccess(instance.getSagaType(), instance.getSagaId(), step.name(),
                        attempt.attempts(), latencyMs));
                return runSteps(definition, instance, index + 1);
            }
            instance.stepFailed(step.name(), result.errorMessage());
            notify(() -> events.onStepFailed(instance.getSagaType(), instance.getSagaId(), step.name(),
                    result.errorMessage(), result.exception(), attempt.attempts(), latencyMs));
            return compensate(definition, instance);
        });
    }

    private <D> Mono<Attempt> runWithRetry(SagaInstance<D> instance, SagaStep<D> step, int attempt) {
        return executeOnce(instance, step, attempt).flatMap(result -> {
            if (result.isSuccess()
                    || instance.getState() != SagaState.RUNNING
                    || !step.retryPolicy().shouldRetry(attempt, result.exception())) {
                return Mono.just(new Attempt(result, attempt));
            }
            Duration delay = step.retryPolicy().getDelay(attempt);
            notify(() -> events.onStepRetry(instance.getSagaType(), instance.getSagaId(), step.name(), attempt,
                    delay.toMillis()));
            return Mono.delay(delay)
                    .takeUntilOther(instance.cancellation())
                    .then(Mono.defer(() -> instance.getState() == SagaState.RUNNING
                            ? runWithRetry(instance, step, attempt + 1)
                            : Mono.just(new Attempt(result, attempt))));
        });
    }

    private <D> Mono<StepResult> executeOnce(SagaInstance<D> instance, SagaStep<D> step, int attempt) {
        return Mono.defer(() -> {
            Mono<StepResult> action = Mono.defer(() -> step.execute(instance.getData()));
            if (step.timeout() != null) {
                action = action.timeout(step.timeout());
            }
            if (attempt == 1 && step.scheduleAfter() != null) {
                CompletableFuture<StepResult> scheduled = instance.scheduledSteps()
                        .track(Mono.delay(step.scheduleAfter()).then(action).toFuture());
                action = Mono.fromFuture(scheduled);
            }
            return action;
        })
                .takeUntilOther(instance.cancellation())
                .switchIfEmpty(Mono.fromSupplier(() -> instance.getState() == SagaState.CANCELLED
                        ? StepResult.failure("Saga cancelled", new CancellationException("Saga cancelled"))
                        : StepResult.failure("Step '" + step.name() + "' produced no result")))
                .onErrorResume(e -> Mono.just(StepResult.failure(describe(step, e), e)));
    }

    private <D> Mono<Void> compensate(SagaDefinition<D> definition, SagaInstance<D> instance) {
        if (!instance.tryTransitionTo(SagaState.COMPENSATING)) {
            return Mono.empty();
        }
        Map<String, SagaStep<D>> byName = new HashMap<>();
        definition.getSteps().forEach(s -> byName.put(s.name(), s));
        return Flux.fromIterable(instance.completedStepsInReverse())
                .concatMap(name -> instance.getState() == SagaState.COMPENSATING
                        ? compensateStep(instance, byName.get(name))
                        : Mono.just(true))
                .reduce(true, (all, ok) -> all && ok)
                .doOnNext(allOk -> instance.tryTransitionTo(
                        allOk ? SagaState.COMPENSATED_SUCCESSFULLY : SagaState.COMPENSATION_FAILED))
                .then();
    }

    private <D> Mono<Boolean> compensateStep(SagaInstance<D> instance, SagaStep<D> step) {
        notify(() -> events.onCompensationStarted(instance.getSagaType(), instance.getSagaId(), step.name()));
        Mono<StepResult> action = Mono.defer(() -> step.compensate(instance.getData()));
        if (step.timeout() != null) {
            action = action.timeout(step.timeout());
        }
        return action
                .defaultIfEmpty(StepResult.success())
                .onErrorResume(e -> Mono.just(StepResult.failure(describe(step, e), e)))
                .map(result -> {
                    if (result.isSuccess()) {
                        instance.record("step_compensated", step.name());
                        notify(() -> events.onCompensated(instance.getSagaType(), instance.getSagaId(), step.name(), null));
                        return true;
                    }
                    Throwable error = result.exception() != null
                            ? result.exception()
                            : new DispatchException(result.errorMessage());
                    instance.record("compensation_failed", step.name() + ": " + result.errorMessage());
                    notify(() -> events.onCompensated(instance.getSagaType(), instance.getSagaId(), step.name(), error));
                    return false;
                });
    }

    private <D> Mono<SagaResult<D>> finish(SagaInstance<D> instance) {
        SagaState state = instance.getState();
        if (state == SagaState.CANCELLED) {
            notify(() -> events.onCancelled(instance.getSagaType(), instance.getSagaId()));
        }
        notify(() -> events.onCompleted(instance.getSagaType(), instance.getSagaId(), state));
        return store.save(instance).thenReturn(SagaResult.from(instance));
    }

    private static String describe(SagaStep<?> step, Throwable e) {
        if (e instanceof TimeoutException) {
            return "Step '" + step.name() + "' timed out after " + step.timeout();
        }
        if (e instanceof CancellationException) {
            return "Step '" + step.name() + "' was cancelled";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }

    private void notify(Runnable event) {
        try {
            event.run();
        } catch (RuntimeException e) {
            log.warn("Saga event hook failed", e);
        }
    }
}
