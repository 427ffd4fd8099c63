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

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Live state of one saga execution.
 */
public class SagaInstance<D> {

    private final String sagaId;
    private final String sagaType;
    private final D data;
    private final Clock clock;
    private final Instant startedAt;
    private final List<SagaActivity> activities = new CopyOnWriteArrayList<>();
    private final List<String> completedSteps = new CopyOnWriteArrayList<>();
    private final Map<String, Object> stepOutputs = Collections.synchronizedMap(new LinkedHashMap<>());
    private final ScheduledStepTracker scheduledSteps = new ScheduledStepTracker();
    private final Sinks.One<Boolean> cancelled = Sinks.one();

    private SagaState state = SagaState.CREATED;
    private volatile Instant finishedAt;
    private volatile String errorMessage;
    private volatile String failedStep;

    public SagaInstance(String sagaId, String sagaType, D data, Clock clock) {
        this.sagaId = sagaId;
        this.sagaType = sagaType;
        this.data = data;
        this.clock = clock;
        this.startedAt = clock.instant();
        record("created", sagaType);
    }

    public String getSagaId() { return sagaId; }
    public String getSagaType() { return sagaType; }
    public D getData() { return data; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public String getErrorMessage() { return errorMessage; }
    public String getFailedStep() { return failedStep; }

    public synchronized SagaState getState() {
        return state;
    }

    public List<SagaActivity> getActivities() {
        return List.copyOf(activities);
    }

    public List<String> getCompletedSteps() {
        return List.copyOf(completedSteps);
    }

    public Map<String, Object> getStepOutputs() {
        synchronized (stepOutputs) {
            return Map.copyOf(stepOutputs);
        }
    }

    public Duration getDuration() {
        Instant end = finishedAt != null ? finishedAt : clock.instant();
        return Duration.between(startedAt, end);
    }

    /**
     * @throws SagaStateTransitionException when the move is not allowed
     */
    public synchronized void transitionTo(SagaState target) {
        SagaStateMachine.validate(state, target);
        applyTransition(target);
    }

    /**
     * Moves to {@code target} if allowed from the current state.
     *
     * @return whether the state changed
     */
    public synchronized boolean tryTransitionTo(SagaState target) {
        if (!SagaStateMachine.canTransition(state, target)) {
            return false;
        }
        applyTransition(target);
        return true;
    }

    private void applyTransition(SagaState target) {
        SagaState previous = state;
        state = target;
        record("state_changed", previous + " -> " + target);
        if (target.isTerminal()) {
            finishedAt = clock.instant();
        }
        if (target == SagaState.CANCELLED) {
            cancelled.tryEmitValue(true);
            scheduledSteps.cancelAll();
        }
    }

    void stepCompleted(String step, Object output) {
        completedSteps.add(step);
        if (output != null) {
            stepOutputs.put(step, output);
        }
        record("step_completed", step);
    }

    void stepFailed(String step, String error) {
        this.failedStep = step;
        this.errorMessage = error;
        record("step_failed", step + ": " + error);
    }

    List<String> completedStepsInReverse() {
        List<String> reversed = new ArrayList<>(completedSteps);
        Collections.reverse(reversed);
        return reversed;
    }

    void record(String name, String detail) {
        activities.add(new SagaActivity(clock.instant(), name, detail));
    }

    ScheduledStepTracker scheduledSteps() {
        return scheduledSteps;
    }

    Mono<Boolean> cancellation() {
        return cancelled.asMono();
    }
}
