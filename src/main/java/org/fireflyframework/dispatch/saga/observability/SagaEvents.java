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
package org.fireflyframework.dispatch.saga.observability;

import org.fireflyframework.dispatch.saga.SagaState;

/**
 * Observability hook for saga lifecycle events.
 * Provide your own Spring bean of this type to export metrics, traces or logs.
 * A default logger-based implementation is provided: {@link SagaLoggerEvents}.
 * <p>
 * onCompensated is invoked for both outcomes; a null error means the compensation succeeded.
 */
public interface SagaEvents {

    default void onStart(String sagaName, String sagaId) {}

    default void onStepStarted(String sagaName, String sagaId, String stepId) {}

    default void onStepSuccess(String sagaName, String sagaId, String stepId, int attempts, long latencyMs) {}

    default void onStepRetry(String sagaName, String sagaId, String stepId, int attempt, long delayMs) {}

    default void onStepFailed(String sagaName, String sagaId, String stepId, String errorMessage, Throwable error,
                              int attempts, long latencyMs) {}

    default void onCompensationStarted(String sagaName, String sagaId, String stepId) {}

    default void onCompensated(String sagaName, String sagaId, String stepId, Throwable error) {}

    default void onCancelled(String sagaName, String sagaId) {}

    default void onCompleted(String sagaName, String sagaId, SagaState finalState) {}
}
