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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default logger-based implementation of SagaEvents.
 * <p>
 * Every event is one JSON line so log aggregation systems can parse it.
 * <ul>
 *   <li>INFO - Normal lifecycle events (started, completed, step transitions)</li>
 *   <li>WARN - Retries and cancellation</li>
 *   <li>ERROR - Failed steps and compensations</li>
 * </ul>
 */
public class SagaLoggerEvents implements SagaEvents {

    private static final Logger log = LoggerFactory.getLogger(SagaLoggerEvents.class);

    @Override
    public void onStart(String sagaName, String sagaId) {
        log.info("{\"saga_event\":\"started\",\"saga_name\":\"{}\",\"saga_id\":\"{}\"}",
                sagaName, sagaId);
    }

    @Override
    public void onStepStarted(String sagaName, String sagaId, String stepId) {
        log.info("{\"saga_event\":\"step_started\",\"saga_name\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\"}",
                sagaName, sagaId, stepId);
    }

    @Override
    public void onStepSuccess(String sagaName, String sagaId, String stepId, int attempts, long latencyMs) {
        log.info("{\"saga_event\":\"step_success\",\"saga_name\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\",\"attempts\":\"{}\",\"latency_ms\":\"{}\"}",
                sagaName, sagaId, stepId, attempts, latencyMs);
    }

    @Override
    public void onStepRetry(String sagaName, String sagaId, String stepId, int attempt, long delayMs) {
        log.warn("{\"saga_event\":\"step_retry\",\"saga_name\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\",\"attempt\":\"{}\",\"delay_ms\":\"{}\"}",
                sagaName, sagaId, stepId, attempt, delayMs);
    }

    @Override
    public void onStepFailed(String sagaName, String sagaId, String stepId, String errorMessage, Throwable error,
                             int attempts, long latencyMs) {
        log.error("{\"saga_event\":\"step_failed\",\"saga_name\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\",\"error_class\":\"{}\",\"error_message\":\"{}\",\"attempts\":\"{}\",\"latency_ms\":\"{}\"}",
                sagaName, sagaId, stepId, error != null ? error.getClass().getSimpleName() : "", errorMessage,
                attempts, latencyMs);
    }

    @Override
    public void onCompensationStarted(String sagaName, String sagaId, String stepId) {
        log.info("{\"saga_event\":\"compensation_started\",\"saga_name\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\"}",
                sagaName, sagaId, stepId);
    }

    @Override
    public void onCompensated(String sagaName, String sagaId, String stepId, Throwable error) {
        if (error == null) {
            log.info("{\"saga_event\":\"compensated_success\",\"saga_name\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\"}",
                    sagaName, sagaId, stepId);
        } else {
            log.error("{\"saga_event\":\"compensated_failed\",\"saga_name\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\",\"error_class\":\"{}\",\"error_message\":\"{}\"}",
                    sagaName, sagaId, stepId, error.getClass().getSimpleName(), error.getMessage());
        }
    }

    @Override
    public void onCancelled(String sagaName, String sagaId) {
        log.warn("{\"saga_event\":\"cancelled\",\"saga_name\":\"{}\",\"saga_id\":\"{}\"}",
                sagaName, sagaId);
    }

    @Override
    public void onCompleted(String sagaName, String sagaId, SagaState finalState) {
        log.info("{\"saga_event\":\"completed\",\"saga_name\":\"{}\",\"saga_id\":\"{}\",\"success\":\"{}\",\"state\":\"{}\"}",
                sagaName, sagaId, finalState == SagaState.COMPLETED, finalState);
    }
}
