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
package org.fireflyframework.dispatch.scheduling;

import org.fireflyframework.dispatch.pipeline.observability.DispatchMetrics;

import java.time.Duration;

/**
 * Publishes scheduler operations as {@code dispatch.scheduled.operations} timers tagged
 * {@code success}, {@code failure} or {@code timeout}.
 */
public class MicrometerScheduleOperationMonitor implements ScheduleOperationMonitor {

    private final DispatchMetrics metrics;

    public MicrometerScheduleOperationMonitor(DispatchMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public Operation start(String operationType) {
        return new Operation(operationType, System.nanoTime());
    }

    @Override
    public void complete(Operation operation, boolean success, boolean timedOut) {
        String outcome = timedOut ? "timeout" : success ? "success" : "failure";
        metrics.recordScheduledOperation(operation.operationType(), outcome,
                Duration.ofNanos(System.nanoTime() - operation.startNanos()));
    }
}
