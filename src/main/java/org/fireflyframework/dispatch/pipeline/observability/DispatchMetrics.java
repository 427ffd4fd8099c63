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
package org.fireflyframework.dispatch.pipeline.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;

import java.time.Duration;

/**
 * Micrometer counters and timers published by the dispatch engine.
 */
public class DispatchMetrics {

    public static final String MESSAGES = "dispatch.messages";
    public static final String DURATION = "dispatch.duration";
    public static final String VALIDATION_FAILURES = "dispatch.validation.failures";
    public static final String SCHEDULED_OPERATIONS = "dispatch.scheduled.operations";

    private final MeterRegistry registry;

    public DispatchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDispatch(String messageType, String outcome, Duration duration) {
        Tags tags = Tags.of(
            Tag.of("message.type", messageType),
            Tag.of("outcome", outcome)
        );
        registry.counter(MESSAGES, tags).increment();
        registry.timer(DURATION, tags).record(duration);
    }

    public void recordValidationFailure(String messageType, boolean suspicious) {
        Tags tags = Tags.of(
            Tag.of("message.type", messageType),
            Tag.of("suspicious", Boolean.toString(suspicious))
        );
        registry.counter(VALIDATION_FAILURES, tags).increment();
    }

    public void recordScheduledOperation(String operationType, String outcome, Duration duration) {
        Tags tags = Tags.of(
            Tag.of("operation", operationType),
            Tag.of("outcome", outcome)
        );
        registry.timer(SCHEDULED_OPERATIONS, tags).record(duration);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
