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

/**
 * One forward action of a saga and the action that undoes it.
 *
 * @param <D> saga data type
 */
public interface SagaStep<D> {

    String name();

    Mono<StepResult> execute(D data);

    /** Undo of a successful {@link #execute}. The default has nothing to undo. */
    default Mono<StepResult> compensate(D data) {
        return Mono.just(StepResult.success());
    }

    /** Governs re-execution of a failed forward action; compensation always runs once. */
    default RetryPolicy retryPolicy() {
        return RetryPolicy.none();
    }

    /** Per attempt bound, {@code null} for none. */
    default Duration timeout() {
        return null;
    }

    /** Delay before the step starts, {@code null} to start immediately. */
    default Duration scheduleAfter() {
        return null;
    }
}
