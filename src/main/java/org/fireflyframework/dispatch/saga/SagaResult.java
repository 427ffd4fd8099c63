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

import java.time.Duration;
import java.util.List;

/**
 * Final view of a saga execution. Only {@link SagaState#COMPLETED} counts as success; a saga
 * that compensated cleanly still reports failure.
 */
public record SagaResult<D>(String sagaId, String sagaType, SagaState state, D data, List<SagaActivity> activities,
                            Duration duration, String failedStep, String errorMessage) {

    public static <D> SagaResult<D> from(SagaInstance<D> instance) {
        return new SagaResult<>(instance.getSagaId(), instance.getSagaType(), instance.getState(), instance.getData(),
                instance.getActivities(), instance.getDuration(), instance.getFailedStep(), instance.getErrorMessage());
    }

    public boolean isSuccess() {
        return state == SagaState.COMPLETED;
    }
}
