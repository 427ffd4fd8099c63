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

import java.util.List;
import java.util.Objects;

/**
 * Named, ordered list of steps. Build one with {@link SagaBuilder}.
 */
public final class SagaDefinition<D> {

    private final String name;
    private final List<SagaStep<D>> steps;

    public SagaDefinition(String name, List<SagaStep<D>> steps) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Saga name must not be blank");
        }
        this.name = name;
        this.steps = List.copyOf(Objects.requireNonNull(steps, "steps"));
    }

    public String getName() {
        return name;
    }

    public List<SagaStep<D>> getSteps() {
        return steps;
    }
}
