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
package org.fireflyframework.dispatch.validation;

import java.util.List;

/**
 * Result of one {@link InputValidator}.
 */
public record InputValidationResult(boolean valid, List<String> errors) {

    private static final InputValidationResult SUCCESS = new InputValidationResult(true, List.of());

    public InputValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static InputValidationResult success() {
        return SUCCESS;
    }

    public static InputValidationResult failure(String... errors) {
        return new InputValidationResult(false, List.of(errors));
    }

    public static InputValidationResult failure(List<String> errors) {
        return errors.isEmpty() ? SUCCESS : new InputValidationResult(false, errors);
    }
}
