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

import org.fireflyframework.dispatch.core.DispatchException;

import java.util.List;

/**
 * Raised when a message fails input validation. Carries every collected error.
 */
public class InputValidationException extends DispatchException {

    private final List<String> errors;

    public InputValidationException(String message, List<String> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    public InputValidationException(List<String> errors) {
        this("Input validation failed with " + errors.size() + " errors", errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
