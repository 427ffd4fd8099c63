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

import java.util.Optional;

/**
 * Immutable outcome of one saga step or compensation.
 */
public final class StepResult {

    private static final StepResult SUCCESS = new StepResult(true, null, null, null);

    private final boolean success;
    private final String errorMessage;
    private final Throwable exception;
    private final Object outputData;

    private StepResult(boolean success, String errorMessage, Throwable exception, Object outputData) {
        this.success = success;
        this.errorMessage = errorMessage;
        this.exception = exception;
        this.outputData = outputData;
    }

    public static StepResult success() {
        return SUCCESS;
    }

    public static StepResult success(Object outputData) {
        return new StepResult(true, null, null, outputData);
    }

    public static StepResult failure(String errorMessage) {
        return new StepResult(false, errorMessage, null, null);
    }

    public static StepResult failure(String errorMessage, Throwable exception) {
        return new StepResult(false, errorMessage, exception, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Throwable exception() {
        return exception;
    }

    public Optional<Object> outputData() {
        return Optional.ofNullable(outputData);
    }

    @Override
    public String toString() {
        return success ? "StepResult{success}" : "StepResult{failure='" + errorMessage + "'}";
    }
}
