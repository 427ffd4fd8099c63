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
package org.fireflyframework.dispatch.core;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one dispatch: either success with an optional return value, or a failure
 * described in problem-details form ({@code type}, {@code title}, {@code detail}) with the
 * originating error when there is one.
 */
public final class MessageResult {

    public static final String VALIDATION_PROBLEM_TYPE = "validation";
    public static final String HANDLER_PROBLEM_TYPE = "handler-error";

    private static final MessageResult EMPTY_SUCCESS = new MessageResult(true, null, null, null, null, null, List.of());

    private final boolean success;
    private final Object value;
    private final String problemType;
    private final String title;
    private final String detail;
    private final Throwable error;
    private final List<String> validationErrors;

    private MessageResult(boolean success, Object value, String problemType, String title, String detail,
                          Throwable error, List<String> validationErrors) {
        this.success = success;
        this.value = value;
        this.problemType = problemType;
        this.title = title;
        this.detail = detail;
        this.error = error;
        this.validationErrors = validationErrors;
    }

    public static MessageResult success() {
        return EMPTY_SUCCESS;
    }

    public static MessageResult success(Object value) {
        return value == null ? EMPTY_SUCCESS : new MessageResult(true, value, null, null, null, null, List.of());
    }

    public static MessageResult failure(String problemType, String title, String detail, Throwable error) {
        return new MessageResult(false, null, problemType, title, detail, error, List.of());
    }

    public static MessageResult failure(Throwable error) {
        return failure(HANDLER_PROBLEM_TYPE, error.getClass().getSimpleName(), error.getMessage(), error);
    }

    public static MessageResult validationFailed(List<String> errors) {
        List<String> copy = List.copyOf(errors);
        return new MessageResult(false, null, VALIDATION_PROBLEM_TYPE, "Validation failed",
                String.join("; ", copy), null, copy);
    }

    public boolean isSuccess() { return success; }

    public boolean isValidationFailure() { return VALIDATION_PROBLEM_TYPE.equals(problemType); }

    public Optional<Object> value() { return Optional.ofNullable(value); }

    public <T> Optional<T> valueAs(Class<T> type) {
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public String problemType() { return problemType; }
    public String title() { return title; }
    public String detail() { return detail; }
    public Throwable error() { return error; }
    public List<String> validationErrors() { return validationErrors; }

    @Override
    public String toString() {
        return success
                ? "MessageResult{success, value=" + value + "}"
                : "MessageResult{failure, type='" + problemType + "', title='" + title + "', detail='" + detail + "'}";
    }
}
