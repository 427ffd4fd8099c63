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

import org.fireflyframework.dispatch.core.DispatchMessage;
import org.fireflyframework.dispatch.core.MessageContext;
import reactor.core.publisher.Mono;

/**
 * Pluggable check run by {@link InputValidationMiddleware}.
 * Declare a bean of this type to add application specific validation.
 */
public interface InputValidator {

    Mono<InputValidationResult> validate(DispatchMessage message, MessageContext context);

    /** Name used in logs and in the error reported when the validator itself fails. */
    default String name() {
        return getClass().getSimpleName();
    }

    /** Whether a failure of this validator indicates an injection attempt. */
    default boolean detectsInjection() {
        return false;
    }
}
