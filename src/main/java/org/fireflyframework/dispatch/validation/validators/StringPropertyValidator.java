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
package org.fireflyframework.dispatch.validation.validators;

import org.fireflyframework.dispatch.core.DispatchMessage;
import org.fireflyframework.dispatch.core.MessageContext;
import org.fireflyframework.dispatch.validation.InputValidationResult;
import org.fireflyframework.dispatch.validation.InputValidator;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Base for validators that check every string property on its own and report one error per
 * offending property.
 */
public abstract class StringPropertyValidator implements InputValidator {

    @Override
    public Mono<InputValidationResult> validate(DispatchMessage message, MessageContext context) {
        return Mono.fromCallable(() -> {
            List<String> errors = new ArrayList<>();
            MessageJson.visitStrings(MessageJson.tree(message), "", false, (path, value) -> {
                String error = check(path, value);
                if (error != null) {
                    errors.add(error);
                }
            });
            return InputValidationResult.failure(errors);
        });
    }

    /**
     * @return the error for this property, or {@code null} when it is acceptable
     */
    protected abstract String check(String propertyPath, String value);
}
