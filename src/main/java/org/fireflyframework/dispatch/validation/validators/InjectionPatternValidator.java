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

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * Base for validators that reject a message when any of its string values matches an attack
 * pattern. A match yields one error per message, not one per value.
 */
public abstract class InjectionPatternValidator implements InputValidator {

    private final Pattern pattern;
    private final String error;
    private final boolean includeFieldNames;

    protected InjectionPatternValidator(Pattern pattern, String error, boolean includeFieldNames) {
        this.pattern = pattern;
        this.error = error;
        this.includeFieldNames = includeFieldNames;
    }

    @Override
    public Mono<InputValidationResult> validate(DispatchMessage message, MessageContext context) {
        return Mono.fromCallable(() -> {
            AtomicBoolean matched = new AtomicBoolean(false);
            MessageJson.visitStrings(MessageJson.tree(message), "", includeFieldNames, (path, value) -> {
                if (!matched.get() && pattern.matcher(value).find()) {
                    matched.set(true);
                }
            });
            return matched.get() ? InputValidationResult.failure(error) : InputValidationResult.success();
        });
    }

    @Override
    public boolean detectsInjection() {
        return true;
    }
}
