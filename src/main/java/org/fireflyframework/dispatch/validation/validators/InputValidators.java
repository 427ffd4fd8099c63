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

import org.fireflyframework.dispatch.validation.InputValidationOptions;
import org.fireflyframework.dispatch.validation.InputValidator;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the built-in validators switched on in {@link InputValidationOptions}.
 */
public final class InputValidators {

    private InputValidators() {
    }

    public static List<InputValidator> fromOptions(InputValidationOptions options) {
        List<InputValidator> validators = new ArrayList<>();
        if (options.getMaxStringLength() > 0) {
            validators.add(new MaxStringLengthValidator(options.getMaxStringLength()));
        }
        if (options.isBlockControlCharacters()) {
            validators.add(new ControlCharacterValidator());
        }
        if (options.isBlockHtmlContent()) {
            validators.add(new HtmlContentValidator());
        }
        if (options.isBlockSqlInjection()) {
            validators.add(new SqlInjectionValidator());
        }
        if (options.isBlockNoSqlInjection()) {
            validators.add(new NoSqlInjectionValidator());
        }
        if (options.isBlockCommandInjection()) {
            validators.add(new CommandInjectionValidator());
        }
        if (options.isBlockPathTraversal()) {
            validators.add(new PathTraversalValidator());
        }
        if (options.isBlockLdapInjection()) {
            validators.add(new LdapInjectionValidator());
        }
        if (options.getMaxMessageSizeBytes() > 0 || options.getMaxObjectDepth() > 0) {
            validators.add(new MessageSizeValidator(options.getMaxMessageSizeBytes(), options.getMaxObjectDepth()));
        }
        return validators;
    }
}
