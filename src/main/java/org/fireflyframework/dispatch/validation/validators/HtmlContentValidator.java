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

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rejects markup and inline script handlers.
 */
public class HtmlContentValidator extends StringPropertyValidator {

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");

    @Override
    protected String check(String propertyPath, String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        if (HTML_TAG.matcher(value).find() || lower.contains("javascript:")
                || lower.contains("onclick") || lower.contains("onerror")) {
            return "Property '" + propertyPath + "' contains prohibited HTML content";
        }
        return null;
    }
}
