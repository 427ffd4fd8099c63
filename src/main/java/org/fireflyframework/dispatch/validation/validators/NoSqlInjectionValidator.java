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

import java.util.regex.Pattern;

/**
 * Rejects MongoDB style query operators in values and in field names.
 */
public class NoSqlInjectionValidator extends InjectionPatternValidator {

    static final Pattern PATTERN = Pattern.compile(
            "(\\$where|\\$regex|\\$ne|\\$gt|\\$lt|\\$gte|\\$lte|\\$in|\\$nin|\\$or|\\$and|\\$not|\\$nor)",
            Pattern.CASE_INSENSITIVE);

    public NoSqlInjectionValidator() {
        super(PATTERN, "Potential NoSQL injection detected", true);
    }
}
