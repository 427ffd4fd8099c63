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
package org.fireflyframework.dispatch.scheduling;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Cron helpers on top of Spring's {@link CronExpression}. Five-field (minute precision)
 * expressions are accepted and run at second 0.
 */
public final class CronSchedules {

    private CronSchedules() {
    }

    /**
     * @throws IllegalArgumentException if the expression is not valid
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression must not be blank");
        }
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        return CronExpression.parse(fields.length == 5 ? "0 " + trimmed : trimmed);
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Next occurrence strictly after {@code after}, evaluated in {@code timeZoneId} (UTC when null).
     */
    public static Optional<Instant> nextAfter(String expression, String timeZoneId, Instant after) {
        ZoneId zone = timeZoneId == null || timeZoneId.isBlank() ? ZoneOffset.UTC : ZoneId.of(timeZoneId);
        ZonedDateTime next = parse(expression).next(after.atZone(zone));
        return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
    }
}
