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

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronSchedulesTest {

    @Test
    void fiveFieldExpressionsGetASecondsField() {
        assertThat(CronSchedules.nextAfter("*/15 * * * *", null, Instant.parse("2024-05-01T10:07:30Z")))
                .contains(Instant.parse("2024-05-01T10:15:00Z"));
    }

    @Test
    void sixFieldExpressionsAreUsedAsIs() {
        assertThat(CronSchedules.nextAfter("30 0 12 * * *", "UTC", Instant.parse("2024-05-01T10:00:00Z")))
                .contains(Instant.parse("2024-05-01T12:00:30Z"));
    }

    @Test
    void occurrencesAreComputedInTheGivenZone() {
        // 09:00 in New York is 13:00 UTC during daylight saving time
        assertThat(CronSchedules.nextAfter("0 9 * * *", "America/New_York", Instant.parse("2024-07-01T00:00:00Z")))
                .contains(Instant.parse("2024-07-01T13:00:00Z"));
    }

    @Test
    void validity() {
        assertThat(CronSchedules.isValid("0 0 * * MON-FRI")).isTrue();
        assertThat(CronSchedules.isValid("not a cron")).isFalse();
        assertThat(CronSchedules.isValid("")).isFalse();
        assertThat(CronSchedules.isValid(null)).isFalse();
        assertThatThrownBy(() -> CronSchedules.parse("61 * * * *")).isInstanceOf(IllegalArgumentException.class);
    }
}
