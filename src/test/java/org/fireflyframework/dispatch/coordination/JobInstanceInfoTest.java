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

package org.fireflyframework.dispatch.coordination;

import org.fireflyframework.dispatch.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobInstanceInfoTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void healthRequiresActiveStatusAndFreshHeartbeat() {
        JobInstanceInfo info = JobInstanceInfo.create("node-1", "host-a", JobInstanceCapabilities.any(4), NOW);

        assertThat(info.isHealthy(Duration.ofSeconds(30), NOW.plusSeconds(29))).isTrue();
        assertThat(info.isHealthy(Duration.ofSeconds(30), NOW.plusSeconds(30))).isFalse();
        assertThat(info.withStatus(JobInstanceStatus.DRAINING).isHealthy(Duration.ofSeconds(30), NOW)).isFalse();
    }

    @Test
    void capacityAndCountClamping() {
        JobInstanceInfo info = JobInstanceInfo.create("node-1", "host-a", JobInstanceCapabilities.any(2), NOW);

        assertThat(info.hasCapacity()).isTrue();
        assertThat(info.withActiveJobCount(2).hasCapacity()).isFalse();
        assertThat(info.withActiveJobCount(-3).activeJobCount()).isZero();
    }

    @Test
    void capabilitiesMatchJobTypes() {
        assertThat(JobInstanceCapabilities.any(1).canHandle("reports")).isTrue();
        JobInstanceCapabilities specific = JobInstanceCapabilities.of(1, "billing", "reports");
        assertThat(specific.canHandle("reports")).isTrue();
        assertThat(specific.canHandle("emails")).isFalse();
        assertThat(specific.canHandle("Reports")).isFalse();
        assertThat(specific.withPriority(7).priority()).isEqualTo(7);
        assertThatThrownBy(() -> JobInstanceCapabilities.any(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void invalidInstancesAreRejected() {
        assertThatThrownBy(() -> JobInstanceInfo.create(" ", "h", JobInstanceCapabilities.any(1), NOW))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobInstanceInfo("n", "h", JobInstanceCapabilities.any(1), null, -1, NOW, NOW))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new JobInstanceInfo("n", "h", JobInstanceCapabilities.any(1), null, 0, NOW, NOW).status())
                .isEqualTo(JobInstanceStatus.ACTIVE);
    }

    @Test
    void survivesJsonRoundTrip() throws Exception {
        JobInstanceInfo info = new JobInstanceInfo("node-1", "host-a",
                new JobInstanceCapabilities(3, Set.of("billing"), 2, Set.of("eu")), JobInstanceStatus.ACTIVE, 1,
                NOW, NOW.plusSeconds(5));

        String json = JsonUtils.mapper().writeValueAsString(info);

        assertThat(json).doesNotContain("capacity");
        assertThat(JsonUtils.mapper().readValue(json, JobInstanceInfo.class)).isEqualTo(info);
    }
}
