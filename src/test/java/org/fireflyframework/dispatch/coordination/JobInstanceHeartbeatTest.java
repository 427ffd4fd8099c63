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

import org.fireflyframework.dispatch.coordination.backend.InMemoryCoordinationBackend;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class JobInstanceHeartbeatTest {

    private final Clock clock = Clock.systemUTC();
    private final DefaultDistributedJobCoordinator coordinator = new DefaultDistributedJobCoordinator(
            new InMemoryCoordinationBackend(clock), "worker-1", CoordinationSettings.defaults(), clock);

    @Test
    void registersBeatsAndUnregistersOnStop() {
        Instant registeredAt = clock.instant().minusSeconds(60);
        JobInstanceHeartbeat heartbeat = new JobInstanceHeartbeat(coordinator,
                () -> JobInstanceInfo.create("worker-1", "host-1", JobInstanceCapabilities.any(4), registeredAt),
                Duration.ofMillis(50), Duration.ofSeconds(2));

        heartbeat.start();

        assertThat(heartbeat.isRunning()).isTrue();
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(coordinator.getActiveInstances().collectList().block())
                        .singleElement()
                        .satisfies(info -> assertThat(info.lastHeartbeat()).isAfter(registeredAt)));

        heartbeat.stop();

        assertThat(heartbeat.isRunning()).isFalse();
        assertThat(coordinator.getActiveInstances().collectList().block()).isEmpty();
    }

    @Test
    void stopWithoutStartIsHarmless() {
        JobInstanceHeartbeat heartbeat = new JobInstanceHeartbeat(coordinator,
                () -> JobInstanceInfo.create("worker-1", "host-1", JobInstanceCapabilities.any(4), clock.instant()),
                Duration.ofSeconds(10), Duration.ofSeconds(1));

        heartbeat.stop();

        assertThat(heartbeat.isRunning()).isFalse();
    }
}
