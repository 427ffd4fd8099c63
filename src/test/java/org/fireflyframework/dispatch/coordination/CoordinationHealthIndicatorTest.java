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

import org.fireflyframework.dispatch.coordination.backend.CoordinationBackend;
import org.fireflyframework.dispatch.coordination.backend.InMemoryCoordinationBackend;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CoordinationHealthIndicatorTest {

    private final Clock clock = Clock.systemUTC();

    @Test
    void upWithInstanceCounts() {
        InMemoryCoordinationBackend backend = new InMemoryCoordinationBackend(clock);
        DefaultDistributedJobCoordinator coordinator =
                new DefaultDistributedJobCoordinator(backend, "node-a", CoordinationSettings.defaults(), clock);
        coordinator.registerInstance(JobInstanceInfo.create("node-a", "h", JobInstanceCapabilities.any(1),
                clock.instant())).block();
        coordinator.registerInstance(JobInstanceInfo.create("node-b", "h", JobInstanceCapabilities.any(1),
                clock.instant().minus(Duration.ofMinutes(5)))).block();

        Health health = new CoordinationHealthIndicator(backend, coordinator, Duration.ofSeconds(30)).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("instance.id", "node-a")
                .containsEntry("instances.registered", 2)
                .containsEntry("instances.healthy", 1L);
    }

    @Test
    void downWhenBackendUnreachable() {
        CoordinationBackend backend = mock(CoordinationBackend.class);
        when(backend.ping()).thenReturn(Mono.error(new IllegalStateException("connection refused")));
        DistributedJobCoordinator coordinator = mock(DistributedJobCoordinator.class);

        Health health = new CoordinationHealthIndicator(backend, coordinator, Duration.ofSeconds(30)).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("reachable", false);
    }
}
