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
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;

import java.time.Duration;
import java.util.List;

/**
 * Actuator health of the coordination backend: reachability plus the registered and healthy
 * instance counts.
 */
public class CoordinationHealthIndicator extends AbstractHealthIndicator {

    private static final Duration CHECK_TIMEOUT = Duration.ofSeconds(2);

    private final CoordinationBackend backend;
    private final DistributedJobCoordinator coordinator;
    private final Duration staleness;

    public CoordinationHealthIndicator(CoordinationBackend backend, DistributedJobCoordinator coordinator,
                                       Duration staleness) {
        super("Coordination health check failed");
        this.backend = backend;
        this.coordinator = coordinator;
        this.staleness = staleness;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) {
        Boolean reachable = backend.ping().onErrorReturn(false).block(CHECK_TIMEOUT);
        if (!Boolean.TRUE.equals(reachable)) {
            builder.down()
                    .withDetail("backend", backend.getClass().getSimpleName())
                    .withDetail("reachable", false);
            return;
        }
        List<JobInstanceInfo> instances = coordinator.getActiveInstances().collectList().block(CHECK_TIMEOUT);
        long healthy = instances == null ? 0 : instances.stream().filter(i -> i.isHealthy(staleness)).count();
        builder.up()
                .withDetail("backend", backend.getClass().getSimpleName())
                .withDetail("reachable", true)
                .withDetail("instance.id", coordinator.getInstanceId())
                .withDetail("instances.registered", instances == null ? 0 : instances.size())
                .withDetail("instances.healthy", healthy);
    }
}
