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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Keeps the local instance registered while the application runs.
 * <p>
 * On start the instance is registered and then heartbeats every interval. On stop it is
 * marked {@link JobInstanceStatus#DRAINING} and unregistered.
 */
public class JobInstanceHeartbeat implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(JobInstanceHeartbeat.class);

    private final DistributedJobCoordinator coordinator;
    private final Supplier<JobInstanceInfo> localInstance;
    private final Duration interval;
    private final Duration shutdownTimeout;

    private volatile Disposable heartbeats;
    private volatile String registeredInstanceId;

    public JobInstanceHeartbeat(DistributedJobCoordinator coordinator, Supplier<JobInstanceInfo> localInstance,
                                Duration interval, Duration shutdownTimeout) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.localInstance = Objects.requireNonNull(localInstance, "localInstance");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    }

    @Override
    public void start() {
        if (isRunning()) {
            return;
        }
        JobInstanceInfo info = localInstance.get();
        registeredInstanceId = info.instanceId();
        heartbeats = coordinator.registerInstance(info)
                .thenMany(Flux.interval(interval))
                .onBackpressureDrop()
                .concatMap(tick -> coordinator.heartbeat(info.instanceId())
                        .onErrorResume(e -> {
                            log.warn(JsonUtils.json(
                                    "coordination_event", "heartbeat_failed",
                                    "instance_id", info.instanceId(),
                                    "error", e
                            ));
                            return Mono.just(false);
                        }))
                .subscribe(
                        beat -> { },
                        e -> log.error(JsonUtils.json(
                                "coordination_event", "registration_failed",
                                "instance_id", info.instanceId(),
                                "error", e
                        )));
    }

    @Override
    public void stop() {
        Disposable current = heartbeats;
        if (current != null) {
            current.dispose();
        }
        heartbeats = null;
        String id = registeredInstanceId;
        if (id == null) {
            return;
        }
        registeredInstanceId = null;
        coordinator.updateInstanceStatus(id, JobInstanceStatus.DRAINING)
                .then(coordinator.unregisterInstance(id))
                .timeout(shutdownTimeout)
                .onErrorResume(e -> {
                    log.warn(JsonUtils.json(
                            "coordination_event", "unregister_failed",
                            "instance_id", id,
                            "error", e
                    ));
                    return Mono.empty();
                })
                .block();
    }

    @Override
    public boolean isRunning() {
        Disposable current = heartbeats;
        return current != null && !current.isDisposed();
    }
}
