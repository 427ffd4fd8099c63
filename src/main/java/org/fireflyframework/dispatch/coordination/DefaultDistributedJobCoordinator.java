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

import com.fasterxml.jackson.core.JsonProcessingException;
import org.fireflyframework.dispatch.coordination.backend.CoordinationBackend;
import org.fireflyframework.dispatch.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;
import java.util.UUID;

/**
 * {@link DistributedJobCoordinator} on top of a {@link CoordinationBackend}.
 * <p>
 * Key layout below the configured prefix:
 * <ul>
 *   <li>{@code lock:{jobKey}} - owner token of a job lock</li>
 *   <li>{@code leader:{leaderKey}} - id of the leading instance</li>
 *   <li>{@code instance:{instanceId}} - JSON {@link JobInstanceInfo}</li>
 *   <li>{@code instances} - set of registered instance ids</li>
 *   <li>{@code assignment:{jobKey}} - JSON {@link JobAssignment}</li>
 *   <li>{@code completion:{jobKey}} - JSON {@link JobCompletion}</li>
 * </ul>
 * Instance records are updated read-modify-write; concurrent load updates of the same instance
 * may be lost, which only skews the load balancing.
 */
public class DefaultDistributedJobCoordinator implements DistributedJobCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DefaultDistributedJobCoordinator.class);

    private final CoordinationBackend backend;
    private final String instanceId;
    private final CoordinationSettings settings;
    private final Clock clock;

    public DefaultDistributedJobCoordinator(CoordinationBackend backend, String instanceId,
                                            CoordinationSettings settings, Clock clock) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.instanceId = requireNonBlank(instanceId, "instanceId");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String getInstanceId() {
        return instanceId;
    }

    @Override
    public Mono<DistributedJobLock> tryAcquireLock(String jobKey, Duration duration) {
        requireNonBlank(jobKey, "jobKey");
        requirePositive(duration);
        String key = key("lock:", jobKey);
        String token = instanceId + ":" + UUID.randomUUID();
        return Mono.defer(() -> {
            Instant now = clock.instant();
            return backend.setIfAbsent(key, token, duration)
                    .filter(Boolean::booleanValue)
                    .map(acquired -> {
                        log.debug(JsonUtils.json("coordination_event", "lock_acquired", "job_key", jobKey,
                                "instance_id", instanceId));
                        return new DistributedJobLock(backend, jobKey, key, token, instanceId, now,
                                now.plus(duration), settings.lockReleaseTimeout(), clock);
                    });
        });
    }

    @Override
    public Mono<LeadershipToken> tryAcquireLeadership(String leaderKey, Duration duration) {
        requireNonBlank(leaderKey, "leaderKey");
        requirePositive(duration);
        String key = key("leader:", leaderKey);
        return Mono.defer(() -> {
            Instant now = clock.instant();
            return backend.setIfAbsent(key, instanceId, duration)
                    .flatMap(acquired -> acquired ? Mono.just(true) : backend.renew(key, instanceId, duration))
                    .filter(Boolean::booleanValue)
                    .map(acquired -> {
                        log.info(JsonUtils.json("coordination_event", "leadership_acquired",
                                "leader_key", leaderKey, "instance_id", instanceId));
                        return new LeadershipToken(backend, leaderKey, key, instanceId, now, now.plus(duration),
                                settings.lockReleaseTimeout(), clock);
                    });
        });
    }

    @Override
    public Mono<String> getCurrentLeader(String leaderKey) {
        requireNonBlank(leaderKey, "leaderKey");
        return backend.get(key("leader:", leaderKey));
    }

    @Override
    public Mono<Void> registerInstance(JobInstanceInfo instanceInfo) {
        Objects.requireNonNull(instanceInfo, "instanceInfo");
        return writeInstance(instanceInfo)
                .then(backend.addToSet(key("instances"), instanceInfo.instanceId()))
                .doOnSuccess(v -> log.info(JsonUtils.json(
                        "coordination_event", "instance_registered",
                        "instance_id", instanceInfo.instanceId(),
                        "host", instanceInfo.hostName()
                )));
    }

    @Override
    public Mono<Void> unregisterInstance(String id) {
        requireNonBlank(id, "instanceId");
        return backend.delete(key("instance:", id))
                .then(backend.removeFromSet(key("instances"), id))
                .doOnSuccess(v -> log.info(JsonUtils.json("coordination_event", "instance_unregistered",
                        "instance_id", id)));
    }

    @Override
    public Mono<Boolean> heartbeat(String id) {
        requireNonBlank(id, "instanceId");
        return readInstance(id)
                .flatMap(info -> writeInstance(info.withHeartbeat(clock.instant())).thenReturn(true))
                .defaultIfEmpty(false);
    }

    @Override
    public Mono<Boolean> updateInstanceStatus(String id, JobInstanceStatus status) {
        requireNonBlank(id, "instanceId");
        Objects.requireNonNull(status, "status");
        return readInstance(id)
                .flatMap(info -> writeInstance(info.withStatus(status)).thenReturn(true))
                .defaultIfEmpty(false);
    }

    @Override
    public Flux<JobInstanceInfo> getActiveInstances() {
        return backend.members(key("instances")).concatMap(this::readInstance);
    }

    @Override
    public Flux<JobInstanceInfo> getHealthyInstances(Duration staleness) {
        Objects.requireNonNull(staleness, "staleness");
        return Flux.defer(() -> {
            Instant now = clock.instant();
            return getActiveInstances().filter(info -> info.isHealthy(staleness, now));
        });
    }

    @Override
    public Mono<String> distributeJob(String jobKey, String payload) {
        return distributeJob(jobKey, jobKey, payload);
    }

    @Override
    public Mono<String> distributeJob(String jobKey, String jobType, String payload) {
        requireNonBlank(jobKey, "jobKey");
        requireNonBlank(jobType, "jobType");
        return getHealthyInstances(settings.instanceStaleness())
                .filter(info -> info.capabilities().canHandle(jobType))
                .filter(JobInstanceInfo::hasCapacity)
                .sort(Comparator.comparingInt(JobInstanceInfo::activeJobCount)
                        .thenComparing(info -> info.capabilities().priority(), Comparator.reverseOrder())
                        .thenComparing(JobInstanceInfo::instanceId))
                .next()
                .flatMap(target -> {
                    JobAssignment assignment = new JobAssignment(jobKey, jobType, target.instanceId(), payload,
                            clock.instant());
                    return writeInstance(target.withActiveJobCount(target.activeJobCount() + 1))
                            .then(writeJson(key("assignment:", jobKey), assignment, null))
                            .thenReturn(target.instanceId());
                })
                .doOnNext(target -> log.info(JsonUtils.json(
                        "coordination_event", "job_distributed",
                        "job_key", jobKey,
                        "job_type", jobType,
                        "instance_id", target
                )))
                .switchIfEmpty(Mono.fromRunnable(() -> log.warn(JsonUtils.json(
                        "coordination_event", "no_instance_available",
                        "job_key", jobKey,
                        "job_type", jobType
                ))));
    }

    @Override
    public Mono<JobAssignment> getJobAssignment(String jobKey) {
        requireNonBlank(jobKey, "jobKey");
        return readJson(key("assignment:", jobKey), JobAssignment.class);
    }

    @Override
    public Mono<Void> reportJobCompletion(String jobKey, String id, boolean success, String result) {
        requireNonBlank(jobKey, "jobKey");
        requireNonBlank(id, "instanceId");
        return Mono.defer(() -> {
            JobCompletion completion = new JobCompletion(jobKey, id, success, result, clock.instant());
            return writeJson(key("completion:", jobKey), completion, settings.completionRetention())
                    .then(backend.delete(key("assignment:", jobKey)))
                    .then(readInstance(id)
                            .flatMap(info -> writeInstance(info.withActiveJobCount(info.activeJobCount() - 1))))
                    .doOnSuccess(v -> log.info(JsonUtils.json(
                            "coordination_event", "job_completed",
                            "job_key", jobKey,
                            "instance_id", id,
                            "success", success
                    )));
        });
    }

    @Override
    public Mono<JobCompletion> getJobCompletion(String jobKey) {
        requireNonBlank(jobKey, "jobKey");
        return readJson(key("completion:", jobKey), JobCompletion.class);
    }

    private Mono<JobInstanceInfo> readInstance(String id) {
        return readJson(key("instance:", id), JobInstanceInfo.class);
    }

    private Mono<Void> writeInstance(JobInstanceInfo info) {
        return writeJson(key("instance:", info.instanceId()), info, null);
    }

    private <T> Mono<T> readJson(String key, Class<T> type) {
        return backend.get(key).flatMap(json -> Mono.fromCallable(() -> JsonUtils.mapper().readValue(json, type)));
    }

    private Mono<Void> writeJson(String key, Object value, Duration ttl) {
        return Mono.fromCallable(() -> toJson(value)).flatMap(json -> backend.set(key, json, ttl));
    }

    private static String toJson(Object value) throws JsonProcessingException {
        return JsonUtils.mapper().writeValueAsString(value);
    }

    private String key(String part) {
        return settings.keyPrefix() + part;
    }

    private String key(String kind, String id) {
        return settings.keyPrefix() + kind + id;
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        return value;
    }

    private static void requirePositive(Duration duration) {
        Objects.requireNonNull(duration, "duration");
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("duration must be positive");
        }
    }
}
