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

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Locks, leader election and job distribution across the instances sharing a coordination backend.
 * <p>
 * Key arguments are checked before any backend call: a blank key or instance id fails with
 * {@link IllegalArgumentException}, a {@code null} structured argument with {@link NullPointerException}.
 */
public interface DistributedJobCoordinator {

    /** Identifier this coordinator acquires locks and leadership under. */
    String getInstanceId();

    /** Emits the lock, or completes empty when another owner holds it. */
    Mono<DistributedJobLock> tryAcquireLock(String jobKey, Duration duration);

    /**
     * Emits a leadership token, or completes empty when another instance leads. An instance that
     * already leads has its term renewed.
     */
    Mono<LeadershipToken> tryAcquireLeadership(String leaderKey, Duration duration);

    Mono<String> getCurrentLeader(String leaderKey);

    Mono<Void> registerInstance(JobInstanceInfo instanceInfo);

    Mono<Void> unregisterInstance(String instanceId);

    /** Emits false when the instance is not registered. */
    Mono<Boolean> heartbeat(String instanceId);

    /** Emits false when the instance is not registered. */
    Mono<Boolean> updateInstanceStatus(String instanceId, JobInstanceStatus status);

    /** Every registered instance, whatever its status. */
    Flux<JobInstanceInfo> getActiveInstances();

    Flux<JobInstanceInfo> getHealthyInstances(Duration staleness);

    /** Routes the job with its key used as job type. */
    Mono<String> distributeJob(String jobKey, String payload);

    /**
     * Assigns the job to the healthy instance that supports {@code jobType} and has spare
     * capacity, preferring the least loaded, then the highest priority. Completes empty when
     * no instance qualifies.
     */
    Mono<String> distributeJob(String jobKey, String jobType, String payload);

    Mono<JobAssignment> getJobAssignment(String jobKey);

    Mono<Void> reportJobCompletion(String jobKey, String instanceId, boolean success, String result);

    Mono<JobCompletion> getJobCompletion(String jobKey);
}
