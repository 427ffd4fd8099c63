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
package org.fireflyframework.dispatch.scheduling.cron;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Persistence of {@link RecurringCronJob}s and their run history.
 * A {@code null} job is rejected eagerly with {@link NullPointerException}.
 */
public interface CronJobStore {

    /** Fails with {@link IllegalStateException} when a job with the same id exists. */
    Mono<Void> addJob(RecurringCronJob job);

    /** Inserts or replaces the job and stamps its last modification time. */
    Mono<Void> updateJob(RecurringCronJob job);

    /** Removes the job and its history; emits whether it existed. */
    Mono<Boolean> removeJob(String jobId);

    Mono<RecurringCronJob> getJob(String jobId);

    Flux<RecurringCronJob> getAllJobs();

    /**
     * Enabled jobs inside their validity window whose next run is at or before {@code now},
     * highest priority first, then earliest next run.
     */
    Flux<RecurringCronJob> getDueJobs(Instant now);

    Flux<RecurringCronJob> getJobsByTag(String tag);

    /** Updates run statistics and appends to the history. Unknown ids are ignored. */
    Mono<Void> recordExecution(String jobId, boolean success, String error);

    /** Most recent runs first. */
    Flux<CronJobExecution> getJobHistory(String jobId, int limit);

    /** Emits whether the job exists. */
    Mono<Boolean> setEnabled(String jobId, boolean enabled);
}
