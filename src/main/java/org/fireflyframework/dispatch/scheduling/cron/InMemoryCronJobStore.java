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

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Process local cron job store.
 */
public class InMemoryCronJobStore implements CronJobStore {

    private final Map<String, RecurringCronJob> jobs = new ConcurrentHashMap<>();
    private final Map<String, Deque<CronJobExecution>> history = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCronJobStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCronJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<Void> addJob(RecurringCronJob job) {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(job.getId(), "job.id");
        return Mono.defer(() -> {
            job.setLastModifiedUtc(clock.instant());
            if (jobs.putIfAbsent(job.getId(), job) != null) {
                return Mono.error(new IllegalStateException("Cron job '" + job.getId() + "' already exists"));
            }
            return Mono.empty();
        });
    }

    @Override
    public Mono<Void> updateJob(RecurringCronJob job) {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(job.getId(), "job.id");
        return Mono.fromRunnable(() -> {
            job.setLastModifiedUtc(clock.instant());
            jobs.put(job.getId(), job);
        });
    }

    @Override
    public Mono<Boolean> removeJob(String jobId) {
        return Mono.fromCallable(() -> {
            history.remove(jobId);
            return jobs.remove(jobId) != null;
        });
    }

    @Override
    public Mono<RecurringCronJob> getJob(String jobId) {
        return Mono.fromCallable(() -> jobs.get(jobId));
    }

    @Override
    public Flux<RecurringCronJob> getAllJobs() {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(jobs.values())));
    }

    @Override
    public Flux<RecurringCronJob> getDueJobs(Instant now) {
        Objects.requireNonNull(now, "now");
        return Flux.defer(() -> Flux.fromIterable(jobs.values().stream()
                .filter(job -> job.shouldRunAt(now))
                .filter(job -> job.getNextRunUtc() != null && !job.getNextRunUtc().isAfter(now))
                .sorted(Comparator.comparingInt(RecurringCronJob::getPriority).reversed()
                        .thenComparing(RecurringCronJob::getNextRunUtc))
                .toList()));
    }

    @Override
    public Flux<RecurringCronJob> getJobsByTag(String tag) {
        return Flux.defer(() -> Flux.fromIterable(jobs.values().stream()
                .filter(job -> job.getTags().contains(tag))
                .toList()));
    }

    @Override
    public Mono<Void> recordExecution(String jobId, boolean success, String error) {
        return Mono.fromRunnable(() -> {
            RecurringCronJob job = jobs.get(jobId);
            if (job == null) {
                return;
            }
            Instant now = clock.instant();
            synchronized (job) {
                job.updateRunStatistics(success, error);
                job.setLastRunUtc(now);
                job.setLastModifiedUtc(now);
            }
            history.computeIfAbsent(jobId, k -> new ConcurrentLinkedDeque<>())
                    .addFirst(new CronJobExecution(jobId, now, success, error));
        });
    }

    @Override
    public Flux<CronJobExecution> getJobHistory(String jobId, int limit) {
        return Flux.defer(() -> {
            Deque<CronJobExecution> runs = history.get(jobId);
            if (runs == null) {
                return Flux.empty();
            }
            List<CronJobExecution> snapshot = new ArrayList<>(runs);
            return Flux.fromIterable(snapshot).take(Math.max(limit, 0));
        });
    }

    @Override
    public Mono<Boolean> setEnabled(String jobId, boolean enabled) {
        return Mono.fromCallable(() -> {
            RecurringCronJob job = jobs.get(jobId);
            if (job == null) {
                return false;
            }
            job.setEnabled(enabled);
            job.setLastModifiedUtc(clock.instant());
            return true;
        });
    }
}
