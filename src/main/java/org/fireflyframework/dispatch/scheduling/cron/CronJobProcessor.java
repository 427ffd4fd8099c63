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

import org.fireflyframework.dispatch.scheduling.CronSchedules;
import org.fireflyframework.dispatch.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Poll loop for {@link RecurringCronJob}s.
 * <p>
 * An occurrence older than the missed-execution threshold is treated as missed and handled
 * according to the job's {@link org.fireflyframework.dispatch.scheduling.MissedExecutionBehavior}.
 * Runs are delegated to {@link MessageDispatchJob}; failures are recorded in the store, logged,
 * and never escape the loop.
 */
public class CronJobProcessor implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(CronJobProcessor.class);

    private final CronJobStore store;
    private final MessageDispatchJob dispatchJob;
    private final Duration pollInterval;
    private final Duration missedExecutionThreshold;
    private final int maxCatchUpExecutions;
    private final Clock clock;

    private volatile Disposable polling;

    public CronJobProcessor(CronJobStore store, MessageDispatchJob dispatchJob, Duration pollInterval,
                            Duration missedExecutionThreshold, int maxCatchUpExecutions, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.dispatchJob = Objects.requireNonNull(dispatchJob, "dispatchJob");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.missedExecutionThreshold = Objects.requireNonNull(missedExecutionThreshold, "missedExecutionThreshold");
        if (maxCatchUpExecutions < 1) {
            throw new IllegalArgumentException("maxCatchUpExecutions must be >= 1");
        }
        this.maxCatchUpExecutions = maxCatchUpExecutions;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Validates the job's cron expression, computes its first run and adds it to the store.
     */
    public Mono<Void> schedule(RecurringCronJob job) {
        Objects.requireNonNull(job, "job");
        CronSchedules.parse(job.getCronExpression());
        return Mono.defer(() -> {
            Instant from = job.getStartDate() != null && job.getStartDate().isAfter(clock.instant())
                    ? job.getStartDate().minusNanos(1)
                    : clock.instant();
            job.setNextRunUtc(nextOccurrence(job, from).orElse(null));
            return store.addJob(job);
        });
    }

    /**
     * Runs one polling tick.
     *
     * @return the number of successful job runs
     */
    public Mono<Integer> processDueJobs() {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            return store.getDueJobs(now)
                    .concatMap(job -> processJob(job, now)
                            .onErrorResume(e -> {
                                log.error(JsonUtils.json(
                                        "cron_event", "processing_failed",
                                        "job_id", job.getId(),
                                        "error", e
                                ));
                                return Mono.just(0);
                            }))
                    .reduce(0, Integer::sum);
        });
    }

    private Mono<Integer> processJob(RecurringCronJob job, Instant now) {
        Instant scheduled = job.getNextRunUtc();
        boolean missed = Duration.between(scheduled, now).compareTo(missedExecutionThreshold) > 0;
        if (!missed) {
            return runWithRetry(job, scheduled).flatMap(ok -> reschedule(job.getId(), now).thenReturn(ok ? 1 : 0));
        }
        switch (job.getMissedExecutionBehavior()) {
            case SKIP_MISSED:
                log.info(JsonUtils.json("cron_event", "missed_skipped", "job_id", job.getId(), "scheduled_at", scheduled));
                return reschedule(job.getId(), now).thenReturn(0);
            case DISABLE_SCHEDULE:
                log.warn(JsonUtils.json("cron_event", "missed_disabled", "job_id", job.getId(), "scheduled_at", scheduled));
                return store.setEnabled(job.getId(), false).thenReturn(0);
            case EXECUTE_ALL_MISSED:
                List<Instant> occurrences = missedOccurrences(job, scheduled, now);
                log.info(JsonUtils.json("cron_event", "missed_catch_up", "job_id", job.getId(), "runs", occurrences.size()));
                return Flux.fromIterable(occurrences)
                        .concatMap(at -> runWithRetry(job, at))
                        .filter(Boolean::booleanValue)
                        .count()
                        .flatMap(count -> reschedule(job.getId(), now).thenReturn(count.intValue()));
            case EXECUTE_LATEST_MISSED:
            default:
                List<Instant> all = missedOccurrences(job, scheduled, now);
                Instant latest = all.isEmpty() ? scheduled : all.get(all.size() - 1);
                return runWithRetry(job, latest).flatMap(ok -> reschedule(job.getId(), now).thenReturn(ok ? 1 : 0));
        }
    }

    private List<Instant> missedOccurrences(RecurringCronJob job, Instant first, Instant now) {
        List<Instant> occurrences = new ArrayList<>();
        Instant current = first;
        while (current != null && !current.isAfter(now) && occurrences.size() < maxCatchUpExecutions) {
            occurrences.add(current);
            current = nextOccurrence(job, current).orElse(null);
        }
        return occurrences;
    }

    private Mono<Boolean> runWithRetry(RecurringCronJob job, Instant scheduledTime) {
        int attempts = job.isRetryOnFailure() ? Math.max(1, job.getMaxRetryAttempts()) : 1;
        return attempt(job, scheduledTime, 1, attempts);
    }

    private Mono<Boolean> attempt(RecurringCronJob job, Instant scheduledTime, int attempt, int attempts) {
        return dispatchJob.execute(job, scheduledTime)
                .then(Mono.defer(() -> store.recordExecution(job.getId(), true, null).thenReturn(true)))
                .onErrorResume(e -> {
                    String error = e.getMessage();
                    Mono<Void> recorded = store.recordExecution(job.getId(), false, error);
                    if (attempt < attempts) {
                        log.warn(JsonUtils.json(
                                "cron_event", "retrying",
                                "job_id", job.getId(),
                                "attempt", attempt,
                                "max_attempts", attempts,
                                "error", e
                        ));
                        return recorded.then(Mono.defer(() -> attempt(job, scheduledTime, attempt + 1, attempts)));
                    }
                    log.error(JsonUtils.json(
                            "cron_event", "failed",
                            "job_id", job.getId(),
                            "attempts", attempt,
                            "error", e
                    ));
                    return recorded.thenReturn(false);
                });
    }

    private Mono<Void> reschedule(String jobId, Instant now) {
        return store.getJob(jobId).flatMap(current -> {
            Optional<Instant> next = nextOccurrence(current, now);
            current.setNextRunUtc(next.orElse(null));
            if (next.isEmpty() || (current.getEndDate() != null && next.get().isAfter(current.getEndDate()))) {
                current.setEnabled(false);
            }
            return store.updateJob(current);
        });
    }

    private Optional<Instant> nextOccurrence(RecurringCronJob job, Instant after) {
        return CronSchedules.nextAfter(job.getCronExpression(), job.getTimeZoneId(), after);
    }

    @Override
    public void start() {
        if (polling != null && !polling.isDisposed()) {
            return;
        }
        log.info("Starting cron job processor with poll interval {}", pollInterval);
        polling = Flux.interval(pollInterval)
                .onBackpressureDrop()
                .concatMap(tick -> processDueJobs())
                .subscribe();
    }

    @Override
    public void stop() {
        Disposable current = polling;
        if (current != null) {
            current.dispose();
        }
        polling = null;
        log.info("Cron job processor stopped");
    }

    @Override
    public boolean isRunning() {
        Disposable current = polling;
        return current != null && !current.isDisposed();
    }
}
