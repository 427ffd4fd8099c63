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
package org.fireflyframework.dispatch.scheduling;

import org.fireflyframework.dispatch.core.DispatchMessage;
import org.fireflyframework.dispatch.core.Dispatcher;
import org.fireflyframework.dispatch.core.MessageContext;
import org.fireflyframework.dispatch.core.MessageResult;
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
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Background loop that dispatches due {@link ScheduledMessage}s.
 * <p>
 * Each tick loads every schedule, keeps the enabled ones whose next execution has passed
 * and handles them one after the other: resolve the message type, deserialize, dispatch
 * with a context rebuilt from the stored correlation data, then persist the next execution.
 * The next execution is persisted whether the handler succeeded or not, so a failing
 * one-shot schedule runs once. A schedule whose type or payload cannot be resolved, or
 * whose dispatch errors or times out, is left untouched and retried on the next tick.
 * <p>
 * A recurring schedule that has fallen behind by more than one occurrence follows its
 * {@link MissedExecutionBehavior}: {@code SKIP_MISSED} moves to the next future occurrence
 * without dispatching, {@code DISABLE_SCHEDULE} disables it, {@code EXECUTE_LATEST_MISSED}
 * dispatches once and then moves to the next future occurrence, and {@code EXECUTE_ALL_MISSED}
 * dispatches once per tick for every missed occurrence.
 * Every schedule handled is reported to the {@link ScheduleOperationMonitor}.
 */
public class ScheduledMessageService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ScheduledMessageService.class);

    public static final String SCHEDULED_MESSAGE_ID_PROPERTY = "ScheduledMessageId";
    public static final String ORIGINAL_SCHEDULE_TIME_PROPERTY = "OriginalScheduleTime";
    static final String OPERATION_TYPE = "scheduled-dispatch";

    private final ScheduleStore store;
    private final MessageSerializer serializer;
    private final MessageTypeRegistry typeRegistry;
    private final Dispatcher dispatcher;
    private final ScheduleOperationMonitor monitor;
    private final Duration pollInterval;
    private final SchedulerTimeouts timeouts;
    private final Clock clock;

    private volatile Disposable polling;

    public ScheduledMessageService(ScheduleStore store, MessageSerializer serializer, MessageTypeRegistry typeRegistry,
                                   Dispatcher dispatcher, ScheduleOperationMonitor monitor, Duration pollInterval,
                                   SchedulerTimeouts timeouts, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.typeRegistry = Objects.requireNonNull(typeRegistry, "typeRegistry");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs a single polling tick.
     *
     * @return the number of schedules dispatched successfully
     */
    public Mono<Integer> processDueMessages() {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            return store.getAll()
                    .filter(scheduled -> scheduled.isDue(now))
                    .concatMap(this::processScheduled)
                    .filter(Boolean::booleanValue)
                    .count()
                    .map(Long::intValue);
        });
    }

    private Mono<Boolean> processScheduled(ScheduledMessage scheduled) {
        ScheduleOperationMonitor.Operation operation = monitor.start(OPERATION_TYPE);
        return Mono.defer(() -> isMissed(scheduled, clock.instant())
                        ? handleMissed(scheduled)
                        : dispatchScheduled(scheduled))
                .defaultIfEmpty(false)
                .doOnNext(success -> monitor.complete(operation, success, false))
                .onErrorResume(TimeoutException.class, e -> {
                    log.error(JsonUtils.json(
                            "scheduler_event", "timed_out",
                            "schedule_id", scheduled.getId(),
                            "message_name", scheduled.getMessageName()
                    ));
                    monitor.complete(operation, false, true);
                    return Mono.just(false);
                })
                .onErrorResume(e -> {
                    log.error(JsonUtils.json(
                            "scheduler_event", "failed",
                            "schedule_id", scheduled.getId(),
                            "message_name", scheduled.getMessageName(),
                            "error", e
                    ));
                    monitor.complete(operation, false, false);
                    return Mono.just(false);
                });
    }

    private Mono<Boolean> dispatchScheduled(ScheduledMessage scheduled) {
        return Mono.fromCallable(() -> typeRegistry.resolve(scheduled.getMessageName()).orElse(null))
                .timeout(timeouts.typeResolution())
                .flatMap(type -> serializer.deserialize(scheduled.getMessageBody(), type)
                        .timeout(timeouts.deserialization()))
                .flatMap(message -> dispatchAndReschedule(scheduled, message))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn(JsonUtils.json(
                            "scheduler_event", "unresolved_message",
                            "schedule_id", scheduled.getId(),
                            "message_name", scheduled.getMessageName()
                    ));
                    return false;
                }));
    }

    private Mono<Boolean> dispatchAndReschedule(ScheduledMessage scheduled, DispatchMessage message) {
        MessageContext context = contextFor(scheduled, message);
        return dispatcher.dispatch(message, context)
                .timeout(timeouts.dispatch())
                .flatMap(result -> {
                    if (!result.isSuccess()) {
                        logDispatchFailure(scheduled, result);
                    }
                    advance(scheduled);
                    return store.store(scheduled).thenReturn(result.isSuccess());
                });
    }

    private Mono<Boolean> handleMissed(ScheduledMessage scheduled) {
        MissedExecutionBehavior behavior = scheduled.getMissedExecutionBehavior();
        if (behavior == MissedExecutionBehavior.DISABLE_SCHEDULE) {
            scheduled.setEnabled(false);
        } else {
            scheduled.setNextExecutionUtc(firstOccurrenceAfter(scheduled, clock.instant()));
            scheduled.setEnabled(scheduled.getNextExecutionUtc() != null);
        }
        log.warn(JsonUtils.json(
                "scheduler_event", "missed_execution",
                "schedule_id", scheduled.getId(),
                "message_name", scheduled.getMessageName(),
                "behavior", behavior,
                "next_execution", scheduled.getNextExecutionUtc()
        ));
        return store.store(scheduled).thenReturn(false);
    }

    /**
     * A recurring schedule is missed when the occurrence after its due one has passed too.
     * Only {@code SKIP_MISSED} and {@code DISABLE_SCHEDULE} act before dispatching.
     */
    private boolean isMissed(ScheduledMessage scheduled, Instant now) {
        MissedExecutionBehavior behavior = scheduled.getMissedExecutionBehavior();
        if (!scheduled.isRecurring()
                || (behavior != MissedExecutionBehavior.SKIP_MISSED
                && behavior != MissedExecutionBehavior.DISABLE_SCHEDULE)) {
            return false;
        }
        Instant following = occurrenceAfter(scheduled, scheduled.getNextExecutionUtc());
        return following != null && !following.isAfter(now);
    }

    MessageContext contextFor(ScheduledMessage scheduled, DispatchMessage message) {
        MessageContext context = MessageContext.create();
        if (scheduled.getCorrelationId() != null) {
            context.setCorrelationId(scheduled.getCorrelationId());
        }
        context.setTraceParent(scheduled.getTraceParent());
        context.setTenantId(scheduled.getTenantId());
        context.setUserId(scheduled.getUserId());
        context.setMessageType(scheduled.getMessageName());
        context.setMessage(message);
        context.properties().put(SCHEDULED_MESSAGE_ID_PROPERTY, scheduled.getId());
        if (scheduled.getNextExecutionUtc() != null) {
            context.properties().put(ORIGINAL_SCHEDULE_TIME_PROPERTY, scheduled.getNextExecutionUtc().toString());
        }
        return context;
    }

    private void advance(ScheduledMessage scheduled) {
        Instant now = clock.instant();
        scheduled.setLastExecutionUtc(now);
        if (!scheduled.isRecurring()) {
            scheduled.setEnabled(false);
            return;
        }
        Instant next = scheduled.getMissedExecutionBehavior() == MissedExecutionBehavior.EXECUTE_ALL_MISSED
                ? occurrenceAfter(scheduled, scheduled.getNextExecutionUtc())
                : firstOccurrenceAfter(scheduled, now);
        scheduled.setNextExecutionUtc(next);
        scheduled.setEnabled(next != null);
    }

    private Instant occurrenceAfter(ScheduledMessage scheduled, Instant from) {
        if (scheduled.getCronExpression() != null) {
            return CronSchedules.nextAfter(scheduled.getCronExpression(), scheduled.getTimeZoneId(), from)
                    .orElse(null);
        }
        return from.plus(scheduled.getInterval());
    }

    private Instant firstOccurrenceAfter(ScheduledMessage scheduled, Instant now) {
        if (scheduled.getCronExpression() != null) {
            return occurrenceAfter(scheduled, now);
        }
        Duration interval = scheduled.getInterval();
        Instant due = scheduled.getNextExecutionUtc();
        if (due.isAfter(now)) {
            return due;
        }
        long elapsed = Duration.between(due, now).toMillis() / interval.toMillis();
        return due.plus(interval.multipliedBy(elapsed + 1));
    }

    private void logDispatchFailure(ScheduledMessage scheduled, MessageResult result) {
        log.error(JsonUtils.json(
                "scheduler_event", "dispatch_failed",
                "schedule_id", scheduled.getId(),
                "message_name", scheduled.getMessageName(),
                "problem_type", result.problemType(),
                "detail", result.detail()
        ));
    }

    @Override
    public void start() {
        if (polling != null && !polling.isDisposed()) {
            return;
        }
        log.info("Starting scheduled message service with poll interval {}", pollInterval);
        polling = Flux.interval(pollInterval)
                .onBackpressureDrop()
                .concatMap(tick -> processDueMessages()
                        .onErrorResume(e -> {
                            log.error("Scheduled message poll failed", e);
                            return Mono.just(0);
                        }))
                .subscribe();
    }

    @Override
    public void stop() {
        Disposable current = polling;
        if (current != null) {
            current.dispose();
        }
        polling = null;
        store.dispose();
        log.info("Scheduled message service stopped");
    }

    @Override
    public boolean isRunning() {
        Disposable current = polling;
        return current != null && !current.isDisposed();
    }
}
