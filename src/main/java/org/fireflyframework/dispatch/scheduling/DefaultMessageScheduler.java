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
import org.fireflyframework.dispatch.core.MessageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;

public class DefaultMessageScheduler implements MessageScheduler {

    private static final Logger log = LoggerFactory.getLogger(DefaultMessageScheduler.class);

    private final ScheduleStore store;
    private final MessageSerializer serializer;
    private final MessageTypeRegistry typeRegistry;
    private final Clock clock;

    public DefaultMessageScheduler(ScheduleStore store, MessageSerializer serializer,
                                   MessageTypeRegistry typeRegistry, Clock clock) {
        this.store = store;
        this.serializer = serializer;
        this.typeRegistry = typeRegistry;
        this.clock = clock;
    }

    @Override
    public Mono<String> scheduleOnce(DispatchMessage message, Instant at, MessageContext context) {
        Objects.requireNonNull(at, "at");
        return schedule(message, context, scheduled -> scheduled.setNextExecutionUtc(at));
    }

    @Override
    public Mono<String> scheduleRecurring(DispatchMessage message, Duration interval, MessageContext context) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        return schedule(message, context, scheduled -> {
            scheduled.setInterval(interval);
            scheduled.setNextExecutionUtc(clock.instant().plus(interval));
        });
    }

    @Override
    public Mono<String> scheduleCron(DispatchMessage message, String cronExpression, ZoneId zone,
                                     MessageContext context) {
        CronSchedules.parse(cronExpression);
        String zoneId = zone != null ? zone.getId() : null;
        Instant first = CronSchedules.nextAfter(cronExpression, zoneId, clock.instant())
                .orElseThrow(() -> new IllegalArgumentException("Cron expression '" + cronExpression
                        + "' has no future occurrence"));
        return schedule(message, context, scheduled -> {
            scheduled.setCronExpression(cronExpression);
            scheduled.setTimeZoneId(zoneId);
            scheduled.setNextExecutionUtc(first);
        });
    }

    @Override
    public Mono<Void> cancel(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId");
        return store.complete(scheduleId)
                .doOnSuccess(v -> log.debug("Cancelled schedule {}", scheduleId));
    }

    private Mono<String> schedule(DispatchMessage message, MessageContext context,
                                  Consumer<ScheduledMessage> timing) {
        Objects.requireNonNull(message, "message");
        String messageName = typeRegistry.nameOf(message.getClass())
                .orElseGet(() -> typeRegistry.register(message.getClass()));
        return serializer.serialize(message).flatMap(body -> {
            ScheduledMessage scheduled = new ScheduledMessage();
            scheduled.setId(UUID.randomUUID().toString());
            scheduled.setMessageName(messageName);
            scheduled.setMessageBody(body);
            if (context != null) {
                scheduled.setCorrelationId(context.correlationId());
                scheduled.setTraceParent(context.traceParent());
                scheduled.setTenantId(context.tenantId());
                scheduled.setUserId(context.userId());
            }
            timing.accept(scheduled);
            log.debug("Scheduling {} as {} (next: {})", messageName, scheduled.getId(), scheduled.getNextExecutionUtc());
            return store.store(scheduled).thenReturn(scheduled.getId());
        });
    }
}
