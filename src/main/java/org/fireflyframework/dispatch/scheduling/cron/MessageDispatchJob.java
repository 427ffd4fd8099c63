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

import org.fireflyframework.dispatch.core.Dispatcher;
import org.fireflyframework.dispatch.core.MessageContext;
import org.fireflyframework.dispatch.scheduling.MessageSerializer;
import org.fireflyframework.dispatch.scheduling.MessageTypeRegistry;
import org.fireflyframework.dispatch.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Objects;

/**
 * Runs a {@link RecurringCronJob} by dispatching its stored message.
 * <p>
 * Unlike the processor that drives it, this job never swallows a failure: an unknown
 * message type, an unreadable payload, a failed result or a dispatcher error all
 * terminate the returned {@code Mono} with an error.
 */
public class MessageDispatchJob {

    private static final Logger log = LoggerFactory.getLogger(MessageDispatchJob.class);

    public static final String CRON_JOB_ID_PROPERTY = "CronJobId";
    public static final String SCHEDULED_TIME_PROPERTY = "ScheduledTime";

    private final MessageTypeRegistry typeRegistry;
    private final MessageSerializer serializer;
    private final Dispatcher dispatcher;

    public MessageDispatchJob(MessageTypeRegistry typeRegistry, MessageSerializer serializer, Dispatcher dispatcher) {
        this.typeRegistry = Objects.requireNonNull(typeRegistry, "typeRegistry");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    public Mono<Void> execute(RecurringCronJob job, Instant scheduledTime) {
        Objects.requireNonNull(job, "job");
        return Mono.defer(() -> {
            var type = typeRegistry.resolve(job.getMessageTypeName()).orElse(null);
            if (type == null) {
                return Mono.error(new JobExecutionException(job.getId(),
                        "Unknown message type '" + job.getMessageTypeName() + "' for cron job " + job.getId()));
            }
            return serializer.deserialize(job.getMessagePayload(), type)
                    .switchIfEmpty(Mono.error(() -> new JobExecutionException(job.getId(),
                            "Payload of cron job " + job.getId() + " could not be read")))
                    .flatMap(message -> {
                        MessageContext context = MessageContext.create();
                        context.setMessageType(job.getMessageTypeName());
                        context.setMessage(message);
                        context.properties().putAll(job.getMetadata());
                        context.properties().put(CRON_JOB_ID_PROPERTY, job.getId());
                        if (scheduledTime != null) {
                            context.properties().put(SCHEDULED_TIME_PROPERTY, scheduledTime.toString());
                        }
                        log.debug(JsonUtils.json(
                                "cron_event", "dispatching",
                                "job_id", job.getId(),
                                "message_type", job.getMessageTypeName(),
                                "correlation_id", context.correlationId()
                        ));
                        return dispatcher.dispatch(message, context);
                    })
                    .flatMap(result -> result.isSuccess()
                            ? Mono.<Void>empty()
                            : Mono.error(new JobExecutionException(job.getId(),
                                    "Cron job " + job.getId() + " failed: " + result.detail(), result.error())))
                    .onErrorMap(e -> !(e instanceof JobExecutionException),
                            e -> new JobExecutionException(job.getId(),
                                    "Cron job " + job.getId() + " failed: " + e.getMessage(), e));
        });
    }
}
