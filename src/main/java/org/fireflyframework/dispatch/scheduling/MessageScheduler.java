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
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Schedules messages for later dispatch by {@link ScheduledMessageService}. Every method
 * returns the id of the created schedule. Correlation, trace, tenant and user data are taken
 * from {@code context} when one is given.
 */
public interface MessageScheduler {

    Mono<String> scheduleOnce(DispatchMessage message, Instant at, MessageContext context);

    Mono<String> scheduleRecurring(DispatchMessage message, Duration interval, MessageContext context);

    Mono<String> scheduleCron(DispatchMessage message, String cronExpression, ZoneId zone, MessageContext context);

    Mono<Void> cancel(String scheduleId);
}
