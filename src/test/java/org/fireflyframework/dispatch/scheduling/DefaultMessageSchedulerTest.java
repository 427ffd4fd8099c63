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

import org.fireflyframework.dispatch.MutableClock;
import org.fireflyframework.dispatch.core.DispatchMessage;
import org.fireflyframework.dispatch.core.MessageContext;
import org.fireflyframework.dispatch.util.JsonUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultMessageSchedulerTest {

    record SendReminder(String customerId, String text) implements DispatchMessage {}

    private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
    private InMemoryScheduleStore store;
    private MessageTypeRegistry typeRegistry;
    private DefaultMessageScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new InMemoryScheduleStore();
        typeRegistry = new MessageTypeRegistry();
        scheduler = new DefaultMessageScheduler(store, new JacksonMessageSerializer(JsonUtils.mapper()), typeRegistry,
                clock);
    }

    private ScheduledMessage stored(String id) {
        return store.getAll().filter(s -> s.getId().equals(id)).blockFirst();
    }

    @Test
    void scheduleOnceStoresSerializedMessageWithContext() {
        MessageContext ctx = MessageContext.create();
        ctx.setTenantId("tenant-1");
        Instant at = Instant.parse("2024-05-02T08:00:00Z");

        String id = scheduler.scheduleOnce(new SendReminder("c-1", "pay invoice"), at, ctx).block();

        ScheduledMessage scheduled = stored(id);
        assertThat(scheduled.getNextExecutionUtc()).isEqualTo(at);
        assertThat(scheduled.isRecurring()).isFalse();
        assertThat(scheduled.getMessageName()).isEqualTo(SendReminder.class.getName());
        assertThat(scheduled.getMessageBody()).contains("\"customerId\":\"c-1\"");
        assertThat(scheduled.getCorrelationId()).isEqualTo(ctx.correlationId());
        assertThat(scheduled.getTenantId()).isEqualTo("tenant-1");
        assertThat(typeRegistry.resolve(SendReminder.class.getName())).contains(SendReminder.class);
    }

    @Test
    void scheduleRecurringStartsOneIntervalFromNow() {
        String id = scheduler.scheduleRecurring(new SendReminder("c-1", "x"), Duration.ofHours(1), null).block();

        ScheduledMessage scheduled = stored(id);
        assertThat(scheduled.getInterval()).isEqualTo(Duration.ofHours(1));
        assertThat(scheduled.getNextExecutionUtc()).isEqualTo(Instant.parse("2024-05-01T11:00:00Z"));
        assertThat(scheduled.isRecurring()).isTrue();
    }

    @Test
    void scheduleCronComputesFirstOccurrenceInZone() {
        String id = scheduler.scheduleCron(new SendReminder("c-1", "x"), "0 12 * * *", ZoneId.of("Europe/Madrid"), null)
                .block();

        ScheduledMessage scheduled = stored(id);
        assertThat(scheduled.getCronExpression()).isEqualTo("0 12 * * *");
        assertThat(scheduled.getTimeZoneId()).isEqualTo("Europe/Madrid");
        // noon in Madrid is 10:00 UTC in May; the current instant is excluded
        assertThat(scheduled.getNextExecutionUtc()).isEqualTo(Instant.parse("2024-05-02T10:00:00Z"));
    }

    @Test
    void invalidArgumentsAreRejected() {
        assertThatThrownBy(() -> scheduler.scheduleRecurring(new SendReminder("c", "x"), Duration.ZERO, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> scheduler.scheduleCron(new SendReminder("c", "x"), "bogus", null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cancelRemovesSchedule() {
        String id = scheduler.scheduleOnce(new SendReminder("c-1", "x"), clock.instant(), null).block();

        StepVerifier.create(scheduler.cancel(id)).verifyComplete();

        StepVerifier.create(store.getAll()).verifyComplete();
    }
}
