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

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.dispatch.MutableClock;
import org.fireflyframework.dispatch.core.DispatchMessage;
import org.fireflyframework.dispatch.core.Dispatcher;
import org.fireflyframework.dispatch.core.MessageContext;
import org.fireflyframework.dispatch.core.MessageResult;
import org.fireflyframework.dispatch.pipeline.observability.DispatchMetrics;
import org.fireflyframework.dispatch.util.JsonUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduledMessageServiceTest {

    record ExpireCart(String cartId) implements DispatchMessage {}

    @Mock
    Dispatcher dispatcher;

    private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private InMemoryScheduleStore store;
    private MessageTypeRegistry typeRegistry;
    private DefaultMessageScheduler scheduler;
    private ScheduledMessageService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryScheduleStore();
        typeRegistry = new MessageTypeRegistry();
        JacksonMessageSerializer serializer = new JacksonMessageSerializer(JsonUtils.mapper());
        scheduler = new DefaultMessageScheduler(store, serializer, typeRegistry, clock);
        service = new ScheduledMessageService(store, serializer, typeRegistry, dispatcher,
                new MicrometerScheduleOperationMonitor(new DispatchMetrics(meterRegistry)), Duration.ofSeconds(10),
                new SchedulerTimeouts(Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofMillis(200)), clock);
    }

    private ScheduledMessage only() {
        return store.getAll().single().block();
    }

    @Test
    void dueOneShotMessageIsDispatchedOnceWithScheduleProperties() {
        MessageContext origin = MessageContext.create();
        origin.setTenantId("tenant-7");
        String id = scheduler.scheduleOnce(new ExpireCart("cart-1"), clock.instant(), origin).block();
        when(dispatcher.dispatch(any(), any())).thenReturn(Mono.just(MessageResult.success()));

        StepVerifier.create(service.processDueMessages()).expectNext(1).verifyComplete();
        StepVerifier.create(service.processDueMessages()).expectNext(0).verifyComplete();

        ArgumentCaptor<DispatchMessage> message = ArgumentCaptor.forClass(DispatchMessage.class);
        ArgumentCaptor<MessageContext> context = ArgumentCaptor.forClass(MessageContext.class);
        verify(dispatcher).dispatch(message.capture(), context.capture());
        assertThat(message.getValue()).isEqualTo(new ExpireCart("cart-1"));
        assertThat(context.getValue().correlationId()).isEqualTo(origin.correlationId());
        assertThat(context.getValue().tenantId()).isEqualTo("tenant-7");
        assertThat(context.getValue().properties())
                .containsEntry(ScheduledMessageService.SCHEDULED_MESSAGE_ID_PROPERTY, id)
                .containsEntry(ScheduledMessageService.ORIGINAL_SCHEDULE_TIME_PROPERTY, "2024-05-01T10:00:00Z");
        assertThat(only().isEnabled()).isFalse();
        assertThat(only().getLastExecutionUtc()).isEqualTo(clock.instant());
    }

    @Test
    void futureMessagesAreNotDispatched() {
        scheduler.scheduleOnce(new ExpireCart("cart-1"), clock.instant().plusSeconds(60), null).block();

        StepVerifier.create(service.processDueMessages()).expectNext(0).verifyComplete();

        verify(dispatcher, never()).dispatch(any(), any());
    }

    @Test
    void intervalScheduleAdvancesByInterval() {
        scheduler.scheduleRecurring(new ExpireCart("cart-1"), Duration.ofMinutes(5), null).block();
        when(dispatcher.dispatch(any(), any())).thenReturn(Mono.just(MessageResult.success()));
        clock.advance(Duration.ofMinutes(5));

        StepVerifier.create(service.processDueMessages()).expectNext(1).verifyComplete();

        assertThat(only().getNextExecutionUtc()).isEqualTo(Instant.parse("2024-05-01T10:10:00Z"));
        assertThat(only().isEnabled()).isTrue();
    }

    @Test
    void cronScheduleAdvancesToNextOccurrence() {
        scheduler.scheduleCron(new ExpireCart("cart-1"), "0 * * * *", null, null).block();
        when(dispatcher.dispatch(any(), any())).thenReturn(Mono.just(MessageResult.success()));
        clock.set(Instant.parse("2024-05-01T11:00:10Z"));

        StepVerifier.create(service.processDueMessages()).expectNext(1).verifyComplete();

        assertThat(only().getNextExecutionUtc()).isEqualTo(Instant.parse("2024-05-01T12:00:00Z"));
    }

    @Test
    void failingOneShotIsDispatchedOnceAndDisabled() {
        scheduler.scheduleOnce(new ExpireCart("cart-1"), clock.instant(), null).block();
        when(dispatcher.dispatch(any(), any()))
                .thenReturn(Mono.just(MessageResult.failure(new IllegalStateException("db down"))));

        for (int tick = 0; tick < 5; tick++) {
            StepVerifier.create(service.processDueMessages()).expectNext(0).verifyComplete();
            clock.advance(Duration.ofSeconds(10));
        }

        verify(dispatcher, times(1)).dispatch(any(), any());
        assertThat(only().isEnabled()).isFalse();
        assertThat(only().getLastExecutionUtc()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(meterRegistry.get(DispatchMetrics.SCHEDULED_OPERATIONS).tags("outcome", "failure").timer().count())
                .isEqualTo(1L);
    }

    @Test
    void failingRecurringScheduleStillAdvances() {
        scheduler.scheduleRecurring(new ExpireCart("cart-1"), Duration.ofMinutes(5), null).block();
        when(dispatcher.dispatch(any(), any()))
                .thenReturn(Mono.just(MessageResult.failure(new IllegalStateException("db down"))));
        clock.advance(Duration.ofMinutes(5));

        StepVerifier.create(service.processDueMessages()).expectNext(0).verifyComplete();

        assertThat(only().getNextExecutionUtc()).isEqualTo(Instant.parse("2024-05-01T10:10:00Z"));
        assertThat(only().isEnabled()).isTrue();
    }

    private void fallBehind(MissedExecutionBehavior behavior) {
        scheduler.scheduleRecurring(new ExpireCart("cart-1"), Duration.ofMinutes(5), null).block();
        ScheduledMessage scheduled = only();
        scheduled.setMissedExecutionBehavior(behavior);
        store.store(scheduled).block();
        clock.set(Instant.parse("2024-05-01T10:17:00Z"));
    }

    @Test
    void skipMissedMovesToNextFutureOccurrenceWithoutDispatching() {
        fallBehind(MissedExecutionBehavior.SKIP_MISSED);

        StepVerifier.create(service.processDueMessages()).expectNext(0).verifyComplete();

        verify(dispatcher, never()).dispatch(any(), any());
        assertThat(only().getNextExecutionUtc()).isEqualTo(Instant.parse("2024-05-01T10:20:00Z"));
        assertThat(only().isEnabled()).isTrue();
    }

    @Test
    void disableScheduleStopsAScheduleThatFellBehind() {
        fallBehind(MissedExecutionBehavior.DISABLE_SCHEDULE);

        StepVerifier.create(service.processDueMessages()).expectNext(0).verifyComplete();

        verify(dispatcher, never()).dispatch(any(), any());
        assertThat(only().isEnabled()).isFalse();
    }

    @Test
    void executeLatestMissedDispatchesOnceThenCatchesUp() {
        fallBehind(MissedExecutionBehavior.EXECUTE_LATEST_MISSED);
        when(dispatcher.dispatch(any(), any())).thenReturn(Mono.just(MessageResult.success()));

        StepVerifier.create(service.processDueMessages()).expectNext(1).verifyComplete();
        StepVerifier.create(service.processDueMessages()).expectNext(0).verifyComplete();

        verify(dispatcher, times(1)).dispatch(any(), any());
        assertThat(only().getNextExecutionUtc()).isEqualTo(Instant.parse("2024-05-01T10:20:00Z"));
    }

    @Test
    void executeAllMissedDispatchesEveryMissedOccurrence() {
        fallBehind(MissedExecutionBehavior.EXECUTE_ALL_MISSED);
        when(dispatcher.dispatch(any(), any())).thenReturn(Mono.just(MessageResult.success()));

        for (int tick = 0; tick < 4; tick++) {
            service.processDueMessages().block();
        }

        verify(dispatcher, times(3)).dispatch(any(), any());
        assertThat(only().getNextExecutionUtc()).isEqualTo(Instant.parse("2024-05-01T10:20:00Z"));
    }

    @Test
    void unknownMessageNameIsSkipped() {
        ScheduledMessage orphan = new ScheduledMessage();
        orphan.setId("orphan");
        orphan.setMessageName("com.example.Gone");
        orphan.setMessageBody("{}");
        orphan.setNextExecutionUtc(clock.instant());
        store.store(orphan).block();

        StepVerifier.create(service.processDueMessages()).expectNext(0).verifyComplete();

        verify(dispatcher, never()).dispatch(any(), any());
    }

    @Test
    void slowDispatchTimesOut() {
        scheduler.scheduleOnce(new ExpireCart("cart-1"), clock.instant(), null).block();
        when(dispatcher.dispatch(any(), any())).thenReturn(Mono.never());

        StepVerifier.create(service.processDueMessages()).expectNext(0).verifyComplete();

        assertThat(meterRegistry.get(DispatchMetrics.SCHEDULED_OPERATIONS).tags("outcome", "timeout").timer().count())
                .isEqualTo(1L);
    }

    @Test
    void lifecycleStartsAndStopsPolling() {
        assertThat(service.isRunning()).isFalse();

        service.start();
        assertThat(service.isRunning()).isTrue();

        service.stop();
        assertThat(service.isRunning()).isFalse();
        assertThat(store.isDisposed()).isTrue();
    }
}
