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

import org.fireflyframework.dispatch.MutableClock;
import org.fireflyframework.dispatch.core.DispatchMessage;
import org.fireflyframework.dispatch.core.Dispatcher;
import org.fireflyframework.dispatch.core.MessageContext;
import org.fireflyframework.dispatch.core.MessageResult;
import org.fireflyframework.dispatch.scheduling.JacksonMessageSerializer;
import org.fireflyframework.dispatch.scheduling.MessageTypeRegistry;
import org.fireflyframework.dispatch.scheduling.MissedExecutionBehavior;
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
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CronJobProcessorTest {

    record RefreshCache(String cache) implements DispatchMessage {}

    @Mock
    Dispatcher dispatcher;

    private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
    private InMemoryCronJobStore store;
    private MessageDispatchJob dispatchJob;
    private CronJobProcessor processor;

    @BeforeEach
    void setUp() {
        MessageTypeRegistry registry = new MessageTypeRegistry();
        registry.register("RefreshCache", RefreshCache.class);
        store = new InMemoryCronJobStore(clock);
        dispatchJob = new MessageDispatchJob(registry, new JacksonMessageSerializer(JsonUtils.mapper()), dispatcher);
        processor = processor(10);
    }

    private CronJobProcessor processor(int maxCatchUp) {
        return new CronJobProcessor(store, dispatchJob, Duration.ofSeconds(30), Duration.ofMinutes(1), maxCatchUp,
                clock);
    }

    private static RecurringCronJob everyFiveMinutes(String id) {
        RecurringCronJob job = new RecurringCronJob();
        job.setId(id);
        job.setName(id);
        job.setCronExpression("*/5 * * * *");
        job.setMessageTypeName("RefreshCache");
        job.setMessagePayload("{\"cache\":\"prices\"}");
        return job;
    }

    private RecurringCronJob stored(String id) {
        return store.getJob(id).block();
    }

    private void dispatchSucceeds() {
        when(dispatcher.dispatch(any(), any())).thenReturn(Mono.just(MessageResult.success()));
    }

    @Test
    void scheduleComputesFirstRun() {
        processor.schedule(everyFiveMinutes("prices")).block();

        assertThat(stored("prices").getNextRunUtc()).isEqualTo(Instant.parse("2024-05-01T10:05:00Z"));
    }

    @Test
    void scheduleHonoursFutureStartDate() {
        RecurringCronJob job = everyFiveMinutes("prices");
        job.setStartDate(Instant.parse("2024-05-01T12:00:00Z"));

        processor.schedule(job).block();

        assertThat(stored("prices").getNextRunUtc()).isEqualTo(Instant.parse("2024-05-01T12:00:00Z"));
    }

    @Test
    void scheduleRejectsInvalidCron() {
        RecurringCronJob job = everyFiveMinutes("bad");
        job.setCronExpression("every tuesday");

        assertThatThrownBy(() -> processor.schedule(job)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void dueJobRunsAndIsRescheduled() {
        dispatchSucceeds();
        processor.schedule(everyFiveMinutes("prices")).block();
        clock.set(Instant.parse("2024-05-01T10:05:20Z"));

        StepVerifier.create(processor.processDueJobs()).expectNext(1).verifyComplete();

        RecurringCronJob job = stored("prices");
        assertThat(job.getRunCount()).isEqualTo(1);
        assertThat(job.getNextRunUtc()).isEqualTo(Instant.parse("2024-05-01T10:10:00Z"));
        verify(dispatcher).dispatch(any(), any());
    }

    @Test
    void nothingRunsBeforeFirstOccurrence() {
        processor.schedule(everyFiveMinutes("prices")).block();
        clock.set(Instant.parse("2024-05-01T10:04:59Z"));

        StepVerifier.create(processor.processDueJobs()).expectNext(0).verifyComplete();
        verify(dispatcher, never()).dispatch(any(), any());
    }

    @Test
    void skipMissedReschedulesWithoutRunning() {
        processor.schedule(everyFiveMinutes("prices")).block();
        clock.set(Instant.parse("2024-05-01T10:21:00Z"));

        StepVerifier.create(processor.processDueJobs()).expectNext(0).verifyComplete();

        verify(dispatcher, never()).dispatch(any(), any());
        assertThat(stored("prices").getNextRunUtc()).isEqualTo(Instant.parse("2024-05-01T10:25:00Z"));
    }

    @Test
    void disableScheduleOnMissedRun() {
        RecurringCronJob job = everyFiveMinutes("prices");
        job.setMissedExecutionBehavior(MissedExecutionBehavior.DISABLE_SCHEDULE);
        processor.schedule(job).block();
        clock.set(Instant.parse("2024-05-01T10:21:00Z"));

        StepVerifier.create(processor.processDueJobs()).expectNext(0).verifyComplete();

        assertThat(stored("prices").isEnabled()).isFalse();
        verify(dispatcher, never()).dispatch(any(), any());
    }

    @Test
    void executeAllMissedRunsEveryOccurrenceInOrder() {
        dispatchSucceeds();
        RecurringCronJob job = everyFiveMinutes("prices");
        job.setMissedExecutionBehavior(MissedExecutionBehavior.EXECUTE_ALL_MISSED);
        processor.schedule(job).block();
        clock.set(Instant.parse("2024-05-01T10:21:00Z"));

        StepVerifier.create(processor.processDueJobs()).expectNext(4).verifyComplete();

        ArgumentCaptor<MessageContext> contexts = ArgumentCaptor.forClass(MessageContext.class);
        verify(dispatcher, times(4)).dispatch(any(), contexts.capture());
        assertThat(contexts.getAllValues())
                .extracting(c -> c.properties().get(MessageDispatchJob.SCHEDULED_TIME_PROPERTY))
                .containsExactly("2024-05-01T10:05:00Z", "2024-05-01T10:10:00Z",
                        "2024-05-01T10:15:00Z", "2024-05-01T10:20:00Z");
        assertThat(stored("prices").getNextRunUtc()).isEqualTo(Instant.parse("2024-05-01T10:25:00Z"));
    }

    @Test
    void catchUpIsCapped() {
        dispatchSucceeds();
        CronJobProcessor capped = processor(2);
        RecurringCronJob job = everyFiveMinutes("prices");
        job.setMissedExecutionBehavior(MissedExecutionBehavior.EXECUTE_ALL_MISSED);
        capped.schedule(job).block();
        clock.set(Instant.parse("2024-05-01T11:00:30Z"));

        StepVerifier.create(capped.processDueJobs()).expectNext(2).verifyComplete();
    }

    @Test
    void executeLatestMissedRunsOnce() {
        dispatchSucceeds();
        RecurringCronJob job = everyFiveMinutes("prices");
        job.setMissedExecutionBehavior(MissedExecutionBehavior.EXECUTE_LATEST_MISSED);
        processor.schedule(job).block();
        clock.set(Instant.parse("2024-05-01T10:21:00Z"));

        StepVerifier.create(processor.processDueJobs()).expectNext(1).verifyComplete();

        ArgumentCaptor<MessageContext> context = ArgumentCaptor.forClass(MessageContext.class);
        verify(dispatcher).dispatch(any(), context.capture());
        assertThat(context.getValue().properties())
                .containsEntry(MessageDispatchJob.SCHEDULED_TIME_PROPERTY, "2024-05-01T10:20:00Z");
    }

    @Test
    void failedRunIsRetriedAndEveryAttemptRecorded() {
        MessageResult failed = MessageResult.failure(new IllegalStateException("cache node down"));
        when(dispatcher.dispatch(any(), any()))
                .thenReturn(Mono.just(failed), Mono.just(failed), Mono.just(MessageResult.success()));
        RecurringCronJob job = everyFiveMinutes("prices");
        job.setRetryOnFailure(true);
        job.setMaxRetryAttempts(3);
        processor.schedule(job).block();
        clock.set(Instant.parse("2024-05-01T10:05:10Z"));

        StepVerifier.create(processor.processDueJobs()).expectNext(1).verifyComplete();

        RecurringCronJob after = stored("prices");
        assertThat(after.getRunCount()).isEqualTo(3);
        assertThat(after.getFailureCount()).isEqualTo(2);
        assertThat(after.getLastError()).isNull();
        StepVerifier.create(store.getJobHistory("prices", 10).map(CronJobExecution::success))
                .expectNext(true, false, false)
                .verifyComplete();
    }

    @Test
    void failureWithoutRetryIsRecordedOnce() {
        when(dispatcher.dispatch(any(), any()))
                .thenReturn(Mono.just(MessageResult.failure(new IllegalStateException("cache node down"))));
        processor.schedule(everyFiveMinutes("prices")).block();
        clock.set(Instant.parse("2024-05-01T10:05:10Z"));

        StepVerifier.create(processor.processDueJobs()).expectNext(0).verifyComplete();

        RecurringCronJob after = stored("prices");
        assertThat(after.getFailureCount()).isEqualTo(1);
        assertThat(after.getLastError()).contains("cache node down");
        assertThat(after.getNextRunUtc()).isEqualTo(Instant.parse("2024-05-01T10:10:00Z"));
    }

    @Test
    void jobIsDisabledOnceNextRunFallsPastEndDate() {
        dispatchSucceeds();
        RecurringCronJob job = everyFiveMinutes("prices");
        job.setEndDate(Instant.parse("2024-05-01T10:07:00Z"));
        processor.schedule(job).block();
        clock.set(Instant.parse("2024-05-01T10:05:10Z"));

        StepVerifier.create(processor.processDueJobs()).expectNext(1).verifyComplete();

        assertThat(stored("prices").isEnabled()).isFalse();
    }

    @Test
    void higherPriorityJobsRunFirst() {
        dispatchSucceeds();
        RecurringCronJob low = everyFiveMinutes("low");
        RecurringCronJob high = everyFiveMinutes("high");
        high.setPriority(10);
        high.setMessagePayload("{\"cache\":\"urgent\"}");
        processor.schedule(low).block();
        processor.schedule(high).block();
        clock.set(Instant.parse("2024-05-01T10:05:10Z"));

        StepVerifier.create(processor.processDueJobs()).expectNext(2).verifyComplete();

        ArgumentCaptor<DispatchMessage> messages = ArgumentCaptor.forClass(DispatchMessage.class);
        verify(dispatcher, times(2)).dispatch(messages.capture(), any());
        assertThat(messages.getAllValues()).containsExactly(new RefreshCache("urgent"), new RefreshCache("prices"));
    }
}
