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

package org.fireflyframework.dispatch.saga;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduledStepTrackerTest {

    private final ScheduledStepTracker tracker = new ScheduledStepTracker();

    @Test
    void drainWaitsForEveryTrackedStep() {
        CompletableFuture<String> first = tracker.track(new CompletableFuture<>());
        CompletableFuture<String> second = tracker.track(new CompletableFuture<>());
        assertThat(tracker.pendingCount()).isEqualTo(2);

        first.complete("a");
        assertThat(tracker.pendingCount()).isEqualTo(1);
        second.complete("b");

        StepVerifier.create(tracker.drain()).verifyComplete();
        assertThat(tracker.pendingCount()).isZero();
    }

    @Test
    void cancelAllSurfacesCancellationOnDrain() {
        CompletableFuture<String> step = tracker.track(new CompletableFuture<>());

        tracker.cancelAll();

        assertThat(step).isCancelled();
        StepVerifier.create(tracker.drain())
                .expectError(CancellationException.class)
                .verify();
    }

    @Test
    void drainReportsStepFailure() {
        CompletableFuture<String> step = tracker.track(new CompletableFuture<>());
        step.completeExceptionally(new IllegalStateException("broken"));

        StepVerifier.create(tracker.drain())
                .expectErrorMatches(e -> e instanceof IllegalStateException && "broken".equals(e.getMessage()))
                .verify();
    }

    @Test
    void drainWithNothingTrackedCompletes() {
        StepVerifier.create(tracker.drain()).verifyComplete();
    }
}
