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

import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps the delayed steps of one saga so they can be awaited or cancelled together.
 */
public class ScheduledStepTracker {

    private final List<CompletableFuture<?>> pending = new CopyOnWriteArrayList<>();

    public <T> CompletableFuture<T> track(CompletableFuture<T> future) {
        pending.add(future);
        future.whenComplete((r, e) -> {
            if (e == null) {
                pending.remove(future);
            }
        });
        return future;
    }

    public int pendingCount() {
        return (int) pending.stream().filter(f -> !f.isDone()).count();
    }

    public void cancelAll() {
        pending.forEach(f -> f.cancel(true));
    }

    /**
     * Completes once every tracked step is done. A cancelled step surfaces as
     * {@link java.util.concurrent.CancellationException}; a failed one with its own error.
     */
    public Mono<Void> drain() {
        return Mono.defer(() -> Mono.fromFuture(CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))))
                .onErrorMap(CompletionException.class, e -> e.getCause() != null ? e.getCause() : e);
    }
}
