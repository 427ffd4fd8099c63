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
package org.fireflyframework.dispatch.pipeline.observability;

import org.fireflyframework.dispatch.core.DispatchMessage;
import org.fireflyframework.dispatch.core.MessageContext;
import org.fireflyframework.dispatch.core.MessageResult;
import org.fireflyframework.dispatch.pipeline.DispatchDelegate;
import org.fireflyframework.dispatch.pipeline.DispatchMiddleware;
import org.fireflyframework.dispatch.pipeline.MiddlewareStage;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Records count and latency of every dispatch, tagged by message type and outcome
 * ({@code success}, {@code failure} or {@code error}).
 */
public class MetricsMiddleware implements DispatchMiddleware {

    private final DispatchMetrics metrics;

    public MetricsMiddleware(DispatchMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public MiddlewareStage stage() {
        return MiddlewareStage.OBSERVABILITY;
    }

    @Override
    public Mono<MessageResult> invoke(DispatchMessage message, MessageContext context, DispatchDelegate next) {
        String messageType = message.getClass().getSimpleName();
        long start = System.nanoTime();
        return next.invoke(message, context)
                .doOnNext(result -> metrics.recordDispatch(messageType, result.isSuccess() ? "success" : "failure",
                        Duration.ofNanos(System.nanoTime() - start)))
                .doOnError(error -> metrics.recordDispatch(messageType, "error",
                        Duration.ofNanos(System.nanoTime() - start)));
    }
}
