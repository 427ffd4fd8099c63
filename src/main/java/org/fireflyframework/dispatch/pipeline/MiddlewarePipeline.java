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
package org.fireflyframework.dispatch.pipeline;

import org.fireflyframework.dispatch.core.DispatchMessage;
import org.fireflyframework.dispatch.core.MessageContext;
import org.fireflyframework.dispatch.core.MessageResult;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered chain of {@link DispatchMiddleware}.
 * <p>
 * Middlewares run in ascending {@link MiddlewareStage} order; inside one stage the
 * registration order is kept (the sort is stable). The chain is built once and shared by
 * all dispatches.
 */
public final class MiddlewarePipeline {

    private static final MiddlewarePipeline EMPTY = new MiddlewarePipeline(List.of());

    private final List<DispatchMiddleware> middlewares;

    public MiddlewarePipeline(List<? extends DispatchMiddleware> middlewares) {
        Objects.requireNonNull(middlewares, "middlewares");
        List<DispatchMiddleware> sorted = new ArrayList<>(middlewares);
        sorted.forEach(m -> Objects.requireNonNull(m.stage(), () -> m.getClass().getName() + " declares no stage"));
        sorted.sort(Comparator.comparingInt(m -> m.stage().ordinal()));
        this.middlewares = List.copyOf(sorted);
    }

    public static MiddlewarePipeline empty() {
        return EMPTY;
    }

    public List<DispatchMiddleware> middlewares() {
        return middlewares;
    }

    /**
     * Runs the chain for one message, finishing with {@code terminal}.
     */
    public Mono<MessageResult> execute(DispatchMessage message, MessageContext context, DispatchDelegate terminal) {
        Objects.requireNonNull(terminal, "terminal");
        return invokeAt(0, message, context, terminal);
    }

    private Mono<MessageResult> invokeAt(int index, DispatchMessage message, MessageContext context,
                                         DispatchDelegate terminal) {
        if (index >= middlewares.size()) {
            return Mono.defer(() -> terminal.invoke(message, context));
        }
        DispatchMiddleware middleware = middlewares.get(index);
        if (!middleware.appliesTo(message)) {
            return invokeAt(index + 1, message, context, terminal);
        }
        DispatchDelegate next = (m, c) -> invokeAt(index + 1, m, c, terminal);
        return Mono.defer(() -> middleware.invoke(message, context, next));
    }
}
