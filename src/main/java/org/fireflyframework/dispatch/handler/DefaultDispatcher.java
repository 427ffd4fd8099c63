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
package org.fireflyframework.dispatch.handler;

import org.fireflyframework.dispatch.core.DispatchException;
import org.fireflyframework.dispatch.core.DispatchMessage;
import org.fireflyframework.dispatch.core.Dispatcher;
import org.fireflyframework.dispatch.core.HandlerNotFoundException;
import org.fireflyframework.dispatch.core.MessageContext;
import org.fireflyframework.dispatch.core.MessageResult;
import org.fireflyframework.dispatch.pipeline.MiddlewarePipeline;
import org.fireflyframework.dispatch.util.JsonUtils;
import org.fireflyframework.dispatch.validation.InputValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Dispatcher that runs the {@link MiddlewarePipeline} and finishes with the handler found in
 * the {@link HandlerRegistry} for the message that reaches the end of the chain (which may be
 * an upcast version of the original).
 */
public class DefaultDispatcher implements Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(DefaultDispatcher.class);

    private final HandlerRegistry registry;
    private final HandlerActivator activator;
    private final MiddlewarePipeline pipeline;

    public DefaultDispatcher(HandlerRegistry registry, HandlerFactory handlerFactory, MiddlewarePipeline pipeline) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.activator = new HandlerActivator(Objects.requireNonNull(handlerFactory, "handlerFactory"));
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    }

    @Override
    public Mono<MessageResult> dispatch(DispatchMessage message, MessageContext context) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(context, "context");
        registry.freeze();
        context.setMessage(message);
        if (context.messageType() == null) {
            context.setMessageType(message.getClass().getName());
        }
        return pipeline.execute(message, context, this::invokeHandler);
    }

    @Override
    public <R> Mono<R> dispatch(DispatchMessage message, MessageContext context, Class<R> responseType) {
        Objects.requireNonNull(responseType, "responseType");
        return dispatch(message, context).flatMap(result -> {
            if (!result.isSuccess()) {
                return Mono.error(result.error() != null
                        ? result.error()
                        : new DispatchException(result.title() + ": " + result.detail()));
            }
            Object value = result.value().orElse(null);
            if (value != null && !responseType.isInstance(value)) {
                return Mono.error(new DispatchException("Handler returned " + value.getClass().getName()
                        + ", expected " + responseType.getName()));
            }
            return Mono.justOrEmpty(responseType.cast(value));
        });
    }

    private Mono<MessageResult> invokeHandler(DispatchMessage message, MessageContext context) {
        HandlerRegistryEntry entry = registry.tryGetHandler(message.getClass()).orElse(null);
        if (entry == null) {
            return Mono.error(new HandlerNotFoundException(message.getClass()));
        }
        return Mono.defer(() -> invoke(entry, message, context))
                .onErrorResume(error -> {
                    if (error instanceof InputValidationException validation) {
                        return Mono.just(MessageResult.validationFailed(validation.getErrors()));
                    }
                    log.error(JsonUtils.json(
                            "dispatch_event", "handler_failed",
                            "message_type", message.getClass().getSimpleName(),
                            "handler", entry.handlerType().getSimpleName(),
                            "message_id", context.messageId(),
                            "correlation_id", context.correlationId(),
                            "error", error
                    ));
                    return Mono.just(MessageResult.failure(error));
                });
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Mono<MessageResult> invoke(HandlerRegistryEntry entry, DispatchMessage message, MessageContext context) {
        Object handler = activator.activate(entry, context);
        if (entry.expectsResponse()) {
            Mono<Object> response = ((ResponseHandler) handler).handle(message, context);
            return Objects.requireNonNull(response, "handler returned null")
                    .map(MessageResult::success)
                    .defaultIfEmpty(MessageResult.success());
        }
        Mono<Void> completion = ((MessageHandler) handler).handle(message, context);
        return Objects.requireNonNull(completion, "handler returned null")
                .thenReturn(MessageResult.success());
    }

    public HandlerRegistry getRegistry() {
        return registry;
    }

    public MiddlewarePipeline getPipeline() {
        return pipeline;
    }
}
