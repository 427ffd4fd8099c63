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
import org.fireflyframework.dispatch.core.HandlerNotFoundException;
import org.fireflyframework.dispatch.core.MessageContext;
import org.fireflyframework.dispatch.core.MessageResult;
import org.fireflyframework.dispatch.pipeline.DispatchDelegate;
import org.fireflyframework.dispatch.pipeline.DispatchMiddleware;
import org.fireflyframework.dispatch.pipeline.MiddlewarePipeline;
import org.fireflyframework.dispatch.pipeline.MiddlewareStage;
import org.fireflyframework.dispatch.validation.InputValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultDispatcherTest {

    record PlaceOrder(String sku, int quantity) implements DispatchMessage {}

    record GetPrice(String sku) implements DispatchMessage {}

    record CancelOrder(String orderId) implements DispatchMessage {}

    record Unhandled() implements DispatchMessage {}

    static final AtomicInteger placed = new AtomicInteger();

    static class PlaceOrderHandler implements MessageHandler<PlaceOrder> {
        @Override
        public Mono<Void> handle(PlaceOrder message, MessageContext context) {
            if (message.quantity() <= 0) {
                return Mono.error(new InputValidationException(List.of("quantity must be positive")));
            }
            placed.addAndGet(message.quantity());
            return Mono.empty();
        }
    }

    static class GetPriceHandler implements ResponseHandler<GetPrice, Long> {
        @Override
        public Mono<Long> handle(GetPrice message, MessageContext context) {
            return Mono.just(1999L);
        }
    }

    static class CancelOrderHandler implements MessageHandler<CancelOrder> {
        @Override
        public Mono<Void> handle(CancelOrder message, MessageContext context) {
            return Mono.error(new IllegalStateException("order " + message.orderId() + " already shipped"));
        }
    }

    private HandlerRegistry registry;
    private DefaultDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        placed.set(0);
        registry = new HandlerRegistry();
        registry.register(PlaceOrder.class, PlaceOrderHandler.class);
        registry.register(GetPrice.class, GetPriceHandler.class);
        registry.register(CancelOrder.class, CancelOrderHandler.class);
        SupplierHandlerFactory factory = new SupplierHandlerFactory()
                .register(PlaceOrderHandler.class, PlaceOrderHandler::new)
                .register(GetPriceHandler.class, GetPriceHandler::new)
                .register(CancelOrderHandler.class, CancelOrderHandler::new);
        dispatcher = new DefaultDispatcher(registry, factory, MiddlewarePipeline.empty());
    }

    @Test
    void dispatchesActionToHandler() {
        MessageContext ctx = MessageContext.create();

        StepVerifier.create(dispatcher.dispatch(new PlaceOrder("sku-1", 2), ctx))
                .assertNext(r -> assertThat(r.isSuccess()).isTrue())
                .verifyComplete();

        assertThat(placed).hasValue(2);
        assertThat(ctx.message()).isEqualTo(new PlaceOrder("sku-1", 2));
        assertThat(ctx.messageType()).isEqualTo(PlaceOrder.class.getName());
    }

    @Test
    void typedDispatchReturnsHandlerResponse() {
        StepVerifier.create(dispatcher.dispatch(new GetPrice("sku-1"), MessageContext.create(), Long.class))
                .expectNext(1999L)
                .verifyComplete();
    }

    @Test
    void typedDispatchWithWrongResponseTypeErrors() {
        StepVerifier.create(dispatcher.dispatch(new GetPrice("sku-1"), MessageContext.create(), String.class))
                .expectError(DispatchException.class)
                .verify();
    }

    @Test
    void handlerValidationErrorBecomesValidationResult() {
        StepVerifier.create(dispatcher.dispatch(new PlaceOrder("sku-1", 0), MessageContext.create()))
                .assertNext(r -> {
                    assertThat(r.isValidationFailure()).isTrue();
                    assertThat(r.validationErrors()).containsExactly("quantity must be positive");
                })
                .verifyComplete();
    }

    @Test
    void handlerErrorBecomesFailedResult() {
        StepVerifier.create(dispatcher.dispatch(new CancelOrder("o-1"), MessageContext.create()))
                .assertNext(r -> {
                    assertThat(r.isSuccess()).isFalse();
                    assertThat(r.problemType()).isEqualTo(MessageResult.HANDLER_PROBLEM_TYPE);
                    assertThat(r.detail()).isEqualTo("order o-1 already shipped");
                })
                .verifyComplete();

        StepVerifier.create(dispatcher.dispatch(new CancelOrder("o-1"), MessageContext.create(), Void.class))
                .expectErrorMessage("order o-1 already shipped")
                .verify();
    }

    @Test
    void missingHandlerErrors() {
        StepVerifier.create(dispatcher.dispatch(new Unhandled(), MessageContext.create()))
                .expectError(HandlerNotFoundException.class)
                .verify();
    }

    @Test
    void firstDispatchFreezesRegistry() {
        dispatcher.dispatch(new PlaceOrder("sku-1", 1), MessageContext.create()).block();

        assertThatThrownBy(() -> registry.register(Unhandled.class, PlaceOrderHandler.class))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void messagesFlowThroughPipelineBeforeHandler() {
        DispatchMiddleware tagging = new DispatchMiddleware() {
            @Override
            public MiddlewareStage stage() {
                return MiddlewareStage.PRE_PROCESSING;
            }

            @Override
            public Mono<MessageResult> invoke(DispatchMessage message, MessageContext context, DispatchDelegate next) {
                context.items().put("seen", true);
                return next.invoke(message, context);
            }
        };
        DefaultDispatcher piped = new DefaultDispatcher(registry,
                new SupplierHandlerFactory().register(GetPriceHandler.class, GetPriceHandler::new),
                new MiddlewarePipeline(List.of(tagging)));
        MessageContext ctx = MessageContext.create();

        StepVerifier.create(piped.dispatch(new GetPrice("sku-2"), ctx))
                .assertNext(r -> assertThat(r.valueAs(Long.class)).contains(1999L))
                .verifyComplete();
        assertThat(ctx.getItem("seen", Boolean.class)).contains(true);
    }
}
