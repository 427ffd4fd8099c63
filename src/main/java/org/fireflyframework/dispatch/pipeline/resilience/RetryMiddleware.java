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
package org.fireflyframework.dispatch.pipeline.resilience;

import org.fireflyframework.dispatch.core.DispatchMessage;
import org.fireflyframework.dispatch.core.HandlerNotFoundException;
import org.fireflyframework.dispatch.core.MessageContext;
import org.fireflyframework.dispatch.core.MessageResult;
import org.fireflyframework.dispatch.pipeline.DispatchDelegate;
import org.fireflyframework.dispatch.pipeline.DispatchMiddleware;
import org.fireflyframework.dispatch.pipeline.MiddlewareStage;
import org.fireflyframework.dispatch.util.JsonUtils;
import org.fireflyframework.dispatch.validation.InputValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Signal;

import java.time.Duration;
import java.util.Objects;

/**
 * Re-invokes the rest of the chain according to a {@link RetryPolicy}.
 * <p>
 * Both error signals and failed results are retried. Validation failures and missing
 * handlers are never retried.
 */
public class RetryMiddleware implements DispatchMiddleware {

    private static final Logger log = LoggerFactory.getLogger(RetryMiddleware.class);

    private final RetryPolicy policy;

    public RetryMiddleware(RetryPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    public MiddlewareStage stage() {
        return MiddlewareStage.RESILIENCE;
    }

    @Override
    public Mono<MessageResult> invoke(DispatchMessage message, MessageContext context, DispatchDelegate next) {
        return attempt(1, message, context, next);
    }

    private Mono<MessageResult> attempt(int attempt, DispatchMessage message, MessageContext context,
                                        DispatchDelegate next) {
        return Mono.defer(() -> next.invoke(message, context))
                .materialize()
                .flatMap(signal -> decide(signal, attempt, message, context, next));
    }

    private Mono<MessageResult> decide(Signal<MessageResult> signal, int attempt, DispatchMessage message,
                                       MessageContext context, DispatchDelegate next) {
        if (signal.isOnError()) {
            Throwable error = signal.getThrowable();
            if (isPermanent(error) || !policy.shouldRetry(attempt, error)) {
                return Mono.error(error);
            }
            return retryLater(attempt, error, message, context, next);
        }
        MessageResult result = signal.get();
        if (result == null || result.isSuccess() || result.isValidationFailure()
                || isPermanent(result.error()) || !policy.shouldRetry(attempt, result.error())) {
            return Mono.justOrEmpty(result);
        }
        return retryLater(attempt, result.error(), message, context, next);
    }

    private Mono<MessageResult> retryLater(int attempt, Throwable error, DispatchMessage message,
                                           MessageContext context, DispatchDelegate next) {
        Duration delay = policy.getDelay(attempt);
        log.warn(JsonUtils.json(
                "dispatch_event", "retry",
                "message_type", message.getClass().getSimpleName(),
                "message_id", context.messageId(),
                "attempt", attempt,
                "delay_ms", delay.toMillis(),
                "error", error
        ));
        return Mono.delay(delay).then(attempt(attempt + 1, message, context, next));
    }

    private static boolean isPermanent(Throwable error) {
        return error instanceof InputValidationException || error instanceof HandlerNotFoundException;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
