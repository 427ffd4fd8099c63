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

/**
 * A unit of cross-cutting behaviour wrapped around handler invocation.
 * <p>
 * Implementations either call {@code next} to continue the chain or short-circuit by
 * returning their own result or an error signal.
 */
public interface DispatchMiddleware {

    /** The stage this middleware runs in. */
    MiddlewareStage stage();

    /** Non-applicable middleware is skipped for the given message. */
    default boolean appliesTo(DispatchMessage message) {
        return true;
    }

    Mono<MessageResult> invoke(DispatchMessage message, MessageContext context, DispatchDelegate next);
}
