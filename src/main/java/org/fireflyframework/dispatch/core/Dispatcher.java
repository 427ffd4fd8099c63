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
package org.fireflyframework.dispatch.core;

import reactor.core.publisher.Mono;

/**
 * Entry point of the dispatch pipeline. Scheduled and cron dispatch go through the same entry.
 */
public interface Dispatcher {

    /**
     * Runs the middleware chain and the handler registered for the message's runtime type.
     * Handler failures are reported as failed results; validation failures and a missing
     * handler are error signals.
     */
    Mono<MessageResult> dispatch(DispatchMessage message, MessageContext context);

    /**
     * Dispatches to a response handler and unwraps its value. A failed result becomes an error signal.
     */
    <R> Mono<R> dispatch(DispatchMessage message, MessageContext context, Class<R> responseType);
}
