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

import org.fireflyframework.dispatch.core.DispatchMessage;
import org.fireflyframework.dispatch.core.MessageContext;
import reactor.core.publisher.Mono;

/**
 * Handles a message and produces a response of type {@code R}.
 */
public interface ResponseHandler<M extends DispatchMessage, R> {
    Mono<R> handle(M message, MessageContext context);
}
