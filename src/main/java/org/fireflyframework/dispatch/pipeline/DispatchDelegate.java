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
 * Continuation handed to a middleware: invoking it runs the rest of the chain.
 */
@FunctionalInterface
public interface DispatchDelegate {
    Mono<MessageResult> invoke(DispatchMessage message, MessageContext context);
}
