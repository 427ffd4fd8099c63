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
package org.fireflyframework.dispatch.versioning;

import org.fireflyframework.dispatch.core.DispatchMessage;
import org.fireflyframework.dispatch.core.MessageContext;
import org.fireflyframework.dispatch.core.MessageResult;
import org.fireflyframework.dispatch.pipeline.DispatchDelegate;
import org.fireflyframework.dispatch.pipeline.DispatchMiddleware;
import org.fireflyframework.dispatch.pipeline.MiddlewareStage;
import reactor.core.publisher.Mono;

/**
 * Replaces versioned messages by their latest version before they reach later stages and the handler.
 * The version that arrived is kept in the {@code Upcasting:OriginalVersion} item.
 */
public class UpcastingMiddleware implements DispatchMiddleware {

    public static final String ORIGINAL_VERSION_ITEM = "Upcasting:OriginalVersion";

    private final UpcastingPipeline pipeline;

    public UpcastingMiddleware(UpcastingPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public MiddlewareStage stage() {
        return MiddlewareStage.PRE_PROCESSING;
    }

    @Override
    public boolean appliesTo(DispatchMessage message) {
        return message instanceof VersionedMessage;
    }

    @Override
    public Mono<MessageResult> invoke(DispatchMessage message, MessageContext context, DispatchDelegate next) {
        DispatchMessage upcasted = pipeline.upcast(message);
        if (upcasted != message) {
            context.items().put(ORIGINAL_VERSION_ITEM, ((VersionedMessage) message).version());
            context.setMessage(upcasted);
        }
        return next.invoke(upcasted, context);
    }
}
