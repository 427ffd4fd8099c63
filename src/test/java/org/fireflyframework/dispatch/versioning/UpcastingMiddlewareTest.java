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
import org.fireflyframework.dispatch.pipeline.MiddlewareStage;
import org.fireflyframework.dispatch.versioning.fixtures.CustomerCreatedV1;
import org.fireflyframework.dispatch.versioning.fixtures.CustomerCreatedV1ToV2;
import org.fireflyframework.dispatch.versioning.fixtures.CustomerCreatedV2;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class UpcastingMiddlewareTest {

    record Plain() implements DispatchMessage {}

    @Test
    void handlerReceivesUpcastedMessageAndContextRemembersOriginalVersion() {
        UpcastingPipeline pipeline = new UpcastingPipeline();
        pipeline.register(new CustomerCreatedV1ToV2());
        UpcastingMiddleware middleware = new UpcastingMiddleware(pipeline);
        MessageContext ctx = MessageContext.create();
        AtomicReference<DispatchMessage> seen = new AtomicReference<>();

        middleware.invoke(new CustomerCreatedV1("Ada Lovelace"), ctx, (m, c) -> {
            seen.set(m);
            return Mono.just(MessageResult.success());
        }).block();

        assertThat(seen.get()).isEqualTo(new CustomerCreatedV2("Ada", "Lovelace"));
        assertThat(ctx.message()).isEqualTo(seen.get());
        assertThat(ctx.getItem(UpcastingMiddleware.ORIGINAL_VERSION_ITEM, Integer.class)).contains(1);
        assertThat(middleware.stage()).isEqualTo(MiddlewareStage.PRE_PROCESSING);
    }

    @Test
    void appliesOnlyToVersionedMessages() {
        UpcastingMiddleware middleware = new UpcastingMiddleware(new UpcastingPipeline());

        assertThat(middleware.appliesTo(new Plain())).isFalse();
        assertThat(middleware.appliesTo(new CustomerCreatedV1("x"))).isTrue();
    }
}
