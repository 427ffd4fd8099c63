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

package org.fireflyframework.dispatch.pipeline.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.dispatch.core.DispatchMessage;
import org.fireflyframework.dispatch.core.MessageContext;
import org.fireflyframework.dispatch.core.MessageResult;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsMiddlewareTest {

    record Audit(String entry) implements DispatchMessage {}

    @Test
    void recordsOutcomePerMessageType() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MetricsMiddleware middleware = new MetricsMiddleware(new DispatchMetrics(registry));

        middleware.invoke(new Audit("a"), MessageContext.create(), (m, c) -> Mono.just(MessageResult.success())).block();
        middleware.invoke(new Audit("b"), MessageContext.create(),
                (m, c) -> Mono.just(MessageResult.failure(new IllegalStateException("x")))).block();
        middleware.invoke(new Audit("c"), MessageContext.create(),
                (m, c) -> Mono.<MessageResult>error(new IllegalStateException("y"))).onErrorResume(e -> Mono.empty()).block();

        assertThat(registry.get(DispatchMetrics.MESSAGES).tags("message.type", "Audit", "outcome", "success")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get(DispatchMetrics.MESSAGES).tags("outcome", "failure").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(DispatchMetrics.MESSAGES).tags("outcome", "error").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(DispatchMetrics.DURATION).tags("outcome", "success").timer().count()).isEqualTo(1L);
    }
}
