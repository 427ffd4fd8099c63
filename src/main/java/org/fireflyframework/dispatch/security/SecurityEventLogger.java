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
package org.fireflyframework.dispatch.security;

import org.fireflyframework.dispatch.core.MessageContext;
import reactor.core.publisher.Mono;

/**
 * Sink for security relevant events raised while dispatching.
 * Provide your own Spring bean of this type to forward events to an audit store.
 * A default logger-based implementation is provided: {@link LoggingSecurityEventLogger}.
 */
public interface SecurityEventLogger {

    /**
     * @param context may be {@code null} when the event is not tied to a dispatch
     */
    Mono<Void> logSecurityEvent(SecurityEventType type, String description, SecuritySeverity severity,
                                MessageContext context);
}
