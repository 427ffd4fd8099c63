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
import org.fireflyframework.dispatch.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Writes security events as single-line JSON. HIGH and CRITICAL events are logged at ERROR,
 * everything else at WARN.
 */
public class LoggingSecurityEventLogger implements SecurityEventLogger {

    private static final Logger log = LoggerFactory.getLogger(LoggingSecurityEventLogger.class);

    @Override
    public Mono<Void> logSecurityEvent(SecurityEventType type, String description, SecuritySeverity severity,
                                       MessageContext context) {
        return Mono.fromRunnable(() -> {
            String line = JsonUtils.json(
                    "security_event", type,
                    "severity", severity,
                    "description", description,
                    "message_id", context != null ? context.messageId() : null,
                    "correlation_id", context != null ? context.correlationId() : null,
                    "tenant_id", context != null ? context.tenantId() : null,
                    "user_id", context != null ? context.userId() : null
            );
            if (severity == SecuritySeverity.HIGH || severity == SecuritySeverity.CRITICAL) {
                log.error(line);
            } else {
                log.warn(line);
            }
        });
    }
}
