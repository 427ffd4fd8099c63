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
package org.fireflyframework.dispatch.validation;

import org.fireflyframework.dispatch.core.DispatchMessage;
import org.fireflyframework.dispatch.core.MessageContext;
import org.fireflyframework.dispatch.core.MessageResult;
import org.fireflyframework.dispatch.pipeline.DispatchDelegate;
import org.fireflyframework.dispatch.pipeline.DispatchMiddleware;
import org.fireflyframework.dispatch.pipeline.MiddlewareStage;
import org.fireflyframework.dispatch.pipeline.observability.DispatchMetrics;
import org.fireflyframework.dispatch.security.SecurityEventLogger;
import org.fireflyframework.dispatch.security.SecurityEventType;
import org.fireflyframework.dispatch.security.SecuritySeverity;
import org.fireflyframework.dispatch.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * Enforces baseline message hygiene before any handler runs.
 * <p>
 * Context checks run first and stop at the first problem: correlation id (when required),
 * message id, timestamp window and the optional {@code User:MessageId} item. Every validator
 * then runs in order and all their errors are collected. A failure is reported to the
 * {@link SecurityEventLogger} and signalled as {@link InputValidationException}; the caller
 * always sees it.
 * <p>
 * On success {@code Validation:Passed} and {@code Validation:Timestamp} are stored in the
 * context items.
 */
public class InputValidationMiddleware implements DispatchMiddleware {

    private static final Logger log = LoggerFactory.getLogger(InputValidationMiddleware.class);

    public static final String VALIDATION_PASSED_ITEM = "Validation:Passed";
    public static final String VALIDATION_TIMESTAMP_ITEM = "Validation:Timestamp";
    public static final String USER_MESSAGE_ID_ITEM = "User:MessageId";

    static final Duration CLOCK_SKEW_TOLERANCE = Duration.ofMinutes(5);

    private static final Pattern USER_ID_FORMAT = Pattern.compile("^[a-zA-Z0-9]{3,50}$");
    private static final UUID NIL_UUID = new UUID(0L, 0L);

    private final InputValidationOptions options;
    private final List<InputValidator> validators;
    private final SecurityEventLogger securityEventLogger;
    private final DispatchMetrics metrics;
    private final Clock clock;
    private final AtomicBoolean disabledWarningLogged = new AtomicBoolean(false);

    public InputValidationMiddleware(InputValidationOptions options, List<? extends InputValidator> validators,
                                     SecurityEventLogger securityEventLogger, DispatchMetrics metrics, Clock clock) {
        this.options = Objects.requireNonNull(options, "options");
        this.validators = List.copyOf(validators);
        this.securityEventLogger = Objects.requireNonNull(securityEventLogger, "securityEventLogger");
        this.metrics = metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public MiddlewareStage stage() {
        return MiddlewareStage.VALIDATION;
    }

    @Override
    public Mono<MessageResult> invoke(DispatchMessage message, MessageContext context, DispatchDelegate next) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(next, "next");

        if (!options.isEnabled()) {
            if (disabledWarningLogged.compareAndSet(false, true)) {
                log.warn("Input validation is disabled. This should only occur in development environments.");
            }
            return next.invoke(message, context);
        }

        return validate(message, context)
                .onErrorResume(error -> reportUnexpected(message, context, error))
                .then(Mono.defer(() -> {
                    context.items().put(VALIDATION_PASSED_ITEM, Boolean.TRUE);
                    context.items().put(VALIDATION_TIMESTAMP_ITEM, clock.instant());
                    return next.invoke(message, context);
                }));
    }

    private Mono<Void> validate(DispatchMessage message, MessageContext context) {
        return Mono.defer(() -> {
            String contextError = checkContext(context);
            if (contextError != null) {
                return fail(message, context, List.of(contextError), false);
            }
            return runValidators(message, context)
                    .flatMap(outcome -> outcome.errors().isEmpty()
                            ? Mono.<Void>empty()
                            : fail(message, context, outcome.errors(), outcome.suspicious()));
        });
    }

    private String checkContext(MessageContext context) {
        if (options.isRequireCorrelationId() && !isValidCorrelationId(context.correlationId())) {
            return "Message context must have a valid correlation ID";
        }
        if (context.messageId() == null || context.messageId().isEmpty()) {
            return "Message context must have a valid message ID";
        }
        Instant timestamp = context.sentTimestampUtc() != null
                ? context.sentTimestampUtc()
                : context.receivedTimestampUtc();
        Instant now = clock.instant();
        if (timestamp.isAfter(now.plus(CLOCK_SKEW_TOLERANCE))) {
            return "Message timestamp cannot be in the future";
        }
        if (timestamp.isBefore(now.minus(Duration.ofDays(options.getMaxMessageAgeDays())))) {
            return "Message is too old (max age: " + options.getMaxMessageAgeDays() + " days)";
        }
        Object userId = context.items().get(USER_MESSAGE_ID_ITEM);
        if (userId instanceof String s && !isValidUserId(s)) {
            return "Invalid user ID format";
        }
        return null;
    }

    private Mono<ValidatorOutcome> runValidators(DispatchMessage message, MessageContext context) {
        ValidatorOutcome outcome = new ValidatorOutcome();
        return Flux.fromIterable(validators)
                .concatMap(validator -> Mono.defer(() -> validator.validate(message, context))
                        .doOnNext(result -> {
                            if (!result.valid()) {
                                outcome.errors.addAll(result.errors());
                                outcome.suspicious |= validator.detectsInjection();
                            }
                        })
                        .onErrorResume(error -> {
                            log.warn(JsonUtils.json(
                                    "validation_event", "validator_failed",
                                    "validator", validator.name(),
                                    "error", error
                            ));
                            if (options.isFailOnValidatorException()) {
                                outcome.errors.add("Validator " + validator.name() + " failed: " + error.getMessage());
                            }
                            return Mono.empty();
                        }))
                .then(Mono.fromSupplier(() -> outcome));
    }

    private Mono<Void> fail(DispatchMessage message, MessageContext context, List<String> errors, boolean suspicious) {
        SecuritySeverity severity = suspicious ? SecuritySeverity.HIGH : SecuritySeverity.MEDIUM;
        String messageType = message.getClass().getSimpleName();
        log.warn(JsonUtils.json(
                "validation_event", "failed",
                "message_type", messageType,
                "message_id", context.messageId(),
                "error_count", errors.size(),
                "suspicious", suspicious
        ));
        if (metrics != null) {
            metrics.recordValidationFailure(messageType, suspicious);
        }
        return logSecurityEvent(SecurityEventType.VALIDATION_FAILURE,
                "Input validation failed: " + String.join(", ", errors), severity, context)
                .then(Mono.error(new InputValidationException(errors)));
    }

    private Mono<Void> reportUnexpected(DispatchMessage message, MessageContext context, Throwable error) {
        String messageType = message.getClass().getSimpleName();
        if (!(error instanceof InputValidationException)) {
            log.error("Unexpected error during input validation for message {}", messageType, error);
        }
        return logSecurityEvent(SecurityEventType.VALIDATION_ERROR,
                "Validation error for " + messageType + ": " + error.getMessage(), SecuritySeverity.MEDIUM, context)
                .then(Mono.error(error));
    }

    private Mono<Void> logSecurityEvent(SecurityEventType type, String description, SecuritySeverity severity,
                                        MessageContext context) {
        return Mono.defer(() -> securityEventLogger.logSecurityEvent(type, description, severity, context))
                .onErrorResume(e -> {
                    log.warn("Failed to log security event {}: {}", type, e.getMessage());
                    return Mono.empty();
                });
    }

    private static boolean isValidCorrelationId(String correlationId) {
        UUID parsed = parseUuid(correlationId);
        return parsed != null && !NIL_UUID.equals(parsed);
    }

    private static boolean isValidUserId(String userId) {
        return parseUuid(userId) != null || USER_ID_FORMAT.matcher(userId).matches();
    }

    private static UUID parseUuid(String value) {
        // canonical 8-4-4-4-12 form only
        if (value == null || value.length() != 36) {
            return null;
        }
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public List<InputValidator> getValidators() {
        return validators;
    }

    private static final class ValidatorOutcome {
        private final List<String> errors = new ArrayList<>();
        private boolean suspicious;

        List<String> errors() { return errors; }
        boolean suspicious() { return suspicious; }
    }
}
