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

package org.fireflyframework.dispatch.saga.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.fireflyframework.dispatch.saga.SagaState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

class SagaLoggerEventsTest {

    private final SagaLoggerEvents events = new SagaLoggerEvents();
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private Logger logger;

    @BeforeEach
    void attach() {
        logger = (Logger) LoggerFactory.getLogger(SagaLoggerEvents.class);
        logger.setLevel(Level.DEBUG);
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
        logger.setLevel(null);
        appender.stop();
    }

    @Test
    void startIsOneJsonLineAtInfo() {
        events.onStart("place-order", "saga-1");

        assertThat(appender.list).singleElement().satisfies(e -> {
            assertThat(e.getLevel()).isEqualTo(Level.INFO);
            assertThat(e.getFormattedMessage())
                    .isEqualTo("{\"saga_event\":\"started\",\"saga_name\":\"place-order\",\"saga_id\":\"saga-1\"}");
        });
    }

    @Test
    void retriesAndCancellationLogAtWarn() {
        events.onStepRetry("place-order", "saga-1", "charge", 2, 200);
        events.onCancelled("place-order", "saga-1");

        assertThat(appender.list).extracting(ILoggingEvent::getLevel).containsOnly(Level.WARN);
        assertThat(appender.list.get(0).getFormattedMessage())
                .contains("\"saga_event\":\"step_retry\"", "\"attempt\":\"2\"", "\"delay_ms\":\"200\"");
    }

    @Test
    void failuresLogAtErrorWithErrorClass() {
        events.onStepFailed("place-order", "saga-1", "charge", "declined", new IllegalStateException("declined"), 3, 12);
        events.onCompensated("place-order", "saga-1", "reserve", new IllegalArgumentException("gone"));

        assertThat(appender.list).extracting(ILoggingEvent::getLevel).containsOnly(Level.ERROR);
        assertThat(appender.list.get(0).getFormattedMessage())
                .contains("\"error_class\":\"IllegalStateException\"", "\"attempts\":\"3\"");
        assertThat(appender.list.get(1).getFormattedMessage())
                .contains("\"saga_event\":\"compensated_failed\"", "\"error_message\":\"gone\"");
    }

    @Test
    void completionReportsSuccessFlag() {
        events.onCompensated("place-order", "saga-1", "reserve", null);
        events.onCompleted("place-order", "saga-1", SagaState.COMPENSATED_SUCCESSFULLY);

        assertThat(appender.list.get(0).getFormattedMessage()).contains("\"saga_event\":\"compensated_success\"");
        assertThat(appender.list.get(1).getFormattedMessage())
                .contains("\"success\":\"false\"", "\"state\":\"COMPENSATED_SUCCESSFULLY\"");
    }
}
