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
package org.fireflyframework.dispatch.scheduling;

import java.time.Duration;
import java.time.Instant;

/**
 * Persisted schedule of one message. Exactly one of {@code cronExpression} and
 * {@code interval} is set for recurring schedules; neither for one-shot schedules.
 */
public class ScheduledMessage {

    private String id;
    private String messageName;
    private String messageBody;
    private String cronExpression;
    private String timeZoneId;
    private Duration interval;
    private Instant nextExecutionUtc;
    private Instant lastExecutionUtc;
    private boolean enabled = true;
    private String correlationId;
    private String traceParent;
    private String tenantId;
    private String userId;
    private MissedExecutionBehavior missedExecutionBehavior = MissedExecutionBehavior.EXECUTE_LATEST_MISSED;

    public boolean isRecurring() {
        return cronExpression != null || interval != null;
    }

    public boolean isDue(Instant now) {
        return enabled && nextExecutionUtc != null && !nextExecutionUtc.isAfter(now);
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getMessageName() { return messageName; }
    public void setMessageName(String messageName) { this.messageName = messageName; }

    public String getMessageBody() { return messageBody; }
    public void setMessageBody(String messageBody) { this.messageBody = messageBody; }

    public String getCronExpression() { return cronExpression; }
    public void setCronExpression(String cronExpression) { this.cronExpression = cronExpression; }

    public String getTimeZoneId() { return timeZoneId; }
    public void setTimeZoneId(String timeZoneId) { this.timeZoneId = timeZoneId; }

    public Duration getInterval() { return interval; }
    public void setInterval(Duration interval) { this.interval = interval; }

    public Instant getNextExecutionUtc() { return nextExecutionUtc; }
    public void setNextExecutionUtc(Instant nextExecutionUtc) { this.nextExecutionUtc = nextExecutionUtc; }

    public Instant getLastExecutionUtc() { return lastExecutionUtc; }
    public void setLastExecutionUtc(Instant lastExecutionUtc) { this.lastExecutionUtc = lastExecutionUtc; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getCorrelationId() { return correlationId; }
    public void setCorrelationId(String correlationId) { this.correlationId = correlationId; }

    public String getTraceParent() { return traceParent; }
    public void setTraceParent(String traceParent) { this.traceParent = traceParent; }

    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public MissedExecutionBehavior getMissedExecutionBehavior() { return missedExecutionBehavior; }
    public void setMissedExecutionBehavior(MissedExecutionBehavior behavior) { this.missedExecutionBehavior = behavior; }

    @Override
    public String toString() {
        return "ScheduledMessage{id='" + id + "', messageName='" + messageName + "', next=" + nextExecutionUtc
                + ", enabled=" + enabled + "}";
    }
}
