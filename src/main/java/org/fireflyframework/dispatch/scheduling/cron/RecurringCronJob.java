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
package org.fireflyframework.dispatch.scheduling.cron;

import org.fireflyframework.dispatch.scheduling.MissedExecutionBehavior;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * A cron driven schedule that dispatches a stored message payload.
 */
public class RecurringCronJob {

    private String id;
    private String name;
    private String description;
    private String cronExpression;
    private String timeZoneId;
    private String messageTypeName;
    private String messagePayload;
    private boolean enabled = true;
    private Instant nextRunUtc;
    private Instant lastRunUtc;
    private Instant lastModifiedUtc;
    private long runCount;
    private long failureCount;
    private String lastError;
    private MissedExecutionBehavior missedExecutionBehavior = MissedExecutionBehavior.SKIP_MISSED;
    private boolean retryOnFailure;
    private int maxRetryAttempts = 3;
    private Instant startDate;
    private Instant endDate;
    private Set<String> tags = new HashSet<>();
    private int priority;
    private Map<String, String> metadata = new HashMap<>();

    /**
     * True when the job is enabled and {@code time} lies inside the validity window (bounds
     * inclusive, an unset bound is always satisfied).
     */
    public boolean shouldRunAt(Instant time) {
        if (!enabled) {
            return false;
        }
        if (startDate != null && time.isBefore(startDate)) {
            return false;
        }
        return endDate == null || !time.isAfter(endDate);
    }

    /**
     * Counts a run. Failures also bump the failure count and keep the error; a success clears it.
     */
    public void updateRunStatistics(boolean success, String error) {
        runCount++;
        if (success) {
            lastError = null;
        } else {
            failureCount++;
            lastError = error;
        }
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getCronExpression() { return cronExpression; }
    public void setCronExpression(String cronExpression) { this.cronExpression = cronExpression; }

    public String getTimeZoneId() { return timeZoneId; }
    public void setTimeZoneId(String timeZoneId) { this.timeZoneId = timeZoneId; }

    public String getMessageTypeName() { return messageTypeName; }
    public void setMessageTypeName(String messageTypeName) { this.messageTypeName = messageTypeName; }

    public String getMessagePayload() { return messagePayload; }
    public void setMessagePayload(String messagePayload) { this.messagePayload = messagePayload; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public Instant getNextRunUtc() { return nextRunUtc; }
    public void setNextRunUtc(Instant nextRunUtc) { this.nextRunUtc = nextRunUtc; }

    public Instant getLastRunUtc() { return lastRunUtc; }
    public void setLastRunUtc(Instant lastRunUtc) { this.lastRunUtc = lastRunUtc; }

    public Instant getLastModifiedUtc() { return lastModifiedUtc; }
    public void setLastModifiedUtc(Instant lastModifiedUtc) { this.lastModifiedUtc = lastModifiedUtc; }

    public long getRunCount() { return runCount; }
    public void setRunCount(long runCount) { this.runCount = runCount; }

    public long getFailureCount() { return failureCount; }
    public void setFailureCount(long failureCount) { this.failureCount = failureCount; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    public MissedExecutionBehavior getMissedExecutionBehavior() { return missedExecutionBehavior; }
    public void setMissedExecutionBehavior(MissedExecutionBehavior behavior) { this.missedExecutionBehavior = behavior; }

    public boolean isRetryOnFailure() { return retryOnFailure; }
    public void setRetryOnFailure(boolean retryOnFailure) { this.retryOnFailure = retryOnFailure; }

    public int getMaxRetryAttempts() { return maxRetryAttempts; }
    public void setMaxRetryAttempts(int maxRetryAttempts) { this.maxRetryAttempts = maxRetryAttempts; }

    public Instant getStartDate() { return startDate; }
    public void setStartDate(Instant startDate) { this.startDate = startDate; }

    public Instant getEndDate() { return endDate; }
    public void setEndDate(Instant endDate) { this.endDate = endDate; }

    public Set<String> getTags() { return tags; }
    public void setTags(Set<String> tags) { this.tags = tags != null ? tags : new HashSet<>(); }

    public int getPriority() { return priority; }
    public void setPriority(int priority) { this.priority = priority; }

    public Map<String, String> getMetadata() { return metadata; }
    public void setMetadata(Map<String, String> metadata) { this.metadata = metadata != null ? metadata : new HashMap<>(); }

    @Override
    public String toString() {
        return "RecurringCronJob{id='" + id + "', name='" + name + "', cron='" + cronExpression
                + "', enabled=" + enabled + ", nextRunUtc=" + nextRunUtc + "}";
    }
}
