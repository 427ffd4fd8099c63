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
package org.fireflyframework.dispatch.coordination;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Registration record of one coordinating instance.
 */
public record JobInstanceInfo(String instanceId, String hostName, JobInstanceCapabilities capabilities,
                              JobInstanceStatus status, int activeJobCount, Instant registeredAt,
                              Instant lastHeartbeat) {

    public JobInstanceInfo {
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("instanceId must not be blank");
        }
        Objects.requireNonNull(capabilities, "capabilities");
        status = status == null ? JobInstanceStatus.ACTIVE : status;
        if (activeJobCount < 0) {
            throw new IllegalArgumentException("activeJobCount must be >= 0");
        }
    }

    public static JobInstanceInfo create(String instanceId, String hostName, JobInstanceCapabilities capabilities,
                                         Instant now) {
        return new JobInstanceInfo(instanceId, hostName, capabilities, JobInstanceStatus.ACTIVE, 0, now, now);
    }

    /**
     * Active and heard from within {@code staleness}.
     */
    public boolean isHealthy(Duration staleness, Instant now) {
        return status == JobInstanceStatus.ACTIVE
                && lastHeartbeat != null
                && Duration.between(lastHeartbeat, now).compareTo(staleness) < 0;
    }

    public boolean isHealthy(Duration staleness) {
        return isHealthy(staleness, Instant.now());
    }

    @JsonIgnore
    public boolean hasCapacity() {
        return activeJobCount < capabilities.maxConcurrentJobs();
    }

    public JobInstanceInfo withStatus(JobInstanceStatus newStatus) {
        return new JobInstanceInfo(instanceId, hostName, capabilities, newStatus, activeJobCount, registeredAt, lastHeartbeat);
    }

    public JobInstanceInfo withHeartbeat(Instant at) {
        return new JobInstanceInfo(instanceId, hostName, capabilities, status, activeJobCount, registeredAt, at);
    }

    public JobInstanceInfo withActiveJobCount(int count) {
        return new JobInstanceInfo(instanceId, hostName, capabilities, status, Math.max(0, count), registeredAt, lastHeartbeat);
    }
}
