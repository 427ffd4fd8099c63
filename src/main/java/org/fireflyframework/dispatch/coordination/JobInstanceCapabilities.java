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

import java.util.Set;

/**
 * What an instance is able to run.
 *
 * @param maxConcurrentJobs  upper bound of jobs assigned at once, strictly positive
 * @param supportedJobTypes  exact, case-sensitive job types; {@value #ANY_JOB_TYPE} matches every type
 * @param priority           higher priority instances win ties on load
 * @param tags               free-form labels
 */
public record JobInstanceCapabilities(int maxConcurrentJobs, Set<String> supportedJobTypes, int priority,
                                      Set<String> tags) {

    public static final String ANY_JOB_TYPE = "*";

    public JobInstanceCapabilities {
        if (maxConcurrentJobs <= 0) {
            throw new IllegalArgumentException("maxConcurrentJobs must be > 0");
        }
        supportedJobTypes = supportedJobTypes == null ? Set.of() : Set.copyOf(supportedJobTypes);
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public static JobInstanceCapabilities any(int maxConcurrentJobs) {
        return new JobInstanceCapabilities(maxConcurrentJobs, Set.of(ANY_JOB_TYPE), 0, Set.of());
    }

    public static JobInstanceCapabilities of(int maxConcurrentJobs, String... jobTypes) {
        return new JobInstanceCapabilities(maxConcurrentJobs, Set.of(jobTypes), 0, Set.of());
    }

    public JobInstanceCapabilities withPriority(int priority) {
        return new JobInstanceCapabilities(maxConcurrentJobs, supportedJobTypes, priority, tags);
    }

    public boolean canHandle(String jobType) {
        return supportedJobTypes.contains(ANY_JOB_TYPE) || supportedJobTypes.contains(jobType);
    }
}
