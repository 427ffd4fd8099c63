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

import java.time.Duration;
import java.util.Objects;

/**
 * @param keyPrefix           prepended to every backend key
 * @param instanceStaleness   heartbeat age after which an instance no longer receives jobs
 * @param lockReleaseTimeout  bound on the release call made when a lease is disposed
 * @param completionRetention how long job completions stay readable
 */
public record CoordinationSettings(String keyPrefix, Duration instanceStaleness, Duration lockReleaseTimeout,
                                   Duration completionRetention) {

    public static final String DEFAULT_KEY_PREFIX = "firefly:dispatch:";

    public CoordinationSettings {
        Objects.requireNonNull(keyPrefix, "keyPrefix");
        Objects.requireNonNull(instanceStaleness, "instanceStaleness");
        Objects.requireNonNull(lockReleaseTimeout, "lockReleaseTimeout");
        Objects.requireNonNull(completionRetention, "completionRetention");
    }

    public static CoordinationSettings defaults() {
        return new CoordinationSettings(DEFAULT_KEY_PREFIX, Duration.ofSeconds(30), Duration.ofSeconds(5),
                Duration.ofHours(24));
    }
}
