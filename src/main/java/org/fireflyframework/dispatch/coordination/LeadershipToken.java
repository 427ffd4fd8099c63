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

import org.fireflyframework.dispatch.coordination.backend.CoordinationBackend;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Leadership of a named group, held by one instance until it expires or is released.
 */
public class LeadershipToken extends AbstractLease {

    private final String leaderKey;

    LeadershipToken(CoordinationBackend backend, String leaderKey, String backendKey, String instanceId,
                    Instant acquiredAt, Instant expiresAt, Duration releaseTimeout, Clock clock) {
        super(backend, backendKey, instanceId, instanceId, acquiredAt, expiresAt, releaseTimeout, clock);
        this.leaderKey = leaderKey;
    }

    public String getLeaderKey() {
        return leaderKey;
    }

    @Override
    public String toString() {
        return "LeadershipToken{leaderKey='" + leaderKey + "', instanceId='" + getInstanceId()
                + "', expiresAt=" + getExpiresAt() + "}";
    }
}
