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

package org.fireflyframework.dispatch.coordination.backend;

import org.fireflyframework.dispatch.MutableClock;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;

class InMemoryCoordinationBackendTest {

    private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
    private final InMemoryCoordinationBackend backend = new InMemoryCoordinationBackend(clock);

    @Test
    void setIfAbsentOnlySucceedsWhileKeyIsFreeOrExpired() {
        StepVerifier.create(backend.setIfAbsent("lock", "a", Duration.ofSeconds(10))).expectNext(true).verifyComplete();
        StepVerifier.create(backend.setIfAbsent("lock", "b", Duration.ofSeconds(10))).expectNext(false).verifyComplete();

        clock.advance(Duration.ofSeconds(10));

        StepVerifier.create(backend.setIfAbsent("lock", "b", Duration.ofSeconds(10))).expectNext(true).verifyComplete();
        StepVerifier.create(backend.get("lock")).expectNext("b").verifyComplete();
    }

    @Test
    void renewRequiresMatchingValue() {
        backend.setIfAbsent("lock", "owner", Duration.ofSeconds(10)).block();
        clock.advance(Duration.ofSeconds(8));

        StepVerifier.create(backend.renew("lock", "intruder", Duration.ofSeconds(10))).expectNext(false).verifyComplete();
        StepVerifier.create(backend.renew("lock", "owner", Duration.ofSeconds(10))).expectNext(true).verifyComplete();

        clock.advance(Duration.ofSeconds(8));
        StepVerifier.create(backend.get("lock")).expectNext("owner").verifyComplete();
    }

    @Test
    void renewFailsOnceExpired() {
        backend.setIfAbsent("lock", "owner", Duration.ofSeconds(1)).block();
        clock.advance(Duration.ofSeconds(2));

        StepVerifier.create(backend.renew("lock", "owner", Duration.ofSeconds(10))).expectNext(false).verifyComplete();
        StepVerifier.create(backend.get("lock")).verifyComplete();
    }

    @Test
    void deleteIfValueLeavesOtherOwnersAlone() {
        backend.setIfAbsent("lock", "owner", Duration.ofSeconds(10)).block();

        StepVerifier.create(backend.deleteIfValue("lock", "intruder")).expectNext(false).verifyComplete();
        StepVerifier.create(backend.deleteIfValue("lock", "owner")).expectNext(true).verifyComplete();
        StepVerifier.create(backend.get("lock")).verifyComplete();
    }

    @Test
    void plainValuesAndSets() {
        backend.set("k", "v1", null).block();
        backend.set("k", "v2", null).block();
        StepVerifier.create(backend.get("k")).expectNext("v2").verifyComplete();
        StepVerifier.create(backend.delete("k")).expectNext(true).verifyComplete();
        StepVerifier.create(backend.delete("k")).expectNext(false).verifyComplete();

        backend.addToSet("s", "a").block();
        backend.addToSet("s", "b").block();
        backend.addToSet("s", "a").block();
        backend.removeFromSet("s", "b").block();
        StepVerifier.create(backend.members("s")).expectNext("a").verifyComplete();
        StepVerifier.create(backend.members("missing")).verifyComplete();
        StepVerifier.create(backend.ping()).expectNext(true).verifyComplete();
    }
}
