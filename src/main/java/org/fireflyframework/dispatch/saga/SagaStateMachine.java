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
package org.fireflyframework.dispatch.saga;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Legal saga state transitions.
 * <pre>
 * CREATED      -> RUNNING | CANCELLED
 * RUNNING      -> COMPLETED | COMPENSATING | CANCELLED
 * COMPENSATING -> COMPENSATED_SUCCESSFULLY | COMPENSATION_FAILED | CANCELLED
 * </pre>
 * Terminal states have no outgoing transition.
 */
public final class SagaStateMachine {

    private static final Map<SagaState, Set<SagaState>> TRANSITIONS = new EnumMap<>(SagaState.class);

    static {
        TRANSITIONS.put(SagaState.CREATED, EnumSet.of(SagaState.RUNNING, SagaState.CANCELLED));
        TRANSITIONS.put(SagaState.RUNNING,
                EnumSet.of(SagaState.COMPLETED, SagaState.COMPENSATING, SagaState.CANCELLED));
        TRANSITIONS.put(SagaState.COMPENSATING, EnumSet.of(SagaState.COMPENSATED_SUCCESSFULLY,
                SagaState.COMPENSATION_FAILED, SagaState.CANCELLED));
    }

    private SagaStateMachine() {
    }

    public static boolean canTransition(SagaState from, SagaState to) {
        return TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    /**
     * @throws SagaStateTransitionException when the transition is not allowed
     */
    public static void validate(SagaState from, SagaState to) {
        if (!canTransition(from, to)) {
            throw new SagaStateTransitionException(from, to);
        }
    }
}
