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

package org.fireflyframework.dispatch.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MessageResultTest {

    @Test
    void successCarriesOptionalValue() {
        assertThat(MessageResult.success().isSuccess()).isTrue();
        assertThat(MessageResult.success().value()).isEmpty();

        MessageResult withValue = MessageResult.success(42);
        assertThat(withValue.valueAs(Integer.class)).contains(42);
        assertThat(withValue.valueAs(String.class)).isEmpty();
    }

    @Test
    void failureFromExceptionUsesHandlerProblemType() {
        IllegalStateException error = new IllegalStateException("boom");

        MessageResult result = MessageResult.failure(error);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isValidationFailure()).isFalse();
        assertThat(result.problemType()).isEqualTo(MessageResult.HANDLER_PROBLEM_TYPE);
        assertThat(result.title()).isEqualTo("IllegalStateException");
        assertThat(result.detail()).isEqualTo("boom");
        assertThat(result.error()).isSameAs(error);
    }

    @Test
    void validationFailureListsErrors() {
        MessageResult result = MessageResult.validationFailed(List.of("a is required", "b too long"));

        assertThat(result.isValidationFailure()).isTrue();
        assertThat(result.validationErrors()).containsExactly("a is required", "b too long");
        assertThat(result.detail()).isEqualTo("a is required; b too long");
    }
}
