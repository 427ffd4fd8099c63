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

package org.fireflyframework.dispatch.pipeline.resilience;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void exponentialDelayGrowsAndIsCapped() {
        RetryPolicy policy = RetryPolicy.builder()
                .maxAttempts(6)
                .initialDelay(Duration.ofMillis(100))
                .maxDelay(Duration.ofMillis(500))
                .backoffMultiplier(2.0)
                .useJitter(false)
                .build();

        assertThat(policy.getDelay(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.getDelay(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.getDelay(3)).isEqualTo(Duration.ofMillis(400));
        assertThat(policy.getDelay(4)).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void jitterAddsAtMostTwentyPercent() {
        RetryPolicy policy = RetryPolicy.exponential(3, Duration.ofMillis(1000), Duration.ofSeconds(10), 2.0);

        for (int i = 0; i < 50; i++) {
            assertThat(policy.getDelay(1).toMillis()).isBetween(1000L, 1200L);
        }
    }

    @Test
    void shouldRetryStopsAtMaxAttempts() {
        RetryPolicy policy = RetryPolicy.fixedDelay(3, Duration.ofMillis(10));

        assertThat(policy.shouldRetry(1, new RuntimeException())).isTrue();
        assertThat(policy.shouldRetry(2, new RuntimeException())).isTrue();
        assertThat(policy.shouldRetry(3, new RuntimeException())).isFalse();
        assertThat(RetryPolicy.none().shouldRetry(1, new RuntimeException())).isFalse();
    }

    @Test
    void retryableExceptionsFilterRetries() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(5).retryOn(IOException.class).build();

        assertThat(policy.shouldRetry(1, new IOException("io"))).isTrue();
        assertThat(policy.shouldRetry(1, new IllegalStateException("nope"))).isFalse();
    }

    @Test
    void invalidConfigurationIsRejected() {
        assertThatThrownBy(() -> RetryPolicy.builder().maxAttempts(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.builder().backoffMultiplier(0.5).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.defaults().getDelay(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultsMatchDocumentedValues() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertThat(policy.getMaxAttempts()).isEqualTo(3);
        assertThat(policy.getInitialDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.getMaxDelay()).isEqualTo(Duration.ofMinutes(1));
        assertThat(policy.getBackoffMultiplier()).isEqualTo(2.0);
        assertThat(policy.isUseJitter()).isTrue();
    }
}
