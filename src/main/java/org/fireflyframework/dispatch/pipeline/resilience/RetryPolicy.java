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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retry with exponential or fixed backoff.
 * <p>
 * {@code getDelay(attempt)} is {@code min(initialDelay * multiplier^(attempt-1), maxDelay)}; with
 * jitter enabled a random 0-20% of that value is added.
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofMinutes(1);
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0d;

    private static final double MAX_JITTER_FRACTION = 0.2d;

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double backoffMultiplier;
    private final boolean useJitter;
    private final List<Class<? extends Throwable>> retryableExceptions;

    private RetryPolicy(Builder b) {
        if (b.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (b.backoffMultiplier < 1.0d) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        this.maxAttempts = b.maxAttempts;
        this.initialDelay = Objects.requireNonNull(b.initialDelay, "initialDelay");
        this.maxDelay = Objects.requireNonNull(b.maxDelay, "maxDelay");
        this.backoffMultiplier = b.backoffMultiplier;
        this.useJitter = b.useJitter;
        this.retryableExceptions = List.copyOf(b.retryableExceptions);
    }

    /** Policy with the default settings: 3 attempts, 1s initial delay doubling up to 1 minute, jitter on. */
    public static RetryPolicy defaults() {
        return builder().build();
    }

    public static RetryPolicy exponential(int maxAttempts, Duration initialDelay, Duration maxDelay, double multiplier) {
        return builder().maxAttempts(maxAttempts).initialDelay(initialDelay).maxDelay(maxDelay)
                .backoffMultiplier(multiplier).build();
    }

    public static RetryPolicy fixedDelay(int maxAttempts, Duration delay) {
        return builder().maxAttempts(maxAttempts).initialDelay(delay).maxDelay(delay)
                .backoffMultiplier(1.0d).useJitter(false).build();
    }

    /** A single attempt, never retried. */
    public static RetryPolicy none() {
        return builder().maxAttempts(1).initialDelay(Duration.ZERO).maxDelay(Duration.ZERO)
                .backoffMultiplier(1.0d).useJitter(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Delay to wait after the given (1-based) failed attempt.
     */
    public Duration getDelay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        double base = initialDelay.toMillis() * Math.pow(backoffMultiplier, attempt - 1);
        long capped = (long) Math.min(base, (double) maxDelay.toMillis());
        if (useJitter && capped > 0) {
            capped += (long) (capped * ThreadLocalRandom.current().nextDouble(MAX_JITTER_FRACTION));
        }
        return Duration.ofMillis(capped);
    }

    /**
     * Whether another attempt should follow the given (1-based) failed attempt.
     * A {@code null} error stands for a failure reported without an exception.
     */
    public boolean shouldRetry(int attempt, Throwable error) {
        if (attempt >= maxAttempts) {
            return false;
        }
        if (retryableExceptions.isEmpty() || error == null) {
            return true;
        }
        return retryableExceptions.stream().anyMatch(type -> type.isInstance(error));
    }

    public int getMaxAttempts() { return maxAttempts; }
    public Duration getInitialDelay() { return initialDelay; }
    public Duration getMaxDelay() { return maxDelay; }
    public double getBackoffMultiplier() { return backoffMultiplier; }
    public boolean isUseJitter() { return useJitter; }
    public List<Class<? extends Throwable>> getRetryableExceptions() { return retryableExceptions; }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", initialDelay=" + initialDelay + ", maxDelay=" + maxDelay
                + ", backoffMultiplier=" + backoffMultiplier + ", useJitter=" + useJitter + "}";
    }

    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration initialDelay = DEFAULT_INITIAL_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
        private boolean useJitter = true;
        private final List<Class<? extends Throwable>> retryableExceptions = new ArrayList<>();

        private Builder() {
        }

        public Builder maxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; return this; }
        public Builder initialDelay(Duration initialDelay) { this.initialDelay = initialDelay; return this; }
        public Builder maxDelay(Duration maxDelay) { this.maxDelay = maxDelay; return this; }
        public Builder backoffMultiplier(double multiplier) { this.backoffMultiplier = multiplier; return this; }
        public Builder useJitter(boolean useJitter) { this.useJitter = useJitter; return this; }

        @SafeVarargs
        public final Builder retryOn(Class<? extends Throwable>... types) {
            this.retryableExceptions.addAll(List.of(types));
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
