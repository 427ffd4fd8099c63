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
package org.fireflyframework.dispatch.config;

import org.fireflyframework.dispatch.coordination.CoordinationSettings;
import org.fireflyframework.dispatch.pipeline.resilience.RetryPolicy;
import org.fireflyframework.dispatch.scheduling.SchedulerTimeouts;
import org.fireflyframework.dispatch.validation.InputValidationOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Configuration properties for the Dispatch Engine.
 *
 * <p>
 * Example configuration:
 * <pre>
 * firefly.dispatch.validation.max-message-age-days=7
 * firefly.dispatch.resilience.retry-enabled=true
 * firefly.dispatch.resilience.max-attempts=5
 * firefly.dispatch.scheduler.enabled=true
 * firefly.dispatch.scheduler.poll-interval=PT10S
 * firefly.dispatch.cron.enabled=true
 * firefly.dispatch.coordination.enabled=true
 * firefly.dispatch.coordination.backend=redis
 * firefly.dispatch.coordination.redis.host=localhost
 * firefly.dispatch.coordination.redis.port=6379
 * </pre>
 */
@ConfigurationProperties(prefix = "firefly.dispatch")
public class DispatchEngineProperties {

    /**
     * Input validation middleware settings.
     */
    @NestedConfigurationProperty
    private InputValidationOptions validation = new InputValidationOptions();

    @NestedConfigurationProperty
    private ResilienceProperties resilience = new ResilienceProperties();

    @NestedConfigurationProperty
    private VersioningProperties versioning = new VersioningProperties();

    @NestedConfigurationProperty
    private SchedulerProperties scheduler = new SchedulerProperties();

    @NestedConfigurationProperty
    private CronProperties cron = new CronProperties();

    @NestedConfigurationProperty
    private CoordinationProperties coordination = new CoordinationProperties();

    @NestedConfigurationProperty
    private SagaProperties saga = new SagaProperties();

    @NestedConfigurationProperty
    private ObservabilityProperties observability = new ObservabilityProperties();

    public InputValidationOptions getValidation() { return validation; }
    public void setValidation(InputValidationOptions validation) { this.validation = validation; }

    public ResilienceProperties getResilience() { return resilience; }
    public void setResilience(ResilienceProperties resilience) { this.resilience = resilience; }

    public VersioningProperties getVersioning() { return versioning; }
    public void setVersioning(VersioningProperties versioning) { this.versioning = versioning; }

    public SchedulerProperties getScheduler() { return scheduler; }
    public void setScheduler(SchedulerProperties scheduler) { this.scheduler = scheduler; }

    public CronProperties getCron() { return cron; }
    public void setCron(CronProperties cron) { this.cron = cron; }

    public CoordinationProperties getCoordination() { return coordination; }
    public void setCoordination(CoordinationProperties coordination) { this.coordination = coordination; }

    public SagaProperties getSaga() { return saga; }
    public void setSaga(SagaProperties saga) { this.saga = saga; }

    public ObservabilityProperties getObservability() { return observability; }
    public void setObservability(ObservabilityProperties observability) { this.observability = observability; }

    /**
     * Retry and circuit breaker middleware. Both are off unless enabled.
     */
    public static class ResilienceProperties {
        private boolean retryEnabled = false;
        private int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
        private Duration initialDelay = RetryPolicy.DEFAULT_INITIAL_DELAY;
        private Duration maxDelay = RetryPolicy.DEFAULT_MAX_DELAY;
        private double backoffMultiplier = RetryPolicy.DEFAULT_BACKOFF_MULTIPLIER;
        private boolean useJitter = true;
        private boolean circuitBreakerEnabled = false;
        private int failureThreshold = 5;
        private Duration openDuration = Duration.ofSeconds(30);
        private int halfOpenMaxCalls = 1;

        public RetryPolicy toRetryPolicy() {
            return RetryPolicy.builder()
                    .maxAttempts(maxAttempts)
                    .initialDelay(initialDelay)
                    .maxDelay(maxDelay)
                    .backoffMultiplier(backoffMultiplier)
                    .useJitter(useJitter)
                    .build();
        }

        public boolean isRetryEnabled() { return retryEnabled; }
        public void setRetryEnabled(boolean retryEnabled) { this.retryEnabled = retryEnabled; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }
        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
        public boolean isUseJitter() { return useJitter; }
        public void setUseJitter(boolean useJitter) { this.useJitter = useJitter; }
        public boolean isCircuitBreakerEnabled() { return circuitBreakerEnabled; }
        public void setCircuitBreakerEnabled(boolean circuitBreakerEnabled) { this.circuitBreakerEnabled = circuitBreakerEnabled; }
        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public Duration getOpenDuration() { return openDuration; }
        public void setOpenDuration(Duration openDuration) { this.openDuration = openDuration; }
        public int getHalfOpenMaxCalls() { return halfOpenMaxCalls; }
        public void setHalfOpenMaxCalls(int halfOpenMaxCalls) { this.halfOpenMaxCalls = halfOpenMaxCalls; }
    }

    public static class VersioningProperties {
        /**
         * Packages scanned for MessageUpcaster implementations in addition to upcaster beans.
         */
        private Set<String> scanPackages = new LinkedHashSet<>();
        private boolean autoUpcastOnReplay = true;

        public Set<String> getScanPackages() { return scanPackages; }
        public void setScanPackages(Set<String> scanPackages) { this.scanPackages = scanPackages; }
        public boolean isAutoUpcastOnReplay() { return autoUpcastOnReplay; }
        public void setAutoUpcastOnReplay(boolean autoUpcastOnReplay) { this.autoUpcastOnReplay = autoUpcastOnReplay; }
    }

    public static class SchedulerProperties {
        private boolean enabled = false;
        private Duration pollInterval = Duration.ofSeconds(10);
        private Duration typeResolutionTimeout = Duration.ofSeconds(5);
        private Duration deserializationTimeout = Duration.ofSeconds(10);
        private Duration dispatchTimeout = Duration.ofSeconds(30);

        public SchedulerTimeouts toTimeouts() {
            return new SchedulerTimeouts(typeResolutionTimeout, deserializationTimeout, dispatchTimeout);
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public Duration getTypeResolutionTimeout() { return typeResolutionTimeout; }
        public void setTypeResolutionTimeout(Duration typeResolutionTimeout) { this.typeResolutionTimeout = typeResolutionTimeout; }
        public Duration getDeserializationTimeout() { return deserializationTimeout; }
        public void setDeserializationTimeout(Duration deserializationTimeout) { this.deserializationTimeout = deserializationTimeout; }
        public Duration getDispatchTimeout() { return dispatchTimeout; }
        public void setDispatchTimeout(Duration dispatchTimeout) { this.dispatchTimeout = dispatchTimeout; }
    }

    public static class CronProperties {
        private boolean enabled = false;
        private Duration pollInterval = Duration.ofSeconds(30);
        /**
         * Age after which a due occurrence counts as missed.
         */
        private Duration missedExecutionThreshold = Duration.ofMinutes(1);
        private int maxCatchUpExecutions = 10;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public Duration getMissedExecutionThreshold() { return missedExecutionThreshold; }
        public void setMissedExecutionThreshold(Duration missedExecutionThreshold) { this.missedExecutionThreshold = missedExecutionThreshold; }
        public int getMaxCatchUpExecutions() { return maxCatchUpExecutions; }
        public void setMaxCatchUpExecutions(int maxCatchUpExecutions) { this.maxCatchUpExecutions = maxCatchUpExecutions; }
    }

    public static class CoordinationProperties {
        /**
         * Registers this instance and heartbeats it while the application runs.
         */
        private boolean enabled = false;
        /**
         * {@code in-memory} or {@code redis}.
         */
        private String backend = "in-memory";
        /**
         * Generated from the host name when not set.
         */
        private String instanceId;
        private String keyPrefix = CoordinationSettings.DEFAULT_KEY_PREFIX;
        private Duration heartbeatInterval = Duration.ofSeconds(10);
        private Duration instanceStaleness = Duration.ofSeconds(30);
        private Duration lockReleaseTimeout = Duration.ofSeconds(5);
        private Duration completionRetention = Duration.ofHours(24);
        private int maxConcurrentJobs = 10;
        private Set<String> supportedJobTypes = new LinkedHashSet<>(Set.of("*"));
        private int priority = 0;

        @NestedConfigurationProperty
        private RedisProperties redis = new RedisProperties();

        public CoordinationSettings toSettings() {
            return new CoordinationSettings(keyPrefix, instanceStaleness, lockReleaseTimeout, completionRetention);
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getBackend() { return backend; }
        public void setBackend(String backend) { this.backend = backend; }
        public String getInstanceId() { return instanceId; }
        public void setInstanceId(String instanceId) { this.instanceId = instanceId; }
        public String getKeyPrefix() { return keyPrefix; }
        public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; }
        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
        public Duration getInstanceStaleness() { return instanceStaleness; }
        public void setInstanceStaleness(Duration instanceStaleness) { this.instanceStaleness = instanceStaleness; }
        public Duration getLockReleaseTimeout() { return lockReleaseTimeout; }
        public void setLockReleaseTimeout(Duration lockReleaseTimeout) { this.lockReleaseTimeout = lockReleaseTimeout; }
        public Duration getCompletionRetention() { return completionRetention; }
        public void setCompletionRetention(Duration completionRetention) { this.completionRetention = completionRetention; }
        public int getMaxConcurrentJobs() { return maxConcurrentJobs; }
        public void setMaxConcurrentJobs(int maxConcurrentJobs) { this.maxConcurrentJobs = maxConcurrentJobs; }
        public Set<String> getSupportedJobTypes() { return supportedJobTypes; }
        public void setSupportedJobTypes(Set<String> supportedJobTypes) { this.supportedJobTypes = supportedJobTypes; }
        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }
        public RedisProperties getRedis() { return redis; }
        public void setRedis(RedisProperties redis) { this.redis = redis; }
    }

    public static class RedisProperties {
        private String host = "localhost";
        private int port = 6379;
        private int database = 0;
        private String password;

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
        public int getDatabase() { return database; }
        public void setDatabase(int database) { this.database = database; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
    }

    public static class SagaProperties {
        private boolean enabled = true;
        /** How long finished sagas stay in the in-memory store. */
        private Duration retention = Duration.ofHours(1);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }
    }

    public static class ObservabilityProperties {
        private boolean metricsEnabled = true;

        public boolean isMetricsEnabled() { return metricsEnabled; }
        public void setMetricsEnabled(boolean metricsEnabled) { this.metricsEnabled = metricsEnabled; }
    }
}
