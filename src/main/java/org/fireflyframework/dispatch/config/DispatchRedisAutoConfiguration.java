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

import org.fireflyframework.dispatch.coordination.backend.CoordinationBackend;
import org.fireflyframework.dispatch.coordination.backend.RedisCoordinationBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;

/**
 * Auto-configuration for the Redis coordination backend.
 * <p>
 * This configuration is only loaded when Redis classes are available on the classpath,
 * and takes effect with {@code firefly.dispatch.coordination.backend=redis}. The backend it
 * declares is primary, so it wins over the in-memory default.
 */
@AutoConfiguration
@EnableConfigurationProperties(DispatchEngineProperties.class)
@ConditionalOnClass({ReactiveRedisConnectionFactory.class, ReactiveRedisTemplate.class})
@ConditionalOnProperty(
    name = "firefly.dispatch.coordination.backend",
    havingValue = "redis",
    matchIfMissing = false
)
public class DispatchRedisAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DispatchRedisAutoConfiguration.class);

    /**
     * Connection factory used when the application does not provide one.
     */
    @Bean
    @ConditionalOnMissingBean(ReactiveRedisConnectionFactory.class)
    public LettuceConnectionFactory dispatchRedisConnectionFactory(DispatchEngineProperties properties) {
        DispatchEngineProperties.RedisProperties redis = properties.getCoordination().getRedis();

        log.info("Configuring Redis connection factory for dispatch coordination: {}:{}",
                redis.getHost(), redis.getPort());

        LettuceConnectionFactory factory = new LettuceConnectionFactory(redis.getHost(), redis.getPort());
        factory.setDatabase(redis.getDatabase());
        if (redis.getPassword() != null) {
            factory.setPassword(redis.getPassword());
        }
        factory.setValidateConnection(true);
        return factory;
    }

    @Bean
    @ConditionalOnMissingBean(name = "dispatchReactiveRedisTemplate")
    public ReactiveRedisTemplate<String, String> dispatchReactiveRedisTemplate(
            ReactiveRedisConnectionFactory connectionFactory) {
        return new ReactiveRedisTemplate<>(connectionFactory, RedisSerializationContext.string());
    }

    @Bean
    @Primary
    public CoordinationBackend redisCoordinationBackend(ReactiveRedisTemplate<String, String> dispatchReactiveRedisTemplate) {
        log.info("Using Redis coordination backend");
        return new RedisCoordinationBackend(dispatchReactiveRedisTemplate);
    }
}
