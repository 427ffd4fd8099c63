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

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.dispatch.coordination.CoordinationHealthIndicator;
import org.fireflyframework.dispatch.coordination.DefaultDistributedJobCoordinator;
import org.fireflyframework.dispatch.coordination.DistributedJobCoordinator;
import org.fireflyframework.dispatch.coordination.JobInstanceCapabilities;
import org.fireflyframework.dispatch.coordination.JobInstanceHeartbeat;
import org.fireflyframework.dispatch.coordination.JobInstanceInfo;
import org.fireflyframework.dispatch.coordination.backend.CoordinationBackend;
import org.fireflyframework.dispatch.coordination.backend.InMemoryCoordinationBackend;
import org.fireflyframework.dispatch.core.DispatchMessage;
import org.fireflyframework.dispatch.core.Dispatcher;
import org.fireflyframework.dispatch.handler.BeanFactoryHandlerFactory;
import org.fireflyframework.dispatch.handler.DefaultDispatcher;
import org.fireflyframework.dispatch.handler.HandlerFactory;
import org.fireflyframework.dispatch.handler.HandlerRegistry;
import org.fireflyframework.dispatch.handler.MessageHandler;
import org.fireflyframework.dispatch.handler.ResponseHandler;
import org.fireflyframework.dispatch.pipeline.DispatchMiddleware;
import org.fireflyframework.dispatch.pipeline.MiddlewarePipeline;
import org.fireflyframework.dispatch.pipeline.observability.DispatchMetrics;
import org.fireflyframework.dispatch.pipeline.observability.MetricsMiddleware;
import org.fireflyframework.dispatch.pipeline.resilience.CircuitBreakerMiddleware;
import org.fireflyframework.dispatch.pipeline.resilience.RetryMiddleware;
import org.fireflyframework.dispatch.saga.InMemorySagaStore;
import org.fireflyframework.dispatch.saga.SagaOrchestrator;
import org.fireflyframework.dispatch.saga.SagaStore;
import org.fireflyframework.dispatch.saga.observability.SagaEvents;
import org.fireflyframework.dispatch.saga.observability.SagaLoggerEvents;
import org.fireflyframework.dispatch.scheduling.DefaultMessageScheduler;
import org.fireflyframework.dispatch.scheduling.InMemoryScheduleStore;
import org.fireflyframework.dispatch.scheduling.JacksonMessageSerializer;
import org.fireflyframework.dispatch.scheduling.MessageScheduler;
import org.fireflyframework.dispatch.scheduling.MessageSerializer;
import org.fireflyframework.dispatch.scheduling.MessageTypeRegistry;
import org.fireflyframework.dispatch.scheduling.MicrometerScheduleOperationMonitor;
import org.fireflyframework.dispatch.scheduling.ScheduleOperationMonitor;
import org.fireflyframework.dispatch.scheduling.ScheduleStore;
import org.fireflyframework.dispatch.scheduling.ScheduledMessageService;
import org.fireflyframework.dispatch.scheduling.cron.CronJobProcessor;
import org.fireflyframework.dispatch.scheduling.cron.CronJobStore;
import org.fireflyframework.dispatch.scheduling.cron.InMemoryCronJobStore;
import org.fireflyframework.dispatch.scheduling.cron.MessageDispatchJob;
import org.fireflyframework.dispatch.security.LoggingSecurityEventLogger;
import org.fireflyframework.dispatch.security.SecurityEventLogger;
import org.fireflyframework.dispatch.util.JsonUtils;
import org.fireflyframework.dispatch.validation.InputValidationMiddleware;
import org.fireflyframework.dispatch.validation.InputValidator;
import org.fireflyframework.dispatch.validation.validators.InputValidators;
import org.fireflyframework.dispatch.versioning.MessageUpcaster;
import org.fireflyframework.dispatch.versioning.UpcastingBuilder;
import org.fireflyframework.dispatch.versioning.UpcastingMiddleware;
import org.fireflyframework.dispatch.versioning.UpcastingPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.ResolvableType;
import org.springframework.util.ClassUtils;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Spring configuration that wires the Dispatch Engine components.
 * Users typically activate it via {@link org.fireflyframework.dispatch.annotations.EnableDispatchEngine}.
 * <p>
 * Every component can be replaced by declaring a bean of the same type. Background loops
 * (scheduled messages, cron jobs, instance heartbeats) only start when enabled under
 * {@code firefly.dispatch.*}.
 */
@Configuration
@EnableConfigurationProperties(DispatchEngineProperties.class)
public class DispatchEngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DispatchEngineConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock dispatchClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchMetrics dispatchMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new DispatchMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    // --- pipeline ---

    @Bean
    @ConditionalOnMissingBean
    public SecurityEventLogger securityEventLogger() {
        return new LoggingSecurityEventLogger();
    }

    @Bean
    @ConditionalOnMissingBean
    public InputValidationMiddleware inputValidationMiddleware(DispatchEngineProperties properties,
                                                               ObjectProvider<InputValidator> customValidators,
                                                               SecurityEventLogger securityEventLogger,
                                                               DispatchMetrics metrics,
                                                               Clock clock) {
        List<InputValidator> validators = new ArrayList<>(InputValidators.fromOptions(properties.getValidation()));
        customValidators.orderedStream().forEach(validators::add);
        return new InputValidationMiddleware(properties.getValidation(), validators, securityEventLogger, metrics, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public UpcastingPipeline upcastingPipeline(DispatchEngineProperties properties,
                                               ObjectProvider<MessageUpcaster<?, ?>> upcasters) {
        UpcastingBuilder builder = new UpcastingBuilder()
                .enableAutoUpcastOnReplay(properties.getVersioning().isAutoUpcastOnReplay());
        upcasters.orderedStream().forEach(upcaster -> builder.registerUpcaster(upcaster));
        properties.getVersioning().getScanPackages().forEach(pkg -> builder.scanPackage(pkg, type -> true));
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public UpcastingMiddleware upcastingMiddleware(UpcastingPipeline upcastingPipeline) {
        return new UpcastingMiddleware(upcastingPipeline);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.dispatch.resilience", name = "retry-enabled", havingValue = "true")
    public RetryMiddleware retryMiddleware(DispatchEngineProperties properties) {
        return new RetryMiddleware(properties.getResilience().toRetryPolicy());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.dispatch.resilience", name = "circuit-breaker-enabled", havingValue = "true")
    public CircuitBreakerMiddleware circuitBreakerMiddleware(DispatchEngineProperties properties, Clock clock) {
        DispatchEngineProperties.ResilienceProperties resilience = properties.getResilience();
        return new CircuitBreakerMiddleware(resilience.getFailureThreshold(), resilience.getOpenDuration(),
                resilience.getHalfOpenMaxCalls(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.dispatch.observability", name = "metrics-enabled", havingValue = "true",
            matchIfMissing = true)
    public MetricsMiddleware metricsMiddleware(DispatchMetrics metrics) {
        return new MetricsMiddleware(metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public MiddlewarePipeline dispatchPipeline(ObjectProvider<DispatchMiddleware> middlewares) {
        MiddlewarePipeline pipeline = new MiddlewarePipeline(middlewares.orderedStream().collect(Collectors.toList()));
        log.info("Dispatch pipeline: {}", pipeline.middlewares().stream()
                .map(m -> m.stage() + ":" + m.getClass().getSimpleName())
                .collect(Collectors.joining(", ")));
        return pipeline;
    }

    // --- handlers ---

    @Bean
    @ConditionalOnMissingBean
    public HandlerRegistry handlerRegistry(ApplicationContext applicationContext) {
        HandlerRegistry registry = new HandlerRegistry();
        registerHandlerBeans(applicationContext, registry, MessageHandler.class);
        registerHandlerBeans(applicationContext, registry, ResponseHandler.class);
        log.info("Registered {} message handler(s)", registry.entries().size());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public HandlerFactory handlerFactory(ApplicationContext applicationContext) {
        return new BeanFactoryHandlerFactory(applicationContext.getAutowireCapableBeanFactory());
    }

    @Bean
    @ConditionalOnMissingBean
    public Dispatcher dispatcher(HandlerRegistry handlerRegistry, HandlerFactory handlerFactory,
                                 MiddlewarePipeline dispatchPipeline) {
        return new DefaultDispatcher(handlerRegistry, handlerFactory, dispatchPipeline);
    }

    // --- scheduling ---

    @Bean
    @ConditionalOnMissingBean
    public MessageTypeRegistry messageTypeRegistry(HandlerRegistry handlerRegistry) {
        MessageTypeRegistry types = new MessageTypeRegistry();
        handlerRegistry.entries().forEach(entry -> types.register(entry.messageType()));
        return types;
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageSerializer messageSerializer() {
        return new JacksonMessageSerializer(JsonUtils.mapper());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleStore scheduleStore() {
        return new InMemoryScheduleStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleOperationMonitor scheduleOperationMonitor(DispatchMetrics metrics) {
        return new MicrometerScheduleOperationMonitor(metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageScheduler messageScheduler(ScheduleStore scheduleStore, MessageSerializer messageSerializer,
                                             MessageTypeRegistry messageTypeRegistry, Clock clock) {
        return new DefaultMessageScheduler(scheduleStore, messageSerializer, messageTypeRegistry, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.dispatch.scheduler", name = "enabled", havingValue = "true")
    public ScheduledMessageService scheduledMessageService(ScheduleStore scheduleStore,
                                                           MessageSerializer messageSerializer,
                                                           MessageTypeRegistry messageTypeRegistry,
                                                           Dispatcher dispatcher,
                                                           ScheduleOperationMonitor monitor,
                                                           DispatchEngineProperties properties,
                                                           Clock clock) {
        DispatchEngineProperties.SchedulerProperties scheduler = properties.getScheduler();
        return new ScheduledMessageService(scheduleStore, messageSerializer, messageTypeRegistry, dispatcher, monitor,
                scheduler.getPollInterval(), scheduler.toTimeouts(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public CronJobStore cronJobStore(Clock clock) {
        return new InMemoryCronJobStore(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageDispatchJob messageDispatchJob(MessageTypeRegistry messageTypeRegistry,
                                                 MessageSerializer messageSerializer, Dispatcher dispatcher) {
        return new MessageDispatchJob(messageTypeRegistry, messageSerializer, dispatcher);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.dispatch.cron", name = "enabled", havingValue = "true")
    public CronJobProcessor cronJobProcessor(CronJobStore cronJobStore, MessageDispatchJob messageDispatchJob,
                                             DispatchEngineProperties properties, Clock clock) {
        DispatchEngineProperties.CronProperties cron = properties.getCron();
        return new CronJobProcessor(cronJobStore, messageDispatchJob, cron.getPollInterval(),
                cron.getMissedExecutionThreshold(), cron.getMaxCatchUpExecutions(), clock);
    }

    // --- coordination ---

    @Bean
    @ConditionalOnMissingBean
    public CoordinationBackend coordinationBackend(Clock clock) {
        return new InMemoryCoordinationBackend(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public DistributedJobCoordinator distributedJobCoordinator(CoordinationBackend coordinationBackend,
                                                               DispatchEngineProperties properties, Clock clock) {
        DispatchEngineProperties.CoordinationProperties coordination = properties.getCoordination();
        String instanceId = coordination.getInstanceId() != null && !coordination.getInstanceId().isBlank()
                ? coordination.getInstanceId()
                : hostName() + "-" + UUID.randomUUID().toString().substring(0, 8);
        log.info("Coordinating as instance {} with {}", instanceId, coordinationBackend.getClass().getSimpleName());
        return new DefaultDistributedJobCoordinator(coordinationBackend, instanceId, coordination.toSettings(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.dispatch.coordination", name = "enabled", havingValue = "true")
    public JobInstanceHeartbeat jobInstanceHeartbeat(DistributedJobCoordinator coordinator,
                                                     DispatchEngineProperties properties, Clock clock) {
        DispatchEngineProperties.CoordinationProperties coordination = properties.getCoordination();
        JobInstanceCapabilities capabilities = new JobInstanceCapabilities(coordination.getMaxConcurrentJobs(),
                coordination.getSupportedJobTypes(), coordination.getPriority(), null);
        return new JobInstanceHeartbeat(coordinator,
                () -> JobInstanceInfo.create(coordinator.getInstanceId(), hostName(), capabilities, clock.instant()),
                coordination.getHeartbeatInterval(), coordination.getLockReleaseTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public CoordinationHealthIndicator coordinationHealthIndicator(CoordinationBackend coordinationBackend,
                                                                   DistributedJobCoordinator coordinator,
                                                                   DispatchEngineProperties properties) {
        return new CoordinationHealthIndicator(coordinationBackend, coordinator,
                properties.getCoordination().getInstanceStaleness());
    }

    // --- saga ---

    @Bean
    @ConditionalOnMissingBean
    public SagaEvents sagaEvents() {
        return new SagaLoggerEvents();
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaStore sagaStore(DispatchEngineProperties properties, Clock clock) {
        return new InMemorySagaStore(clock, properties.getSaga().getRetention());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.dispatch.saga", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SagaOrchestrator sagaOrchestrator(SagaStore sagaStore, SagaEvents sagaEvents, Clock clock) {
        return new SagaOrchestrator(sagaStore, sagaEvents, clock);
    }

    @SuppressWarnings("unchecked")
    private static void registerHandlerBeans(ApplicationContext context, HandlerRegistry registry, Class<?> handlerKind) {
        for (String beanName : context.getBeanNamesForType(handlerKind)) {
            Class<?> beanType = context.getType(beanName);
            if (beanType == null) {
                continue;
            }
            Class<?> handlerType = ClassUtils.getUserClass(beanType);
            Class<?> messageType = ResolvableType.forClass(handlerType).as(handlerKind).getGeneric(0).resolve();
            if (messageType == null || !DispatchMessage.class.isAssignableFrom(messageType)) {
                log.warn("Cannot determine the message type handled by bean '{}' ({})", beanName, handlerType.getName());
                continue;
            }
            registry.register((Class<? extends DispatchMessage>) messageType, handlerType);
        }
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Local host name unavailable, using 'localhost'", e);
            return "localhost";
        }
    }
}
