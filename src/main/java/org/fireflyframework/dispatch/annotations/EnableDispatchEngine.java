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
package org.fireflyframework.dispatch.annotations;

import org.fireflyframework.dispatch.config.DispatchEngineConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enables the Dispatch Engine components in a Spring application.
 * <p>
 * This annotation imports {@link DispatchEngineConfiguration} directly so it works
 * in both Spring Boot (auto-configuration) and plain Spring contexts
 * (e.g. {@code AnnotationConfigApplicationContext}).
 * <p>
 * The Redis coordination backend is registered via
 * {@code META-INF/spring/org.springframework.boot.autoconfigure.AutoConfiguration.imports}
 * and activated with {@code firefly.dispatch.coordination.backend=redis}.
 * <p>
 * Components wired by this annotation:
 * - {@code Dispatcher}: the middleware pipeline in front of the registered handlers
 * - {@code HandlerRegistry}: every {@code MessageHandler} and {@code ResponseHandler} bean
 * - {@code UpcastingPipeline}: every {@code MessageUpcaster} bean
 * - {@code MessageScheduler}, {@code CronJobStore} and their optional poll loops
 * - {@code DistributedJobCoordinator}: in-memory unless Redis is selected
 * - {@code SagaOrchestrator} with {@code SagaLoggerEvents} (override by declaring your own bean)
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
@Import(DispatchEngineConfiguration.class)
public @interface EnableDispatchEngine {
}
