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
package org.fireflyframework.dispatch.versioning;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeanUtils;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.context.annotation.ClassPathScanningCandidateComponentProvider;
import org.springframework.core.type.filter.AssignableTypeFilter;
import org.springframework.util.ClassUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Fluent registration surface for upcasters. Every method returns the builder.
 *
 * <pre>
 * UpcastingPipeline pipeline = new UpcastingBuilder()
 *     .registerUpcaster(new OrderCreatedV1ToV2())
 *     .scanPackage("com.acme.orders.upcasters", type -&gt; true)
 *     .enableAutoUpcastOnReplay(true)
 *     .build();
 * </pre>
 */
public class UpcastingBuilder {

    private static final Logger log = LoggerFactory.getLogger(UpcastingBuilder.class);

    private final List<Supplier<? extends MessageUpcaster<?, ?>>> registrations = new ArrayList<>();
    private final List<MessageUpcaster<?, ?>> scanned = new ArrayList<>();
    private boolean autoUpcastOnReplay = true;

    public UpcastingBuilder registerUpcaster(MessageUpcaster<?, ?> upcaster) {
        Objects.requireNonNull(upcaster, "upcaster");
        registrations.add(() -> upcaster);
        return this;
    }

    public UpcastingBuilder registerUpcaster(Supplier<? extends MessageUpcaster<?, ?>> factory) {
        registrations.add(Objects.requireNonNull(factory, "factory"));
        return this;
    }

    /**
     * Registers every concrete {@link MessageUpcaster} with a no-argument constructor found under
     * {@code basePackage} and accepted by {@code filter}. Downcasting upcasters and duplicates
     * of an already known (type, fromVersion) pair are skipped with a warning.
     */
    public UpcastingBuilder scanPackage(String basePackage, Predicate<Class<?>> filter) {
        Objects.requireNonNull(basePackage, "basePackage");
        Predicate<Class<?>> accept = filter != null ? filter : type -> true;

        ClassPathScanningCandidateComponentProvider scanner = new ClassPathScanningCandidateComponentProvider(false);
        scanner.addIncludeFilter(new AssignableTypeFilter(MessageUpcaster.class));

        Set<String> seen = new HashSet<>();
        scanned.forEach(u -> seen.add(key(u)));

        List<BeanDefinition> candidates = new ArrayList<>(scanner.findCandidateComponents(basePackage));
        candidates.sort(Comparator.comparing(BeanDefinition::getBeanClassName));
        for (BeanDefinition candidate : candidates) {
            Class<?> type = ClassUtils.resolveClassName(Objects.requireNonNull(candidate.getBeanClassName()),
                    ClassUtils.getDefaultClassLoader());
            if (!accept.test(type)) {
                continue;
            }
            MessageUpcaster<?, ?> upcaster = (MessageUpcaster<?, ?>) BeanUtils.instantiateClass(type);
            if (upcaster.fromVersion() >= upcaster.toVersion()) {
                log.warn("Skipping upcaster {}: FromVersion {} must be less than ToVersion {}",
                        type.getName(), upcaster.fromVersion(), upcaster.toVersion());
                continue;
            }
            if (!seen.add(key(upcaster))) {
                log.warn("Skipping upcaster {}: an upcaster for {} v{} was already found",
                        type.getName(), upcaster.messageType(), upcaster.fromVersion());
                continue;
            }
            scanned.add(upcaster);
        }
        log.debug("Scanned {} upcasters under {}", scanned.size(), basePackage);
        return this;
    }

    public UpcastingBuilder enableAutoUpcastOnReplay(boolean enabled) {
        this.autoUpcastOnReplay = enabled;
        return this;
    }

    /**
     * @throws IllegalStateException if two explicit registrations target the same (type, fromVersion)
     */
    public UpcastingPipeline build() {
        UpcastingPipeline pipeline = new UpcastingPipeline(autoUpcastOnReplay);
        for (Supplier<? extends MessageUpcaster<?, ?>> registration : registrations) {
            pipeline.register(registration.get());
        }
        for (MessageUpcaster<?, ?> upcaster : scanned) {
            if (pipeline.isRegistered(upcaster.messageType(), upcaster.fromVersion())) {
                log.warn("Skipping scanned upcaster {}: {} v{} is registered explicitly",
                        upcaster.getClass().getName(), upcaster.messageType(), upcaster.fromVersion());
                continue;
            }
            pipeline.register(upcaster);
        }
        return pipeline;
    }

    private static String key(MessageUpcaster<?, ?> upcaster) {
        return upcaster.messageType() + "#" + upcaster.fromVersion();
    }
}
