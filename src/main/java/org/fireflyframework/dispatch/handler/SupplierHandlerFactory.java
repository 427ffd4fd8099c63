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
package org.fireflyframework.dispatch.handler;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Handler factory backed by explicitly registered suppliers, for use without a Spring context.
 */
public class SupplierHandlerFactory implements HandlerFactory {

    private final Map<Class<?>, Supplier<?>> suppliers = new ConcurrentHashMap<>();

    public <H> SupplierHandlerFactory register(Class<H> handlerType, Supplier<? extends H> supplier) {
        suppliers.put(Objects.requireNonNull(handlerType, "handlerType"), Objects.requireNonNull(supplier, "supplier"));
        return this;
    }

    @Override
    public Object create(Class<?> handlerType) {
        Supplier<?> supplier = suppliers.get(handlerType);
        if (supplier == null) {
            throw new IllegalStateException("No supplier registered for handler type " + handlerType.getName());
        }
        return supplier.get();
    }
}
