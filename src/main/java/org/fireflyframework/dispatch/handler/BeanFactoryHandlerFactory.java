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

import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.beans.factory.config.AutowireCapableBeanFactory;

/**
 * Resolves handlers from the Spring context, falling back to autowired creation for handler
 * types that are not beans.
 */
public class BeanFactoryHandlerFactory implements HandlerFactory {

    private final AutowireCapableBeanFactory beanFactory;

    public BeanFactoryHandlerFactory(AutowireCapableBeanFactory beanFactory) {
        this.beanFactory = beanFactory;
    }

    @Override
    public Object create(Class<?> handlerType) {
        try {
            return beanFactory.getBean(handlerType);
        } catch (NoSuchBeanDefinitionException e) {
            return beanFactory.createBean(handlerType);
        }
    }
}
