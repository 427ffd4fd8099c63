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

/**
 * Single-hop transform of one message type from {@link #fromVersion()} to a newer {@link #toVersion()}.
 *
 * @param <F> the message class of the source version
 * @param <T> the message class of the target version
 */
public interface MessageUpcaster<F extends VersionedMessage, T extends VersionedMessage> {

    String messageType();

    int fromVersion();

    int toVersion();

    T upcast(F message);
}
