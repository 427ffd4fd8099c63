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

import org.fireflyframework.dispatch.core.DispatchMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves chains of {@link MessageUpcaster}s per message type and applies them.
 * <p>
 * Versions of a message type form a directed graph whose edges are upcasters. The
 * shortest path between two versions (fewest hops) is found breadth-first and cached until
 * the next registration for that type.
 */
public class UpcastingPipeline {

    private static final Logger log = LoggerFactory.getLogger(UpcastingPipeline.class);

    // messageType -> fromVersion -> upcaster
    private final Map<String, Map<Integer, MessageUpcaster<?, ?>>> upcasters = new ConcurrentHashMap<>();
    private final Map<String, Integer> latestVersions = new ConcurrentHashMap<>();
    private final Map<PathKey, List<MessageUpcaster<?, ?>>> pathCache = new ConcurrentHashMap<>();
    private final boolean autoUpcastOnReplay;

    public UpcastingPipeline() {
        this(true);
    }

    public UpcastingPipeline(boolean autoUpcastOnReplay) {
        this.autoUpcastOnReplay = autoUpcastOnReplay;
    }

    /**
     * @throws IllegalArgumentException if the upcaster does not move to a higher version
     * @throws IllegalStateException if an upcaster for the same type and source version exists
     */
    public synchronized void register(MessageUpcaster<?, ?> upcaster) {
        Objects.requireNonNull(upcaster, "upcaster");
        String type = upcaster.messageType();
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Upcaster " + upcaster.getClass().getName() + " declares no message type");
        }
        if (upcaster.fromVersion() >= upcaster.toVersion()) {
            throw new IllegalArgumentException("FromVersion (" + upcaster.fromVersion()
                    + ") must be less than ToVersion (" + upcaster.toVersion() + ") for " + type);
        }
        Map<Integer, MessageUpcaster<?, ?>> byVersion = upcasters.computeIfAbsent(type, k -> new ConcurrentHashMap<>());
        if (byVersion.containsKey(upcaster.fromVersion())) {
            throw new IllegalStateException("Upcaster for " + type + " v" + upcaster.fromVersion()
                    + " is already registered");
        }
        byVersion.put(upcaster.fromVersion(), upcaster);
        latestVersions.merge(type, upcaster.toVersion(), Math::max);
        pathCache.keySet().removeIf(key -> key.messageType().equals(type));
        log.debug("Registered upcaster {} for {} v{} -> v{}", upcaster.getClass().getSimpleName(), type,
                upcaster.fromVersion(), upcaster.toVersion());
    }

    public boolean isRegistered(String messageType, int fromVersion) {
        Map<Integer, MessageUpcaster<?, ?>> byVersion = upcasters.get(messageType);
        return byVersion != null && byVersion.containsKey(fromVersion);
    }

    /**
     * Highest version any registered upcaster produces for the type, or 0 when the type is unknown.
     */
    public int getLatestVersion(String messageType) {
        return latestVersions.getOrDefault(messageType, 0);
    }

    public boolean canUpcast(String messageType, int fromVersion, int toVersion) {
        if (fromVersion == toVersion) {
            return true;
        }
        if (fromVersion > toVersion) {
            return false;
        }
        return findPath(messageType, fromVersion, toVersion).isPresent();
    }

    /**
     * Brings a versioned message to the latest registered version of its type. Messages that
     * are not versioned, or already at the latest version, are returned as they are.
     */
    public DispatchMessage upcast(DispatchMessage message) {
        Objects.requireNonNull(message, "message");
        if (!(message instanceof VersionedMessage versioned)) {
            return message;
        }
        int latest = getLatestVersion(versioned.messageType());
        if (versioned.version() >= latest) {
            return message;
        }
        return upcastTo(message, latest);
    }

    /**
     * Upcasts only when auto upcast on replay is enabled.
     */
    public DispatchMessage upcastForReplay(DispatchMessage message) {
        return autoUpcastOnReplay ? upcast(message) : message;
    }

    /**
     * Brings a versioned message to an explicit target version.
     */
    public DispatchMessage upcastTo(DispatchMessage message, int targetVersion) {
        Objects.requireNonNull(message, "message");
        if (!(message instanceof VersionedMessage versioned)) {
            throw new IllegalArgumentException("Message type " + message.getClass().getName()
                    + " does not implement VersionedMessage");
        }
        int current = versioned.version();
        if (targetVersion < current) {
            throw new IllegalArgumentException("Cannot downcast " + versioned.messageType() + " from v" + current
                    + " to v" + targetVersion);
        }
        if (targetVersion == current) {
            return message;
        }
        List<MessageUpcaster<?, ?>> path = findPath(versioned.messageType(), current, targetVersion)
                .orElseThrow(() -> new IllegalStateException("No upcasting path exists for " + versioned.messageType()
                        + " from v" + current + " to v" + targetVersion));
        VersionedMessage result = versioned;
        for (MessageUpcaster<?, ?> step : path) {
            result = apply(step, result);
        }
        return result;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static VersionedMessage apply(MessageUpcaster upcaster, VersionedMessage message) {
        VersionedMessage upcasted = (VersionedMessage) upcaster.upcast(message);
        if (upcasted == null) {
            throw new IllegalStateException("Upcaster " + upcaster.getClass().getName() + " returned null");
        }
        return upcasted;
    }

    private Optional<List<MessageUpcaster<?, ?>>> findPath(String messageType, int from, int to) {
        PathKey key = new PathKey(messageType, from, to);
        List<MessageUpcaster<?, ?>> cached = pathCache.get(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        List<MessageUpcaster<?, ?>> path = search(messageType, from, to);
        if (path != null) {
            pathCache.put(key, path);
        }
        return Optional.ofNullable(path);
    }

    private List<MessageUpcaster<?, ?>> search(String messageType, int from, int to) {
        Map<Integer, MessageUpcaster<?, ?>> byVersion = upcasters.getOrDefault(messageType, Map.of());
        Map<Integer, MessageUpcaster<?, ?>> reachedVia = new HashMap<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(from);
        while (!queue.isEmpty()) {
            int version = queue.poll();
            if (version == to) {
                List<MessageUpcaster<?, ?>> path = new ArrayList<>();
                int cursor = to;
                while (cursor != from) {
                    MessageUpcaster<?, ?> edge = reachedVia.get(cursor);
                    path.add(edge);
                    cursor = edge.fromVersion();
                }
                Collections.reverse(path);
                return List.copyOf(path);
            }
            MessageUpcaster<?, ?> edge = byVersion.get(version);
            if (edge != null && edge.toVersion() <= to && !reachedVia.containsKey(edge.toVersion())) {
                reachedVia.put(edge.toVersion(), edge);
                queue.add(edge.toVersion());
            }
        }
        return null;
    }

    public boolean isAutoUpcastOnReplay() {
        return autoUpcastOnReplay;
    }

    private record PathKey(String messageType, int from, int to) {
    }
}
