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


package org.fireflyframework.dispatch.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Per-dispatch metadata threaded explicitly through every middleware and handler.
 * <p>
 * A context is created once per inbound message, either blank (transports copy their
 * headers in) or via {@link #create()}, which guarantees non-empty message and
 * correlation identifiers. {@link #receivedTimestampUtc()} is fixed at construction.
 * <p>
 * {@link #items()} is a mutable bag scoped to one dispatch. {@link #properties()} holds
 * string metadata meant to survive serialization (scheduling, transports).
 */
public class MessageContext {

    private String messageId;
    private String correlationId;
    private String causationId;
    private String tenantId;
    private String userId;
    private String sessionId;
    private String workflowId;
    private String partitionKey;
    private String source;
    private String messageType;
    private String contentType;
    private String traceParent;
    private String externalId;
    private int deliveryCount;
    private Instant sentTimestampUtc;
    private final Instant receivedTimestampUtc;
    private DispatchMessage message;

    private final Map<String, Object> items = new ConcurrentHashMap<>();
    private final Map<String, String> properties = new ConcurrentHashMap<>();
    // shared by parent and child contexts of the same dispatch
    private final Map<Class<?>, Object> scopedServices;

    public MessageContext() {
        this(Instant.now(), new ConcurrentHashMap<>());
    }

    private MessageContext(Instant receivedTimestampUtc, Map<Class<?>, Object> scopedServices) {
        this.receivedTimestampUtc = receivedTimestampUtc;
        this.scopedServices = scopedServices;
    }

    /**
     * Creates a context with generated message and correlation identifiers.
     */
    public static MessageContext create() {
        MessageContext ctx = new MessageContext();
        ctx.messageId = UUID.randomUUID().toString();
        ctx.correlationId = UUID.randomUUID().toString();
        return ctx;
    }

    /**
     * Creates a context for a message caused by this one. Correlation, tenant, user,
     * session, workflow and trace data are carried over; the causation id points at
     * this context's message id and a fresh message id is generated.
     */
    public MessageContext createChildContext() {
        MessageContext child = new MessageContext(Instant.now(), scopedServices);
        child.messageId = UUID.randomUUID().toString();
        child.correlationId = correlationId;
        child.causationId = messageId;
        child.tenantId = tenantId;
        child.userId = userId;
        child.sessionId = sessionId;
        child.workflowId = workflowId;
        child.traceParent = traceParent;
        child.source = source;
        return child;
    }

    public String messageId() { return messageId; }
    public void setMessageId(String messageId) { this.messageId = messageId; }

    public String correlationId() { return correlationId; }
    public void setCorrelationId(String correlationId) { this.correlationId = correlationId; }

    public String causationId() { return causationId; }
    public void setCausationId(String causationId) { this.causationId = causationId; }

    public String tenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }

    public String userId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String sessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String workflowId() { return workflowId; }
    public void setWorkflowId(String workflowId) { this.workflowId = workflowId; }

    public String partitionKey() { return partitionKey; }
    public void setPartitionKey(String partitionKey) { this.partitionKey = partitionKey; }

    public String source() { return source; }
    public void setSource(String source) { this.source = source; }

    public String messageType() { return messageType; }
    public void setMessageType(String messageType) { this.messageType = messageType; }

    public String contentType() { return contentType; }
    public void setContentType(String contentType) { this.contentType = contentType; }

    public String traceParent() { return traceParent; }
    public void setTraceParent(String traceParent) { this.traceParent = traceParent; }

    public String externalId() { return externalId; }
    public void setExternalId(String externalId) { this.externalId = externalId; }

    public int deliveryCount() { return deliveryCount; }

    public void setDeliveryCount(int deliveryCount) {
        if (deliveryCount < 0) {
            throw new IllegalArgumentException("deliveryCount must be >= 0");
        }
        this.deliveryCount = deliveryCount;
    }

    public Instant sentTimestampUtc() { return sentTimestampUtc; }
    public void setSentTimestampUtc(Instant sentTimestampUtc) { this.sentTimestampUtc = sentTimestampUtc; }

    public Instant receivedTimestampUtc() { return receivedTimestampUtc; }

    public DispatchMessage message() { return message; }
    public void setMessage(DispatchMessage message) { this.message = message; }

    public Map<String, Object> items() { return items; }

    public Map<String, String> properties() { return properties; }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> getItem(String key, Class<T> type) {
        Object value = items.get(key);
        return type.isInstance(value) ? Optional.of((T) value) : Optional.empty();
    }

    /**
     * Returns the scoped service of the given type, creating it on first use.
     * Parent and child contexts of one dispatch share the same instances.
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrCreateScoped(Class<T> type, Supplier<? extends T> factory) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(factory, "factory");
        return (T) scopedServices.computeIfAbsent(type, k -> factory.get());
    }

    @Override
    public String toString() {
        return "MessageContext{messageId='" + messageId + "', correlationId='" + correlationId
                + "', messageType='" + messageType + "', tenantId='" + tenantId + "'}";
    }
}
