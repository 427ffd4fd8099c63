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
package org.fireflyframework.dispatch.validation.validators;

import com.fasterxml.jackson.databind.JsonNode;
import org.fireflyframework.dispatch.core.DispatchMessage;
import org.fireflyframework.dispatch.core.MessageContext;
import org.fireflyframework.dispatch.util.JsonUtils;
import org.fireflyframework.dispatch.validation.InputValidationResult;
import org.fireflyframework.dispatch.validation.InputValidator;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Limits the serialized size and the nesting depth of a message. A limit of 0 disables that check.
 */
public class MessageSizeValidator implements InputValidator {

    private final int maxSizeBytes;
    private final int maxDepth;

    public MessageSizeValidator(int maxSizeBytes, int maxDepth) {
        this.maxSizeBytes = maxSizeBytes;
        this.maxDepth = maxDepth;
    }

    @Override
    public Mono<InputValidationResult> validate(DispatchMessage message, MessageContext context) {
        return Mono.fromCallable(() -> {
            List<String> errors = new ArrayList<>();
            JsonNode tree = MessageJson.tree(message);
            if (maxSizeBytes > 0) {
                int size = JsonUtils.mapper().writeValueAsBytes(tree).length;
                if (size > maxSizeBytes) {
                    errors.add("Message size (" + size + " bytes) exceeds maximum allowed size ("
                            + maxSizeBytes + " bytes)");
                }
            }
            if (maxDepth > 0) {
                int depth = MessageJson.depth(tree);
                if (depth > maxDepth) {
                    errors.add("Message object depth (" + depth + ") exceeds maximum allowed depth (" + maxDepth + ")");
                }
            }
            return InputValidationResult.failure(errors);
        });
    }
}
