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
import org.fireflyframework.dispatch.util.JsonUtils;

import java.util.Iterator;
import java.util.Map;

/**
 * JSON view of a message shared by the content validators.
 */
final class MessageJson {

    private MessageJson() {
    }

    static JsonNode tree(DispatchMessage message) {
        return JsonUtils.mapper().valueToTree(message);
    }

    /**
     * Visits every text value with its dotted path, plus every field name when
     * {@code includeFieldNames} is set (reported with the path of the owning object).
     */
    static void visitStrings(JsonNode node, String path, boolean includeFieldNames, StringVisitor visitor) {
        if (node == null) {
            return;
        }
        if (node.isTextual()) {
            visitor.visit(path, node.textValue());
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String childPath = path.isEmpty() ? field.getKey() : path + "." + field.getKey();
                if (includeFieldNames) {
                    visitor.visit(path, field.getKey());
                }
                visitStrings(field.getValue(), childPath, includeFieldNames, visitor);
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                visitStrings(node.get(i), path + "[" + i + "]", includeFieldNames, visitor);
            }
        }
    }

    static int depth(JsonNode node) {
        if (node == null || !node.isContainerNode() || node.isEmpty()) {
            return 0;
        }
        int deepest = 0;
        for (JsonNode child : node) {
            deepest = Math.max(deepest, depth(child));
        }
        return deepest + 1;
    }

    @FunctionalInterface
    interface StringVisitor {
        void visit(String path, String value);
    }
}
