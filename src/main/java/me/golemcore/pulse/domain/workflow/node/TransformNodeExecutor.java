package me.golemcore.pulse.domain.workflow.node;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.pulse.domain.exception.NodeExecutionException;
import me.golemcore.pulse.domain.model.WorkflowNode;
import me.golemcore.pulse.domain.model.WorkflowNode.NodeType;
import me.golemcore.pulse.domain.workflow.ContextPaths;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reshapes a context value. {@code transform} is one of passthrough,
 * uppercase, lowercase, json_parse, template or pick; the value is read from
 * {@code input_key} (dotted path, default {@code input}).
 */
@Component
public class TransformNodeExecutor implements NodeExecutor {

    static final Set<String> TRANSFORMS = Set.of(
            "passthrough", "uppercase", "lowercase", "json_parse", "template", "pick");

    private final ObjectMapper objectMapper;

    public TransformNodeExecutor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.TRANSFORM;
    }

    @Override
    public void validate(WorkflowNode node) {
        String transform = NodeConfigs.string(node, "transform", "passthrough").toLowerCase(Locale.ROOT);
        if (!TRANSFORMS.contains(transform)) {
            throw new IllegalArgumentException("Unknown transform in node " + node.getId() + ": " + transform);
        }
        if ("template".equals(transform)) {
            NodeConfigs.requireString(node, "template");
        }
        if ("pick".equals(transform) && NodeConfigs.strings(node, "fields").isEmpty()) {
            throw new IllegalArgumentException("pick transform of node " + node.getId() + " needs config.fields");
        }
    }

    @Override
    public Object execute(WorkflowNode node, NodeInput input) {
        String transform = NodeConfigs.string(node, "transform", "passthrough").toLowerCase(Locale.ROOT);
        Object data = ContextPaths.resolve(input.context(), NodeConfigs.string(node, "input_key", "input"));

        return switch (transform) {
            case "uppercase" -> data != null ? data.toString().toUpperCase(Locale.ROOT) : "";
            case "lowercase" -> data != null ? data.toString().toLowerCase(Locale.ROOT) : "";
            case "json_parse" -> parseJson(node, data);
            case "template" -> ContextPaths.render(NodeConfigs.requireString(node, "template"), input.context());
            case "pick" -> pick(node, data);
            default -> data;
        };
    }

    private Object parseJson(WorkflowNode node, Object data) {
        if (data == null) {
            throw new NodeExecutionException(node.getId(), "Nothing to parse");
        }
        if (!(data instanceof String text)) {
            return data;
        }
        try {
            return objectMapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            throw new NodeExecutionException(node.getId(), "Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static Map<String, Object> pick(WorkflowNode node, Object data) {
        Map<String, Object> picked = new LinkedHashMap<>();
        if (!(data instanceof Map<?, ?> map)) {
            return picked;
        }
        for (String field : NodeConfigs.strings(node, "fields")) {
            if (map.containsKey(field)) {
                picked.put(field, map.get(field));
            }
        }
        return picked;
    }
}
