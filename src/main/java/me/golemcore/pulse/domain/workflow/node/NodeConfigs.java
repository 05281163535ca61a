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

import me.golemcore.pulse.domain.model.WorkflowNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Typed reads over a node's free-form config map.
 */
final class NodeConfigs {

    private NodeConfigs() {
    }

    static String requireString(WorkflowNode node, String key) {
        String value = node.configString(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Node " + node.getId() + " (" + node.getType().wireName()
                    + ") requires config." + key);
        }
        return value;
    }

    static String string(WorkflowNode node, String key, String fallback) {
        String value = node.configString(key);
        return value != null && !value.isBlank() ? value : fallback;
    }

    static int integer(WorkflowNode node, String key, int fallback) {
        Object value = node.getConfig() != null ? node.getConfig().get(key) : null;
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("config." + key + " of node " + node.getId()
                        + " must be an integer");
            }
        }
        return fallback;
    }

    static boolean bool(WorkflowNode node, String key, boolean fallback) {
        Object value = node.getConfig() != null ? node.getConfig().get(key) : null;
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text && !text.isBlank()) {
            return Boolean.parseBoolean(text.trim());
        }
        return fallback;
    }

    static List<String> strings(WorkflowNode node, String key) {
        Object value = node.getConfig() != null ? node.getConfig().get(key) : null;
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            list.stream().filter(item -> item != null).forEach(item -> result.add(item.toString()));
        } else if (value instanceof String text && !text.isBlank()) {
            for (String part : text.split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> map(WorkflowNode node, String key) {
        Object value = node.getConfig() != null ? node.getConfig().get(key) : null;
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    static String abbreviate(String text, int maxChars) {
        if (text == null || maxChars <= 0 || text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars);
    }
}
