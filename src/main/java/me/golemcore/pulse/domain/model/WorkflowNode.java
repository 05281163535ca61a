package me.golemcore.pulse.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One step of a workflow. {@code config} is checked against the node type
 * when the workflow is saved.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowNode {

    private String id;
    private NodeType type;
    private String label;

    @Builder.Default
    private Map<String, Object> config = new LinkedHashMap<>();

    public enum NodeType {
        TRIGGER, AI, HTTP, BROWSER, CODE, HUMAN, CONDITION, LOOP, TRANSFORM, NOTIFICATION;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static NodeType fromWire(String value) {
            if (value == null) {
                throw new IllegalArgumentException("Node type is required");
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown node type: " + value);
            }
        }
    }

    /**
     * String config value or {@code null}.
     */
    public String configString(String key) {
        Object value = config != null ? config.get(key) : null;
        return value != null ? value.toString() : null;
    }
}
