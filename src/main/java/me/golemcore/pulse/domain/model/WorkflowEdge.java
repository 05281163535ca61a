package me.golemcore.pulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Directed edge between two nodes. A {@code null} condition is
 * unconditional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowEdge {

    private String id;
    private String source;
    private String target;
    private EdgeCondition condition;

    /**
     * Predicate over the run context: {@code field} is a dotted path,
     * {@code operator} one of eq, neq, gt, gte, lt, lte, contains, exists,
     * truthy.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EdgeCondition {
        private String field;
        private String operator;
        private Object value;
    }
}
