package me.golemcore.pulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Replay log entry for a workflow run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowLog {

    private String id;
    private String runId;
    private String tenantId;
    private String nodeId;
    private Level level;
    private String message;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private Instant timestamp;
    private long sequence;

    public enum Level {
        DEBUG, INFO, WARNING, ERROR, SUCCESS
    }
}
