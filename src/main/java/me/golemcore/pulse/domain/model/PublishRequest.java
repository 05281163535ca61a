package me.golemcore.pulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Arguments of a bus publish. {@code toAgent} set means unicast; otherwise
 * the subscription registry decides the recipients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishRequest {

    private String tenantId;
    private String fromAgent;
    private String topic;

    @Builder.Default
    private AgentMessage.MessageType messageType = AgentMessage.MessageType.INSIGHT;

    @Builder.Default
    private Map<String, Object> payload = new LinkedHashMap<>();

    private String toAgent;

    @Builder.Default
    private AgentMessage.Priority priority = AgentMessage.Priority.MEDIUM;

    private boolean requiresResponse;
    private Integer responseDeadlineMinutes;
    private String threadId;
    private String parentId;
}
