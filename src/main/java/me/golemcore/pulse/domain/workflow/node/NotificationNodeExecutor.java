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

import me.golemcore.pulse.domain.model.Notification;
import me.golemcore.pulse.domain.model.WorkflowNode;
import me.golemcore.pulse.domain.model.WorkflowNode.NodeType;
import me.golemcore.pulse.domain.service.NotificationService;
import me.golemcore.pulse.domain.workflow.ContextPaths;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sends a templated message through the notification sink.
 */
@Component
public class NotificationNodeExecutor implements NodeExecutor {

    static final String DEFAULT_CHANNEL = "in_app";
    static final String DEFAULT_MESSAGE = "Workflow completed";

    private final NotificationService notificationService;

    public NotificationNodeExecutor(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.NOTIFICATION;
    }

    @Override
    public Object execute(WorkflowNode node, NodeInput input) {
        List<String> channels = NodeConfigs.strings(node, "channels");
        if (channels.isEmpty()) {
            channels = List.of(NodeConfigs.string(node, "channel", DEFAULT_CHANNEL));
        }
        String message = ContextPaths.render(NodeConfigs.string(node, "message", DEFAULT_MESSAGE), input.context());
        String title = ContextPaths.render(NodeConfigs.string(node, "title",
                node.getLabel() != null ? node.getLabel() : "Workflow notification"), input.context());

        boolean delivered = notificationService.notify(Notification.builder()
                .tenantId(input.tenantId())
                .title(title)
                .body(message)
                .channels(channels)
                .build());

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("notified", delivered);
        output.put("channels", channels);
        output.put("message", message);
        return output;
    }
}
