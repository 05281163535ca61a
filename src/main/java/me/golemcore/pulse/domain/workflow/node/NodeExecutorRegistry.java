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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.WorkflowNode;
import me.golemcore.pulse.domain.model.WorkflowNode.NodeType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Node type to executor lookup. {@code human} nodes have no executor: the
 * runner suspends on them.
 */
@Component
@Slf4j
public class NodeExecutorRegistry {

    static final int DEFAULT_APPROVAL_TIMEOUT_HOURS = 24;

    private final Map<NodeType, NodeExecutor> executors = new EnumMap<>(NodeType.class);

    public NodeExecutorRegistry(List<NodeExecutor> nodeExecutors) {
        for (NodeExecutor executor : nodeExecutors) {
            NodeExecutor previous = executors.put(executor.getNodeType(), executor);
            if (previous != null) {
                throw new IllegalStateException("Two executors for node type " + executor.getNodeType());
            }
        }
        log.info("[Workflow] Registered node executors: {}", executors.keySet());
    }

    public NodeExecutor get(NodeType type) {
        NodeExecutor executor = executors.get(type);
        if (executor == null) {
            throw new IllegalArgumentException("No executor for node type: " + type);
        }
        return executor;
    }

    public void validate(WorkflowNode node) {
        if (node.getType() == NodeType.HUMAN) {
            if (humanTimeoutHours(node) <= 0) {
                throw new IllegalArgumentException("config.timeout_hours of node " + node.getId()
                        + " must be positive");
            }
            return;
        }
        get(node.getType()).validate(node);
    }

    public static int humanTimeoutHours(WorkflowNode node) {
        return NodeConfigs.integer(node, "timeout_hours", DEFAULT_APPROVAL_TIMEOUT_HOURS);
    }
}
