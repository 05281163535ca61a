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
import me.golemcore.pulse.domain.model.WorkflowNode.NodeType;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded counter. Each visit increments {@code iteration}; {@code continue}
 * stays true until {@code max_iterations} is reached. A back-edge conditioned
 * on {@code <nodeId>.continue} forms the loop body.
 */
@Component
public class LoopNodeExecutor implements NodeExecutor {

    private final PulseProperties properties;

    public LoopNodeExecutor(PulseProperties properties) {
        this.properties = properties;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.LOOP;
    }

    @Override
    public void validate(WorkflowNode node) {
        int max = NodeConfigs.integer(node, "max_iterations", properties.getWorkflow().getMaxLoopIterations());
        if (max <= 0) {
            throw new IllegalArgumentException("max_iterations of node " + node.getId() + " must be positive");
        }
    }

    @Override
    public Object execute(WorkflowNode node, NodeInput input) {
        int max = NodeConfigs.integer(node, "max_iterations", properties.getWorkflow().getMaxLoopIterations());
        int previous = 0;
        if (input.context().get(node.getId()) instanceof Map<?, ?> state
                && state.get("iteration") instanceof Number number) {
            previous = number.intValue();
        }
        int iteration = previous + 1;

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("iteration", iteration);
        output.put("max_iterations", max);
        output.put("continue", iteration < max);
        return output;
    }
}
