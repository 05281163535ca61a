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

import me.golemcore.pulse.domain.model.WorkflowEdge.EdgeCondition;
import me.golemcore.pulse.domain.model.WorkflowNode;
import me.golemcore.pulse.domain.model.WorkflowNode.NodeType;
import me.golemcore.pulse.domain.workflow.ContextPaths;
import me.golemcore.pulse.domain.workflow.EdgeConditionEvaluator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured predicate: {@code {field, operator, value}} in config, output
 * {@code {result, actual}}. Outgoing edges usually branch on
 * {@code <nodeId>.result}.
 */
@Component
public class ConditionNodeExecutor implements NodeExecutor {

    @Override
    public NodeType getNodeType() {
        return NodeType.CONDITION;
    }

    @Override
    public void validate(WorkflowNode node) {
        NodeConfigs.requireString(node, "field");
        String operator = NodeConfigs.requireString(node, "operator");
        if (!EdgeConditionEvaluator.isKnownOperator(operator)) {
            throw new IllegalArgumentException("Unknown operator in node " + node.getId() + ": " + operator);
        }
    }

    @Override
    public Object execute(WorkflowNode node, NodeInput input) {
        EdgeCondition condition = EdgeCondition.builder()
                .field(node.configString("field"))
                .operator(node.configString("operator"))
                .value(node.getConfig().get("value"))
                .build();
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("result", EdgeConditionEvaluator.matches(condition, input.context()));
        output.put("actual", ContextPaths.resolve(input.context(), condition.getField()));
        return output;
    }
}
