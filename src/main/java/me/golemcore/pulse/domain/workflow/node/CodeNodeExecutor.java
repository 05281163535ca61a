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

import me.golemcore.pulse.domain.exception.NodeExecutionException;
import me.golemcore.pulse.domain.model.WorkflowNode;
import me.golemcore.pulse.domain.model.WorkflowNode.NodeType;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Evaluates a SpEL expression over the run context.
 *
 * <p>
 * The evaluation context is read-only and exposes no types, constructors or
 * bean references: only {@code #context} and {@code #inputs} maps, e.g.
 * {@code #context['http_1']['status'] == 200}. Output: {@code {result}}.
 */
@Component
public class CodeNodeExecutor implements NodeExecutor {

    private final ExpressionParser parser = new SpelExpressionParser();

    @Override
    public NodeType getNodeType() {
        return NodeType.CODE;
    }

    @Override
    public void validate(WorkflowNode node) {
        String expression = NodeConfigs.requireString(node, "expression");
        try {
            parser.parseExpression(expression);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid expression in node " + node.getId() + ": "
                    + e.getMessage());
        }
    }

    @Override
    public Object execute(WorkflowNode node, NodeInput input) {
        EvaluationContext evaluationContext = SimpleEvaluationContext.forReadOnlyDataBinding().build();
        evaluationContext.setVariable("context", input.context());
        evaluationContext.setVariable("inputs", input.inputs());
        try {
            Object result = parser.parseExpression(NodeConfigs.requireString(node, "expression"))
                    .getValue(evaluationContext);
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("result", result);
            return output;
        } catch (ParseException | EvaluationException e) {
            throw new NodeExecutionException(node.getId(), "Expression failed: " + e.getMessage(), e);
        }
    }
}
