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
import me.golemcore.pulse.domain.exception.NodeExecutionException;
import me.golemcore.pulse.domain.model.Advice;
import me.golemcore.pulse.domain.model.AdvisorRequest;
import me.golemcore.pulse.domain.model.WorkflowNode;
import me.golemcore.pulse.domain.model.WorkflowNode.NodeType;
import me.golemcore.pulse.domain.workflow.ContextPaths;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.AdvisorPort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends a templated prompt to the advisor. Placeholders like {@code {input}}
 * or {@code {http_1.data}} are filled from the run context.
 */
@Component
@Slf4j
public class AiNodeExecutor implements NodeExecutor {

    static final String DEFAULT_PROMPT = "Process: {input}";
    static final String DEFAULT_AGENT = "workflow";

    private final AdvisorPort advisorPort;
    private final PulseProperties properties;

    public AiNodeExecutor(AdvisorPort advisorPort, PulseProperties properties) {
        this.advisorPort = advisorPort;
        this.properties = properties;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.AI;
    }

    @Override
    public Object execute(WorkflowNode node, NodeInput input) {
        String prompt = ContextPaths.render(NodeConfigs.string(node, "prompt_template", DEFAULT_PROMPT),
                input.context());
        Advice advice;
        try {
            advice = advisorPort.respond(AdvisorRequest.builder()
                    .tenantId(input.tenantId())
                    .agentId(NodeConfigs.string(node, "agent", DEFAULT_AGENT))
                    .prompt(prompt)
                    .context(new LinkedHashMap<>(input.context()))
                    .build());
        } catch (RuntimeException e) { // NOSONAR - intentionally catch all, advisor errors fail the node
            throw new NodeExecutionException(node.getId(), "AI call failed: " + e.getMessage(), e);
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("result", NodeConfigs.abbreviate(advice.getContent(),
                properties.getWorkflow().getMaxResponseChars()));
        output.put("model", advice.getModel());
        log.debug("[Workflow] AI node {} answered with {} chars", node.getId(),
                advice.getContent() != null ? advice.getContent().length() : 0);
        return output;
    }
}
