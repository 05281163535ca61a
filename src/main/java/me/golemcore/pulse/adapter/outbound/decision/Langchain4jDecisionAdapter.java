package me.golemcore.pulse.adapter.outbound.decision;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.ChecklistItem;
import me.golemcore.pulse.domain.model.Decision;
import me.golemcore.pulse.domain.model.EvaluationContext;
import me.golemcore.pulse.domain.model.EvaluationResult.ResultType;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.DecisionPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decision function that asks a langchain4j {@link ChatModel} to classify the
 * heartbeat context. The model must answer with a JSON object:
 *
 * <pre>
 * {"result_type": "OK|INSIGHT|ACTION|ESCALATION", "triggered_check": "...",
 *  "summary": "...", "recommended_action": "...", "should_notify": false}
 * </pre>
 *
 * Unknown result types are read as OK. Unparseable answers throw, which the
 * heartbeat engine records as an evaluation error.
 */
@Component
@ConditionalOnProperty(prefix = "pulse.llm", name = "provider", havingValue = "openai")
@Slf4j
public class Langchain4jDecisionAdapter implements DecisionPort {

    private static final String SYSTEM_PROMPT = """
            You are a proactive startup agent running a heartbeat check.
            Review the metrics against the checklist and answer with ONLY a JSON object:
            {"result_type": "OK|INSIGHT|ACTION|ESCALATION", "triggered_check": "<check or null>",
             "summary": "<one sentence>", "recommended_action": "<action or null>",
             "should_notify": <true|false>}
            Use OK when nothing needs attention. Use ESCALATION only when a human must decide.
            """;

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final String modelName;

    public Langchain4jDecisionAdapter(ChatModel chatModel, ObjectMapper objectMapper, PulseProperties properties) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.modelName = properties.getLlm().getModel();
    }

    @Override
    public String getName() {
        return modelName;
    }

    @Override
    public Decision decide(EvaluationContext context, List<ChecklistItem> checklist) {
        List<ChatMessage> messages = List.of(
                SystemMessage.from(SYSTEM_PROMPT),
                UserMessage.from(buildUserPrompt(context, checklist)));
        ChatResponse response = chatModel.chat(messages);
        return parseDecision(response.aiMessage().text());
    }

    String buildUserPrompt(EvaluationContext context, List<ChecklistItem> checklist) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agent_id", context.getAgentId());
        payload.put("startup_id", context.getTenantId());
        payload.put("evaluation_time", String.valueOf(context.getEvaluationTime()));
        payload.put("metrics", context.getMetrics());
        payload.put("previous_metrics", context.getPreviousMetrics());
        payload.put("recent_history", context.getMemory());
        payload.put("checklist", checklist);
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize heartbeat context", e);
        }
    }

    Decision parseDecision(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalStateException("Empty decision response");
        }
        String json = stripCodeFence(text.trim());
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Decision response is not JSON: " + e.getOriginalMessage(), e);
        }
        return Decision.builder()
                .resultType(ResultType.parse(textOrNull(node, "result_type")))
                .triggeredCheck(textOrNull(node, "triggered_check"))
                .summary(textOrNull(node, "summary"))
                .recommendedAction(textOrNull(node, "recommended_action"))
                .shouldNotify(node.path("should_notify").asBoolean(false))
                .model(modelName)
                .build();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String stripCodeFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int lastFence = text.lastIndexOf("```");
        if (firstNewline < 0 || lastFence <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, lastFence).trim();
    }
}
