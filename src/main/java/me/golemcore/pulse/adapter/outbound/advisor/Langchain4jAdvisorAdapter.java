package me.golemcore.pulse.adapter.outbound.advisor;

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

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.Advice;
import me.golemcore.pulse.domain.model.AdvisorRequest;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.AdvisorPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Advisor backed by a langchain4j {@link ChatModel}. The request's agent id
 * becomes the persona of the system message.
 */
@Component
@ConditionalOnProperty(prefix = "pulse.llm", name = "provider", havingValue = "openai")
@Slf4j
public class Langchain4jAdvisorAdapter implements AdvisorPort {

    private final ChatModel chatModel;
    private final String modelName;

    public Langchain4jAdvisorAdapter(ChatModel chatModel, PulseProperties properties) {
        this.chatModel = chatModel;
        this.modelName = properties.getLlm().getModel();
    }

    @Override
    public Advice respond(AdvisorRequest request) {
        String agent = request.getAgentId() != null ? request.getAgentId() : "assistant";
        List<ChatMessage> messages = List.of(
                SystemMessage.from("You are the " + agent + " agent of a startup operating system. "
                        + "Answer concisely and concretely."),
                UserMessage.from(buildPrompt(request)));

        long started = System.currentTimeMillis();
        ChatResponse response = chatModel.chat(messages);
        log.debug("[LLM] Advisor {} answered in {}ms", agent, System.currentTimeMillis() - started);

        return Advice.builder()
                .content(response.aiMessage().text())
                .model(modelName)
                .build();
    }

    private static String buildPrompt(AdvisorRequest request) {
        if (request.getContext() == null || request.getContext().isEmpty()) {
            return request.getPrompt();
        }
        return request.getPrompt() + "\n\nContext:\n" + request.getContext();
    }
}
