package me.golemcore.pulse.infrastructure.config;

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

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * langchain4j chat model backing the LLM decision function and advisor. Only
 * active with {@code pulse.llm.provider=openai}; any OpenAI-compatible
 * endpoint works through {@code pulse.llm.base-url}.
 */
@Configuration
@ConditionalOnProperty(prefix = "pulse.llm", name = "provider", havingValue = "openai")
@RequiredArgsConstructor
@Slf4j
public class LlmConfig {

    private final PulseProperties properties;

    @Bean
    public ChatModel chatModel() {
        PulseProperties.LlmProperties llm = properties.getLlm();
        if (llm.getApiKey() == null || llm.getApiKey().isBlank()) {
            throw new IllegalStateException("pulse.llm.api-key is required for provider openai");
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .temperature(llm.getTemperature())
                .maxRetries(1)
                .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()));
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }

        log.info("[LLM] Using OpenAI-compatible model {}", llm.getModel());
        return builder.build();
    }
}
