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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.Advice;
import me.golemcore.pulse.domain.model.AdvisorRequest;
import me.golemcore.pulse.port.outbound.AdvisorPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Advisor used when no LLM is configured. Echoes the task so that actions and
 * {@code ai} workflow nodes still complete with a traceable result.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@ConditionalOnProperty(prefix = "pulse.llm", name = "provider", havingValue = "none", matchIfMissing = true)
@Slf4j
public class NoOpAdvisorAdapter implements AdvisorPort {

    @Override
    public Advice respond(AdvisorRequest request) {
        log.debug("[LLM] No LLM configured, echoing advisor request for {}", request.getAgentId());
        return Advice.builder()
                .content("[No LLM configured] " + request.getPrompt())
                .model("none")
                .build();
    }
}
