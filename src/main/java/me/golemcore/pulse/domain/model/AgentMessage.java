package me.golemcore.pulse.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A unit of agent-to-agent communication, persisted in the
 * {@code agent_messages} table. A broadcast is stored as one copy per
 * subscribed recipient, all sharing the same thread.
 *
 * <p>
 * {@code status} only moves forward (PENDING to PROCESSED) and
 * {@code threadId} never changes once assigned.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentMessage {

    private String id;
    private String tenantId;
    private String threadId;
    private String parentId;
    private String fromAgent;
    private String toAgent;
    private String topic;
    private boolean broadcast;

    @Builder.Default
    private MessageType messageType = MessageType.INSIGHT;

    @Builder.Default
    private Priority priority = Priority.MEDIUM;

    @Builder.Default
    private Map<String, Object> payload = new LinkedHashMap<>();

    @Builder.Default
    private Status status = Status.PENDING;

    private boolean requiresResponse;
    private Instant responseDeadline;
    private boolean responseReceived;
    private Instant createdAt;
    private long sequence;

    public enum MessageType {
        INSIGHT, REQUEST, ACTION, ALERT;

        /**
         * Lenient parse; unknown or blank values resolve to {@link #INSIGHT}.
         */
        public static MessageType parse(String value) {
            if (value == null || value.isBlank()) {
                return INSIGHT;
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return INSIGHT;
            }
        }
    }

    public enum Priority {
        LOW, MEDIUM, HIGH, CRITICAL;

        /**
         * Lenient parse; unknown or blank values resolve to {@link #MEDIUM}.
         */
        public static Priority parse(String value) {
            if (value == null || value.isBlank()) {
                return MEDIUM;
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return MEDIUM;
            }
        }
    }

    public enum Status {
        PENDING, PROCESSED
    }

    /**
     * Whether a response was requested and the deadline passed without one.
     */
    @JsonIgnore
    public boolean isResponseOverdue(Instant now) {
        return requiresResponse && !responseReceived && responseDeadline != null && now.isAfter(responseDeadline);
    }
}
