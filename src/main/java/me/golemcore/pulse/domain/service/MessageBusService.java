package me.golemcore.pulse.domain.service;

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
import me.golemcore.pulse.domain.exception.NotFoundException;
import me.golemcore.pulse.domain.model.AgentMessage;
import me.golemcore.pulse.domain.model.PublishRequest;
import me.golemcore.pulse.domain.model.SubscriptionRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Topic-based agent-to-agent message bus.
 *
 * <p>
 * Delivery is pull-based: {@link #publish(PublishRequest)} only writes rows to
 * {@code agent_messages} and consumers read their inbox. A broadcast is routed
 * through the {@link SubscriptionRegistry} given at construction and stored as
 * one row per recipient; the publisher never receives its own broadcast.
 *
 * <p>
 * Messages of a thread are totally ordered by creation time, ties broken by
 * the per-tenant sequence number.
 */
@Service
@Slf4j
public class MessageBusService {

    private static final Comparator<AgentMessage> CREATION_ORDER = Comparator
            .comparing(AgentMessage::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingLong(AgentMessage::getSequence);

    private final JsonTable<AgentMessage> messages;
    private final SubscriptionRegistry registry;
    private final Clock clock;

    public MessageBusService(JsonTableStore tableStore, SubscriptionRegistry registry, Clock clock) {
        this.messages = tableStore.table(PulseTables.AGENT_MESSAGES, AgentMessage.class);
        this.registry = registry;
        this.clock = clock;
        log.info("[Bus] Using {}", registry);
    }

    /**
     * Publish a message. Returns one row per recipient, or an empty list (and no
     * writes) when nobody is subscribed to the topic.
     */
    public List<AgentMessage> publish(PublishRequest request) {
        requireText(request.getTenantId(), "startup_id");
        requireText(request.getFromAgent(), "from_agent");
        requireText(request.getTopic(), "topic");

        List<String> recipients = request.getToAgent() != null && !request.getToAgent().isBlank()
                ? List.of(request.getToAgent())
                : registry.recipientsFor(request.getTopic(), request.getFromAgent());
        if (recipients.isEmpty()) {
            log.debug("[Bus] No subscribers for topic {} from {}", request.getTopic(), request.getFromAgent());
            return List.of();
        }

        Instant now = clock.instant();
        Instant deadline = request.getResponseDeadlineMinutes() != null && request.getResponseDeadlineMinutes() > 0
                ? now.plus(Duration.ofMinutes(request.getResponseDeadlineMinutes()))
                : null;
        String threadId = request.getThreadId() != null && !request.getThreadId().isBlank()
                ? request.getThreadId()
                : UUID.randomUUID().toString();
        boolean broadcast = request.getToAgent() == null || request.getToAgent().isBlank();
        Map<String, Object> payload = request.getPayload() != null
                ? new LinkedHashMap<>(request.getPayload())
                : new LinkedHashMap<>();

        List<AgentMessage> published = messages.mutate(request.getTenantId(), rows -> {
            long sequence = rows.stream().mapToLong(AgentMessage::getSequence).max().orElse(0);
            List<AgentMessage> created = new ArrayList<>();
            for (String recipient : recipients) {
                AgentMessage message = AgentMessage.builder()
                        .id(UUID.randomUUID().toString())
                        .tenantId(request.getTenantId())
                        .threadId(threadId)
                        .parentId(request.getParentId())
                        .fromAgent(request.getFromAgent())
                        .toAgent(recipient)
                        .topic(request.getTopic())
                        .broadcast(broadcast)
                        .messageType(request.getMessageType() != null
                                ? request.getMessageType()
                                : AgentMessage.MessageType.INSIGHT)
                        .priority(request.getPriority() != null
                                ? request.getPriority()
                                : AgentMessage.Priority.MEDIUM)
                        .payload(new LinkedHashMap<>(payload))
                        .status(AgentMessage.Status.PENDING)
                        .requiresResponse(request.isRequiresResponse())
                        .responseDeadline(deadline)
                        .createdAt(now)
                        .sequence(++sequence)
                        .build();
                rows.add(message);
                created.add(message);
            }
            return created;
        });

        log.info("[Bus] Published {} on {} from {} to {} recipient(s) in thread {}",
                published.get(0).getMessageType(), request.getTopic(), request.getFromAgent(),
                published.size(), threadId);
        return published;
    }

    /**
     * Messages addressed to {@code agentId} (or to nobody), newest first. An
     * unknown status filter is ignored.
     */
    public List<AgentMessage> getInbox(String tenantId, String agentId, String status, int limit) {
        Optional<AgentMessage.Status> statusFilter = parseStatus(status);
        return messages.read(tenantId).stream()
                .filter(message -> message.getToAgent() == null || message.getToAgent().equals(agentId))
                .filter(message -> statusFilter.map(s -> s == message.getStatus()).orElse(true))
                .sorted(CREATION_ORDER.reversed())
                .limit(Math.max(1, limit))
                .toList();
    }

    /**
     * All messages of a thread in creation order.
     */
    public List<AgentMessage> getThread(String threadId, int limit) {
        return messages.findTenant(message -> threadId.equals(message.getThreadId()))
                .map(tenant -> messages.read(tenant).stream()
                        .filter(message -> threadId.equals(message.getThreadId()))
                        .sorted(CREATION_ORDER)
                        .limit(Math.max(1, limit))
                        .toList())
                .orElse(List.of());
    }

    public AgentMessage getMessage(String messageId) {
        return messages.findAny(message -> messageId.equals(message.getId()))
                .orElseThrow(() -> new NotFoundException("Message", messageId));
    }

    /**
     * Reply to a message: a new INSIGHT to the original sender in the same
     * thread, parented to the original. The original's
     * {@code responseReceived} flag is set and never cleared.
     */
    public AgentMessage respondTo(String originalId, String fromAgent, Map<String, Object> payload) {
        requireText(fromAgent, "from_agent");
        AgentMessage original = getMessage(originalId);

        messages.mutate(original.getTenantId(), rows -> {
            rows.stream()
                    .filter(message -> originalId.equals(message.getId()))
                    .findFirst()
                    .ifPresent(message -> message.setResponseReceived(true));
            return null;
        });

        List<AgentMessage> responses = publish(PublishRequest.builder()
                .tenantId(original.getTenantId())
                .fromAgent(fromAgent)
                .topic(original.getTopic())
                .messageType(AgentMessage.MessageType.INSIGHT)
                .payload(payload)
                .toAgent(original.getFromAgent())
                .threadId(original.getThreadId())
                .parentId(original.getId())
                .build());
        log.debug("[Bus] {} responded to {} in thread {}", fromAgent, originalId, original.getThreadId());
        return responses.get(0);
    }

    /**
     * PENDING to PROCESSED. Idempotent.
     */
    public AgentMessage markProcessed(String messageId) {
        AgentMessage found = getMessage(messageId);
        return messages.mutate(found.getTenantId(), rows -> {
            AgentMessage message = rows.stream()
                    .filter(row -> messageId.equals(row.getId()))
                    .findFirst()
                    .orElseThrow(() -> new NotFoundException("Message", messageId));
            message.setStatus(AgentMessage.Status.PROCESSED);
            return message;
        });
    }

    /**
     * Messages still waiting for a response after their deadline.
     */
    public List<AgentMessage> getOverdueResponses(String tenantId) {
        Instant now = clock.instant();
        return messages.read(tenantId).stream()
                .filter(message -> message.isResponseOverdue(now))
                .sorted(CREATION_ORDER)
                .toList();
    }

    public static AgentMessage.MessageType resolveType(String value) {
        AgentMessage.MessageType type = AgentMessage.MessageType.parse(value);
        if (value != null && !type.name().equalsIgnoreCase(value.trim())) {
            log.debug("[Bus] Unknown message type '{}', using {}", value, type);
        }
        return type;
    }

    public static AgentMessage.Priority resolvePriority(String value) {
        AgentMessage.Priority priority = AgentMessage.Priority.parse(value);
        if (value != null && !priority.name().equalsIgnoreCase(value.trim())) {
            log.debug("[Bus] Unknown priority '{}', using {}", value, priority);
        }
        return priority;
    }

    private static Optional<AgentMessage.Status> parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(AgentMessage.Status.valueOf(status.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
