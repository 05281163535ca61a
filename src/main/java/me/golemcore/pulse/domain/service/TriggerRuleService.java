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
import me.golemcore.pulse.domain.model.TriggerRule;
import me.golemcore.pulse.domain.model.TriggerRule.TriggerType;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * CRUD over per-tenant trigger rules. Rules are paused, resumed or
 * deactivated; deletion is an explicit separate call.
 */
@Service
@Slf4j
public class TriggerRuleService {

    private static final int WEBHOOK_SECRET_BYTES = 24;

    private final JsonTable<TriggerRule> rules;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public TriggerRuleService(JsonTableStore tableStore, Clock clock) {
        this.rules = tableStore.table(PulseTables.TRIGGER_RULES, TriggerRule.class);
        this.clock = clock;
    }

    public List<TriggerRule> list(String tenantId, boolean includeInactive) {
        return rules.read(tenantId).stream()
                .filter(rule -> includeInactive || rule.isActive())
                .sorted(Comparator.comparing(TriggerRule::getCreatedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    /**
     * Active, non-paused rules of one trigger type.
     */
    public List<TriggerRule> listRunnable(String tenantId, TriggerType triggerType) {
        return rules.read(tenantId).stream()
                .filter(rule -> rule.isActive() && !rule.isPaused())
                .filter(rule -> rule.getTriggerType() == triggerType)
                .toList();
    }

    public List<String> tenants() {
        return rules.tenants();
    }

    public TriggerRule get(String tenantId, String ruleId) {
        return rules.read(tenantId).stream()
                .filter(rule -> rule.getId().equals(ruleId))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Trigger rule", ruleId));
    }

    public Optional<TriggerRule> findByWebhookSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            return Optional.empty();
        }
        return rules.findAny(rule -> secret.equals(rule.getWebhookSecret()));
    }

    public TriggerRule create(String tenantId, TriggerRule rule) {
        validate(rule);
        Instant now = clock.instant();
        rule.setId(UUID.randomUUID().toString());
        rule.setTenantId(tenantId);
        rule.setActive(true);
        rule.setTriggerCount(0);
        rule.setLastTriggeredAt(null);
        rule.setLastEvaluatedAt(null);
        rule.setCreatedAt(now);
        rule.setUpdatedAt(now);
        rule.setWebhookSecret(rule.getTriggerType() == TriggerType.WEBHOOK ? newWebhookSecret() : null);
        rules.append(tenantId, rule);
        log.info("[Triggers] Created {} rule '{}' ({}) for {}", rule.getTriggerType(), rule.getName(),
                rule.getId(), tenantId);
        return rule;
    }

    /**
     * Replace the definition of a rule. Runtime counters and the webhook
     * secret are kept.
     */
    public TriggerRule update(String tenantId, String ruleId, TriggerRule changes) {
        validate(changes);
        return mutate(tenantId, ruleId, rule -> {
            if (changes.getTriggerType() == TriggerType.WEBHOOK && rule.getWebhookSecret() == null) {
                rule.setWebhookSecret(newWebhookSecret());
            }
            rule.setName(changes.getName());
            rule.setDescription(changes.getDescription());
            rule.setTriggerType(changes.getTriggerType());
            rule.setCondition(changes.getCondition());
            rule.setAction(changes.getAction());
            rule.setCooldownMinutes(changes.getCooldownMinutes());
            rule.setMaxTriggersPerDay(changes.getMaxTriggersPerDay());
        });
    }

    public TriggerRule pause(String tenantId, String ruleId) {
        log.info("[Triggers] Pausing rule {} for {}", ruleId, tenantId);
        return mutate(tenantId, ruleId, rule -> rule.setPaused(true));
    }

    public TriggerRule resume(String tenantId, String ruleId) {
        log.info("[Triggers] Resuming rule {} for {}", ruleId, tenantId);
        return mutate(tenantId, ruleId, rule -> rule.setPaused(false));
    }

    public TriggerRule deactivate(String tenantId, String ruleId) {
        log.info("[Triggers] Deactivating rule {} for {}", ruleId, tenantId);
        return mutate(tenantId, ruleId, rule -> rule.setActive(false));
    }

    public void delete(String tenantId, String ruleId) {
        boolean removed = rules.mutate(tenantId, rows -> rows.removeIf(rule -> rule.getId().equals(ruleId)));
        if (!removed) {
            throw new NotFoundException("Trigger rule", ruleId);
        }
        log.info("[Triggers] Deleted rule {} for {}", ruleId, tenantId);
    }

    public void markEvaluated(String tenantId, String ruleId, Instant evaluatedAt) {
        mutate(tenantId, ruleId, rule -> rule.setLastEvaluatedAt(evaluatedAt));
    }

    public TriggerRule markTriggered(String tenantId, String ruleId, Instant triggeredAt) {
        return mutate(tenantId, ruleId, rule -> {
            rule.setLastEvaluatedAt(triggeredAt);
            rule.setLastTriggeredAt(triggeredAt);
            rule.setTriggerCount(rule.getTriggerCount() + 1);
        });
    }

    private TriggerRule mutate(String tenantId, String ruleId, Consumer<TriggerRule> change) {
        Instant now = clock.instant();
        return rules.mutate(tenantId, rows -> {
            TriggerRule rule = rows.stream()
                    .filter(row -> row.getId().equals(ruleId))
                    .findFirst()
                    .orElseThrow(() -> new NotFoundException("Trigger rule", ruleId));
            change.accept(rule);
            rule.setUpdatedAt(now);
            return rule;
        });
    }

    private String newWebhookSecret() {
        byte[] bytes = new byte[WEBHOOK_SECRET_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    static void validate(TriggerRule rule) {
        if (rule.getName() == null || rule.getName().isBlank()) {
            throw new IllegalArgumentException("Trigger name is required");
        }
        if (rule.getTriggerType() == null) {
            throw new IllegalArgumentException("trigger_type is required");
        }
        if (rule.getAction() == null || rule.getAction().getTask() == null || rule.getAction().getTask().isBlank()) {
            throw new IllegalArgumentException("action.task is required");
        }
        TriggerRule.Condition condition = rule.getCondition();
        if (condition == null) {
            throw new IllegalArgumentException("condition is required");
        }
        switch (rule.getTriggerType()) {
            case METRIC -> {
                if (condition.getMetric() == null || condition.getMetric().isBlank()) {
                    throw new IllegalArgumentException("condition.metric is required for METRIC triggers");
                }
                if (!MetricConditions.isKnownOperator(condition.getOperator())) {
                    throw new IllegalArgumentException("Unknown operator: " + condition.getOperator());
                }
                if (condition.getValue() == null) {
                    throw new IllegalArgumentException("condition.value is required for METRIC triggers");
                }
            }
            case TIME -> CronSchedules.normalize(condition.getCron());
            case EVENT -> {
                if (condition.getEvent() == null || condition.getEvent().isBlank()) {
                    throw new IllegalArgumentException("condition.event is required for EVENT triggers");
                }
            }
            case WEBHOOK -> {
                // fired only through its secret
            }
        }
    }
}
