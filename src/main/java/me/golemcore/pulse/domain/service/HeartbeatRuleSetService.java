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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.exception.NotFoundException;
import me.golemcore.pulse.domain.model.ChecklistItem;
import me.golemcore.pulse.domain.model.HeartbeatRuleSet;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.TenantDirectoryPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Rule store for heartbeat rule-sets, kept in the global document of
 * {@code heartbeat_rulesets}.
 *
 * <p>
 * Rule-sets from {@code pulse.heartbeat.rulesets} are merged in at start:
 * definitions come from configuration while runtime state ({@code paused},
 * {@code lastRunAt}) survives restarts. Rule-sets are paused and resumed,
 * never deleted.
 */
@Service
@Slf4j
public class HeartbeatRuleSetService {

    private final JsonTable<HeartbeatRuleSet> ruleSets;
    private final PulseProperties properties;
    private final AutonomyPolicyLinter policyLinter;
    private final TenantDirectoryPort tenantDirectory;
    private final Clock clock;

    public HeartbeatRuleSetService(JsonTableStore tableStore, PulseProperties properties,
            AutonomyPolicyLinter policyLinter, TenantDirectoryPort tenantDirectory, Clock clock) {
        this.ruleSets = tableStore.table(PulseTables.HEARTBEAT_RULESETS, HeartbeatRuleSet.class);
        this.properties = properties;
        this.policyLinter = policyLinter;
        this.tenantDirectory = tenantDirectory;
        this.clock = clock;
    }

    @PostConstruct
    public void loadConfigured() {
        int loaded = 0;
        for (HeartbeatRuleSet configured : properties.getHeartbeat().getRulesets()) {
            try {
                upsertConfigured(configured);
                loaded++;
            } catch (IllegalArgumentException e) {
                log.warn("[Heartbeat] Skipping invalid configured rule-set {}: {}", configured.getId(),
                        e.getMessage());
            }
        }
        log.info("[Heartbeat] Loaded {} configured rule-set(s)", loaded);
    }

    public List<HeartbeatRuleSet> list() {
        return ruleSets.read(JsonTable.GLOBAL).stream()
                .sorted(Comparator.comparing(HeartbeatRuleSet::getId))
                .toList();
    }

    public HeartbeatRuleSet get(String ruleSetId) {
        return ruleSets.read(JsonTable.GLOBAL).stream()
                .filter(ruleSet -> ruleSet.getId().equals(ruleSetId))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Rule-set", ruleSetId));
    }

    public HeartbeatRuleSet create(HeartbeatRuleSet ruleSet) {
        validate(ruleSet);
        Instant now = clock.instant();
        HeartbeatRuleSet created = ruleSets.mutate(JsonTable.GLOBAL, rows -> {
            if (rows.stream().anyMatch(existing -> existing.getId().equals(ruleSet.getId()))) {
                throw new IllegalArgumentException("Rule-set already exists: " + ruleSet.getId());
            }
            ruleSet.setCreatedAt(now);
            ruleSet.setUpdatedAt(now);
            ruleSet.setLastRunAt(null);
            rows.add(ruleSet);
            return ruleSet;
        });
        policyLinter.lint(created, tenantDirectory.listTenants());
        log.info("[Heartbeat] Created rule-set {} for agent {}", created.getId(), created.getAgentId());
        return created;
    }

    public HeartbeatRuleSet pause(String ruleSetId) {
        HeartbeatRuleSet paused = update(ruleSetId, ruleSet -> ruleSet.setPaused(true));
        log.info("[Heartbeat] Rule-set {} paused", ruleSetId);
        return paused;
    }

    public HeartbeatRuleSet resume(String ruleSetId) {
        HeartbeatRuleSet resumed = update(ruleSetId, ruleSet -> ruleSet.setPaused(false));
        log.info("[Heartbeat] Rule-set {} resumed", ruleSetId);
        return resumed;
    }

    /**
     * Enabled, non-paused rule-sets whose interval elapsed.
     */
    public List<HeartbeatRuleSet> getDue(Instant now) {
        return list().stream().filter(ruleSet -> ruleSet.isDue(now)).toList();
    }

    public void markRun(String ruleSetId, Instant runAt) {
        update(ruleSetId, ruleSet -> ruleSet.setLastRunAt(runAt));
    }

    private HeartbeatRuleSet update(String ruleSetId, Consumer<HeartbeatRuleSet> change) {
        Instant now = clock.instant();
        return ruleSets.mutate(JsonTable.GLOBAL, rows -> {
            HeartbeatRuleSet ruleSet = rows.stream()
                    .filter(row -> row.getId().equals(ruleSetId))
                    .findFirst()
                    .orElseThrow(() -> new NotFoundException("Rule-set", ruleSetId));
            change.accept(ruleSet);
            ruleSet.setUpdatedAt(now);
            return ruleSet;
        });
    }

    private void upsertConfigured(HeartbeatRuleSet configured) {
        validate(configured);
        Instant now = clock.instant();
        HeartbeatRuleSet merged = ruleSets.mutate(JsonTable.GLOBAL, rows -> {
            Optional<HeartbeatRuleSet> stored = rows.stream()
                    .filter(row -> row.getId().equals(configured.getId()))
                    .findFirst();
            stored.ifPresent(rows::remove);
            configured.setPaused(stored.map(HeartbeatRuleSet::isPaused).orElse(configured.isPaused()));
            configured.setLastRunAt(stored.map(HeartbeatRuleSet::getLastRunAt).orElse(null));
            configured.setCreatedAt(stored.map(HeartbeatRuleSet::getCreatedAt).orElse(now));
            configured.setUpdatedAt(now);
            rows.add(configured);
            return configured;
        });
        policyLinter.lint(merged, tenantDirectory.listTenants());
    }

    static void validate(HeartbeatRuleSet ruleSet) {
        if (ruleSet.getId() == null || ruleSet.getId().isBlank()) {
            throw new IllegalArgumentException("Rule-set id is required");
        }
        if (ruleSet.getAgentId() == null || ruleSet.getAgentId().isBlank()) {
            throw new IllegalArgumentException("Rule-set agent_id is required");
        }
        if (ruleSet.getIntervalMinutes() <= 0) {
            throw new IllegalArgumentException("interval_minutes must be positive");
        }
        if (ruleSet.getChecklist() == null) {
            ruleSet.setChecklist(new ArrayList<>());
        }
        for (ChecklistItem item : ruleSet.getChecklist()) {
            if (item.getCheck() == null || item.getCheck().isBlank()) {
                throw new IllegalArgumentException("Every checklist item needs a check name");
            }
        }
    }
}
