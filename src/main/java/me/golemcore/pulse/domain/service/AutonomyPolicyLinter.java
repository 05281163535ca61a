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
import me.golemcore.pulse.domain.model.AutonomyLevel;
import me.golemcore.pulse.domain.model.ChecklistItem;
import me.golemcore.pulse.domain.model.EvaluationResult.ResultType;
import me.golemcore.pulse.domain.model.HeartbeatRuleSet;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Static checks over heartbeat checklists, run when a rule-set is loaded or
 * created. Findings are warnings only: the rule-set is still accepted.
 *
 * <p>
 * Flags:
 * <ul>
 * <li>action-producing checks that will run without approval for a bound
 * tenant (no rollback exists once executed)</li>
 * <li>action-producing checks with no cooldown or no daily cap</li>
 * <li>unknown operators and checks without a metric or description</li>
 * <li>duplicate check names</li>
 * </ul>
 */
@Component
@Slf4j
public class AutonomyPolicyLinter {

    private final AutonomyService autonomyService;

    public AutonomyPolicyLinter(AutonomyService autonomyService) {
        this.autonomyService = autonomyService;
    }

    public List<String> lint(HeartbeatRuleSet ruleSet, List<String> tenants) {
        List<String> warnings = new ArrayList<>();
        Set<String> seenChecks = new HashSet<>();

        for (ChecklistItem item : ruleSet.getChecklist()) {
            String check = item.getCheck() != null ? item.getCheck() : "<unnamed>";
            if (!seenChecks.add(check)) {
                warnings.add(String.format("%s/%s: duplicate check name, limits are shared", ruleSet.getId(), check));
            }
            if (item.getMetric() == null && (item.getDescription() == null || item.getDescription().isBlank())) {
                warnings.add(String.format("%s/%s: neither metric nor description, the check can never fire",
                        ruleSet.getId(), check));
            }
            if (item.getMetric() != null && !MetricConditions.isKnownOperator(item.getOperator())) {
                warnings.add(String.format("%s/%s: unknown operator '%s'", ruleSet.getId(), check,
                        item.getOperator()));
            }
            if (item.getOnBreach() != ResultType.ACTION) {
                continue;
            }
            if (item.getCooldownMinutes() <= 0 || item.getMaxTriggersPerDay() <= 0) {
                warnings.add(String.format("%s/%s: action check without cooldown or daily cap", ruleSet.getId(),
                        check));
            }
            if (!item.isRequiresApproval()) {
                for (String tenant : tenants) {
                    if (!ruleSet.isBoundTo(tenant)) {
                        continue;
                    }
                    AutonomyLevel level = autonomyService.levelFor(tenant, item.getCategory());
                    if (level.isAtLeast(AutonomyLevel.AUTOPILOT)) {
                        warnings.add(String.format(
                                "%s/%s: executes without approval for %s (category %s at %s)",
                                ruleSet.getId(), check, tenant, item.getCategory(), level));
                    }
                }
            }
        }

        warnings.forEach(warning -> log.warn("[Heartbeat] Policy: {}", warning));
        return warnings;
    }
}
