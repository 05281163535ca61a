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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.ChecklistItem;
import me.golemcore.pulse.domain.model.Decision;
import me.golemcore.pulse.domain.model.EvaluationContext;
import me.golemcore.pulse.domain.model.EvaluationResult.ResultType;
import me.golemcore.pulse.domain.service.MetricConditions;
import me.golemcore.pulse.port.outbound.DecisionPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Deterministic decision function used when no LLM is configured.
 *
 * <p>
 * Each checklist item with a {@code metric}, {@code operator} and
 * {@code threshold} is compared against the context's metrics. A breached item
 * yields its {@code onBreach} result, or ESCALATION when the value also
 * breaches {@code escalateThreshold}. The most severe breach wins; ties go to
 * the first item. Items without a metric are ignored.
 */
@Component
@ConditionalOnProperty(prefix = "pulse.llm", name = "provider", havingValue = "none", matchIfMissing = true)
@Slf4j
public class RuleBasedDecisionAdapter implements DecisionPort {

    public static final String NAME = "rule-based";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Decision decide(EvaluationContext context, List<ChecklistItem> checklist) {
        Decision strongest = null;
        for (ChecklistItem item : checklist) {
            Decision decision = evaluateItem(context, item);
            if (decision != null && (strongest == null || severity(decision) > severity(strongest))) {
                strongest = decision;
            }
        }
        if (strongest == null) {
            Decision ok = Decision.ok("All " + checklist.size() + " checks passed");
            ok.setModel(NAME);
            return ok;
        }
        return strongest;
    }

    private Decision evaluateItem(EvaluationContext context, ChecklistItem item) {
        if (item.getMetric() == null || item.getOperator() == null || item.getThreshold() == null) {
            return null;
        }
        Double current = context.getMetrics().get(item.getMetric());
        Double previous = context.getPreviousMetrics().get(item.getMetric());
        boolean percent = item.isPercent();
        if (!MetricConditions.matches(item.getOperator(), current, previous, item.getThreshold(), percent)) {
            return null;
        }

        ResultType resultType = item.getOnBreach() != null ? item.getOnBreach() : ResultType.INSIGHT;
        if (item.getEscalateThreshold() != null && MetricConditions.matches(item.getOperator(), current, previous,
                item.getEscalateThreshold(), percent)) {
            resultType = ResultType.ESCALATION;
        }
        String check = item.getCheck() != null ? item.getCheck() : item.getMetric();
        String summary = String.format(Locale.ROOT, "%s: %s=%s %s %s", check, item.getMetric(),
                formatNumber(current), item.getOperator(), formatNumber(item.getThreshold()));
        log.debug("[Heartbeat] Check {} breached for {}: {}", check, context.getTenantId(), resultType);

        return Decision.builder()
                .resultType(resultType)
                .triggeredCheck(check)
                .summary(summary)
                .recommendedAction(item.getAction())
                .shouldNotify(item.isNotify() || resultType == ResultType.ESCALATION)
                .model(NAME)
                .build();
    }

    private static int severity(Decision decision) {
        return switch (decision.getResultType()) {
            case ESCALATION -> 3;
            case ACTION -> 2;
            case INSIGHT -> 1;
            default -> 0;
        };
    }

    private static String formatNumber(Double value) {
        if (value == null) {
            return "n/a";
        }
        if (value == Math.rint(value)) {
            return String.valueOf(value.longValue());
        }
        return String.valueOf(value);
    }
}
