package me.golemcore.pulse.port.outbound;

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

import me.golemcore.pulse.domain.model.ChecklistItem;
import me.golemcore.pulse.domain.model.Decision;
import me.golemcore.pulse.domain.model.EvaluationContext;

import java.util.List;

/**
 * Port for the heartbeat decision function. Given the assembled context and
 * the checklist it classifies the situation as OK, INSIGHT, ACTION or
 * ESCALATION.
 *
 * <p>
 * Implementations may block for seconds (LLM calls) and may throw; callers
 * run them on a bounded pool with a timeout and record failures as OK.
 */
public interface DecisionPort {

    Decision decide(EvaluationContext context, List<ChecklistItem> checklist);

    /**
     * Model or strategy name recorded in the ledger.
     */
    String getName();
}
