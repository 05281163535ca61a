package me.golemcore.pulse.domain.workflow;

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
import me.golemcore.pulse.domain.model.Workflow;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Starts schedule-triggered workflows whose next cron time has passed.
 * Missed occurrences are not replayed: the schedule moves to the next time
 * after now.
 */
@Service
@Slf4j
public class WorkflowScheduleService {

    private final WorkflowService workflowService;
    private final WorkflowRunner workflowRunner;
    private final Clock clock;

    public WorkflowScheduleService(WorkflowService workflowService, WorkflowRunner workflowRunner, Clock clock) {
        this.workflowService = workflowService;
        this.workflowRunner = workflowRunner;
        this.clock = clock;
    }

    public int runDueSchedules() {
        Instant now = clock.instant();
        int started = 0;
        for (Workflow workflow : workflowService.listDueSchedules(now)) {
            try {
                workflowService.advanceSchedule(workflow.getId(), now);
                Map<String, Object> inputs = new LinkedHashMap<>();
                inputs.put("scheduled_at", workflow.getNextScheduledAt().toString());
                workflowRunner.start(workflow.getId(), inputs, true, "schedule");
                started++;
            } catch (RuntimeException e) { // NOSONAR - intentionally catch all, one workflow must not stop the tick
                log.error("[Workflow] Scheduled start of {} failed", workflow.getId(), e);
            }
        }
        if (started > 0) {
            log.info("[Workflow] Started {} scheduled run(s)", started);
        }
        return started;
    }
}
