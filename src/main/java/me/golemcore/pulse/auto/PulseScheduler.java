package me.golemcore.pulse.auto;

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
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.service.ActionService;
import me.golemcore.pulse.domain.service.HeartbeatEngine;
import me.golemcore.pulse.domain.service.TriggerEngine;
import me.golemcore.pulse.domain.workflow.WorkflowRunner;
import me.golemcore.pulse.domain.workflow.WorkflowScheduleService;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the periodic work: heartbeat rule-sets, TIME triggers, action
 * approval expiry and workflow schedules.
 *
 * <p>
 * Each concern is a {@link TickJob} with its own fixed-rate timer. A job still
 * running when its next tick fires skips that tick. Failures are logged and
 * never cancel the timer.
 */
@Component
@Slf4j
public class PulseScheduler {

    private final HeartbeatEngine heartbeatEngine;
    private final TriggerEngine triggerEngine;
    private final ActionService actionService;
    private final WorkflowScheduleService workflowScheduleService;
    private final WorkflowRunner workflowRunner;
    private final PulseProperties properties;
    private final List<TickJob> jobs = new ArrayList<>();

    private ScheduledExecutorService scheduler;

    public PulseScheduler(HeartbeatEngine heartbeatEngine, TriggerEngine triggerEngine,
            ActionService actionService, WorkflowScheduleService workflowScheduleService,
            WorkflowRunner workflowRunner, PulseProperties properties) {
        this.heartbeatEngine = heartbeatEngine;
        this.triggerEngine = triggerEngine;
        this.actionService = actionService;
        this.workflowScheduleService = workflowScheduleService;
        this.workflowRunner = workflowRunner;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        PulseProperties.SchedulerProperties config = properties.getScheduler();
        if (!config.isEnabled()) {
            log.info("[PulseScheduler] Scheduler disabled");
            return;
        }

        jobs.add(new TickJob("heartbeat", config.getHeartbeatTickSeconds(), this::heartbeatTick));
        jobs.add(new TickJob("time-triggers", config.getTriggerTickSeconds(), this::triggerTick));
        jobs.add(new TickJob("approval-expiry", config.getExpiryTickSeconds(), this::expiryTick));
        jobs.add(new TickJob("workflows", config.getWorkflowTickSeconds(), this::workflowTick));

        scheduler = Executors.newScheduledThreadPool(jobs.size(), r -> {
            Thread t = new Thread(r, "pulse-scheduler");
            t.setDaemon(true);
            return t;
        });
        for (TickJob job : jobs) {
            job.start(scheduler);
        }
        log.info("[PulseScheduler] Started {} job(s)", jobs.size());
    }

    @PreDestroy
    public void shutdown() {
        jobs.forEach(TickJob::cancel);
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[PulseScheduler] Shut down");
    }

    void heartbeatTick() {
        heartbeatEngine.runDueRuleSets();
    }

    void triggerTick() {
        triggerEngine.evaluateTimeTriggers();
    }

    void expiryTick() {
        int expired = actionService.expireOverdue();
        if (expired > 0) {
            log.info("[PulseScheduler] Expired {} action(s) waiting for approval", expired);
        }
    }

    void workflowTick() {
        workflowScheduleService.runDueSchedules();
        workflowRunner.expireApprovals();
    }

    List<TickJob> getJobs() {
        return jobs;
    }

    /**
     * One periodic concern with its own timer and overlap guard.
     */
    static final class TickJob {

        private final String name;
        private final int intervalSeconds;
        private final Runnable work;
        private final AtomicBoolean executing = new AtomicBoolean(false);
        private ScheduledFuture<?> future;

        TickJob(String name, int intervalSeconds, Runnable work) {
            this.name = name;
            this.intervalSeconds = Math.max(1, intervalSeconds);
            this.work = work;
        }

        void start(ScheduledExecutorService scheduler) {
            future = scheduler.scheduleAtFixedRate(this::tick, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
            log.info("[PulseScheduler] Job '{}' every {}s", name, intervalSeconds);
        }

        /**
         * Run the work unless the previous run is still going.
         *
         * @return whether the work ran
         */
        boolean tick() {
            if (!executing.compareAndSet(false, true)) {
                log.debug("[PulseScheduler] Job '{}' still running, skipping tick", name);
                return false;
            }
            try {
                work.run();
            } catch (Exception e) { // NOSONAR - intentionally catch all, an exception would cancel the timer
                log.error("[PulseScheduler] Job '{}' tick failed", name, e);
            } finally {
                executing.set(false);
            }
            return true;
        }

        void cancel() {
            if (future != null) {
                future.cancel(false);
            }
        }

        String getName() {
            return name;
        }
    }
}
