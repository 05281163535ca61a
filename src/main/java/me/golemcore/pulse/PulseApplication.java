package me.golemcore.pulse;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for golemcore-pulse.
 *
 * <p>
 * golemcore-pulse is the proactive coordination core of the platform: it runs
 * heartbeat checklists and trigger rules on a schedule, routes their
 * observations between agents over a topic-based message bus, gates actions
 * behind an approval state machine and executes workflow graphs that can
 * suspend for a human decision.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → REST controllers, webhook endpoints, PulseScheduler
 * Domain Layer       → MessageBusService, HeartbeatEngine, TriggerEngine,
 *                      ActionService, WorkflowRunner
 * Infrastructure     → Storage, Decision, Advisor, Notification adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration lives in {@code application.yml} under the
 * {@code pulse.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(PulseApplication.class, args);
    }

}
