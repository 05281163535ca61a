package me.golemcore.pulse.domain.workflow.node;

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

import java.util.Collections;
import java.util.Map;

/**
 * What a node sees while executing: the owning tenant and run, the run
 * inputs and a read-only view of the accumulated context.
 */
public record NodeInput(String tenantId, String workflowId, String runId, Map<String, Object> inputs,
        Map<String, Object> context) {

    public NodeInput {
        inputs = inputs != null ? Collections.unmodifiableMap(inputs) : Map.of();
        context = context != null ? Collections.unmodifiableMap(context) : Map.of();
    }
}
