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

import me.golemcore.pulse.domain.model.WorkflowNode;
import me.golemcore.pulse.domain.model.WorkflowNode.NodeType;

/**
 * Executes one kind of workflow node. Implementations are Spring components
 * collected by {@link NodeExecutorRegistry}.
 *
 * <p>
 * The returned output is stored in the run context under the node id. A
 * failure is reported by throwing
 * {@link me.golemcore.pulse.domain.exception.NodeExecutionException}; the run
 * then ends FAILED without retry.
 */
public interface NodeExecutor {

    NodeType getNodeType();

    /**
     * Check the node config when a workflow is saved.
     *
     * @throws IllegalArgumentException
     *             if the config is not usable
     */
    default void validate(WorkflowNode node) {
    }

    Object execute(WorkflowNode node, NodeInput input);
}
