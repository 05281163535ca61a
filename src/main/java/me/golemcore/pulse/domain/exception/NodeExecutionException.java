package me.golemcore.pulse.domain.exception;

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

/**
 * A workflow node failed. The run is marked FAILED and attributed to
 * {@link #getNodeId()}.
 */
public class NodeExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String nodeId;

    public NodeExecutionException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    public NodeExecutionException(String nodeId, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
