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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.exception.NodeExecutionException;
import me.golemcore.pulse.domain.model.WorkflowNode;
import me.golemcore.pulse.domain.model.WorkflowNode.NodeType;
import me.golemcore.pulse.domain.workflow.ContextPaths;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Performs one HTTP request with the shared OkHttp client.
 *
 * <p>
 * Config: {@code url} (templated, required), {@code method} (default GET),
 * {@code headers}, {@code body} (string template or JSON object),
 * {@code timeout_seconds}, {@code fail_on_error}. Output:
 * {@code {status, ok, data, json?}}.
 */
@Component
@Slf4j
public class HttpNodeExecutor implements NodeExecutor {

    private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE", "HEAD");
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final PulseProperties properties;

    public HttpNodeExecutor(OkHttpClient okHttpClient, ObjectMapper objectMapper, PulseProperties properties) {
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.HTTP;
    }

    @Override
    public void validate(WorkflowNode node) {
        NodeConfigs.requireString(node, "url");
        String method = NodeConfigs.string(node, "method", "GET").toUpperCase(Locale.ROOT);
        if (!METHODS.contains(method)) {
            throw new IllegalArgumentException("Unsupported HTTP method for node " + node.getId() + ": " + method);
        }
    }

    @Override
    @SuppressWarnings("PMD.CloseResource") // ResponseBody is closed when Response is closed in try-with-resources
    public Object execute(WorkflowNode node, NodeInput input) {
        String url = ContextPaths.render(NodeConfigs.requireString(node, "url"), input.context());
        HttpUrl httpUrl = HttpUrl.parse(url);
        if (httpUrl == null) {
            throw new NodeExecutionException(node.getId(), "Invalid URL: " + url);
        }
        String method = NodeConfigs.string(node, "method", "GET").toUpperCase(Locale.ROOT);

        Request.Builder request = new Request.Builder().url(httpUrl);
        NodeConfigs.map(node, "headers").forEach((name, value) -> request.header(name,
                ContextPaths.render(String.valueOf(value), input.context())));
        request.method(method, buildBody(node, method, input));

        OkHttpClient client = okHttpClient;
        int timeoutSeconds = NodeConfigs.integer(node, "timeout_seconds", 0);
        if (timeoutSeconds > 0) {
            client = okHttpClient.newBuilder().callTimeout(timeoutSeconds, TimeUnit.SECONDS).build();
        }

        log.debug("[Workflow] HTTP node {}: {} {}", node.getId(), method, httpUrl.redact());
        try (Response response = client.newCall(request.build()).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (!response.isSuccessful() && NodeConfigs.bool(node, "fail_on_error", false)) {
                throw new NodeExecutionException(node.getId(), "HTTP " + response.code() + " from "
                        + httpUrl.redact());
            }

            Map<String, Object> output = new LinkedHashMap<>();
            output.put("status", response.code());
            output.put("ok", response.isSuccessful());
            output.put("data", NodeConfigs.abbreviate(text, properties.getWorkflow().getMaxResponseChars()));
            String contentType = response.header("Content-Type", "");
            if (contentType != null && contentType.contains("json") && !text.isBlank()) {
                try {
                    output.put("json", objectMapper.readValue(text, Object.class));
                } catch (JsonProcessingException e) {
                    log.debug("[Workflow] HTTP node {} returned invalid JSON: {}", node.getId(), e.getMessage());
                }
            }
            return output;
        } catch (IOException e) {
            throw new NodeExecutionException(node.getId(), "HTTP request failed: " + e.getMessage(), e);
        }
    }

    private RequestBody buildBody(WorkflowNode node, String method, NodeInput input) {
        if ("GET".equals(method) || "HEAD".equals(method)) {
            return null;
        }
        Object body = node.getConfig() != null ? node.getConfig().get("body") : null;
        if (body == null) {
            return RequestBody.create(new byte[0], (MediaType) null);
        }
        if (body instanceof String template) {
            return RequestBody.create(ContextPaths.render(template, input.context()), JSON);
        }
        try {
            return RequestBody.create(objectMapper.writeValueAsString(body), JSON);
        } catch (JsonProcessingException e) {
            throw new NodeExecutionException(node.getId(), "Cannot serialize request body: " + e.getMessage(), e);
        }
    }
}
