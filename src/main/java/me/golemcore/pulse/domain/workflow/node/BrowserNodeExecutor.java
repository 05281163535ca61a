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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.exception.NodeExecutionException;
import me.golemcore.pulse.domain.model.WorkflowNode;
import me.golemcore.pulse.domain.model.WorkflowNode.NodeType;
import me.golemcore.pulse.domain.workflow.ContextPaths;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Fetches a page and extracts its readable text. No script execution: the
 * HTML returned by the server is parsed as is.
 *
 * <p>
 * Config: {@code url} (templated, required), {@code selector} (CSS, defaults
 * to the main content candidates). Output: {@code {url, status, title, text}}.
 */
@Component
@Slf4j
public class BrowserNodeExecutor implements NodeExecutor {

    private static final String USER_AGENT = "Mozilla/5.0 (compatible; golemcore-pulse)";
    private static final String NOISE = "script,noscript,style,header,footer,nav,aside";
    private static final String CONTENT = "article, main, #content, .post, .entry-content, .article, .content";

    private final OkHttpClient okHttpClient;
    private final PulseProperties properties;

    public BrowserNodeExecutor(OkHttpClient okHttpClient, PulseProperties properties) {
        this.okHttpClient = okHttpClient;
        this.properties = properties;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.BROWSER;
    }

    @Override
    public void validate(WorkflowNode node) {
        NodeConfigs.requireString(node, "url");
    }

    @Override
    @SuppressWarnings("PMD.CloseResource") // ResponseBody is closed when Response is closed in try-with-resources
    public Object execute(WorkflowNode node, NodeInput input) {
        String url = ContextPaths.render(NodeConfigs.requireString(node, "url"), input.context());
        HttpUrl httpUrl = HttpUrl.parse(url);
        if (httpUrl == null) {
            throw new NodeExecutionException(node.getId(), "Invalid URL: " + url);
        }

        Request request = new Request.Builder()
                .url(httpUrl)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "text/html,application/xhtml+xml")
                .get()
                .build();

        try (Response response = okHttpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new NodeExecutionException(node.getId(), "Page fetch failed with HTTP " + response.code());
            }
            Document document = Jsoup.parse(body.string(), httpUrl.toString());
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("url", httpUrl.toString());
            output.put("status", response.code());
            output.put("title", document.title());
            output.put("text", NodeConfigs.abbreviate(extractText(document, node.configString("selector")),
                    properties.getWorkflow().getMaxResponseChars()));
            log.debug("[Workflow] Browser node {} fetched {}", node.getId(), httpUrl.redact());
            return output;
        } catch (IOException e) {
            throw new NodeExecutionException(node.getId(), "Page fetch failed: " + e.getMessage(), e);
        }
    }

    static String extractText(Document document, String selector) {
        document.select(NOISE).remove();
        Elements parts = document.select(selector != null && !selector.isBlank() ? selector : CONTENT);
        if (parts.isEmpty() && document.body() != null) {
            parts = document.body().children();
        }
        return parts.stream()
                .map(Element::text)
                .collect(Collectors.joining("\n"))
                .replace('\u00A0', ' ')
                .replaceAll("[ \\t]{2,}", " ")
                .trim();
    }
}
