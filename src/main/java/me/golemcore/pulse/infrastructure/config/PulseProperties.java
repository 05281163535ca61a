package me.golemcore.pulse.infrastructure.config;

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

import lombok.Data;
import me.golemcore.pulse.domain.model.HeartbeatRuleSet;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties, bound from {@code application.yml}.
 *
 * <p>
 * All configuration is organized under the {@code pulse.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - where JSON tables are written</li>
 * <li>{@link SchedulerProperties} - tick intervals and the evaluation pool</li>
 * <li>{@link BusProperties} - versioned subscription registry</li>
 * <li>{@link HeartbeatProperties} - rule-sets loaded at start</li>
 * <li>{@link WorkflowProperties} - runner limits</li>
 * <li>{@link LlmProperties} - decision/advisor model settings</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "pulse")
@Data
public class PulseProperties {

    private List<String> tenants = new ArrayList<>();
    private StorageProperties storage = new StorageProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private BusProperties bus = new BusProperties();
    private HeartbeatProperties heartbeat = new HeartbeatProperties();
    private ApprovalProperties approval = new ApprovalProperties();
    private WorkflowProperties workflow = new WorkflowProperties();
    private HttpProperties http = new HttpProperties();
    private LlmProperties llm = new LlmProperties();
    private NotificationProperties notification = new NotificationProperties();

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/pulse";
    }

    // ==================== SCHEDULER ====================

    @Data
    public static class SchedulerProperties {
        private boolean enabled = true;
        private int heartbeatTickSeconds = 60;
        private int triggerTickSeconds = 60;
        private int expiryTickSeconds = 60;
        private int workflowTickSeconds = 30;
        private int workers = 4;
        private int queueCapacity = 100;
        private int evaluationTimeoutSeconds = 60;
    }

    // ==================== BUS ====================

    @Data
    public static class BusProperties {
        private String registryVersion = "1";
        private Map<String, List<String>> subscriptions = new LinkedHashMap<>();
        private int defaultInboxLimit = 50;
    }

    // ==================== HEARTBEAT ====================

    @Data
    public static class HeartbeatProperties {
        private List<HeartbeatRuleSet> rulesets = new ArrayList<>();
        private int decisionCallsPerMinute = 30;
        private int memoryEntries = 5;
    }

    // ==================== APPROVAL ====================

    @Data
    public static class ApprovalProperties {
        private int defaultExpiryHours = 72;
    }

    // ==================== WORKFLOW ====================

    @Data
    public static class WorkflowProperties {
        private int maxNodeExecutions = 100;
        private int workers = 4;
        private int maxLoopIterations = 10;
        private int maxResponseChars = 10000;
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "none";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.2;
        private int timeoutSeconds = 60;
    }

    // ==================== NOTIFICATION ====================

    @Data
    public static class NotificationProperties {
        private String webhookUrl;
        private int timeoutSeconds = 10;
        private int maxRetries = 3;
    }
}
