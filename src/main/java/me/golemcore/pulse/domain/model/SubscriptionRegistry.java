package me.golemcore.pulse.domain.model;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, versioned table of which agent listens to which topic patterns.
 * Handed to the message bus at construction so that separate bus instances
 * never share routing state.
 *
 * <p>
 * Pattern syntax:
 * <ul>
 * <li>{@code *} matches every topic</li>
 * <li>{@code sales.*} matches any topic starting with {@code sales.}</li>
 * <li>anything else matches the topic exactly</li>
 * </ul>
 */
public final class SubscriptionRegistry {

    private static final String WILDCARD = "*";
    private static final String PREFIX_WILDCARD = ".*";

    private final String version;
    private final Map<String, List<String>> subscriptions;

    public SubscriptionRegistry(String version, Map<String, List<String>> subscriptions) {
        this.version = version != null ? version : "0";
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (subscriptions != null) {
            subscriptions.forEach((agent, patterns) -> copy.put(agent,
                    patterns != null ? List.copyOf(patterns) : List.of()));
        }
        this.subscriptions = Collections.unmodifiableMap(copy);
    }

    public static SubscriptionRegistry empty() {
        return new SubscriptionRegistry("0", Map.of());
    }

    public String getVersion() {
        return version;
    }

    public Map<String, List<String>> getSubscriptions() {
        return subscriptions;
    }

    /**
     * Agents subscribed to {@code topic}, in registry order, never including
     * {@code publisher}.
     */
    public List<String> recipientsFor(String topic, String publisher) {
        List<String> recipients = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : subscriptions.entrySet()) {
            String agent = entry.getKey();
            if (agent.equals(publisher)) {
                continue;
            }
            for (String pattern : entry.getValue()) {
                if (topicMatches(pattern, topic)) {
                    recipients.add(agent);
                    break;
                }
            }
        }
        return recipients;
    }

    public static boolean topicMatches(String pattern, String topic) {
        if (pattern == null || topic == null) {
            return false;
        }
        if (WILDCARD.equals(pattern)) {
            return true;
        }
        if (pattern.endsWith(PREFIX_WILDCARD)) {
            String prefix = pattern.substring(0, pattern.length() - 1);
            return topic.startsWith(prefix);
        }
        return pattern.equals(topic);
    }

    @Override
    public String toString() {
        return "SubscriptionRegistry{version=" + version + ", subscribers=" + subscriptions.keySet() + "}";
    }
}
