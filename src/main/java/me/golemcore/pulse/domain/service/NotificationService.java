package me.golemcore.pulse.domain.service;

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
import me.golemcore.pulse.domain.model.Notification;
import me.golemcore.pulse.port.outbound.NotificationPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Routes notifications to the {@link NotificationPort} of each requested
 * channel. Channels without an adapter fall back to the default channel.
 * Delivery failures are logged and never reach the caller.
 */
@Service
@Slf4j
public class NotificationService {

    public static final String DEFAULT_CHANNEL = "in_app";

    private final Map<String, NotificationPort> ports = new LinkedHashMap<>();

    public NotificationService(List<NotificationPort> notificationPorts) {
        for (NotificationPort port : notificationPorts) {
            ports.put(port.getChannel(), port);
        }
        log.info("[Notify] Channels available: {}", ports.keySet());
    }

    /**
     * @return {@code true} when at least one channel accepted the notification
     */
    public boolean notify(Notification notification) {
        List<String> requested = notification.getChannels() == null || notification.getChannels().isEmpty()
                ? List.of(DEFAULT_CHANNEL)
                : notification.getChannels();

        Set<NotificationPort> targets = new LinkedHashSet<>();
        for (String channel : requested) {
            NotificationPort port = ports.get(channel);
            if (port == null) {
                log.debug("[Notify] No adapter for channel {}, using {}", channel, DEFAULT_CHANNEL);
                port = ports.get(DEFAULT_CHANNEL);
            }
            if (port != null) {
                targets.add(port);
            }
        }

        boolean delivered = false;
        for (NotificationPort port : targets) {
            try {
                port.send(notification);
                delivered = true;
            } catch (RuntimeException e) { // NOSONAR - intentionally catch all, one channel must not block others
                log.error("[Notify] Channel {} failed for {}: {}", port.getChannel(), notification.getTenantId(),
                        e.getMessage());
            }
        }
        return delivered;
    }

    public List<String> availableChannels() {
        return new ArrayList<>(ports.keySet());
    }
}
