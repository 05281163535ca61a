package me.golemcore.pulse.adapter.outbound.notification;

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
import org.springframework.stereotype.Component;

/**
 * In-app notification channel. Writes the notification to the application log
 * where the dashboard's log shipper picks it up; also the fallback for
 * channels without a dedicated adapter.
 */
@Component
@Slf4j
public class LoggingNotificationAdapter implements NotificationPort {

    public static final String CHANNEL = "in_app";

    @Override
    public String getChannel() {
        return CHANNEL;
    }

    @Override
    public void send(Notification notification) {
        log.info("[Notify] [{}] {}: {}", notification.getTenantId(), notification.getTitle(),
                notification.getBody());
    }
}
