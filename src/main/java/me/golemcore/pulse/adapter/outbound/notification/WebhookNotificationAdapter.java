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
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.NotificationPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Delivers notifications as JSON POSTs to {@code pulse.notification.webhook-url}.
 * Uses {@link WebClient} fire-and-forget with exponential backoff retry.
 */
@Component
@ConditionalOnProperty(prefix = "pulse.notification", name = "webhook-url")
@Slf4j
public class WebhookNotificationAdapter implements NotificationPort {

    public static final String CHANNEL = "webhook";

    private static final Duration FIRST_BACKOFF = Duration.ofSeconds(1);

    private final WebClient webClient;
    private final PulseProperties.NotificationProperties settings;

    @Autowired
    public WebhookNotificationAdapter(PulseProperties properties) {
        this(WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(256 * 1024))
                .build(), properties);
    }

    WebhookNotificationAdapter(WebClient webClient, PulseProperties properties) {
        this.webClient = webClient;
        this.settings = properties.getNotification();
    }

    @Override
    public String getChannel() {
        return CHANNEL;
    }

    @Override
    public void send(Notification notification) {
        buildSendMono(notification).subscribe(
                ignored -> {
                },
                error -> log.debug("[Notify] Webhook delivery dropped: {}", error.getMessage()));
    }

    Mono<Void> buildSendMono(Notification notification) {
        String url = settings.getWebhookUrl();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("startup_id", notification.getTenantId());
        body.put("title", notification.getTitle());
        body.put("body", notification.getBody());
        body.put("channels", notification.getChannels());

        return webClient.post()
                .uri(url)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .timeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
                .retryWhen(buildRetry()
                        .doBeforeRetry(signal -> log.debug(
                                "[Notify] Retrying webhook to {} (attempt {})",
                                url, signal.totalRetries() + 1)))
                .doOnSuccess(response -> log.info("[Notify] Webhook delivered to {}: {}",
                        url, notification.getTitle()))
                .doOnError(error -> log.error("[Notify] Webhook to {} failed after retries: {}",
                        url, error.getMessage()))
                .then();
    }

    protected RetryBackoffSpec buildRetry() {
        return Retry.backoff(settings.getMaxRetries(), FIRST_BACKOFF);
    }
}
