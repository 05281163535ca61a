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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.SubscriptionRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core bean wiring: clock, JSON mapper and the subscription registry handed to
 * the message bus.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final PulseProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public SubscriptionRegistry subscriptionRegistry() {
        PulseProperties.BusProperties bus = properties.getBus();
        return new SubscriptionRegistry(bus.getRegistryVersion(), bus.getSubscriptions());
    }

    @PostConstruct
    public void logStartup() {
        log.info("[Pulse] Storage: {}", properties.getStorage().getLocal().getBasePath());
        log.info("[Pulse] Scheduler: heartbeat every {}s, {} workers, evaluation timeout {}s",
                properties.getScheduler().getHeartbeatTickSeconds(),
                properties.getScheduler().getWorkers(),
                properties.getScheduler().getEvaluationTimeoutSeconds());
        log.info("[Pulse] Subscription registry v{} with {} subscribers",
                properties.getBus().getRegistryVersion(), properties.getBus().getSubscriptions().size());
    }
}
