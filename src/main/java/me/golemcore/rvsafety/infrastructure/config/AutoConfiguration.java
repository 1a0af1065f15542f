package me.golemcore.rvsafety.infrastructure.config;

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
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Composition root for shared infrastructure beans.
 *
 * <p>
 * Provides the {@link Clock} every expiry computation is based on and the
 * {@link ObjectMapper} used by the JSON PIN store, and logs the effective
 * safety configuration on startup.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final RvSafetyProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        RvSafetyProperties.PinProperties pin = properties.getPin();
        RvSafetyProperties.SafetyProperties safety = properties.getSafety();
        log.info("RV safety core starting...");
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
        log.info("PIN policy: length {}-{}, lockout after {} failures for {} min, max {} sessions per user",
                pin.getMinLength(), pin.getMaxLength(), pin.getMaxFailedAttempts(),
                pin.getLockoutDurationMinutes(), pin.getMaxConcurrentSessions());
        log.info("Safety monitor: health interval {}ms, watchdog timeout {}ms, enabled={}",
                safety.getHealthCheckIntervalMs(), safety.getWatchdogTimeoutMs(), safety.isMonitoringEnabled());
        log.info("Features: {}", properties.getFeatures().keySet());
    }
}
