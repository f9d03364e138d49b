package me.golemcore.proxy.infrastructure.config;

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
import me.golemcore.proxy.ratelimit.CooldownPolicy;
import me.golemcore.proxy.security.XuidFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Process-wide singletons built once from {@link ProxyProperties} and the
 * startup banner.
 *
 * <p>
 * Startup fails when no XUID secret is configured outside development mode.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final ProxyProperties properties;

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

    @Bean
    public XuidFactory xuidFactory() {
        return XuidFactory.fromProperties(properties);
    }

    @Bean
    public CooldownPolicy cooldownPolicy() {
        return CooldownPolicy.parse(properties.getCooldown().getPolicy());
    }

    @PostConstruct
    public void init() {
        log.info("{} v{} starting...", properties.getName(), properties.getVersion());
        if (properties.isDevelopment()) {
            log.warn("Development mode is enabled");
        }
        log.info("Cooldown policy: {}", cooldownPolicy());
        log.info("Gemini endpoint: {}", properties.getGemini().getBaseUrl());
    }
}
