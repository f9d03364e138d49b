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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the proxy, bound from
 * application.yml.
 *
 * <p>
 * All proxy configuration is organized under the {@code proxy.*} prefix:
 * <ul>
 * <li>{@link XuidProperties} - salt used to derive anonymous identities</li>
 * <li>{@link CooldownProperties} - bandwidth-tiered cooldown policy</li>
 * <li>{@link BandwidthProperties} - hosting bandwidth polling</li>
 * <li>{@link StorageProperties} - settings store backend</li>
 * <li>{@link GeminiProperties} - upstream generation API</li>
 * <li>{@link PromptsProperties} - injected prompt texts and banner</li>
 * <li>{@link StatsProperties} - statistics buckets</li>
 * <li>{@link HttpProperties} - shared HTTP client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "proxy")
@Data
public class ProxyProperties {

    private String name = "GeminiForJanitors";
    private String version = "dev";
    private String admin = "Anonymous";
    private String externalUrl = "https://geminiforjanitors.onrender.com";
    private boolean development = false;

    private XuidProperties xuid = new XuidProperties();
    private CooldownProperties cooldown = new CooldownProperties();
    private BandwidthProperties bandwidth = new BandwidthProperties();
    private StorageProperties storage = new StorageProperties();
    private GeminiProperties gemini = new GeminiProperties();
    private PromptsProperties prompts = new PromptsProperties();
    private StatsProperties stats = new StatsProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class XuidProperties {
        private String secret;
    }

    @Data
    public static class CooldownProperties {
        private String policy = "0";
    }

    @Data
    public static class BandwidthProperties {
        private long warningMib = 76800;
        private long cacheTtlSeconds = 300;
        private RenderProperties render = new RenderProperties();
    }

    @Data
    public static class RenderProperties {
        private String apiKey;
        private String serviceId;
        private String baseUrl = "https://api.render.com";
    }

    @Data
    public static class StorageProperties {
        private RedisProperties redis = new RedisProperties();
    }

    @Data
    public static class RedisProperties {
        private String url;
        private int timeoutMs = 30000;
        private long lockTimeoutSeconds = 180;
        private long recordExpirySeconds = 0;
    }

    @Data
    public static class GeminiProperties {
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";
        private long timeoutSeconds = 75;
    }

    @Data
    public static class PromptsProperties {
        private String prefill = "classpath:prompts/prefill.txt";
        private String think = "classpath:prompts/think.txt";
        private String presets = "classpath*:prompts/presets/*.txt";
        private String banner = "classpath:prompts/banner.md";
        private int bannerVersion = 23;
    }

    @Data
    public static class StatsProperties {
        private int bucketCount = 48;
        private long bucketIntervalSeconds = 1800;
        private long bucketLifespanSeconds = 90000;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
