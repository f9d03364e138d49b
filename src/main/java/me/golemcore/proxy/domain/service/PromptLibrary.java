package me.golemcore.proxy.domain.service;

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
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable prompt texts loaded once at startup: the prefill and think
 * injections, named presets and the banner.
 *
 * <p>
 * Locations come from {@code proxy.prompts.*} and accept Spring resource
 * syntax ({@code classpath:}, {@code file:}). A preset's name is its file
 * name without extension.
 */
@Component
@Slf4j
public class PromptLibrary {

    private final String prefill;
    private final String think;
    private final Map<String, String> presets;
    private final String banner;
    private final int bannerVersion;

    public PromptLibrary(ProxyProperties properties) {
        ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
        ProxyProperties.PromptsProperties prompts = properties.getPrompts();
        this.prefill = read(resolver.getResource(prompts.getPrefill()));
        this.think = read(resolver.getResource(prompts.getThink()));
        this.presets = loadPresets(resolver, prompts.getPresets());
        this.banner = renderBanner(read(resolver.getResource(prompts.getBanner())), properties);
        this.bannerVersion = prompts.getBannerVersion();
        log.info("[Prompts] Loaded {} presets: {}", presets.size(), presets.keySet());
    }

    public String getPrefill() {
        return prefill;
    }

    public String getThink() {
        return think;
    }

    public Map<String, String> getPresets() {
        return presets;
    }

    public String getPreset(String name) {
        return presets.get(name);
    }

    public String getBanner() {
        return banner;
    }

    public int getBannerVersion() {
        return bannerVersion;
    }

    private static Map<String, String> loadPresets(ResourcePatternResolver resolver, String pattern) {
        Map<String, String> loaded = new TreeMap<>();
        try {
            for (Resource resource : resolver.getResources(pattern)) {
                String filename = resource.getFilename();
                if (filename == null || !resource.isReadable()) {
                    continue;
                }
                int dot = filename.indexOf('.');
                String name = dot > 0 ? filename.substring(0, dot) : filename;
                loaded.put(name, read(resource));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list presets: " + pattern, e);
        }
        return Collections.unmodifiableMap(loaded);
    }

    private static String renderBanner(String template, ProxyProperties properties) {
        return template
                .replace("{name}", properties.getName())
                .replace("{version}", properties.getVersion())
                .replace("{admin}", properties.getAdmin())
                .replace("{url}", stripTrailingSlash(properties.getExternalUrl()))
                .strip();
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static String read(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read prompt resource: " + resource.getDescription(), e);
        }
    }
}
