package me.golemcore.proxy;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Janitor Gemini proxy.
 *
 * <p>
 * The proxy sits between an OpenAI-style roleplay chat client and Google
 * Gemini. Every chat turn goes through the same pipeline:
 *
 * <pre>
 * Identity      → XUID derived from the caller's API key
 * Settings      → per-identity lock + record load (local or Redis)
 * Cooldown      → bandwidth-tiered wait policy
 * Commands      → inline //directives parsed from the last user message
 * Generation    → Gemini generateContent call
 * Response      → assembled chat/proxy/error fragments
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration lives in {@code application.yml} under the
 * {@code proxy.*} prefix, see {@code ProxyProperties}.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ProxyApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProxyApplication.class, args);
    }

}
