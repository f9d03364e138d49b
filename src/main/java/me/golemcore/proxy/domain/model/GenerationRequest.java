package me.golemcore.proxy.domain.model;

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

import java.util.List;
import java.util.Map;

/**
 * Provider-neutral generation call: credential, model, ordered turns and a
 * flat settings map.
 *
 * <p>
 * Recognized settings keys are {@code temperature}, {@code max_tokens},
 * {@code top_k}, {@code top_p}, {@code frequency_penalty},
 * {@code repetition_penalty} and {@code search}.
 */
public record GenerationRequest(String apiKey, String model, List<ChatMessage> turns, Map<String, Object> settings) {

    public static final String TEMPERATURE = "temperature";
    public static final String MAX_TOKENS = "max_tokens";
    public static final String TOP_K = "top_k";
    public static final String TOP_P = "top_p";
    public static final String FREQUENCY_PENALTY = "frequency_penalty";
    public static final String REPETITION_PENALTY = "repetition_penalty";
    public static final String SEARCH = "search";
}
