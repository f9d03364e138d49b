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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Per-request settings override.
 *
 * <p>
 * Carries the fields parsed from the client's chat-completions body plus the
 * transient state set by directives for this message only. Never persisted.
 *
 * @since 1.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    private static final String PROXY_TEST_CONTENT = "Just say TEST";

    @Builder.Default
    private List<ChatMessage> messages = new ArrayList<>();
    private String model;
    private Double temperature;
    private int maxTokens;
    private int topK;
    private double topP;
    private double frequencyPenalty;
    private double repetitionPenalty;
    private boolean stream;

    /** Set from the URL ({@code /quiet/}), not from the body. */
    private boolean quiet;

    @Builder.Default
    private Set<ProxyFeature> requestFeatures = EnumSet.noneOf(ProxyFeature.class);

    /** Preset text added for this message only. */
    private String preset;

    public boolean isRequestEnabled(ProxyFeature feature) {
        return requestFeatures.contains(feature);
    }

    public void setRequestEnabled(ProxyFeature feature, boolean enabled) {
        if (enabled) {
            requestFeatures.add(feature);
        } else {
            requestFeatures.remove(feature);
        }
    }

    /**
     * Connectivity test sent by the client when the user presses "check API
     * key": exactly one user message saying {@code Just say TEST}.
     */
    public boolean isProxyTest() {
        if (messages.size() != 1) {
            return false;
        }
        ChatMessage only = messages.get(0);
        return ChatMessage.ROLE_USER.equals(only.role()) && PROXY_TEST_CONTENT.equals(only.content());
    }

    public boolean hasModel() {
        return model != null && !model.isBlank();
    }
}
