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

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.proxy.domain.model.ChatMessage;
import me.golemcore.proxy.domain.model.ChatRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a chat-completions JSON body onto a {@link ChatRequest}. Missing or
 * mistyped fields fall back to their defaults instead of failing the request.
 */
@Component
public class ChatRequestReader {

    public ChatRequest read(JsonNode body, boolean quiet) {
        List<ChatMessage> messages = new ArrayList<>();
        JsonNode messagesNode = body.path("messages");
        if (messagesNode.isArray()) {
            for (JsonNode message : messagesNode) {
                if (message.isObject()) {
                    messages.add(new ChatMessage(text(message, "role"), text(message, "content")));
                }
            }
        }

        JsonNode temperature = body.path("temperature");
        return ChatRequest.builder()
                .messages(messages)
                .model(text(body, "model"))
                .temperature(temperature.isNumber() ? temperature.asDouble() : null)
                .maxTokens(body.path("max_tokens").asInt(0))
                .topK(body.path("top_k").asInt(0))
                .topP(body.path("top_p").asDouble(0))
                .frequencyPenalty(body.path("frequency_penalty").asDouble(0))
                .repetitionPenalty(body.path("repetition_penalty").asDouble(0))
                .stream(body.path("stream").asBoolean(false))
                .quiet(quiet)
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : "";
    }
}
