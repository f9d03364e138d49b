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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.command.CommandContext;
import me.golemcore.proxy.command.CommandDispatcher;
import me.golemcore.proxy.command.CommandParser;
import me.golemcore.proxy.command.ParsedMessage;
import me.golemcore.proxy.domain.model.ChatMessage;
import me.golemcore.proxy.domain.model.ChatRequest;
import me.golemcore.proxy.domain.model.GenerationOutcome;
import me.golemcore.proxy.domain.model.GenerationRequest;
import me.golemcore.proxy.domain.model.ResponseAssembler;
import me.golemcore.proxy.domain.model.UserSettings;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Handles the two kinds of chat turns: the client's connectivity test and a
 * regular roleplay message with optional inline directives.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatTurnService {

    static final String FORBIDDEN_WORDS_NOTE = "SYSTEM NOTE: Do not include the following words/phrases"
            + " in your output under any circumstances: ";
    static final String ENHANCE_PREFIX = "Rewrite/Enhance this message: ";

    private final ContentGenerationService generationService;
    private final CommandParser commandParser;
    private final CommandDispatcher commandDispatcher;
    private final PromptLibrary prompts;

    /**
     * Tests the caller's key and model with none of the stored preferences
     * applied. The client sends a tiny token limit for the test, so the
     * limit is lifted.
     */
    public void handleProxyTest(UserSettings user, ChatRequest request, String apiKey, ResponseAssembler response) {
        log.info("[Proxy] {} handling proxy test ({})", user.getXuid().pretty(), request.getModel());

        UserSettings blank = UserSettings.blank(user.getXuid());
        Map<String, Object> overrides = Collections.singletonMap(GenerationRequest.MAX_TOKENS, null);
        GenerationOutcome outcome = generationService.generate(blank, request, apiKey, overrides);

        if (!outcome.isSuccess()) {
            user.setValid(outcome.failure().isApiKeyValid());
            response.addError(outcome.failure().message(), outcome.failure().status());
            return;
        }
        response.addMessage(outcome.text());
    }

    public void handleChat(UserSettings user, ChatRequest request, String apiKey, ResponseAssembler response,
            long nowEpochSeconds) {
        String who = user.getXuid().pretty();
        List<ChatMessage> messages = request.getMessages();
        if (messages.isEmpty()) {
            response.addError("No messages to respond to.", 400);
            return;
        }

        int lastIndex = messages.size() - 1;
        if (messages.get(lastIndex).isAssistant() && lastIndex > 0) {
            log.info("[Proxy] {} user set prefill detected", who);
            lastIndex--;
        }
        ChatMessage last = messages.get(lastIndex);

        if (last.content().contains(FORBIDDEN_WORDS_NOTE)) {
            log.info("[Proxy] {} user set forbidden words/phrases detected", who);
        }
        if (last.content().startsWith(ENHANCE_PREFIX)) {
            log.info("[Proxy] {} handling enhance message ({})", who, request.getModel());
        } else {
            log.info("[Proxy] {} handling chat message ({})", who, request.getModel());
        }

        ParsedMessage parsed = commandParser.parse(last.content());
        if (parsed.hasCommands()) {
            List<ChatMessage> rewritten = new ArrayList<>(messages);
            rewritten.set(lastIndex, last.withContent(parsed.content()));
            request.setMessages(rewritten);
        }

        CommandContext context = new CommandContext(user, request, nowEpochSeconds);
        if (commandDispatcher.dispatch(parsed.commands(), context, response)) {
            return;
        }

        GenerationOutcome outcome = generationService.generate(user, request, apiKey);
        if (!outcome.isSuccess()) {
            if (!outcome.failure().isApiKeyValid()) {
                user.setValid(false);
            }
            response.addError(outcome.failure().message(), outcome.failure().status());
            return;
        }

        response.addMessage(outcome.text());
        if (outcome.hasExtras()) {
            response.addProxyMessage(outcome.extras());
        }

        if (!request.isQuiet() && user.markBannerSeen(prompts.getBannerVersion())) {
            log.info("[Proxy] {} showing{}user the latest banner", who, user.exists() ? " " : " new ");
            response.addMessage(prompts.getBanner());
        }
    }
}
