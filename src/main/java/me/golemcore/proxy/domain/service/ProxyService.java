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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.model.AssembledResponse;
import me.golemcore.proxy.domain.model.ChatRequest;
import me.golemcore.proxy.domain.model.ResponseAssembler;
import me.golemcore.proxy.domain.model.UserSettings;
import me.golemcore.proxy.port.outbound.StatisticsPort;
import me.golemcore.proxy.port.outbound.UserStoragePort;
import me.golemcore.proxy.security.Xuid;
import me.golemcore.proxy.security.XuidFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Per-request orchestration of a chat-completions call.
 *
 * <p>
 * Steps: parse the body, authenticate, derive the identity, take its lock,
 * load settings, enforce the cooldown, pick the credential for this request,
 * run the chat turn, append the announcement, save and release the lock.
 * Every failure is turned into a response; nothing escapes to the caller.
 *
 * <p>
 * The identity lock is released exactly once on every path after it was
 * acquired.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProxyService {

    static final String QUIET_SEGMENT = "/quiet/";
    static final String INTERNAL_ERROR = "Internal Proxy Error";

    private final ObjectMapper objectMapper;
    private final ChatRequestReader requestReader;
    private final XuidFactory xuidFactory;
    private final UserStoragePort storage;
    private final UserSettingsService settingsService;
    private final BandwidthService bandwidthService;
    private final ChatTurnService chatTurnService;
    private final StatisticsPort statistics;

    public AssembledResponse handle(String body, String path, String authorization) {
        JsonNode root = parseBody(body);
        if (root == null || !root.isObject() || root.isEmpty()) {
            return new ResponseAssembler(objectMapper, false, false)
                    .addError("Bad Request. Missing or invalid JSON.", 400)
                    .build();
        }

        ChatRequest request = requestReader.read(root, path != null && path.contains(QUIET_SEGMENT));
        boolean proxyTest = request.isProxyTest();
        ResponseAssembler response = new ResponseAssembler(objectMapper, request.isStream(), proxyTest);

        List<String> apiKeys = parseBearer(authorization);
        if (apiKeys.isEmpty()) {
            statistics.track("p.rejected.unauthorized");
            return response.addError("Unauthorized. API key required.", 401).build();
        }

        Xuid xuid = xuidFactory.derive(apiKeys.get(0));
        boolean locked;
        try {
            locked = storage.lock(xuid);
        } catch (RuntimeException e) {
            log.error("[Proxy] {} failed to acquire lock", xuid.pretty(), e);
            statistics.track("p.failed.internal");
            return response.addError(INTERNAL_ERROR, 500).build();
        }
        if (!locked) {
            log.info("[Proxy] {} user attempted concurrent use", xuid.pretty());
            statistics.track("p.rejected.concurrent");
            return response.addError("Concurrent use is not allowed. Please wait a moment.", 403).build();
        }

        try {
            return process(xuid, request, apiKeys, proxyTest, path, response);
        } finally {
            release(xuid);
        }
    }

    private void release(Xuid xuid) {
        try {
            storage.unlock(xuid);
        } catch (RuntimeException e) {
            log.error("[Proxy] {} failed to release lock", xuid.pretty(), e);
        }
    }

    private AssembledResponse process(Xuid xuid, ChatRequest request, List<String> apiKeys, boolean proxyTest,
            String path, ResponseAssembler response) {
        UserSettings user;
        try {
            user = settingsService.load(xuid);
        } catch (RuntimeException e) {
            log.error("[Proxy] {} failed to load settings", xuid.pretty(), e);
            return response.addError(INTERNAL_ERROR, 500).build();
        }

        long now = settingsService.nowEpochSeconds();
        Long seconds = user.secondsSinceLastSeen(now);
        if (seconds != null) {
            long cooldown = bandwidthService.currentCooldown();
            long delay = cooldown - seconds;
            if (cooldown > 0 && delay > 0) {
                log.info("[Proxy] {} user told to wait {} seconds", xuid.pretty(), delay);
                statistics.track("p.rejected.cooldown");
                return response.addError("Please wait " + delay + " seconds.", 429).build();
            }
        }

        int keyIndex = (int) (user.getRequestCounter() % apiKeys.size());
        user.incrementRequestCounter();
        String apiKey = apiKeys.get(keyIndex);

        List<String> details = new ArrayList<>();
        details.add("User " + user.lastSeenMessage(now));
        details.add("Request #" + user.getRequestCounter());
        if (apiKeys.size() > 1) {
            details.add("Key " + (keyIndex + 1) + "/" + apiKeys.size());
        }
        log.info("[Proxy] {} Processing {}{} ({})", xuid.pretty(), request.isStream() ? "stream " : "", path,
                String.join(", ", details));
        long started = System.nanoTime();

        try {
            if (!request.hasModel()) {
                response.addError("Please specify a model.", 400);
            } else if (proxyTest) {
                chatTurnService.handleProxyTest(user, request, apiKey, response);
            } else {
                chatTurnService.handleChat(user, request, apiKey, response, now);
            }
        } catch (RuntimeException e) {
            log.error("[Proxy] {} unexpected failure", xuid.pretty(), e);
            statistics.track("p.failed.internal");
            response.addError(INTERNAL_ERROR, 500);
        }

        String elapsed = formatElapsed(started);
        int status = response.getStatus();
        if (status >= 200 && status <= 299) {
            log.info("[Proxy] {} Processing succeeded ({})", xuid.pretty(), elapsed);
            appendAnnouncement(response, proxyTest);
        } else {
            String[] lines = response.getMessage().split("\n");
            log.info("[Proxy] {} Processing failed: {} ({})", xuid.pretty(), lines[0], elapsed);
            for (int i = 1; i < lines.length; i++) {
                log.info("[Proxy] {} > {}", xuid.pretty(), lines[i]);
            }
        }

        if (user.isValid()) {
            try {
                settingsService.save(user);
            } catch (RuntimeException e) {
                log.error("[Proxy] {} failed to save settings", xuid.pretty(), e);
            }
        } else {
            log.info("[Proxy] {} Invalid user not saved", xuid.pretty());
        }

        return response.build();
    }

    private void appendAnnouncement(ResponseAssembler response, boolean proxyTest) {
        if (proxyTest) {
            return;
        }
        try {
            String announcement = storage.getAnnouncement();
            if (announcement != null && !announcement.isEmpty()) {
                response.addProxyMessage("***\n" + announcement + "\n***");
            }
        } catch (RuntimeException e) {
            log.warn("[Proxy] Failed to read announcement: {}", e.getMessage());
        }
    }

    private JsonNode parseBody(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("[Proxy] Invalid JSON body: {}", e.getOriginalMessage());
            return null;
        }
    }

    /**
     * Credentials of an {@code Authorization: Bearer k1,k2} header, trimmed,
     * empty entries dropped. Empty when the header is missing or not a
     * bearer header.
     */
    static List<String> parseBearer(String authorization) {
        if (authorization == null) {
            return List.of();
        }
        String[] parts = authorization.split(" ", 2);
        if (parts.length != 2 || !"bearer".equals(parts[0].toLowerCase(Locale.ROOT))) {
            return List.of();
        }
        List<String> keys = new ArrayList<>();
        for (String key : parts[1].split(",")) {
            String trimmed = key.strip();
            if (!trimmed.isEmpty()) {
                keys.add(trimmed);
            }
        }
        return keys;
    }

    private static String formatElapsed(long startedNanos) {
        long millis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        return String.format(Locale.ROOT, "%.2fs", millis / 1000.0);
    }
}
