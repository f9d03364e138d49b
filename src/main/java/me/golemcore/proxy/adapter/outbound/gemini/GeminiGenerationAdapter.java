package me.golemcore.proxy.adapter.outbound.gemini;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.model.ChatMessage;
import me.golemcore.proxy.domain.model.GenerationException;
import me.golemcore.proxy.domain.model.GenerationRequest;
import me.golemcore.proxy.domain.model.GenerationResult;
import me.golemcore.proxy.domain.model.GenerationTimeoutException;
import me.golemcore.proxy.domain.model.TokenUsage;
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import me.golemcore.proxy.port.outbound.GenerationPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Google Gemini adapter over the Generative Language REST API.
 *
 * <p>
 * Endpoint: {@code POST {base}/models/{model}:generateContent}, credential in
 * the {@code x-goog-api-key} header. System and assistant turns are sent with
 * role {@code model}. Safety filters are set to {@code BLOCK_NONE} for every
 * adjustable category.
 *
 * <p>
 * Error bodies ({@code {"error": {code, status, message, details}}}) are
 * turned into {@link GenerationException}; call timeouts into
 * {@link GenerationTimeoutException}.
 *
 * <p>
 * Grounding links point at a Google redirect service; each one is resolved
 * once through its {@code Location} header so the user sees the real URL.
 *
 * @see GenerationPort
 */
@Component
@Slf4j
public class GeminiGenerationAdapter implements GenerationPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final String REDIRECT_PREFIX = "https://vertexaisearch.cloud.google.com/grounding-api-redirect/";
    private static final List<String> HARM_CATEGORIES = List.of(
            "HARM_CATEGORY_HATE_SPEECH",
            "HARM_CATEGORY_DANGEROUS_CONTENT",
            "HARM_CATEGORY_HARASSMENT",
            "HARM_CATEGORY_SEXUALLY_EXPLICIT");
    private static final TypeReference<Map<String, Object>> DETAIL_TYPE = new TypeReference<>() {
    };

    private final OkHttpClient httpClient;
    private final OkHttpClient redirectClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public GeminiGenerationAdapter(ProxyProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.baseUrl = stripTrailingSlash(properties.getGemini().getBaseUrl());

        long timeoutSeconds = properties.getGemini().getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
        this.redirectClient = baseHttpClient.newBuilder()
                .followRedirects(false)
                .followSslRedirects(false)
                .build();
    }

    @Override
    public GenerationResult generate(GenerationRequest request) {
        String url = baseUrl + "/models/" + request.model() + ":generateContent";
        String body = toJson(buildBody(request));

        Request httpRequest = new Request.Builder()
                .url(url)
                .header("x-goog-api-key", request.apiKey())
                .post(RequestBody.create(body, JSON))
                .build();

        try (Response response = httpClient.newCall(httpRequest).execute()) {
            ResponseBody responseBody = response.body();
            String payload = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw parseError(response.code(), payload);
            }
            return parseResult(payload);
        } catch (InterruptedIOException e) {
            throw new GenerationTimeoutException("Gemini call timed out", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Gemini call failed", e);
        }
    }

    ObjectNode buildBody(GenerationRequest request) {
        ObjectNode root = objectMapper.createObjectNode();

        ArrayNode contents = root.putArray("contents");
        for (ChatMessage turn : request.turns()) {
            ObjectNode content = contents.addObject();
            content.put("role", turn.isSystem() || turn.isAssistant() ? "model" : "user");
            content.putArray("parts").addObject().put("text", turn.content());
        }

        ArrayNode safety = root.putArray("safetySettings");
        for (String category : HARM_CATEGORIES) {
            safety.addObject().put("category", category).put("threshold", "BLOCK_NONE");
        }

        Map<String, Object> settings = request.settings();
        ObjectNode config = root.putObject("generationConfig");
        putNumber(config, "temperature", settings.get(GenerationRequest.TEMPERATURE));
        putNumber(config, "maxOutputTokens", settings.get(GenerationRequest.MAX_TOKENS));
        putNumber(config, "topK", settings.get(GenerationRequest.TOP_K));
        putNumber(config, "topP", settings.get(GenerationRequest.TOP_P));
        putNumber(config, "frequencyPenalty", settings.get(GenerationRequest.FREQUENCY_PENALTY));
        putNumber(config, "presencePenalty", settings.get(GenerationRequest.REPETITION_PENALTY));

        if (Boolean.TRUE.equals(settings.get(GenerationRequest.SEARCH))) {
            root.putArray("tools").addObject().putObject("google_search");
        }
        return root;
    }

    GenerationException parseError(int code, String payload) {
        try {
            JsonNode error = objectMapper.readTree(payload).path("error");
            if (error.isObject()) {
                List<Map<String, Object>> details = new ArrayList<>();
                for (JsonNode detail : error.path("details")) {
                    if (detail.isObject()) {
                        details.add(objectMapper.convertValue(detail, DETAIL_TYPE));
                    }
                }
                return new GenerationException(error.path("code").asInt(code), error.path("status").asText(""),
                        error.path("message").asText("Unknown error"), details);
            }
        } catch (JsonProcessingException e) {
            log.debug("[Gemini] Error body is not JSON: {}", e.getOriginalMessage());
        }
        return new GenerationException(code, "", payload.isBlank() ? "Unknown error" : payload.strip(), List.of());
    }

    GenerationResult parseResult(String payload) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(payload);
        GenerationResult.GenerationResultBuilder builder = GenerationResult.builder();

        JsonNode feedback = root.path("promptFeedback");
        builder.blockReason(textOrNull(feedback, "blockReason"));
        builder.blockReasonMessage(textOrNull(feedback, "blockReasonMessage"));

        JsonNode candidates = root.path("candidates");
        builder.candidateCount(candidates.isArray() ? candidates.size() : 0);

        List<GenerationResult.Part> parts = new ArrayList<>();
        List<String> queries = new ArrayList<>();
        List<String> links = new ArrayList<>();
        if (candidates.isArray() && !candidates.isEmpty()) {
            JsonNode candidate = candidates.get(0);
            builder.finishReason(textOrNull(candidate, "finishReason"));

            for (JsonNode part : candidate.path("content").path("parts")) {
                JsonNode text = part.get("text");
                if (text != null && text.isTextual()) {
                    parts.add(new GenerationResult.Part(text.asText(), part.path("thought").asBoolean(false)));
                }
            }

            JsonNode grounding = candidate.get("groundingMetadata");
            if (grounding != null && grounding.isObject()) {
                builder.grounded(true);
                for (JsonNode query : grounding.path("webSearchQueries")) {
                    queries.add(query.asText());
                }
                for (JsonNode chunk : grounding.path("groundingChunks")) {
                    String uri = textOrNull(chunk.path("web"), "uri");
                    if (uri != null) {
                        links.add(resolveLink(uri));
                    }
                }
                log.info("[Gemini] Made {} web searches, found {} links", queries.size(), links.size());
            }
        }

        JsonNode usage = root.get("usageMetadata");
        if (usage != null && usage.isObject()) {
            builder.usage(new TokenUsage(
                    usage.path("promptTokenCount").asInt(0),
                    usage.path("candidatesTokenCount").asInt(0),
                    usage.path("thoughtsTokenCount").asInt(0),
                    usage.path("totalTokenCount").asInt(0)));
        }

        return builder.parts(parts).searchQueries(queries).links(links).build();
    }

    String resolveLink(String link) {
        if (!link.startsWith(REDIRECT_PREFIX)) {
            return link;
        }
        Request request = new Request.Builder().url(link).get().build();
        try (Response response = redirectClient.newCall(request).execute()) {
            String location = response.header("Location");
            if (response.isRedirect() && location != null && !location.isEmpty()) {
                log.debug("[Gemini] Link resolved");
                return location;
            }
            log.debug("[Gemini] Link not resolved: HTTP {}", response.code());
        } catch (IOException e) {
            log.debug("[Gemini] Could not resolve link: {}", e.getMessage());
        }
        return link;
    }

    private static void putNumber(ObjectNode node, String field, Object value) {
        if (value instanceof Integer) {
            node.put(field, (Integer) value);
        } else if (value instanceof Long) {
            node.put(field, (Long) value);
        } else if (value instanceof Number) {
            node.put(field, ((Number) value).doubleValue());
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private String toJson(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize Gemini request", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
