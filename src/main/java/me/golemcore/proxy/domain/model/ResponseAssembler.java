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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates the fragments of one response and renders them to the client's
 * chat-completions wire shape.
 *
 * <p>
 * Fragments are never reordered. Rendering rules:
 * <ul>
 * <li>a sole error fragment keeps its status code and is sent as a plain body,
 * or as {@code {"error": "PROXY ERROR <code>: <text>"}} when errors are
 * wrapped (connectivity tests)</li>
 * <li>anything else is sent with status 200: chat runs are newline-joined,
 * runs of proxy/error fragments are newline-joined with errors prefixed
 * {@code Error <code>: } and the run wrapped in {@link #PROXY_TAG_OPEN} /
 * {@link #PROXY_TAG_CLOSE}</li>
 * </ul>
 *
 * <p>
 * The client treats any non-2xx answer as fatal to the turn, so partial
 * successes (bot reply plus a command error) are delivered as one 200
 * payload.
 *
 * @since 1.0
 */
public class ResponseAssembler {

    /** U+200B ZERO WIDTH SPACE keeps the tag from being rendered. */
    public static final String PROXY_TAG_OPEN = "\u200B<proxy>\n";
    public static final String PROXY_TAG_CLOSE = "\n\u200B</proxy>";

    private static final int STATUS_OK = 200;

    private final ObjectMapper objectMapper;
    private final boolean stream;
    private final boolean wrapErrors;
    private final List<ResponseFragment> fragments = new ArrayList<>();

    public ResponseAssembler(ObjectMapper objectMapper, boolean stream, boolean wrapErrors) {
        this.objectMapper = objectMapper;
        this.stream = stream;
        this.wrapErrors = wrapErrors;
    }

    public ResponseAssembler addMessage(String... texts) {
        for (String text : texts) {
            fragments.add(ResponseFragment.chat(text));
        }
        return this;
    }

    public ResponseAssembler addProxyMessage(String... texts) {
        for (String text : texts) {
            fragments.add(ResponseFragment.proxy(text));
        }
        return this;
    }

    public ResponseAssembler addError(String text, int code) {
        fragments.add(ResponseFragment.error(text, code));
        return this;
    }

    public List<ResponseFragment> getFragments() {
        return Collections.unmodifiableList(fragments);
    }

    public boolean isEmpty() {
        return fragments.isEmpty();
    }

    /**
     * The sole fragment's code when it is an error, 200 otherwise.
     */
    public int getStatus() {
        if (isSoleError()) {
            return fragments.get(0).code();
        }
        return STATUS_OK;
    }

    public String getMessage() {
        if (fragments.isEmpty()) {
            return "";
        }

        if (fragments.size() == 1) {
            ResponseFragment only = fragments.get(0);
            return switch (only.kind()) {
            case CHAT -> only.text();
            case ERROR -> wrapErrors ? "PROXY ERROR " + only.code() + ": " + only.text() : only.text();
            case PROXY -> PROXY_TAG_OPEN + only.text() + PROXY_TAG_CLOSE;
            };
        }

        List<String> groups = new ArrayList<>();
        int index = 0;
        while (index < fragments.size()) {
            boolean chatRun = fragments.get(index).isChat();
            List<String> lines = new ArrayList<>();
            while (index < fragments.size() && fragments.get(index).isChat() == chatRun) {
                lines.add(render(fragments.get(index)));
                index++;
            }
            String joined = String.join("\n", lines);
            groups.add(chatRun ? joined : PROXY_TAG_OPEN + joined + PROXY_TAG_CLOSE);
        }
        return String.join("\n", groups);
    }

    public AssembledResponse build() {
        String message = getMessage();

        if (isSoleError()) {
            int status = fragments.get(0).code();
            if (wrapErrors) {
                ObjectNode body = objectMapper.createObjectNode();
                body.put("error", message.strip());
                return new AssembledResponse(status, AssembledResponse.APPLICATION_JSON, toJson(body));
            }
            return new AssembledResponse(status, AssembledResponse.TEXT_PLAIN, message);
        }

        ObjectNode choice = objectMapper.createObjectNode();
        choice.put("index", 0);
        if (stream) {
            choice.putObject("delta").put("content", message);
        } else {
            ObjectNode assistant = choice.putObject("message");
            assistant.put("role", "assistant");
            assistant.put("content", message);
        }
        choice.put("finish_reason", "stop");

        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode choices = body.putArray("choices");
        choices.add(choice);

        if (stream) {
            String chunk = "data: " + toJson(body) + "\n\ndata: [DONE]\n\n";
            return new AssembledResponse(STATUS_OK, AssembledResponse.TEXT_EVENT_STREAM, chunk);
        }
        return new AssembledResponse(STATUS_OK, AssembledResponse.APPLICATION_JSON, toJson(body));
    }

    private boolean isSoleError() {
        return fragments.size() == 1 && fragments.get(0).isError();
    }

    private static String render(ResponseFragment fragment) {
        if (fragment.isError()) {
            return "Error " + fragment.code() + ": " + fragment.text();
        }
        return fragment.text();
    }

    private String toJson(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response", e);
        }
    }
}
