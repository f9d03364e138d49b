package me.golemcore.proxy.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResponseAssemblerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ResponseAssembler plain() {
        return new ResponseAssembler(objectMapper, false, false);
    }

    // ===== Sole error =====

    @Test
    void shouldSendSoleErrorAsPlainText() {
        AssembledResponse response = plain().addError("Please wait 30 seconds.", 429).build();

        assertEquals(429, response.status());
        assertEquals(AssembledResponse.TEXT_PLAIN, response.contentType());
        assertEquals("Please wait 30 seconds.", response.body());
    }

    @Test
    void shouldWrapSoleErrorForConnectivityTest() throws Exception {
        AssembledResponse response = new ResponseAssembler(objectMapper, false, true)
                .addError("API key not valid.", 400)
                .build();

        assertEquals(400, response.status());
        assertEquals(AssembledResponse.APPLICATION_JSON, response.contentType());
        JsonNode body = objectMapper.readTree(response.body());
        assertEquals("PROXY ERROR 400: API key not valid.", body.get("error").asText());
    }

    @Test
    void shouldKeepSoleErrorStatusWhenStreaming() {
        AssembledResponse response = new ResponseAssembler(objectMapper, true, false)
                .addError("Unauthorized. API key required.", 401)
                .build();

        assertEquals(401, response.status());
        assertEquals("Unauthorized. API key required.", response.body());
    }

    // ===== Composite =====

    @Test
    void shouldReturnChatTextVerbatim() throws Exception {
        AssembledResponse response = plain().addMessage("Hello there.").build();

        assertEquals(200, response.status());
        JsonNode body = objectMapper.readTree(response.body());
        JsonNode choice = body.get("choices").get(0);
        assertEquals(0, choice.get("index").asInt());
        assertEquals("assistant", choice.get("message").get("role").asText());
        assertEquals("Hello there.", choice.get("message").get("content").asText());
        assertEquals("stop", choice.get("finish_reason").asText());
    }

    @Test
    void shouldWrapSoleProxyMessageInTags() {
        ResponseAssembler assembler = plain().addProxyMessage("Thinking enabled.");

        assertEquals("\u200B<proxy>\nThinking enabled.\n\u200B</proxy>", assembler.getMessage());
        assertEquals(200, assembler.getStatus());
    }

    @Test
    void shouldGroupRunsAndPrefixErrors() {
        ResponseAssembler assembler = plain()
                .addMessage("A")
                .addError("B", 404);

        assertEquals("A\n\u200B<proxy>\nError 404: B\n\u200B</proxy>", assembler.getMessage());
        assertEquals(200, assembler.getStatus());
    }

    @Test
    void shouldKeepFragmentOrder() {
        ResponseAssembler assembler = plain()
                .addProxyMessage("one", "two")
                .addMessage("reply")
                .addProxyMessage("banner");

        assertEquals("\u200B<proxy>\none\ntwo\n\u200B</proxy>\nreply\n\u200B<proxy>\nbanner\n\u200B</proxy>",
                assembler.getMessage());
        assertEquals(4, assembler.getFragments().size());
    }

    @Test
    void shouldNotWrapErrorsInsideCompositeResponse() throws Exception {
        AssembledResponse response = new ResponseAssembler(objectMapper, false, true)
                .addProxyMessage("note")
                .addError("failed", 500)
                .build();

        assertEquals(200, response.status());
        String content = objectMapper.readTree(response.body()).get("choices").get(0).get("message")
                .get("content").asText();
        assertEquals("\u200B<proxy>\nnote\nError 500: failed\n\u200B</proxy>", content);
    }

    // ===== Streaming =====

    @Test
    void shouldRenderSingleServerSentEvent() throws Exception {
        AssembledResponse response = new ResponseAssembler(objectMapper, true, false)
                .addMessage("streamed")
                .build();

        assertEquals(200, response.status());
        assertEquals(AssembledResponse.TEXT_EVENT_STREAM, response.contentType());
        assertTrue(response.body().startsWith("data: "));
        assertTrue(response.body().endsWith("\n\ndata: [DONE]\n\n"));

        String json = response.body().substring("data: ".length(), response.body().indexOf("\n\n"));
        JsonNode delta = objectMapper.readTree(json).get("choices").get(0).get("delta");
        assertEquals("streamed", delta.get("content").asText());
    }

    @Test
    void shouldRenderEmptyMessageWhenNothingWasAdded() {
        ResponseAssembler assembler = plain();

        assertTrue(assembler.isEmpty());
        assertEquals("", assembler.getMessage());
        assertEquals(200, assembler.build().status());
    }
}
