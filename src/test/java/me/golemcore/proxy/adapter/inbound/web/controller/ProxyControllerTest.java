package me.golemcore.proxy.adapter.inbound.web.controller;

import me.golemcore.proxy.domain.model.AssembledResponse;
import me.golemcore.proxy.domain.service.ProxyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProxyControllerTest {

    private static final String BODY = "{\"model\":\"m\",\"messages\":[]}";

    private ProxyService proxyService;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        proxyService = mock(ProxyService.class);
        webTestClient = WebTestClient.bindToController(new ProxyController(proxyService)).build();
    }

    @Test
    void shouldRenderAssembledJsonResponse() {
        when(proxyService.handle(eq(BODY), eq("/chat/completions"), eq("Bearer key"))).thenReturn(
                new AssembledResponse(200, AssembledResponse.APPLICATION_JSON, "{\"choices\":[]}"));

        webTestClient.post()
                .uri("/chat/completions")
                .header("Authorization", "Bearer key")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_JSON)
                .expectBody(String.class).isEqualTo("{\"choices\":[]}");
    }

    @Test
    void shouldPassPlainErrorStatusThrough() {
        when(proxyService.handle(any(), any(), isNull())).thenReturn(
                new AssembledResponse(401, AssembledResponse.TEXT_PLAIN, "Unauthorized. API key required."));

        webTestClient.post()
                .uri("/")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isUnauthorized()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_PLAIN)
                .expectBody(String.class).isEqualTo("Unauthorized. API key required.");
    }

    @Test
    void shouldWriteEventStreamVerbatim() {
        String events = "data: {\"choices\":[]}\n\ndata: [DONE]\n\n";
        when(proxyService.handle(any(), eq("/quiet/chat/completions"), any())).thenReturn(
                new AssembledResponse(200, AssembledResponse.TEXT_EVENT_STREAM, events));

        webTestClient.post()
                .uri("/quiet/chat/completions")
                .header("Authorization", "Bearer key")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .expectBody(String.class).isEqualTo(events);
    }

    @Test
    void shouldForwardMissingBodyAsNull() {
        when(proxyService.handle(isNull(), eq("/quiet/"), any())).thenReturn(
                new AssembledResponse(400, AssembledResponse.TEXT_PLAIN, "Bad Request. Missing or invalid JSON."));

        webTestClient.post()
                .uri("/quiet/")
                .exchange()
                .expectStatus().isBadRequest();

        verify(proxyService).handle(isNull(), eq("/quiet/"), isNull());
    }
}
