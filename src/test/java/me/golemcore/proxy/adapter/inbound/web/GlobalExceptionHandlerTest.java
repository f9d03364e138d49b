package me.golemcore.proxy.adapter.inbound.web;

import me.golemcore.proxy.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.proxy.domain.model.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.NOT_FOUND, "No such bucket");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(404, body.getStatus());
                    assertEquals("No such bucket", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleIllegalArgumentException() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("apiKey is required")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("apiKey is required", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldReportStorageFailureAsServiceUnavailable() {
        StorageException ex = new StorageException("Failed to read announcement", new IllegalStateException("down"));

        StepVerifier.create(handler.handleStorage(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(503, body.getStatus());
                    assertEquals("Settings store unavailable", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideGenericExceptionDetails() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("jedis pool exhausted")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(500, body.getStatus());
                    assertEquals("Internal server error", body.getMessage());
                })
                .verifyComplete();
    }
}
