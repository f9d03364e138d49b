package me.golemcore.proxy.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.proxy.adapter.outbound.storage.LocalUserStorageAdapter;
import me.golemcore.proxy.domain.model.AssembledResponse;
import me.golemcore.proxy.domain.model.ResponseAssembler;
import me.golemcore.proxy.domain.model.StorageException;
import me.golemcore.proxy.domain.model.UserSettings;
import me.golemcore.proxy.port.outbound.StatisticsPort;
import me.golemcore.proxy.security.Xuid;
import me.golemcore.proxy.security.XuidFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ProxyServiceTest {

    private static final long NOW = 1_700_000_000L;
    private static final String PATH = "/chat/completions";
    private static final String CHAT_BODY = "{\"model\":\"gemini-2.5-pro\","
            + "\"messages\":[{\"role\":\"user\",\"content\":\"Hello\"}]}";
    private static final String PROXY_TEST_BODY = "{\"model\":\"gemini-2.5-pro\",\"max_tokens\":1,"
            + "\"messages\":[{\"role\":\"user\",\"content\":\"Just say TEST\"}]}";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private LocalUserStorageAdapter storage;
    private BandwidthService bandwidthService;
    private ChatTurnService chatTurnService;
    private StatisticsPort statistics;
    private XuidFactory xuidFactory;
    private ProxyService service;

    @BeforeEach
    void setUp() {
        storage = spy(new LocalUserStorageAdapter());
        bandwidthService = mock(BandwidthService.class);
        chatTurnService = mock(ChatTurnService.class);
        statistics = mock(StatisticsPort.class);
        xuidFactory = new XuidFactory("salt".getBytes(StandardCharsets.UTF_8));
        UserSettingsService settingsService = new UserSettingsService(storage,
                Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC));
        service = new ProxyService(objectMapper, new ChatRequestReader(), xuidFactory, storage, settingsService,
                bandwidthService, chatTurnService, statistics);
    }

    private void replyWith(String text) {
        doAnswer(invocation -> {
            ResponseAssembler response = invocation.getArgument(3);
            response.addMessage(text);
            return null;
        }).when(chatTurnService).handleChat(any(), any(), any(), any(), anyLong());
    }

    private String content(AssembledResponse response) throws Exception {
        JsonNode body = objectMapper.readTree(response.body());
        return body.get("choices").get(0).get("message").get("content").asText();
    }

    // ===== Request validation =====

    @Test
    void shouldRejectMissingOrInvalidJson() {
        for (String body : new String[] { null, "", "not json", "[1,2]", "{}" }) {
            AssembledResponse response = service.handle(body, PATH, "Bearer key");

            assertEquals(400, response.status(), String.valueOf(body));
            assertEquals("Bad Request. Missing or invalid JSON.", response.body());
        }
        verifyNoInteractions(chatTurnService);
        verify(storage, never()).lock(any());
    }

    @Test
    void shouldRejectMissingCredential() {
        AssembledResponse response = service.handle(CHAT_BODY, PATH, null);

        assertEquals(401, response.status());
        assertEquals("Unauthorized. API key required.", response.body());
        verify(statistics).track("p.rejected.unauthorized");
    }

    @Test
    void shouldRejectNonBearerOrEmptyCredential() {
        assertEquals(401, service.handle(CHAT_BODY, PATH, "Basic abc").status());
        assertEquals(401, service.handle(CHAT_BODY, PATH, "Bearer , ,").status());
    }

    @Test
    void shouldParseBearerKeys() {
        assertEquals(List.of("k1", "k2"), ProxyService.parseBearer("bearer k1, k2,"));
        assertEquals(List.of("k1"), ProxyService.parseBearer("BEARER k1"));
        assertEquals(List.of(), ProxyService.parseBearer("Bearer"));
        assertEquals(List.of(), ProxyService.parseBearer("Token k1"));
    }

    @Test
    void shouldRequireModel() {
        AssembledResponse response = service.handle(
                "{\"messages\":[{\"role\":\"user\",\"content\":\"Hello\"}]}", PATH, "Bearer key");

        assertEquals(400, response.status());
        assertEquals("Please specify a model.", response.body());
        verifyNoInteractions(chatTurnService);
    }

    // ===== Locking =====

    @Test
    void shouldRejectConcurrentUse() {
        Xuid xuid = xuidFactory.derive("key");
        assertTrue(storage.lock(xuid));

        AssembledResponse response = service.handle(CHAT_BODY, PATH, "Bearer key");

        assertEquals(403, response.status());
        assertEquals("Concurrent use is not allowed. Please wait a moment.", response.body());
        verify(storage, never()).unlock(any());
        verify(statistics).track("p.rejected.concurrent");
    }

    @Test
    void shouldReleaseLockExactlyOnce() {
        replyWith("Hi");

        service.handle(CHAT_BODY, PATH, "Bearer key");

        Xuid xuid = xuidFactory.derive("key");
        verify(storage, times(1)).unlock(xuid);
        assertTrue(storage.lock(xuid));
    }

    @Test
    void shouldReleaseLockAfterUnexpectedFailure() {
        doThrow(new IllegalStateException("boom")).when(chatTurnService)
                .handleChat(any(), any(), any(), any(), anyLong());

        AssembledResponse response = service.handle(CHAT_BODY, PATH, "Bearer key");

        assertEquals(500, response.status());
        assertEquals("Internal Proxy Error", response.body());
        verify(storage, times(1)).unlock(xuidFactory.derive("key"));
        verify(statistics).track("p.failed.internal");
    }

    @Test
    void shouldAnswerInternalErrorWhenLockBackendFails() {
        Xuid xuid = xuidFactory.derive("key");
        doThrow(new StorageException("Failed to lock", new IllegalStateException("redis down")))
                .when(storage).lock(xuid);

        AssembledResponse response = service.handle(CHAT_BODY, PATH, "Bearer key");

        assertEquals(500, response.status());
        assertEquals("Internal Proxy Error", response.body());
        verify(storage, never()).unlock(any());
        verifyNoInteractions(chatTurnService);
        verify(statistics).track("p.failed.internal");
    }

    @Test
    void shouldKeepReplyWhenLockReleaseFails() throws Exception {
        replyWith("Hi");
        Xuid xuid = xuidFactory.derive("key");
        doThrow(new StorageException("Failed to unlock", new IllegalStateException("redis blip")))
                .when(storage).unlock(xuid);

        AssembledResponse response = service.handle(CHAT_BODY, PATH, "Bearer key");

        assertEquals(200, response.status());
        assertEquals("Hi", content(response));
        assertTrue(storage.get(xuid).existed());
    }

    // ===== Cooldown =====

    @Test
    void shouldEnforceCooldownForReturningUser() {
        Xuid xuid = xuidFactory.derive("key");
        storage.put(xuid, Map.of(UserSettings.KEY_LAST_SEEN, NOW - 10));
        when(bandwidthService.currentCooldown()).thenReturn(60L);

        AssembledResponse response = service.handle(CHAT_BODY, PATH, "Bearer key");

        assertEquals(429, response.status());
        assertEquals("Please wait 50 seconds.", response.body());
        verifyNoInteractions(chatTurnService);
        verify(statistics).track("p.rejected.cooldown");
    }

    @Test
    void shouldNotApplyCooldownToNewUser() {
        when(bandwidthService.currentCooldown()).thenReturn(60L);
        replyWith("Hi");

        assertEquals(200, service.handle(CHAT_BODY, PATH, "Bearer key").status());
    }

    @Test
    void shouldAllowRequestAfterCooldownElapsed() {
        storage.put(xuidFactory.derive("key"), Map.of(UserSettings.KEY_LAST_SEEN, NOW - 90));
        when(bandwidthService.currentCooldown()).thenReturn(60L);
        replyWith("Hi");

        assertEquals(200, service.handle(CHAT_BODY, PATH, "Bearer key").status());
    }

    // ===== Chat =====

    @Test
    void shouldRotateKeysByRequestCounter() {
        replyWith("Hi");

        service.handle(CHAT_BODY, PATH, "Bearer k1,k2");
        service.handle(CHAT_BODY, PATH, "Bearer k1,k2");
        service.handle(CHAT_BODY, PATH, "Bearer k1,k2");

        verify(chatTurnService, times(2)).handleChat(any(), any(), eq("k1"), any(), anyLong());
        verify(chatTurnService, times(1)).handleChat(any(), any(), eq("k2"), any(), anyLong());
        assertEquals(3L, storage.get(xuidFactory.derive("k1")).data().get(UserSettings.KEY_REQUEST_COUNTER));
    }

    @Test
    void shouldSaveRecordWithLastSeen() {
        replyWith("Hi");

        service.handle(CHAT_BODY, PATH, "Bearer key");

        Map<String, Object> saved = storage.get(xuidFactory.derive("key")).data();
        assertEquals(NOW, saved.get(UserSettings.KEY_LAST_SEEN));
        assertEquals(NOW, saved.get(UserSettings.KEY_FIRST_SEEN));
    }

    @Test
    void shouldAppendAnnouncementToSuccessfulReply() throws Exception {
        storage.setAnnouncement("Maintenance tonight");
        replyWith("Hi");

        AssembledResponse response = service.handle(CHAT_BODY, PATH, "Bearer key");

        assertEquals("Hi\n\u200B<proxy>\n***\nMaintenance tonight\n***\n\u200B</proxy>", content(response));
    }

    @Test
    void shouldPassQuietFlagFromPath() {
        replyWith("Hi");

        service.handle(CHAT_BODY, "/quiet/chat/completions", "Bearer key");

        verify(chatTurnService).handleChat(any(), argThat(request -> request.isQuiet()), eq("key"), any(),
                eq(NOW));
    }

    @Test
    void shouldNotSaveInvalidUser() {
        doAnswer(invocation -> {
            UserSettings user = invocation.getArgument(0);
            user.setValid(false);
            ResponseAssembler response = invocation.getArgument(3);
            response.addError("API key not valid.", 400);
            return null;
        }).when(chatTurnService).handleChat(any(), any(), any(), any(), anyLong());

        AssembledResponse response = service.handle(CHAT_BODY, PATH, "Bearer key");

        assertEquals(400, response.status());
        assertFalse(storage.get(xuidFactory.derive("key")).existed());
    }

    @Test
    void shouldStreamWhenRequested() {
        replyWith("Hi");

        AssembledResponse response = service.handle(
                "{\"model\":\"m\",\"stream\":true,\"messages\":[{\"role\":\"user\",\"content\":\"Hello\"}]}",
                PATH, "Bearer key");

        assertEquals(AssembledResponse.TEXT_EVENT_STREAM, response.contentType());
        assertTrue(response.body().endsWith("data: [DONE]\n\n"));
    }

    // ===== Proxy test =====

    @Test
    void shouldWrapProxyTestErrorsAndSkipAnnouncement() throws Exception {
        storage.setAnnouncement("Maintenance tonight");
        doAnswer(invocation -> {
            ResponseAssembler response = invocation.getArgument(3);
            response.addError("API key not valid.", 400);
            return null;
        }).when(chatTurnService).handleProxyTest(any(), any(), any(), any());

        AssembledResponse response = service.handle(PROXY_TEST_BODY, PATH, "Bearer key");

        assertEquals(400, response.status());
        assertEquals("PROXY ERROR 400: API key not valid.", objectMapper.readTree(response.body()).get("error")
                .asText());
        verify(chatTurnService, never()).handleChat(any(), any(), any(), any(), anyLong());
    }

    @Test
    void shouldNotAnnounceOnSuccessfulProxyTest() throws Exception {
        storage.setAnnouncement("Maintenance tonight");
        doAnswer(invocation -> {
            ResponseAssembler response = invocation.getArgument(3);
            response.addMessage("TEST");
            return null;
        }).when(chatTurnService).handleProxyTest(any(), any(), any(), any());

        assertEquals("TEST", content(service.handle(PROXY_TEST_BODY, PATH, "Bearer key")));
    }
}
