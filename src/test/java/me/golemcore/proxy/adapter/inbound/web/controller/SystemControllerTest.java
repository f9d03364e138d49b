package me.golemcore.proxy.adapter.inbound.web.controller;

import me.golemcore.proxy.adapter.inbound.web.dto.HealthResponse;
import me.golemcore.proxy.domain.model.BandwidthUsage;
import me.golemcore.proxy.domain.service.BandwidthService;
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import me.golemcore.proxy.port.outbound.StatisticsPort;
import me.golemcore.proxy.port.outbound.UserStoragePort;
import me.golemcore.proxy.ratelimit.CooldownPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SystemControllerTest {

    private ProxyProperties properties;
    private BandwidthService bandwidthService;
    private UserStoragePort storage;
    private StatisticsPort statistics;
    private SystemController controller;

    @BeforeEach
    void setUp() {
        properties = new ProxyProperties();
        properties.setAdmin("Operator");
        properties.setVersion("2025.06");
        bandwidthService = mock(BandwidthService.class);
        storage = mock(UserStoragePort.class);
        statistics = mock(StatisticsPort.class);
        controller = new SystemController(properties, bandwidthService, storage, statistics);
    }

    @Test
    void shouldReportHealth() {
        when(bandwidthService.getUsage()).thenReturn(new BandwidthUsage(80 * 1024, "MB"));
        when(bandwidthService.getWarningMib()).thenReturn(76800L);
        when(bandwidthService.getCooldownPolicy()).thenReturn(CooldownPolicy.parse("90:90, 60:75, 30:60"));
        when(storage.keyCount()).thenReturn(42L);

        StepVerifier.create(controller.health())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    HealthResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("Operator", body.getAdmin());
                    assertEquals(81920, body.getBandwidth());
                    assertEquals(76800, body.getBwarning());
                    assertEquals(60, body.getCooldown());
                    assertEquals("90:90, 60:75, 30:60", body.getCpolicy());
                    assertEquals(42, body.getKeyspace());
                    assertTrue(body.getUptime() >= 0);
                    assertEquals("2025.06", body.getVersion());
                })
                .verifyComplete();
    }

    @Test
    void shouldReportUnknownBandwidth() {
        when(bandwidthService.getUsage()).thenReturn(BandwidthUsage.unavailable());
        when(bandwidthService.getCooldownPolicy()).thenReturn(CooldownPolicy.parse("90:90"));

        StepVerifier.create(controller.health())
                .assertNext(response -> {
                    HealthResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(-1, body.getBandwidth());
                    assertEquals(0, body.getCooldown());
                })
                .verifyComplete();
    }

    @Test
    void shouldListStatisticsBuckets() {
        when(statistics.query()).thenReturn(List.of(
                new StatisticsPort.Bucket(":stats:2026-03-15T09:30", Map.of("g", 1L)),
                new StatisticsPort.Bucket(":stats:2026-03-15T10:00", Map.of("p", 2L))));

        StepVerifier.create(controller.stats())
                .assertNext(response -> {
                    Map<String, Map<String, Long>> body = response.getBody();
                    assertNotNull(body);
                    assertEquals(List.of(":stats:2026-03-15T09:30", ":stats:2026-03-15T10:00"),
                            List.copyOf(body.keySet()));
                    assertEquals(2L, body.get(":stats:2026-03-15T10:00").get("p"));
                })
                .verifyComplete();
    }

    @Test
    void shouldReadStorageOffTheCallingThread() {
        AtomicReference<String> keyspaceThread = new AtomicReference<>();
        AtomicReference<String> statsThread = new AtomicReference<>();
        when(bandwidthService.getUsage()).thenReturn(BandwidthUsage.unavailable());
        when(bandwidthService.getCooldownPolicy()).thenReturn(CooldownPolicy.parse("90:90"));
        when(storage.keyCount()).thenAnswer(invocation -> {
            keyspaceThread.set(Thread.currentThread().getName());
            return 7L;
        });
        when(statistics.query()).thenAnswer(invocation -> {
            statsThread.set(Thread.currentThread().getName());
            return List.of();
        });

        Mono<ResponseEntity<HealthResponse>> health = controller.health();
        Mono<ResponseEntity<Map<String, Map<String, Long>>>> stats = controller.stats();
        verify(storage, never()).keyCount();
        verify(statistics, never()).query();

        StepVerifier.create(health).expectNextCount(1).verifyComplete();
        StepVerifier.create(stats).expectNextCount(1).verifyComplete();
        assertTrue(keyspaceThread.get().startsWith("boundedElastic"), keyspaceThread.get());
        assertTrue(statsThread.get().startsWith("boundedElastic"), statsThread.get());
    }
}
