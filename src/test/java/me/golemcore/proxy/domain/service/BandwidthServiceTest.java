package me.golemcore.proxy.domain.service;

import me.golemcore.proxy.domain.model.BandwidthUsage;
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import me.golemcore.proxy.port.outbound.BandwidthPort;
import me.golemcore.proxy.ratelimit.CooldownPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class BandwidthServiceTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);
    private static final long GIB = 1024;

    private BandwidthPort bandwidthPort;
    private Clock clock;
    private BandwidthService service;

    @BeforeEach
    void setUp() {
        bandwidthPort = mock(BandwidthPort.class);
        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(NOW);
        ProxyProperties properties = new ProxyProperties();
        properties.getBandwidth().setCacheTtlSeconds(300);
        properties.getBandwidth().setWarningMib(70 * GIB);
        service = new BandwidthService(bandwidthPort, CooldownPolicy.parse("90:90, 60:75, 30:60"), clock,
                properties);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void shouldRefreshInBackgroundOnFirstRead() {
        when(bandwidthPort.fetchMonthlyUsage()).thenReturn(new BandwidthUsage(80 * GIB, "MB"));

        service.getUsage();

        verify(bandwidthPort, timeout(2000)).fetchMonthlyUsage();
    }

    @Test
    void shouldDeriveCooldownFromCachedUsage() {
        when(bandwidthPort.fetchMonthlyUsage()).thenReturn(new BandwidthUsage(80 * GIB, "MB"));

        service.refresh();

        assertEquals(80 * GIB, service.getUsage().mebibytes());
        assertEquals(60L, service.currentCooldown());
    }

    @Test
    void shouldNotRefetchWhileFresh() {
        when(bandwidthPort.fetchMonthlyUsage()).thenReturn(new BandwidthUsage(10 * GIB, "MB"));
        service.refresh();

        when(clock.instant()).thenReturn(NOW.plusSeconds(299));
        service.getUsage();

        verify(bandwidthPort, after(200).times(1)).fetchMonthlyUsage();
    }

    @Test
    void shouldRefetchWhenStale() {
        when(bandwidthPort.fetchMonthlyUsage()).thenReturn(new BandwidthUsage(10 * GIB, "MB"));
        service.refresh();

        when(clock.instant()).thenReturn(NOW.plusSeconds(300));
        service.getUsage();

        verify(bandwidthPort, timeout(2000).times(2)).fetchMonthlyUsage();
    }

    @Test
    void shouldKeepLastReadingWhenRefreshFails() {
        when(bandwidthPort.fetchMonthlyUsage())
                .thenReturn(new BandwidthUsage(95 * GIB, "MB"))
                .thenThrow(new IllegalStateException("metrics down"));

        service.refresh();
        service.refresh();

        assertEquals(90L, service.currentCooldown());
    }

    @Test
    void shouldHaveNoCooldownWhileUsageIsUnavailable() {
        when(bandwidthPort.fetchMonthlyUsage()).thenReturn(BandwidthUsage.unavailable());

        service.refresh();

        assertFalse(service.getUsage().isAvailable());
        assertEquals(0L, service.currentCooldown());
    }

    @Test
    void shouldExposeConfiguration() {
        assertEquals("90:90, 60:75, 30:60", service.getCooldownPolicy().toString());
        assertEquals(70 * GIB, service.getWarningMib());
    }
}
