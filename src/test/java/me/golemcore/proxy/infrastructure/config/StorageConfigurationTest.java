package me.golemcore.proxy.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.proxy.adapter.outbound.stats.InMemoryStatisticsAdapter;
import me.golemcore.proxy.adapter.outbound.stats.RedisStatisticsAdapter;
import me.golemcore.proxy.adapter.outbound.stats.StatsBuckets;
import me.golemcore.proxy.adapter.outbound.storage.LocalUserStorageAdapter;
import me.golemcore.proxy.adapter.outbound.storage.RedisUserStorageAdapter;
import me.golemcore.proxy.port.outbound.UserStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.beans.factory.ObjectProvider;
import redis.clients.jedis.JedisPooled;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

class StorageConfigurationTest {

    @Mock
    private ObjectProvider<JedisPooled> jedisProvider;
    @Mock
    private JedisPooled jedis;

    private final StorageConfiguration configuration = new StorageConfiguration();
    private ProxyProperties properties;
    private StatsBuckets buckets;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        properties = new ProxyProperties();
        buckets = new StatsBuckets(Clock.systemUTC(), properties.getStats());
    }

    @Test
    void shouldUseRedisWhenClientIsAvailable() {
        when(jedisProvider.getIfAvailable()).thenReturn(jedis);
        when(jedis.ping()).thenReturn("PONG");

        UserStoragePort storage = configuration.userStoragePort(jedisProvider, new ObjectMapper(), properties);

        assertInstanceOf(RedisUserStorageAdapter.class, storage);
        assertInstanceOf(RedisStatisticsAdapter.class, configuration.statisticsPort(jedisProvider, buckets));
    }

    @Test
    void shouldFallBackToLocalStorageInDevelopment() {
        when(jedisProvider.getIfAvailable()).thenReturn(null);
        properties.setDevelopment(true);

        UserStoragePort storage = configuration.userStoragePort(jedisProvider, new ObjectMapper(), properties);

        assertInstanceOf(LocalUserStorageAdapter.class, storage);
        assertInstanceOf(InMemoryStatisticsAdapter.class, configuration.statisticsPort(jedisProvider, buckets));
    }

    @Test
    void shouldRefuseLocalStorageOutsideDevelopment() {
        when(jedisProvider.getIfAvailable()).thenReturn(null);

        assertThrows(IllegalStateException.class,
                () -> configuration.userStoragePort(jedisProvider, new ObjectMapper(), properties));
    }

    @Test
    void shouldKeepLockAliveLongerThanUpstreamCall() {
        properties.getGemini().setTimeoutSeconds(75);
        properties.getStorage().getRedis().setLockTimeoutSeconds(60);
        assertEquals(150, StorageConfiguration.lockTimeoutSeconds(properties));

        properties.getStorage().getRedis().setLockTimeoutSeconds(300);
        assertEquals(300, StorageConfiguration.lockTimeoutSeconds(properties));
    }

    @Test
    void shouldDefaultLockTimeoutAboveUpstreamBudget() {
        assertEquals(180, StorageConfiguration.lockTimeoutSeconds(properties));
    }
}
