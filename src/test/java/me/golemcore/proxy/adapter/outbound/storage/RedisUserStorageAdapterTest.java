package me.golemcore.proxy.adapter.outbound.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.proxy.domain.model.StorageException;
import me.golemcore.proxy.domain.model.StoredRecord;
import me.golemcore.proxy.security.Xuid;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.params.SetParams;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RedisUserStorageAdapterTest {

    private JedisPooled jedis;
    private RedisUserStorageAdapter storage;
    private Xuid xuid;

    @BeforeEach
    void setUp() {
        jedis = mock(JedisPooled.class);
        storage = new RedisUserStorageAdapter(jedis, new ObjectMapper(), 60, 0);
        xuid = Xuid.derive("key", "salt".getBytes(StandardCharsets.UTF_8));
    }

    // ===== Locks =====

    @Test
    void shouldAcquireLockWithSetNx() {
        when(jedis.set(eq(xuid.lockId()), anyString(), any(SetParams.class))).thenReturn("OK");

        assertTrue(storage.lock(xuid));
    }

    @Test
    void shouldFailLockWhenKeyExists() {
        when(jedis.set(eq(xuid.lockId()), anyString(), any(SetParams.class))).thenReturn(null);

        assertFalse(storage.lock(xuid));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldReleaseOnlyOwnToken() {
        ArgumentCaptor<String> token = ArgumentCaptor.forClass(String.class);
        when(jedis.set(eq(xuid.lockId()), token.capture(), any(SetParams.class))).thenReturn("OK");
        when(jedis.eval(anyString(), anyList(), anyList())).thenReturn(1L);

        storage.lock(xuid);
        storage.unlock(xuid);

        ArgumentCaptor<List<String>> args = ArgumentCaptor.forClass(List.class);
        verify(jedis).eval(eq(RedisUserStorageAdapter.UNLOCK_SCRIPT), eq(List.of(xuid.lockId())), args.capture());
        assertEquals(List.of(token.getValue()), args.getValue());
    }

    @Test
    void shouldSkipUnlockWhenLockNotHeld() {
        storage.unlock(xuid);

        verify(jedis, never()).eval(anyString(), anyList(), anyList());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldNotReleaseLockReacquiredAfterExpiry() throws Exception {
        ArgumentCaptor<String> tokens = ArgumentCaptor.forClass(String.class);
        when(jedis.set(eq(xuid.lockId()), tokens.capture(), any(SetParams.class))).thenReturn("OK");
        when(jedis.eval(anyString(), anyList(), anyList())).thenReturn(0L);

        ExecutorService firstRequest = Executors.newSingleThreadExecutor();
        try {
            assertTrue(firstRequest.submit(() -> storage.lock(xuid)).get(5, TimeUnit.SECONDS));
            // first lock expired in Redis, a second request takes it on this thread
            assertTrue(storage.lock(xuid));

            firstRequest.submit(() -> storage.unlock(xuid)).get(5, TimeUnit.SECONDS);
        } finally {
            firstRequest.shutdownNow();
        }

        String firstToken = tokens.getAllValues().get(0);
        String secondToken = tokens.getAllValues().get(1);
        assertNotEquals(firstToken, secondToken);
        ArgumentCaptor<List<String>> args = ArgumentCaptor.forClass(List.class);
        verify(jedis).eval(eq(RedisUserStorageAdapter.UNLOCK_SCRIPT), eq(List.of(xuid.lockId())), args.capture());
        assertEquals(List.of(firstToken), args.getValue());
    }

    @Test
    void shouldWrapLockFailures() {
        when(jedis.set(eq(xuid.lockId()), anyString(), any(SetParams.class)))
                .thenThrow(new JedisConnectionException("down"));

        assertThrows(StorageException.class, () -> storage.lock(xuid));
    }

    @Test
    void shouldWrapUnlockFailures() {
        when(jedis.set(eq(xuid.lockId()), anyString(), any(SetParams.class))).thenReturn("OK");
        when(jedis.eval(anyString(), anyList(), anyList())).thenThrow(new JedisConnectionException("blip"));
        storage.lock(xuid);

        assertThrows(StorageException.class, () -> storage.unlock(xuid));
        // token is forgotten even when the release failed
        reset(jedis);
        storage.unlock(xuid);
        verify(jedis, never()).eval(anyString(), anyList(), anyList());
    }

    // ===== Records =====

    @Test
    void shouldReadStoredJson() {
        when(jedis.get(xuid.full())).thenReturn("{\"use_think\":true,\"rcounter\":3}");

        StoredRecord record = storage.get(xuid);

        assertTrue(record.existed());
        assertEquals(true, record.data().get("use_think"));
        assertEquals(3, record.data().get("rcounter"));
    }

    @Test
    void shouldReportMissingRecord() {
        when(jedis.get(xuid.full())).thenReturn(null);

        assertFalse(storage.get(xuid).existed());
    }

    @Test
    void shouldWrapRedisFailures() {
        when(jedis.get(xuid.full())).thenThrow(new JedisConnectionException("down"));

        assertThrows(StorageException.class, () -> storage.get(xuid));
    }

    @Test
    void shouldWriteJsonAndReportExistence() {
        when(jedis.exists(xuid.full())).thenReturn(true);

        assertTrue(storage.put(xuid, Map.of("use_nobot", true)));

        verify(jedis).set(xuid.full(), "{\"use_nobot\":true}");
    }

    @Test
    void shouldApplyRecordExpiryWhenConfigured() {
        storage = new RedisUserStorageAdapter(jedis, new ObjectMapper(), 60, 3600);

        storage.put(xuid, Map.of());

        verify(jedis).set(eq(xuid.full()), eq("{}"), any(SetParams.class));
    }

    @Test
    void shouldThrowWhenRemovingMissingRecord() {
        when(jedis.del(xuid.full())).thenReturn(0L);

        assertThrows(NoSuchElementException.class, () -> storage.remove(xuid));
    }

    // ===== Announcement =====

    @Test
    void shouldClearAnnouncementOnBlank() {
        storage.setAnnouncement("");

        verify(jedis).del(RedisUserStorageAdapter.ANNOUNCEMENT_KEY);
    }

    @Test
    void shouldWrapAnnouncementFailures() {
        when(jedis.get(RedisUserStorageAdapter.ANNOUNCEMENT_KEY)).thenThrow(new JedisConnectionException("down"));
        when(jedis.set(RedisUserStorageAdapter.ANNOUNCEMENT_KEY, "hello"))
                .thenThrow(new JedisConnectionException("down"));

        assertThrows(StorageException.class, () -> storage.getAnnouncement());
        assertThrows(StorageException.class, () -> storage.setAnnouncement("hello"));
    }

    @Test
    void shouldReturnEmptyAnnouncementWhenUnset() {
        when(jedis.get(RedisUserStorageAdapter.ANNOUNCEMENT_KEY)).thenReturn(null);

        assertEquals("", storage.getAnnouncement());
    }
}
