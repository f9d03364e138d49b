package me.golemcore.proxy.adapter.outbound.storage;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.model.StorageException;
import me.golemcore.proxy.domain.model.StoredRecord;
import me.golemcore.proxy.port.outbound.UserStoragePort;
import me.golemcore.proxy.security.Xuid;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * Redis implementation of {@link UserStoragePort}, shared by every worker.
 *
 * <p>
 * Key layout:
 * <ul>
 * <li>{@code <xuid>} - settings record as a flat JSON object</li>
 * <li>{@code <xuid>:lock} - lock token, {@code SET NX PX} with a bounded
 * timeout so a crashed holder cannot wedge the identity</li>
 * <li>{@code :announcement} - shared broadcast notice</li>
 * </ul>
 *
 * <p>
 * Unlock is a compare-and-delete script against the token set by the same
 * thread's {@link #lock(Xuid)}. Tokens are kept per thread, so a request whose
 * lock expired and was re-acquired by another request, in this process or
 * elsewhere, never releases the new holder's lock.
 *
 * <p>
 * Redis failures surface as {@link StorageException}.
 */
@Slf4j
public class RedisUserStorageAdapter implements UserStoragePort {

    static final String ANNOUNCEMENT_KEY = ":announcement";

    static final String UNLOCK_SCRIPT = "if redis.call('get', KEYS[1]) == ARGV[1] then "
            + "return redis.call('del', KEYS[1]) else return 0 end";

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    private final JedisPooled jedis;
    private final ObjectMapper objectMapper;
    private final long lockTimeoutMillis;
    private final long recordExpirySeconds;
    private final ThreadLocal<Map<String, String>> lockTokens = ThreadLocal.withInitial(HashMap::new);

    public RedisUserStorageAdapter(JedisPooled jedis, ObjectMapper objectMapper, long lockTimeoutSeconds,
            long recordExpirySeconds) {
        this.jedis = jedis;
        this.objectMapper = objectMapper;
        this.lockTimeoutMillis = lockTimeoutSeconds * 1000L;
        this.recordExpirySeconds = recordExpirySeconds;
    }

    @Override
    public boolean isActive() {
        try {
            return "PONG".equalsIgnoreCase(jedis.ping());
        } catch (JedisException e) {
            log.warn("[Storage] Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public StoredRecord get(Xuid xuid) {
        String json;
        try {
            json = jedis.get(xuid.full());
        } catch (JedisException e) {
            throw new StorageException("Failed to read record " + xuid, e);
        }
        if (json == null) {
            return StoredRecord.missing();
        }
        try {
            return StoredRecord.found(objectMapper.readValue(json, RECORD_TYPE));
        } catch (JsonProcessingException e) {
            throw new StorageException("Corrupted record " + xuid, e);
        }
    }

    @Override
    public boolean put(Xuid xuid, Map<String, Object> data) {
        String key = xuid.full();
        try {
            String json = objectMapper.writeValueAsString(data);
            boolean existed = jedis.exists(key);
            if (recordExpirySeconds > 0) {
                jedis.set(key, json, SetParams.setParams().ex(recordExpirySeconds));
            } else {
                jedis.set(key, json);
            }
            return existed;
        } catch (JsonProcessingException | JedisException e) {
            throw new StorageException("Failed to write record " + xuid, e);
        }
    }

    @Override
    public void remove(Xuid xuid) {
        long removed;
        try {
            removed = jedis.del(xuid.full());
        } catch (JedisException e) {
            throw new StorageException("Failed to remove record " + xuid, e);
        }
        if (removed == 0) {
            throw new NoSuchElementException(xuid.full());
        }
    }

    @Override
    public boolean lock(Xuid xuid) {
        String lockId = xuid.lockId();
        String token = UUID.randomUUID().toString();
        String result;
        try {
            result = jedis.set(lockId, token, SetParams.setParams().nx().px(lockTimeoutMillis));
        } catch (JedisException e) {
            throw new StorageException("Failed to lock " + xuid, e);
        }
        if ("OK".equalsIgnoreCase(result)) {
            lockTokens.get().put(lockId, token);
            return true;
        }
        return false;
    }

    @Override
    public void unlock(Xuid xuid) {
        String lockId = xuid.lockId();
        Map<String, String> tokens = lockTokens.get();
        String token = tokens.remove(lockId);
        if (tokens.isEmpty()) {
            lockTokens.remove();
        }
        if (token == null) {
            return;
        }
        Object released;
        try {
            released = jedis.eval(UNLOCK_SCRIPT, List.of(lockId), List.of(token));
        } catch (JedisException e) {
            throw new StorageException("Failed to unlock " + xuid, e);
        }
        if (!(released instanceof Long) || (Long) released == 0L) {
            log.debug("[Storage] {} lock expired before release", xuid.pretty());
        }
    }

    @Override
    public String getAnnouncement() {
        String text;
        try {
            text = jedis.get(ANNOUNCEMENT_KEY);
        } catch (JedisException e) {
            throw new StorageException("Failed to read announcement", e);
        }
        return text != null ? text : "";
    }

    @Override
    public void setAnnouncement(String text) {
        try {
            if (text != null && !text.isBlank()) {
                jedis.set(ANNOUNCEMENT_KEY, text);
            } else {
                jedis.del(ANNOUNCEMENT_KEY);
            }
        } catch (JedisException e) {
            throw new StorageException("Failed to write announcement", e);
        }
    }

    @Override
    public long keyCount() {
        try {
            return jedis.dbSize();
        } catch (JedisException e) {
            log.warn("[Storage] Redis DBSIZE failed: {}", e.getMessage());
            return -1;
        }
    }
}
