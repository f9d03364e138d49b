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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.model.StoredRecord;
import me.golemcore.proxy.port.outbound.UserStoragePort;
import me.golemcore.proxy.security.Xuid;

import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process, non-persistent implementation of {@link UserStoragePort}.
 *
 * <p>
 * Records live in a concurrent map. An identity is locked while its lock id
 * is a member of a concurrent set, so taking and releasing the lock are each a
 * single atomic set operation. The lock is not reentrant: locking twice from
 * the same thread fails the second time.
 *
 * <p>
 * Only safe for a single worker process. Used in development mode when no
 * Redis URL is configured.
 */
@Slf4j
public class LocalUserStorageAdapter implements UserStoragePort {

    private final Map<Xuid, Map<String, Object>> records = new ConcurrentHashMap<>();
    private final Set<String> locks = ConcurrentHashMap.newKeySet();
    private volatile String announcement = "";

    @Override
    public boolean isActive() {
        return true;
    }

    @Override
    public StoredRecord get(Xuid xuid) {
        Map<String, Object> data = records.get(xuid);
        if (data == null) {
            return StoredRecord.missing();
        }
        return StoredRecord.found(data);
    }

    @Override
    public boolean put(Xuid xuid, Map<String, Object> data) {
        return records.put(xuid, new HashMap<>(data)) != null;
    }

    @Override
    public void remove(Xuid xuid) {
        if (records.remove(xuid) == null) {
            throw new NoSuchElementException(xuid.full());
        }
    }

    @Override
    public boolean lock(Xuid xuid) {
        return locks.add(xuid.lockId());
    }

    @Override
    public void unlock(Xuid xuid) {
        if (!locks.remove(xuid.lockId())) {
            log.debug("[Storage] {} unlock without a held lock", xuid.pretty());
        }
    }

    @Override
    public String getAnnouncement() {
        return announcement;
    }

    @Override
    public void setAnnouncement(String text) {
        announcement = text != null && !text.isBlank() ? text : "";
    }

    @Override
    public long keyCount() {
        return records.size();
    }
}
