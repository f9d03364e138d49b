package me.golemcore.proxy.port.outbound;

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

import me.golemcore.proxy.domain.model.StoredRecord;
import me.golemcore.proxy.security.Xuid;

import java.util.Map;

/**
 * Port for per-identity settings records and the per-identity lock.
 *
 * <p>
 * Two backends exist: an in-process map for single-worker development and a
 * Redis-backed store shared by every worker. The backend is chosen once at
 * startup.
 */
public interface UserStoragePort {

    /**
     * Whether the backend is reachable and may be used.
     */
    boolean isActive();

    /**
     * Read the record of an identity.
     *
     * @return the record and whether it existed; an empty mutable map when it
     *         did not
     */
    StoredRecord get(Xuid xuid);

    /**
     * Overwrite the record of an identity.
     *
     * @return true if a record existed before
     */
    boolean put(Xuid xuid, Map<String, Object> data);

    /**
     * Administrative purge.
     *
     * @throws java.util.NoSuchElementException
     *             if the identity has no record
     */
    void remove(Xuid xuid);

    /**
     * Non-blocking attempt to take the identity lock.
     *
     * @return false immediately if the lock is held by anyone
     */
    boolean lock(Xuid xuid);

    /**
     * Release the identity lock taken by {@link #lock(Xuid)} on the same
     * thread. Releasing a lock that is no longer owned is ignored.
     *
     * @throws me.golemcore.proxy.domain.model.StorageException
     *             if the backend cannot be reached
     */
    void unlock(Xuid xuid);

    /**
     * Shared broadcast notice, empty string when none.
     */
    String getAnnouncement();

    /**
     * Set the broadcast notice; null or blank clears it.
     */
    void setAnnouncement(String text);

    /**
     * Number of stored keys, or -1 when the backend cannot tell.
     */
    long keyCount();
}
