package me.golemcore.proxy.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.model.StoredRecord;
import me.golemcore.proxy.domain.model.UserSettings;
import me.golemcore.proxy.port.outbound.UserStoragePort;
import me.golemcore.proxy.security.Xuid;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Loads and saves {@link UserSettings} through the configured storage
 * backend.
 *
 * <p>
 * A record is loaded once per request and saved at most once. The caller must
 * hold the identity lock in between.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserSettingsService {

    private final UserStoragePort storage;
    private final Clock clock;

    public UserSettings load(Xuid xuid) {
        StoredRecord stored = storage.get(xuid);
        UserSettings settings = new UserSettings(xuid, stored.data(), stored.existed());
        if (!stored.existed()) {
            settings.setFirstSeen(nowEpochSeconds());
        }
        settings.markVersion();
        return settings;
    }

    public void save(UserSettings settings) {
        settings.setLastSeen(nowEpochSeconds());
        storage.put(settings.getXuid(), settings.getData());
        log.debug("[Storage] {} settings saved", settings.getXuid().pretty());
    }

    public long nowEpochSeconds() {
        return clock.instant().getEpochSecond();
    }
}
