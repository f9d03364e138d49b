package me.golemcore.proxy.domain.model;

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

import me.golemcore.proxy.security.Xuid;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Persisted per-identity settings record.
 *
 * <p>
 * Backed by a flat map so the stored JSON stays compatible with records
 * written by older deployments. The record is loaded once at request start,
 * mutated in place while the identity lock is held and saved at most once.
 *
 * <p>
 * {@code valid} is cleared when the upstream rejected the caller's
 * credential; such a record must not be persisted.
 *
 * @since 1.0
 */
public class UserSettings {

    public static final String KEY_REQUEST_COUNTER = "rcounter";
    public static final String KEY_FIRST_SEEN = "timestamp_first_seen";
    public static final String KEY_LAST_SEEN = "timestamp_last_seen";
    public static final String KEY_BANNER = "banner";
    public static final String KEY_VERSION = "version";
    public static final String KEY_THINK_TEXT = "think_text";

    public static final int RECORD_VERSION = 1;
    public static final String THINK_TEXT_KEEP = "keep";
    public static final String THINK_TEXT_REMOVE = "remove";

    private final Xuid xuid;
    private final Map<String, Object> data;
    private final boolean exists;
    private boolean valid = true;

    public UserSettings(Xuid xuid, Map<String, Object> data, boolean exists) {
        this.xuid = xuid;
        this.data = new HashMap<>(data);
        this.exists = exists;
    }

    /**
     * Blank record for the same identity, used when user preferences must not
     * influence a request.
     */
    public static UserSettings blank(Xuid xuid) {
        return new UserSettings(xuid, Map.of(), false);
    }

    public Xuid getXuid() {
        return xuid;
    }

    public boolean exists() {
        return exists;
    }

    public boolean isValid() {
        return valid;
    }

    public void setValid(boolean valid) {
        this.valid = valid;
    }

    public long getRequestCounter() {
        return getLong(KEY_REQUEST_COUNTER, 0L);
    }

    public void incrementRequestCounter() {
        data.put(KEY_REQUEST_COUNTER, getRequestCounter() + 1);
    }

    public boolean isEnabled(ProxyFeature feature) {
        return Boolean.TRUE.equals(data.get(feature.getSettingKey()));
    }

    public void setEnabled(ProxyFeature feature, boolean enabled) {
        data.put(feature.getSettingKey(), enabled);
    }

    public String getThinkText() {
        Object value = data.get(KEY_THINK_TEXT);
        return value instanceof String ? (String) value : THINK_TEXT_REMOVE;
    }

    public void setThinkText(String thinkText) {
        data.put(KEY_THINK_TEXT, thinkText);
    }

    public boolean isKeepThinking() {
        return THINK_TEXT_KEEP.equals(getThinkText());
    }

    public Long getFirstSeen() {
        return getLongOrNull(KEY_FIRST_SEEN);
    }

    public void setFirstSeen(long epochSeconds) {
        data.put(KEY_FIRST_SEEN, epochSeconds);
    }

    public Long getLastSeen() {
        return getLongOrNull(KEY_LAST_SEEN);
    }

    public void setLastSeen(long epochSeconds) {
        data.put(KEY_LAST_SEEN, epochSeconds);
    }

    public void markVersion() {
        data.put(KEY_VERSION, RECORD_VERSION);
    }

    /**
     * Seconds elapsed since the last save, or {@code null} when the identity
     * was never saved.
     */
    public Long secondsSinceLastSeen(long nowEpochSeconds) {
        Long lastSeen = getLastSeen();
        if (lastSeen == null || lastSeen == 0L) {
            return null;
        }
        return nowEpochSeconds - lastSeen;
    }

    public String lastSeenMessage(long nowEpochSeconds) {
        Long seconds = secondsSinceLastSeen(nowEpochSeconds);
        if (seconds == null || seconds == 0L) {
            return "not seen before";
        }
        return String.format(Locale.ROOT, "last seen %,ds ago", seconds);
    }

    /**
     * Returns true and records the version when the identity has not seen
     * this banner version yet.
     */
    public boolean markBannerSeen(int bannerVersion) {
        long lastSeenBanner = getLong(KEY_BANNER, 0L);
        if (lastSeenBanner != bannerVersion) {
            data.put(KEY_BANNER, bannerVersion);
            return true;
        }
        return false;
    }

    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }

    private long getLong(String key, long defaultValue) {
        Long value = getLongOrNull(key);
        return value != null ? value : defaultValue;
    }

    private Long getLongOrNull(String key) {
        Object value = data.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return null;
    }
}
