package me.golemcore.proxy.ratelimit;

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

/**
 * Minimum interval between two requests of one identity, active once the
 * hosting bandwidth reaches {@code bandwidthGib}.
 *
 * @param durationSeconds
 *            required wait in seconds
 * @param bandwidthGib
 *            bandwidth threshold in GiB
 */
public record Cooldown(long durationSeconds, long bandwidthGib) {

    public static final Cooldown NONE = new Cooldown(0, 0);

    /**
     * Parses {@code duration[:bandwidth]}. A bare integer means a zero
     * threshold, an empty string means no cooldown.
     *
     * @throws NumberFormatException
     *             if either part is not a base-10 integer
     */
    public static Cooldown parse(String text) {
        int index = text.indexOf(':');
        if (index > 0) {
            return new Cooldown(
                    Long.parseLong(text.substring(0, index)),
                    Long.parseLong(text.substring(index + 1)));
        }
        if (!text.isEmpty()) {
            return new Cooldown(Long.parseLong(text), 0);
        }
        return NONE;
    }
}
