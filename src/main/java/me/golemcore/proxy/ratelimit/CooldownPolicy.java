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

import me.golemcore.proxy.domain.model.BandwidthUsage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bandwidth-tiered cooldown rule.
 *
 * <p>
 * Entries are kept sorted by threshold, highest first, with one entry per
 * threshold (the longest duration wins). {@link #apply(BandwidthUsage)}
 * returns the duration of the first entry whose threshold the current usage
 * has reached.
 *
 * <pre>{@code
 * CooldownPolicy policy = CooldownPolicy.parse("30:60, 60:75, 90:90");
 * policy.apply(new BandwidthUsage(80 * 1024, "MB")); // 60
 * }</pre>
 *
 * @since 1.0
 */
public final class CooldownPolicy {

    private final List<Cooldown> cooldowns;

    private CooldownPolicy(List<Cooldown> cooldowns) {
        this.cooldowns = List.copyOf(cooldowns);
    }

    public static CooldownPolicy parse(String policy) {
        String text = policy != null ? policy.replace(" ", "") : "";

        List<Cooldown> parsed = new ArrayList<>();
        for (String step : text.split(",", -1)) {
            parsed.add(Cooldown.parse(step));
        }
        parsed.sort(Comparator.comparingLong(Cooldown::bandwidthGib).reversed());

        Map<Long, Cooldown> byThreshold = new LinkedHashMap<>();
        for (Cooldown cooldown : parsed) {
            byThreshold.merge(cooldown.bandwidthGib(), cooldown,
                    (a, b) -> a.durationSeconds() >= b.durationSeconds() ? a : b);
        }
        return new CooldownPolicy(new ArrayList<>(byThreshold.values()));
    }

    public long apply(BandwidthUsage usage) {
        if (usage == null || !usage.isAvailable()) {
            return 0;
        }
        long gibibytes = usage.gibibytes();
        for (Cooldown cooldown : cooldowns) {
            if (cooldown.bandwidthGib() <= gibibytes) {
                return cooldown.durationSeconds();
            }
        }
        return 0;
    }

    public List<Cooldown> getCooldowns() {
        return cooldowns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CooldownPolicy)) {
            return false;
        }
        return cooldowns.equals(((CooldownPolicy) o).cooldowns);
    }

    @Override
    public int hashCode() {
        return cooldowns.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Cooldown cooldown : cooldowns) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(cooldown.durationSeconds()).append(':').append(cooldown.bandwidthGib());
        }
        return sb.toString();
    }
}
