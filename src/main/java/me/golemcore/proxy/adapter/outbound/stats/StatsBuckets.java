package me.golemcore.proxy.adapter.outbound.stats;

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

import me.golemcore.proxy.infrastructure.config.ProxyProperties;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Half-hour (by default) bucket naming shared by the statistics backends.
 * Bucket names look like {@code :stats:2025-01-31T12:30} in UTC.
 */
public class StatsBuckets {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm")
            .withZone(ZoneOffset.UTC);
    static final String PREFIX = ":stats:";

    private final Clock clock;
    private final int count;
    private final long intervalSeconds;
    private final long lifespanSeconds;

    public StatsBuckets(Clock clock, ProxyProperties.StatsProperties properties) {
        this.clock = clock;
        this.count = properties.getBucketCount();
        this.intervalSeconds = properties.getBucketIntervalSeconds();
        this.lifespanSeconds = properties.getBucketLifespanSeconds();
    }

    public String current() {
        return name(floor(clock.instant().getEpochSecond()));
    }

    /**
     * Names of the tracked buckets, newest first.
     */
    public List<String> recent() {
        long start = floor(clock.instant().getEpochSecond());
        List<String> names = new ArrayList<>(count);
        for (int delta = 0; delta < count; delta++) {
            names.add(name(start - delta * intervalSeconds));
        }
        return names;
    }

    public long getLifespanSeconds() {
        return lifespanSeconds;
    }

    /**
     * A key and every dotted prefix of it: {@code a.b.c} gives
     * {@code a}, {@code a.b}, {@code a.b.c}.
     */
    public static List<String> prefixes(String key) {
        List<String> result = new ArrayList<>();
        int dot = key.indexOf('.');
        while (dot >= 0) {
            result.add(key.substring(0, dot));
            dot = key.indexOf('.', dot + 1);
        }
        result.add(key);
        return result;
    }

    private long floor(long epochSeconds) {
        return (epochSeconds / intervalSeconds) * intervalSeconds;
    }

    private static String name(long epochSeconds) {
        return PREFIX + FORMAT.format(Instant.ofEpochSecond(epochSeconds));
    }
}
