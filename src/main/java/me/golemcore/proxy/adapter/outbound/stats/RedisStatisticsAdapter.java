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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.port.outbound.StatisticsPort;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Statistics kept in Redis hashes, one hash per time bucket. Counting is
 * best effort: Redis failures are logged and never reach the request.
 */
@Slf4j
public class RedisStatisticsAdapter implements StatisticsPort {

    private final JedisPooled jedis;
    private final StatsBuckets buckets;

    public RedisStatisticsAdapter(JedisPooled jedis, StatsBuckets buckets) {
        this.jedis = jedis;
        this.buckets = buckets;
    }

    @Override
    public void track(String key) {
        String bucket = buckets.current();
        try {
            for (String prefix : StatsBuckets.prefixes(key)) {
                jedis.hincrBy(bucket, prefix, 1);
            }
            jedis.expire(bucket, buckets.getLifespanSeconds());
        } catch (JedisException e) {
            log.warn("[Stats] Failed to track {}: {}", key, e.getMessage());
        }
    }

    @Override
    public List<Bucket> query() {
        List<Bucket> result = new ArrayList<>();
        try {
            for (String name : buckets.recent()) {
                Map<String, String> raw = jedis.hgetAll(name);
                if (raw == null || raw.isEmpty()) {
                    continue;
                }
                Map<String, Long> parsed = new TreeMap<>();
                for (Map.Entry<String, String> entry : raw.entrySet()) {
                    parsed.put(entry.getKey(), parseCount(entry.getValue()));
                }
                result.add(new Bucket(name, Collections.unmodifiableMap(parsed)));
            }
        } catch (JedisException e) {
            log.warn("[Stats] Failed to query statistics: {}", e.getMessage());
            return List.of();
        }
        Collections.reverse(result);
        return result;
    }

    private static long parseCount(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
