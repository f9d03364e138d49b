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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local statistics for development deployments. Buckets that fall
 * out of the tracked window are dropped on the next write.
 */
@Slf4j
public class InMemoryStatisticsAdapter implements StatisticsPort {

    private final StatsBuckets buckets;
    private final Map<String, Map<String, AtomicLong>> counters = new ConcurrentHashMap<>();

    public InMemoryStatisticsAdapter(StatsBuckets buckets) {
        this.buckets = buckets;
    }

    @Override
    public void track(String key) {
        String bucket = buckets.current();
        Map<String, AtomicLong> bucketCounters = counters.computeIfAbsent(bucket, b -> new ConcurrentHashMap<>());
        for (String prefix : StatsBuckets.prefixes(key)) {
            bucketCounters.computeIfAbsent(prefix, p -> new AtomicLong()).incrementAndGet();
        }
        prune();
    }

    @Override
    public List<Bucket> query() {
        List<Bucket> result = new ArrayList<>();
        for (String name : buckets.recent()) {
            Map<String, AtomicLong> bucketCounters = counters.get(name);
            if (bucketCounters == null || bucketCounters.isEmpty()) {
                continue;
            }
            Map<String, Long> snapshot = new TreeMap<>();
            bucketCounters.forEach((key, value) -> snapshot.put(key, value.get()));
            result.add(new Bucket(name, Collections.unmodifiableMap(snapshot)));
        }
        Collections.reverse(result);
        return result;
    }

    private void prune() {
        Set<String> live = new HashSet<>(buckets.recent());
        counters.keySet().removeIf(name -> !live.contains(name));
    }
}
