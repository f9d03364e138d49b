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

import java.util.List;
import java.util.Map;

/**
 * Port for time-bucketed outcome counters. Failures never reach the caller.
 */
public interface StatisticsPort {

    /**
     * Increment a dotted key and each of its prefixes in the current bucket,
     * e.g. {@code g.failed.client} also counts {@code g.failed} and
     * {@code g}.
     */
    void track(String key);

    /**
     * Buckets of the tracked period, oldest first, empty buckets skipped.
     */
    List<Bucket> query();

    /**
     * Counters of one time bucket.
     */
    record Bucket(String name, Map<String, Long> counters) {
    }
}
