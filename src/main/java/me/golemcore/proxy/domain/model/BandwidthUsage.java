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

/**
 * Hosting bandwidth consumed this month, in MiB. Negative means unknown.
 */
public record BandwidthUsage(long mebibytes, String unit) {

    private static final long MIB_PER_GIB = 1024;

    public static BandwidthUsage unavailable() {
        return new BandwidthUsage(-1, null);
    }

    public boolean isAvailable() {
        return mebibytes >= 0;
    }

    public long gibibytes() {
        return mebibytes / MIB_PER_GIB;
    }
}
