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

import java.util.HashMap;
import java.util.Map;

/**
 * Raw settings record as read from a storage backend. {@code data} is always
 * a fresh mutable map; it is empty when {@code existed} is false.
 */
public record StoredRecord(Map<String, Object> data, boolean existed) {

    public static StoredRecord missing() {
        return new StoredRecord(new HashMap<>(), false);
    }

    public static StoredRecord found(Map<String, Object> data) {
        return new StoredRecord(new HashMap<>(data), true);
    }
}
