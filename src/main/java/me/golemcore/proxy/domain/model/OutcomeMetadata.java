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
 * Machine-readable side information of a classified generation outcome.
 *
 * @param apiKeyValid
 *            false when the upstream rejected the credential itself
 * @param rejectionFeedback
 *            block/finish reason tag of a content rejection, otherwise null
 * @param statsKey
 *            dotted statistics counter for this outcome
 */
public record OutcomeMetadata(boolean apiKeyValid, String rejectionFeedback, String statsKey) {

    public static OutcomeMetadata of(String statsKey) {
        return new OutcomeMetadata(true, null, statsKey);
    }

    public static OutcomeMetadata invalidApiKey(String statsKey) {
        return new OutcomeMetadata(false, null, statsKey);
    }

    public static OutcomeMetadata rejected(String feedback, String statsKey) {
        return new OutcomeMetadata(true, feedback, statsKey);
    }
}
