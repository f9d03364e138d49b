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
 * Result of one generation attempt as seen by the chat pipeline: either the
 * reply text (plus optional grounding extras) or a classified failure.
 */
public record GenerationOutcome(String text, String extras, TokenUsage usage, ClassifiedOutcome failure) {

    public static GenerationOutcome success(String text, String extras, TokenUsage usage) {
        return new GenerationOutcome(text, extras, usage, null);
    }

    public static GenerationOutcome failure(ClassifiedOutcome failure) {
        return new GenerationOutcome(null, null, null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean hasExtras() {
        return extras != null && !extras.isEmpty();
    }
}
