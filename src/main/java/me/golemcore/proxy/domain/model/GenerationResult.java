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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Successful (2xx) upstream answer in provider-neutral form.
 *
 * <p>
 * A successful answer may still carry no visible text, in which case the
 * block/finish reasons explain the content rejection.
 *
 * @since 1.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationResult {

    @Builder.Default
    private List<Part> parts = new ArrayList<>();
    private int candidateCount;
    private String finishReason;
    private String blockReason;
    private String blockReasonMessage;
    private TokenUsage usage;
    @Builder.Default
    private List<String> searchQueries = new ArrayList<>();
    @Builder.Default
    private List<String> links = new ArrayList<>();
    private boolean grounded;

    /**
     * Concatenation of all non-reasoning text parts.
     */
    public String visibleText() {
        StringBuilder sb = new StringBuilder();
        for (Part part : parts) {
            if (part.text() != null && !part.thought()) {
                sb.append(part.text());
            }
        }
        return sb.toString();
    }

    /**
     * Candidate text part; {@code thought} marks internal reasoning.
     */
    public record Part(String text, boolean thought) {
    }
}
