package me.golemcore.proxy.domain.service;

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
import me.golemcore.proxy.domain.model.ClassifiedOutcome;
import me.golemcore.proxy.domain.model.GenerationException;
import me.golemcore.proxy.domain.model.GenerationResult;
import me.golemcore.proxy.domain.model.OutcomeMetadata;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Maps upstream failures to user-facing outcomes.
 *
 * <p>
 * The table is keyed on the machine status name, then for permission and
 * quota failures on the structured details ({@code ErrorInfo.reason},
 * {@code QuotaFailure.violations[].quotaId} prefix). Anything else passes the
 * upstream message through and is logged.
 */
@Component
@Slf4j
public class GenerationErrorClassifier {

    static final String ERROR_INFO_TYPE = "type.googleapis.com/google.rpc.ErrorInfo";
    static final String QUOTA_FAILURE_TYPE = "type.googleapis.com/google.rpc.QuotaFailure";

    private static final int STATUS_TOO_MANY_REQUESTS = 429;
    private static final int STATUS_BAD_GATEWAY = 502;
    private static final int STATUS_GATEWAY_TIMEOUT = 504;

    private static final String MAX_TOKENS = "MAX_TOKENS";
    private static final String MAX_TOKENS_HINT = "\nTry increasing \"Max tokens\" in your Generation Settings"
            + " or set it to zero to disable it.";
    private static final String WORKAROUND_HINT = "\nTry using: `//ooctrick on`, `//prefill on`, `//think on`";

    public ClassifiedOutcome classify(GenerationException e, String model) {
        String status = e.getStatus() != null ? e.getStatus() : "";
        String message = e.getMessage() != null ? e.getMessage() : "Unknown error";
        int code = e.getCode();

        switch (status) {
        case "NOT_FOUND":
            if (message.startsWith("models/")) {
                return outcome(code, "Invalid/unsupported model '" + model + "'", "g.failed.client.not_found.model");
            }
            log.warn("[Gemini] Unexpected NOT_FOUND: {}", e.toString());
            return outcome(code, message, "g.failed.client.not_found.unknown");

        case "INVALID_ARGUMENT":
            if (message.contains("API key not valid")) {
                return new ClassifiedOutcome(code, message,
                        OutcomeMetadata.invalidApiKey("g.failed.client.invalid.api_key"));
            }
            return outcome(code, message, "g.failed.client.invalid");

        case "PERMISSION_DENIED":
            for (Map<String, Object> detail : detailsOfType(e.getDetails(), ERROR_INFO_TYPE)) {
                Object reason = detail.get("reason");
                if ("SERVICE_DISABLED".equals(reason)) {
                    return outcome(code, "Generative Language API needs to be enabled",
                            "g.failed.client.denied.disabled");
                }
                if ("CONSUMER_SUSPENDED".equals(reason)) {
                    return outcome(code, "Customer suspended. You might be banned.",
                            "g.failed.client.denied.suspended");
                }
            }
            return outcome(code, message, "g.failed.client.denied.unknown");

        case "RESOURCE_EXHAUSTED":
            for (Map<String, Object> detail : detailsOfType(e.getDetails(), QUOTA_FAILURE_TYPE)) {
                Object violations = detail.get("violations");
                if (!(violations instanceof List<?>)) {
                    continue;
                }
                for (Object violation : (List<?>) violations) {
                    if (!(violation instanceof Map<?, ?>)) {
                        continue;
                    }
                    Object quotaId = ((Map<?, ?>) violation).get("quotaId");
                    String feedback = quotaId instanceof String ? quotaFeedback((String) quotaId) : null;
                    if (feedback != null) {
                        return outcome(STATUS_TOO_MANY_REQUESTS, feedback,
                                "g.failed.client.quota.violation." + quotaId);
                    }
                }
            }
            return outcome(code, message, "g.failed.client.quota.unknown");

        case "UNAVAILABLE":
            return outcome(code, message, "g.failed.server.overloaded");

        case "DEADLINE_EXCEEDED":
            return outcome(code, "Google AI timed out. Try again later.", "g.failed.server.time_out");

        case "INTERNAL":
            return outcome(code, "Google AI had an internal error. Try again later.", "g.failed.server.internal");

        default:
            log.warn("[Gemini] Unclassified upstream failure: {}", e.toString());
            return outcome(code, message, e.isServerError() ? "g.failed.server.unknown" : "g.failed.client.unknown");
        }
    }

    public ClassifiedOutcome timeout() {
        return outcome(STATUS_GATEWAY_TIMEOUT, "Gateway Timeout", "g.time_out");
    }

    public ClassifiedOutcome unexpected(Exception e) {
        log.error("[Gemini] Unhandled exception from upstream", e);
        return outcome(STATUS_BAD_GATEWAY, "Unhandled exception from Google AI.", "g.failed.unknown");
    }

    /**
     * Classify a 2xx answer without visible text.
     *
     * @param workaroundUsed
     *            whether ooctrick, prefill or think was active
     */
    public ClassifiedOutcome rejection(GenerationResult result, boolean workaroundUsed) {
        String feedback = rejectionFeedback(result);
        if (feedback == null) {
            log.warn("[Gemini] No result text and no feedback: {}", result);
            feedback = "UNKNOWN";
        }

        String message = "Response blocked/empty due to " + feedback + ".";
        if (MAX_TOKENS.equals(feedback)) {
            message += MAX_TOKENS_HINT;
        } else if (!workaroundUsed) {
            message += WORKAROUND_HINT;
        }
        return new ClassifiedOutcome(STATUS_BAD_GATEWAY, message,
                OutcomeMetadata.rejected(feedback, "g.rejected." + feedback));
    }

    static String quotaFeedback(String quotaId) {
        if (quotaId.startsWith("GenerateContentInputTokensPerModelPerMinute")
                || quotaId.startsWith("GenerateContentPaidTierInputTokensPerModelPerMinute")) {
            return "Input Tokens per Minute quota exceeded.";
        }
        if (quotaId.startsWith("GenerateContentInputTokensPerModelPerDay")) {
            return "Input Tokens per Day quota exceeded.";
        }
        if (quotaId.startsWith("GenerateRequestsPerMinutePerProjectPerModel")) {
            return "Requests per Minute quota exceeded.";
        }
        if (quotaId.startsWith("GenerateRequestsPerDayPerProjectPerModel")) {
            return "Requests per Day quota exceeded.";
        }
        return null;
    }

    private static String rejectionFeedback(GenerationResult result) {
        if (hasText(result.getBlockReasonMessage())) {
            return result.getBlockReasonMessage();
        }
        if (hasText(result.getBlockReason())) {
            return result.getBlockReason();
        }
        if (hasText(result.getFinishReason())) {
            return result.getFinishReason();
        }
        return null;
    }

    private static List<Map<String, Object>> detailsOfType(List<Map<String, Object>> details, String type) {
        return details.stream()
                .filter(detail -> type.equals(detail.get("@type")))
                .toList();
    }

    private static ClassifiedOutcome outcome(int status, String message, String statsKey) {
        return new ClassifiedOutcome(status, message, OutcomeMetadata.of(statsKey));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
