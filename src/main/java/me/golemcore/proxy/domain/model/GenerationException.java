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

import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Typed upstream failure: HTTP code, machine status name (e.g.
 * {@code RESOURCE_EXHAUSTED}), message and structured details.
 */
@Getter
public class GenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int code;
    private final String status;
    private final transient List<Map<String, Object>> details;

    public GenerationException(int code, String status, String message, List<Map<String, Object>> details) {
        super(message);
        this.code = code;
        this.status = status;
        this.details = details != null ? details : List.of();
    }

    public boolean isServerError() {
        return code >= 500;
    }

    @Override
    public String toString() {
        return "GenerationException{code=" + code + ", status=" + status + ", message=" + getMessage() + "}";
    }
}
