package me.golemcore.proxy.command;

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

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans model-authored text before it is sent upstream again.
 *
 * <p>
 * Removes proxy-only spans ({@code <proxy>...</proxy>}, including the
 * zero-width framing added when rendering), then trims every line and
 * collapses runs of spaces. Markdown list lines keep their leading
 * indentation.
 */
@Component
public class MessageSanitizer {

    private static final Pattern PROXY_SPAN = Pattern.compile(
            "\u200B?<proxy>.*?</proxy>", Pattern.DOTALL);
    private static final Pattern MULTI_SPACE = Pattern.compile(" +");

    public String strip(String message) {
        if (message == null || message.isEmpty()) {
            return "";
        }

        String text = PROXY_SPAN.matcher(trimNewlines(message)).replaceAll("");

        List<String> result = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            int index = Math.max(line.indexOf('-'), line.indexOf('*'));
            if (index > 0 && line.substring(0, index).isBlank()) {
                String trimmed = line.stripTrailing();
                result.add(trimmed.substring(0, index) + collapse(trimmed.substring(index)));
            } else {
                result.add(collapse(line.strip()));
            }
        }
        return String.join("\n", result);
    }

    private static String trimNewlines(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == '\n') {
            start++;
        }
        while (end > start && text.charAt(end - 1) == '\n') {
            end--;
        }
        return text.substring(start, end);
    }

    private static String collapse(String text) {
        return MULTI_SPACE.matcher(text).replaceAll(" ");
    }
}
