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

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a chat message into {@code //directives} and residual content.
 *
 * <p>
 * Tokens are, in priority order: runs of {@code /}, runs of word characters,
 * runs of whitespace, any other single character. A directive starts when the
 * previous token begins with {@code //} and the current token is a registered
 * name; the marker is dropped from the content. A directive that takes an
 * argument skips whitespace and consumes the next alphanumeric token. Any
 * other token stops argument collection and is kept as plain text, so a
 * malformed directive degrades to content instead of failing the message.
 *
 * <pre>{@code
 * parse("//banner Lorem //banner") // two banner directives, content "Lorem"
 * }</pre>
 */
@Component
@RequiredArgsConstructor
public class CommandParser {

    private static final String MARKER = "//";
    private static final Pattern TOKEN = Pattern.compile("/+|\\w+|\\s+|.",
            Pattern.UNICODE_CHARACTER_CLASS | Pattern.DOTALL);
    private static final Pattern MULTI_SPACE = Pattern.compile(" +");

    private final CommandRegistry registry;

    public ParsedMessage parse(String message) {
        String text = message != null ? message.strip() : "";

        if (!text.contains(MARKER)) {
            return new ParsedMessage(List.of(), collapseSpaces(text));
        }

        List<ParsedCommand> commands = new ArrayList<>();
        List<String> content = new ArrayList<>();

        ProxyCommand pending = null;
        String pendingName = null;
        StringBuilder pendingArgs = new StringBuilder();
        int argsLeft = 0;
        String previous = "";

        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            String token = matcher.group();

            if (argsLeft == 0) {
                ProxyCommand command = previous.startsWith(MARKER) ? registry.find(token) : null;
                if (command != null) {
                    flush(commands, pending, pendingName, pendingArgs);
                    pending = command;
                    pendingName = command.getName();
                    pendingArgs = new StringBuilder();
                    argsLeft = command.getArity();
                    content.remove(content.size() - 1);
                } else {
                    content.add(token);
                }
            } else if (isWhitespace(token)) {
                continue;
            } else if (isAlphanumeric(token)) {
                argsLeft--;
                pendingArgs.append(token);
            } else {
                argsLeft = 0;
                content.add(token);
            }

            previous = token;
        }
        flush(commands, pending, pendingName, pendingArgs);

        return new ParsedMessage(List.copyOf(commands), collapseSpaces(String.join("", content).strip()));
    }

    static String collapseSpaces(String text) {
        return MULTI_SPACE.matcher(text).replaceAll(" ");
    }

    private static void flush(List<ParsedCommand> commands, ProxyCommand command, String name, StringBuilder args) {
        if (command != null) {
            commands.add(new ParsedCommand(name, args.toString(), command));
        }
    }

    private static boolean isWhitespace(String token) {
        return token.codePoints().allMatch(cp -> Character.isWhitespace(cp) || Character.isSpaceChar(cp));
    }

    private static boolean isAlphanumeric(String token) {
        return token.codePoints().allMatch(Character::isLetterOrDigit);
    }
}
