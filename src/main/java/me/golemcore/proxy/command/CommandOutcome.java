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

/**
 * Result of executing one directive.
 *
 * <ul>
 * <li>{@link Kind#APPLIED} - the directive ran; an optional note may
 * follow</li>
 * <li>{@link Kind#RECOVERED} - user-correctable error, reported inline, the
 * remaining directives still run</li>
 * <li>{@link Kind#EARLY_EXIT} - stop processing and answer with the message
 * instead of generating</li>
 * </ul>
 */
public record CommandOutcome(Kind kind, String message) {

    public enum Kind {
        APPLIED, RECOVERED, EARLY_EXIT
    }

    public static CommandOutcome applied(String note) {
        return new CommandOutcome(Kind.APPLIED, note);
    }

    public static CommandOutcome recovered(String error) {
        return new CommandOutcome(Kind.RECOVERED, error);
    }

    public static CommandOutcome earlyExit(String message) {
        return new CommandOutcome(Kind.EARLY_EXIT, message);
    }
}
