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

import java.util.regex.Pattern;

/**
 * Inline {@code //name [argument]} directive.
 *
 * <p>
 * Implementations never see a malformed argument: the dispatcher checks the
 * argument against {@link #getArgumentPattern()} first.
 */
public interface ProxyCommand {

    /**
     * Canonical lowercase name, without the leading {@code //}.
     */
    String getName();

    CommandShape getShape();

    /**
     * Full-match pattern of the argument, or {@code null} for directives
     * without one.
     */
    Pattern getArgumentPattern();

    /**
     * Number of argument tokens the parser collects after the name.
     */
    default int getArity() {
        return getArgumentPattern() != null ? 1 : 0;
    }

    CommandOutcome execute(String args, CommandContext context);
}
