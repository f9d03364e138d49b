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

import me.golemcore.proxy.domain.model.UserSettings;

import java.util.regex.Pattern;

/**
 * {@code //think_text keep|remove}: whether the model's thinking stays in the
 * reply when {@code //think} is used. Persisted.
 */
public class ThinkTextCommand implements ProxyCommand {

    private static final Pattern ARGUMENT = Pattern.compile("keep|remove");

    @Override
    public String getName() {
        return "think_text";
    }

    @Override
    public CommandShape getShape() {
        return CommandShape.PARAMETERIZED;
    }

    @Override
    public Pattern getArgumentPattern() {
        return ARGUMENT;
    }

    @Override
    public CommandOutcome execute(String args, CommandContext context) {
        context.user().setThinkText(args);
        boolean keep = UserSettings.THINK_TEXT_KEEP.equals(args);
        return CommandOutcome.applied("Thinking text will be " + (keep ? "kept" : "removed") + ".");
    }
}
