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

import me.golemcore.proxy.domain.service.PromptLibrary;

import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@code //preset <name>}: adds a named writing guideline to this message.
 */
public class PresetCommand implements ProxyCommand {

    private static final Pattern ARGUMENT = Pattern.compile("[A-Za-z]+");

    private final PromptLibrary prompts;

    public PresetCommand(PromptLibrary prompts) {
        this.prompts = prompts;
    }

    @Override
    public String getName() {
        return "preset";
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
        Map<String, String> presets = prompts.getPresets();
        String preset = presets.get(args);
        if (preset == null) {
            String available = presets.keySet().stream()
                    .map(name -> "`" + name + "`")
                    .collect(Collectors.joining(", "));
            return CommandOutcome.recovered("\"`" + args + "`\" is not a valid preset. Available presets: " + available);
        }
        context.request().setPreset(preset);
        return CommandOutcome.applied("Added preset \"`" + args + "`\" to this message.");
    }
}
