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

import me.golemcore.proxy.domain.model.ProxyFeature;
import me.golemcore.proxy.domain.service.PromptLibrary;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Static table of the available directives, built once at startup. Each
 * directive is checked against its {@link CommandShape} on registration.
 */
@Component
public class CommandRegistry {

    private final Map<String, ProxyCommand> commands;

    public CommandRegistry(PromptLibrary prompts) {
        Map<String, ProxyCommand> table = new LinkedHashMap<>();
        register(table, new AboutMeCommand());
        register(table, new BannerCommand(prompts));
        register(table, new PresetCommand(prompts));
        for (ProxyFeature feature : ProxyFeature.values()) {
            register(table, new ToggleCommand(feature));
        }
        register(table, new ThinkTextCommand());
        this.commands = Collections.unmodifiableMap(table);
    }

    public ProxyCommand find(String name) {
        return commands.get(name.toLowerCase(Locale.ROOT));
    }

    private static void register(Map<String, ProxyCommand> table, ProxyCommand command) {
        validate(command);
        ProxyCommand previous = table.put(command.getName(), command);
        if (previous != null) {
            throw new IllegalStateException("Duplicate command: " + command.getName());
        }
    }

    /**
     * Informational directives take no argument; toggles and parameterized
     * directives take exactly one.
     */
    static void validate(ProxyCommand command) {
        boolean takesArgument = command.getArgumentPattern() != null;
        boolean expectsArgument = command.getShape() != CommandShape.INFORMATIONAL;
        if (takesArgument != expectsArgument) {
            throw new IllegalStateException("Command //" + command.getName() + " of shape " + command.getShape()
                    + (expectsArgument ? " needs" : " must not have") + " an argument pattern");
        }
    }
}
