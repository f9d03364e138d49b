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

import java.util.regex.Pattern;

/**
 * {@code //<feature> off|on|this}.
 *
 * <p>
 * {@code this} enables the feature for the current message only. {@code on}
 * and {@code off} change both the current message and the persisted record.
 */
public class ToggleCommand implements ProxyCommand {

    public static final String THIS = "this";
    public static final String ON = "on";

    private static final Pattern ARGUMENT = Pattern.compile("off|on|this");

    private final ProxyFeature feature;

    public ToggleCommand(ProxyFeature feature) {
        this.feature = feature;
    }

    @Override
    public String getName() {
        return feature.getCommandName();
    }

    @Override
    public CommandShape getShape() {
        return CommandShape.TOGGLE;
    }

    @Override
    public Pattern getArgumentPattern() {
        return ARGUMENT;
    }

    @Override
    public CommandOutcome execute(String args, CommandContext context) {
        boolean oneShot = THIS.equals(args);
        boolean enabled = oneShot || ON.equals(args);

        context.request().setRequestEnabled(feature, enabled);
        if (!oneShot) {
            context.user().setEnabled(feature, enabled);
        }

        return CommandOutcome.applied(feature.describe(enabled)
                + (oneShot ? " (for this message only)." : "."));
    }
}
