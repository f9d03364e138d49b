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
import me.golemcore.proxy.domain.model.UserSettings;

import java.util.List;
import java.util.regex.Pattern;

/**
 * {@code //aboutme}: identity, usage and persisted toggles of the caller.
 */
public class AboutMeCommand implements ProxyCommand {

    private static final List<ProxyFeature> LISTED = List.of(
            ProxyFeature.NOBOT,
            ProxyFeature.OOCTRICK,
            ProxyFeature.PREFILL,
            ProxyFeature.THINK,
            ProxyFeature.SEARCH,
            ProxyFeature.ADVSETTINGS);

    @Override
    public String getName() {
        return "aboutme";
    }

    @Override
    public CommandShape getShape() {
        return CommandShape.INFORMATIONAL;
    }

    @Override
    public Pattern getArgumentPattern() {
        return null;
    }

    @Override
    public CommandOutcome execute(String args, CommandContext context) {
        UserSettings user = context.user();
        StringBuilder sb = new StringBuilder()
                .append("Your user ID on this proxy is `").append(user.getXuid().full()).append("`.")
                .append(" You were ").append(user.lastSeenMessage(context.nowEpochSeconds())).append('.')
                .append(" Your request counter is ").append(user.getRequestCounter()).append('.')
                .append(" Your settings are:");
        for (ProxyFeature feature : LISTED) {
            sb.append("\n- //").append(feature.getCommandName()).append(" is ")
                    .append(user.isEnabled(feature) ? "enabled" : "disabled");
        }
        sb.append("\n- //think_text is ").append(user.getThinkText());
        return CommandOutcome.earlyExit(sb.toString());
    }
}
