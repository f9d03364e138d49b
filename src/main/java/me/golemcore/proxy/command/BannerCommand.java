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

import java.util.regex.Pattern;

/**
 * {@code //banner}: shows the current banner regardless of the quiet URL and
 * marks it as seen.
 */
public class BannerCommand implements ProxyCommand {

    private final PromptLibrary prompts;

    public BannerCommand(PromptLibrary prompts) {
        this.prompts = prompts;
    }

    @Override
    public String getName() {
        return "banner";
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
        context.user().markBannerSeen(prompts.getBannerVersion());
        return CommandOutcome.earlyExit(prompts.getBanner() + "\n***");
    }
}
