package me.golemcore.proxy.domain.model;

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

import lombok.Getter;

/**
 * Features that can be switched with an {@code off|on|this} directive.
 */
@Getter
public enum ProxyFeature {

    ADVSETTINGS("advsettings", "Advanced generation settings", "enabled", "disabled"),
    NOBOT("nobot", "Bot description", "omitted", "kept"),
    OOCTRICK("ooctrick", "OOC Trick", "enabled", "disabled"),
    PREFILL("prefill", "Prefill", "enabled", "disabled"),
    SEARCH("search", "Google Search", "enabled", "disabled"),
    THINK("think", "Thinking", "enabled", "disabled");

    private final String commandName;
    private final String label;
    private final String onWord;
    private final String offWord;

    ProxyFeature(String commandName, String label, String onWord, String offWord) {
        this.commandName = commandName;
        this.label = label;
        this.onWord = onWord;
        this.offWord = offWord;
    }

    public String getSettingKey() {
        return "use_" + commandName;
    }

    public String describe(boolean enabled) {
        return label + " " + (enabled ? onWord : offWord);
    }
}
