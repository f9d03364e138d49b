package me.golemcore.proxy.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Post-processes replies generated with {@code //think}: removes the
 * {@code <think>} block and extracts the {@code <response>} block. Missing or
 * unbalanced tags are tolerated.
 */
@Component
@Slf4j
public class ThinkingTextProcessor {

    private static final String THINK_OPEN = "<think>";
    private static final String THINK_CLOSE = "</think>";
    private static final String RESPONSE_OPEN = "<response>";
    private static final String RESPONSE_CLOSE = "</response>";

    public String process(String text, boolean keepThinking) {
        String result = text;
        String thinking = null;

        int thinkOpen = result.indexOf(THINK_OPEN);
        int thinkClose = result.indexOf(THINK_CLOSE);
        if (thinkOpen == -1 && thinkClose == -1) {
            log.debug("[Think] No thinking tags found");
        } else if (thinkOpen > -1 && thinkOpen < thinkClose) {
            thinking = result.substring(thinkOpen + THINK_OPEN.length(), thinkClose);
            result = result.substring(0, thinkOpen) + result.substring(thinkClose + THINK_CLOSE.length());
        } else if (thinkClose > -1) {
            thinking = result.substring(0, thinkClose);
            result = result.substring(thinkClose + THINK_CLOSE.length());
        } else {
            log.debug("[Think] Unclosed thinking tag left in place");
        }

        int responseOpen = result.indexOf(RESPONSE_OPEN);
        int responseClose = result.indexOf(RESPONSE_CLOSE);
        if (responseOpen > -1 && responseOpen < responseClose) {
            result = result.substring(responseOpen + RESPONSE_OPEN.length(), responseClose);
        } else if (responseOpen > -1) {
            result = result.substring(responseOpen + RESPONSE_OPEN.length());
        } else if (responseClose > -1) {
            log.debug("[Think] Response close tag without open tag");
        }

        if (keepThinking && thinking != null) {
            result = THINK_OPEN + "\n" + thinking + "\n" + THINK_CLOSE + "\n" + result;
        }
        return result;
    }
}
