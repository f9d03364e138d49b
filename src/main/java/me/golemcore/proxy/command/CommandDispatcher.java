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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.model.ResponseAssembler;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Runs parsed directives in order against the request override and the
 * persisted record.
 *
 * <p>
 * A malformed argument or a {@link CommandOutcome.Kind#RECOVERED} outcome is
 * reported as inline proxy text and the loop continues. An
 * {@link CommandOutcome.Kind#EARLY_EXIT} outcome adds its message and stops:
 * the caller must skip generation.
 */
@Component
@Slf4j
public class CommandDispatcher {

    /**
     * @return true when generation must be skipped
     */
    public boolean dispatch(List<ParsedCommand> commands, CommandContext context, ResponseAssembler response) {
        for (ParsedCommand parsed : commands) {
            log.info("[Command] {} //{} {} ({})", context.user().getXuid().pretty(), parsed.name(), parsed.args(),
                    parsed.command().getShape());

            CommandOutcome outcome = execute(parsed, context);
            switch (outcome.kind()) {
            case APPLIED -> {
                if (outcome.message() != null && !outcome.message().isEmpty()) {
                    response.addProxyMessage(outcome.message());
                }
            }
            case RECOVERED -> {
                String message = "Error: " + outcome.message() + " (Command has been ignored.)";
                response.addProxyMessage(message);
                log.info("[Command] {} {}", context.user().getXuid().pretty(), message);
            }
            case EARLY_EXIT -> {
                response.addProxyMessage(outcome.message());
                return true;
            }
            }
        }
        return false;
    }

    CommandOutcome execute(ParsedCommand parsed, CommandContext context) {
        ProxyCommand command = parsed.command();
        Pattern pattern = command.getArgumentPattern();
        String args = parsed.args();

        if (pattern != null && !pattern.matcher(args).matches()) {
            if (args.isEmpty()) {
                return CommandOutcome.recovered(
                        "`//" + parsed.name() + "` requires an argument \"`" + pattern.pattern() + "`\".");
            }
            return CommandOutcome.recovered(
                    "`//" + parsed.name() + "` only accepts \"`" + pattern.pattern() + "`\", not \"`" + args + "`\".");
        }

        return command.execute(args, context);
    }
}
