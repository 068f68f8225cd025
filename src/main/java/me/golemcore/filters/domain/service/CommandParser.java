package me.golemcore.filters.domain.service;

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

import me.golemcore.filters.domain.model.ParsedCommand;
import me.golemcore.filters.domain.model.UpdatePayload;
import me.golemcore.filters.domain.model.UpdatePayload.MessagePayload;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Splits bot commands such as {@code /compact@mybot 10} into name, mention and
 * arguments.
 */
public final class CommandParser {

    public static final String DEFAULT_PREFIX = "/";

    private static final String MENTION_SEPARATOR = "@";
    private static final String WHITESPACE = "\\s+";

    private CommandParser() {
    }

    public static Optional<ParsedCommand> parse(String text) {
        return parse(text, DEFAULT_PREFIX);
    }

    public static Optional<ParsedCommand> parse(String text, String prefix) {
        if (text == null || prefix == null || prefix.isEmpty() || !text.startsWith(prefix)) {
            return Optional.empty();
        }

        String[] parts = text.split(WHITESPACE, 2);
        String token = parts[0].substring(prefix.length());
        String name = token;
        String mention = null;
        int at = token.indexOf(MENTION_SEPARATOR);
        if (at >= 0) {
            name = token.substring(0, at);
            mention = token.substring(at + 1);
            if (mention.isEmpty()) {
                mention = null;
            }
        }
        if (name.isEmpty()) {
            return Optional.empty();
        }

        String rawArguments = parts.length > 1 ? parts[1].trim() : "";
        List<String> args = rawArguments.isEmpty()
                ? List.of()
                : Arrays.asList(rawArguments.split(WHITESPACE));
        return Optional.of(new ParsedCommand(name.toLowerCase(Locale.ROOT), mention, rawArguments, args));
    }

    /**
     * Parses the text (or caption) of a message-kind update. Other kinds never
     * carry commands.
     */
    public static Optional<ParsedCommand> parse(Update update, String prefix) {
        UpdatePayload payload = UpdateExtractor.extract(update);
        if (payload instanceof MessagePayload messagePayload) {
            return parse(UpdateExtractor.messageText(messagePayload.message()), prefix);
        }
        return Optional.empty();
    }
}
