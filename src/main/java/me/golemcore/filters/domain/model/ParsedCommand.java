package me.golemcore.filters.domain.model;

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

import java.util.List;

/**
 * A bot command split out of message text, e.g. {@code /start@mybot 42 en}.
 *
 * @param name
 *            lower-cased command name without the prefix ({@code start})
 * @param mention
 *            addressed bot username without {@code @}, or {@code null}
 * @param rawArguments
 *            everything after the command token, trimmed ({@code 42 en})
 * @param args
 *            whitespace-separated arguments ({@code [42, en]})
 */
public record ParsedCommand(
        String name,
        String mention,
        String rawArguments,
        List<String> args
) {
    public ParsedCommand {
        args = List.copyOf(args);
    }

    public boolean hasMention() {
        return mention != null;
    }

    /**
     * Whether this command is addressed to the given bot, or to no bot at all.
     */
    public boolean isAddressedTo(String botUsername) {
        if (mention == null) {
            return true;
        }
        if (botUsername == null) {
            return false;
        }
        String normalized = botUsername.startsWith("@") ? botUsername.substring(1) : botUsername;
        return mention.equalsIgnoreCase(normalized);
    }
}
