package me.golemcore.filters.domain.filter;

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

import me.golemcore.filters.domain.model.UpdatePayload;
import me.golemcore.filters.domain.model.UpdatePayload.MessagePayload;
import me.golemcore.filters.domain.service.UpdateExtractor;
import me.golemcore.filters.port.inbound.UpdateFilter;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Matches message-kind updates that invoke one of a set of bot commands.
 *
 * <p>
 * Configured names are normalized once to {@code lower(prefix + name)}. A
 * message matches a command {@code /start} for bot {@code @mybot} when its text
 * (or caption) is one of:
 * <ul>
 * <li>{@code /start}</li>
 * <li>{@code /start@mybot}</li>
 * <li>{@code /start <anything>}</li>
 * <li>{@code /start@mybot <anything>}</li>
 * </ul>
 *
 * <p>
 * With {@code ignoreCase} the head of the incoming text is compared with each
 * form ignoring case, so {@code /Start} and {@code /start@MyBot} match too.
 * Without it the incoming text is compared as-is against the lower-cased
 * commands. Prefixes and names may contain spaces.
 *
 * <p>
 * Callback queries, inline queries and other kinds never match.
 */
@Slf4j
public final class CommandFilter implements UpdateFilter {

    private static final String MENTION_PREFIX = "@";
    private static final char ARGUMENT_SEPARATOR = ' ';

    @Getter
    private final Set<String> commands;
    @Getter
    private final String botMention;
    @Getter
    private final boolean ignoreCase;

    /**
     * @param prefix
     *            command prefix, usually {@code /}
     * @param botUsername
     *            bot username with or without {@code @}; {@code null} or blank
     *            disables the mention form
     * @param names
     *            command names without prefix; the collection is copied and
     *            never modified
     * @param ignoreCase
     *            whether the incoming text is compared ignoring case
     */
    public CommandFilter(String prefix, String botUsername, Collection<String> names, boolean ignoreCase) {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(names, "names");
        if (prefix.isBlank()) {
            throw new IllegalArgumentException("Command prefix must not be blank");
        }

        Set<String> normalized = new LinkedHashSet<>();
        for (String name : names) {
            Objects.requireNonNull(name, "command name");
            normalized.add((prefix + name).toLowerCase(Locale.ROOT));
        }
        this.commands = Collections.unmodifiableSet(normalized);
        this.botMention = normalizeMention(botUsername, ignoreCase);
        this.ignoreCase = ignoreCase;
        log.debug("[Filters] Command filter: commands={}, mention={}, ignoreCase={}",
                commands, botMention, ignoreCase);
    }

    @Override
    public boolean check(Update update) {
        UpdatePayload payload = UpdateExtractor.extract(update);
        if (payload instanceof MessagePayload messagePayload) {
            return matches(UpdateExtractor.messageText(messagePayload.message()));
        }
        return false;
    }

    /**
     * Tests raw message text against the configured commands.
     */
    public boolean matches(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (String command : commands) {
            if (invokes(text, command)) {
                return true;
            }
            if (!botMention.isEmpty() && invokes(text, command + botMention)) {
                return true;
            }
        }
        return false;
    }

    // text equals form, or starts with form followed by a space
    private boolean invokes(String text, String form) {
        int length = form.length();
        if (text.length() < length || !text.regionMatches(ignoreCase, 0, form, 0, length)) {
            return false;
        }
        return text.length() == length || text.charAt(length) == ARGUMENT_SEPARATOR;
    }

    private static String normalizeMention(String botUsername, boolean ignoreCase) {
        if (botUsername == null || botUsername.isBlank()) {
            return "";
        }
        String mention = botUsername.trim();
        if (!mention.startsWith(MENTION_PREFIX)) {
            mention = MENTION_PREFIX + mention;
        }
        return ignoreCase ? mention.toLowerCase(Locale.ROOT) : mention;
    }
}
