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

import me.golemcore.filters.domain.model.UpdateKind;
import me.golemcore.filters.domain.service.CommandParser;
import me.golemcore.filters.domain.service.UpdateExtractor;
import me.golemcore.filters.port.inbound.UpdateFilter;
import lombok.extern.slf4j.Slf4j;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Factory methods for {@link UpdateFilter} instances.
 *
 * <p>
 * Text filters compare against {@link UpdateExtractor#extractText(Update)}:
 * the message text (or caption), the callback data or the inline query.
 * Sender filters use {@link UpdateExtractor#extractSenderId(Update)}, which
 * only resolves for messages and callback queries.
 *
 * <p>
 * Arguments are copied at construction, so the returned filters are immutable
 * and may be shared between threads. {@code null} arguments are rejected with
 * {@link NullPointerException}.
 */
@Slf4j
public final class Filters {

    private static final UpdateFilter ALWAYS_TRUE = update -> true;
    private static final UpdateFilter ALWAYS_FALSE = update -> false;

    private Filters() {
    }

    public static UpdateFilter of(Predicate<Update> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return predicate::test;
    }

    public static UpdateFilter alwaysTrue() {
        return ALWAYS_TRUE;
    }

    public static UpdateFilter alwaysFalse() {
        return ALWAYS_FALSE;
    }

    // ==================== COMBINATORS ====================

    /**
     * Passes when every filter passes, evaluated left to right and stopping at
     * the first failure. No filters means a pass.
     */
    public static UpdateFilter and(UpdateFilter... filters) {
        List<UpdateFilter> copy = copyFilters(filters);
        return update -> {
            for (UpdateFilter filter : copy) {
                if (!filter.check(update)) {
                    return false;
                }
            }
            return true;
        };
    }

    /**
     * Passes when any filter passes, evaluated left to right and stopping at
     * the first success. No filters means a failure.
     */
    public static UpdateFilter or(UpdateFilter... filters) {
        List<UpdateFilter> copy = copyFilters(filters);
        return update -> {
            for (UpdateFilter filter : copy) {
                if (filter.check(update)) {
                    return true;
                }
            }
            return false;
        };
    }

    public static UpdateFilter not(UpdateFilter filter) {
        Objects.requireNonNull(filter, "filter");
        return update -> !filter.check(update);
    }

    // ==================== TEXT ====================

    /**
     * Exact, case-sensitive match of the update text.
     */
    public static UpdateFilter text(String text) {
        Objects.requireNonNull(text, "text");
        return update -> text.equals(UpdateExtractor.extractText(update));
    }

    public static UpdateFilter texts(String... texts) {
        Objects.requireNonNull(texts, "texts");
        Set<String> candidates = Set.copyOf(Arrays.asList(texts));
        return update -> candidates.contains(UpdateExtractor.extractText(update));
    }

    public static UpdateFilter withPrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        return update -> UpdateExtractor.extractText(update).startsWith(prefix);
    }

    public static UpdateFilter withSuffix(String suffix) {
        Objects.requireNonNull(suffix, "suffix");
        return update -> UpdateExtractor.extractText(update).endsWith(suffix);
    }

    /**
     * Passes when the pattern is found anywhere in the update text.
     */
    public static UpdateFilter regex(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return update -> pattern.matcher(UpdateExtractor.extractText(update)).find();
    }

    public static UpdateFilter regex(String regex) {
        return regex(Pattern.compile(Objects.requireNonNull(regex, "regex")));
    }

    // ==================== SENDER ====================

    /**
     * Passes when the sender of a message or callback query is one of the
     * given ids. Updates without a resolvable sender never pass.
     */
    public static UpdateFilter whitelist(long... ids) {
        Objects.requireNonNull(ids, "ids");
        Set<Long> allowed = Arrays.stream(ids).boxed().collect(Collectors.toUnmodifiableSet());
        return update -> {
            OptionalLong senderId = UpdateExtractor.extractSenderId(update);
            if (senderId.isEmpty()) {
                return false;
            }
            boolean listed = allowed.contains(senderId.getAsLong());
            log.trace("[Filters] Sender {} listed={}", senderId.getAsLong(), listed);
            return listed;
        };
    }

    /**
     * Negation of {@link #whitelist(long...)}: updates without a resolvable
     * sender pass.
     */
    public static UpdateFilter blacklist(long... ids) {
        return not(whitelist(ids));
    }

    // ==================== KIND ====================

    public static UpdateFilter kinds(UpdateKind first, UpdateKind... rest) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(rest, "rest");
        Set<UpdateKind> accepted = EnumSet.of(first, rest);
        return update -> accepted.contains(UpdateExtractor.extract(update).kind());
    }

    // ==================== COMMANDS ====================

    public static UpdateFilter command(String name, String botUsername) {
        return commands(CommandParser.DEFAULT_PREFIX, botUsername, name);
    }

    /**
     * Matches messages invoking any of the commands, with or without the bot
     * mention, e.g. {@code /start}, {@code /start@mybot 42}. The incoming
     * command is compared case-insensitively.
     *
     * @see CommandFilter
     */
    public static CommandFilter commands(String prefix, String botUsername, String... names) {
        Objects.requireNonNull(names, "names");
        return new CommandFilter(prefix, botUsername, Arrays.asList(names), true);
    }

    private static List<UpdateFilter> copyFilters(UpdateFilter... filters) {
        Objects.requireNonNull(filters, "filters");
        return List.of(filters);
    }
}
