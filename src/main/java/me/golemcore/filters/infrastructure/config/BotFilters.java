package me.golemcore.filters.infrastructure.config;

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

import me.golemcore.filters.domain.filter.CommandFilter;
import me.golemcore.filters.domain.filter.Filters;
import me.golemcore.filters.port.inbound.UpdateFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Builds filters from {@link UpdateFilterProperties}.
 *
 * <p>
 * The access filter admits an update when:
 * <ul>
 * <li>the allowlist is empty, or the sender is on it</li>
 * <li>the sender is not blocked</li>
 * </ul>
 * With a non-empty allowlist, updates without a resolvable sender (inline
 * queries, channel posts) are rejected; with an empty one they pass.
 */
@RequiredArgsConstructor
@Slf4j
public class BotFilters {

    private final UpdateFilterProperties properties;

    public UpdateFilter access() {
        List<Long> allowed = nonNull(properties.getAllowedUsers());
        List<Long> blocked = nonNull(properties.getBlockedUsers());
        UpdateFilter allowlist = allowed.isEmpty()
                ? Filters.alwaysTrue()
                : Filters.whitelist(toArray(allowed));
        return Filters.and(allowlist, Filters.blacklist(toArray(blocked)));
    }

    public CommandFilter command(String name) {
        return commands(name);
    }

    public CommandFilter commands(String... names) {
        Objects.requireNonNull(names, "names");
        return new CommandFilter(properties.getCommandPrefix(), properties.getBotUsername(),
                Arrays.asList(names), properties.isIgnoreCommandCase());
    }

    void logSettings() {
        log.info("[Filters] bot=@{}, prefix='{}', ignoreCommandCase={}, allowed={}, blocked={}",
                properties.getBotUsername(), properties.getCommandPrefix(), properties.isIgnoreCommandCase(),
                nonNull(properties.getAllowedUsers()).size(), nonNull(properties.getBlockedUsers()).size());
    }

    private static List<Long> nonNull(List<Long> ids) {
        return ids != null ? ids : List.of();
    }

    private static long[] toArray(List<Long> ids) {
        return ids.stream()
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .toArray();
    }
}
