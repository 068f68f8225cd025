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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Update filter settings bound from {@code bot.filters.*}.
 *
 * <pre>
 * bot.filters.bot-username=mybot
 * bot.filters.command-prefix=/
 * bot.filters.ignore-command-case=true
 * bot.filters.allowed-users=111,222
 * bot.filters.blocked-users=333
 * </pre>
 *
 * <p>
 * An empty {@code allowed-users} list disables the allowlist; blocked users are
 * rejected either way.
 */
@ConfigurationProperties(prefix = "bot.filters")
@Data
public class UpdateFilterProperties {

    private String botUsername;
    private String commandPrefix = "/";
    private boolean ignoreCommandCase = true;
    private List<Long> allowedUsers = new ArrayList<>();
    private List<Long> blockedUsers = new ArrayList<>();
}
