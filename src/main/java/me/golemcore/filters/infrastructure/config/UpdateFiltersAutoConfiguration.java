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

import me.golemcore.filters.adapter.inbound.telegram.FilteringUpdateConsumer;
import me.golemcore.filters.domain.routing.UpdateRouter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration for update filters and routing.
 *
 * <p>
 * Exposes:
 * <ul>
 * <li>{@link BotFilters} bound to {@code bot.filters.*}</li>
 * <li>an empty {@link UpdateRouter} for the application to fill</li>
 * <li>a {@link FilteringUpdateConsumer} gated by {@link BotFilters#access()}</li>
 * </ul>
 * Every bean backs off when the application defines its own. Registering the
 * consumer with a polling application is left to the application.
 */
@AutoConfiguration
@EnableConfigurationProperties(UpdateFilterProperties.class)
public class UpdateFiltersAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public BotFilters botFilters(UpdateFilterProperties properties) {
        BotFilters botFilters = new BotFilters(properties);
        botFilters.logSettings();
        return botFilters;
    }

    @Bean
    @ConditionalOnMissingBean
    public UpdateRouter updateRouter() {
        return new UpdateRouter();
    }

    @Bean
    @ConditionalOnMissingBean
    public FilteringUpdateConsumer filteringUpdateConsumer(BotFilters botFilters, UpdateRouter updateRouter) {
        return new FilteringUpdateConsumer(botFilters.access(), updateRouter);
    }
}
