package me.golemcore.filters.adapter.inbound.telegram;

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

import me.golemcore.filters.domain.routing.UpdateRouter;
import me.golemcore.filters.domain.service.UpdateExtractor;
import me.golemcore.filters.port.inbound.UpdateFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.objects.Update;

/**
 * Long-polling consumer that gates updates through an access filter and hands
 * the rest to an {@link UpdateRouter}.
 *
 * <p>
 * Register it with a {@code TelegramBotsLongPollingApplication} under the bot
 * token. Handler failures are logged here so the polling loop keeps running.
 * Batches passed to {@code consume(List)} are processed one update at a time on
 * the single worker thread of telegrambots, not on the caller's thread.
 */
@RequiredArgsConstructor
@Slf4j
public class FilteringUpdateConsumer implements LongPollingSingleThreadUpdateConsumer {

    private final UpdateFilter accessFilter;
    private final UpdateRouter router;

    @Override
    public void consume(Update update) {
        if (!accessFilter.check(update)) {
            log.debug("[Telegram] Dropped update {} from sender {}", updateId(update),
                    UpdateExtractor.extractSenderId(update));
            return;
        }
        try {
            router.route(update);
        } catch (UpdateRouter.UpdateHandlingException e) {
            log.error("[Telegram] Failed to handle update {} on route '{}'", updateId(update),
                    e.getRouteName(), e);
        }
    }

    private static Integer updateId(Update update) {
        return update != null ? update.getUpdateId() : null;
    }
}
