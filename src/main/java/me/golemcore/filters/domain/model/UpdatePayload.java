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

import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.inlinequery.InlineQuery;
import org.telegram.telegrambots.meta.api.objects.message.Message;

import java.util.Objects;

/**
 * The single populated payload of a Telegram update.
 *
 * <p>
 * Variants:
 * <ul>
 * <li>{@link MessagePayload} - message, edited message, channel post or edited
 * channel post</li>
 * <li>{@link CallbackQueryPayload} - inline keyboard callback</li>
 * <li>{@link InlineQueryPayload} - inline mode query</li>
 * <li>{@link OtherPayload} - any other populated kind, kept opaque</li>
 * <li>{@link EmptyPayload} - nothing populated</li>
 * </ul>
 */
public sealed interface UpdatePayload {

    UpdateKind kind();

    record MessagePayload(UpdateKind kind, Message message) implements UpdatePayload {
        public MessagePayload {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(message, "message");
            if (!kind.isMessage()) {
                throw new IllegalArgumentException("Not a message kind: " + kind);
            }
        }
    }

    record CallbackQueryPayload(CallbackQuery callbackQuery) implements UpdatePayload {
        public CallbackQueryPayload {
            Objects.requireNonNull(callbackQuery, "callbackQuery");
        }

        @Override
        public UpdateKind kind() {
            return UpdateKind.CALLBACK_QUERY;
        }
    }

    record InlineQueryPayload(InlineQuery inlineQuery) implements UpdatePayload {
        public InlineQueryPayload {
            Objects.requireNonNull(inlineQuery, "inlineQuery");
        }

        @Override
        public UpdateKind kind() {
            return UpdateKind.INLINE_QUERY;
        }
    }

    record OtherPayload(UpdateKind kind, Object value) implements UpdatePayload {
        public OtherPayload {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(value, "value");
        }
    }

    record EmptyPayload() implements UpdatePayload {
        @Override
        public UpdateKind kind() {
            return UpdateKind.NONE;
        }
    }

    EmptyPayload EMPTY = new EmptyPayload();
}
