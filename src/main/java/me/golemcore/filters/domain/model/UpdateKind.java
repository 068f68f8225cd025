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

/**
 * Kind of payload carried by an update. Kinds reporting {@link #isMessage()}
 * all carry a Telegram message.
 */
public enum UpdateKind {

    MESSAGE(true),
    EDITED_MESSAGE(true),
    CHANNEL_POST(true),
    EDITED_CHANNEL_POST(true),
    BUSINESS_MESSAGE(true),
    EDITED_BUSINESS_MESSAGE(true),
    CALLBACK_QUERY(false),
    INLINE_QUERY(false),
    CHOSEN_INLINE_RESULT(false),
    SHIPPING_QUERY(false),
    PRE_CHECKOUT_QUERY(false),
    POLL(false),
    POLL_ANSWER(false),
    MY_CHAT_MEMBER(false),
    CHAT_MEMBER(false),
    CHAT_JOIN_REQUEST(false),
    MESSAGE_REACTION(false),
    MESSAGE_REACTION_COUNT(false),
    CHAT_BOOST(false),
    REMOVED_CHAT_BOOST(false),
    BUSINESS_CONNECTION(false),
    DELETED_BUSINESS_MESSAGES(false),
    NONE(false);

    private final boolean message;

    UpdateKind(boolean message) {
        this.message = message;
    }

    public boolean isMessage() {
        return message;
    }
}
