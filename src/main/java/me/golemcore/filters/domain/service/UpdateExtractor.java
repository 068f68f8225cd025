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

import me.golemcore.filters.domain.model.UpdateKind;
import me.golemcore.filters.domain.model.UpdatePayload;
import me.golemcore.filters.domain.model.UpdatePayload.CallbackQueryPayload;
import me.golemcore.filters.domain.model.UpdatePayload.InlineQueryPayload;
import me.golemcore.filters.domain.model.UpdatePayload.MessagePayload;
import me.golemcore.filters.domain.model.UpdatePayload.OtherPayload;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.message.Message;

import java.util.OptionalLong;

/**
 * Resolves the payload, text and sender of a Telegram update.
 *
 * <p>
 * None of these methods throws: a missing payload, text or sender yields
 * {@link UpdatePayload#EMPTY}, an empty string or an empty
 * {@link OptionalLong}, so filters built on top degrade to "no match".
 */
public final class UpdateExtractor {

    private UpdateExtractor() {
    }

    /**
     * Returns the single populated payload of the update.
     */
    public static UpdatePayload extract(Update update) {
        if (update == null) {
            return UpdatePayload.EMPTY;
        }
        if (update.getMessage() != null) {
            return new MessagePayload(UpdateKind.MESSAGE, update.getMessage());
        }
        if (update.getEditedMessage() != null) {
            return new MessagePayload(UpdateKind.EDITED_MESSAGE, update.getEditedMessage());
        }
        if (update.getChannelPost() != null) {
            return new MessagePayload(UpdateKind.CHANNEL_POST, update.getChannelPost());
        }
        if (update.getEditedChannelPost() != null) {
            return new MessagePayload(UpdateKind.EDITED_CHANNEL_POST, update.getEditedChannelPost());
        }
        if (update.getBusinessMessage() != null) {
            return new MessagePayload(UpdateKind.BUSINESS_MESSAGE, update.getBusinessMessage());
        }
        if (update.getEditedBuinessMessage() != null) {
            return new MessagePayload(UpdateKind.EDITED_BUSINESS_MESSAGE, update.getEditedBuinessMessage());
        }
        if (update.getCallbackQuery() != null) {
            return new CallbackQueryPayload(update.getCallbackQuery());
        }
        if (update.getInlineQuery() != null) {
            return new InlineQueryPayload(update.getInlineQuery());
        }
        if (update.getChosenInlineQuery() != null) {
            return new OtherPayload(UpdateKind.CHOSEN_INLINE_RESULT, update.getChosenInlineQuery());
        }
        if (update.getShippingQuery() != null) {
            return new OtherPayload(UpdateKind.SHIPPING_QUERY, update.getShippingQuery());
        }
        if (update.getPreCheckoutQuery() != null) {
            return new OtherPayload(UpdateKind.PRE_CHECKOUT_QUERY, update.getPreCheckoutQuery());
        }
        if (update.getPoll() != null) {
            return new OtherPayload(UpdateKind.POLL, update.getPoll());
        }
        if (update.getPollAnswer() != null) {
            return new OtherPayload(UpdateKind.POLL_ANSWER, update.getPollAnswer());
        }
        if (update.getMyChatMember() != null) {
            return new OtherPayload(UpdateKind.MY_CHAT_MEMBER, update.getMyChatMember());
        }
        if (update.getChatMember() != null) {
            return new OtherPayload(UpdateKind.CHAT_MEMBER, update.getChatMember());
        }
        if (update.getChatJoinRequest() != null) {
            return new OtherPayload(UpdateKind.CHAT_JOIN_REQUEST, update.getChatJoinRequest());
        }
        if (update.getMessageReaction() != null) {
            return new OtherPayload(UpdateKind.MESSAGE_REACTION, update.getMessageReaction());
        }
        if (update.getMessageReactionCount() != null) {
            return new OtherPayload(UpdateKind.MESSAGE_REACTION_COUNT, update.getMessageReactionCount());
        }
        if (update.getChatBoost() != null) {
            return new OtherPayload(UpdateKind.CHAT_BOOST, update.getChatBoost());
        }
        if (update.getRemovedChatBoost() != null) {
            return new OtherPayload(UpdateKind.REMOVED_CHAT_BOOST, update.getRemovedChatBoost());
        }
        if (update.getBusinessConnection() != null) {
            return new OtherPayload(UpdateKind.BUSINESS_CONNECTION, update.getBusinessConnection());
        }
        if (update.getDeletedBusinessMessages() != null) {
            return new OtherPayload(UpdateKind.DELETED_BUSINESS_MESSAGES, update.getDeletedBusinessMessages());
        }
        return UpdatePayload.EMPTY;
    }

    /**
     * Returns the text associated with the update: message text (or caption),
     * callback data or inline query. Empty string for every other kind.
     */
    public static String extractText(Update update) {
        UpdatePayload payload = extract(update);
        if (payload instanceof MessagePayload messagePayload) {
            return messageText(messagePayload.message());
        }
        if (payload instanceof CallbackQueryPayload callbackPayload) {
            return nullToEmpty(callbackPayload.callbackQuery().getData());
        }
        if (payload instanceof InlineQueryPayload inlinePayload) {
            return nullToEmpty(inlinePayload.inlineQuery().getQuery());
        }
        return "";
    }

    /**
     * Returns the id of the user who sent a message or pressed a callback
     * button. Empty for other kinds and for messages without a sender (e.g.
     * channel posts).
     */
    public static OptionalLong extractSenderId(Update update) {
        UpdatePayload payload = extract(update);
        User from = null;
        if (payload instanceof MessagePayload messagePayload) {
            from = messagePayload.message().getFrom();
        } else if (payload instanceof CallbackQueryPayload callbackPayload) {
            CallbackQuery callbackQuery = callbackPayload.callbackQuery();
            from = callbackQuery.getFrom();
        }
        if (from == null || from.getId() == null) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(from.getId());
    }

    /**
     * Message text if non-empty, otherwise caption, otherwise empty string.
     */
    public static String messageText(Message message) {
        if (message == null) {
            return "";
        }
        String text = message.getText();
        if (text != null && !text.isEmpty()) {
            return text;
        }
        return nullToEmpty(message.getCaption());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
