package me.golemcore.filters.domain.filter;

import me.golemcore.filters.port.inbound.UpdateFilter;
import me.golemcore.filters.testsupport.TestUpdates;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandFilterTest {

    private static final String BOT = "mybot";

    @ParameterizedTest
    @ValueSource(strings = { "/start", "/start@mybot", "/start 42", "/start@mybot 42" })
    void commandShouldMatchSupportedForms(String text) {
        assertTrue(Filters.command("start", BOT).check(TestUpdates.message(1L, text)));
    }

    @ParameterizedTest
    @ValueSource(strings = { "/started", "start", "/star", "/start@otherbot", "/start@mybotx", "", " /start" })
    void commandShouldRejectOtherTexts(String text) {
        assertFalse(Filters.command("start", BOT).check(TestUpdates.message(1L, text)));
    }

    @Test
    void shouldMatchCaptionWhenTextIsEmpty() {
        UpdateFilter filter = Filters.command("upload", BOT);

        assertTrue(filter.check(TestUpdates.messageWithCaption(1L, "", "/upload holiday")));
    }

    @Test
    void shouldMatchEditedMessages() {
        assertTrue(Filters.command("start", BOT).check(TestUpdates.editedMessage(1L, "/start")));
    }

    @Test
    void shouldMatchBusinessMessages() {
        assertTrue(Filters.command("start", BOT).check(TestUpdates.businessMessage(1L, "/start@mybot 42")));
    }

    @Test
    void shouldOnlyApplyToMessages() {
        UpdateFilter filter = Filters.command("start", BOT);

        assertFalse(filter.check(TestUpdates.callbackQuery(1L, "/start")));
        assertFalse(filter.check(TestUpdates.inlineQuery(1L, "/start")));
        assertFalse(filter.check(TestUpdates.empty()));
        assertFalse(filter.check(null));
    }

    @Test
    void shouldNormalizeWithoutMutatingCallerNames() {
        String[] names = { "Start", "HELP" };

        CommandFilter filter = Filters.commands("/", BOT, names);

        assertEquals(Set.of("/start", "/help"), filter.getCommands());
        assertArrayEquals(new String[] { "Start", "HELP" }, names);
        assertTrue(filter.check(TestUpdates.message(1L, "/start")));
        assertTrue(filter.check(TestUpdates.message(1L, "/help@mybot")));
    }

    @Test
    void shouldAcceptUsernameWithLeadingAt() {
        CommandFilter filter = Filters.commands("/", "@MyBot", "start");

        assertEquals("@mybot", filter.getBotMention());
        assertTrue(filter.check(TestUpdates.message(1L, "/start@mybot")));
    }

    @ParameterizedTest
    @ValueSource(strings = { "/START", "/Start@MyBot", "/sTaRt 42" })
    void shouldIgnoreCaseOfIncomingCommandByDefault(String text) {
        assertTrue(Filters.command("start", BOT).check(TestUpdates.message(1L, text)));
    }

    @Test
    void caseSensitiveFilterShouldRequireLowerCaseText() {
        CommandFilter filter = new CommandFilter("/", BOT, List.of("Start"), false);

        assertTrue(filter.check(TestUpdates.message(1L, "/start@mybot 1")));
        assertFalse(filter.check(TestUpdates.message(1L, "/Start")));
        assertFalse(filter.isIgnoreCase());
    }

    @Test
    void shouldSupportCustomPrefix() {
        CommandFilter filter = Filters.commands("!", BOT, "ban", "kick");

        assertTrue(filter.check(TestUpdates.message(1L, "!kick 42")));
        assertFalse(filter.check(TestUpdates.message(1L, "/kick 42")));
    }

    @Test
    void shouldMatchPrefixContainingSpace() {
        CommandFilter filter = Filters.commands("bot ", BOT, "start");

        assertTrue(filter.check(TestUpdates.message(1L, "bot start")));
        assertTrue(filter.check(TestUpdates.message(1L, "Bot Start@mybot 42")));
        assertFalse(filter.check(TestUpdates.message(1L, "bot started")));
    }

    @Test
    void shouldMatchCommandNameContainingSpace() {
        CommandFilter filter = new CommandFilter("/", BOT, List.of("my cmd"), false);

        assertTrue(filter.check(TestUpdates.message(1L, "/my cmd")));
        assertTrue(filter.check(TestUpdates.message(1L, "/my cmd 42")));
        assertTrue(filter.check(TestUpdates.message(1L, "/my cmd@mybot 42")));
        assertFalse(filter.check(TestUpdates.message(1L, "/my")));
    }

    @Test
    void blankUsernameShouldDisableMentionForm() {
        CommandFilter filter = Filters.commands("/", " ", "start");

        assertTrue(filter.check(TestUpdates.message(1L, "/start")));
        assertFalse(filter.check(TestUpdates.message(1L, "/start@")));
        assertFalse(filter.check(TestUpdates.message(1L, "/start@mybot")));
    }

    @Test
    void emptyCommandListShouldNeverMatch() {
        assertFalse(Filters.commands("/", BOT).check(TestUpdates.message(1L, "/start")));
    }

    @Test
    void shouldRejectInvalidConstructionArguments() {
        assertThrows(IllegalArgumentException.class, () -> Filters.commands("", BOT, "start"));
        assertThrows(NullPointerException.class, () -> Filters.commands(null, BOT, "start"));
        assertThrows(NullPointerException.class, () -> Filters.commands("/", BOT, "start", null));
    }
}
