package me.golemcore.filters.domain.routing;

import me.golemcore.filters.domain.filter.Filters;
import me.golemcore.filters.port.inbound.UpdateHandler;
import me.golemcore.filters.testsupport.TestUpdates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.api.objects.Update;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class UpdateRouterTest {

    private static final String BOT = "mybot";

    private UpdateRouter router;
    private UpdateHandler startHandler;
    private UpdateHandler callbackHandler;
    private UpdateHandler fallbackHandler;

    @BeforeEach
    void setUp() {
        startHandler = mock(UpdateHandler.class);
        callbackHandler = mock(UpdateHandler.class);
        fallbackHandler = mock(UpdateHandler.class);

        router = new UpdateRouter()
                .register("start", Filters.command("start", BOT), startHandler)
                .register("menu", Filters.withPrefix("menu:"), callbackHandler)
                .register("fallback", Filters.alwaysTrue(), fallbackHandler);
    }

    @Test
    void shouldDispatchToFirstMatchingRoute() {
        Update update = TestUpdates.message(1L, "/start 42");

        assertTrue(router.route(update));

        verify(startHandler).handle(update);
        verify(fallbackHandler, never()).handle(any());
    }

    @Test
    void shouldFallThroughToLaterRoutes() {
        Update callback = TestUpdates.callbackQuery(1L, "menu:settings");
        Update other = TestUpdates.message(1L, "hello");

        router.route(callback);
        router.route(other);

        verify(callbackHandler).handle(callback);
        verify(fallbackHandler).handle(other);
        verify(startHandler, never()).handle(any());
    }

    @Test
    void shouldReturnFalseWhenNoRouteMatches() {
        UpdateRouter strict = new UpdateRouter()
                .register("start", Filters.command("start", BOT), startHandler);

        assertFalse(strict.route(TestUpdates.poll()));
        verify(startHandler, never()).handle(any());
    }

    @Test
    void shouldWrapHandlerFailure() {
        Update update = TestUpdates.message(1L, "/start");
        IllegalStateException failure = new IllegalStateException("boom");
        doThrow(failure).when(startHandler).handle(update);

        UpdateRouter.UpdateHandlingException exception = assertThrows(
                UpdateRouter.UpdateHandlingException.class, () -> router.route(update));

        assertEquals("start", exception.getRouteName());
        assertSame(failure, exception.getCause());
        verify(fallbackHandler, never()).handle(any());
    }

    @Test
    void shouldExposeRoutesInRegistrationOrder() {
        assertEquals(3, router.getRoutes().size());
        assertEquals("start", router.getRoutes().get(0).name());
        assertEquals("fallback", router.getRoutes().get(2).name());
    }

    @Test
    void shouldRejectIncompleteRoutes() {
        assertThrows(NullPointerException.class, () -> router.register("x", null, fallbackHandler));
        assertThrows(NullPointerException.class, () -> router.register("x", Filters.alwaysTrue(), null));
    }
}
