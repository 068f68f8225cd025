package me.golemcore.filters.domain.routing;

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

import me.golemcore.filters.domain.service.UpdateExtractor;
import me.golemcore.filters.port.inbound.UpdateFilter;
import me.golemcore.filters.port.inbound.UpdateHandler;
import lombok.extern.slf4j.Slf4j;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Dispatches updates to the first route whose filter passes.
 *
 * <p>
 * Routes are evaluated in registration order. Register routes before the router
 * is shared with a polling thread; {@link #route(Update)} itself holds no
 * mutable state.
 */
@Slf4j
public class UpdateRouter {

    private final List<Route> routes = new CopyOnWriteArrayList<>();

    public UpdateRouter register(String name, UpdateFilter filter, UpdateHandler handler) {
        Route route = new Route(name, filter, handler);
        routes.add(route);
        log.debug("[Router] Registered route '{}' (position {})", name, routes.size());
        return this;
    }

    public List<Route> getRoutes() {
        return List.copyOf(routes);
    }

    /**
     * Routes the update.
     *
     * @return {@code true} if a route handled the update
     * @throws UpdateHandlingException
     *             if the matching handler failed
     */
    public boolean route(Update update) {
        for (Route route : routes) {
            if (!route.filter().check(update)) {
                continue;
            }
            log.debug("[Router] Update {} matched route '{}'", updateId(update), route.name());
            try {
                route.handler().handle(update);
            } catch (RuntimeException e) {
                log.error("[Router] Route '{}' failed on update {}", route.name(), updateId(update), e);
                throw new UpdateHandlingException(route.name(), e);
            }
            return true;
        }
        log.debug("[Router] No route for update {} (kind={})", updateId(update),
                UpdateExtractor.extract(update).kind());
        return false;
    }

    private static Integer updateId(Update update) {
        return update != null ? update.getUpdateId() : null;
    }

    /**
     * A named filter/handler pair.
     */
    public record Route(String name, UpdateFilter filter, UpdateHandler handler) {
        public Route {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(filter, "filter");
            Objects.requireNonNull(handler, "handler");
        }
    }

    /**
     * Thrown when the handler of a matching route fails.
     */
    public static class UpdateHandlingException extends RuntimeException {

        private final String routeName;

        public UpdateHandlingException(String routeName, Throwable cause) {
            super("Route '" + routeName + "' failed: " + cause.getMessage(), cause);
            this.routeName = routeName;
        }

        public String getRouteName() {
            return routeName;
        }
    }
}
