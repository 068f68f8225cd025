package me.golemcore.filters.port.inbound;

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

import me.golemcore.filters.domain.filter.Filters;
import org.telegram.telegrambots.meta.api.objects.Update;

/**
 * Port for classifying incoming Telegram updates.
 *
 * <p>
 * A filter is a pure predicate over an {@link Update}. Implementations hold
 * only construction-time state and must never mutate it during
 * {@link #check(Update)}, so a single instance can be shared between polling
 * threads. Most filters are obtained from {@link Filters}; any lambda of the
 * shape {@code update -> boolean} is a filter too.
 *
 * @see Filters
 */
@FunctionalInterface
public interface UpdateFilter {

    /**
     * Tests the update.
     *
     * @param update
     *            incoming update, may be {@code null}
     * @return {@code true} if the update passes this filter
     */
    boolean check(Update update);

    /**
     * Returns a filter passing only when both this and {@code other} pass.
     */
    default UpdateFilter and(UpdateFilter other) {
        return Filters.and(this, other);
    }

    /**
     * Returns a filter passing when this or {@code other} passes.
     */
    default UpdateFilter or(UpdateFilter other) {
        return Filters.or(this, other);
    }

    /**
     * Returns the negation of this filter.
     */
    default UpdateFilter negate() {
        return Filters.not(this);
    }
}
