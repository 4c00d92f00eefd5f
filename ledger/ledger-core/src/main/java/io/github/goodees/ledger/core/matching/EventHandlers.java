package io.github.goodees.ledger.core.matching;

/*-
 * #%L
 * ledger
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */


import io.github.goodees.ledger.core.Event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Dispatch table from event types to state mutations of an aggregate. Terminates on first match, events without
 * a handler are ignored.
 *
 * <pre>{@code
 * private final EventHandlers handlers = EventHandlers.builder()
 *         .on(AccountOpenedEvent.class, this::opened)
 *         .on(MoneyDepositedEvent.class, this::deposited)
 *         .build();
 * }</pre>
 */
public class EventHandlers {

    private final List<Handler<?>> handlers;

    private EventHandlers(Builder b) {
        this.handlers = Collections.unmodifiableList(new ArrayList<>(b.handlers));
    }

    /**
     * Apply first matching handler.
     * @param event event to apply
     * @return true if a handler was found
     */
    public boolean apply(Event event) {
        for (Handler<?> handler : handlers) {
            if (handler.match(event)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Check whether events of given type would be handled.
     * @param eventType type of event
     * @return true if any handler accepts instances of the type
     */
    public boolean handles(Class<? extends Event> eventType) {
        for (Handler<?> handler : handlers) {
            if (handler.eventType.isAssignableFrom(eventType)) {
                return true;
            }
        }
        return false;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<Handler<?>> handlers = new ArrayList<>();

        public <T extends Event> Builder on(Class<T> eventType, Consumer<T> callback) {
            this.handlers.add(new Handler<>(eventType, callback));
            return this;
        }

        public EventHandlers build() {
            return new EventHandlers(this);
        }
    }

    private static class Handler<T extends Event> {
        private final Class<T> eventType;
        private final Consumer<T> callback;

        Handler(Class<T> eventType, Consumer<T> callback) {
            this.eventType = Objects.requireNonNull(eventType, "Event type cannot be null");
            this.callback = Objects.requireNonNull(callback, "Callback cannot be null");
        }

        boolean match(Event event) {
            if (event != null && eventType.isInstance(event)) {
                callback.accept(eventType.cast(event));
                return true;
            }
            return false;
        }
    }
}
