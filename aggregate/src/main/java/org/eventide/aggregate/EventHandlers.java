/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventide.aggregate;

import org.eventide.event.Event;
import org.jspecify.annotations.NullMarked;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

import static java.util.Objects.requireNonNull;

/**
 * Routes events to the handler registered for their type. Build one table per aggregate type and keep it in a
 * static field:
 * <pre>
 * private static final EventHandlers&lt;Account&gt; HANDLERS = EventHandlers.builder(Account.class)
 *         .on(AccountOpened.class, Account::onOpened)
 *         .on(AccountCredited.class, Account::onCredited)
 *         .build();
 * </pre>
 * When no handler is registered for the exact type of an event, the handlers of its super classes are tried.
 *
 * @param <A> The aggregate type
 */
@NullMarked
public final class EventHandlers<A extends Aggregate> {
    private final Class<A> aggregateType;
    private final Map<Class<? extends Event>, BiConsumer<A, Event>> handlers;

    private EventHandlers(Class<A> aggregateType, Map<Class<? extends Event>, BiConsumer<A, Event>> handlers) {
        this.aggregateType = aggregateType;
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
    }

    public static <A extends Aggregate> Builder<A> builder(Class<A> aggregateType) {
        return new Builder<>(aggregateType);
    }

    /**
     * @return {@code true} if a handler was invoked, {@code false} if there's no handler for the event.
     */
    boolean dispatch(Aggregate aggregate, Event event) {
        A typedAggregate = aggregateType.cast(aggregate);
        Class<?> type = event.getClass();
        while (type != null && Event.class.isAssignableFrom(type)) {
            BiConsumer<A, Event> handler = handlers.get(type);
            if (handler != null) {
                handler.accept(typedAggregate, event);
                return true;
            }
            type = type.getSuperclass();
        }
        return false;
    }

    public boolean handles(Class<? extends Event> eventType) {
        return handlers.containsKey(eventType);
    }

    public static final class Builder<A extends Aggregate> {
        private final Class<A> aggregateType;
        private final Map<Class<? extends Event>, BiConsumer<A, Event>> handlers = new LinkedHashMap<>();

        private Builder(Class<A> aggregateType) {
            this.aggregateType = requireNonNull(aggregateType, "Aggregate type cannot be null");
        }

        /**
         * @throws IllegalArgumentException If a handler is already registered for {@code eventType}
         */
        public <E extends Event> Builder<A> on(Class<E> eventType, BiConsumer<A, ? super E> handler) {
            requireNonNull(eventType, "Event type cannot be null");
            requireNonNull(handler, "Handler cannot be null");
            if (handlers.putIfAbsent(eventType, (aggregate, event) -> handler.accept(aggregate, eventType.cast(event))) != null) {
                throw new IllegalArgumentException("A handler for " + eventType.getName() + " is already registered for " + aggregateType.getName());
            }
            return this;
        }

        public EventHandlers<A> build() {
            return new EventHandlers<>(aggregateType, handlers);
        }
    }
}
