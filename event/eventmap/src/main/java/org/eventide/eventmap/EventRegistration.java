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

package org.eventide.eventmap;

import org.eventide.event.Event;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Describes how an event type should be registered in an {@link EventMap}. Name and serializer are optional, when
 * missing the name is read from the {@link org.eventide.event.EventName} annotation and a {@link JacksonEventSerializer} is used.
 */
@NullMarked
public final class EventRegistration<E extends Event> {
    public final Class<E> type;
    public final @Nullable String name;
    public final @Nullable EventSerializer<E> serializer;

    private EventRegistration(Class<E> type, @Nullable String name, @Nullable EventSerializer<E> serializer) {
        requireNonNull(type, "Event type cannot be null");
        this.type = type;
        this.name = name;
        this.serializer = serializer;
    }

    public static <E extends Event> EventRegistration<E> of(Class<E> type) {
        return new EventRegistration<>(type, null, null);
    }

    public static <E extends Event> EventRegistration<E> of(Class<E> type, EventSerializer<E> serializer) {
        return new EventRegistration<>(type, null, requireNonNull(serializer, "Serializer cannot be null"));
    }

    public static <E extends Event> EventRegistration<E> of(Class<E> type, String name, @Nullable EventSerializer<E> serializer) {
        return new EventRegistration<>(type, requireNonNull(name, "Event name cannot be null"), serializer);
    }

    void registerIn(EventMap eventMap) {
        if (name == null) {
            eventMap.register(type, serializer);
        } else {
            eventMap.register(type, name, serializer);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventRegistration)) return false;
        EventRegistration<?> that = (EventRegistration<?>) o;
        return Objects.equals(type, that.type) && Objects.equals(name, that.name) && Objects.equals(serializer, that.serializer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, serializer);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", EventRegistration.class.getSimpleName() + "[", "]")
                .add("type=" + type.getName())
                .add("name='" + name + "'")
                .add("serializer=" + serializer)
                .toString();
    }
}
