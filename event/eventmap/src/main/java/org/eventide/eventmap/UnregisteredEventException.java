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

import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Thrown when an event name, type or instance is looked up in an {@link EventMap} that doesn't know about it.
 * Exactly one of {@link #eventName} and {@link #eventType} is set.
 */
public class UnregisteredEventException extends RuntimeException {
    public final @Nullable String eventName;
    public final @Nullable Class<?> eventType;

    public UnregisteredEventException(String eventName) {
        super("Event '" + eventName + "' is not registered");
        this.eventName = eventName;
        this.eventType = null;
    }

    public UnregisteredEventException(Class<?> eventType) {
        super("Event type " + eventType.getName() + " is not registered");
        this.eventName = null;
        this.eventType = eventType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnregisteredEventException)) return false;
        UnregisteredEventException that = (UnregisteredEventException) o;
        return Objects.equals(eventName, that.eventName) && Objects.equals(eventType, that.eventType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventName, eventType);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", UnregisteredEventException.class.getSimpleName() + "[", "]")
                .add("eventName='" + eventName + "'")
                .add("eventType=" + eventType)
                .toString();
    }
}
