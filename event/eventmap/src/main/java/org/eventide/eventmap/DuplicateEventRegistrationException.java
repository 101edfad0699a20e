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

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Thrown when an event type is registered twice or when two event types are registered under the same name.
 */
public class DuplicateEventRegistrationException extends RuntimeException {
    public final String eventName;
    public final Class<?> eventType;

    public DuplicateEventRegistrationException(String eventName, Class<?> eventType, String message) {
        super(message);
        this.eventName = eventName;
        this.eventType = eventType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DuplicateEventRegistrationException)) return false;
        DuplicateEventRegistrationException that = (DuplicateEventRegistrationException) o;
        return Objects.equals(eventName, that.eventName) && Objects.equals(eventType, that.eventType) && Objects.equals(getMessage(), that.getMessage());
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventName, eventType);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", DuplicateEventRegistrationException.class.getSimpleName() + "[", "]")
                .add("eventName='" + eventName + "'")
                .add("eventType=" + eventType.getName())
                .add("message=" + super.getMessage())
                .toString();
    }
}
