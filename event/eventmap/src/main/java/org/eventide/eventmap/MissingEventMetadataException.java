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
 * Thrown when an event type is registered without a name, i.e. it lacks the {@link org.eventide.event.EventName} annotation
 * and no explicit name was supplied.
 */
public class MissingEventMetadataException extends RuntimeException {
    public final Class<?> eventType;

    public MissingEventMetadataException(Class<?> eventType) {
        super("Missing event name for " + eventType.getName() + ", annotate it with @EventName or register it with an explicit name.");
        this.eventType = eventType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MissingEventMetadataException)) return false;
        return Objects.equals(eventType, ((MissingEventMetadataException) o).eventType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventType);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", MissingEventMetadataException.class.getSimpleName() + "[", "]")
                .add("eventType=" + eventType.getName())
                .toString();
    }
}
