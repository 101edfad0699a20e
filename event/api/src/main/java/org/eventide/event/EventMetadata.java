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

package org.eventide.event;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Metadata stored together with each event.
 */
@NullMarked
public final class EventMetadata {
    public final EventId eventId;
    public final String aggregateId;
    public final long version;
    public final Instant occurredOn;
    public final @Nullable String correlationId;
    public final @Nullable String causationId;

    public EventMetadata(EventId eventId, String aggregateId, long version, Instant occurredOn, @Nullable String correlationId, @Nullable String causationId) {
        requireNonNull(eventId, "Event id cannot be null");
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        requireNonNull(occurredOn, "Occurred on cannot be null");
        if (version < 1) {
            throw new IllegalArgumentException("Version must be greater than or equal to 1, was " + version);
        }
        this.eventId = eventId;
        this.aggregateId = aggregateId;
        this.version = version;
        this.occurredOn = occurredOn;
        this.correlationId = correlationId;
        this.causationId = causationId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventMetadata)) return false;
        EventMetadata that = (EventMetadata) o;
        return version == that.version && Objects.equals(eventId, that.eventId) && Objects.equals(aggregateId, that.aggregateId)
                && Objects.equals(occurredOn, that.occurredOn) && Objects.equals(correlationId, that.correlationId) && Objects.equals(causationId, that.causationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, aggregateId, version, occurredOn, correlationId, causationId);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", EventMetadata.class.getSimpleName() + "[", "]")
                .add("eventId=" + eventId)
                .add("aggregateId='" + aggregateId + "'")
                .add("version=" + version)
                .add("occurredOn=" + occurredOn)
                .add("correlationId='" + correlationId + "'")
                .add("causationId='" + causationId + "'")
                .toString();
    }
}
