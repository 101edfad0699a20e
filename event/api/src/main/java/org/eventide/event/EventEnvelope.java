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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * The persisted form of an {@link Event}: its registered name, its serialized payload and its {@link EventMetadata}.
 * An envelope is immutable, the payload map can't be modified.
 */
@NullMarked
public final class EventEnvelope {
    public final String event;
    public final Map<String, Object> payload;
    public final EventMetadata metadata;

    private EventEnvelope(String event, Map<String, ?> payload, EventMetadata metadata) {
        requireNonNull(event, "Event name cannot be null");
        requireNonNull(payload, "Payload cannot be null");
        requireNonNull(metadata, EventMetadata.class.getSimpleName() + " cannot be null");
        this.event = event;
        this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.metadata = metadata;
    }

    /**
     * Create a new envelope with a newly generated {@link EventId}. The occurred on instant is taken from the event id.
     */
    public static EventEnvelope create(String event, Map<String, ?> payload, String aggregateId, long version) {
        return create(event, payload, aggregateId, version, null, null);
    }

    public static EventEnvelope create(String event, Map<String, ?> payload, String aggregateId, long version, @Nullable String correlationId, @Nullable String causationId) {
        EventId eventId = EventId.generate();
        return new EventEnvelope(event, payload, new EventMetadata(eventId, aggregateId, version, eventId.instant(), correlationId, causationId));
    }

    /**
     * Reconstruct an envelope that has been read from storage.
     */
    public static EventEnvelope from(String event, Map<String, ?> payload, EventMetadata metadata) {
        return new EventEnvelope(event, payload, metadata);
    }

    public EventId eventId() {
        return metadata.eventId;
    }

    public long version() {
        return metadata.version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventEnvelope)) return false;
        EventEnvelope that = (EventEnvelope) o;
        return Objects.equals(event, that.event) && Objects.equals(payload, that.payload) && Objects.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(event, payload, metadata);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", EventEnvelope.class.getSimpleName() + "[", "]")
                .add("event='" + event + "'")
                .add("payload=" + payload)
                .add("metadata=" + metadata)
                .toString();
    }
}
