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

package org.eventide.snapshotstore.api;

import org.eventide.event.EventStream;
import org.jspecify.annotations.NullMarked;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * The serialized state of an aggregate after all events up to and including {@link #version} have been applied.
 */
@NullMarked
public final class SnapshotEnvelope {
    public final String streamId;
    public final String aggregateId;
    public final long version;
    public final Map<String, Object> payload;
    public final String aggregateName;
    public final Instant occurredOn;

    public SnapshotEnvelope(String streamId, String aggregateId, long version, Map<String, ?> payload, String aggregateName, Instant occurredOn) {
        requireNonNull(streamId, "Stream id cannot be null");
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        requireNonNull(payload, "Payload cannot be null");
        requireNonNull(aggregateName, "Aggregate name cannot be null");
        requireNonNull(occurredOn, "Occurred on cannot be null");
        if (version < 1) {
            throw new IllegalArgumentException("Snapshot version must be greater than or equal to 1, was " + version);
        }
        this.streamId = streamId;
        this.aggregateId = aggregateId;
        this.version = version;
        this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.aggregateName = aggregateName;
        this.occurredOn = occurredOn;
    }

    /**
     * Create a snapshot of the aggregate in {@code stream} taken now.
     */
    public static SnapshotEnvelope create(EventStream stream, long version, Map<String, ?> payload) {
        requireNonNull(stream, EventStream.class.getSimpleName() + " cannot be null");
        // Millisecond precision survives every backend
        return new SnapshotEnvelope(stream.streamId(), stream.aggregateId(), version, payload, stream.streamName(), Instant.now().truncatedTo(ChronoUnit.MILLIS));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SnapshotEnvelope)) return false;
        SnapshotEnvelope that = (SnapshotEnvelope) o;
        return version == that.version && Objects.equals(streamId, that.streamId) && Objects.equals(aggregateId, that.aggregateId)
                && Objects.equals(payload, that.payload) && Objects.equals(aggregateName, that.aggregateName) && Objects.equals(occurredOn, that.occurredOn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamId, aggregateId, version, payload, aggregateName, occurredOn);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", SnapshotEnvelope.class.getSimpleName() + "[", "]")
                .add("streamId='" + streamId + "'")
                .add("aggregateId='" + aggregateId + "'")
                .add("version=" + version)
                .add("payload=" + payload)
                .add("aggregateName='" + aggregateName + "'")
                .add("occurredOn=" + occurredOn)
                .toString();
    }
}
