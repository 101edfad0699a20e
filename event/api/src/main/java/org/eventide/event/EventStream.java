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

import java.util.Locale;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Identifies the event stream of a single aggregate instance. The stream id is {@code streamName + "-" + aggregateId}.
 * An {@code EventStream} is a pure value, it's never persisted on its own.
 */
@NullMarked
public final class EventStream {
    public static final int MAX_STREAM_NAME_LENGTH = 50;

    private final String streamName;
    private final String streamId;
    private final String aggregateId;

    private EventStream(String streamName, String aggregateId) {
        requireNonNull(streamName, "Stream name cannot be null");
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        if (streamName.isEmpty()) {
            throw new IllegalArgumentException("Stream name cannot be empty");
        }
        if (aggregateId.isEmpty()) {
            throw new IllegalArgumentException("Aggregate id cannot be empty");
        }
        this.streamName = streamName;
        this.streamId = streamName + "-" + aggregateId;
        this.aggregateId = aggregateId;
    }

    public static EventStream of(String streamName, String aggregateId) {
        return new EventStream(streamName, aggregateId);
    }

    /**
     * Create the stream of an aggregate instance. The stream name is taken from the {@link AggregateStream} annotation
     * of {@code aggregateType} or, when missing, is the lower-cased simple name of the class.
     *
     * @throws InvalidAggregateStreamNameException If the resulting stream name is empty or longer than {@value #MAX_STREAM_NAME_LENGTH} characters.
     */
    public static EventStream forAggregate(Class<?> aggregateType, String aggregateId) {
        return new EventStream(streamNameOf(aggregateType), aggregateId);
    }

    public static String streamNameOf(Class<?> aggregateType) {
        requireNonNull(aggregateType, "Aggregate type cannot be null");
        AggregateStream annotation = aggregateType.getAnnotation(AggregateStream.class);
        String streamName = annotation == null ? aggregateType.getSimpleName().toLowerCase(Locale.ROOT) : annotation.value();
        if (streamName.isEmpty() || streamName.length() > MAX_STREAM_NAME_LENGTH) {
            throw new InvalidAggregateStreamNameException(aggregateType, streamName);
        }
        return streamName;
    }

    public String streamName() {
        return streamName;
    }

    public String streamId() {
        return streamId;
    }

    public String aggregateId() {
        return aggregateId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventStream)) return false;
        EventStream that = (EventStream) o;
        return Objects.equals(streamId, that.streamId) && Objects.equals(aggregateId, that.aggregateId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamId, aggregateId);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", EventStream.class.getSimpleName() + "[", "]")
                .add("streamId='" + streamId + "'")
                .add("aggregateId='" + aggregateId + "'")
                .toString();
    }
}
