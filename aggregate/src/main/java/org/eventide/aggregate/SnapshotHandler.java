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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventide.event.EventStream;
import org.eventide.eventmap.JacksonEventSerializer;
import org.eventide.snapshotstore.api.SnapshotEnvelope;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;
import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Snapshot policy of an aggregate type. A snapshot is taken every {@link #interval} events, the snapshot state is
 * converted to and from the snapshot payload with Jackson.
 *
 * @param <A> The aggregate type, it must implement {@link SnapshotCapable}
 * @param <S> The snapshot state type
 */
@NullMarked
public final class SnapshotHandler<A extends Aggregate, S> {
    public static final int DEFAULT_INTERVAL = 10;
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<Map<String, Object>>() {
    };

    public final Class<A> aggregateType;
    public final Class<S> stateType;
    public final int interval;
    private final ObjectMapper objectMapper;

    private SnapshotHandler(Class<A> aggregateType, Class<S> stateType, int interval, @Nullable ObjectMapper objectMapper) {
        requireNonNull(aggregateType, "Aggregate type cannot be null");
        requireNonNull(stateType, "State type cannot be null");
        if (!SnapshotCapable.class.isAssignableFrom(aggregateType)) {
            throw new IllegalArgumentException(aggregateType.getName() + " must implement " + SnapshotCapable.class.getSimpleName() + " to be snapshotted");
        }
        if (interval < 1) {
            throw new IllegalArgumentException("Snapshot interval must be greater than zero, was " + interval);
        }
        this.aggregateType = aggregateType;
        this.stateType = stateType;
        this.interval = interval;
        this.objectMapper = objectMapper == null ? JacksonEventSerializer.defaultObjectMapper() : objectMapper;
    }

    /**
     * @return {@code true} if the aggregate passed a multiple of {@link #interval} when moving from {@code previousVersion} to {@code currentVersion}
     */
    public boolean shouldTakeSnapshot(long previousVersion, long currentVersion) {
        return currentVersion / interval > previousVersion / interval;
    }

    public SnapshotEnvelope toSnapshotEnvelope(EventStream stream, A aggregate) {
        requireNonNull(aggregate, "Aggregate cannot be null");
        Object state = ((SnapshotCapable<?>) aggregate).createSnapshot();
        return SnapshotEnvelope.create(stream, aggregate.version(), objectMapper.convertValue(state, PAYLOAD_TYPE));
    }

    public AggregateSnapshot<S> toAggregateSnapshot(SnapshotEnvelope snapshot) {
        requireNonNull(snapshot, SnapshotEnvelope.class.getSimpleName() + " cannot be null");
        return new AggregateSnapshot<>(snapshot.version, objectMapper.convertValue(snapshot.payload, stateType));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SnapshotHandler)) return false;
        SnapshotHandler<?, ?> that = (SnapshotHandler<?, ?>) o;
        return interval == that.interval && Objects.equals(aggregateType, that.aggregateType) && Objects.equals(stateType, that.stateType) && Objects.equals(objectMapper, that.objectMapper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateType, stateType, interval, objectMapper);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", SnapshotHandler.class.getSimpleName() + "[", "]")
                .add("aggregateType=" + aggregateType.getName())
                .add("stateType=" + stateType.getName())
                .add("interval=" + interval)
                .toString();
    }

    @NullUnmarked
    public static final class Builder<A extends Aggregate, S> {
        private final Class<A> aggregateType;
        private final Class<S> stateType;
        private int interval = DEFAULT_INTERVAL;
        private ObjectMapper objectMapper;

        @NullMarked
        public Builder(Class<A> aggregateType, Class<S> stateType) {
            this.aggregateType = aggregateType;
            this.stateType = stateType;
        }

        /**
         * @param interval Take a snapshot every {@code interval} events, {@value SnapshotHandler#DEFAULT_INTERVAL} by default
         * @return The builder instance
         */
        @NullMarked
        public Builder<A, S> interval(int interval) {
            this.interval = interval;
            return this;
        }

        /**
         * @param objectMapper The object mapper that converts the snapshot state, defaults to {@link JacksonEventSerializer#defaultObjectMapper()}
         * @return The builder instance
         */
        @NullMarked
        public Builder<A, S> objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        @NullMarked
        public SnapshotHandler<A, S> build() {
            return new SnapshotHandler<>(aggregateType, stateType, interval, objectMapper);
        }
    }
}
