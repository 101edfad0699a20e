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

package org.eventide.eventstore.api;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Specifies which events to read from a stream, in what order and in batches of which size.
 * <p>
 * {@link #fromVersion} is an inclusive lower bound on the event version regardless of {@link #direction}, so reading
 * {@link StreamReadingDirection#BACKWARD} from version 4 of a stream with 6 events returns versions 6, 5 and 4.
 * <p>
 * Instances are immutable, use {@link #filter()} and the "with" methods to create one:
 * <pre>
 * EventFilter.filter().fromVersion(5).direction(BACKWARD).limit(10);
 * </pre>
 */
@NullMarked
public final class EventFilter {
    public static final int DEFAULT_BATCH_SIZE = 100;

    private static final EventFilter DEFAULT = new EventFilter(1, StreamReadingDirection.FORWARD, Long.MAX_VALUE, DEFAULT_BATCH_SIZE, null);

    public final long fromVersion;
    public final StreamReadingDirection direction;
    public final long limit;
    public final int batch;
    public final @Nullable String pool;

    private EventFilter(long fromVersion, StreamReadingDirection direction, long limit, int batch, @Nullable String pool) {
        requireNonNull(direction, StreamReadingDirection.class.getSimpleName() + " cannot be null");
        requireTrue(fromVersion > 0, "fromVersion must be greater than 0, was " + fromVersion);
        requireTrue(limit > 0, "limit must be greater than 0, was " + limit);
        requireTrue(batch > 0, "batch must be greater than 0, was " + batch);
        this.fromVersion = fromVersion;
        this.direction = direction;
        this.limit = limit;
        this.batch = batch;
        this.pool = pool;
    }

    /**
     * @return A filter that reads all events of the default pool, oldest first, in batches of {@value #DEFAULT_BATCH_SIZE}.
     */
    public static EventFilter filter() {
        return DEFAULT;
    }

    public EventFilter fromVersion(long fromVersion) {
        return new EventFilter(fromVersion, direction, limit, batch, pool);
    }

    public EventFilter direction(StreamReadingDirection direction) {
        return new EventFilter(fromVersion, direction, limit, batch, pool);
    }

    public EventFilter limit(long limit) {
        return new EventFilter(fromVersion, direction, limit, batch, pool);
    }

    public EventFilter batch(int batch) {
        return new EventFilter(fromVersion, direction, limit, batch, pool);
    }

    public EventFilter pool(@Nullable String pool) {
        return new EventFilter(fromVersion, direction, limit, batch, pool);
    }

    public boolean isForward() {
        return direction == StreamReadingDirection.FORWARD;
    }

    private static void requireTrue(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventFilter)) return false;
        EventFilter that = (EventFilter) o;
        return fromVersion == that.fromVersion && limit == that.limit && batch == that.batch && direction == that.direction && Objects.equals(pool, that.pool);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromVersion, direction, limit, batch, pool);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", EventFilter.class.getSimpleName() + "[", "]")
                .add("fromVersion=" + fromVersion)
                .add("direction=" + direction)
                .add("limit=" + limit)
                .add("batch=" + batch)
                .add("pool='" + pool + "'")
                .toString();
    }
}
