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

import org.eventide.event.Event;
import org.eventide.event.EventEnvelope;
import org.eventide.event.EventStream;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.stream.Stream;

/**
 * An append-only store of the events of many aggregate streams with optimistic concurrency control.
 * <p>
 * Events are grouped into pools, each pool is stored in its own collection (see {@link EventCollection}). A pool's
 * collection must be provisioned with {@link #start()} (the default pool) or {@link #ensureCollection(String)} before
 * events can be appended to it.
 * <p>
 * Reads return a lazy {@link Stream} of batches. The stream holds on to a cursor or connection in the underlying
 * storage until it's exhausted or closed, so always close it, preferably with try-with-resources:
 * <pre>
 * try (Stream&lt;List&lt;Event&gt;&gt; batches = eventStore.getEvents(stream)) {
 *     batches.forEach(aggregate::loadFromHistory);
 * }
 * </pre>
 */
@NullMarked
public interface EventStore {

    /**
     * Provision the collection of the default pool. Calling this method more than once is harmless.
     *
     * @return The name of the default collection
     */
    String start();

    /**
     * Provision the collection of {@code pool}. Calling this method more than once is harmless.
     *
     * @param pool The pool, or {@code null} for the default pool
     * @return The name of the collection
     */
    String ensureCollection(@Nullable String pool);

    /**
     * Release resources, such as connections, owned by this event store.
     */
    void stop();

    /**
     * Append {@code events} to the default pool.
     *
     * @see #appendEvents(EventStream, long, List, AppendOptions)
     */
    default List<EventEnvelope> appendEvents(EventStream stream, long expectedAggregateVersion, List<? extends Event> events) {
        return appendEvents(stream, expectedAggregateVersion, events, AppendOptions.options());
    }

    /**
     * Append {@code events} to {@code pool}.
     *
     * @see #appendEvents(EventStream, long, List, AppendOptions)
     */
    default List<EventEnvelope> appendEvents(EventStream stream, long expectedAggregateVersion, List<? extends Event> events, @Nullable String pool) {
        return appendEvents(stream, expectedAggregateVersion, events, AppendOptions.options().pool(pool));
    }

    /**
     * Append {@code events} to a stream. {@code expectedAggregateVersion} is the version of the aggregate <i>after</i> the
     * events have been applied, so the events get versions {@code expectedAggregateVersion - events.size() + 1} up to and
     * including {@code expectedAggregateVersion}.
     * <p>
     * The append is all-or-nothing. It only succeeds if the stream is at version {@code expectedAggregateVersion - events.size()}
     * when the events are written. Appending an empty list is a no-op.
     *
     * @return The envelopes that were written, in version order
     * @throws StreamVersionConflictException If the stream is not at the expected version, nothing has been written
     * @throws EventStorePersistenceException If the events couldn't be written, for example because the collection of the pool doesn't exist
     * @throws IllegalArgumentException       If {@code expectedAggregateVersion} is less than the number of events
     * @throws org.eventide.eventmap.UnregisteredEventException If an event type is not registered in the event map
     */
    List<EventEnvelope> appendEvents(EventStream stream, long expectedAggregateVersion, List<? extends Event> events, AppendOptions options);

    default Event getEvent(EventStream stream, long version) {
        return getEvent(stream, version, null);
    }

    /**
     * @throws EventNotFoundException If there's no event with {@code version} in the stream.
     */
    Event getEvent(EventStream stream, long version, @Nullable String pool);

    default EventEnvelope getEnvelope(EventStream stream, long version) {
        return getEnvelope(stream, version, null);
    }

    /**
     * @throws EventNotFoundException If there's no event with {@code version} in the stream.
     */
    EventEnvelope getEnvelope(EventStream stream, long version, @Nullable String pool);

    default Stream<List<Event>> getEvents(EventStream stream) {
        return getEvents(stream, EventFilter.filter());
    }

    /**
     * Read the events of a stream in batches of {@link EventFilter#batch} events. Every batch except possibly the last
     * one is full. The returned stream must be closed.
     */
    Stream<List<Event>> getEvents(EventStream stream, EventFilter filter);

    default Stream<List<EventEnvelope>> getEnvelopes(EventStream stream) {
        return getEnvelopes(stream, EventFilter.filter());
    }

    /**
     * Read the envelopes of a stream in batches of {@link EventFilter#batch} envelopes. Every batch except possibly the last
     * one is full. The returned stream must be closed.
     */
    Stream<List<EventEnvelope>> getEnvelopes(EventStream stream, EventFilter filter);
}
