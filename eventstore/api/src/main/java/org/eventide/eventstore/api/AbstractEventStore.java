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
import org.eventide.eventmap.EventMap;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Base class for {@link EventStore} implementations. It turns events into {@link EventEnvelope}s using the {@link EventMap},
 * validates arguments, maps envelopes back into events when reading and notifies the {@link EventEnvelopeListener}.
 * Subclasses only deal with storing and reading envelopes.
 */
@NullMarked
public abstract class AbstractEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(AbstractEventStore.class);

    protected final EventMap eventMap;
    private final EventEnvelopeListener listener;

    protected AbstractEventStore(EventMap eventMap, EventEnvelopeListener listener) {
        requireNonNull(eventMap, EventMap.class.getSimpleName() + " cannot be null");
        requireNonNull(listener, EventEnvelopeListener.class.getSimpleName() + " cannot be null");
        this.eventMap = eventMap;
        this.listener = listener;
    }

    @Override
    public String start() {
        return ensureCollection(null);
    }

    @Override
    public void stop() {
    }

    @Override
    public final List<EventEnvelope> appendEvents(EventStream stream, long expectedAggregateVersion, List<? extends Event> events, AppendOptions options) {
        requireNonNull(stream, EventStream.class.getSimpleName() + " cannot be null");
        requireNonNull(events, "Events cannot be null");
        requireNonNull(options, AppendOptions.class.getSimpleName() + " cannot be null");
        if (events.isEmpty()) {
            return Collections.emptyList();
        }
        int numberOfEvents = events.size();
        if (expectedAggregateVersion < numberOfEvents) {
            throw new IllegalArgumentException(String.format("Expected aggregate version (%d) cannot be less than the number of events to append (%d)", expectedAggregateVersion, numberOfEvents));
        }

        String collection = EventCollection.get(options.pool);
        long currentVersion = expectedAggregateVersion - numberOfEvents;
        List<EventEnvelope> envelopes = new ArrayList<>(numberOfEvents);
        for (int i = 0; i < numberOfEvents; i++) {
            Event event = requireNonNull(events.get(i), "Event cannot be null");
            envelopes.add(EventEnvelope.create(eventMap.getName(event), eventMap.serializeEvent(event), stream.aggregateId(), currentVersion + i + 1, options.correlationId, options.causationId));
        }

        writeEnvelopes(collection, stream, currentVersion, envelopes);
        log.debug("Appended {} event(s) to stream {} in collection {}, stream is now at version {}", numberOfEvents, stream.streamId(), collection, expectedAggregateVersion);

        List<EventEnvelope> appended = Collections.unmodifiableList(envelopes);
        publish(collection, stream, appended);
        return appended;
    }

    @Override
    public Event getEvent(EventStream stream, long version, @Nullable String pool) {
        return toEvent(getEnvelope(stream, version, pool));
    }

    @Override
    public EventEnvelope getEnvelope(EventStream stream, long version, @Nullable String pool) {
        requireNonNull(stream, EventStream.class.getSimpleName() + " cannot be null");
        return readEnvelope(EventCollection.get(pool), stream, version).orElseThrow(() -> new EventNotFoundException(stream.streamId(), version));
    }

    @Override
    public Stream<List<Event>> getEvents(EventStream stream, EventFilter filter) {
        return getEnvelopes(stream, filter).map(batch -> batch.stream().map(this::toEvent).collect(Collectors.toUnmodifiableList()));
    }

    @Override
    public Stream<List<EventEnvelope>> getEnvelopes(EventStream stream, EventFilter filter) {
        requireNonNull(stream, EventStream.class.getSimpleName() + " cannot be null");
        requireNonNull(filter, EventFilter.class.getSimpleName() + " cannot be null");
        return readEnvelopes(EventCollection.get(filter.pool), stream, filter);
    }

    /**
     * Write {@code envelopes} atomically. Must fail with {@link StreamVersionConflictException} unless the stream is at
     * {@code currentVersion}, and with {@link EventStorePersistenceException} if the collection doesn't exist or the write fails.
     */
    protected abstract void writeEnvelopes(String collection, EventStream stream, long currentVersion, List<EventEnvelope> envelopes);

    protected abstract Optional<EventEnvelope> readEnvelope(String collection, EventStream stream, long version);

    /**
     * Read envelopes with {@code version >= filter.fromVersion} in the order given by {@code filter.direction}, batched
     * and limited according to {@code filter}. Nothing may be read from storage until the first batch is requested.
     */
    protected abstract Stream<List<EventEnvelope>> readEnvelopes(String collection, EventStream stream, EventFilter filter);

    private Event toEvent(EventEnvelope envelope) {
        return eventMap.deserializeEvent(envelope.event, envelope.payload);
    }

    private void publish(String collection, EventStream stream, List<EventEnvelope> envelopes) {
        try {
            listener.onAppended(collection, stream, envelopes);
        } catch (RuntimeException e) {
            // The events are already written so the append itself has succeeded
            log.error("Event envelope listener failed for stream {} in collection {}", stream.streamId(), collection, e);
        }
    }
}
