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

package org.eventide.eventstore.inmemory;

import org.eventide.event.EventEnvelope;
import org.eventide.event.EventStream;
import org.eventide.eventmap.EventMap;
import org.eventide.eventstore.api.AbstractEventStore;
import org.eventide.eventstore.api.EventCollection;
import org.eventide.eventstore.api.EventEnvelopeListener;
import org.eventide.eventstore.api.EventFilter;
import org.eventide.eventstore.api.EventStorePersistenceException;
import org.eventide.eventstore.api.StreamVersionConflictException;
import org.eventide.eventstore.api.internal.CloseableIterator;
import org.eventide.eventstore.api.internal.EventBatches;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * This is an {@link org.eventide.eventstore.api.EventStore} that stores events in-memory. This is mainly useful for testing
 * and/or demo purposes.
 * <p>
 * Each collection maps a stream id to the immutable list of its envelopes. Appends replace the list of a stream atomically,
 * so readers always see a consistent snapshot of the stream.
 */
public class InMemoryEventStore extends AbstractEventStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ConcurrentMap<String, ConcurrentMap<String, List<EventEnvelope>>> collections = new ConcurrentHashMap<>();

    /**
     * Create an instance of {@link InMemoryEventStore}
     */
    public InMemoryEventStore(EventMap eventMap) {
        this(eventMap, EventEnvelopeListener.NOOP);
    }

    /**
     * Create an instance of {@link InMemoryEventStore} that has a <code>listener</code> that will be invoked
     * (synchronously) after events have been written to the event store.
     */
    public InMemoryEventStore(EventMap eventMap, EventEnvelopeListener listener) {
        super(eventMap, listener);
    }

    @Override
    public String ensureCollection(@Nullable String pool) {
        String collection = EventCollection.get(pool);
        if (collections.putIfAbsent(collection, new ConcurrentHashMap<>()) == null) {
            log.info("Created in-memory event collection {}", collection);
        }
        return collection;
    }

    @Override
    protected void writeEnvelopes(String collection, EventStream stream, long currentVersion, List<EventEnvelope> envelopes) {
        collection(collection).compute(stream.streamId(), (__, currentEnvelopes) -> {
            long currentStreamVersion = calculateStreamVersion(currentEnvelopes);
            if (currentStreamVersion != currentVersion) {
                throw new StreamVersionConflictException(collection, stream.streamId(), currentVersion, currentStreamVersion);
            }
            List<EventEnvelope> newEnvelopes = new ArrayList<>(currentEnvelopes == null ? Collections.emptyList() : currentEnvelopes);
            newEnvelopes.addAll(envelopes);
            return Collections.unmodifiableList(newEnvelopes);
        });
    }

    @Override
    protected Optional<EventEnvelope> readEnvelope(String collection, EventStream stream, long version) {
        List<EventEnvelope> envelopes = existingCollection(collection).getOrDefault(stream.streamId(), Collections.emptyList());
        if (version < 1 || version > envelopes.size()) {
            return Optional.empty();
        }
        return Optional.of(envelopes.get((int) version - 1));
    }

    @Override
    protected Stream<List<EventEnvelope>> readEnvelopes(String collection, EventStream stream, EventFilter filter) {
        return EventBatches.batched(collection, () -> {
            List<EventEnvelope> envelopes = existingCollection(collection).getOrDefault(stream.streamId(), Collections.emptyList()).stream()
                    .filter(envelope -> envelope.version() >= filter.fromVersion)
                    .collect(Collectors.toCollection(ArrayList::new));
            if (!filter.isForward()) {
                Collections.reverse(envelopes);
            }
            return CloseableIterator.of(envelopes.iterator(), () -> {
            });
        }, filter.batch, filter.limit);
    }

    private ConcurrentMap<String, List<EventEnvelope>> collection(String collection) {
        ConcurrentMap<String, List<EventEnvelope>> streams = collections.get(collection);
        if (streams == null) {
            throw new EventStorePersistenceException(collection, "Collection " + collection + " doesn't exist, make sure that the pool has been provisioned with ensureCollection");
        }
        return streams;
    }

    private Map<String, List<EventEnvelope>> existingCollection(String collection) {
        return collections.getOrDefault(collection, new ConcurrentHashMap<>());
    }

    private static long calculateStreamVersion(@Nullable List<EventEnvelope> envelopes) {
        return envelopes == null || envelopes.isEmpty() ? 0 : envelopes.get(envelopes.size() - 1).version();
    }
}
