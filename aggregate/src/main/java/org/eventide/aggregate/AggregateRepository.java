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

import org.eventide.event.Event;
import org.eventide.event.EventEnvelope;
import org.eventide.event.EventStream;
import org.eventide.eventstore.api.AppendOptions;
import org.eventide.eventstore.api.EventFilter;
import org.eventide.eventstore.api.EventStore;
import org.eventide.snapshotstore.api.SnapshotStore;
import org.eventide.snapshotstore.api.SnapshotStorePersistenceException;
import org.eventide.snapshotstore.api.StaleSnapshotException;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Loads and saves aggregates of one type. Loading restores the latest snapshot, if snapshots are enabled, and then
 * replays the events after the snapshot in batches. Saving appends the uncommitted events with the version of the
 * aggregate as expected version, so concurrent modifications of the same aggregate fail with
 * {@link org.eventide.eventstore.api.StreamVersionConflictException}.
 *
 * @param <A> The aggregate type
 */
@NullMarked
public class AggregateRepository<A extends Aggregate> {
    private static final Logger log = LoggerFactory.getLogger(AggregateRepository.class);

    private final Class<A> aggregateType;
    private final Function<String, A> factory;
    private final EventStore eventStore;
    private final @Nullable SnapshotStore snapshotStore;
    private final @Nullable SnapshotHandler<A, ?> snapshotHandler;
    private final @Nullable String pool;
    private final int batchSize;

    private AggregateRepository(Class<A> aggregateType, Function<String, A> factory, EventStore eventStore, @Nullable SnapshotStore snapshotStore,
                                @Nullable SnapshotHandler<A, ?> snapshotHandler, @Nullable String pool, int batchSize) {
        requireNonNull(aggregateType, "Aggregate type cannot be null");
        requireNonNull(factory, "Aggregate factory cannot be null");
        requireNonNull(eventStore, EventStore.class.getSimpleName() + " cannot be null");
        if (snapshotHandler != null && snapshotStore == null) {
            throw new IllegalArgumentException("A " + SnapshotStore.class.getSimpleName() + " is required to take snapshots of " + aggregateType.getName());
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be greater than zero");
        }
        this.aggregateType = aggregateType;
        this.factory = factory;
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
        this.snapshotHandler = snapshotHandler;
        this.pool = pool;
        this.batchSize = batchSize;
    }

    public EventStream streamOf(String aggregateId) {
        return EventStream.forAggregate(aggregateType, aggregateId);
    }

    /**
     * @return The aggregate with all events applied, or empty if no events have been written for {@code aggregateId}.
     */
    public Optional<A> getById(String aggregateId) {
        EventStream stream = streamOf(aggregateId);
        A aggregate = requireNonNull(factory.apply(aggregateId), "Aggregate factory returned null");

        AggregateSnapshot<?> snapshot = loadSnapshot(stream);
        aggregate.loadFromHistory(Collections.emptyList(), snapshot);
        long fromVersion = snapshot == null ? 1 : snapshot.version + 1;

        EventFilter filter = EventFilter.filter().fromVersion(fromVersion).batch(batchSize).pool(pool);
        try (Stream<List<Event>> batches = eventStore.getEvents(stream, filter)) {
            batches.forEach(aggregate::loadFromHistory);
        }
        if (aggregate.version() == 0) {
            return Optional.empty();
        }
        log.debug("Loaded {} at version {} (snapshot version {})", stream.streamId(), aggregate.version(), snapshot == null ? "none" : snapshot.version);
        return Optional.of(aggregate);
    }

    public List<EventEnvelope> save(A aggregate) {
        return save(aggregate, null, null);
    }

    /**
     * Append the uncommitted events of {@code aggregate} and commit them. The events stay uncommitted if the append
     * fails. A snapshot is saved when the append made the aggregate pass a multiple of the snapshot interval, failing
     * to save it doesn't fail the save.
     *
     * @return The written envelopes, empty if there were no uncommitted events
     */
    public List<EventEnvelope> save(A aggregate, @Nullable String correlationId, @Nullable String causationId) {
        requireNonNull(aggregate, "Aggregate cannot be null");
        List<Event> events = aggregate.uncommittedEvents();
        if (events.isEmpty()) {
            return Collections.emptyList();
        }
        EventStream stream = streamOf(aggregate.id());
        AppendOptions options = AppendOptions.options().pool(pool).correlationId(correlationId).causationId(causationId);
        List<EventEnvelope> envelopes = eventStore.appendEvents(stream, aggregate.version(), events, options);
        aggregate.commit();

        if (snapshotHandler != null && snapshotHandler.shouldTakeSnapshot(aggregate.version() - events.size(), aggregate.version())) {
            saveSnapshot(stream, aggregate, snapshotHandler);
        }
        return envelopes;
    }

    private @Nullable AggregateSnapshot<?> loadSnapshot(EventStream stream) {
        if (snapshotStore == null || snapshotHandler == null) {
            return null;
        }
        return snapshotStore.load(stream, pool).map(snapshotHandler::toAggregateSnapshot).orElse(null);
    }

    private void saveSnapshot(EventStream stream, A aggregate, SnapshotHandler<A, ?> snapshotHandler) {
        requireNonNull(snapshotStore, SnapshotStore.class.getSimpleName() + " cannot be null");
        try {
            snapshotStore.save(stream, snapshotHandler.toSnapshotEnvelope(stream, aggregate), pool);
        } catch (StaleSnapshotException e) {
            log.debug("A newer snapshot of {} than version {} has already been saved", stream.streamId(), e.attemptedVersion);
        } catch (SnapshotStorePersistenceException e) {
            log.warn("Failed to save snapshot of {} at version {}, it will be rebuilt from events", stream.streamId(), aggregate.version(), e);
        }
    }

    @NullUnmarked
    public static final class Builder<A extends Aggregate> {
        private final Class<A> aggregateType;
        private final Function<String, A> factory;
        private EventStore eventStore;
        private SnapshotStore snapshotStore;
        private SnapshotHandler<A, ?> snapshotHandler;
        private String pool;
        private int batchSize = EventFilter.DEFAULT_BATCH_SIZE;

        /**
         * @param aggregateType The aggregate type, its stream name is derived from it
         * @param factory       Creates an empty aggregate from an aggregate id
         */
        @NullMarked
        public Builder(Class<A> aggregateType, Function<String, A> factory) {
            this.aggregateType = aggregateType;
            this.factory = factory;
        }

        @NullMarked
        public Builder<A> eventStore(EventStore eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        /**
         * Enable snapshots. {@code snapshotHandler} decides how often snapshots are taken.
         */
        @NullMarked
        public Builder<A> snapshots(SnapshotStore snapshotStore, SnapshotHandler<A, ?> snapshotHandler) {
            this.snapshotStore = snapshotStore;
            this.snapshotHandler = snapshotHandler;
            return this;
        }

        /**
         * @param pool The pool that holds the events and snapshots of the aggregate. It must have been provisioned.
         */
        public Builder<A> pool(@Nullable String pool) {
            this.pool = pool;
            return this;
        }

        /**
         * @param batchSize The number of events read per batch when loading an aggregate
         */
        @NullMarked
        public Builder<A> batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        @NullMarked
        public AggregateRepository<A> build() {
            return new AggregateRepository<>(aggregateType, factory, eventStore, snapshotStore, snapshotHandler, pool, batchSize);
        }
    }
}
