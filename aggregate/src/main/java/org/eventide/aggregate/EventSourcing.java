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

import org.eventide.eventmap.EventMap;
import org.eventide.eventmap.EventRegistration;
import org.eventide.eventstore.api.EventStore;
import org.eventide.eventstore.api.EventStoreDriver;
import org.eventide.snapshotstore.api.SnapshotStore;
import org.eventide.snapshotstore.api.SnapshotStoreDriver;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Wires an {@link EventMap}, an {@link EventStore} and optionally a {@link SnapshotStore} together. The stores are
 * created through their drivers and started (including the collections of the configured pools) when the instance
 * is built, and stopped by {@link #close()}.
 * <pre>
 * try (EventSourcing eventSourcing = new EventSourcing.Builder()
 *         .events(EventRegistration.of(AccountOpened.class), EventRegistration.of(AccountCredited.class))
 *         .eventStore(InMemoryEventStore::new)
 *         .snapshotStore(InMemorySnapshotStore::new)
 *         .build()) {
 *     AggregateRepository&lt;Account&gt; accounts = eventSourcing.repository(Account.class, Account::new).build();
 * }
 * </pre>
 */
@NullMarked
public class EventSourcing implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventSourcing.class);

    private final EventMap eventMap;
    private final EventStore eventStore;
    private final @Nullable SnapshotStore snapshotStore;

    private EventSourcing(EventMap eventMap, EventStore eventStore, @Nullable SnapshotStore snapshotStore) {
        this.eventMap = eventMap;
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
    }

    public EventMap eventMap() {
        return eventMap;
    }

    public EventStore eventStore() {
        return eventStore;
    }

    public Optional<SnapshotStore> snapshotStore() {
        return Optional.ofNullable(snapshotStore);
    }

    /**
     * @return A repository builder that is already configured with the event store of this instance
     */
    public <A extends Aggregate> AggregateRepository.Builder<A> repository(Class<A> aggregateType, Function<String, A> factory) {
        return new AggregateRepository.Builder<>(aggregateType, factory).eventStore(eventStore);
    }

    /**
     * @return A repository builder configured with the event store and the snapshot store of this instance
     * @throws IllegalStateException If no snapshot store is configured
     */
    public <A extends Aggregate> AggregateRepository.Builder<A> repository(Class<A> aggregateType, Function<String, A> factory, SnapshotHandler<A, ?> snapshotHandler) {
        if (snapshotStore == null) {
            throw new IllegalStateException("Cannot take snapshots of " + aggregateType.getName() + " since no snapshot store is configured");
        }
        return repository(aggregateType, factory).snapshots(snapshotStore, snapshotHandler);
    }

    @Override
    public void close() {
        log.info("Stopping event sourcing");
        try {
            if (snapshotStore != null) {
                snapshotStore.stop();
            }
        } finally {
            eventStore.stop();
        }
    }

    @NullUnmarked
    public static final class Builder {
        private final List<EventRegistration<?>> registrations = new ArrayList<>();
        private final Set<String> pools = new LinkedHashSet<>();
        private EventStoreDriver eventStoreDriver;
        private SnapshotStoreDriver snapshotStoreDriver;

        @NullMarked
        public Builder events(EventRegistration<?>... registrations) {
            return events(Arrays.asList(registrations));
        }

        @NullMarked
        public Builder events(Collection<? extends EventRegistration<?>> registrations) {
            this.registrations.addAll(registrations);
            return this;
        }

        @NullMarked
        public Builder eventStore(EventStoreDriver eventStoreDriver) {
            this.eventStoreDriver = eventStoreDriver;
            return this;
        }

        @NullMarked
        public Builder snapshotStore(SnapshotStoreDriver snapshotStoreDriver) {
            this.snapshotStoreDriver = snapshotStoreDriver;
            return this;
        }

        /**
         * @param pools Pools whose collections are provisioned in addition to the default collection
         * @return The builder instance
         */
        @NullMarked
        public Builder pools(String... pools) {
            this.pools.addAll(Arrays.asList(pools));
            return this;
        }

        /**
         * Register the events, create and start the stores.
         *
         * @throws IllegalStateException If no event store driver is configured
         */
        @NullMarked
        public EventSourcing build() {
            if (eventStoreDriver == null) {
                throw new IllegalStateException("An event store driver must be configured");
            }
            EventMap eventMap = new EventMap().registerAll(registrations);

            EventStore eventStore = requireNonNull(eventStoreDriver.create(eventMap), "Event store driver returned null");
            eventStore.start();
            pools.forEach(eventStore::ensureCollection);

            SnapshotStore snapshotStore = null;
            if (snapshotStoreDriver != null) {
                snapshotStore = requireNonNull(snapshotStoreDriver.create(), "Snapshot store driver returned null");
                snapshotStore.start();
                pools.forEach(snapshotStore::ensureCollection);
            }
            log.info("Started event sourcing with {} registered event type(s), event store {} and snapshot store {}", registrations.size(),
                    eventStore.getClass().getSimpleName(), snapshotStore == null ? "none" : snapshotStore.getClass().getSimpleName());
            return new EventSourcing(eventMap, eventStore, snapshotStore);
        }
    }
}
