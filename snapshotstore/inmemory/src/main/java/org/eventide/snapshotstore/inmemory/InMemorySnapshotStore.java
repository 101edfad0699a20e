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

package org.eventide.snapshotstore.inmemory;

import org.eventide.event.EventStream;
import org.eventide.snapshotstore.api.AbstractSnapshotStore;
import org.eventide.snapshotstore.api.SnapshotCollection;
import org.eventide.snapshotstore.api.SnapshotEnvelope;
import org.eventide.snapshotstore.api.SnapshotStorePersistenceException;
import org.eventide.snapshotstore.api.StaleSnapshotException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.util.Objects.requireNonNull;

/**
 * A {@link org.eventide.snapshotstore.api.SnapshotStore} that keeps the latest {@code maxHistory} snapshots of each
 * stream in memory, newest first.
 */
public class InMemorySnapshotStore extends AbstractSnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(InMemorySnapshotStore.class);
    public static final int DEFAULT_MAX_HISTORY = 10;

    private final ConcurrentMap<String, ConcurrentMap<String, List<SnapshotEnvelope>>> collections = new ConcurrentHashMap<>();
    private final int maxHistory;

    public InMemorySnapshotStore() {
        this(DEFAULT_MAX_HISTORY);
    }

    public InMemorySnapshotStore(int maxHistory) {
        if (maxHistory < 1) {
            throw new IllegalArgumentException("Max history must be greater than zero");
        }
        this.maxHistory = maxHistory;
    }

    @Override
    public String ensureCollection(@Nullable String pool) {
        String collection = SnapshotCollection.get(pool);
        if (collections.putIfAbsent(collection, new ConcurrentHashMap<>()) == null) {
            log.info("Created in-memory snapshot collection {}", collection);
        }
        return collection;
    }

    @Override
    protected void writeSnapshot(String collection, SnapshotEnvelope snapshot) {
        ConcurrentMap<String, List<SnapshotEnvelope>> streams = collections.get(collection);
        if (streams == null) {
            throw new SnapshotStorePersistenceException(collection, "Collection " + collection + " doesn't exist, make sure that the pool has been provisioned with ensureCollection");
        }
        streams.compute(snapshot.streamId, (__, history) -> {
            List<SnapshotEnvelope> newHistory = new ArrayList<>(maxHistory + 1);
            if (history != null && !history.isEmpty()) {
                SnapshotEnvelope latest = history.get(0);
                if (snapshot.version < latest.version) {
                    throw new StaleSnapshotException(snapshot.streamId, latest.version, snapshot.version);
                }
                newHistory.addAll(latest.version == snapshot.version ? history.subList(1, history.size()) : history);
            }
            newHistory.add(0, snapshot);
            return Collections.unmodifiableList(newHistory.size() > maxHistory ? newHistory.subList(0, maxHistory) : newHistory);
        });
    }

    @Override
    protected Optional<SnapshotEnvelope> readLatestSnapshot(String collection, String streamId) {
        List<SnapshotEnvelope> history = history(collection, streamId);
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(0));
    }

    /**
     * @return The retained snapshots of {@code stream}, newest first.
     */
    public List<SnapshotEnvelope> history(EventStream stream, @Nullable String pool) {
        requireNonNull(stream, EventStream.class.getSimpleName() + " cannot be null");
        return history(SnapshotCollection.get(pool), stream.streamId());
    }

    private List<SnapshotEnvelope> history(String collection, String streamId) {
        ConcurrentMap<String, List<SnapshotEnvelope>> streams = collections.get(collection);
        if (streams == null) {
            return Collections.emptyList();
        }
        return streams.getOrDefault(streamId, Collections.emptyList());
    }
}
