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
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Base class for {@link SnapshotStore} implementations that validates arguments and resolves pools to collections.
 */
@NullMarked
public abstract class AbstractSnapshotStore implements SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(AbstractSnapshotStore.class);

    @Override
    public String start() {
        return ensureCollection(null);
    }

    @Override
    public void stop() {
    }

    @Override
    public final void save(EventStream stream, SnapshotEnvelope snapshot, @Nullable String pool) {
        requireNonNull(stream, EventStream.class.getSimpleName() + " cannot be null");
        requireNonNull(snapshot, SnapshotEnvelope.class.getSimpleName() + " cannot be null");
        if (!stream.streamId().equals(snapshot.streamId)) {
            throw new IllegalArgumentException("Snapshot of stream " + snapshot.streamId + " cannot be saved in stream " + stream.streamId());
        }
        String collection = SnapshotCollection.get(pool);
        writeSnapshot(collection, snapshot);
        log.debug("Saved snapshot of stream {} at version {} in collection {}", stream.streamId(), snapshot.version, collection);
    }

    @Override
    public final Optional<SnapshotEnvelope> load(EventStream stream, @Nullable String pool) {
        requireNonNull(stream, EventStream.class.getSimpleName() + " cannot be null");
        return readLatestSnapshot(SnapshotCollection.get(pool), stream.streamId());
    }

    /**
     * Store {@code snapshot} unless a snapshot with a higher version exists, in which case {@link StaleSnapshotException}
     * must be thrown. The check and the write must be atomic.
     */
    protected abstract void writeSnapshot(String collection, SnapshotEnvelope snapshot);

    protected abstract Optional<SnapshotEnvelope> readLatestSnapshot(String collection, String streamId);
}
