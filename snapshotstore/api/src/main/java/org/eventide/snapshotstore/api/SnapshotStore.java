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

import java.util.Optional;

/**
 * Stores the latest snapshot of each event stream. Snapshots are an optimization: an aggregate can always be
 * rebuilt from its events alone.
 */
@NullMarked
public interface SnapshotStore {

    /**
     * Provision the snapshot collection of the default pool. Calling this method more than once is harmless.
     *
     * @return The name of the default collection
     */
    String start();

    String ensureCollection(@Nullable String pool);

    void stop();

    default void save(EventStream stream, SnapshotEnvelope snapshot) {
        save(stream, snapshot, null);
    }

    /**
     * Save {@code snapshot} as the latest snapshot of {@code stream}. Saving the same version again replaces the
     * stored snapshot.
     *
     * @throws StaleSnapshotException             If a snapshot with a higher version is already stored
     * @throws IllegalArgumentException           If the snapshot belongs to another stream
     * @throws SnapshotStorePersistenceException If the snapshot couldn't be written
     */
    void save(EventStream stream, SnapshotEnvelope snapshot, @Nullable String pool);

    default Optional<SnapshotEnvelope> load(EventStream stream) {
        return load(stream, null);
    }

    /**
     * @return The latest snapshot of {@code stream}, empty if no snapshot has been saved.
     */
    Optional<SnapshotEnvelope> load(EventStream stream, @Nullable String pool);
}
