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

import java.util.Objects;
import java.util.StringJoiner;

/**
 * A snapshot older than the latest stored snapshot of the same stream was saved. Snapshots only move forward.
 */
public class StaleSnapshotException extends RuntimeException {
    public final String streamId;
    public final long latestVersion;
    public final long attemptedVersion;

    public StaleSnapshotException(String streamId, long latestVersion, long attemptedVersion) {
        super(String.format("Cannot save snapshot of stream %s at version %d since a snapshot at version %d already exists", streamId, attemptedVersion, latestVersion));
        this.streamId = streamId;
        this.latestVersion = latestVersion;
        this.attemptedVersion = attemptedVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StaleSnapshotException)) return false;
        StaleSnapshotException that = (StaleSnapshotException) o;
        return latestVersion == that.latestVersion && attemptedVersion == that.attemptedVersion && Objects.equals(streamId, that.streamId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamId, latestVersion, attemptedVersion);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", StaleSnapshotException.class.getSimpleName() + "[", "]")
                .add("streamId='" + streamId + "'")
                .add("latestVersion=" + latestVersion)
                .add("attemptedVersion=" + attemptedVersion)
                .toString();
    }
}
