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

import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * The events couldn't be appended because the stream has changed since the aggregate was loaded, i.e. some other
 * writer has already written (some of) the versions that were about to be written. This is effectively an optimistic
 * locking failure, reloading the aggregate and retrying the command is appropriate. Nothing has been written.
 */
public class StreamVersionConflictException extends EventStorePersistenceException {
    public final String streamId;
    public final long expectedVersion;
    /**
     * The current version of the stream, {@code null} if the backend couldn't tell.
     */
    public final @Nullable Long actualVersion;

    public StreamVersionConflictException(String collection, String streamId, long expectedVersion, @Nullable Long actualVersion) {
        this(collection, streamId, expectedVersion, actualVersion, null);
    }

    public StreamVersionConflictException(String collection, String streamId, long expectedVersion, @Nullable Long actualVersion, @Nullable Throwable cause) {
        super(collection, String.format("Version conflict in stream %s of collection %s. Expected the stream to be at version %d but was %s.",
                streamId, collection, expectedVersion, actualVersion == null ? "unknown" : actualVersion), cause);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StreamVersionConflictException)) return false;
        StreamVersionConflictException that = (StreamVersionConflictException) o;
        return expectedVersion == that.expectedVersion && Objects.equals(collection, that.collection) && Objects.equals(streamId, that.streamId) && Objects.equals(actualVersion, that.actualVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collection, streamId, expectedVersion, actualVersion);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", StreamVersionConflictException.class.getSimpleName() + "[", "]")
                .add("collection='" + collection + "'")
                .add("streamId='" + streamId + "'")
                .add("expectedVersion=" + expectedVersion)
                .add("actualVersion=" + actualVersion)
                .toString();
    }
}
