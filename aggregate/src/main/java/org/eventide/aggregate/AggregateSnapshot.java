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

import org.jspecify.annotations.NullMarked;

import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * The deserialized state of an aggregate at {@link #version}.
 */
@NullMarked
public final class AggregateSnapshot<S> {
    public final long version;
    public final S state;

    public AggregateSnapshot(long version, S state) {
        requireNonNull(state, "Snapshot state cannot be null");
        if (version < 1) {
            throw new IllegalArgumentException("Snapshot version must be greater than or equal to 1, was " + version);
        }
        this.version = version;
        this.state = state;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateSnapshot)) return false;
        AggregateSnapshot<?> that = (AggregateSnapshot<?>) o;
        return version == that.version && Objects.equals(state, that.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, state);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", AggregateSnapshot.class.getSimpleName() + "[", "]")
                .add("version=" + version)
                .add("state=" + state)
                .toString();
    }
}
