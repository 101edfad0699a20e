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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Optional settings for {@link EventStore#appendEvents(org.eventide.event.EventStream, long, java.util.List, AppendOptions)}:
 * the pool to write to and the correlation and causation ids to store in the metadata of every appended event.
 */
@NullMarked
public final class AppendOptions {
    private static final AppendOptions DEFAULT = new AppendOptions(null, null, null);

    public final @Nullable String pool;
    public final @Nullable String correlationId;
    public final @Nullable String causationId;

    private AppendOptions(@Nullable String pool, @Nullable String correlationId, @Nullable String causationId) {
        this.pool = pool;
        this.correlationId = correlationId;
        this.causationId = causationId;
    }

    public static AppendOptions options() {
        return DEFAULT;
    }

    public AppendOptions pool(@Nullable String pool) {
        return new AppendOptions(pool, correlationId, causationId);
    }

    public AppendOptions correlationId(@Nullable String correlationId) {
        return new AppendOptions(pool, correlationId, causationId);
    }

    public AppendOptions causationId(@Nullable String causationId) {
        return new AppendOptions(pool, correlationId, causationId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AppendOptions)) return false;
        AppendOptions that = (AppendOptions) o;
        return Objects.equals(pool, that.pool) && Objects.equals(correlationId, that.correlationId) && Objects.equals(causationId, that.causationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pool, correlationId, causationId);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", AppendOptions.class.getSimpleName() + "[", "]")
                .add("pool='" + pool + "'")
                .add("correlationId='" + correlationId + "'")
                .add("causationId='" + causationId + "'")
                .toString();
    }
}
