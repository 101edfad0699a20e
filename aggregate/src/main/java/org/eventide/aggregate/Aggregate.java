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
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Base class of event sourced aggregates. State changes are expressed as events passed to {@link #apply(Event)},
 * which routes them to the handlers returned by {@link #eventHandlers()} and buffers them until {@link #commit()}.
 * <p>
 * The version is the number of events applied to the aggregate, including events that are not yet committed.
 * An aggregate is not thread-safe.
 */
@NullMarked
public abstract class Aggregate {
    private final String id;
    private long version;
    private final List<Event> uncommittedEvents = new ArrayList<>();

    protected Aggregate(String id) {
        requireNonNull(id, "Aggregate id cannot be null");
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Aggregate id cannot be empty");
        }
        this.id = id;
    }

    /**
     * @return The handlers of this aggregate type, normally a static {@link EventHandlers} instance.
     */
    protected abstract EventHandlers<?> eventHandlers();

    public final String id() {
        return id;
    }

    public final long version() {
        return version;
    }

    public final void apply(Event event) {
        apply(event, false);
    }

    /**
     * Apply {@code event} to the aggregate. Events applied from history are not buffered. Events without a handler
     * change no state but are still counted and buffered.
     */
    public final void apply(Event event, boolean fromHistory) {
        requireNonNull(event, "Event cannot be null");
        eventHandlers().dispatch(this, event);
        version++;
        if (!fromHistory) {
            uncommittedEvents.add(event);
        }
    }

    /**
     * @return The events applied since the last commit, in order. The buffer is empty afterwards.
     */
    public final List<Event> commit() {
        List<Event> events = List.copyOf(uncommittedEvents);
        uncommittedEvents.clear();
        return events;
    }

    public final List<Event> uncommittedEvents() {
        return Collections.unmodifiableList(new ArrayList<>(uncommittedEvents));
    }

    public final boolean hasUncommittedEvents() {
        return !uncommittedEvents.isEmpty();
    }

    public final void loadFromHistory(Iterable<? extends Event> events) {
        loadFromHistory(events, null);
    }

    /**
     * Rebuild state from a snapshot and the events that follow it. The snapshot is only used when the aggregate
     * implements {@link SnapshotCapable}, its version becomes the version of the aggregate.
     *
     * @throws IllegalStateException If the aggregate has uncommitted events
     */
    @SuppressWarnings("unchecked")
    public final void loadFromHistory(Iterable<? extends Event> events, @Nullable AggregateSnapshot<?> snapshot) {
        requireNonNull(events, "Events cannot be null");
        if (hasUncommittedEvents()) {
            throw new IllegalStateException("Cannot load history into aggregate " + id + " since it has " + uncommittedEvents.size() + " uncommitted event(s)");
        }
        if (snapshot != null && this instanceof SnapshotCapable) {
            ((SnapshotCapable<Object>) this).loadSnapshot(snapshot.state);
            version = snapshot.version;
        }
        for (Event event : events) {
            apply(event, true);
        }
    }
}
