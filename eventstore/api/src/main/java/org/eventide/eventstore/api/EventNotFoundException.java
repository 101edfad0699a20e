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

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Thrown when a single event is requested by stream and version but no such event exists.
 */
public class EventNotFoundException extends RuntimeException {
    public final String streamId;
    public final long version;

    public EventNotFoundException(String streamId, long version) {
        super("Event with version " + version + " was not found in stream " + streamId);
        this.streamId = streamId;
        this.version = version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventNotFoundException)) return false;
        EventNotFoundException that = (EventNotFoundException) o;
        return version == that.version && Objects.equals(streamId, that.streamId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamId, version);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", EventNotFoundException.class.getSimpleName() + "[", "]")
                .add("streamId='" + streamId + "'")
                .add("version=" + version)
                .toString();
    }
}
