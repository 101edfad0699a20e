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

package org.eventide.event;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Thrown when the stream name derived for an aggregate type is empty or longer than
 * {@value EventStream#MAX_STREAM_NAME_LENGTH} characters.
 */
public class InvalidAggregateStreamNameException extends RuntimeException {
    public final Class<?> aggregateType;
    public final String streamName;

    public InvalidAggregateStreamNameException(Class<?> aggregateType, String streamName) {
        super(String.format("Invalid stream name '%s' for aggregate %s, a stream name must have between 1 and %d characters.", streamName, aggregateType.getName(), EventStream.MAX_STREAM_NAME_LENGTH));
        this.aggregateType = aggregateType;
        this.streamName = streamName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InvalidAggregateStreamNameException)) return false;
        InvalidAggregateStreamNameException that = (InvalidAggregateStreamNameException) o;
        return Objects.equals(aggregateType, that.aggregateType) && Objects.equals(streamName, that.streamName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateType, streamName);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", InvalidAggregateStreamNameException.class.getSimpleName() + "[", "]")
                .add("aggregateType=" + aggregateType.getName())
                .add("streamName='" + streamName + "'")
                .toString();
    }
}
