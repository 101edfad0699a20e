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

import org.jspecify.annotations.NullMarked;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * A globally unique, time-ordered event identifier backed by a version 7 UUID. The first 48 bits hold the creation
 * time in Unix epoch milliseconds, the next 12 bits hold a counter that keeps ids generated within the same
 * millisecond in order, and the remaining bits are random.
 * <p>
 * Ids generated by the same process are strictly increasing, even if the system clock is moved backwards.
 */
@NullMarked
public final class EventId implements Comparable<EventId> {
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int MAX_COUNTER = 0xFFF;

    private static long lastTimestamp = -1;
    private static int counter;

    private final UUID uuid;

    private EventId(UUID uuid) {
        this.uuid = uuid;
    }

    public static EventId generate() {
        final long timestamp;
        final int sequence;
        synchronized (EventId.class) {
            long now = System.currentTimeMillis();
            if (now > lastTimestamp) {
                lastTimestamp = now;
                // Start in the lower half so that there's room left for ids generated in the same millisecond
                counter = RANDOM.nextInt(MAX_COUNTER / 2);
            } else if (counter < MAX_COUNTER) {
                counter++;
            } else {
                lastTimestamp++;
                counter = 0;
            }
            timestamp = lastTimestamp;
            sequence = counter;
        }

        long mostSignificantBits = (timestamp << 16) | 0x7000L | sequence;
        long leastSignificantBits = (RANDOM.nextLong() & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
        return new EventId(new UUID(mostSignificantBits, leastSignificantBits));
    }

    /**
     * Parse an event id from its canonical textual form.
     *
     * @throws IllegalArgumentException If {@code value} is not a version 7 UUID.
     */
    public static EventId from(String value) {
        requireNonNull(value, "Event id cannot be null");
        UUID uuid = UUID.fromString(value);
        if (uuid.version() != 7) {
            throw new IllegalArgumentException("Event id must be a version 7 UUID but was version " + uuid.version() + ": " + value);
        }
        return new EventId(uuid);
    }

    /**
     * @return The instant (millisecond precision) at which this id was generated.
     */
    public Instant instant() {
        return Instant.ofEpochMilli(uuid.getMostSignificantBits() >>> 16);
    }

    public UUID toUUID() {
        return uuid;
    }

    @Override
    public int compareTo(EventId other) {
        int result = Long.compareUnsigned(uuid.getMostSignificantBits(), other.uuid.getMostSignificantBits());
        return result != 0 ? result : Long.compareUnsigned(uuid.getLeastSignificantBits(), other.uuid.getLeastSignificantBits());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventId)) return false;
        return uuid.equals(((EventId) o).uuid);
    }

    @Override
    public int hashCode() {
        return uuid.hashCode();
    }

    @Override
    public String toString() {
        return uuid.toString();
    }
}
