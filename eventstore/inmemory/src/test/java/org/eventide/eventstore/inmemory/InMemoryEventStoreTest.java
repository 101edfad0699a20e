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

package org.eventide.eventstore.inmemory;

import org.eventide.event.EventEnvelope;
import org.eventide.eventmap.EventMap;
import org.eventide.eventstore.api.EventEnvelopeListener;
import org.eventide.eventstore.api.EventFilter;
import org.eventide.eventstore.api.EventStore;
import org.eventide.testsupport.eventstore.AbstractEventStoreTest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryEventStoreTest extends AbstractEventStoreTest {

    @Override
    protected EventStore createEventStore(EventMap eventMap, EventEnvelopeListener listener) {
        return new InMemoryEventStore(eventMap, listener);
    }

    @Test
    void failing_listener_does_not_fail_the_append() {
        // Given
        EventStore store = new InMemoryEventStore(eventMap, (collection, stream, envelopes) -> {
            throw new IllegalStateException("listener failed");
        });
        store.start();

        // When
        List<EventEnvelope> envelopes = store.appendEvents(stream, 2, accountHistory(2));

        // Then
        assertThat(envelopes).hasSize(2);
        assertThat(store.getEnvelope(stream, 2)).isEqualTo(envelopes.get(1));
    }

    @Test
    void stored_envelopes_are_returned_as_written() {
        // Given
        List<EventEnvelope> envelopes = eventStore.appendEvents(stream, 3, accountHistory(3));

        // When
        List<EventEnvelope> read = readAllEnvelopes(stream, EventFilter.filter());

        // Then
        assertThat(read).containsExactlyElementsOf(envelopes);
    }
}
