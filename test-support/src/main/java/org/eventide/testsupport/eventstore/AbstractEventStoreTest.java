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

package org.eventide.testsupport.eventstore;

import org.eventide.event.Event;
import org.eventide.event.EventEnvelope;
import org.eventide.event.EventStream;
import org.eventide.eventmap.EventMap;
import org.eventide.eventmap.UnregisteredEventException;
import org.eventide.eventstore.api.AppendOptions;
import org.eventide.eventstore.api.EventEnvelopeListener;
import org.eventide.eventstore.api.EventFilter;
import org.eventide.eventstore.api.EventNotFoundException;
import org.eventide.eventstore.api.EventStore;
import org.eventide.eventstore.api.EventStorePersistenceException;
import org.eventide.eventstore.api.StreamVersionConflictException;
import org.eventide.testsupport.domain.AccountClosed;
import org.eventide.testsupport.domain.AccountCredited;
import org.eventide.testsupport.domain.AccountDebited;
import org.eventide.testsupport.domain.AccountEvents;
import org.eventide.testsupport.domain.AccountOpened;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CyclicBarrier;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import java.util.stream.Stream;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.awaitility.Awaitility.await;
import static org.eventide.eventstore.api.StreamReadingDirection.BACKWARD;

/**
 * Behaviour that every {@link EventStore} backend must have. Backend tests extend this class and create the store
 * in {@link #createEventStore(EventMap, EventEnvelopeListener)}.
 */
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
public abstract class AbstractEventStoreTest {

    protected EventStore eventStore;
    protected EventMap eventMap;
    protected List<EventEnvelope> published;
    protected EventStream stream;

    protected abstract EventStore createEventStore(EventMap eventMap, EventEnvelopeListener listener);

    @BeforeEach
    void create_and_start_event_store() {
        eventMap = AccountEvents.eventMap();
        published = new CopyOnWriteArrayList<>();
        eventStore = createEventStore(eventMap, (collection, stream, envelopes) -> published.addAll(envelopes));
        eventStore.start();
        stream = EventStream.of("account", UUID.randomUUID().toString());
    }

    @AfterEach
    void stop_event_store() {
        eventStore.stop();
    }

    @Test
    void start_provisions_the_default_collection_and_can_be_called_more_than_once() {
        assertThat(eventStore.start()).isEqualTo("events");
        assertThat(eventStore.ensureCollection(null)).isEqualTo("events");
        assertThat(eventStore.ensureCollection("tenant")).isEqualTo("tenant-events");
        assertThat(eventStore.ensureCollection("tenant")).isEqualTo("tenant-events");
    }

    @Test
    void appended_events_get_consecutive_versions_ending_at_the_expected_aggregate_version() {
        // When
        List<EventEnvelope> envelopes = eventStore.appendEvents(stream, 3, accountHistory(3));

        // Then
        assertThat(envelopes).extracting(EventEnvelope::version).containsExactly(1L, 2L, 3L);
        assertThat(envelopes).extracting(envelope -> envelope.event).containsExactly("account-opened", "account-credited", "account-debited");
        assertThat(envelopes).extracting(envelope -> envelope.metadata.aggregateId).containsOnly(stream.aggregateId());
        assertThat(envelopes).extracting(EventEnvelope::eventId).doesNotHaveDuplicates().isSorted();
    }

    @Test
    void appended_events_are_read_back_in_version_order() {
        // Given
        List<Event> history = accountHistory(4);

        // When
        eventStore.appendEvents(stream, 2, history.subList(0, 2));
        eventStore.appendEvents(stream, 4, history.subList(2, 4));

        // Then
        assertThat(readAll(stream, EventFilter.filter())).containsExactlyElementsOf(history);
        assertThat(readAllEnvelopes(stream, EventFilter.filter())).extracting(EventEnvelope::version).containsExactly(1L, 2L, 3L, 4L);
    }

    @Test
    void appending_an_empty_list_of_events_writes_nothing() {
        // When
        List<EventEnvelope> envelopes = eventStore.appendEvents(stream, 0, List.of());

        // Then
        assertThat(envelopes).isEmpty();
        assertThat(readAll(stream, EventFilter.filter())).isEmpty();
        assertThat(published).isEmpty();
    }

    @Test
    void expected_aggregate_version_less_than_the_number_of_events_is_rejected() {
        // When
        Throwable throwable = catchThrowable(() -> eventStore.appendEvents(stream, 1, accountHistory(2)));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
        assertThat(readAll(stream, EventFilter.filter())).isEmpty();
    }

    @Test
    void single_event_and_envelope_can_be_read_by_version() {
        // Given
        List<Event> history = accountHistory(3);
        List<EventEnvelope> envelopes = eventStore.appendEvents(stream, 3, history, AppendOptions.options().correlationId("correlation").causationId("cause"));

        // When
        Event event = eventStore.getEvent(stream, 2);
        EventEnvelope envelope = eventStore.getEnvelope(stream, 3);

        // Then
        assertThat(event).isEqualTo(history.get(1));
        assertThat(envelope.event).isEqualTo("account-debited");
        assertThat(envelope.metadata.eventId).isEqualTo(envelopes.get(2).metadata.eventId);
        assertThat(envelope.metadata.occurredOn.truncatedTo(ChronoUnit.MILLIS)).isEqualTo(envelopes.get(2).metadata.occurredOn.truncatedTo(ChronoUnit.MILLIS));
        assertThat(envelope.metadata.correlationId).isEqualTo("correlation");
        assertThat(envelope.metadata.causationId).isEqualTo("cause");
    }

    @Test
    void reading_a_version_that_does_not_exist_throws_event_not_found_exception() {
        // Given
        eventStore.appendEvents(stream, 1, accountHistory(1));

        // When
        Throwable throwable = catchThrowable(() -> eventStore.getEvent(stream, 2));

        // Then
        assertThat(throwable).isEqualTo(new EventNotFoundException(stream.streamId(), 2));
    }

    @Test
    void reading_a_stream_without_events_returns_no_batches() {
        try (Stream<List<Event>> batches = eventStore.getEvents(EventStream.of("account", "does-not-exist"))) {
            assertThat(batches).isEmpty();
        }
    }

    @Test
    void appending_with_a_stale_expected_version_throws_stream_version_conflict_and_writes_nothing() {
        // Given
        List<Event> history = accountHistory(3);
        eventStore.appendEvents(stream, 2, history.subList(0, 2));

        // When
        Throwable throwable = catchThrowable(() -> eventStore.appendEvents(stream, 2, List.of(new AccountCredited(stream.aggregateId(), 5))));

        // Then
        assertThat(throwable).isInstanceOf(StreamVersionConflictException.class);
        StreamVersionConflictException conflict = (StreamVersionConflictException) throwable;
        assertThat(conflict.streamId).isEqualTo(stream.streamId());
        assertThat(conflict.collection).isEqualTo("events");
        assertThat(readAll(stream, EventFilter.filter())).containsExactlyElementsOf(history.subList(0, 2));
    }

    @Test
    void appending_beyond_the_end_of_the_stream_throws_stream_version_conflict() {
        // Given
        eventStore.appendEvents(stream, 1, accountHistory(1));

        // When
        Throwable throwable = catchThrowable(() -> eventStore.appendEvents(stream, 4, List.of(new AccountCredited(stream.aggregateId(), 5))));

        // Then
        assertThat(throwable).isInstanceOf(StreamVersionConflictException.class);
        assertThat(readAll(stream, EventFilter.filter())).hasSize(1);
    }

    @Test
    void only_one_of_two_concurrent_writers_with_the_same_expected_version_succeeds() throws Exception {
        // Given
        eventStore.appendEvents(stream, 1, accountHistory(1));
        CyclicBarrier barrier = new CyclicBarrier(2);
        List<Object> results = new CopyOnWriteArrayList<>();

        // When
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            long amount = i + 1;
            Thread thread = new Thread(() -> {
                try {
                    barrier.await();
                    results.add(eventStore.appendEvents(stream, 2, List.of(new AccountCredited(stream.aggregateId(), amount))));
                } catch (Exception e) {
                    results.add(e);
                }
            });
            thread.start();
            threads.add(thread);
        }
        await().atMost(10, SECONDS).until(() -> results.size() == 2);
        for (Thread thread : threads) {
            thread.join();
        }

        // Then
        assertThat(results).filteredOn(result -> result instanceof List).hasSize(1);
        assertThat(results).filteredOn(result -> result instanceof StreamVersionConflictException).hasSize(1);
        assertThat(readAllEnvelopes(stream, EventFilter.filter())).extracting(EventEnvelope::version).containsExactly(1L, 2L);
    }

    @Test
    void backward_reading_returns_newest_first_and_from_version_is_a_lower_bound() {
        // Given
        eventStore.appendEvents(stream, 6, accountHistory(6));

        // When
        List<EventEnvelope> envelopes = readAllEnvelopes(stream, EventFilter.filter().direction(BACKWARD).fromVersion(4));

        // Then
        assertThat(envelopes).extracting(EventEnvelope::version).containsExactly(6L, 5L, 4L);
    }

    @Test
    void forward_reading_starts_at_from_version() {
        // Given
        eventStore.appendEvents(stream, 6, accountHistory(6));

        // When
        List<EventEnvelope> envelopes = readAllEnvelopes(stream, EventFilter.filter().fromVersion(4));

        // Then
        assertThat(envelopes).extracting(EventEnvelope::version).containsExactly(4L, 5L, 6L);
    }

    @Test
    void events_are_returned_in_full_batches_except_the_last() {
        // Given
        eventStore.appendEvents(stream, 7, accountHistory(7));

        // When
        List<Integer> batchSizes;
        try (Stream<List<Event>> batches = eventStore.getEvents(stream, EventFilter.filter().batch(3))) {
            batchSizes = batches.map(List::size).collect(Collectors.toList());
        }

        // Then
        assertThat(batchSizes).containsExactly(3, 3, 1);
    }

    @Test
    void limit_caps_the_number_of_events_read() {
        // Given
        eventStore.appendEvents(stream, 7, accountHistory(7));

        // When
        List<List<EventEnvelope>> batches;
        try (Stream<List<EventEnvelope>> envelopes = eventStore.getEnvelopes(stream, EventFilter.filter().limit(5).batch(2).direction(BACKWARD))) {
            batches = envelopes.collect(Collectors.toList());
        }

        // Then
        assertThat(batches).extracting(List::size).containsExactly(2, 2, 1);
        assertThat(batches.stream().flatMap(List::stream)).extracting(EventEnvelope::version).containsExactly(7L, 6L, 5L, 4L, 3L);
    }

    @Test
    void closing_a_partially_consumed_read_releases_it() {
        // Given
        eventStore.appendEvents(stream, 5, accountHistory(5));

        // When
        try (Stream<List<Event>> batches = eventStore.getEvents(stream, EventFilter.filter().batch(2))) {
            assertThat(batches.findFirst()).hasValueSatisfying(batch -> assertThat(batch).hasSize(2));
        }

        // Then
        assertThat(readAll(stream, EventFilter.filter())).hasSize(5);
    }

    @Test
    void pools_are_isolated_from_each_other() {
        // Given
        eventStore.ensureCollection("tenant");

        // When
        eventStore.appendEvents(stream, 2, accountHistory(2), "tenant");

        // Then
        assertThat(readAll(stream, EventFilter.filter().pool("tenant"))).hasSize(2);
        assertThat(readAll(stream, EventFilter.filter())).isEmpty();
        assertThat(eventStore.getEvent(stream, 1, "tenant")).isInstanceOf(AccountOpened.class);
    }

    @Test
    void appending_to_a_pool_that_has_not_been_provisioned_throws_persistence_exception() {
        // When
        Throwable throwable = catchThrowable(() -> eventStore.appendEvents(stream, 1, accountHistory(1), "not-a-pool"));

        // Then
        assertThat(throwable).isInstanceOf(EventStorePersistenceException.class).isNotInstanceOf(StreamVersionConflictException.class);
        assertThat(((EventStorePersistenceException) throwable).collection).isEqualTo("not-a-pool-events");
        assertThat(published).isEmpty();
    }

    @Test
    void streams_are_independent_of_each_other() {
        // Given
        EventStream other = EventStream.of("account", UUID.randomUUID().toString());

        // When
        eventStore.appendEvents(stream, 2, accountHistory(2));
        eventStore.appendEvents(other, 1, List.of(new AccountOpened(other.aggregateId(), "Jane Doe", Instant.now())));

        // Then
        assertThat(readAll(stream, EventFilter.filter())).hasSize(2);
        assertThat(readAll(other, EventFilter.filter())).hasSize(1);
    }

    @Test
    void appended_envelopes_are_published_to_the_listener() {
        // When
        List<EventEnvelope> envelopes = eventStore.appendEvents(stream, 2, accountHistory(2));

        // Then
        assertThat(published).containsExactlyElementsOf(envelopes);
    }

    @Test
    void appending_an_unregistered_event_throws_unregistered_event_exception_and_writes_nothing() {
        // When
        Throwable throwable = catchThrowable(() -> eventStore.appendEvents(stream, 1, List.of(new Event() {
        })));

        // Then
        assertThat(throwable).isExactlyInstanceOf(UnregisteredEventException.class);
        assertThat(readAll(stream, EventFilter.filter())).isEmpty();
    }

    /**
     * @return An account history of {@code numberOfEvents} events: opened, then alternating credits and debits, closed last if there are more than five events.
     */
    protected List<Event> accountHistory(int numberOfEvents) {
        String accountId = stream.aggregateId();
        List<Event> events = new ArrayList<>();
        events.add(new AccountOpened(accountId, "John Doe", Instant.parse("2024-01-02T10:15:30.123Z")));
        LongStream.range(1, numberOfEvents).forEach(i -> {
            if (numberOfEvents > 5 && i == numberOfEvents - 1) {
                events.add(new AccountClosed(accountId, "customer request"));
            } else if (i % 2 == 1) {
                events.add(new AccountCredited(accountId, i * 100));
            } else {
                events.add(new AccountDebited(accountId, i * 10));
            }
        });
        return events;
    }

    protected List<Event> readAll(EventStream stream, EventFilter filter) {
        try (Stream<List<Event>> batches = eventStore.getEvents(stream, filter)) {
            return batches.flatMap(List::stream).collect(Collectors.toList());
        }
    }

    protected List<EventEnvelope> readAllEnvelopes(EventStream stream, EventFilter filter) {
        try (Stream<List<EventEnvelope>> batches = eventStore.getEnvelopes(stream, filter)) {
            return batches.flatMap(List::stream).collect(Collectors.toList());
        }
    }
}
