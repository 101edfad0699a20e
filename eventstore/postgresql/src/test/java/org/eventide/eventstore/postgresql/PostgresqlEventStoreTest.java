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

package org.eventide.eventstore.postgresql;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventide.event.Event;
import org.eventide.eventmap.EventMap;
import org.eventide.eventstore.api.EventEnvelopeListener;
import org.eventide.eventstore.api.EventFilter;
import org.eventide.eventstore.api.EventStore;
import org.eventide.eventstore.api.EventStorePersistenceException;
import org.eventide.testsupport.eventstore.AbstractEventStoreTest;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@Timeout(20)
@Testcontainers(disabledWithoutDocker = true)
class PostgresqlEventStoreTest extends AbstractEventStoreTest {

    @Container
    private static final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:16-alpine");

    private static Jdbi jdbi() {
        return Jdbi.create(postgreSQLContainer.getJdbcUrl(), postgreSQLContainer.getUsername(), postgreSQLContainer.getPassword());
    }

    @Override
    protected EventStore createEventStore(EventMap eventMap, EventEnvelopeListener listener) {
        return new PostgresqlEventStore(jdbi(), eventMap, new PostgresqlEventStoreConfig.Builder().queryFetchSize(2).build(), listener);
    }

    @Test
    void payload_is_stored_as_jsonb() {
        // Given
        eventStore.appendEvents(stream, 2, accountHistory(2));

        // When
        String payloadType = jdbi().withHandle(handle -> handle.createQuery("SELECT jsonb_typeof(payload) FROM \"events\" WHERE stream_id = :streamId AND version = 2")
                .bind("streamId", stream.streamId())
                .mapTo(String.class)
                .one());
        Long amount = jdbi().withHandle(handle -> handle.createQuery("SELECT (payload ->> 'amount')::BIGINT FROM \"events\" WHERE stream_id = :streamId AND version = 2")
                .bind("streamId", stream.streamId())
                .mapTo(Long.class)
                .one());

        // Then
        assertThat(payloadType).isEqualTo("object");
        assertThat(amount).isEqualTo(100L);
    }

    @Test
    void each_pool_gets_its_own_table() {
        // When
        eventStore.ensureCollection("reporting");

        // Then
        List<String> tables = jdbi().withHandle(handle -> handle.createQuery("SELECT table_name FROM information_schema.tables WHERE table_schema = 'public'")
                .mapTo(String.class)
                .list());
        assertThat(tables).contains("events", "reporting-events");
    }

    @Test
    void payload_that_cannot_be_written_as_json_is_reported_as_a_persistence_exception() {
        // Given
        ObjectMapper objectMapper = new ObjectMapper() {
            @Override
            public String writeValueAsString(Object value) throws JsonProcessingException {
                throw new JsonProcessingException("cannot write payload") {
                };
            }
        };
        PostgresqlEventStore store = new PostgresqlEventStore(jdbi(), eventMap, new PostgresqlEventStoreConfig.Builder().objectMapper(objectMapper).build(), (collection, eventStream, envelopes) -> {
        });

        // When
        Throwable throwable = catchThrowable(() -> store.appendEvents(stream, 2, accountHistory(2)));

        // Then
        assertThat(throwable).isExactlyInstanceOf(EventStorePersistenceException.class).hasCauseInstanceOf(JsonProcessingException.class);
        assertThat(((EventStorePersistenceException) throwable).collection).isEqualTo("events");
        assertThat(readAll(stream, EventFilter.filter())).isEmpty();
    }

    @Test
    void payload_that_cannot_be_read_from_json_is_reported_as_a_persistence_exception() {
        // Given
        eventStore.appendEvents(stream, 1, accountHistory(1));
        ObjectMapper objectMapper = new ObjectMapper() {
            @Override
            public <T> T readValue(String content, TypeReference<T> valueTypeRef) throws JsonProcessingException {
                throw new JsonProcessingException("cannot read payload") {
                };
            }
        };
        PostgresqlEventStore store = new PostgresqlEventStore(jdbi(), eventMap, new PostgresqlEventStoreConfig.Builder().objectMapper(objectMapper).build(), (collection, eventStream, envelopes) -> {
        });

        // When
        Throwable single = catchThrowable(() -> store.getEvent(stream, 1));
        Throwable batched = catchThrowable(() -> {
            try (Stream<List<Event>> events = store.getEvents(stream)) {
                events.forEach(batch -> {
                });
            }
        });

        // Then
        assertThat(single).isExactlyInstanceOf(EventStorePersistenceException.class);
        assertThat(((EventStorePersistenceException) single).collection).isEqualTo("events");
        assertThat(batched).isExactlyInstanceOf(EventStorePersistenceException.class);
        assertThat(((EventStorePersistenceException) batched).collection).isEqualTo("events");
    }
}
