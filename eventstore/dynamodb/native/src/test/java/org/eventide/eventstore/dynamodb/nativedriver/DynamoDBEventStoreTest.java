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

package org.eventide.eventstore.dynamodb.nativedriver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventide.event.Event;
import org.eventide.eventmap.EventMap;
import org.eventide.eventstore.api.EventEnvelopeListener;
import org.eventide.eventstore.api.EventFilter;
import org.eventide.eventstore.api.EventStore;
import org.eventide.eventstore.api.EventStorePersistenceException;
import org.eventide.testsupport.domain.AccountCredited;
import org.eventide.testsupport.eventstore.AbstractEventStoreTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@Timeout(30)
@Testcontainers(disabledWithoutDocker = true)
class DynamoDBEventStoreTest extends AbstractEventStoreTest {

    @Container
    private static final GenericContainer<?> dynamoDBContainer = new GenericContainer<>("amazon/dynamodb-local:2.5.2").withExposedPorts(8000);

    private static DynamoDbClient dynamoDbClient() {
        return DynamoDbClient.builder()
                .endpointOverride(URI.create("http://" + dynamoDBContainer.getHost() + ":" + dynamoDBContainer.getMappedPort(8000)))
                .region(Region.EU_WEST_1)
                .credentialsProvider(StaticCredentialsProvider.create(AwsBasicCredentials.create("key", "secret")))
                .build();
    }

    @Override
    protected EventStore createEventStore(EventMap eventMap, EventEnvelopeListener listener) {
        return new DynamoDBEventStore(dynamoDbClient(), eventMap, new DynamoDBEventStoreConfig.Builder().tableNamePrefix("test-").build(), listener);
    }

    @Test
    void events_are_stored_as_items_keyed_by_stream_id_and_version() {
        // Given
        eventStore.appendEvents(stream, 2, accountHistory(2));

        // When
        Map<String, AttributeValue> item;
        try (DynamoDbClient client = dynamoDbClient()) {
            item = client.getItem(GetItemRequest.builder()
                    .tableName("test-events")
                    .key(Map.of("streamId", AttributeValue.builder().s(stream.streamId()).build(), "version", AttributeValue.builder().n("2").build()))
                    .build()).item();
        }

        // Then
        assertThat(item.get("event").s()).isEqualTo("account-credited");
        assertThat(item.get("payload").s()).contains("\"amount\":100");
        assertThat(item).doesNotContainKey("correlationId");
    }

    @Test
    void too_many_events_in_a_single_append_are_rejected() {
        // Given
        List<Event> events = LongStream.rangeClosed(1, DynamoDBEventStore.MAX_EVENTS_PER_APPEND + 1)
                .mapToObj(i -> new AccountCredited(stream.aggregateId(), i))
                .collect(Collectors.toList());

        // When
        Throwable throwable = catchThrowable(() -> eventStore.appendEvents(stream, events.size(), events));

        // Then
        assertThat(throwable).isExactlyInstanceOf(EventStorePersistenceException.class);
        assertThat(readAll(stream, EventFilter.filter())).isEmpty();
    }

    @Test
    void max_number_of_events_can_be_appended_after_existing_events() {
        // Given
        eventStore.appendEvents(stream, 1, accountHistory(1));
        List<Event> events = LongStream.rangeClosed(1, DynamoDBEventStore.MAX_EVENTS_PER_APPEND)
                .mapToObj(i -> new AccountCredited(stream.aggregateId(), i))
                .collect(Collectors.toList());

        // When
        eventStore.appendEvents(stream, 1 + events.size(), events);

        // Then
        assertThat(readAll(stream, EventFilter.filter())).hasSize(1 + DynamoDBEventStore.MAX_EVENTS_PER_APPEND);
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
        DynamoDBEventStore store = storeWith(objectMapper);

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
        DynamoDBEventStore store = storeWith(objectMapper);

        // When
        Throwable single = catchThrowable(() -> store.getEvent(stream, 1));
        Throwable batched = catchThrowable(() -> {
            try (Stream<List<Event>> events = store.getEvents(stream)) {
                events.forEach(batch -> {
                });
            }
        });

        // Then
        assertThat(single).isExactlyInstanceOf(EventStorePersistenceException.class).hasCauseInstanceOf(JsonProcessingException.class);
        assertThat(((EventStorePersistenceException) single).collection).isEqualTo("events");
        assertThat(batched).isExactlyInstanceOf(EventStorePersistenceException.class).hasCauseInstanceOf(JsonProcessingException.class);
        assertThat(((EventStorePersistenceException) batched).collection).isEqualTo("events");
    }

    private DynamoDBEventStore storeWith(ObjectMapper objectMapper) {
        return new DynamoDBEventStore(dynamoDbClient(), eventMap, new DynamoDBEventStoreConfig.Builder().tableNamePrefix("test-").objectMapper(objectMapper).build(), (collection, eventStream, envelopes) -> {
        });
    }
}
