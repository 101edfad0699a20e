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
import org.eventide.event.EventEnvelope;
import org.eventide.event.EventId;
import org.eventide.event.EventMetadata;
import org.eventide.event.EventStream;
import org.eventide.eventmap.EventMap;
import org.eventide.eventstore.api.AbstractEventStore;
import org.eventide.eventstore.api.EventCollection;
import org.eventide.eventstore.api.EventEnvelopeListener;
import org.eventide.eventstore.api.EventFilter;
import org.eventide.eventstore.api.EventStoreDriver;
import org.eventide.eventstore.api.EventStorePersistenceException;
import org.eventide.eventstore.api.StreamVersionConflictException;
import org.eventide.eventstore.api.internal.CloseableIterator;
import org.eventide.eventstore.api.internal.EventBatches;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.ConditionCheck;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.Put;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * An event store that stores events in DynamoDB using the AWS SDK v2. Each pool is stored in its own table with the
 * stream id as partition key and the version as sort key, so the (stream, version) pair is unique by construction.
 * <p>
 * DynamoDB can't read and write in the same transaction, so appends are written with {@code TransactWriteItems} where every
 * new version must not exist yet and the version just before the first new one must exist. Since versions are gap free this
 * is the same as requiring that the stream is at the expected version. A single append can hold at most
 * {@value #MAX_EVENTS_PER_APPEND} events.
 */
public class DynamoDBEventStore extends AbstractEventStore {
    private static final Logger log = LoggerFactory.getLogger(DynamoDBEventStore.class);

    public static final int MAX_EVENTS_PER_APPEND = 99;

    static final String ATTRIBUTE_STREAM_ID = "streamId";
    static final String ATTRIBUTE_VERSION = "version";
    static final String ATTRIBUTE_EVENT = "event";
    static final String ATTRIBUTE_PAYLOAD = "payload";
    static final String ATTRIBUTE_EVENT_ID = "eventId";
    static final String ATTRIBUTE_AGGREGATE_ID = "aggregateId";
    static final String ATTRIBUTE_OCCURRED_ON = "occurredOn";
    static final String ATTRIBUTE_CORRELATION_ID = "correlationId";
    static final String ATTRIBUTE_CAUSATION_ID = "causationId";

    private static final Map<String, String> KEY_ATTRIBUTE_NAMES = Map.of("#stream", ATTRIBUTE_STREAM_ID, "#version", ATTRIBUTE_VERSION);
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<Map<String, Object>>() {
    };
    private static final Set<String> CONFLICT_REASONS = Set.of("ConditionalCheckFailed", "TransactionConflict");

    private final DynamoDbClient dynamoDB;
    private final DynamoDBEventStoreConfig config;

    public DynamoDBEventStore(DynamoDbClient dynamoDB, EventMap eventMap, DynamoDBEventStoreConfig config) {
        this(dynamoDB, eventMap, config, EventEnvelopeListener.NOOP);
    }

    public DynamoDBEventStore(DynamoDbClient dynamoDB, EventMap eventMap, DynamoDBEventStoreConfig config, EventEnvelopeListener listener) {
        super(eventMap, listener);
        this.dynamoDB = requireNonNull(dynamoDB, DynamoDbClient.class.getSimpleName() + " cannot be null");
        this.config = requireNonNull(config, DynamoDBEventStoreConfig.class.getSimpleName() + " cannot be null");
    }

    /**
     * @return An {@link EventStoreDriver} that creates {@link DynamoDBEventStore}s sharing {@code dynamoDB}
     */
    public static EventStoreDriver driver(DynamoDbClient dynamoDB, DynamoDBEventStoreConfig config) {
        return eventMap -> new DynamoDBEventStore(dynamoDB, eventMap, config);
    }

    @Override
    public String ensureCollection(@Nullable String pool) {
        String collection = EventCollection.get(pool);
        String tableName = config.tableName(collection);
        try {
            dynamoDB.createTable(CreateTableRequest.builder()
                    .tableName(tableName)
                    .keySchema(
                            KeySchemaElement.builder().attributeName(ATTRIBUTE_STREAM_ID).keyType(KeyType.HASH).build(),
                            KeySchemaElement.builder().attributeName(ATTRIBUTE_VERSION).keyType(KeyType.RANGE).build())
                    .attributeDefinitions(
                            AttributeDefinition.builder().attributeName(ATTRIBUTE_STREAM_ID).attributeType(ScalarAttributeType.S).build(),
                            AttributeDefinition.builder().attributeName(ATTRIBUTE_VERSION).attributeType(ScalarAttributeType.N).build())
                    .billingMode(BillingMode.PAY_PER_REQUEST)
                    .build());
            log.info("Created event table {}", tableName);
        } catch (ResourceInUseException e) {
            log.debug("Event table {} already exists", tableName);
        } catch (SdkException e) {
            throw new EventStorePersistenceException(collection, "Failed to provision event table " + tableName, e);
        }

        try {
            dynamoDB.waiter().waitUntilTableExists(DescribeTableRequest.builder().tableName(tableName).build());
        } catch (SdkException e) {
            throw new EventStorePersistenceException(collection, "Event table " + tableName + " didn't become available", e);
        }
        return collection;
    }

    @Override
    protected void writeEnvelopes(String collection, EventStream stream, long currentVersion, List<EventEnvelope> envelopes) {
        if (envelopes.size() > MAX_EVENTS_PER_APPEND) {
            throw new EventStorePersistenceException(collection, String.format("Cannot append %d events at once, at most %d events can be appended in a single transaction", envelopes.size(), MAX_EVENTS_PER_APPEND));
        }
        String tableName = config.tableName(collection);
        String streamId = stream.streamId();

        List<TransactWriteItem> items = new ArrayList<>(envelopes.size() + 1);
        if (currentVersion > 0) {
            items.add(TransactWriteItem.builder().conditionCheck(ConditionCheck.builder()
                    .tableName(tableName)
                    .key(key(streamId, currentVersion))
                    .conditionExpression("attribute_exists(#version)")
                    .expressionAttributeNames(Map.of("#version", ATTRIBUTE_VERSION))
                    .build()).build());
        }
        for (EventEnvelope envelope : envelopes) {
            items.add(TransactWriteItem.builder().put(Put.builder()
                    .tableName(tableName)
                    .item(toItem(collection, streamId, envelope))
                    .conditionExpression("attribute_not_exists(#version)")
                    .expressionAttributeNames(Map.of("#version", ATTRIBUTE_VERSION))
                    .build()).build());
        }

        try {
            dynamoDB.transactWriteItems(TransactWriteItemsRequest.builder().transactItems(items).build());
        } catch (TransactionCanceledException e) {
            if (e.hasCancellationReasons() && e.cancellationReasons().stream().anyMatch(reason -> CONFLICT_REASONS.contains(reason.code()))) {
                throw new StreamVersionConflictException(collection, streamId, currentVersion, null, e);
            }
            throw new EventStorePersistenceException(collection, e);
        } catch (ResourceNotFoundException e) {
            throw new EventStorePersistenceException(collection, "Event table " + tableName + " doesn't exist, make sure that the pool has been provisioned with ensureCollection", e);
        } catch (SdkException e) {
            throw new EventStorePersistenceException(collection, e);
        }
    }

    @Override
    protected Optional<EventEnvelope> readEnvelope(String collection, EventStream stream, long version) {
        try {
            Map<String, AttributeValue> item = dynamoDB.getItem(GetItemRequest.builder()
                    .tableName(config.tableName(collection))
                    .key(key(stream.streamId(), version))
                    .consistentRead(true)
                    .build()).item();
            return item == null || item.isEmpty() ? Optional.empty() : Optional.of(toEnvelope(collection, item));
        } catch (SdkException e) {
            throw new EventStorePersistenceException(collection, "Failed to read event from table " + config.tableName(collection), e);
        }
    }

    @Override
    protected Stream<List<EventEnvelope>> readEnvelopes(String collection, EventStream stream, EventFilter filter) {
        return EventBatches.batched(collection, () -> {
            QueryRequest query = QueryRequest.builder()
                    .tableName(config.tableName(collection))
                    .keyConditionExpression("#stream = :streamId AND #version >= :fromVersion")
                    .expressionAttributeNames(KEY_ATTRIBUTE_NAMES)
                    .expressionAttributeValues(Map.of(
                            ":streamId", AttributeValue.builder().s(stream.streamId()).build(),
                            ":fromVersion", number(filter.fromVersion)))
                    .scanIndexForward(filter.isForward())
                    .consistentRead(true)
                    .limit(filter.batch)
                    .build();
            Iterator<Map<String, AttributeValue>> items = dynamoDB.queryPaginator(query).items().iterator();
            return CloseableIterator.of(items, () -> {
            }).map(item -> toEnvelope(collection, item));
        }, filter.batch, filter.limit);
    }

    private Map<String, AttributeValue> toItem(String collection, String streamId, EventEnvelope envelope) {
        EventMetadata metadata = envelope.metadata;
        Map<String, AttributeValue> item = new HashMap<>();
        item.put(ATTRIBUTE_STREAM_ID, AttributeValue.builder().s(streamId).build());
        item.put(ATTRIBUTE_VERSION, number(metadata.version));
        item.put(ATTRIBUTE_EVENT, AttributeValue.builder().s(envelope.event).build());
        item.put(ATTRIBUTE_PAYLOAD, AttributeValue.builder().s(writePayload(collection, envelope)).build());
        item.put(ATTRIBUTE_EVENT_ID, AttributeValue.builder().s(metadata.eventId.toString()).build());
        item.put(ATTRIBUTE_AGGREGATE_ID, AttributeValue.builder().s(metadata.aggregateId).build());
        item.put(ATTRIBUTE_OCCURRED_ON, number(metadata.occurredOn.toEpochMilli()));
        if (metadata.correlationId != null) {
            item.put(ATTRIBUTE_CORRELATION_ID, AttributeValue.builder().s(metadata.correlationId).build());
        }
        if (metadata.causationId != null) {
            item.put(ATTRIBUTE_CAUSATION_ID, AttributeValue.builder().s(metadata.causationId).build());
        }
        return item;
    }

    private EventEnvelope toEnvelope(String collection, Map<String, AttributeValue> item) {
        EventMetadata metadata = new EventMetadata(
                EventId.from(item.get(ATTRIBUTE_EVENT_ID).s()),
                item.get(ATTRIBUTE_AGGREGATE_ID).s(),
                Long.parseLong(item.get(ATTRIBUTE_VERSION).n()),
                Instant.ofEpochMilli(Long.parseLong(item.get(ATTRIBUTE_OCCURRED_ON).n())),
                stringOrNull(item.get(ATTRIBUTE_CORRELATION_ID)),
                stringOrNull(item.get(ATTRIBUTE_CAUSATION_ID)));
        return EventEnvelope.from(item.get(ATTRIBUTE_EVENT).s(), readPayload(collection, item.get(ATTRIBUTE_PAYLOAD).s()), metadata);
    }

    private String writePayload(String collection, EventEnvelope envelope) {
        try {
            return config.objectMapper.writeValueAsString(envelope.payload);
        } catch (JsonProcessingException e) {
            throw new EventStorePersistenceException(collection, "Failed to write payload of event " + envelope.event + " as JSON", e);
        }
    }

    private Map<String, Object> readPayload(String collection, String json) {
        try {
            return config.objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new EventStorePersistenceException(collection, "Failed to read event payload from table " + config.tableName(collection), e);
        }
    }

    private static Map<String, AttributeValue> key(String streamId, long version) {
        return Map.of(ATTRIBUTE_STREAM_ID, AttributeValue.builder().s(streamId).build(), ATTRIBUTE_VERSION, number(version));
    }

    private static AttributeValue number(long value) {
        return AttributeValue.builder().n(Long.toString(value)).build();
    }

    private static @Nullable String stringOrNull(@Nullable AttributeValue value) {
        return value == null ? null : value.s();
    }
}
