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

package org.eventide.eventstore.mongodb.nativedriver;

import com.mongodb.ConnectionString;
import com.mongodb.MongoException;
import com.mongodb.client.ClientSession;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.eventide.event.EventEnvelope;
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
import org.eventide.eventstore.mongodb.nativedriver.internal.EventEnvelopeDocumentMapper;
import org.eventide.eventstore.mongodb.nativedriver.internal.MongoExceptionTranslator.WriteContext;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.gte;
import static com.mongodb.client.model.Projections.include;
import static com.mongodb.client.model.Sorts.ascending;
import static com.mongodb.client.model.Sorts.descending;
import static java.util.Objects.requireNonNull;
import static org.eventide.eventstore.mongodb.nativedriver.internal.EventEnvelopeDocumentMapper.STREAM_ID;
import static org.eventide.eventstore.mongodb.nativedriver.internal.EventEnvelopeDocumentMapper.VERSION;
import static org.eventide.eventstore.mongodb.nativedriver.internal.MongoExceptionTranslator.translateException;

/**
 * An event store that stores events in MongoDB using the synchronous java driver. Each pool is stored in its own
 * collection with a unique index on (streamId, version).
 * <p>
 * Events are appended in a transaction that first verifies the current version of the stream, so MongoDB must run as a
 * replica set. The unique index makes sure that two writers can never both write the same version, even if they
 * happen to pass the version check at the same time.
 */
public class MongoEventStore extends AbstractEventStore {
    private static final Logger log = LoggerFactory.getLogger(MongoEventStore.class);

    private final MongoClient mongoClient;
    private final boolean ownsMongoClient;
    private final MongoDatabase database;
    private final MongoEventStoreConfig config;
    private final Set<String> provisionedCollections = ConcurrentHashMap.newKeySet();

    /**
     * Create a {@link MongoEventStore} that uses an existing {@link MongoClient}. The client is not closed by {@link #stop()}.
     */
    public MongoEventStore(MongoClient mongoClient, EventMap eventMap, MongoEventStoreConfig config) {
        this(mongoClient, false, eventMap, config, EventEnvelopeListener.NOOP);
    }

    public MongoEventStore(MongoClient mongoClient, EventMap eventMap, MongoEventStoreConfig config, EventEnvelopeListener listener) {
        this(mongoClient, false, eventMap, config, listener);
    }

    /**
     * Create a {@link MongoEventStore} that connects to {@code connectionString}. The connection is closed by {@link #stop()}.
     */
    public MongoEventStore(ConnectionString connectionString, EventMap eventMap, MongoEventStoreConfig config, EventEnvelopeListener listener) {
        this(MongoClients.create(requireNonNull(connectionString, ConnectionString.class.getSimpleName() + " cannot be null")), true, eventMap, config, listener);
    }

    private MongoEventStore(MongoClient mongoClient, boolean ownsMongoClient, EventMap eventMap, MongoEventStoreConfig config, EventEnvelopeListener listener) {
        super(eventMap, listener);
        requireNonNull(mongoClient, "Mongo client cannot be null");
        requireNonNull(config, MongoEventStoreConfig.class.getSimpleName() + " cannot be null");
        this.mongoClient = mongoClient;
        this.ownsMongoClient = ownsMongoClient;
        this.config = config;
        this.database = mongoClient.getDatabase(config.databaseName);
    }

    /**
     * @return An {@link EventStoreDriver} that creates {@link MongoEventStore}s sharing {@code mongoClient}
     */
    public static EventStoreDriver driver(MongoClient mongoClient, MongoEventStoreConfig config) {
        return eventMap -> new MongoEventStore(mongoClient, eventMap, config);
    }

    @Override
    public String ensureCollection(@Nullable String pool) {
        String collectionName = EventCollection.get(pool);
        try {
            if (!collectionExists(collectionName)) {
                log.info("Creating event collection {} in database {}", collectionName, database.getName());
                database.createCollection(collectionName);
            }
            database.getCollection(collectionName).createIndex(Indexes.compoundIndex(Indexes.ascending(STREAM_ID), Indexes.ascending(VERSION)), new IndexOptions().unique(true));
        } catch (MongoException e) {
            throw new EventStorePersistenceException(collectionName, "Failed to provision event collection " + collectionName, e);
        }
        provisionedCollections.add(collectionName);
        return collectionName;
    }

    @Override
    public void stop() {
        if (ownsMongoClient) {
            log.info("Closing MongoDB client of event store");
            mongoClient.close();
        }
    }

    @Override
    protected void writeEnvelopes(String collection, EventStream stream, long currentVersion, List<EventEnvelope> envelopes) {
        MongoCollection<Document> eventCollection = provisionedCollection(collection);
        List<Document> documents = envelopes.stream().map(envelope -> EventEnvelopeDocumentMapper.toDocument(stream, envelope)).collect(Collectors.toList());
        String streamId = stream.streamId();
        try (ClientSession clientSession = mongoClient.startSession()) {
            clientSession.withTransaction(() -> {
                long currentStreamVersion = currentStreamVersion(clientSession, eventCollection, streamId);
                if (currentStreamVersion != currentVersion) {
                    throw new StreamVersionConflictException(collection, streamId, currentVersion, currentStreamVersion);
                }
                eventCollection.insertMany(clientSession, documents);
                return "";
            }, config.transactionOptions);
        } catch (MongoException e) {
            throw translateException(new WriteContext(collection, streamId, currentVersion), e);
        }
    }

    @Override
    protected Optional<EventEnvelope> readEnvelope(String collection, EventStream stream, long version) {
        try {
            Document document = database.getCollection(collection).find(and(streamIdEqualTo(stream.streamId()), eq(VERSION, version))).first();
            return Optional.ofNullable(document).map(EventEnvelopeDocumentMapper::toEnvelope);
        } catch (MongoException e) {
            throw new EventStorePersistenceException(collection, "Failed to read event from collection " + collection, e);
        }
    }

    @Override
    protected Stream<List<EventEnvelope>> readEnvelopes(String collection, EventStream stream, EventFilter filter) {
        return EventBatches.batched(collection, () -> {
            Bson query = and(streamIdEqualTo(stream.streamId()), gte(VERSION, filter.fromVersion));
            FindIterable<Document> documents = config.queryOptions.apply(database.getCollection(collection).find(query))
                    .sort(filter.isForward() ? ascending(VERSION) : descending(VERSION))
                    .batchSize(filter.batch);
            if (filter.limit < Integer.MAX_VALUE) {
                documents = documents.limit((int) filter.limit);
            }
            MongoCursor<Document> cursor = documents.iterator();
            return CloseableIterator.of(cursor, cursor::close).map(EventEnvelopeDocumentMapper::toEnvelope);
        }, filter.batch, filter.limit);
    }

    private MongoCollection<Document> provisionedCollection(String collectionName) {
        if (!provisionedCollections.contains(collectionName)) {
            try {
                if (!collectionExists(collectionName)) {
                    throw new EventStorePersistenceException(collectionName, "Event collection " + collectionName + " doesn't exist, make sure that the pool has been provisioned with ensureCollection");
                }
            } catch (MongoException e) {
                throw new EventStorePersistenceException(collectionName, e);
            }
            provisionedCollections.add(collectionName);
        }
        return database.getCollection(collectionName);
    }

    private static long currentStreamVersion(ClientSession clientSession, MongoCollection<Document> eventCollection, String streamId) {
        Document documentWithLatestStreamVersion = eventCollection.find(clientSession, streamIdEqualTo(streamId)).sort(descending(VERSION)).limit(1).projection(include(VERSION)).first();
        final long currentStreamVersion;
        if (documentWithLatestStreamVersion == null) {
            currentStreamVersion = 0;
        } else {
            currentStreamVersion = documentWithLatestStreamVersion.getLong(VERSION);
        }
        return currentStreamVersion;
    }

    private boolean collectionExists(String collectionName) {
        for (String listCollectionName : database.listCollectionNames()) {
            if (listCollectionName.equals(collectionName)) {
                return true;
            }
        }
        return false;
    }

    private static Bson streamIdEqualTo(String streamId) {
        return eq(STREAM_ID, streamId);
    }
}
