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

package org.eventide.snapshotstore.mongodb.nativedriver;

import com.mongodb.ConnectionString;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.ReplaceOptions;
import org.bson.Document;
import org.eventide.snapshotstore.api.AbstractSnapshotStore;
import org.eventide.snapshotstore.api.SnapshotCollection;
import org.eventide.snapshotstore.api.SnapshotEnvelope;
import org.eventide.snapshotstore.api.SnapshotStoreDriver;
import org.eventide.snapshotstore.api.SnapshotStorePersistenceException;
import org.eventide.snapshotstore.api.StaleSnapshotException;
import org.eventide.snapshotstore.mongodb.nativedriver.internal.SnapshotDocumentMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.lte;
import static java.util.Objects.requireNonNull;
import static org.eventide.snapshotstore.mongodb.nativedriver.internal.SnapshotDocumentMapper.ID;
import static org.eventide.snapshotstore.mongodb.nativedriver.internal.SnapshotDocumentMapper.VERSION;

/**
 * A snapshot store that keeps the latest snapshot of each stream as one document in MongoDB, using the stream id as
 * document id. A snapshot is written with a conditional upsert that only matches documents with a lower or equal
 * version. When a newer snapshot exists the upsert collides with it on {@code _id} and the save is rejected as stale.
 */
public class MongoSnapshotStore extends AbstractSnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(MongoSnapshotStore.class);
    private static final int MAX_WRITE_ATTEMPTS = 3;

    private final MongoClient mongoClient;
    private final boolean ownsMongoClient;
    private final MongoDatabase database;
    private final MongoSnapshotStoreConfig config;
    private final Set<String> provisionedCollections = ConcurrentHashMap.newKeySet();

    /**
     * Create a {@link MongoSnapshotStore} that uses an existing {@link MongoClient}. The client is not closed by {@link #stop()}.
     */
    public MongoSnapshotStore(MongoClient mongoClient, MongoSnapshotStoreConfig config) {
        this(mongoClient, false, config);
    }

    public MongoSnapshotStore(ConnectionString connectionString, MongoSnapshotStoreConfig config) {
        this(MongoClients.create(requireNonNull(connectionString, ConnectionString.class.getSimpleName() + " cannot be null")), true, config);
    }

    private MongoSnapshotStore(MongoClient mongoClient, boolean ownsMongoClient, MongoSnapshotStoreConfig config) {
        requireNonNull(mongoClient, "Mongo client cannot be null");
        requireNonNull(config, MongoSnapshotStoreConfig.class.getSimpleName() + " cannot be null");
        this.mongoClient = mongoClient;
        this.ownsMongoClient = ownsMongoClient;
        this.config = config;
        this.database = mongoClient.getDatabase(config.databaseName);
    }

    public static SnapshotStoreDriver driver(MongoClient mongoClient, MongoSnapshotStoreConfig config) {
        return () -> new MongoSnapshotStore(mongoClient, config);
    }

    @Override
    public String ensureCollection(@Nullable String pool) {
        String collectionName = SnapshotCollection.get(pool);
        try {
            if (!collectionExists(collectionName)) {
                log.info("Creating snapshot collection {} in database {}", collectionName, database.getName());
                database.createCollection(collectionName);
            }
        } catch (MongoException e) {
            throw new SnapshotStorePersistenceException(collectionName, "Failed to provision snapshot collection " + collectionName, e);
        }
        provisionedCollections.add(collectionName);
        return collectionName;
    }

    @Override
    public void stop() {
        if (ownsMongoClient) {
            log.info("Closing MongoDB client of snapshot store");
            mongoClient.close();
        }
    }

    @Override
    protected void writeSnapshot(String collection, SnapshotEnvelope snapshot) {
        MongoCollection<Document> snapshotCollection = provisionedCollection(collection).withWriteConcern(config.writeConcern);
        Document document = SnapshotDocumentMapper.toDocument(snapshot);
        for (int attempt = 1; ; attempt++) {
            try {
                snapshotCollection.replaceOne(and(eq(ID, snapshot.streamId), lte(VERSION, snapshot.version)), document, new ReplaceOptions().upsert(true));
                return;
            } catch (MongoWriteException e) {
                if (e.getError().getCategory() != ErrorCategory.DUPLICATE_KEY) {
                    throw new SnapshotStorePersistenceException(collection, e);
                }
                // The document exists but didn't match, either it's newer or it was written concurrently by someone else
                Optional<SnapshotEnvelope> latest = readLatestSnapshot(collection, snapshot.streamId);
                if (latest.isPresent() && latest.get().version > snapshot.version) {
                    throw new StaleSnapshotException(snapshot.streamId, latest.get().version, snapshot.version);
                }
                if (attempt == MAX_WRITE_ATTEMPTS) {
                    throw new SnapshotStorePersistenceException(collection, "Failed to save snapshot of stream " + snapshot.streamId + " after " + attempt + " attempts", e);
                }
                log.debug("Retrying save of snapshot of stream {} at version {}", snapshot.streamId, snapshot.version);
            } catch (MongoException e) {
                throw new SnapshotStorePersistenceException(collection, e);
            }
        }
    }

    @Override
    protected Optional<SnapshotEnvelope> readLatestSnapshot(String collection, String streamId) {
        try {
            Document document = database.getCollection(collection).find(eq(ID, streamId)).first();
            return Optional.ofNullable(document).map(SnapshotDocumentMapper::toSnapshot);
        } catch (MongoException e) {
            throw new SnapshotStorePersistenceException(collection, "Failed to read snapshot from collection " + collection, e);
        }
    }

    private MongoCollection<Document> provisionedCollection(String collectionName) {
        if (!provisionedCollections.contains(collectionName)) {
            try {
                if (!collectionExists(collectionName)) {
                    throw new SnapshotStorePersistenceException(collectionName, "Snapshot collection " + collectionName + " doesn't exist, make sure that the pool has been provisioned with ensureCollection");
                }
            } catch (MongoException e) {
                throw new SnapshotStorePersistenceException(collectionName, e);
            }
            provisionedCollections.add(collectionName);
        }
        return database.getCollection(collectionName);
    }

    private boolean collectionExists(String collectionName) {
        for (String listCollectionName : database.listCollectionNames()) {
            if (listCollectionName.equals(collectionName)) {
                return true;
            }
        }
        return false;
    }
}
