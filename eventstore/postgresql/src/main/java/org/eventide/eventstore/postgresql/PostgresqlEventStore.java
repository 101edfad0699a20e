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
import org.eventide.event.EventEnvelope;
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
import org.eventide.eventstore.postgresql.internal.EventEnvelopeRowMapper;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.result.ResultIterator;
import org.jdbi.v3.core.statement.PreparedBatch;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * An event store that stores events in PostgreSQL using Jdbi. Each pool is stored in its own table with
 * {@code (stream_id, version)} as primary key and the event payload as {@code JSONB}.
 * <p>
 * Events are appended in a transaction that first verifies the current version of the stream. Two writers that pass the
 * version check at the same time can't both commit, the primary key rejects the second one.
 */
public class PostgresqlEventStore extends AbstractEventStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlEventStore.class);

    private static final String UNIQUE_VIOLATION = "23505";
    private static final String UNDEFINED_TABLE = "42P01";

    private final Jdbi jdbi;
    private final PostgresqlEventStoreConfig config;
    private final EventEnvelopeRowMapper rowMapper;

    public PostgresqlEventStore(Jdbi jdbi, EventMap eventMap, PostgresqlEventStoreConfig config) {
        this(jdbi, eventMap, config, EventEnvelopeListener.NOOP);
    }

    public PostgresqlEventStore(Jdbi jdbi, EventMap eventMap, PostgresqlEventStoreConfig config, EventEnvelopeListener listener) {
        super(eventMap, listener);
        this.jdbi = requireNonNull(jdbi, Jdbi.class.getSimpleName() + " cannot be null");
        this.config = requireNonNull(config, PostgresqlEventStoreConfig.class.getSimpleName() + " cannot be null");
        this.rowMapper = new EventEnvelopeRowMapper(config.objectMapper);
    }

    /**
     * @return An {@link EventStoreDriver} that creates {@link PostgresqlEventStore}s sharing {@code jdbi}
     */
    public static EventStoreDriver driver(Jdbi jdbi, PostgresqlEventStoreConfig config) {
        return eventMap -> new PostgresqlEventStore(jdbi, eventMap, config);
    }

    @Override
    public String ensureCollection(@Nullable String pool) {
        String table = EventCollection.get(pool);
        try {
            jdbi.useHandle(handle -> {
                handle.execute("CREATE TABLE IF NOT EXISTS " + quote(table) + " (\n" +
                        "    stream_id      TEXT        NOT NULL,\n" +
                        "    version        BIGINT      NOT NULL,\n" +
                        "    event          TEXT        NOT NULL,\n" +
                        "    payload        JSONB       NOT NULL,\n" +
                        "    event_id       UUID        NOT NULL UNIQUE,\n" +
                        "    aggregate_id   TEXT        NOT NULL,\n" +
                        "    occurred_on    TIMESTAMPTZ NOT NULL,\n" +
                        "    correlation_id TEXT,\n" +
                        "    causation_id   TEXT,\n" +
                        "    PRIMARY KEY (stream_id, version)\n" +
                        ")");
            });
        } catch (JdbiException e) {
            throw new EventStorePersistenceException(table, "Failed to provision event table " + table, e);
        }
        log.info("Ensured event table {}", table);
        return table;
    }

    @Override
    protected void writeEnvelopes(String collection, EventStream stream, long currentVersion, List<EventEnvelope> envelopes) {
        String streamId = stream.streamId();
        try {
            jdbi.useTransaction(handle -> {
                long currentStreamVersion = handle.createQuery("SELECT COALESCE(MAX(version), 0) FROM " + quote(collection) + " WHERE stream_id = :streamId")
                        .bind("streamId", streamId)
                        .mapTo(Long.class)
                        .one();
                if (currentStreamVersion != currentVersion) {
                    throw new StreamVersionConflictException(collection, streamId, currentVersion, currentStreamVersion);
                }

                PreparedBatch batch = handle.prepareBatch("INSERT INTO " + quote(collection) +
                        " (stream_id, version, event, payload, event_id, aggregate_id, occurred_on, correlation_id, causation_id)" +
                        " VALUES (:streamId, :version, :event, CAST(:payload AS JSONB), :eventId, :aggregateId, :occurredOn, :correlationId, :causationId)");
                for (EventEnvelope envelope : envelopes) {
                    EventMetadata metadata = envelope.metadata;
                    batch.bind("streamId", streamId)
                            .bind("version", metadata.version)
                            .bind("event", envelope.event)
                            .bind("payload", writePayload(collection, envelope))
                            .bind("eventId", metadata.eventId.toUUID())
                            .bind("aggregateId", metadata.aggregateId)
                            .bind("occurredOn", OffsetDateTime.ofInstant(metadata.occurredOn, ZoneOffset.UTC))
                            .bind("correlationId", metadata.correlationId)
                            .bind("causationId", metadata.causationId)
                            .add();
                }
                batch.execute();
            });
        } catch (JdbiException e) {
            throw translateException(collection, streamId, currentVersion, e);
        }
    }

    @Override
    protected Optional<EventEnvelope> readEnvelope(String collection, EventStream stream, long version) {
        try {
            return jdbi.withHandle(handle -> handle.createQuery("SELECT * FROM " + quote(collection) + " WHERE stream_id = :streamId AND version = :version")
                    .bind("streamId", stream.streamId())
                    .bind("version", version)
                    .map(rowMapper)
                    .findOne());
        } catch (JdbiException | UncheckedIOException e) {
            throw new EventStorePersistenceException(collection, "Failed to read event from table " + collection, e);
        }
    }

    @Override
    protected Stream<List<EventEnvelope>> readEnvelopes(String collection, EventStream stream, EventFilter filter) {
        String sql = "SELECT * FROM " + quote(collection) + " WHERE stream_id = :streamId AND version >= :fromVersion" +
                " ORDER BY version " + (filter.isForward() ? "ASC" : "DESC") +
                (filter.limit < Long.MAX_VALUE ? " LIMIT " + filter.limit : "");
        return EventBatches.batched(collection, () -> {
            Handle handle = jdbi.open();
            try {
                // PostgreSQL only streams rows through a cursor when auto-commit is off
                handle.begin();
                ResultIterator<EventEnvelope> rows = handle.createQuery(sql)
                        .bind("streamId", stream.streamId())
                        .bind("fromVersion", filter.fromVersion)
                        .setFetchSize(Math.min(filter.batch, config.queryFetchSize))
                        .map(rowMapper)
                        .iterator();
                return CloseableIterator.of(rows, () -> closeCursor(rows, handle));
            } catch (RuntimeException e) {
                handle.rollback();
                handle.close();
                throw e;
            }
        }, filter.batch, filter.limit);
    }

    private static void closeCursor(ResultIterator<EventEnvelope> rows, Handle handle) {
        try {
            rows.close();
            handle.rollback();
        } finally {
            handle.close();
        }
    }

    private String writePayload(String collection, EventEnvelope envelope) {
        try {
            return config.objectMapper.writeValueAsString(envelope.payload);
        } catch (JsonProcessingException e) {
            throw new EventStorePersistenceException(collection, "Failed to write payload of event " + envelope.event + " as JSON", e);
        }
    }

    private static EventStorePersistenceException translateException(String collection, String streamId, long currentVersion, JdbiException e) {
        String sqlState = sqlStateOf(e);
        final EventStorePersistenceException translated;
        if (UNIQUE_VIOLATION.equals(sqlState)) {
            translated = new StreamVersionConflictException(collection, streamId, currentVersion, null, e);
        } else if (UNDEFINED_TABLE.equals(sqlState)) {
            translated = new EventStorePersistenceException(collection, "Event table " + collection + " doesn't exist, make sure that the pool has been provisioned with ensureCollection", e);
        } else {
            translated = new EventStorePersistenceException(collection, e);
        }
        return translated;
    }

    private static @Nullable String sqlStateOf(Throwable e) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof SQLException) {
                return ((SQLException) cause).getSQLState();
            }
            cause = cause.getCause();
        }
        return null;
    }

    // Table names only contain letters, digits, '_' and '-', see EventCollection
    private static String quote(String table) {
        return "\"" + table + "\"";
    }
}
