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

package org.eventide.eventstore.postgresql.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventide.event.EventEnvelope;
import org.eventide.event.EventId;
import org.eventide.event.EventMetadata;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.io.UncheckedIOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Maps a row of an event table to an {@link EventEnvelope}.
 */
public class EventEnvelopeRowMapper implements RowMapper<EventEnvelope> {
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private final ObjectMapper objectMapper;

    public EventEnvelopeRowMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public EventEnvelope map(ResultSet rs, StatementContext ctx) throws SQLException {
        EventMetadata metadata = new EventMetadata(
                EventId.from(rs.getString("event_id")),
                rs.getString("aggregate_id"),
                rs.getLong("version"),
                rs.getObject("occurred_on", OffsetDateTime.class).toInstant(),
                rs.getString("correlation_id"),
                rs.getString("causation_id"));
        return EventEnvelope.from(rs.getString("event"), readPayload(rs.getString("payload")), metadata);
    }

    private Map<String, Object> readPayload(String json) {
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
