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

package org.eventide.eventstore.mongodb.nativedriver.internal;

import org.bson.Document;
import org.bson.types.Decimal128;
import org.eventide.event.EventEnvelope;
import org.eventide.event.EventId;
import org.eventide.event.EventMetadata;
import org.eventide.event.EventStream;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps between {@link EventEnvelope} and the MongoDB document that stores it. The event id is used as document id.
 */
public class EventEnvelopeDocumentMapper {
    public static final String ID = "_id";
    public static final String STREAM_ID = "streamId";
    public static final String VERSION = "version";
    public static final String EVENT = "event";
    public static final String PAYLOAD = "payload";
    public static final String AGGREGATE_ID = "aggregateId";
    public static final String OCCURRED_ON = "occurredOn";
    public static final String CORRELATION_ID = "correlationId";
    public static final String CAUSATION_ID = "causationId";

    private EventEnvelopeDocumentMapper() {
    }

    public static Document toDocument(EventStream stream, EventEnvelope envelope) {
        EventMetadata metadata = envelope.metadata;
        Document document = new Document(ID, metadata.eventId.toString())
                .append(STREAM_ID, stream.streamId())
                .append(VERSION, metadata.version)
                .append(EVENT, envelope.event)
                .append(PAYLOAD, new Document(envelope.payload))
                .append(AGGREGATE_ID, metadata.aggregateId)
                .append(OCCURRED_ON, Date.from(metadata.occurredOn));
        if (metadata.correlationId != null) {
            document.append(CORRELATION_ID, metadata.correlationId);
        }
        if (metadata.causationId != null) {
            document.append(CAUSATION_ID, metadata.causationId);
        }
        return document;
    }

    public static EventEnvelope toEnvelope(Document document) {
        EventMetadata metadata = new EventMetadata(
                EventId.from(document.getString(ID)),
                document.getString(AGGREGATE_ID),
                document.getLong(VERSION),
                document.getDate(OCCURRED_ON).toInstant(),
                document.getString(CORRELATION_ID),
                document.getString(CAUSATION_ID));
        return EventEnvelope.from(document.getString(EVENT), payloadOf(document.get(PAYLOAD, Document.class)), metadata);
    }

    /**
     * BSON decimals are read back as {@link Decimal128}, which Jackson can't convert into a {@link BigDecimal} field.
     */
    private static Map<String, Object> payloadOf(Document payload) {
        Map<String, Object> converted = new LinkedHashMap<>();
        payload.forEach((key, value) -> converted.put(key, fromBson(value)));
        return converted;
    }

    private static Object fromBson(Object value) {
        if (value instanceof Decimal128) {
            return ((Decimal128) value).bigDecimalValue();
        } else if (value instanceof Map) {
            Map<Object, Object> converted = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((key, nested) -> converted.put(key, fromBson(nested)));
            return converted;
        } else if (value instanceof List) {
            List<Object> converted = new ArrayList<>();
            for (Object element : (List<?>) value) {
                converted.add(fromBson(element));
            }
            return converted;
        }
        return value;
    }
}
