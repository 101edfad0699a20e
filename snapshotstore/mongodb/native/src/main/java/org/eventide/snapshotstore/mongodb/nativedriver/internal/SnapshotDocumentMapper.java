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

package org.eventide.snapshotstore.mongodb.nativedriver.internal;

import org.bson.Document;
import org.bson.types.Decimal128;
import org.eventide.snapshotstore.api.SnapshotEnvelope;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a {@link SnapshotEnvelope} to and from the MongoDB document that stores it. The stream id is the document id,
 * so each stream has exactly one snapshot document.
 */
public final class SnapshotDocumentMapper {
    public static final String ID = "_id";
    public static final String VERSION = "version";
    public static final String AGGREGATE_ID = "aggregateId";
    public static final String AGGREGATE_NAME = "aggregateName";
    public static final String PAYLOAD = "payload";
    public static final String OCCURRED_ON = "occurredOn";

    private SnapshotDocumentMapper() {
    }

    public static Document toDocument(SnapshotEnvelope snapshot) {
        return new Document(ID, snapshot.streamId)
                .append(VERSION, snapshot.version)
                .append(AGGREGATE_ID, snapshot.aggregateId)
                .append(AGGREGATE_NAME, snapshot.aggregateName)
                .append(PAYLOAD, new Document(snapshot.payload))
                .append(OCCURRED_ON, Date.from(snapshot.occurredOn));
    }

    public static SnapshotEnvelope toSnapshot(Document document) {
        return new SnapshotEnvelope(
                document.getString(ID),
                document.getString(AGGREGATE_ID),
                document.getLong(VERSION),
                payloadOf(document.get(PAYLOAD, Document.class)),
                document.getString(AGGREGATE_NAME),
                document.getDate(OCCURRED_ON).toInstant());
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
