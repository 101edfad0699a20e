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

package org.eventide.eventmap;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.eventide.event.Event;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * An {@link EventSerializer} that uses a Jackson {@link ObjectMapper} to make a field-for-field structural copy of an event.
 * This is the serializer that's used when an event type is registered without a serializer of its own.
 * <p>
 * The default {@code ObjectMapper} reads and writes fields directly (getters are ignored), writes {@code java.time} types
 * as ISO-8601 strings and ignores unknown properties when deserializing. The event type needs a no-arg constructor
 * (it may be private).
 *
 * @param <E> The type of event to serialize
 */
public class JacksonEventSerializer<E extends Event> implements EventSerializer<E> {
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private final ObjectMapper objectMapper;
    private final Class<E> eventType;

    public JacksonEventSerializer(Class<E> eventType) {
        this(defaultObjectMapper(), eventType);
    }

    public JacksonEventSerializer(ObjectMapper objectMapper, Class<E> eventType) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(eventType, "Event type cannot be null");
        this.objectMapper = objectMapper;
        this.eventType = eventType;
    }

    @Override
    public Map<String, Object> serialize(E event) {
        requireNonNull(event, "Event cannot be null");
        return objectMapper.convertValue(event, PAYLOAD_TYPE);
    }

    @Override
    public E deserialize(Map<String, ?> payload) {
        requireNonNull(payload, "Payload cannot be null");
        return objectMapper.convertValue(payload, eventType);
    }

    /**
     * @return A new {@link ObjectMapper} configured the way {@link JacksonEventSerializer} expects by default.
     */
    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE);
        objectMapper.setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE);
        objectMapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return objectMapper;
    }
}
