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

import org.eventide.event.Event;
import org.eventide.event.EventName;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * The registry that maps persistent event names to event types and the {@link EventSerializer} used for each type.
 * Event stores use it to turn events into {@link org.eventide.event.EventEnvelope}s when writing and back again when reading.
 * <p>
 * Every event type can be registered exactly once and every name must be unique. Registration typically happens once at
 * startup, after that the map can be read concurrently from any number of threads.
 *
 * <pre>
 * EventMap eventMap = new EventMap()
 *         .register(AccountOpened.class)
 *         .register(AccountCredited.class, new AccountCreditedSerializer());
 * </pre>
 */
@NullMarked
public class EventMap {
    private static final Logger log = LoggerFactory.getLogger(EventMap.class);

    private final Map<String, Registered<?>> eventsByName = new ConcurrentHashMap<>();
    private final Map<Class<?>, Registered<?>> eventsByType = new ConcurrentHashMap<>();

    /**
     * Register {@code type} under the name defined by its {@link EventName} annotation using the default {@link JacksonEventSerializer}.
     *
     * @throws MissingEventMetadataException       If {@code type} is not annotated with {@link EventName}.
     * @throws DuplicateEventRegistrationException If the type or its name is already registered.
     */
    public <E extends Event> EventMap register(Class<E> type) {
        return register(type, (EventSerializer<E>) null);
    }

    /**
     * Register {@code type} under the name defined by its {@link EventName} annotation.
     *
     * @param serializer The serializer to use, or {@code null} to use the default {@link JacksonEventSerializer}.
     */
    public <E extends Event> EventMap register(Class<E> type, @Nullable EventSerializer<E> serializer) {
        requireNonNull(type, "Event type cannot be null");
        EventName eventName = type.getAnnotation(EventName.class);
        if (eventName == null) {
            throw new MissingEventMetadataException(type);
        }
        return register(type, eventName.value(), serializer);
    }

    /**
     * Register {@code type} under an explicit {@code name}, the {@link EventName} annotation is not consulted.
     *
     * @param serializer The serializer to use, or {@code null} to use the default {@link JacksonEventSerializer}.
     */
    public synchronized <E extends Event> EventMap register(Class<E> type, String name, @Nullable EventSerializer<E> serializer) {
        requireNonNull(type, "Event type cannot be null");
        requireNonNull(name, "Event name cannot be null");
        if (name.isEmpty()) {
            throw new MissingEventMetadataException(type);
        }
        if (eventsByType.containsKey(type)) {
            throw new DuplicateEventRegistrationException(name, type, "Event type " + type.getName() + " is already registered as '" + eventsByType.get(type).name + "'");
        }
        Registered<?> existing = eventsByName.get(name);
        if (existing != null) {
            throw new DuplicateEventRegistrationException(name, type, "Event name '" + name + "' is already registered by " + existing.type.getName());
        }

        Registered<E> registered = new Registered<>(name, type, serializer == null ? new JacksonEventSerializer<>(type) : serializer);
        eventsByName.put(name, registered);
        eventsByType.put(type, registered);
        log.debug("Registered event {} as '{}'", type.getName(), name);
        return this;
    }

    public EventMap registerAll(Collection<? extends EventRegistration<?>> registrations) {
        requireNonNull(registrations, "Registrations cannot be null");
        registrations.forEach(registration -> registration.registerIn(this));
        return this;
    }

    public boolean has(String name) {
        return eventsByName.containsKey(name);
    }

    public boolean has(Class<?> type) {
        return eventsByType.containsKey(type);
    }

    public boolean has(Event event) {
        return has(event.getClass());
    }

    public String getName(Class<?> type) {
        return byType(type).name;
    }

    public String getName(Event event) {
        return getName(event.getClass());
    }

    public Class<? extends Event> getType(String name) {
        return byName(name).type;
    }

    public Class<? extends Event> getType(Event event) {
        return byType(event.getClass()).type;
    }

    public EventSerializer<?> getSerializer(String name) {
        return byName(name).serializer;
    }

    @SuppressWarnings("unchecked")
    public <E extends Event> EventSerializer<E> getSerializer(Class<E> type) {
        return (EventSerializer<E>) byType(type).serializer;
    }

    @SuppressWarnings("unchecked")
    public <E extends Event> EventSerializer<E> getSerializer(E event) {
        return (EventSerializer<E>) byType(event.getClass()).serializer;
    }

    /**
     * Serialize {@code event} with the serializer registered for its type.
     *
     * @throws UnregisteredEventException If the type of {@code event} is not registered.
     */
    public Map<String, Object> serializeEvent(Event event) {
        requireNonNull(event, "Event cannot be null");
        return byType(event.getClass()).serialize(event);
    }

    /**
     * Deserialize {@code payload} with the serializer registered under {@code name}.
     *
     * @throws UnregisteredEventException If no event is registered under {@code name}.
     */
    public Event deserializeEvent(String name, Map<String, ?> payload) {
        requireNonNull(payload, "Payload cannot be null");
        return byName(name).serializer.deserialize(payload);
    }

    private Registered<?> byName(String name) {
        requireNonNull(name, "Event name cannot be null");
        Registered<?> registered = eventsByName.get(name);
        if (registered == null) {
            throw new UnregisteredEventException(name);
        }
        return registered;
    }

    private Registered<?> byType(Class<?> type) {
        requireNonNull(type, "Event type cannot be null");
        Registered<?> registered = eventsByType.get(type);
        if (registered == null) {
            throw new UnregisteredEventException(type);
        }
        return registered;
    }

    private static final class Registered<E extends Event> {
        private final String name;
        private final Class<E> type;
        private final EventSerializer<E> serializer;

        private Registered(String name, Class<E> type, EventSerializer<E> serializer) {
            this.name = name;
            this.type = type;
            this.serializer = serializer;
        }

        private Map<String, Object> serialize(Event event) {
            return serializer.serialize(type.cast(event));
        }
    }
}
