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

import java.util.Map;

/**
 * Converts an event of type {@code E} to and from the plain, storage friendly payload that is stored in an
 * {@link org.eventide.event.EventEnvelope}. The payload may only contain maps, lists, strings, numbers, booleans and {@code null}.
 *
 * @param <E> The type of event to serialize
 */
public interface EventSerializer<E extends Event> {

    Map<String, Object> serialize(E event);

    E deserialize(Map<String, ?> payload);
}
