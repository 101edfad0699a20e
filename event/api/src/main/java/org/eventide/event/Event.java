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

package org.eventide.event;

/**
 * Marker interface for domain events. An event is an immutable fact about something that happened to an aggregate.
 * <p>
 * Every event type must be registered in an {@code EventMap} before it can be persisted, normally under the name
 * given by the {@link EventName} annotation.
 */
public interface Event {
}
