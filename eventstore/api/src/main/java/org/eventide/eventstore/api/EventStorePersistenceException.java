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

package org.eventide.eventstore.api;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when the underlying storage fails to read or write events, for example because the collection of a pool
 * has not been provisioned or because the database is unavailable. No events have been written when this exception
 * is thrown from an append.
 */
public class EventStorePersistenceException extends RuntimeException {
    public final String collection;

    public EventStorePersistenceException(String collection, String message) {
        super(message);
        this.collection = collection;
    }

    public EventStorePersistenceException(String collection, @Nullable Throwable cause) {
        this(collection, "Failed to persist events to collection " + collection, cause);
    }

    public EventStorePersistenceException(String collection, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.collection = collection;
    }
}
