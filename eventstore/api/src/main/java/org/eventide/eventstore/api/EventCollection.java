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

import java.util.regex.Pattern;

/**
 * Maps a pool to the name of the collection (or table) that holds its events. Events without a pool are stored in
 * {@value #DEFAULT_COLLECTION}, events in pool {@code p} are stored in {@code p-events}.
 */
public final class EventCollection {
    public static final String DEFAULT_COLLECTION = "events";
    private static final String SUFFIX = "-" + DEFAULT_COLLECTION;
    private static final Pattern VALID_POOL = Pattern.compile("[A-Za-z0-9_-]+");

    private EventCollection() {
    }

    /**
     * @param pool The pool, or {@code null} for the default collection.
     * @return The collection name of the pool.
     * @throws IllegalArgumentException If the pool contains other characters than letters, digits, {@code _} and {@code -}.
     */
    public static String get(@Nullable String pool) {
        if (pool == null) {
            return DEFAULT_COLLECTION;
        }
        if (!VALID_POOL.matcher(pool).matches()) {
            throw new IllegalArgumentException("Invalid pool '" + pool + "', only letters, digits, '_' and '-' are allowed");
        }
        return pool + SUFFIX;
    }
}
