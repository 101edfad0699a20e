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

package org.eventide.snapshotstore.api;

import org.jspecify.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * Maps a pool to the name of the collection (or table) that holds its snapshots, {@value #DEFAULT_COLLECTION} or
 * {@code p-snapshots} for pool {@code p}.
 */
public final class SnapshotCollection {
    public static final String DEFAULT_COLLECTION = "snapshots";
    private static final String SUFFIX = "-" + DEFAULT_COLLECTION;
    private static final Pattern VALID_POOL = Pattern.compile("[A-Za-z0-9_-]+");

    private SnapshotCollection() {
    }

    /**
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
