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

package org.eventide.eventstore.postgresql;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Configuration for the PostgreSQL event store
 */
@NullMarked
public class PostgresqlEventStoreConfig {
    public static final int DEFAULT_QUERY_FETCH_SIZE = 100;

    public final ObjectMapper objectMapper;
    public final int queryFetchSize;

    /**
     * Create a {@link PostgresqlEventStoreConfig} with a default {@link ObjectMapper} and a fetch size of {@value #DEFAULT_QUERY_FETCH_SIZE}.
     */
    public PostgresqlEventStoreConfig() {
        this(null, DEFAULT_QUERY_FETCH_SIZE);
    }

    private PostgresqlEventStoreConfig(@Nullable ObjectMapper objectMapper, int queryFetchSize) {
        if (queryFetchSize < 1) {
            throw new IllegalArgumentException("Query fetch size must be greater than 0");
        }
        this.objectMapper = Objects.requireNonNullElseGet(objectMapper, ObjectMapper::new);
        this.queryFetchSize = queryFetchSize;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PostgresqlEventStoreConfig)) return false;
        PostgresqlEventStoreConfig that = (PostgresqlEventStoreConfig) o;
        return queryFetchSize == that.queryFetchSize && Objects.equals(objectMapper, that.objectMapper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(objectMapper, queryFetchSize);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", PostgresqlEventStoreConfig.class.getSimpleName() + "[", "]")
                .add("objectMapper=" + objectMapper)
                .add("queryFetchSize=" + queryFetchSize)
                .toString();
    }

    @NullUnmarked
    public static final class Builder {
        private ObjectMapper objectMapper;
        private int queryFetchSize = DEFAULT_QUERY_FETCH_SIZE;

        /**
         * @param objectMapper The {@link ObjectMapper} that converts event payloads to and from JSONB
         * @return The builder instance
         */
        @NullMarked
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * @param queryFetchSize The max number of rows fetched per round trip when reading events. A read never fetches more rows per round trip than its batch size.
         * @return The builder instance
         */
        @NullMarked
        public Builder queryFetchSize(int queryFetchSize) {
            this.queryFetchSize = queryFetchSize;
            return this;
        }

        @NullMarked
        public PostgresqlEventStoreConfig build() {
            return new PostgresqlEventStoreConfig(objectMapper, queryFetchSize);
        }
    }
}
