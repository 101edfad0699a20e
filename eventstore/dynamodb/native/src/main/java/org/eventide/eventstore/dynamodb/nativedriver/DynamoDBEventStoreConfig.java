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

package org.eventide.eventstore.dynamodb.nativedriver;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Configuration for the DynamoDB event store
 */
@NullMarked
public class DynamoDBEventStoreConfig {

    public final String tableNamePrefix;
    public final ObjectMapper objectMapper;

    /**
     * Create a {@link DynamoDBEventStoreConfig} without table name prefix and with a default {@link ObjectMapper}.
     */
    public DynamoDBEventStoreConfig() {
        this("", null);
    }

    private DynamoDBEventStoreConfig(String tableNamePrefix, @Nullable ObjectMapper objectMapper) {
        Objects.requireNonNull(tableNamePrefix, "Table name prefix cannot be null");
        this.tableNamePrefix = tableNamePrefix;
        this.objectMapper = Objects.requireNonNullElseGet(objectMapper, ObjectMapper::new);
    }

    /**
     * @return The DynamoDB table that holds {@code collection}
     */
    public String tableName(String collection) {
        return tableNamePrefix + collection;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DynamoDBEventStoreConfig)) return false;
        DynamoDBEventStoreConfig that = (DynamoDBEventStoreConfig) o;
        return Objects.equals(tableNamePrefix, that.tableNamePrefix) && Objects.equals(objectMapper, that.objectMapper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableNamePrefix, objectMapper);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", DynamoDBEventStoreConfig.class.getSimpleName() + "[", "]")
                .add("tableNamePrefix='" + tableNamePrefix + "'")
                .add("objectMapper=" + objectMapper)
                .toString();
    }

    @NullUnmarked
    public static final class Builder {
        private String tableNamePrefix = "";
        private ObjectMapper objectMapper;

        /**
         * @param tableNamePrefix Prepended to the collection name of each pool to get the DynamoDB table name, for example {@code "myapp-"}
         * @return The builder instance
         */
        @NullMarked
        public Builder tableNamePrefix(String tableNamePrefix) {
            this.tableNamePrefix = tableNamePrefix;
            return this;
        }

        /**
         * @param objectMapper The {@link ObjectMapper} that converts event payloads to and from JSON
         * @return The builder instance
         */
        @NullMarked
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        @NullMarked
        public DynamoDBEventStoreConfig build() {
            return new DynamoDBEventStoreConfig(tableNamePrefix, objectMapper);
        }
    }
}
