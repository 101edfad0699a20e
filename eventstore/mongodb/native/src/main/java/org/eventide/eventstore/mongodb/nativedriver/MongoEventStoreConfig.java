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

package org.eventide.eventstore.mongodb.nativedriver;

import com.mongodb.TransactionOptions;
import com.mongodb.client.FindIterable;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Function;

/**
 * Configuration for the synchronous java driver MongoDB event store
 */
@NullMarked
public class MongoEventStoreConfig {
    private static final Function<FindIterable<Document>, FindIterable<Document>> DEFAULT_QUERY_OPTIONS_FUNCTION = Function.identity();

    public final String databaseName;
    public final TransactionOptions transactionOptions;
    public final Function<FindIterable<Document>, FindIterable<Document>> queryOptions;

    /**
     * Create a {@link MongoEventStoreConfig} that stores events in the database {@code databaseName} using default {@link TransactionOptions}.
     *
     * @param databaseName The name of the MongoDB database that holds the event collections
     */
    public MongoEventStoreConfig(String databaseName) {
        this(databaseName, null, DEFAULT_QUERY_OPTIONS_FUNCTION);
    }

    private MongoEventStoreConfig(String databaseName, @Nullable TransactionOptions transactionOptions, Function<FindIterable<Document>, FindIterable<Document>> queryOptions) {
        Objects.requireNonNull(databaseName, "Database name cannot be null");
        Objects.requireNonNull(queryOptions, "Query options cannot be null");
        this.databaseName = databaseName;
        this.transactionOptions = Objects.requireNonNullElseGet(transactionOptions, () -> TransactionOptions.builder().build());
        this.queryOptions = queryOptions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MongoEventStoreConfig)) return false;
        MongoEventStoreConfig that = (MongoEventStoreConfig) o;
        return Objects.equals(databaseName, that.databaseName) && Objects.equals(transactionOptions, that.transactionOptions) && Objects.equals(queryOptions, that.queryOptions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(databaseName, transactionOptions, queryOptions);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", MongoEventStoreConfig.class.getSimpleName() + "[", "]")
                .add("databaseName='" + databaseName + "'")
                .add("transactionOptions=" + transactionOptions)
                .add("queryOptions=" + queryOptions)
                .toString();
    }

    @NullUnmarked
    public static final class Builder {
        private String databaseName;
        private TransactionOptions transactionOptions;
        private Function<FindIterable<Document>, FindIterable<Document>> queryOptions = DEFAULT_QUERY_OPTIONS_FUNCTION;

        /**
         * @param databaseName The name of the MongoDB database that holds the event collections
         * @return The builder instance
         */
        @NullMarked
        public Builder databaseName(String databaseName) {
            this.databaseName = databaseName;
            return this;
        }

        /**
         * @param transactionOptions The default {@link TransactionOptions} that the event store will use when appending events. May be <code>null</code>.
         * @return The builder instance
         */
        @NullMarked
        public Builder transactionOptions(TransactionOptions transactionOptions) {
            this.transactionOptions = transactionOptions;
            return this;
        }

        /**
         * Specify a function that configures the query options used when reading events, for example the cursor timeout.
         * <br><br>
         * Note that you must <i>not</i> use this to change the query itself, i.e. don't use {@link FindIterable#sort(Bson)},
         * {@link FindIterable#limit(int)} etc. Only use options that don't change the result or its order.
         *
         * @param queryOptions The query options function to use, it cannot return null.
         * @return The builder instance
         */
        @NullMarked
        public Builder queryOptions(Function<FindIterable<Document>, FindIterable<Document>> queryOptions) {
            this.queryOptions = queryOptions;
            return this;
        }

        @NullMarked
        public MongoEventStoreConfig build() {
            return new MongoEventStoreConfig(databaseName, transactionOptions, queryOptions);
        }
    }
}
