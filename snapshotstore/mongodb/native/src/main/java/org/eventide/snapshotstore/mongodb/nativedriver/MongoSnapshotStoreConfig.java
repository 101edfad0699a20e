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

package org.eventide.snapshotstore.mongodb.nativedriver;

import com.mongodb.WriteConcern;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Configuration for the MongoDB snapshot store
 */
@NullMarked
public class MongoSnapshotStoreConfig {
    public final String databaseName;
    public final WriteConcern writeConcern;

    public MongoSnapshotStoreConfig(String databaseName) {
        this(databaseName, null);
    }

    private MongoSnapshotStoreConfig(String databaseName, @Nullable WriteConcern writeConcern) {
        Objects.requireNonNull(databaseName, "Database name cannot be null");
        this.databaseName = databaseName;
        this.writeConcern = Objects.requireNonNullElse(writeConcern, WriteConcern.MAJORITY);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MongoSnapshotStoreConfig)) return false;
        MongoSnapshotStoreConfig that = (MongoSnapshotStoreConfig) o;
        return Objects.equals(databaseName, that.databaseName) && Objects.equals(writeConcern, that.writeConcern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(databaseName, writeConcern);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", MongoSnapshotStoreConfig.class.getSimpleName() + "[", "]")
                .add("databaseName='" + databaseName + "'")
                .add("writeConcern=" + writeConcern)
                .toString();
    }

    @NullUnmarked
    public static final class Builder {
        private String databaseName;
        private WriteConcern writeConcern;

        @NullMarked
        public Builder databaseName(String databaseName) {
            this.databaseName = databaseName;
            return this;
        }

        /**
         * @param writeConcern The write concern used when saving snapshots, {@link WriteConcern#MAJORITY} by default.
         * @return The builder instance
         */
        @NullMarked
        public Builder writeConcern(WriteConcern writeConcern) {
            this.writeConcern = writeConcern;
            return this;
        }

        @NullMarked
        public MongoSnapshotStoreConfig build() {
            return new MongoSnapshotStoreConfig(databaseName, writeConcern);
        }
    }
}
