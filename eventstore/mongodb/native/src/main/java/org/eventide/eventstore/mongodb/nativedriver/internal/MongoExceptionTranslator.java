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

package org.eventide.eventstore.mongodb.nativedriver.internal;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoBulkWriteException;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import org.eventide.eventstore.api.EventStorePersistenceException;
import org.eventide.eventstore.api.StreamVersionConflictException;

/**
 * Translates a {@link MongoException} thrown when appending events into an {@link EventStorePersistenceException}.
 */
public class MongoExceptionTranslator {
    private static final int WRITE_CONFLICT = 112;

    private MongoExceptionTranslator() {
    }

    /**
     * Duplicate key errors on the unique (streamId, version) index and write conflicts between concurrent transactions
     * both mean that another writer got there first, they're translated to {@link StreamVersionConflictException}.
     *
     * @param ctx The append that failed
     * @param e   The {@code MongoException} to translate
     * @return The translated exception
     */
    public static EventStorePersistenceException translateException(WriteContext ctx, MongoException e) {
        final EventStorePersistenceException translated;
        if (isDuplicateKey(e) || (e instanceof MongoCommandException && e.getCode() == WRITE_CONFLICT)) {
            translated = new StreamVersionConflictException(ctx.collection, ctx.streamId, ctx.expectedStreamVersion, null, e);
        } else {
            translated = new EventStorePersistenceException(ctx.collection, e);
        }
        return translated;
    }

    private static boolean isDuplicateKey(MongoException e) {
        if (e instanceof MongoBulkWriteException) {
            return ((MongoBulkWriteException) e).getWriteErrors().stream()
                    .anyMatch(bulkWriteError -> ErrorCategory.fromErrorCode(bulkWriteError.getCode()) == ErrorCategory.DUPLICATE_KEY);
        }
        return ErrorCategory.fromErrorCode(e.getCode()) == ErrorCategory.DUPLICATE_KEY;
    }

    public static class WriteContext {
        public final String collection;
        public final String streamId;
        public final long expectedStreamVersion;

        public WriteContext(String collection, String streamId, long expectedStreamVersion) {
            this.collection = collection;
            this.streamId = streamId;
            this.expectedStreamVersion = expectedStreamVersion;
        }
    }
}
