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

package org.eventide.eventstore.api.internal;

import org.eventide.eventstore.api.EventStorePersistenceException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static java.util.Objects.requireNonNull;

/**
 * Turns a backend cursor into a lazy {@link Stream} of batches. The cursor is opened when the first batch is requested
 * and closed when it's exhausted, when the limit is reached, when reading fails or when the stream is closed. Failures while iterating the cursor are reported as {@link EventStorePersistenceException}.
 */
public final class EventBatches {

    private EventBatches() {
    }

    /**
     * @param collection The collection that is read, used in error messages
     * @param cursor     Opens the cursor, invoked at most once
     * @param batchSize  The max number of elements in each batch
     * @param limit      The max number of elements in total
     */
    public static <T> Stream<List<T>> batched(String collection, Supplier<? extends CloseableIterator<T>> cursor, int batchSize, long limit) {
        requireNonNull(collection, "Collection cannot be null");
        requireNonNull(cursor, "Cursor cannot be null");
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be greater than 0");
        }
        BatchSpliterator<T> spliterator = new BatchSpliterator<>(collection, cursor, batchSize, limit);
        return StreamSupport.stream(spliterator, false).onClose(spliterator::close);
    }

    private static class BatchSpliterator<T> extends Spliterators.AbstractSpliterator<List<T>> {
        private final String collection;
        private final Supplier<? extends CloseableIterator<T>> cursorSupplier;
        private final int batchSize;
        private long remaining;
        private CloseableIterator<T> cursor;
        private boolean closed;

        BatchSpliterator(String collection, Supplier<? extends CloseableIterator<T>> cursorSupplier, int batchSize, long limit) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.collection = collection;
            this.cursorSupplier = cursorSupplier;
            this.batchSize = batchSize;
            this.remaining = limit;
        }

        @Override
        public boolean tryAdvance(Consumer<? super List<T>> action) {
            if (closed) {
                return false;
            } else if (remaining <= 0) {
                close();
                return false;
            }
            final List<T> batch;
            try {
                if (cursor == null) {
                    cursor = cursorSupplier.get();
                }
                int size = (int) Math.min(batchSize, remaining);
                batch = new ArrayList<>(size);
                while (batch.size() < size && cursor.hasNext()) {
                    batch.add(cursor.next());
                }
            } catch (EventStorePersistenceException e) {
                closeAfterFailure(e);
                throw e;
            } catch (RuntimeException e) {
                EventStorePersistenceException exception = new EventStorePersistenceException(collection, "Failed to read events from collection " + collection, e);
                closeAfterFailure(exception);
                throw exception;
            }

            if (batch.isEmpty()) {
                close();
                return false;
            }
            remaining -= batch.size();
            action.accept(Collections.unmodifiableList(batch));
            return true;
        }

        private void closeAfterFailure(RuntimeException failure) {
            try {
                close();
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
            }
        }

        void close() {
            closed = true;
            if (cursor != null) {
                cursor.close();
                cursor = null;
            }
        }
    }
}
