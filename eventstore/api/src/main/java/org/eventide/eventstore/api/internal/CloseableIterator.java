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

import java.util.Iterator;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * An {@link Iterator} over a backend cursor that must be closed when no longer used.
 */
public interface CloseableIterator<T> extends Iterator<T>, AutoCloseable {

    @Override
    void close();

    default <R> CloseableIterator<R> map(Function<? super T, ? extends R> mapper) {
        requireNonNull(mapper, "Mapper cannot be null");
        CloseableIterator<T> self = this;
        return new CloseableIterator<R>() {
            @Override
            public boolean hasNext() {
                return self.hasNext();
            }

            @Override
            public R next() {
                return mapper.apply(self.next());
            }

            @Override
            public void close() {
                self.close();
            }
        };
    }

    static <T> CloseableIterator<T> of(Iterator<T> iterator, Runnable onClose) {
        requireNonNull(iterator, "Iterator cannot be null");
        requireNonNull(onClose, "onClose cannot be null");
        return new CloseableIterator<T>() {
            @Override
            public boolean hasNext() {
                return iterator.hasNext();
            }

            @Override
            public T next() {
                return iterator.next();
            }

            @Override
            public void close() {
                onClose.run();
            }
        };
    }
}
