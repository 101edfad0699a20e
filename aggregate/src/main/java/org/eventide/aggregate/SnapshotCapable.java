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

package org.eventide.aggregate;

/**
 * Implemented by aggregates that can be restored from a snapshot of their state instead of replaying every event.
 *
 * @param <S> The type of the snapshot state. It's serialized with Jackson by {@link SnapshotHandler}.
 */
public interface SnapshotCapable<S> {

    S createSnapshot();

    void loadSnapshot(S snapshot);
}
