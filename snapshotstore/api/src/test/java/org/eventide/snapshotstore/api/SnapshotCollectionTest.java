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

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SnapshotCollectionTest {

    @Test
    void no_pool_maps_to_the_default_collection() {
        assertThat(SnapshotCollection.get(null)).isEqualTo("snapshots");
    }

    @Test
    void pool_is_prefixed_to_the_default_collection() {
        assertThat(SnapshotCollection.get("tenant-1")).isEqualTo("tenant-1-snapshots");
    }

    @Test
    void pools_with_invalid_characters_are_rejected() {
        assertThat(catchThrowable(() -> SnapshotCollection.get("a/b"))).isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
