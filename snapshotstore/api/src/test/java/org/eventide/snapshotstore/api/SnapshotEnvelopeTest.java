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

import org.eventide.event.EventStream;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SnapshotEnvelopeTest {

    @Test
    void create_takes_stream_id_aggregate_id_and_aggregate_name_from_the_stream() {
        // Given
        EventStream stream = EventStream.of("account", "42");

        // When
        SnapshotEnvelope snapshot = SnapshotEnvelope.create(stream, 10, Map.of("balance", 100));

        // Then
        assertThat(snapshot.streamId).isEqualTo("account-42");
        assertThat(snapshot.aggregateId).isEqualTo("42");
        assertThat(snapshot.aggregateName).isEqualTo("account");
        assertThat(snapshot.version).isEqualTo(10);
        assertThat(snapshot.payload).containsEntry("balance", 100);
        assertThat(snapshot.occurredOn.getNano() % 1_000_000).isZero();
    }

    @Test
    void payload_is_copied_and_cannot_be_modified() {
        // Given
        Map<String, Object> payload = new HashMap<>();
        payload.put("balance", 100);
        SnapshotEnvelope snapshot = new SnapshotEnvelope("account-42", "42", 1, payload, "account", Instant.now());

        // When
        payload.put("balance", 200);
        Throwable throwable = catchThrowable(() -> snapshot.payload.put("balance", 300));

        // Then
        assertThat(snapshot.payload).containsEntry("balance", 100);
        assertThat(throwable).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void version_must_be_positive() {
        Throwable throwable = catchThrowable(() -> new SnapshotEnvelope("account-42", "42", 0, Map.of(), "account", Instant.now()));

        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
