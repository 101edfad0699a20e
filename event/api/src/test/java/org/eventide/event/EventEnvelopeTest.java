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

package org.eventide.event;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class EventEnvelopeTest {

    @Test
    void create_generates_an_event_id_and_uses_its_instant_as_occurred_on() {
        // When
        EventEnvelope envelope = EventEnvelope.create("account-opened", Map.of("owner", "John"), "123", 1);

        // Then
        assertThat(envelope.metadata.occurredOn).isEqualTo(envelope.eventId().instant());
        assertThat(envelope.metadata.aggregateId).isEqualTo("123");
        assertThat(envelope.version()).isEqualTo(1);
        assertThat(envelope.metadata.correlationId).isNull();
    }

    @Test
    void payload_is_copied_and_cannot_be_modified() {
        // Given
        Map<String, Object> payload = new HashMap<>();
        payload.put("owner", "John");
        EventEnvelope envelope = EventEnvelope.create("account-opened", payload, "123", 1, "correlation", "cause");

        // When
        payload.put("owner", "Jane");
        Throwable throwable = catchThrowable(() -> envelope.payload.put("owner", "Jane"));

        // Then
        assertThat(envelope.payload).containsEntry("owner", "John");
        assertThat(throwable).isInstanceOf(UnsupportedOperationException.class);
        assertThat(envelope.metadata.correlationId).isEqualTo("correlation");
        assertThat(envelope.metadata.causationId).isEqualTo("cause");
    }

    @Test
    void version_must_be_positive() {
        assertThat(catchThrowable(() -> EventEnvelope.create("account-opened", Map.of(), "123", 0))).isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
