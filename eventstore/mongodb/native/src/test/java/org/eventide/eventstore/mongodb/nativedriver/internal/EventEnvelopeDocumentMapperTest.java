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

import org.bson.Document;
import org.bson.types.Decimal128;
import org.eventide.event.EventEnvelope;
import org.eventide.event.EventId;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class EventEnvelopeDocumentMapperTest {

    @Test
    void decimals_in_the_payload_are_read_back_as_big_decimals() {
        // Given
        Document document = new Document(EventEnvelopeDocumentMapper.ID, EventId.generate().toString())
                .append(EventEnvelopeDocumentMapper.STREAM_ID, "account-1")
                .append(EventEnvelopeDocumentMapper.VERSION, 1L)
                .append(EventEnvelopeDocumentMapper.EVENT, "interest-accrued")
                .append(EventEnvelopeDocumentMapper.PAYLOAD, new Document("rate", new Decimal128(new BigDecimal("0.25")))
                        .append("tiers", List.of(new Decimal128(new BigDecimal("1.5")), "flat"))
                        .append("fee", new Document("amount", new Decimal128(new BigDecimal("9.99"))).append("currency", "SEK"))
                        .append("days", 30))
                .append(EventEnvelopeDocumentMapper.AGGREGATE_ID, "1")
                .append(EventEnvelopeDocumentMapper.OCCURRED_ON, new Date());

        // When
        EventEnvelope envelope = EventEnvelopeDocumentMapper.toEnvelope(document);

        // Then
        assertThat(envelope.payload.get("rate")).isEqualTo(new BigDecimal("0.25"));
        assertThat(envelope.payload.get("tiers")).isEqualTo(List.of(new BigDecimal("1.5"), "flat"));
        assertThat(envelope.payload.get("fee")).isEqualTo(Map.of("amount", new BigDecimal("9.99"), "currency", "SEK"));
        assertThat(envelope.payload.get("days")).isEqualTo(30);
    }
}
