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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class EventStreamTest {

    @Test
    void stream_id_is_stream_name_and_aggregate_id_joined_by_a_dash() {
        // When
        EventStream stream = EventStream.of("account", "123");

        // Then
        assertThat(stream.streamId()).isEqualTo("account-123");
        assertThat(stream.streamName()).isEqualTo("account");
        assertThat(stream.aggregateId()).isEqualTo("123");
    }

    @Test
    void streams_with_same_name_and_aggregate_id_are_equal() {
        assertThat(EventStream.of("account", "123")).isEqualTo(EventStream.of("account", "123")).isNotEqualTo(EventStream.of("account", "124"));
    }

    @Test
    void stream_name_defaults_to_lower_case_class_name() {
        // When
        EventStream stream = EventStream.forAggregate(ShoppingCart.class, "1");

        // Then
        assertThat(stream.streamId()).isEqualTo("shoppingcart-1");
    }

    @Test
    void stream_name_is_taken_from_annotation_when_present() {
        // When
        EventStream stream = EventStream.forAggregate(Order.class, "1");

        // Then
        assertThat(stream.streamId()).isEqualTo("orders-1");
    }

    @Test
    void stream_names_longer_than_50_characters_are_rejected() {
        // When
        Throwable throwable = catchThrowable(() -> EventStream.forAggregate(TooLong.class, "1"));

        // Then
        assertThat(throwable).isExactlyInstanceOf(InvalidAggregateStreamNameException.class);
        assertThat(((InvalidAggregateStreamNameException) throwable).aggregateType).isEqualTo(TooLong.class);
    }

    @Test
    void empty_aggregate_id_is_rejected() {
        assertThat(catchThrowable(() -> EventStream.of("account", ""))).isExactlyInstanceOf(IllegalArgumentException.class);
    }

    private static class ShoppingCart {
    }

    @AggregateStream("orders")
    private static class Order {
    }

    @AggregateStream("this-stream-name-is-definitely-longer-than-fifty-characters")
    private static class TooLong {
    }
}
