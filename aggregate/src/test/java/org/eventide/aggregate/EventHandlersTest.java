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

import org.eventide.testsupport.domain.AccountCredited;
import org.eventide.testsupport.domain.AccountDebited;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class EventHandlersTest {

    @Test
    void event_is_routed_to_the_handler_of_its_type() {
        // Given
        List<Object> handled = new ArrayList<>();
        EventHandlers<Account> handlers = EventHandlers.builder(Account.class)
                .on(AccountCredited.class, (account, event) -> handled.add(event))
                .build();

        // When
        boolean dispatched = handlers.dispatch(new Account("1"), new AccountCredited("1", 10));

        // Then
        assertThat(dispatched).isTrue();
        assertThat(handled).containsExactly(new AccountCredited("1", 10));
    }

    @Test
    void handler_of_super_class_is_used_when_there_is_no_handler_for_the_exact_type() {
        // Given
        List<Object> handled = new ArrayList<>();
        EventHandlers<Account> handlers = EventHandlers.builder(Account.class)
                .on(AccountCredited.class, (account, event) -> handled.add(event.getAmount()))
                .build();

        // When
        handlers.dispatch(new Account("1"), new BonusCredited("1", 7));

        // Then
        assertThat(handled).containsExactly(7L);
    }

    @Test
    void event_without_handler_is_not_dispatched() {
        // Given
        EventHandlers<Account> handlers = EventHandlers.builder(Account.class)
                .on(AccountCredited.class, (account, event) -> {
                })
                .build();

        // When
        boolean dispatched = handlers.dispatch(new Account("1"), new AccountDebited("1", 10));

        // Then
        assertThat(dispatched).isFalse();
        assertThat(handlers.handles(AccountCredited.class)).isTrue();
        assertThat(handlers.handles(AccountDebited.class)).isFalse();
    }

    @Test
    void registering_two_handlers_for_the_same_event_type_fails() {
        // Given
        EventHandlers.Builder<Account> builder = EventHandlers.builder(Account.class)
                .on(AccountCredited.class, (account, event) -> {
                });

        // When
        Throwable throwable = catchThrowable(() -> builder.on(AccountCredited.class, (account, event) -> {
        }));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessageContaining(AccountCredited.class.getName());
    }

    private static class BonusCredited extends AccountCredited {
        BonusCredited(String accountId, long amount) {
            super(accountId, amount);
        }
    }
}
