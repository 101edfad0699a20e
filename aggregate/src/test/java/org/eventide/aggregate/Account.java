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

import org.eventide.testsupport.domain.AccountClosed;
import org.eventide.testsupport.domain.AccountCredited;
import org.eventide.testsupport.domain.AccountDebited;
import org.eventide.testsupport.domain.AccountOpened;

import java.time.Instant;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Account aggregate used by the tests. {@link AccountClosed} has no handler on purpose.
 */
class Account extends Aggregate implements SnapshotCapable<Account.State> {
    private static final EventHandlers<Account> HANDLERS = EventHandlers.builder(Account.class)
            .on(AccountOpened.class, Account::onOpened)
            .on(AccountCredited.class, Account::onCredited)
            .on(AccountDebited.class, Account::onDebited)
            .build();

    private String owner;
    private long balance;

    Account(String id) {
        super(id);
    }

    static Account open(String id, String owner) {
        Account account = new Account(id);
        account.apply(new AccountOpened(id, owner, Instant.now()));
        return account;
    }

    void credit(long amount) {
        apply(new AccountCredited(id(), amount));
    }

    void debit(long amount) {
        if (amount > balance) {
            throw new IllegalStateException("Insufficient funds");
        }
        apply(new AccountDebited(id(), amount));
    }

    void close(String reason) {
        apply(new AccountClosed(id(), reason));
    }

    String owner() {
        return owner;
    }

    long balance() {
        return balance;
    }

    @Override
    protected EventHandlers<?> eventHandlers() {
        return HANDLERS;
    }

    @Override
    public State createSnapshot() {
        return new State(owner, balance);
    }

    @Override
    public void loadSnapshot(State snapshot) {
        this.owner = snapshot.owner;
        this.balance = snapshot.balance;
    }

    private void onOpened(AccountOpened event) {
        owner = event.getOwner();
    }

    private void onCredited(AccountCredited event) {
        balance += event.getAmount();
    }

    private void onDebited(AccountDebited event) {
        balance -= event.getAmount();
    }

    static final class State {
        private String owner;
        private long balance;

        @SuppressWarnings("unused")
        private State() {
        }

        State(String owner, long balance) {
            this.owner = owner;
            this.balance = balance;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof State)) return false;
            State state = (State) o;
            return balance == state.balance && Objects.equals(owner, state.owner);
        }

        @Override
        public int hashCode() {
            return Objects.hash(owner, balance);
        }

        @Override
        public String toString() {
            return new StringJoiner(", ", State.class.getSimpleName() + "[", "]")
                    .add("owner='" + owner + "'")
                    .add("balance=" + balance)
                    .toString();
        }
    }
}
