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

package org.eventide.testsupport.domain;

import org.eventide.event.EventName;

import java.util.Objects;

@EventName("account-closed")
public class AccountClosed implements AccountEvent {

    private String accountId;
    private String reason;

    @SuppressWarnings("unused")
    AccountClosed() {
    }

    public AccountClosed(String accountId, String reason) {
        this.accountId = accountId;
        this.reason = reason;
    }

    @Override
    public String getAccountId() {
        return accountId;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AccountClosed)) return false;
        AccountClosed that = (AccountClosed) o;
        return Objects.equals(accountId, that.accountId) &&
                Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accountId, reason);
    }

    @Override
    public String toString() {
        return "AccountClosed{" +
                "accountId='" + accountId + '\'' +
                ", reason='" + reason + '\'' +
                '}';
    }
}
