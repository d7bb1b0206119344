/*
 * Copyright 2022 - 2026 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */
package org.elasticsoftware.eventvault.store;

import org.elasticsoftware.eventvault.EventVaultException;
import org.elasticsoftware.eventvault.aggregate.account.Account;
import org.elasticsoftware.eventvault.aggregate.account.AccountCreatedEvent;
import org.elasticsoftware.eventvault.aggregate.account.AccountCreditedEvent;
import org.elasticsoftware.eventvault.aggregate.account.AccountEvent;
import org.elasticsoftware.eventvault.aggregate.account.AccountId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EventStoreExceptionTests {

    @Test
    public void testAggregateNotFoundException() {
        AggregateNotFoundException exception = new AggregateNotFoundException("Account", "account-123");

        assertEquals("Account", exception.getAggregateName());
        assertEquals("account-123", exception.getAggregateId());
        assertEquals("aggregate Account with id account-123 does not exist", exception.getMessage());
        assertNull(exception.getCause());
    }

    @Test
    public void testEventStorageExceptionKeepsCause() {
        Throwable cause = new InterruptedException("interrupted");
        EventStorageException exception = new EventStorageException("Account", "account-1", "lock acquisition interrupted", cause);

        assertSame(cause, exception.getCause());
        assertEquals("event storage error: lock acquisition interrupted", exception.getMessage());
        assertEquals("account-1", exception.getAggregateId());
    }

    @Test
    public void testEmptyEventListHasNoAggregateId() {
        EventStoreException exception = assertThrows(EventStoreException.class,
                () -> StoredEventList.<Account, AccountEvent, AccountId>of(Account.TYPE, List.of()));

        assertInstanceOf(EmptyEventListException.class, exception);
        assertEquals("Account", exception.getAggregateName());
        assertNull(exception.getAggregateId());
        assertEquals("empty event list", exception.getMessage());
    }

    @Test
    public void testInvalidInitialEventNamesTheEvent() {
        EventStoreException exception = assertThrows(EventStoreException.class,
                () -> StoredEventList.<Account, AccountEvent, AccountId>of(Account.TYPE,
                        List.of(new AccountCreditedEvent(new AccountId("account-1"), 5L))));

        InvalidInitialEventException invalid = assertInstanceOf(InvalidInitialEventException.class, exception);
        assertEquals("AccountCreditedEvent", invalid.getEventName());
        assertNull(invalid.getAggregateId());
        assertTrue(invalid.getMessage().contains("AccountCreditedEvent"));
    }

    @Test
    public void testConsistencyErrorsReportTheBoundAggregate() {
        AccountId accountId = new AccountId("account-1");

        EventVaultException exception = assertThrows(EventVaultException.class,
                () -> StoredEventRawList.restore(Account.TYPE, List.of(
                        new StoredEvent<AccountEvent, AccountId>(accountId, 0, new AccountCreatedEvent(accountId, "alice")),
                        new StoredEvent<AccountEvent, AccountId>(accountId, 5, new AccountCreditedEvent(accountId, 1L)))));

        assertInstanceOf(InconsistentEventIndexException.class, exception);
        assertEquals("Account", exception.getAggregateName());
        assertEquals("account-1", exception.getAggregateId());
        assertEquals("inconsistent event index number: expected 1 but was 5", exception.getMessage());
    }

    @Test
    public void testInconsistentAggregateIdMessage() {
        InconsistentAggregateIdException exception =
                new InconsistentAggregateIdException("Account", "account-1", "account-2", 3);

        assertEquals("inconsistent event aggregate id at index 3: expected 'account-1' but was 'account-2'",
                exception.getMessage());
        assertInstanceOf(RuntimeException.class, exception);
    }
}
