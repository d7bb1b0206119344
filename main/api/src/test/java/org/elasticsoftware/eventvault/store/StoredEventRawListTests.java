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

import org.elasticsoftware.eventvault.aggregate.account.Account;
import org.elasticsoftware.eventvault.aggregate.account.AccountCreatedEvent;
import org.elasticsoftware.eventvault.aggregate.account.AccountCreditedEvent;
import org.elasticsoftware.eventvault.aggregate.account.AccountEvent;
import org.elasticsoftware.eventvault.aggregate.account.AccountId;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StoredEventRawListTests {
    private static final AccountId ACCOUNT_1 = new AccountId("account-1");

    @Test
    public void testNewListIsUnbound() {
        StoredEventRawList<Account, AccountEvent, AccountId> list = new StoredEventRawList<>(Account.TYPE);

        assertTrue(list.isEmpty());
        assertEquals(0, list.size());
        assertTrue(list.getAggregateId().isEmpty());
        assertTrue(list.snapshot().isEmpty());
        assertTrue(list.snapshotAt(0).isEmpty());
        assertTrue(list.toNonEmpty().isEmpty());
        assertDoesNotThrow(list::checkConsistency);
    }

    @Test
    public void testFirstAppendBindsAggregateId() {
        StoredEventRawList<Account, AccountEvent, AccountId> list = new StoredEventRawList<>(Account.TYPE);

        StoredEvent<AccountEvent, AccountId> first = list.append(new AccountCreatedEvent(ACCOUNT_1, "alice"));

        assertEquals(ACCOUNT_1, first.aggregateId());
        assertEquals(0, first.index());
        assertEquals(ACCOUNT_1, list.getAggregateId().orElseThrow());
    }

    @Test
    public void testAppendReusesEstablishedId() {
        StoredEventRawList<Account, AccountEvent, AccountId> list = new StoredEventRawList<>(Account.TYPE);
        list.append(new AccountCreatedEvent(ACCOUNT_1, "alice"));

        // the event names another account, but the list is already bound
        StoredEvent<AccountEvent, AccountId> second = list.append(new AccountCreatedEvent(new AccountId("account-2"), "bob"));

        assertEquals(ACCOUNT_1, second.aggregateId());
        assertEquals(1, second.index());
        assertDoesNotThrow(list::checkConsistency);
    }

    @Test
    public void testInvalidInitialEvent() {
        StoredEventRawList<Account, AccountEvent, AccountId> list = new StoredEventRawList<>(Account.TYPE);

        InvalidInitialEventException exception = assertThrows(InvalidInitialEventException.class,
                () -> list.append(new AccountCreditedEvent(ACCOUNT_1, 10L)));

        assertEquals("Account", exception.getAggregateName());
        assertEquals("AccountCreditedEvent", exception.getEventName());
        assertTrue(list.isEmpty());
    }

    @Test
    public void testAppendAllOnEmptyInput() {
        StoredEventRawList<Account, AccountEvent, AccountId> list = new StoredEventRawList<>(Account.TYPE);

        assertThrows(EmptyEventListException.class, () -> list.appendAll(List.of()));
    }

    @Test
    public void testAppendAllWithInvalidFirstEventAppendsNothing() {
        StoredEventRawList<Account, AccountEvent, AccountId> list = new StoredEventRawList<>(Account.TYPE);

        assertThrows(InvalidInitialEventException.class, () -> list.appendAll(List.of(
                new AccountCreditedEvent(ACCOUNT_1, 10L),
                new AccountCreatedEvent(ACCOUNT_1, "alice"))));
        assertTrue(list.isEmpty());
    }

    @Test
    public void testAppendAllWithNullEventAppendsNothing() {
        StoredEventRawList<Account, AccountEvent, AccountId> list = new StoredEventRawList<>(Account.TYPE);

        assertThrows(NullPointerException.class, () -> list.appendAll(Arrays.asList(
                new AccountCreatedEvent(ACCOUNT_1, "alice"),
                null)));
        assertTrue(list.isEmpty());

        list.append(new AccountCreatedEvent(ACCOUNT_1, "alice"));
        assertThrows(NullPointerException.class, () -> list.appendAll(Arrays.asList(
                new AccountCreditedEvent(ACCOUNT_1, 1L),
                null,
                new AccountCreditedEvent(ACCOUNT_1, 2L))));
        assertEquals(1, list.size());
    }

    @Test
    public void testAppendAllAssignsContiguousIndices() {
        StoredEventRawList<Account, AccountEvent, AccountId> list = new StoredEventRawList<>(Account.TYPE);

        StoredEventList<Account, AccountEvent, AccountId> result = list.appendAll(List.of(
                new AccountCreatedEvent(ACCOUNT_1, "alice"),
                new AccountCreditedEvent(ACCOUNT_1, 10L),
                new AccountCreditedEvent(ACCOUNT_1, 5L)));

        assertEquals(3, result.size());
        for (int i = 0; i < result.size(); i++) {
            assertEquals(i, result.getEvents().get(i).index());
            assertEquals(ACCOUNT_1, result.getEvents().get(i).aggregateId());
        }
        assertEquals(3, list.size());
    }

    @Test
    public void testSnapshotAt() {
        StoredEventRawList<Account, AccountEvent, AccountId> list = new StoredEventRawList<>(Account.TYPE);
        list.append(new AccountCreatedEvent(ACCOUNT_1, "alice"));
        list.append(new AccountCreditedEvent(ACCOUNT_1, 10L));
        list.append(new AccountCreditedEvent(ACCOUNT_1, 5L));

        assertEquals(new Snapshot<>(new Account(ACCOUNT_1, "alice", 0L), 0), list.snapshotAt(0).orElseThrow());
        assertEquals(new Snapshot<>(new Account(ACCOUNT_1, "alice", 10L), 1), list.snapshotAt(1).orElseThrow());
        assertEquals(list.snapshot().orElseThrow(), list.snapshotAt(2).orElseThrow());
        assertTrue(list.snapshotAt(3).isEmpty());
        assertTrue(list.snapshotAt(-1).isEmpty());
    }

    @Test
    public void testRestoreConsistentHistory() {
        StoredEventRawList<Account, AccountEvent, AccountId> restored = StoredEventRawList.restore(Account.TYPE, List.of(
                new StoredEvent<AccountEvent, AccountId>(ACCOUNT_1, 0, new AccountCreatedEvent(ACCOUNT_1, "alice")),
                new StoredEvent<AccountEvent, AccountId>(ACCOUNT_1, 1, new AccountCreditedEvent(ACCOUNT_1, 7L))));

        assertEquals(7L, restored.snapshot().orElseThrow().aggregate().balance());
        // appending continues the sequence
        assertEquals(2, restored.append(new AccountCreditedEvent(ACCOUNT_1, 1L)).index());
    }

    @Test
    public void testRestoreDetectsForeignAggregateId() {
        InconsistentAggregateIdException exception = assertThrows(InconsistentAggregateIdException.class,
                () -> StoredEventRawList.restore(Account.TYPE, List.of(
                        new StoredEvent<AccountEvent, AccountId>(ACCOUNT_1, 0, new AccountCreatedEvent(ACCOUNT_1, "alice")),
                        new StoredEvent<AccountEvent, AccountId>(new AccountId("account-2"), 1, new AccountCreditedEvent(ACCOUNT_1, 7L)))));

        assertEquals("account-1", exception.getAggregateId());
        assertEquals("account-2", exception.getActualAggregateId());
        assertEquals(1, exception.getIndex());
    }

    @Test
    public void testRestoreDetectsIndexGap() {
        InconsistentEventIndexException exception = assertThrows(InconsistentEventIndexException.class,
                () -> StoredEventRawList.restore(Account.TYPE, List.of(
                        new StoredEvent<AccountEvent, AccountId>(ACCOUNT_1, 0, new AccountCreatedEvent(ACCOUNT_1, "alice")),
                        new StoredEvent<AccountEvent, AccountId>(ACCOUNT_1, 2, new AccountCreditedEvent(ACCOUNT_1, 7L)))));

        assertEquals(1, exception.getExpectedIndex());
        assertEquals(2, exception.getActualIndex());
    }

    @Test
    public void testRestoreDetectsIndexNotStartingAtZero() {
        assertThrows(InconsistentEventIndexException.class,
                () -> StoredEventRawList.restore(Account.TYPE, List.of(
                        new StoredEvent<AccountEvent, AccountId>(ACCOUNT_1, 1, new AccountCreatedEvent(ACCOUNT_1, "alice")))));
    }

    @Test
    public void testRestoreRejectsEmptyAggregateId() {
        assertThrows(InvalidInitialEventException.class,
                () -> StoredEventRawList.restore(Account.TYPE, List.of(
                        new StoredEvent<AccountEvent, AccountId>(AccountId.EMPTY, 0, new AccountCreditedEvent(ACCOUNT_1, 7L)))));
    }

    @Test
    public void testCopyIsIndependent() {
        StoredEventRawList<Account, AccountEvent, AccountId> list = new StoredEventRawList<>(Account.TYPE);
        list.append(new AccountCreatedEvent(ACCOUNT_1, "alice"));

        StoredEventRawList<Account, AccountEvent, AccountId> copy = list.copy();
        copy.append(new AccountCreditedEvent(ACCOUNT_1, 1L));

        assertEquals(1, list.size());
        assertEquals(2, copy.size());
        assertNotEquals(list, copy);
    }

    @Test
    public void testEventsViewIsReadOnly() {
        StoredEventRawList<Account, AccountEvent, AccountId> list = new StoredEventRawList<>(Account.TYPE);
        list.append(new AccountCreatedEvent(ACCOUNT_1, "alice"));

        assertThrows(UnsupportedOperationException.class, () -> list.getEvents().clear());
    }
}
