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
package org.elasticsoftware.eventvault.store.memory;

import org.elasticsoftware.eventvault.aggregate.Aggregate;
import org.elasticsoftware.eventvault.aggregate.AggregateType;
import org.elasticsoftware.eventvault.events.DomainEvent;
import org.elasticsoftware.eventvault.ids.AggregateId;
import org.elasticsoftware.eventvault.ids.AggregateIdentity;
import org.elasticsoftware.eventvault.store.AggregateNotFoundException;
import org.elasticsoftware.eventvault.store.EventStorageException;
import org.elasticsoftware.eventvault.store.EventStore;
import org.elasticsoftware.eventvault.store.StoredEventList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link EventStore} keeping every history in a {@link HashMap} guarded by a single read/write lock.
 * <p>
 * Lookups accept borrowed identifiers directly, since they hash and compare equal to the owned keys.
 * Histories are copied on the way in and on the way out.
 */
public class InMemoryEventStore<A extends Aggregate<A, E, I>, E extends DomainEvent, I extends AggregateId<I, ?>>
        implements EventStore<A, E, I> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);
    private final AggregateType<A> aggregateType;
    private final Map<I, StoredEventList<A, E, I>> eventLists = new HashMap<>();
    private final ReentrantReadWriteLock lock;

    public InMemoryEventStore(AggregateType<A> aggregateType) {
        this(aggregateType, false);
    }

    public InMemoryEventStore(AggregateType<A> aggregateType, boolean fair) {
        this.aggregateType = Objects.requireNonNull(aggregateType, "aggregateType");
        this.lock = new ReentrantReadWriteLock(fair);
    }

    @Override
    public StoredEventList<A, E, I> fetch(AggregateIdentity<I> aggregateId) {
        Lock readLock = acquire(lock.readLock(), aggregateId);
        try {
            StoredEventList<A, E, I> eventList = eventLists.get(aggregateId);
            if (eventList == null || eventList.size() == 0) {
                throw new AggregateNotFoundException(aggregateType.typeName(), aggregateId.asString());
            }
            log.trace("Fetched {} events for {} with id {}", eventList.size(), aggregateType.typeName(), aggregateId);
            return eventList.copy();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public boolean exists(AggregateIdentity<I> aggregateId) {
        Lock readLock = acquire(lock.readLock(), aggregateId);
        try {
            return eventLists.containsKey(aggregateId);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public void commit(StoredEventList<A, E, I> eventList) {
        I aggregateId = eventList.getAggregateId();
        StoredEventList<A, E, I> copy = eventList.copy();
        Lock writeLock = acquire(lock.writeLock(), aggregateId);
        try {
            StoredEventList<A, E, I> previous = eventLists.put(aggregateId, copy);
            log.trace("Committed {} events for {} with id {} (previously {})", copy.size(), aggregateType.typeName(),
                    aggregateId, previous != null ? previous.size() : 0);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public StoredEventList<A, E, I> remove(AggregateIdentity<I> aggregateId) {
        Lock writeLock = acquire(lock.writeLock(), aggregateId);
        try {
            StoredEventList<A, E, I> removed = eventLists.remove(aggregateId);
            if (removed == null) {
                throw new AggregateNotFoundException(aggregateType.typeName(), aggregateId.asString());
            }
            log.trace("Removed {} events for {} with id {}", removed.size(), aggregateType.typeName(), aggregateId);
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    public int size() {
        Lock readLock = acquire(lock.readLock(), null);
        try {
            return eventLists.size();
        } finally {
            readLock.unlock();
        }
    }

    public void clear() {
        Lock writeLock = acquire(lock.writeLock(), null);
        try {
            log.trace("Clearing {} {} histories", eventLists.size(), aggregateType.typeName());
            eventLists.clear();
        } finally {
            writeLock.unlock();
        }
    }

    private Lock acquire(Lock lock, CharSequence aggregateId) {
        try {
            lock.lockInterruptibly();
            return lock;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventStorageException(aggregateType.typeName(),
                    aggregateId != null ? aggregateId.toString() : null,
                    "interrupted while waiting for the store lock", e);
        }
    }
}
