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

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.eventvault.aggregate.Aggregate;
import org.elasticsoftware.eventvault.aggregate.AggregateType;
import org.elasticsoftware.eventvault.events.DomainEvent;
import org.elasticsoftware.eventvault.ids.AggregateId;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The complete history of one aggregate. Never empty and always bound to an aggregate id.
 * <p>
 * Instances handed out by an {@link EventStore} are private copies: callers append to their copy and
 * {@link EventStore#commit(StoredEventList) commit} it again. Not thread safe.
 */
public final class StoredEventList<A extends Aggregate<A, E, I>, E extends DomainEvent, I extends AggregateId<I, ?>> {
    private final StoredEventRawList<A, E, I> events;

    StoredEventList(StoredEventRawList<A, E, I> events) {
        this.events = events;
    }

    /**
     * @throws EmptyEventListException when {@code events} is empty
     * @throws InvalidInitialEventException when the first event does not produce an aggregate id
     */
    public static <A extends Aggregate<A, E, I>, E extends DomainEvent, I extends AggregateId<I, ?>> StoredEventList<A, E, I> of(
            @NotNull AggregateType<A> aggregateType,
            @NotNull List<? extends E> events) {
        return new StoredEventRawList<A, E, I>(aggregateType).appendAll(events);
    }

    public @NotNull I getAggregateId() {
        return events.aggregateIdUnchecked();
    }

    public AggregateType<A> getAggregateType() {
        return events.getAggregateType();
    }

    public Snapshot<A> snapshot() {
        return events.snapshotUnchecked();
    }

    public Optional<Snapshot<A>> snapshotAt(long index) {
        return events.snapshotAt(index);
    }

    public StoredEvent<E, I> append(@NotNull E event) {
        return events.appendUnchecked(getAggregateId(), Objects.requireNonNull(event, "event"));
    }

    /**
     * Appends the events under this list's aggregate id. Nothing is appended when one of them is {@code null}.
     *
     * @return this list
     */
    public StoredEventList<A, E, I> appendAll(@NotNull List<? extends E> newEvents) {
        for (E event : newEvents) {
            Objects.requireNonNull(event, "event");
        }
        I aggregateId = getAggregateId();
        for (E event : newEvents) {
            events.appendUnchecked(aggregateId, event);
        }
        return this;
    }

    public List<StoredEvent<E, I>> getEvents() {
        return events.getEvents();
    }

    public int size() {
        return events.size();
    }

    public void checkConsistency() {
        events.checkConsistency();
    }

    public StoredEventList<A, E, I> copy() {
        return new StoredEventList<>(events.copy());
    }

    /**
     * @return a builder holding a copy of these events
     */
    public StoredEventRawList<A, E, I> raw() {
        return events.copy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StoredEventList<?, ?, ?> other)) {
            return false;
        }
        return events.equals(other.events);
    }

    @Override
    public int hashCode() {
        return events.hashCode();
    }

    @Override
    public String toString() {
        return "StoredEventList{" +
                "aggregateType=" + getAggregateType().typeName() +
                ", aggregateId=" + getAggregateId() +
                ", size=" + size() +
                '}';
    }
}
