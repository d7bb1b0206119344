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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builder form of an aggregate's event history. It may be empty, in which case it is not yet bound to an
 * aggregate id: the first appended event binds it, and the binding never changes afterwards.
 * <p>
 * The id is derived by applying the first event to {@link AggregateType#newInstance()} and reading
 * {@link Aggregate#getAggregateId()} back. Indices are assigned contiguously from 0 in append order.
 * <p>
 * Not thread safe.
 */
public final class StoredEventRawList<A extends Aggregate<A, E, I>, E extends DomainEvent, I extends AggregateId<I, ?>> {
    private final AggregateType<A> aggregateType;
    private final List<StoredEvent<E, I>> events;

    public StoredEventRawList(@NotNull AggregateType<A> aggregateType) {
        this(aggregateType, new ArrayList<>());
    }

    private StoredEventRawList(AggregateType<A> aggregateType, List<StoredEvent<E, I>> events) {
        this.aggregateType = Objects.requireNonNull(aggregateType, "aggregateType");
        this.events = events;
    }

    /**
     * Rebuilds a history from events loaded by a storage backend and verifies it.
     *
     * @throws InvalidInitialEventException when the first event carries an empty aggregate id
     * @throws InconsistentAggregateIdException when the events belong to more than one aggregate
     * @throws InconsistentEventIndexException when the indices are not contiguous from 0
     */
    public static <A extends Aggregate<A, E, I>, E extends DomainEvent, I extends AggregateId<I, ?>> StoredEventRawList<A, E, I> restore(
            @NotNull AggregateType<A> aggregateType,
            @NotNull Collection<StoredEvent<E, I>> storedEvents) {
        StoredEventRawList<A, E, I> list = new StoredEventRawList<>(aggregateType, new ArrayList<>(storedEvents));
        if (!list.isEmpty() && list.aggregateIdUnchecked().isEmpty()) {
            throw new InvalidInitialEventException(aggregateType.typeName(), list.events.get(0).event().getEventName());
        }
        list.checkConsistency();
        return list;
    }

    public AggregateType<A> getAggregateType() {
        return aggregateType;
    }

    public Optional<I> getAggregateId() {
        return events.isEmpty() ? Optional.empty() : Optional.of(aggregateIdUnchecked());
    }

    I aggregateIdUnchecked() {
        return events.get(0).aggregateId();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }

    /**
     * @return a read only view of the stored events, in index order
     */
    public List<StoredEvent<E, I>> getEvents() {
        return Collections.unmodifiableList(events);
    }

    /**
     * Appends one event. On an empty list the aggregate id is derived from this event, otherwise the
     * established id is reused.
     *
     * @throws InvalidInitialEventException when the list is empty and the event does not produce an id
     */
    public StoredEvent<E, I> append(@NotNull E event) {
        Objects.requireNonNull(event, "event");
        I aggregateId = initialAggregateId(event);
        if (aggregateId.isEmpty()) {
            throw new InvalidInitialEventException(aggregateType.typeName(), event.getEventName());
        }
        return appendUnchecked(aggregateId, event);
    }

    /**
     * Appends all events under one id (derived from the first event when this list is empty) and returns a
     * finalized copy of the result. Nothing is appended when an exception is thrown.
     *
     * @throws EmptyEventListException when {@code newEvents} is empty
     * @throws InvalidInitialEventException when the list is empty and the first event does not produce an id
     */
    public StoredEventList<A, E, I> appendAll(@NotNull List<? extends E> newEvents) {
        if (newEvents.isEmpty()) {
            throw new EmptyEventListException(aggregateType.typeName());
        }
        for (E event : newEvents) {
            Objects.requireNonNull(event, "event");
        }
        E first = newEvents.get(0);
        I aggregateId = initialAggregateId(first);
        if (aggregateId.isEmpty()) {
            throw new InvalidInitialEventException(aggregateType.typeName(), first.getEventName());
        }
        for (E event : newEvents) {
            appendUnchecked(aggregateId, event);
        }
        return new StoredEventList<>(copy());
    }

    StoredEvent<E, I> appendUnchecked(I aggregateId, E event) {
        StoredEvent<E, I> storedEvent = new StoredEvent<>(aggregateId, events.size(), event);
        events.add(storedEvent);
        return storedEvent;
    }

    private I initialAggregateId(E maybeInitialEvent) {
        if (!events.isEmpty()) {
            return aggregateIdUnchecked();
        }
        return aggregateType.newInstance().apply(maybeInitialEvent).getAggregateId();
    }

    /**
     * @return the state after all events, empty when there are no events
     */
    public Optional<Snapshot<A>> snapshot() {
        return events.isEmpty() ? Optional.empty() : Optional.of(snapshotUnchecked());
    }

    Snapshot<A> snapshotUnchecked() {
        A aggregate = aggregateType.newInstance();
        for (StoredEvent<E, I> storedEvent : events) {
            aggregate = aggregate.apply(storedEvent.event());
        }
        return new Snapshot<>(aggregate, events.size() - 1L);
    }

    /**
     * @return the state after the event at {@code index}, empty when the list holds fewer than
     * {@code index + 1} events
     */
    public Optional<Snapshot<A>> snapshotAt(long index) {
        if (index < 0 || index >= events.size()) {
            return Optional.empty();
        }
        A aggregate = aggregateType.newInstance();
        for (StoredEvent<E, I> storedEvent : events) {
            aggregate = aggregate.apply(storedEvent.event());
            if (storedEvent.index() == index) {
                break;
            }
        }
        return Optional.of(new Snapshot<>(aggregate, index));
    }

    /**
     * Verifies that every event carries the first event's aggregate id and that indices run from 0 without gaps.
     */
    public void checkConsistency() {
        if (events.isEmpty()) {
            return;
        }
        I aggregateId = aggregateIdUnchecked();
        long expectedIndex = 0;
        for (StoredEvent<E, I> storedEvent : events) {
            if (!aggregateId.equals(storedEvent.aggregateId())) {
                throw new InconsistentAggregateIdException(aggregateType.typeName(), aggregateId.asString(),
                        storedEvent.aggregateId().asString(), storedEvent.index());
            }
            if (storedEvent.index() != expectedIndex) {
                throw new InconsistentEventIndexException(aggregateType.typeName(), aggregateId.asString(),
                        expectedIndex, storedEvent.index());
            }
            expectedIndex++;
        }
    }

    /**
     * @return the finalized list, or empty when no event was appended yet
     */
    public Optional<StoredEventList<A, E, I>> toNonEmpty() {
        return events.isEmpty() ? Optional.empty() : Optional.of(new StoredEventList<>(copy()));
    }

    public StoredEventRawList<A, E, I> copy() {
        return new StoredEventRawList<>(aggregateType, new ArrayList<>(events));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StoredEventRawList<?, ?, ?> other)) {
            return false;
        }
        return aggregateType.equals(other.aggregateType) && events.equals(other.events);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateType.typeName(), events);
    }

    @Override
    public String toString() {
        return "StoredEventRawList{" +
                "aggregateType=" + aggregateType.typeName() +
                ", aggregateId=" + getAggregateId().map(I::asString).orElse("<unbound>") +
                ", size=" + events.size() +
                '}';
    }
}
