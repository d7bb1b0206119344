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
import org.elasticsoftware.eventvault.events.DomainEvent;
import org.elasticsoftware.eventvault.ids.AggregateId;
import org.elasticsoftware.eventvault.ids.AggregateIdentity;

/**
 * Storage for aggregate histories, one {@link StoredEventList} per aggregate id.
 * <p>
 * Identifiers may be passed in either form: the owned {@link AggregateId} or a borrowed view over it.
 * Every operation may throw {@link EventStorageException} when the backend fails.
 */
public interface EventStore<A extends Aggregate<A, E, I>, E extends DomainEvent, I extends AggregateId<I, ?>> {
    /**
     * @return a private copy of the full history
     * @throws AggregateNotFoundException when nothing was committed under this id
     */
    @NotNull StoredEventList<A, E, I> fetch(@NotNull AggregateIdentity<I> aggregateId);

    boolean exists(@NotNull AggregateIdentity<I> aggregateId);

    /**
     * Stores the whole history under the list's aggregate id, replacing any earlier history.
     */
    void commit(@NotNull StoredEventList<A, E, I> eventList);

    /**
     * Deletes the history and returns it.
     *
     * @throws AggregateNotFoundException when nothing was committed under this id
     */
    @NotNull StoredEventList<A, E, I> remove(@NotNull AggregateIdentity<I> aggregateId);
}
