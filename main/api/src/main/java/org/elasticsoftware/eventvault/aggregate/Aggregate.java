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

package org.elasticsoftware.eventvault.aggregate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.eventvault.events.DomainEvent;
import org.elasticsoftware.eventvault.ids.AggregateId;

/**
 * A projection of an event history. Implementations are immutable (usually records): {@link #apply(DomainEvent)}
 * returns the next state instead of changing this one.
 *
 * @param <A> the aggregate type itself
 * @param <E> the event type folded into this aggregate
 * @param <I> the owned identifier type
 */
public interface Aggregate<A extends Aggregate<A, E, I>, E extends DomainEvent, I extends AggregateId<I, ?>> {
    /**
     * @return the identifier, empty for the default state
     */
    @JsonIgnore
    @NotNull I getAggregateId();

    /**
     * Folds one event into this state. Must be deterministic and must not throw.
     */
    @NotNull A apply(@NotNull E event);
}
