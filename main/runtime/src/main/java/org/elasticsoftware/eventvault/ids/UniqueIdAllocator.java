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
package org.elasticsoftware.eventvault.ids;

import org.elasticsoftware.eventvault.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Hands out identifiers that are not yet present in an {@link EventStore}, bumping the generator's collision
 * counter until a free one is found.
 * <p>
 * The check is not atomic with a later commit: callers that need exclusivity must serialize allocation and
 * commit themselves.
 */
public class UniqueIdAllocator<I extends AggregateId<I, ?>> {
    private static final Logger log = LoggerFactory.getLogger(UniqueIdAllocator.class);
    private final AggregateIdGenerator<I> generator;
    private final EventStore<?, ?, I> eventStore;
    private final int maxBump;

    public UniqueIdAllocator(AggregateIdGenerator<I> generator, EventStore<?, ?, I> eventStore) {
        this(generator, eventStore, AggregateIdGenerator.MAX_BUMP);
    }

    public UniqueIdAllocator(AggregateIdGenerator<I> generator, EventStore<?, ?, I> eventStore, int maxBump) {
        if (maxBump < 0 || maxBump > AggregateIdGenerator.MAX_BUMP) {
            throw new IllegalArgumentException("maxBump must be between 0 and " + AggregateIdGenerator.MAX_BUMP);
        }
        this.generator = Objects.requireNonNull(generator, "generator");
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        this.maxBump = maxBump;
    }

    /**
     * @throws IllegalStateException when every bump value up to the configured maximum collides
     */
    public I allocate(String seed) {
        for (int bump = 0; bump <= maxBump; bump++) {
            I candidate = generator.generate(seed, bump);
            if (!eventStore.exists(candidate)) {
                return candidate;
            }
            log.debug("Generated id {} is already in use, retrying with bump {}", candidate, bump + 1);
        }
        log.error("Unable to allocate a free id for seed '{}' after {} attempts", seed, maxBump + 1);
        throw new IllegalStateException("id space exhausted for seed '" + seed + "' after " + (maxBump + 1) + " attempts");
    }

    public int getMaxBump() {
        return maxBump;
    }
}
