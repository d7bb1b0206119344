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

/**
 * Produces candidate identifiers. Calls with the same seed and a different bump must yield different
 * candidates, which is what {@link UniqueIdAllocator} relies on to step past collisions.
 *
 * @param <I> the owned identifier type produced
 */
@FunctionalInterface
public interface AggregateIdGenerator<I extends AggregateId<I, ?>> {
    int MAX_BUMP = 0xFFFF;

    /**
     * @param seed caller supplied input, generators may ignore it
     * @param bump collision counter in {@code [0, MAX_BUMP]}
     */
    I generate(String seed, int bump);
}
