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

import java.time.Clock;
import java.util.Objects;
import java.util.function.Function;

/**
 * Takes its entropy from the sub second part of the clock, ignoring the seed.
 */
public class TimeBasedIdGenerator<I extends AggregateId<I, ?>> implements AggregateIdGenerator<I> {
    private final Clock clock;
    private final Function<String, I> idFactory;

    public TimeBasedIdGenerator(Function<String, I> idFactory) {
        this(Clock.systemUTC(), idFactory);
    }

    public TimeBasedIdGenerator(Clock clock, Function<String, I> idFactory) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.idFactory = Objects.requireNonNull(idFactory, "idFactory");
    }

    @Override
    public I generate(String seed, int bump) {
        return idFactory.apply(IdTokens.encode(clock.instant().getNano(), bump));
    }
}
