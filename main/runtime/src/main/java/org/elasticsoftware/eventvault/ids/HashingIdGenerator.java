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

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.util.Objects;
import java.util.function.Function;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Derives the entropy from a murmur3 hash of the seed, so equal seeds start from the same candidate.
 */
public class HashingIdGenerator<I extends AggregateId<I, ?>> implements AggregateIdGenerator<I> {
    private final HashFunction hashFunction = Hashing.murmur3_32_fixed();
    private final Function<String, I> idFactory;

    public HashingIdGenerator(Function<String, I> idFactory) {
        this.idFactory = Objects.requireNonNull(idFactory, "idFactory");
    }

    @Override
    public I generate(String seed, int bump) {
        return idFactory.apply(IdTokens.encode(hashFunction.hashString(seed, UTF_8).asInt(), bump));
    }
}
