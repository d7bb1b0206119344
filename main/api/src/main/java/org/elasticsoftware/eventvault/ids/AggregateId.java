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

import jakarta.validation.constraints.NotNull;

import java.util.Objects;

/**
 * Owned form of a string based aggregate identifier. Immutable, holds its own {@link String}.
 * <p>
 * Concrete identifiers are declared in pairs:
 * <pre>{@code
 * public final class Slug extends AggregateId<Slug, SlugRef> { ... }
 * public final class SlugRef extends AggregateIdRef<Slug, SlugRef> { ... }
 * }</pre>
 *
 * @param <I> the concrete owned type
 * @param <R> the matching borrowed view type
 */
public abstract class AggregateId<I extends AggregateId<I, R>, R extends AggregateIdRef<I, R>> extends AggregateIdentity<I> {
    private final String value;
    private R ref;

    protected AggregateId(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    /**
     * Creates the borrowed view type over the given region.
     */
    protected abstract R newRef(CharSequence source, int start, int end);

    /**
     * @return a view over this identifier's characters, created once
     */
    public final @NotNull R asRef() {
        R current = ref;
        if (current == null) {
            current = newRef(value, 0, value.length());
            ref = current;
        }
        return current;
    }

    /**
     * @return this instance as its concrete type
     */
    protected abstract I self();

    @Override
    public final @NotNull I toOwned() {
        return self();
    }

    @Override
    protected final Class<?> ownedType() {
        return getClass();
    }

    @Override
    public final @NotNull String asString() {
        return value;
    }

    @Override
    public int length() {
        return value.length();
    }

    @Override
    public char charAt(int index) {
        return value.charAt(index);
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return value.subSequence(start, end);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
