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
 * Borrowed form of a string based aggregate identifier: a view over the region {@code [start, end)} of some
 * {@link CharSequence}. No characters are copied until {@link #toOwned()} or {@link #asString()} is called.
 * <p>
 * The viewed sequence must not change while the view is in use.
 *
 * @param <I> the matching owned type
 * @param <R> the concrete view type
 */
public abstract class AggregateIdRef<I extends AggregateId<I, R>, R extends AggregateIdRef<I, R>> extends AggregateIdentity<I> {
    private final CharSequence source;
    private final int start;
    private final int end;

    protected AggregateIdRef(CharSequence source, int start, int end) {
        this.source = Objects.requireNonNull(source, "source");
        Objects.checkFromToIndex(start, end, source.length());
        this.start = start;
        this.end = end;
    }

    protected AggregateIdRef(CharSequence source) {
        this(source, 0, source.length());
    }

    /**
     * Creates the owned type holding the given text.
     */
    protected abstract I newOwned(String value);

    @Override
    public final @NotNull I toOwned() {
        return newOwned(asString());
    }

    @Override
    public final @NotNull String asString() {
        // String.substring returns the same instance for the full range
        return source.subSequence(start, end).toString();
    }

    @Override
    public int length() {
        return end - start;
    }

    @Override
    public char charAt(int index) {
        return source.charAt(start + Objects.checkIndex(index, length()));
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        Objects.checkFromToIndex(start, end, length());
        return source.subSequence(this.start + start, this.start + end);
    }
}
