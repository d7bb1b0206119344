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

/**
 * Common base of the two forms of a string based aggregate identifier: the owned {@link AggregateId} and the
 * borrowed {@link AggregateIdRef}.
 * <p>
 * Equality and hashing only look at the owned type and the characters, so an owned id and any view over the
 * same text are interchangeable as {@link java.util.HashMap} keys. The hash code is the one {@link String}
 * would compute for the same characters.
 *
 * @param <I> the owned identifier type of this family
 */
public abstract class AggregateIdentity<I extends AggregateId<I, ?>> implements CharSequence {

    AggregateIdentity() {
    }

    /**
     * @return the owned form, either this instance or a fresh copy of the viewed characters
     */
    public abstract @NotNull I toOwned();

    /**
     * @return the identifier text
     */
    public abstract @NotNull String asString();

    /**
     * Identifies the family this identifier belongs to. Forms of different families are never equal.
     */
    protected abstract Class<?> ownedType();

    @Override
    public boolean isEmpty() {
        return length() == 0;
    }

    public boolean contentEquals(CharSequence other) {
        int length = length();
        if (other.length() != length) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (charAt(i) != other.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AggregateIdentity<?> other)) {
            return false;
        }
        return ownedType() == other.ownedType() && contentEquals(other);
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (int i = 0; i < length(); i++) {
            h = 31 * h + charAt(i);
        }
        return h;
    }

    @Override
    public String toString() {
        return asString();
    }
}
