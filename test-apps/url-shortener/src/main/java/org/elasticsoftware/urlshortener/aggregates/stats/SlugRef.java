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
package org.elasticsoftware.urlshortener.aggregates.stats;

import org.elasticsoftware.eventvault.ids.AggregateIdRef;

/**
 * A {@link Slug} read in place, for instance from a request path, without copying it.
 */
public final class SlugRef extends AggregateIdRef<Slug, SlugRef> {
    public SlugRef(CharSequence source, int start, int end) {
        super(source, start, end);
    }

    public SlugRef(CharSequence source) {
        super(source);
    }

    @Override
    protected Slug newOwned(String value) {
        return new Slug(value);
    }

    @Override
    protected Class<Slug> ownedType() {
        return Slug.class;
    }
}
