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

import org.elasticsoftware.eventvault.ids.AggregateId;

/**
 * Identifier of a short link, the path segment users follow.
 */
public final class Slug extends AggregateId<Slug, SlugRef> {
    public static final Slug EMPTY = new Slug("");

    public Slug(String value) {
        super(value);
    }

    @Override
    protected Slug self() {
        return this;
    }

    @Override
    protected SlugRef newRef(CharSequence source, int start, int end) {
        return new SlugRef(source, start, end);
    }
}
