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

import org.elasticsoftware.eventvault.aggregate.Aggregate;
import org.elasticsoftware.eventvault.aggregate.AggregateType;
import org.elasticsoftware.eventvault.annotations.AggregateInfo;
import org.elasticsoftware.urlshortener.aggregates.stats.events.RedirectRecordedEvent;
import org.elasticsoftware.urlshortener.aggregates.stats.events.ShortLinkCreatedEvent;
import org.elasticsoftware.urlshortener.aggregates.stats.events.ShortenerEvent;

@AggregateInfo("Stats")
public record Stats(ShortLink link, long redirects) implements Aggregate<Stats, ShortenerEvent, Slug> {
    public static final Stats EMPTY = new Stats(ShortLink.EMPTY, 0L);
    public static final AggregateType<Stats> TYPE = AggregateType.of(Stats.class, () -> EMPTY);

    @Override
    public Slug getAggregateId() {
        return link.slug();
    }

    @Override
    public Stats apply(ShortenerEvent event) {
        if (event instanceof ShortLinkCreatedEvent created) {
            return new Stats(new ShortLink(created.slug(), created.url()), 0L);
        } else if (event instanceof RedirectRecordedEvent redirect && redirect.slug().equals(link.slug())) {
            return new Stats(link, redirects + 1);
        }
        // redirects recorded against another link
        return this;
    }
}
