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
package org.elasticsoftware.urlshortener.services;

import org.elasticsoftware.eventvault.ids.AggregateIdentity;
import org.elasticsoftware.eventvault.ids.UniqueIdAllocator;
import org.elasticsoftware.eventvault.store.AggregateNotFoundException;
import org.elasticsoftware.eventvault.store.EventStore;
import org.elasticsoftware.eventvault.store.EventStoreException;
import org.elasticsoftware.eventvault.store.StoredEventList;
import org.elasticsoftware.urlshortener.aggregates.stats.ShortLink;
import org.elasticsoftware.urlshortener.aggregates.stats.Slug;
import org.elasticsoftware.urlshortener.aggregates.stats.Stats;
import org.elasticsoftware.urlshortener.aggregates.stats.Url;
import org.elasticsoftware.urlshortener.aggregates.stats.events.RedirectRecordedEvent;
import org.elasticsoftware.urlshortener.aggregates.stats.events.ShortLinkCreatedEvent;
import org.elasticsoftware.urlshortener.aggregates.stats.events.ShortenerEvent;
import org.elasticsoftware.urlshortener.commands.CommandHandler;
import org.elasticsoftware.urlshortener.errors.InvalidUrlException;
import org.elasticsoftware.urlshortener.errors.SlugAlreadyInUseException;
import org.elasticsoftware.urlshortener.errors.SlugNotFoundException;
import org.elasticsoftware.urlshortener.queries.QueryHandler;
import org.elasticsoftware.urlshortener.validation.UrlValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Short link commands and queries on top of an {@link EventStore}.
 * <p>
 * Commands run one at a time per service instance, so the free slug check and the commit that claims the slug
 * cannot interleave. Queries do not take that lock and rely on the store's own locking.
 * <p>
 * Storage errors other than a missing aggregate mean an event list was built wrongly, and are rethrown as
 * {@link IllegalStateException}.
 */
public class UrlShortenerService implements CommandHandler, QueryHandler {
    private static final Logger log = LoggerFactory.getLogger(UrlShortenerService.class);
    private final EventStore<Stats, ShortenerEvent, Slug> eventStore;
    private final UniqueIdAllocator<Slug> slugAllocator;
    private final UrlValidator urlValidator;

    public UrlShortenerService(EventStore<Stats, ShortenerEvent, Slug> eventStore,
                               UniqueIdAllocator<Slug> slugAllocator,
                               UrlValidator urlValidator) {
        this.eventStore = eventStore;
        this.slugAllocator = slugAllocator;
        this.urlValidator = urlValidator;
    }

    @Override
    public synchronized ShortLink handleCreateShortLink(String url, Slug slug) {
        if (!urlValidator.isValid(url)) {
            throw new InvalidUrlException(url);
        }
        try {
            Slug newSlug;
            if (slug != null && !slug.isEmpty()) {
                if (eventStore.exists(slug)) {
                    throw new SlugAlreadyInUseException(slug.asString());
                }
                newSlug = slug;
            } else {
                newSlug = slugAllocator.allocate(url);
            }
            StoredEventList<Stats, ShortenerEvent, Slug> eventList =
                    StoredEventList.of(Stats.TYPE, List.of(new ShortLinkCreatedEvent(newSlug, new Url(url))));
            eventStore.commit(eventList);
            ShortLink shortLink = eventList.snapshot().aggregate().link();
            log.debug("Created short link {} for {}", shortLink.slug(), shortLink.url());
            return shortLink;
        } catch (EventStoreException e) {
            throw storeFailure(e);
        }
    }

    @Override
    public synchronized ShortLink handleRedirect(AggregateIdentity<Slug> slug) {
        StoredEventList<Stats, ShortenerEvent, Slug> eventList = fetch(slug);
        try {
            eventList.append(new RedirectRecordedEvent(eventList.getAggregateId()));
            eventStore.commit(eventList);
        } catch (EventStoreException e) {
            throw storeFailure(e);
        }
        log.trace("Recorded redirect for {}", slug);
        return eventList.snapshot().aggregate().link();
    }

    @Override
    public Stats getStats(AggregateIdentity<Slug> slug) {
        return fetch(slug).snapshot().aggregate();
    }

    private StoredEventList<Stats, ShortenerEvent, Slug> fetch(AggregateIdentity<Slug> slug) {
        try {
            return eventStore.fetch(slug);
        } catch (AggregateNotFoundException e) {
            throw new SlugNotFoundException(slug.asString());
        } catch (EventStoreException e) {
            throw storeFailure(e);
        }
    }

    private IllegalStateException storeFailure(EventStoreException e) {
        log.error("Unexpected event store failure for {} {}", e.getAggregateName(), e.getAggregateId(), e);
        return new IllegalStateException("unexpected event store failure: " + e.getMessage(), e);
    }
}
