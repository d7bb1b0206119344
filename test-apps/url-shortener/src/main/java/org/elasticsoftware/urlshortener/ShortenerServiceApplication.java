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
package org.elasticsoftware.urlshortener;

import org.elasticsoftware.eventvault.ids.AggregateIdGenerator;
import org.elasticsoftware.eventvault.ids.HashingIdGenerator;
import org.elasticsoftware.eventvault.ids.TimeBasedIdGenerator;
import org.elasticsoftware.eventvault.ids.UniqueIdAllocator;
import org.elasticsoftware.eventvault.store.EventStore;
import org.elasticsoftware.eventvault.store.memory.InMemoryEventStore;
import org.elasticsoftware.urlshortener.aggregates.stats.Slug;
import org.elasticsoftware.urlshortener.aggregates.stats.Stats;
import org.elasticsoftware.urlshortener.aggregates.stats.events.ShortenerEvent;
import org.elasticsoftware.urlshortener.services.UrlShortenerService;
import org.elasticsoftware.urlshortener.validation.UriComponentsUrlValidator;
import org.elasticsoftware.urlshortener.validation.UrlValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.PropertySource;

@SpringBootApplication
@PropertySource("classpath:url-shortener.properties")
public class ShortenerServiceApplication {
    private static final Logger log = LoggerFactory.getLogger(ShortenerServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ShortenerServiceApplication.class, args);
    }

    @Bean(name = "shortenerEventStore")
    public InMemoryEventStore<Stats, ShortenerEvent, Slug> eventStore(
            @Value("${urlshortener.store.fair-locking:false}") boolean fairLocking) {
        log.info("Using in-memory event store (fair locking: {})", fairLocking);
        return new InMemoryEventStore<>(Stats.TYPE, fairLocking);
    }

    @Bean(name = "shortenerSlugGenerator")
    public AggregateIdGenerator<Slug> slugGenerator(@Value("${urlshortener.slug.generator:time}") String generator) {
        log.info("Using {} slug generator", generator);
        switch (generator) {
            case "time":
                return new TimeBasedIdGenerator<>(Slug::new);
            case "hash":
                return new HashingIdGenerator<>(Slug::new);
            default:
                throw new IllegalArgumentException("Unknown slug generator: " + generator);
        }
    }

    @Bean(name = "shortenerSlugAllocator")
    public UniqueIdAllocator<Slug> slugAllocator(AggregateIdGenerator<Slug> slugGenerator,
                                                 EventStore<Stats, ShortenerEvent, Slug> eventStore,
                                                 @Value("${urlshortener.slug.max-bump:65535}") int maxBump) {
        return new UniqueIdAllocator<>(slugGenerator, eventStore, Math.min(maxBump, AggregateIdGenerator.MAX_BUMP));
    }

    @Bean(name = "shortenerUrlValidator")
    public UrlValidator urlValidator() {
        return new UriComponentsUrlValidator();
    }

    @Bean(name = "urlShortenerService")
    public UrlShortenerService urlShortenerService(EventStore<Stats, ShortenerEvent, Slug> eventStore,
                                                   UniqueIdAllocator<Slug> slugAllocator,
                                                   UrlValidator urlValidator) {
        return new UrlShortenerService(eventStore, slugAllocator, urlValidator);
    }
}
