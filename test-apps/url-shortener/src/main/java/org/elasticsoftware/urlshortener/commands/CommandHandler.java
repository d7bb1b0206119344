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
package org.elasticsoftware.urlshortener.commands;

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.eventvault.ids.AggregateIdentity;
import org.elasticsoftware.urlshortener.aggregates.stats.ShortLink;
import org.elasticsoftware.urlshortener.aggregates.stats.Slug;

public interface CommandHandler {
    /**
     * Registers a new short link.
     *
     * @param url  the target, must pass URL validation
     * @param slug the requested slug, or {@code null} (or empty) to have one allocated
     * @throws org.elasticsoftware.urlshortener.errors.InvalidUrlException when {@code url} is not a valid URL
     * @throws org.elasticsoftware.urlshortener.errors.SlugAlreadyInUseException when {@code slug} is taken
     */
    @NotNull ShortLink handleCreateShortLink(@NotNull String url, Slug slug);

    /**
     * Counts one redirect through the link.
     *
     * @throws org.elasticsoftware.urlshortener.errors.SlugNotFoundException when no link has this slug
     */
    @NotNull ShortLink handleRedirect(@NotNull AggregateIdentity<Slug> slug);
}
