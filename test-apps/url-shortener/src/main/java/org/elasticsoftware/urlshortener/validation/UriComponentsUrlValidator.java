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
package org.elasticsoftware.urlshortener.validation;

import com.google.common.base.CharMatcher;
import com.google.common.net.InetAddresses;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Locale;

/**
 * Lenient URL check. Characters that would have to be percent encoded (spaces, {@code |} or {@code {}} in the
 * path or query) are accepted, as are underscores and non ASCII letters in host names.
 * <p>
 * The URL needs a scheme. Web URLs ({@code http} and {@code https}) also need a host without forbidden host
 * characters, a numeric port, and a well formed address when the host is a bracketed IPv6 literal.
 */
public class UriComponentsUrlValidator implements UrlValidator {
    private static final CharMatcher SCHEME_START = CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z'));
    private static final CharMatcher SCHEME_PART = SCHEME_START
            .or(CharMatcher.inRange('0', '9'))
            .or(CharMatcher.anyOf("+-."));
    private static final CharMatcher FORBIDDEN_HOST = CharMatcher.anyOf(" #%/:<>?@[\\]^|")
            .or(CharMatcher.whitespace())
            .or(CharMatcher.javaIsoControl());

    @Override
    public boolean isValid(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        UriComponents components;
        int port;
        try {
            components = UriComponentsBuilder.fromUriString(url.strip()).build();
            port = components.getPort();
        } catch (IllegalArgumentException | IllegalStateException e) {
            return false;
        }
        String scheme = components.getScheme();
        if (scheme == null || scheme.isEmpty()
                || !SCHEME_START.matches(scheme.charAt(0)) || !SCHEME_PART.matchesAllOf(scheme)) {
            return false;
        }
        String normalizedScheme = scheme.toLowerCase(Locale.ROOT);
        if (normalizedScheme.equals("http") || normalizedScheme.equals("https")) {
            return isValidHost(components.getHost()) && port <= 0xFFFF;
        }
        return true;
    }

    private static boolean isValidHost(String host) {
        if (host == null || host.isEmpty()) {
            return false;
        }
        if (host.startsWith("[")) {
            return host.length() > 2 && host.endsWith("]")
                    && host.indexOf(':') >= 0
                    && InetAddresses.isInetAddress(host.substring(1, host.length() - 1));
        }
        return FORBIDDEN_HOST.matchesNoneOf(host);
    }
}
