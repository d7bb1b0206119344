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

import com.google.common.io.BaseEncoding;
import com.google.common.primitives.Ints;

/**
 * Text form of generated identifiers: 32 bits of entropy followed by the 16 bit bump counter, both big endian,
 * in URL safe base64. Six bytes encode to exactly eight characters, so there is never any padding.
 */
public final class IdTokens {
    public static final int TOKEN_LENGTH = 8;
    private static final BaseEncoding ENCODING = BaseEncoding.base64Url().omitPadding();

    private IdTokens() {
    }

    public static String encode(int entropy, int bump) {
        if (bump < 0 || bump > AggregateIdGenerator.MAX_BUMP) {
            throw new IllegalArgumentException("bump out of range: " + bump);
        }
        byte[] bytes = new byte[6];
        System.arraycopy(Ints.toByteArray(entropy), 0, bytes, 0, 4);
        bytes[4] = (byte) (bump >>> 8);
        bytes[5] = (byte) bump;
        return ENCODING.encode(bytes);
    }
}
