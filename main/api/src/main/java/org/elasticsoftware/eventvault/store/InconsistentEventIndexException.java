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
package org.elasticsoftware.eventvault.store;

public class InconsistentEventIndexException extends EventStoreException {
    private final long expectedIndex;
    private final long actualIndex;

    public InconsistentEventIndexException(String aggregateName, String aggregateId, long expectedIndex, long actualIndex) {
        super(aggregateName, aggregateId, "inconsistent event index number: expected " + expectedIndex + " but was " + actualIndex);
        this.expectedIndex = expectedIndex;
        this.actualIndex = actualIndex;
    }

    public long getExpectedIndex() {
        return expectedIndex;
    }

    public long getActualIndex() {
        return actualIndex;
    }
}
