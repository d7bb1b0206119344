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

public class InconsistentAggregateIdException extends EventStoreException {
    private final String actualAggregateId;
    private final long index;

    public InconsistentAggregateIdException(String aggregateName, String aggregateId, String actualAggregateId, long index) {
        super(aggregateName, aggregateId, "inconsistent event aggregate id at index " + index + ": expected '"
                + aggregateId + "' but was '" + actualAggregateId + "'");
        this.actualAggregateId = actualAggregateId;
        this.index = index;
    }

    public String getActualAggregateId() {
        return actualAggregateId;
    }

    public long getIndex() {
        return index;
    }
}
