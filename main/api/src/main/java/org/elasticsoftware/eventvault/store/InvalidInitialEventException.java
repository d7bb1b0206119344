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

/**
 * Thrown when the first event of a history leaves the default aggregate with an empty identifier.
 */
public class InvalidInitialEventException extends EventStoreException {
    private final String eventName;

    public InvalidInitialEventException(String aggregateName, String eventName) {
        super(aggregateName, null, "invalid initial event " + eventName + " (aggregate id is empty after applying it)");
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
