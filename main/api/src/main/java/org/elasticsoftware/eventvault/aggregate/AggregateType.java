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

package org.elasticsoftware.eventvault.aggregate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.elasticsoftware.eventvault.annotations.AggregateInfo;

import java.util.function.Supplier;

public record AggregateType<A extends Aggregate<A, ?, ?>>(String typeName,
                                                          int version,
                                                          @JsonIgnore Class<A> typeClass,
                                                          @JsonIgnore Supplier<A> defaultState) {

    public static <A extends Aggregate<A, ?, ?>> AggregateType<A> of(Class<A> aggregateClass, Supplier<A> defaultState) {
        AggregateInfo info = aggregateClass.getAnnotation(AggregateInfo.class);
        if (info != null) {
            return new AggregateType<>(info.value(), info.version(), aggregateClass, defaultState);
        }
        return new AggregateType<>(aggregateClass.getSimpleName(), 1, aggregateClass, defaultState);
    }

    /**
     * @return the state before any event has been applied
     */
    public A newInstance() {
        return defaultState.get();
    }
}
