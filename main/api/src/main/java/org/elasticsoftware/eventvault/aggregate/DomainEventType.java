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
import org.elasticsoftware.eventvault.annotations.DomainEventInfo;
import org.elasticsoftware.eventvault.events.DomainEvent;

public record DomainEventType<T extends DomainEvent>(String typeName, int version, @JsonIgnore Class<T> typeClass) {

    public static <T extends DomainEvent> DomainEventType<T> of(Class<T> eventClass) {
        DomainEventInfo info = findInfo(eventClass);
        if (info != null) {
            return new DomainEventType<>(info.type(), info.version(), eventClass);
        }
        return new DomainEventType<>(eventClass.getSimpleName(), 1, eventClass);
    }

    public static String typeNameOf(Class<?> eventClass) {
        DomainEventInfo info = findInfo(eventClass);
        return info != null ? info.type() : eventClass.getSimpleName();
    }

    private static DomainEventInfo findInfo(Class<?> type) {
        if (type == null) {
            return null;
        }
        DomainEventInfo info = type.getAnnotation(DomainEventInfo.class);
        if (info != null) {
            return info;
        }
        // the family annotation usually sits on a (sealed) parent interface
        for (Class<?> parent : type.getInterfaces()) {
            info = findInfo(parent);
            if (info != null) {
                return info;
            }
        }
        return findInfo(type.getSuperclass());
    }
}
