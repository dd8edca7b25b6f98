/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventum.eventstore.api.internal;

import org.eventum.event.Event;
import org.eventum.eventstore.api.ErrorKind;
import org.eventum.eventstore.api.EventStoreException;
import org.eventum.eventstore.api.VersionConflictException;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Validates the events passed to {@code save} before any backing store is contacted. Shared by the event store implementations, don't use it directly.
 */
public class EventGroupValidator {
    private static final String SAVE = "save";

    private EventGroupValidator() {
    }

    /**
     * Validate that {@code events} is a non-empty group of events of a single aggregate with contiguous versions.
     *
     * @return The aggregate id shared by all events
     */
    public static String validate(List<Event> events) {
        requireNonNull(events, "Events cannot be null");
        if (events.isEmpty()) {
            throw new EventStoreException(ErrorKind.SERIALIZATION_ERROR, SAVE, null, "Cannot save an empty list of events");
        }
        Event first = requireNonNull(events.get(0), "Event cannot be null");
        String aggregateId = first.getAggregateId();
        long expectedVersion = first.getVersion();
        for (Event event : events) {
            requireNonNull(event, "Event cannot be null");
            if (!aggregateId.equals(event.getAggregateId())) {
                throw new EventStoreException(ErrorKind.SERIALIZATION_ERROR, SAVE, aggregateId,
                        "All events must belong to the same aggregate but found both " + aggregateId + " and " + event.getAggregateId());
            }
            if (event.getVersion() != expectedVersion) {
                throw new VersionConflictException(SAVE, aggregateId, expectedVersion, event.getVersion());
            }
            expectedVersion++;
        }
        return aggregateId;
    }

    /**
     * Verify that the first event of the group immediately follows {@code currentVersion}, the highest persisted
     * version of the aggregate ({@code 0} if none).
     */
    public static void verifyFollows(List<Event> events, long currentVersion) {
        Event first = events.get(0);
        if (first.getVersion() != currentVersion + 1) {
            throw new VersionConflictException(SAVE, first.getAggregateId(), currentVersion + 1, first.getVersion());
        }
    }

    /**
     * @return The version of the last event in the group
     */
    public static long lastVersion(List<Event> events) {
        return events.get(events.size() - 1).getVersion();
    }
}
