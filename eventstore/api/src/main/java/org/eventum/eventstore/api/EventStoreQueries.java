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

package org.eventum.eventstore.api;

import org.eventum.event.Event;

import java.util.List;

/**
 * Queries across aggregates. These are intended for analytics and similar cross-cutting concerns, not for replay, and
 * the order of the returned events is whatever the backing store finds natural.
 */
public interface EventStoreQueries {

    /**
     * @return All events of the given {@code type}, regardless of aggregate
     */
    List<Event> loadByType(String type);

    /**
     * @return All events whose timestamp is within the closed {@code timeRange}
     */
    List<Event> loadByTimeRange(TimeRange timeRange);

    /**
     * Load events within a time range expressed as RFC 3339 date-time strings. The strings are parsed before the
     * backing store is contacted.
     *
     * @throws EventStoreException with kind {@link ErrorKind#SERIALIZATION_ERROR} if {@code start} or {@code end} is malformed
     * @see #loadByTimeRange(TimeRange)
     */
    default List<Event> loadByTimeRange(String start, String end) {
        return loadByTimeRange(TimeRange.parse(start, end));
    }
}
