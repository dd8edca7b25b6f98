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

import org.eventum.time.internal.RFC3339;

import java.time.Instant;
import java.time.format.DateTimeParseException;

import static java.util.Objects.requireNonNull;

/**
 * A closed range of event creation times, i.e. both {@code start} and {@code end} are inclusive.
 */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        requireNonNull(start, "Start cannot be null");
        requireNonNull(end, "End cannot be null");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Start (" + start + ") cannot be after end (" + end + ")");
        }
    }

    public static TimeRange between(Instant start, Instant end) {
        return new TimeRange(start, end);
    }

    /**
     * Create a time range from two RFC 3339 date-time strings, e.g. {@code 2024-01-15T10:30:00Z}.
     *
     * @throws EventStoreException with kind {@link ErrorKind#SERIALIZATION_ERROR} if either string is malformed
     *                             or if {@code start} is after {@code end}
     */
    public static TimeRange parse(String start, String end) {
        requireNonNull(start, "Start cannot be null");
        requireNonNull(end, "End cannot be null");
        try {
            return new TimeRange(RFC3339.parse(start), RFC3339.parse(end));
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new EventStoreException(ErrorKind.SERIALIZATION_ERROR, "loadByTimeRange", null,
                    "Invalid time range [" + start + ", " + end + "]: " + e.getMessage(), e);
        }
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }
}
