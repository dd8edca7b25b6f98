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

package org.eventum.time.internal;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;

import static java.time.format.DateTimeFormatter.ISO_LOCAL_DATE_TIME;
import static java.time.temporal.ChronoUnit.MILLIS;
import static java.util.Objects.requireNonNull;

/**
 * Utilities for RFC3339 date/time conversions.
 */
public class RFC3339 {

    public static final DateTimeFormatter RFC_3339_DATE_TIME_FORMATTER = new DateTimeFormatterBuilder()
            .append(ISO_LOCAL_DATE_TIME)
            .optionalStart()
            .appendOffset("+HH:MM", "Z")
            .optionalEnd()
            .toFormatter();

    private RFC3339() {
    }

    /**
     * Parse an RFC 3339 string, such as {@code 2024-01-15T10:30:00.123+01:00}, into an {@link Instant}.
     * An offset is required.
     *
     * @throws DateTimeParseException If {@code dateTime} is not a valid RFC 3339 date-time with an offset
     */
    public static Instant parse(String dateTime) {
        requireNonNull(dateTime, "Date time cannot be null");
        return OffsetDateTime.parse(dateTime.trim(), RFC_3339_DATE_TIME_FORMATTER).toInstant();
    }

    /**
     * Format an instant as an RFC 3339 string in UTC with millisecond precision, e.g. {@code 2024-01-15T09:30:00.123Z}.
     */
    public static String format(Instant instant) {
        requireNonNull(instant, Instant.class.getSimpleName() + " cannot be null");
        return RFC_3339_DATE_TIME_FORMATTER.format(instant.truncatedTo(MILLIS).atOffset(ZoneOffset.UTC));
    }
}
