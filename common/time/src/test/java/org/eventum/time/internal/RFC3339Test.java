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

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.stream.Stream;

import static java.time.ZoneOffset.UTC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(ReplaceUnderscores.class)
class RFC3339Test {

    @ParameterizedTest
    @MethodSource("rfc3339Data")
    void parses_rfc3339_date_times_with_offset_into_instants(String dateTimeString, OffsetDateTime expected) {
        // When
        Instant actual = RFC3339.parse(dateTimeString);

        // Then
        assertThat(actual).isEqualTo(expected.toInstant());
    }

    @ParameterizedTest
    @ValueSource(strings = {"2024-13-01T00:00:00Z", "2024-01-15", "not a date", "2024-01-15T10:30:00", ""})
    void rejects_malformed_date_times(String dateTimeString) {
        // When
        Throwable throwable = catchThrowable(() -> RFC3339.parse(dateTimeString));

        // Then
        assertThat(throwable).isInstanceOf(DateTimeParseException.class);
    }

    @Test
    void formats_instants_in_utc_with_millisecond_precision() {
        // Given
        Instant instant = OffsetDateTime.of(LocalDateTime.of(2024, 1, 15, 10, 30, 0, 123_456_789), ZoneOffset.of("+01:00")).toInstant();

        // When
        String formatted = RFC3339.format(instant);

        // Then
        assertThat(formatted).isEqualTo("2024-01-15T09:30:00.123Z");
        assertThat(RFC3339.parse(formatted)).isEqualTo(Instant.parse("2024-01-15T09:30:00.123Z"));
    }

    private static Stream<Arguments> rfc3339Data() {
        return Stream.of(
                Arguments.of("2007-05-01T15:43:26+07:00", OffsetDateTime.of(LocalDateTime.of(2007, 5, 1, 15, 43, 26), ZoneOffset.of("+07:00"))),
                Arguments.of("2007-05-01T15:43:26.3452+07:00", OffsetDateTime.of(LocalDateTime.of(2007, 5, 1, 15, 43, 26, 345_200_000), ZoneOffset.of("+07:00"))),
                Arguments.of("2007-05-01T15:43:26.3-07:00", OffsetDateTime.of(LocalDateTime.of(2007, 5, 1, 15, 43, 26, 300_000_000), ZoneOffset.of("-07:00"))),
                Arguments.of("2007-05-01T15:43:26.3Z", OffsetDateTime.of(LocalDateTime.of(2007, 5, 1, 15, 43, 26, 300_000_000), UTC)),
                Arguments.of("2007-05-01T15:43:26Z", OffsetDateTime.of(LocalDateTime.of(2007, 5, 1, 15, 43, 26), UTC))
        );
    }
}
