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

package org.eventum.event;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(ReplaceUnderscores.class)
class EventTest {

    @Test
    void create_assigns_a_unique_id_and_a_millisecond_precision_timestamp() {
        // When
        Event event1 = Event.create("EntryCreated", "aggregate", 1, "{}".getBytes(UTF_8));
        Event event2 = Event.create("EntryCreated", "aggregate", 1, "{}".getBytes(UTF_8));

        // Then
        assertThat(event1.getId()).isNotEqualTo(event2.getId());
        assertThat(event1.getTimestamp().getNano() % 1_000_000).isZero();
        assertThat(event1.getMetadata()).isEmpty();
    }

    @Test
    void version_must_be_strictly_positive() {
        // When
        Throwable throwable = catchThrowable(() -> Event.create("EntryCreated", "aggregate", 0, new byte[0]));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessageContaining("version");
    }

    @Test
    void aggregate_id_cannot_be_blank() {
        // When
        Throwable throwable = catchThrowable(() -> Event.create("EntryCreated", " ", 1, new byte[0]));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void payload_cannot_be_modified_from_the_outside() {
        // Given
        byte[] payload = "abc".getBytes(UTF_8);
        Event event = Event.create("EntryCreated", "aggregate", 1, payload);

        // When
        payload[0] = 'x';
        event.getPayload()[1] = 'y';

        // Then
        assertThat(event.getPayload()).isEqualTo("abc".getBytes(UTF_8));
    }

    @Test
    void equality_ignores_metadata_key_order() {
        // Given
        Map<String, MetadataValue> metadata1 = new LinkedHashMap<>();
        metadata1.put("a", MetadataValue.of("1"));
        metadata1.put("b", MetadataValue.of(true));
        Map<String, MetadataValue> metadata2 = new LinkedHashMap<>();
        metadata2.put("b", MetadataValue.of(true));
        metadata2.put("a", MetadataValue.of("1"));
        Instant now = Instant.now();

        // When
        Event event1 = new Event("id", "EntryCreated", "aggregate", 1, now, "{}".getBytes(UTF_8), metadata1);
        Event event2 = new Event("id", "EntryCreated", "aggregate", 1, now, "{}".getBytes(UTF_8), metadata2);

        // Then
        assertThat(event1).isEqualTo(event2).hasSameHashCodeAs(event2);
    }

    @Test
    void event_metadata_defaults_causation_id_to_correlation_id() {
        // When
        Map<String, MetadataValue> metadata = EventMetadata.correlatedBy("correlation").toMap();

        // Then
        assertThat(metadata).containsEntry(EventMetadata.CORRELATION_ID, MetadataValue.of("correlation"))
                .containsEntry(EventMetadata.CAUSATION_ID, MetadataValue.of("correlation"))
                .doesNotContainKey(EventMetadata.USER_ID);
    }
}
