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

package org.eventum.testsupport;

import org.eventum.event.Event;
import org.eventum.event.EventMetadata;
import org.eventum.event.MetadataValue;
import org.eventum.eventstore.api.ErrorKind;
import org.eventum.eventstore.api.EventStore;
import org.eventum.eventstore.api.EventStoreException;
import org.eventum.eventstore.api.TimeRange;
import org.eventum.eventstore.api.VersionConflictException;
import org.eventum.eventstore.api.WriteResult;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.time.temporal.ChronoUnit.MINUTES;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.eventum.testsupport.EventFixtures.event;
import static org.eventum.testsupport.EventFixtures.events;
import static org.eventum.testsupport.EventFixtures.newAggregateId;
import static org.eventum.testsupport.EventFixtures.uniqueType;

/**
 * The behavior every {@link EventStore} implementation must have. Extend this class and return the store under test
 * from {@link #eventStore()}.
 * <p>
 * Tests never assume an empty store, every test uses its own aggregate ids and event types.
 */
@DisplayNameGeneration(ReplaceUnderscores.class)
public abstract class EventStoreContract {

    protected abstract EventStore eventStore();

    @Nested
    class Save {

        @Test
        void saved_events_are_loaded_in_version_order() {
            // Given
            String aggregateId = newAggregateId();
            List<Event> events = events(aggregateId, 1, 3);

            // When
            WriteResult writeResult = eventStore().save(events);

            // Then
            assertThat(writeResult).isEqualTo(new WriteResult(aggregateId, 3));
            assertThat(eventStore().loadByAggregate(aggregateId)).containsExactlyElementsOf(events);
        }

        @Test
        void successive_saves_extend_the_history_without_gaps() {
            // Given
            String aggregateId = newAggregateId();

            // When
            eventStore().save(events(aggregateId, 1, 2));
            eventStore().save(events(aggregateId, 3, 1));
            WriteResult writeResult = eventStore().save(events(aggregateId, 4, 3));

            // Then
            assertThat(writeResult.getVersion()).isEqualTo(6);
            assertThat(eventStore().loadByAggregate(aggregateId)).extracting(Event::getVersion).containsExactly(1L, 2L, 3L, 4L, 5L, 6L);
        }

        @Test
        void payload_and_metadata_are_persisted_exactly() {
            // Given
            String aggregateId = newAggregateId();
            byte[] payload = "{\"title\":\"Dear diary\",\"mood\":7,\"emoji\":\"☺\"}".getBytes(UTF_8);
            Map<String, MetadataValue> nested = new LinkedHashMap<>();
            nested.put("device", MetadataValue.of("ios"));
            nested.put("battery", MetadataValue.of(new BigDecimal("0.5")));
            Map<String, MetadataValue> metadata = EventMetadata.correlatedBy("correlation")
                    .causedBy("causation")
                    .userId("user")
                    .with("retries", MetadataValue.of(2))
                    .with("imported", MetadataValue.of(false))
                    .with("client", MetadataValue.of(nested))
                    .toMap();
            Event event = event(aggregateId, 1, "EntryCreated", payload, metadata);

            // When
            eventStore().save(List.of(event));

            // Then
            List<Event> loaded = eventStore().loadByAggregate(aggregateId);
            assertThat(loaded).containsExactly(event);
            assertThat(loaded.get(0).getPayload()).isEqualTo(payload);
            assertThat(loaded.get(0).getMetadata()).isEqualTo(metadata);
        }

        @Test
        void a_concurrent_writer_saving_the_same_version_gets_a_version_conflict() {
            // Given
            String aggregateId = newAggregateId();
            Event created = event(aggregateId, 1, "Created");
            Event updated = event(aggregateId, 2, "Updated");
            eventStore().save(List.of(created));
            eventStore().save(List.of(updated));

            // When
            Throwable throwable = catchThrowable(() -> eventStore().save(List.of(event(aggregateId, 2, "Updated"))));

            // Then
            assertThat(throwable).isInstanceOf(VersionConflictException.class);
            assertThat(((EventStoreException) throwable).kind).isEqualTo(ErrorKind.VERSION_CONFLICT);
            assertThat(((EventStoreException) throwable).aggregateId).isEqualTo(aggregateId);
            assertThat(eventStore().loadByAggregate(aggregateId)).containsExactly(created, updated);
        }

        @Test
        void a_new_aggregate_whose_first_version_is_not_one_gets_a_version_conflict() {
            // Given
            String aggregateId = newAggregateId();

            // When
            Throwable throwable = catchThrowable(() -> eventStore().save(events(aggregateId, 2, 3)));

            // Then
            assertThat(throwable).isInstanceOf(VersionConflictException.class);
            assertThat(eventStore().loadByAggregate(aggregateId)).isEmpty();
        }

        @Test
        void a_group_that_skips_versions_ahead_of_the_history_gets_a_version_conflict() {
            // Given
            String aggregateId = newAggregateId();
            List<Event> persisted = events(aggregateId, 1, 2);
            eventStore().save(persisted);

            // When
            Throwable throwable = catchThrowable(() -> eventStore().save(events(aggregateId, 4, 1)));

            // Then
            assertThat(throwable).isInstanceOf(VersionConflictException.class);
            assertThat(eventStore().loadByAggregate(aggregateId)).containsExactlyElementsOf(persisted);
        }

        @Test
        void a_group_with_a_gap_is_rejected_as_a_whole() {
            // Given
            String aggregateId = newAggregateId();
            List<Event> group = List.of(event(aggregateId, 1), event(aggregateId, 2), event(aggregateId, 4));

            // When
            Throwable throwable = catchThrowable(() -> eventStore().save(group));

            // Then
            assertThat(throwable).isInstanceOf(VersionConflictException.class);
            assertThat(eventStore().loadByAggregate(aggregateId)).isEmpty();
        }

        @Test
        void a_group_mixing_aggregates_is_rejected_as_serialization_error() {
            // Given
            String aggregateId1 = newAggregateId();
            String aggregateId2 = newAggregateId();

            // When
            Throwable throwable = catchThrowable(() -> eventStore().save(List.of(event(aggregateId1, 1), event(aggregateId2, 2))));

            // Then
            assertThat(EventStoreException.isKind(throwable, ErrorKind.SERIALIZATION_ERROR)).isTrue();
            assertThat(eventStore().loadByAggregate(aggregateId1)).isEmpty();
            assertThat(eventStore().loadByAggregate(aggregateId2)).isEmpty();
        }

        @Test
        void an_empty_group_is_rejected_as_serialization_error() {
            // When
            Throwable throwable = catchThrowable(() -> eventStore().save(Collections.emptyList()));

            // Then
            assertThat(EventStoreException.isKind(throwable, ErrorKind.SERIALIZATION_ERROR)).isTrue();
        }
    }

    @Nested
    class LoadByAggregate {

        @Test
        void returns_an_empty_list_when_the_aggregate_has_no_history() {
            assertThat(eventStore().loadByAggregate(newAggregateId())).isEmpty();
        }

        @Test
        void only_returns_events_of_the_requested_aggregate() {
            // Given
            String aggregateId1 = newAggregateId();
            String aggregateId2 = newAggregateId();
            List<Event> events1 = events(aggregateId1, 1, 2);
            eventStore().save(events1);
            eventStore().save(events(aggregateId2, 1, 3));

            // When
            List<Event> loaded = eventStore().loadByAggregate(aggregateId1);

            // Then
            assertThat(loaded).containsExactlyElementsOf(events1);
        }

        @Test
        void returns_a_prefix_of_the_history_when_loading_up_to_a_version() {
            // Given
            String aggregateId = newAggregateId();
            List<Event> events = events(aggregateId, 1, 5);
            eventStore().save(events);

            // When
            List<Event> upToThree = eventStore().loadByAggregateUpToVersion(aggregateId, 3);

            // Then
            assertThat(upToThree).containsExactlyElementsOf(events.subList(0, 3));
            assertThat(eventStore().loadByAggregate(aggregateId)).startsWith(upToThree.toArray(new Event[0]));
        }

        @Test
        void loading_up_to_a_version_beyond_the_history_returns_all_events() {
            // Given
            String aggregateId = newAggregateId();
            List<Event> events = events(aggregateId, 1, 2);
            eventStore().save(events);

            // Then
            assertThat(eventStore().loadByAggregateUpToVersion(aggregateId, 10)).containsExactlyElementsOf(events);
        }

        @Test
        void loading_up_to_version_zero_returns_no_events() {
            // Given
            String aggregateId = newAggregateId();
            eventStore().save(events(aggregateId, 1, 2));

            // Then
            assertThat(eventStore().loadByAggregateUpToVersion(aggregateId, 0)).isEmpty();
        }
    }

    @Nested
    class Queries {

        @Test
        void load_by_type_returns_the_events_of_every_aggregate_with_that_type() {
            // Given
            String type = uniqueType("Noted");
            String aggregateIdB = newAggregateId();
            String aggregateIdC = newAggregateId();
            Event eventB = event(aggregateIdB, 1, type);
            Event eventC = event(aggregateIdC, 1, type);
            eventStore().save(List.of(eventB));
            eventStore().save(List.of(eventC));
            eventStore().save(List.of(event(aggregateIdB, 2, uniqueType("Other"))));

            // When
            List<Event> loaded = eventStore().loadByType(type);

            // Then
            assertThat(loaded).containsExactlyInAnyOrder(eventB, eventC);
        }

        @Test
        void load_by_type_returns_an_empty_list_when_no_event_has_that_type() {
            assertThat(eventStore().loadByType(uniqueType("Unknown"))).isEmpty();
        }

        @Test
        void load_by_time_range_only_returns_events_created_within_the_range() {
            // Given
            String type = uniqueType("Noted");
            Instant timeOfB = randomInstantInThePast();
            Event eventB = event(newAggregateId(), 1, type, timeOfB);
            Event eventC = event(newAggregateId(), 1, type, timeOfB.plus(5, MINUTES));
            eventStore().save(List.of(eventB));
            eventStore().save(List.of(eventC));

            // When
            List<Event> loaded = eventStore().loadByTimeRange(TimeRange.between(timeOfB.minusMillis(1), timeOfB.plusMillis(1)));

            // Then
            assertThat(loaded).containsExactly(eventB);
        }

        @Test
        void load_by_time_range_includes_both_ends() {
            // Given
            String type = uniqueType("Noted");
            Instant start = randomInstantInThePast();
            Instant end = start.plus(1, MINUTES);
            String aggregateId = newAggregateId();
            Event first = event(aggregateId, 1, type, start);
            Event last = event(aggregateId, 2, type, end);
            eventStore().save(List.of(first, last));

            // When
            List<Event> loaded = eventStore().loadByTimeRange(TimeRange.between(start, end));

            // Then
            assertThat(loaded).containsExactlyInAnyOrder(first, last);
        }

        @Test
        void load_by_time_range_accepts_rfc3339_strings() {
            // Given
            Instant timestamp = randomInstantInThePast();
            Event event = event(newAggregateId(), 1, uniqueType("Noted"), timestamp);
            eventStore().save(List.of(event));

            // When
            List<Event> loaded = eventStore().loadByTimeRange(timestamp.toString(), timestamp.toString());

            // Then
            assertThat(loaded).containsExactly(event);
        }

        @Test
        void load_by_time_range_rejects_malformed_date_times_as_serialization_error() {
            // When
            Throwable throwable = catchThrowable(() -> eventStore().loadByTimeRange("2024-01-15 10:00", "2024-01-16T10:00:00Z"));

            // Then
            assertThat(EventStoreException.isKind(throwable, ErrorKind.SERIALIZATION_ERROR)).isTrue();
        }
    }

    @Test
    void persisted_versions_of_an_aggregate_are_always_one_to_n() {
        // Given
        String aggregateId = newAggregateId();
        List<Long> expected = new ArrayList<>();
        long version = 1;

        // When
        for (int batch = 1; batch <= 4; batch++) {
            eventStore().save(events(aggregateId, version, batch));
            catchThrowable(() -> eventStore().save(events(aggregateId, 1, 1)));
            for (int i = 0; i < batch; i++) {
                expected.add(version++);
            }
        }

        // Then
        assertThat(eventStore().loadByAggregate(aggregateId)).extracting(Event::getVersion).containsExactlyElementsOf(expected);
    }

    /**
     * An instant at a random minute within a year in the past, so that time range queries don't pick up events from other tests.
     */
    private static Instant randomInstantInThePast() {
        long minutes = ThreadLocalRandom.current().nextLong(0, 365L * 24 * 60);
        return Instant.parse("2001-01-01T00:00:00Z").plus(minutes, MINUTES).plusMillis(ThreadLocalRandom.current().nextInt(0, 60_000));
    }
}
