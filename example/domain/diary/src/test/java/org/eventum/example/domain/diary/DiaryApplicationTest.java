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

package org.eventum.example.domain.diary;

import org.eventum.application.service.AggregateRepository;
import org.eventum.application.service.GenericApplicationService;
import org.eventum.event.Event;
import org.eventum.eventstore.api.TimeRange;
import org.eventum.eventstore.inmemory.InMemoryEventStore;
import org.eventum.retry.RetryStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class DiaryApplicationTest {

    private InMemoryEventStore eventStore;
    private List<String> publishedTopics;
    private GenericApplicationService<DiaryEntry> diaryService;
    private GenericApplicationService<UserProfile> userService;

    @BeforeEach
    void create_services() {
        eventStore = new InMemoryEventStore();
        publishedTopics = new CopyOnWriteArrayList<>();
        diaryService = new GenericApplicationService<>(new AggregateRepository<>(eventStore, DiaryEntry::new), RetryStrategy.none(), (topic, event) -> publishedTopics.add(topic), "metachat");
        userService = new GenericApplicationService<>(new AggregateRepository<>(eventStore, UserProfile::new), RetryStrategy.none(), (topic, event) -> publishedTopics.add(topic), "metachat");
    }

    @Test
    void diary_entries_and_users_share_one_event_store() {
        // Given
        String userId = UUID.randomUUID().toString();
        String entryId = UUID.randomUUID().toString();
        Instant before = Instant.now().minusSeconds(1);

        // When
        userService.execute(userId, user -> user.register("john", "john@example.com", "John", "Doe", ""));
        diaryService.execute(entryId, entry -> entry.createEntry(userId, "Monday", "It rained", 3, "session-1", List.of("weather")));
        diaryService.execute(entryId, entry -> entry.updateEntry("", "It stopped raining", 4, null));
        diaryService.execute(entryId, entry -> entry.deleteEntry("private"));

        // Then
        DiaryEntry entry = new AggregateRepository<>(eventStore, DiaryEntry::new).load(entryId);
        assertAll(
                () -> assertThat(entry.isDeleted()).isTrue(),
                () -> assertThat(entry.getContent()).isEqualTo("It stopped raining"),
                () -> assertThat(entry.getVersion()).isEqualTo(3),
                () -> assertThat(eventStore.loadByType("DiaryEntryUpdated")).extracting(Event::getAggregateId).containsExactly(entryId),
                () -> assertThat(eventStore.loadByTimeRange(new TimeRange(before, Instant.now().plusSeconds(1)))).hasSize(4),
                () -> assertThat(publishedTopics).containsExactly("metachat.UserRegistered", "metachat.DiaryEntryCreated", "metachat.DiaryEntryUpdated", "metachat.DiaryEntryDeleted")
        );
    }

    @Test
    void entry_can_be_read_as_it_was_before_it_was_deleted() {
        // Given
        String entryId = UUID.randomUUID().toString();
        diaryService.execute(entryId, entry -> entry.createEntry("user-1", "Monday", "It rained", 3, "session-1", List.of()));
        diaryService.execute(entryId, entry -> entry.deleteEntry("private"));

        // When
        DiaryEntry beforeDeletion = new AggregateRepository<>(eventStore, DiaryEntry::new).loadAsOf(entryId, 1);

        // Then
        assertAll(
                () -> assertThat(beforeDeletion.isDeleted()).isFalse(),
                () -> assertThat(beforeDeletion.getTitle()).isEqualTo("Monday")
        );
    }

    @Test
    void rejected_operation_doesnt_write_anything() {
        // Given
        String entryId = UUID.randomUUID().toString();

        // When
        Throwable throwable = catchThrowable(() -> diaryService.execute(entryId, entry -> entry.deleteEntry("never created")));

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(DiaryEntryDoesNotExist.class),
                () -> assertThat(eventStore.size()).isZero(),
                () -> assertThat(publishedTopics).isEmpty()
        );
    }

    @Test
    void entry_cannot_be_created_twice_in_one_command() {
        // Given
        String entryId = UUID.randomUUID().toString();

        // When
        Throwable throwable = catchThrowable(() -> diaryService.execute(entryId, entry -> {
            entry.createEntry("user-1", "First", "", 1, "session-1", List.of());
            entry.createEntry("user-1", "Second", "", 1, "session-1", List.of());
        }));

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class),
                () -> assertThat(eventStore.size()).isZero(),
                () -> assertThat(publishedTopics).isEmpty()
        );
    }

    @Test
    void entry_cannot_be_updated_after_being_deleted_in_the_same_command() {
        // Given
        String entryId = UUID.randomUUID().toString();
        diaryService.execute(entryId, entry -> entry.createEntry("user-1", "Monday", "It rained", 3, "session-1", List.of()));

        // When
        Throwable throwable = catchThrowable(() -> diaryService.execute(entryId, entry -> {
            entry.deleteEntry("gone");
            entry.updateEntry("After delete", "", 0, null);
        }));

        // Then
        DiaryEntry entry = new AggregateRepository<>(eventStore, DiaryEntry::new).load(entryId);
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class),
                () -> assertThat(eventStore.loadByAggregate(entryId)).extracting(Event::getType).containsExactly("DiaryEntryCreated"),
                () -> assertThat(entry.getTitle()).isEqualTo("Monday"),
                () -> assertThat(entry.isDeleted()).isFalse()
        );
    }

    @Test
    void user_cannot_register_twice_in_one_command() {
        // Given
        String userId = UUID.randomUUID().toString();

        // When
        Throwable throwable = catchThrowable(() -> userService.execute(userId, user -> {
            user.register("john", "john@example.com", "John", "Doe", "");
            user.register("jane", "jane@example.com", "Jane", "Doe", "");
        }));

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class),
                () -> assertThat(eventStore.loadByAggregate(userId)).isEmpty()
        );
    }
}
