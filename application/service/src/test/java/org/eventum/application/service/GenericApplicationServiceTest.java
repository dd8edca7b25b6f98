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

package org.eventum.application.service;

import org.eventum.aggregate.DomainRuleViolationException;
import org.eventum.event.Event;
import org.eventum.eventstore.api.VersionConflictException;
import org.eventum.eventstore.api.WriteResult;
import org.eventum.eventstore.inmemory.InMemoryEventStore;
import org.eventum.retry.RetryStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class GenericApplicationServiceTest {

    private InMemoryEventStore eventStore;
    private AggregateRepository<Visits> repository;
    private String aggregateId;

    @BeforeEach
    void create_repository() {
        eventStore = new InMemoryEventStore();
        repository = new AggregateRepository<>(eventStore, Visits::new);
        aggregateId = UUID.randomUUID().toString();
    }

    @Test
    void command_is_executed_against_an_empty_aggregate_the_first_time() {
        // Given
        GenericApplicationService<Visits> applicationService = new GenericApplicationService<>(repository);

        // When
        WriteResult writeResult = applicationService.execute(aggregateId, Visits::open);

        // Then
        assertAll(
                () -> assertThat(writeResult).isEqualTo(new WriteResult(aggregateId, 1)),
                () -> assertThat(repository.load(aggregateId).isOpen()).isTrue()
        );
    }

    @Test
    void committed_events_are_published_to_a_topic_per_event_type() {
        // Given
        List<String> topics = new CopyOnWriteArrayList<>();
        List<Event> published = new CopyOnWriteArrayList<>();
        GenericApplicationService<Visits> applicationService = new GenericApplicationService<>(repository, RetryStrategy.none(), (topic, event) -> {
            topics.add(topic);
            published.add(event);
        }, "diary");

        // When
        applicationService.execute(aggregateId, visits -> visits.open());
        applicationService.execute(aggregateId, visits -> visits.visit("john"));

        // Then
        assertAll(
                () -> assertThat(topics).containsExactly("diary.VisitsOpened", "diary.Visited"),
                () -> assertThat(published).containsExactlyElementsOf(eventStore.loadByAggregate(aggregateId))
        );
    }

    @Test
    void failing_publisher_doesnt_undo_the_write() {
        // Given
        GenericApplicationService<Visits> applicationService = new GenericApplicationService<>(repository, RetryStrategy.none(), (topic, event) -> {
            throw new IllegalStateException("bus is down");
        }, "diary");

        // When
        Throwable throwable = catchThrowable(() -> applicationService.execute(aggregateId, Visits::open));

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class),
                () -> assertThat(eventStore.loadByAggregate(aggregateId)).hasSize(1)
        );
    }

    @Test
    void blank_topic_prefix_is_rejected_when_publishing() {
        Throwable throwable = catchThrowable(() -> new GenericApplicationService<>(repository, RetryStrategy.none(), (topic, event) -> {
        }, " "));

        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    class Retries {

        @Test
        void command_is_run_again_against_fresh_state_after_a_version_conflict() {
            // Given
            repository.save(opened(aggregateId));
            AtomicInteger invocations = new AtomicInteger();
            GenericApplicationService<Visits> applicationService = new GenericApplicationService<>(repository, conflictRetries(3));

            // When
            WriteResult writeResult = applicationService.execute(aggregateId, visits -> {
                if (invocations.incrementAndGet() == 1) {
                    concurrentVisit(aggregateId, "jane");
                }
                visits.visit("john");
            });

            // Then
            Visits visits = repository.load(aggregateId);
            assertAll(
                    () -> assertThat(invocations).hasValue(2),
                    () -> assertThat(writeResult.getVersion()).isEqualTo(3),
                    () -> assertThat(visits.count()).isEqualTo(2)
            );
        }

        @Test
        void version_conflict_is_rethrown_when_attempts_are_exhausted() {
            // Given
            repository.save(opened(aggregateId));
            AtomicInteger invocations = new AtomicInteger();
            GenericApplicationService<Visits> applicationService = new GenericApplicationService<>(repository, conflictRetries(3));

            // When
            Throwable throwable = catchThrowable(() -> applicationService.execute(aggregateId, visits -> {
                invocations.incrementAndGet();
                concurrentVisit(aggregateId, "jane");
                visits.visit("john");
            }));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(VersionConflictException.class),
                    () -> assertThat(invocations).hasValue(3),
                    () -> assertThat(repository.load(aggregateId).count()).isEqualTo(3)
            );
        }

        @Test
        void domain_rule_violations_are_not_retried() {
            // Given
            AtomicInteger invocations = new AtomicInteger();
            GenericApplicationService<Visits> applicationService = new GenericApplicationService<>(repository, conflictRetries(3));

            // When
            Throwable throwable = catchThrowable(() -> applicationService.execute(aggregateId, visits -> {
                invocations.incrementAndGet();
                visits.visit("john");
            }));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(DomainRuleViolationException.class),
                    () -> assertThat(invocations).hasValue(1),
                    () -> assertThat(eventStore.loadByAggregate(aggregateId)).isEmpty()
            );
        }

        private RetryStrategy conflictRetries(int maxAttempts) {
            return RetryStrategy.retry().maxAttempts(maxAttempts).retryIf(VersionConflictException::isInstance);
        }
    }

    private Visits opened(String aggregateId) {
        Visits visits = new Visits(aggregateId);
        visits.open();
        return visits;
    }

    private void concurrentVisit(String aggregateId, String visitor) {
        Visits visits = repository.load(aggregateId);
        visits.visit(visitor);
        repository.save(visits);
    }
}
