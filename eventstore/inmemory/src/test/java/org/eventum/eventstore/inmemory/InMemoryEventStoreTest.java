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

package org.eventum.eventstore.inmemory;

import org.eventum.event.Event;
import org.eventum.eventstore.api.EventStore;
import org.eventum.eventstore.api.VersionConflictException;
import org.eventum.testsupport.EventStoreContract;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.eventum.testsupport.EventFixtures.event;
import static org.eventum.testsupport.EventFixtures.events;
import static org.eventum.testsupport.EventFixtures.newAggregateId;

@DisplayNameGeneration(ReplaceUnderscores.class)
class InMemoryEventStoreTest extends EventStoreContract {

    private CopyOnWriteArrayList<List<Event>> committed;
    private InMemoryEventStore inMemoryEventStore;

    @BeforeEach
    void create_event_store() {
        committed = new CopyOnWriteArrayList<>();
        inMemoryEventStore = new InMemoryEventStore(committed::add);
    }

    @Override
    protected EventStore eventStore() {
        return inMemoryEventStore;
    }

    @Nested
    class Listener {

        @Test
        void is_invoked_with_each_saved_group() {
            // Given
            String aggregateId = newAggregateId();
            List<Event> group1 = events(aggregateId, 1, 2);
            List<Event> group2 = events(aggregateId, 3, 1);

            // When
            inMemoryEventStore.save(group1);
            inMemoryEventStore.save(group2);

            // Then
            assertThat(committed).containsExactly(group1, group2);
        }

        @Test
        void is_not_invoked_when_the_save_is_rejected() {
            // Given
            String aggregateId = newAggregateId();

            // When
            Throwable throwable = catchThrowable(() -> inMemoryEventStore.save(events(aggregateId, 2, 1)));

            // Then
            assertThat(throwable).isExactlyInstanceOf(VersionConflictException.class);
            assertThat(committed).isEmpty();
        }
    }

    @Test
    void size_and_clear() {
        // Given
        inMemoryEventStore.save(events(newAggregateId(), 1, 2));
        inMemoryEventStore.save(events(newAggregateId(), 1, 3));

        // When
        int sizeBeforeClear = inMemoryEventStore.size();
        inMemoryEventStore.clear();

        // Then
        assertThat(sizeBeforeClear).isEqualTo(5);
        assertThat(inMemoryEventStore.size()).isZero();
    }

    @Test
    void rejected_save_of_an_unknown_aggregate_leaves_no_trace() {
        // Given
        String aggregateId = newAggregateId();

        // When
        Throwable throwable = catchThrowable(() -> inMemoryEventStore.save(events(aggregateId, 2, 1)));

        // Then
        assertThat(throwable).isExactlyInstanceOf(VersionConflictException.class);
        assertThat(inMemoryEventStore.aggregateCount()).isZero();
        assertThat(inMemoryEventStore.loadByAggregate(aggregateId)).isEmpty();
    }

    @Test
    void the_store_can_be_reused_after_clear() {
        // Given
        String aggregateId = newAggregateId();
        inMemoryEventStore.save(events(aggregateId, 1, 2));
        inMemoryEventStore.clear();

        // When
        inMemoryEventStore.save(List.of(event(aggregateId, 1)));

        // Then
        assertThat(inMemoryEventStore.loadByAggregate(aggregateId)).extracting(Event::getVersion).containsExactly(1L);
    }

    @Test
    @Timeout(10)
    void only_one_of_many_concurrent_writers_of_the_same_version_succeeds() throws Exception {
        // Given
        String aggregateId = newAggregateId();
        inMemoryEventStore.save(List.of(event(aggregateId, 1)));
        int numberOfWriters = 16;
        ExecutorService executor = Executors.newFixedThreadPool(numberOfWriters);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger conflicts = new AtomicInteger();
        List<Callable<Boolean>> writers = new ArrayList<>();
        for (int i = 0; i < numberOfWriters; i++) {
            writers.add(() -> {
                start.await();
                try {
                    inMemoryEventStore.save(events(aggregateId, 2, 2));
                    return true;
                } catch (VersionConflictException e) {
                    conflicts.incrementAndGet();
                    return false;
                }
            });
        }

        // When
        List<Future<Boolean>> futures = new ArrayList<>();
        try {
            for (Callable<Boolean> writer : writers) {
                futures.add(executor.submit(writer));
            }
            start.countDown();
            for (Future<Boolean> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertThat(conflicts).hasValue(numberOfWriters - 1);
        assertThat(inMemoryEventStore.loadByAggregate(aggregateId)).extracting(Event::getVersion).containsExactly(1L, 2L, 3L);
    }
}
