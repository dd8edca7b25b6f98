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

package org.eventum.eventstore.cassandra;

import com.datastax.oss.driver.api.core.CqlSession;
import org.eventum.event.Event;
import org.eventum.eventstore.api.EventStore;
import org.eventum.testsupport.EventStoreContract;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.testcontainers.containers.CassandraContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.eventum.testsupport.EventFixtures.events;
import static org.eventum.testsupport.EventFixtures.newAggregateId;

@DisplayNameGeneration(ReplaceUnderscores.class)
@Testcontainers(disabledWithoutDocker = true)
class CassandraEventStoreTest extends EventStoreContract {
    private static final String KEYSPACE = "eventum_test";

    @Container
    private static final CassandraContainer<?> cassandraContainer = new CassandraContainer<>("cassandra:4.1");

    private static CqlSession session;

    @RegisterExtension
    FlushCassandraExtension flushCassandraExtension = new FlushCassandraExtension(() -> session, KEYSPACE, CassandraEventStoreConfig.DEFAULT_TABLE);

    private CassandraEventStore eventStore;

    @BeforeAll
    static void create_session() {
        session = CqlSession.builder()
                .addContactPoint(cassandraContainer.getContactPoint())
                .withLocalDatacenter(cassandraContainer.getLocalDatacenter())
                .build();
    }

    @AfterAll
    static void close_session() {
        if (session != null) {
            session.close();
        }
    }

    @BeforeEach
    void create_cassandra_event_store() {
        eventStore = new CassandraEventStore(session, new CassandraEventStoreConfig(KEYSPACE));
    }

    @Override
    protected EventStore eventStore() {
        return eventStore;
    }

    @Nested
    class Schema {

        @Test
        void creating_the_event_store_again_keeps_existing_events() {
            // Given
            String aggregateId = newAggregateId();
            List<Event> events = events(aggregateId, 1, 2);
            eventStore.save(events);

            // When
            CassandraEventStore recreated = new CassandraEventStore(session, new CassandraEventStoreConfig(KEYSPACE));

            // Then
            assertThat(recreated.loadByAggregate(aggregateId)).containsExactlyElementsOf(events);
        }

        @Test
        void aggregates_of_different_kinds_are_stored_in_different_partitions() {
            // Given
            String aggregateId = newAggregateId();
            CassandraEventStore diaryStore = new CassandraEventStore(session, new CassandraEventStoreConfig.Builder()
                    .keyspace(KEYSPACE)
                    .aggregateKindResolver(AggregateKindResolver.constant("diary_entry"))
                    .build());
            diaryStore.save(events(aggregateId, 1, 1));

            // When
            List<Event> loadedWithDefaultKind = eventStore.loadByAggregate(aggregateId);

            // Then
            assertThat(loadedWithDefaultKind).isEmpty();
            assertThat(diaryStore.loadByAggregate(aggregateId)).hasSize(1);
        }
    }
}
