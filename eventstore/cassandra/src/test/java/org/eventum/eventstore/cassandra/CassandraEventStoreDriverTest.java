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
import com.datastax.oss.driver.api.core.DriverTimeoutException;
import com.datastax.oss.driver.api.core.NoNodeAvailableException;
import com.datastax.oss.driver.api.core.cql.AsyncResultSet;
import com.datastax.oss.driver.api.core.cql.BatchStatement;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.cql.Statement;
import org.eventum.event.Event;
import org.eventum.eventstore.api.ErrorKind;
import org.eventum.eventstore.api.EventStoreException;
import org.eventum.eventstore.api.VersionConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.eventum.testsupport.EventFixtures.event;
import static org.eventum.testsupport.EventFixtures.events;
import static org.eventum.testsupport.EventFixtures.newAggregateId;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Exercises the {@link CassandraEventStore} against a mocked driver, for the paths that are hard to provoke on a real cluster.
 */
@DisplayNameGeneration(ReplaceUnderscores.class)
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CassandraEventStoreDriverTest {

    @Mock
    private CqlSession session;
    @Mock
    private PreparedStatement preparedStatement;
    @Mock
    private BoundStatement boundStatement;
    @Mock
    private AsyncResultSet countResult;
    @Mock
    private Row countRow;

    private CassandraEventStore eventStore;

    @BeforeEach
    void create_event_store() {
        when(session.prepare(anyString())).thenReturn(preparedStatement);
        when(preparedStatement.bind(any(), any())).thenReturn(boundStatement);
        when(preparedStatement.bind(any(), any(), any(), any(), any(), any(), any(), any())).thenReturn(boundStatement);
        when(countResult.one()).thenReturn(countRow);
        eventStore = new CassandraEventStore(session, new CassandraEventStoreConfig.Builder().initializeSchema(false).build());
    }

    @Test
    void fails_with_version_conflict_before_writing_when_the_first_version_does_not_follow_the_persisted_count() {
        // Given
        when(countRow.getLong(0)).thenReturn(2L);
        when(session.executeAsync(any(Statement.class))).thenReturn(CompletableFuture.completedFuture(countResult));

        // When
        Throwable throwable = catchThrowable(() -> eventStore.save(events(newAggregateId(), 2, 2)));

        // Then
        assertThat(throwable).isExactlyInstanceOf(VersionConflictException.class);
        VersionConflictException e = (VersionConflictException) throwable;
        assertThat(e.expectedVersion).isEqualTo(3);
        assertThat(e.actualVersion).isEqualTo(2);
        verify(session, never()).executeAsync(any(BatchStatement.class));
    }

    @Test
    void writes_all_events_in_one_batch_when_the_first_version_follows_the_persisted_count() {
        // Given
        String aggregateId = newAggregateId();
        when(countRow.getLong(0)).thenReturn(1L);
        when(session.executeAsync(any(Statement.class))).thenReturn(CompletableFuture.completedFuture(countResult));

        // When
        long version = eventStore.save(events(aggregateId, 2, 3)).getVersion();

        // Then
        assertThat(version).isEqualTo(4);
        verify(session).executeAsync(any(BatchStatement.class));
    }

    @Test
    void aggregate_ids_that_are_not_uuids_are_rejected_as_serialization_error_without_contacting_cassandra() {
        // When
        Throwable throwable = catchThrowable(() -> eventStore.save(List.of(event("not-a-uuid", 1))));

        // Then
        assertThat(EventStoreException.isKind(throwable, ErrorKind.SERIALIZATION_ERROR)).isTrue();
        verify(session, never()).executeAsync(any(Statement.class));
    }

    @Test
    void unreachable_cluster_is_reported_as_connection_failure() {
        // Given
        when(session.executeAsync(any(Statement.class))).thenReturn(CompletableFuture.failedFuture(new NoNodeAvailableException()));

        // When
        Throwable throwable = catchThrowable(() -> eventStore.loadByAggregate(newAggregateId()));

        // Then
        assertThat(EventStoreException.isKind(throwable, ErrorKind.CONNECTION_FAILURE)).isTrue();
        assertThat(throwable).hasCauseExactlyInstanceOf(NoNodeAvailableException.class);
    }

    @Test
    void a_failing_batch_is_reported_as_storage_error() {
        // Given
        when(countRow.getLong(0)).thenReturn(0L);
        when(session.executeAsync(any(Statement.class))).thenAnswer(invocation -> {
            if (invocation.getArgument(0) instanceof BatchStatement) {
                return CompletableFuture.failedFuture(new DriverTimeoutException("Query timed out"));
            }
            return CompletableFuture.completedFuture(countResult);
        });

        // When
        Throwable throwable = catchThrowable(() -> eventStore.save(events(newAggregateId(), 1, 2)));

        // Then
        assertThat(EventStoreException.isKind(throwable, ErrorKind.STORAGE_ERROR)).isTrue();
        assertThat(throwable.getCause()).isInstanceOf(EventStoreException.class);
        assertThat(((EventStoreException) throwable.getCause()).kind).isEqualTo(ErrorKind.CONNECTION_FAILURE);
    }

    @Test
    void reads_every_page_of_the_result() {
        // Given
        String aggregateId = newAggregateId();
        AsyncResultSet page1 = mock(AsyncResultSet.class);
        AsyncResultSet page2 = mock(AsyncResultSet.class);
        Row row1 = row(aggregateId, 1);
        Row row2 = row(aggregateId, 2);
        when(page1.currentPage()).thenReturn(List.of(row1));
        when(page1.hasMorePages()).thenReturn(true);
        when(page1.fetchNextPage()).thenReturn(CompletableFuture.completedFuture(page2));
        when(page2.currentPage()).thenReturn(List.of(row2));
        when(page2.hasMorePages()).thenReturn(false);
        when(session.executeAsync(any(Statement.class))).thenReturn(CompletableFuture.completedFuture(page1));

        // When
        List<Event> events = eventStore.loadByAggregate(aggregateId);

        // Then
        assertThat(events).extracting(Event::getVersion).containsExactly(1L, 2L);
        assertThat(events).extracting(Event::getAggregateId).containsOnly(aggregateId);
        assertThat(events.get(0).getMetadata()).isEmpty();
    }

    private static Row row(String aggregateId, long version) {
        Row row = mock(Row.class);
        when(row.getUuid("aggregate_id")).thenReturn(UUID.fromString(aggregateId));
        when(row.getLong("version")).thenReturn(version);
        when(row.getString("event_id")).thenReturn(UUID.randomUUID().toString());
        when(row.getString("event_type")).thenReturn("SomethingHappened");
        when(row.getByteBuffer("payload")).thenReturn(ByteBuffer.wrap("{}".getBytes(UTF_8)));
        when(row.getString("metadata")).thenReturn("{}");
        when(row.getInstant("created_at")).thenReturn(Instant.parse("2024-01-15T10:00:00Z"));
        return row;
    }
}
