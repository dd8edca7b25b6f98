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
import com.datastax.oss.driver.api.core.cql.AsyncResultSet;
import com.datastax.oss.driver.api.core.cql.BatchStatement;
import com.datastax.oss.driver.api.core.cql.BatchStatementBuilder;
import com.datastax.oss.driver.api.core.cql.DefaultBatchType;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.datastax.oss.driver.api.core.cql.Statement;
import org.eventum.event.Event;
import org.eventum.event.internal.MetadataJson;
import org.eventum.eventstore.api.ErrorKind;
import org.eventum.eventstore.api.EventStore;
import org.eventum.eventstore.api.EventStoreException;
import org.eventum.eventstore.api.TimeRange;
import org.eventum.eventstore.api.VersionConflictException;
import org.eventum.eventstore.api.WriteResult;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static java.util.Objects.requireNonNull;
import static org.eventum.eventstore.api.internal.EventGroupValidator.lastVersion;
import static org.eventum.eventstore.api.internal.EventGroupValidator.validate;
import static org.eventum.eventstore.api.internal.EventGroupValidator.verifyFollows;
import static org.eventum.eventstore.cassandra.internal.CassandraExceptionTranslator.translateException;

/**
 * An {@link EventStore} backed by Apache Cassandra. Each aggregate is a partition keyed by {@code (aggregate_type, aggregate_id)}
 * and clustered by ascending version.
 * <p>
 * Cassandra has no compare-and-swap across rows, so {@link #save(List)} first counts the persisted events of the
 * aggregate and fails with a {@link VersionConflictException} unless the first new version is {@code count + 1}. The events
 * are then written in a single logged batch. Two writers can both pass the count check and race on the batch,
 * callers that need to detect this should retry on conflict and re-read the history.
 * <p>
 * A failure after the count check has passed is reported as {@link ErrorKind#STORAGE_ERROR} and it's unknown whether the
 * batch was applied. Reload the aggregate before retrying.
 */
@NullMarked
public class CassandraEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(CassandraEventStore.class);

    private static final String COLUMNS = "aggregate_id, version, event_id, event_type, payload, metadata, created_at";

    private final CqlSession session;
    private final CassandraEventStoreConfig config;
    private final String qualifiedTable;

    private final PreparedStatement insertStatement;
    private final PreparedStatement countStatement;
    private final PreparedStatement selectByAggregateStatement;
    private final PreparedStatement selectByAggregateUpToVersionStatement;
    private final PreparedStatement selectByTypeStatement;
    private final PreparedStatement selectByTimeRangeStatement;

    /**
     * Create a new instance of {@code CassandraEventStore}. The keyspace, table and indexes are created unless
     * {@link CassandraEventStoreConfig#initializeSchema} is {@code false}.
     *
     * @param session The session to use, it's not closed by the event store
     * @param config  The configuration
     */
    public CassandraEventStore(CqlSession session, CassandraEventStoreConfig config) {
        requireNonNull(session, CqlSession.class.getSimpleName() + " cannot be null");
        requireNonNull(config, CassandraEventStoreConfig.class.getSimpleName() + " cannot be null");
        this.session = session;
        this.config = config;
        this.qualifiedTable = config.keyspace + "." + config.table;
        if (config.initializeSchema) {
            initializeSchema();
        }
        this.insertStatement = prepare("INSERT INTO " + qualifiedTable + " (aggregate_type, " + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)");
        this.countStatement = prepare("SELECT count(*) FROM " + qualifiedTable + " WHERE aggregate_type = ? AND aggregate_id = ?");
        this.selectByAggregateStatement = prepare("SELECT " + COLUMNS + " FROM " + qualifiedTable + " WHERE aggregate_type = ? AND aggregate_id = ?");
        this.selectByAggregateUpToVersionStatement = prepare("SELECT " + COLUMNS + " FROM " + qualifiedTable + " WHERE aggregate_type = ? AND aggregate_id = ? AND version <= ?");
        this.selectByTypeStatement = prepare("SELECT " + COLUMNS + " FROM " + qualifiedTable + " WHERE event_type = ?");
        this.selectByTimeRangeStatement = prepare("SELECT " + COLUMNS + " FROM " + qualifiedTable + " WHERE created_at >= ? AND created_at <= ? ALLOW FILTERING");
    }

    @Override
    public WriteResult save(List<Event> events) {
        String aggregateId = validate(events);
        UUID partitionId = toUuid("save", aggregateId);
        String aggregateType = config.aggregateKindResolver.resolve(aggregateId);

        Row countRow = await(session.executeAsync(countStatement.bind(aggregateType, partitionId)), "save", aggregateId).one();
        long currentVersion = countRow == null ? 0 : countRow.getLong(0);
        try {
            verifyFollows(events, currentVersion);
        } catch (VersionConflictException e) {
            log.debug("Rejecting {} event(s) for aggregate {}, persisted version is {}", events.size(), aggregateId, currentVersion);
            throw e;
        }

        BatchStatementBuilder batch = BatchStatement.builder(DefaultBatchType.LOGGED);
        for (Event event : events) {
            batch.addStatement(insertStatement.bind(aggregateType, partitionId, event.getVersion(), event.getId(), event.getType(),
                    ByteBuffer.wrap(event.getPayload()), MetadataJson.toJson(event.getMetadata()), event.getTimestamp()));
        }
        try {
            await(session.executeAsync(batch.build()), "save", aggregateId);
        } catch (EventStoreException e) {
            throw new EventStoreException(ErrorKind.STORAGE_ERROR, "save", aggregateId,
                    "Batch write for aggregate " + aggregateId + " failed, it's unknown whether the events were persisted. Reload the aggregate before retrying.", e);
        }
        long version = lastVersion(events);
        log.debug("Saved {} event(s) for aggregate {}, version is now {}", events.size(), aggregateId, version);
        return new WriteResult(aggregateId, version);
    }

    @Override
    public List<Event> loadByAggregate(String aggregateId) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        String aggregateType = config.aggregateKindResolver.resolve(aggregateId);
        return query(selectByAggregateStatement.bind(aggregateType, toUuid("loadByAggregate", aggregateId)), "loadByAggregate", aggregateId);
    }

    @Override
    public List<Event> loadByAggregateUpToVersion(String aggregateId, long version) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        String aggregateType = config.aggregateKindResolver.resolve(aggregateId);
        UUID partitionId = toUuid("loadByAggregateUpToVersion", aggregateId);
        return query(selectByAggregateUpToVersionStatement.bind(aggregateType, partitionId, version), "loadByAggregateUpToVersion", aggregateId);
    }

    @Override
    public List<Event> loadByType(String type) {
        requireNonNull(type, "Type cannot be null");
        return query(selectByTypeStatement.bind(type), "loadByType", null);
    }

    @Override
    public List<Event> loadByTimeRange(TimeRange timeRange) {
        requireNonNull(timeRange, TimeRange.class.getSimpleName() + " cannot be null");
        return query(selectByTimeRangeStatement.bind(timeRange.start(), timeRange.end()), "loadByTimeRange", null);
    }

    private void initializeSchema() {
        log.info("Initializing Cassandra schema {} (replication factor {})", qualifiedTable, config.replicationFactor);
        execute("CREATE KEYSPACE IF NOT EXISTS " + config.keyspace
                + " WITH replication = {'class': 'SimpleStrategy', 'replication_factor': " + config.replicationFactor + "}");
        execute("CREATE TABLE IF NOT EXISTS " + qualifiedTable + " ("
                + "aggregate_type text, "
                + "aggregate_id uuid, "
                + "version bigint, "
                + "event_id text, "
                + "event_type text, "
                + "payload blob, "
                + "metadata text, "
                + "created_at timestamp, "
                + "PRIMARY KEY ((aggregate_type, aggregate_id), version)"
                + ") WITH CLUSTERING ORDER BY (version ASC)");
        execute("CREATE INDEX IF NOT EXISTS " + config.table + "_event_type_idx ON " + qualifiedTable + " (event_type)");
        execute("CREATE INDEX IF NOT EXISTS " + config.table + "_created_at_idx ON " + qualifiedTable + " (created_at)");
    }

    private void execute(String cql) {
        await(session.executeAsync(SimpleStatement.newInstance(cql)), "initializeSchema", null);
    }

    private PreparedStatement prepare(String cql) {
        try {
            return session.prepare(cql);
        } catch (RuntimeException e) {
            throw translateException("prepare", null, e);
        }
    }

    private List<Event> query(Statement<?> statement, String operation, @Nullable String aggregateId) {
        List<Event> events = new ArrayList<>();
        AsyncResultSet resultSet = await(session.executeAsync(statement), operation, aggregateId);
        while (true) {
            for (Row row : resultSet.currentPage()) {
                events.add(toEvent(row, operation));
            }
            if (!resultSet.hasMorePages()) {
                break;
            }
            resultSet = await(resultSet.fetchNextPage(), operation, aggregateId);
        }
        return Collections.unmodifiableList(events);
    }

    private <T> T await(CompletionStage<T> stage, String operation, @Nullable String aggregateId) {
        try {
            return stage.toCompletableFuture().get(config.requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventStoreException(ErrorKind.CONNECTION_FAILURE, operation, aggregateId, "Interrupted while waiting for Cassandra", e);
        } catch (TimeoutException e) {
            throw new EventStoreException(ErrorKind.CONNECTION_FAILURE, operation, aggregateId, "Timed out after " + config.requestTimeout + " waiting for Cassandra", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw translateException(operation, aggregateId, cause);
        }
    }

    private static Event toEvent(Row row, String operation) {
        UUID aggregateId = requireNonNull(row.getUuid("aggregate_id"));
        try {
            ByteBuffer payloadBuffer = row.getByteBuffer("payload");
            byte[] payload = new byte[payloadBuffer == null ? 0 : payloadBuffer.remaining()];
            if (payloadBuffer != null) {
                payloadBuffer.duplicate().get(payload);
            }
            String metadata = row.getString("metadata");
            return new Event(requireNonNull(row.getString("event_id")), requireNonNull(row.getString("event_type")), aggregateId.toString(),
                    row.getLong("version"), requireNonNull(row.getInstant("created_at")), payload,
                    metadata == null ? null : MetadataJson.fromJson(metadata));
        } catch (RuntimeException e) {
            throw new EventStoreException(ErrorKind.SERIALIZATION_ERROR, operation, aggregateId.toString(), "Failed to read event from row: " + e.getMessage(), e);
        }
    }

    private static UUID toUuid(String operation, String aggregateId) {
        try {
            return UUID.fromString(aggregateId);
        } catch (IllegalArgumentException e) {
            throw new EventStoreException(ErrorKind.SERIALIZATION_ERROR, operation, aggregateId, "Aggregate id must be a UUID but was " + aggregateId, e);
        }
    }
}
