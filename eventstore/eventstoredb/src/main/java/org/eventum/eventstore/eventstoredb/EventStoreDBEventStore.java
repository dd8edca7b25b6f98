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

package org.eventum.eventstore.eventstoredb;

import com.eventstore.dbclient.AppendToStreamOptions;
import com.eventstore.dbclient.EventData;
import com.eventstore.dbclient.EventStoreDBClient;
import com.eventstore.dbclient.EventStoreDBClientSettings;
import com.eventstore.dbclient.EventStoreDBConnectionString;
import com.eventstore.dbclient.ExpectedRevision;
import com.eventstore.dbclient.ReadAllOptions;
import com.eventstore.dbclient.ReadResult;
import com.eventstore.dbclient.ReadStreamOptions;
import com.eventstore.dbclient.RecordedEvent;
import com.eventstore.dbclient.ResolvedEvent;
import com.eventstore.dbclient.StreamNotFoundException;
import com.eventstore.dbclient.WrongExpectedVersionException;
import org.eventum.event.Event;
import org.eventum.eventstore.api.ErrorKind;
import org.eventum.eventstore.api.EventStore;
import org.eventum.eventstore.api.EventStoreException;
import org.eventum.eventstore.api.TimeRange;
import org.eventum.eventstore.api.VersionConflictException;
import org.eventum.eventstore.api.WriteResult;
import org.eventum.eventstore.eventstoredb.internal.StructuralMetadataCodec;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;
import static org.eventum.eventstore.api.internal.EventGroupValidator.lastVersion;
import static org.eventum.eventstore.api.internal.EventGroupValidator.validate;
import static org.eventum.eventstore.eventstoredb.internal.EventStoreDBExceptionTranslator.translateException;

/**
 * An {@link EventStore} backed by <a href="https://www.eventstore.com">EventStoreDB</a>. Each aggregate is a stream named
 * {@code streamPrefix + "-" + aggregateId} and version {@code v} of the aggregate is stored at stream revision {@code v - 1}.
 * <p>
 * Optimistic concurrency is delegated to EventStoreDB: an append whose first version is {@code 1} requires that the stream
 * doesn't exist, any other append requires that the last revision of the stream is {@code firstVersion - 2}. EventStoreDB
 * rejects the whole append atomically otherwise, and the rejection is reported as a {@link VersionConflictException}.
 * <p>
 * {@link #loadByType(String)} and {@link #loadByTimeRange(TimeRange)} read the {@code $all} stream from the start and are
 * intended for analytics rather than for replay.
 */
@NullMarked
public class EventStoreDBEventStore implements EventStore, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventStoreDBEventStore.class);

    private final EventStoreDBClient client;
    private final EventStoreDBEventStoreConfig config;
    private final boolean ownsClient;

    /**
     * Create a new instance of {@code EventStoreDBEventStore}.
     *
     * @param client The client to use, it's not shut down by {@link #close()}
     * @param config The configuration
     */
    public EventStoreDBEventStore(EventStoreDBClient client, EventStoreDBEventStoreConfig config) {
        this(client, config, false);
    }

    private EventStoreDBEventStore(EventStoreDBClient client, EventStoreDBEventStoreConfig config, boolean ownsClient) {
        requireNonNull(client, EventStoreDBClient.class.getSimpleName() + " cannot be null");
        requireNonNull(config, EventStoreDBEventStoreConfig.class.getSimpleName() + " cannot be null");
        this.client = client;
        this.config = config;
        this.ownsClient = ownsClient;
    }

    /**
     * Create an event store with a client of its own, connected to the given connection string, e.g. {@code esdb://localhost:2113?tls=false}.
     * The client is shut down by {@link #close()}.
     *
     * @throws EventStoreException with kind {@link ErrorKind#CONNECTION_FAILURE} if the connection string is invalid
     */
    public static EventStoreDBEventStore connect(String connectionString, EventStoreDBEventStoreConfig config) {
        requireNonNull(connectionString, "Connection string cannot be null");
        final EventStoreDBClient client;
        try {
            EventStoreDBClientSettings settings = EventStoreDBConnectionString.parseOrThrow(connectionString);
            client = EventStoreDBClient.create(settings);
        } catch (RuntimeException e) {
            throw new EventStoreException(ErrorKind.CONNECTION_FAILURE, "connect", null, "Failed to create EventStoreDB client: " + e.getMessage(), e);
        }
        log.info("Created EventStoreDB client (stream prefix {})", config.streamPrefix);
        return new EventStoreDBEventStore(client, config, true);
    }

    @Override
    public WriteResult save(List<Event> events) {
        String aggregateId = validate(events);
        String streamName = config.streamNameOf(aggregateId);
        EventData[] eventData = new EventData[events.size()];
        for (int i = 0; i < events.size(); i++) {
            eventData[i] = toEventData(events.get(i));
        }

        long firstVersion = events.get(0).getVersion();
        ExpectedRevision expectedRevision = firstVersion == 1 ? ExpectedRevision.noStream() : ExpectedRevision.expectedRevision(firstVersion - 2);
        AppendToStreamOptions options = AppendToStreamOptions.get().expectedRevision(expectedRevision);
        await(client.appendToStream(streamName, options, eventData), "save", aggregateId, e -> {
            if (e instanceof WrongExpectedVersionException) {
                log.debug("EventStoreDB rejected {} event(s) for stream {} starting at version {}", events.size(), streamName, firstVersion);
                return new VersionConflictException("save", aggregateId, -1, firstVersion, e);
            }
            return translateException("save", aggregateId, e);
        });
        long version = lastVersion(events);
        log.debug("Appended {} event(s) to stream {}, version is now {}", events.size(), streamName, version);
        return new WriteResult(aggregateId, version);
    }

    @Override
    public List<Event> loadByAggregate(String aggregateId) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        return readStream("loadByAggregate", aggregateId, ReadStreamOptions.get().forwards().fromStart());
    }

    @Override
    public List<Event> loadByAggregateUpToVersion(String aggregateId, long version) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        if (version < 1) {
            return Collections.emptyList();
        }
        return readStream("loadByAggregateUpToVersion", aggregateId, ReadStreamOptions.get().forwards().fromStart().maxCount(version));
    }

    @Override
    public List<Event> loadByType(String type) {
        requireNonNull(type, "Type cannot be null");
        return readAll("loadByType", event -> event.getType().equals(type));
    }

    @Override
    public List<Event> loadByTimeRange(TimeRange timeRange) {
        requireNonNull(timeRange, TimeRange.class.getSimpleName() + " cannot be null");
        return readAll("loadByTimeRange", event -> timeRange.contains(event.getTimestamp()));
    }

    @Override
    public void close() {
        if (ownsClient) {
            log.info("Shutting down EventStoreDB client");
            client.shutdown();
        }
    }

    private List<Event> readStream(String operation, String aggregateId, ReadStreamOptions options) {
        String streamName = config.streamNameOf(aggregateId);
        ReadResult result = await(client.readStream(streamName, options), operation, aggregateId, e -> translateException(operation, aggregateId, e));
        if (result == null) {
            return Collections.emptyList();
        }
        List<Event> events = new ArrayList<>(result.getEvents().size());
        for (ResolvedEvent resolvedEvent : result.getEvents()) {
            events.add(toEvent(operation, resolvedEvent.getOriginalEvent()));
        }
        return Collections.unmodifiableList(events);
    }

    private List<Event> readAll(String operation, Predicate<Event> predicate) {
        ReadResult result = await(client.readAll(ReadAllOptions.get().forwards().fromStart()), operation, null, e -> translateException(operation, null, e));
        if (result == null) {
            return Collections.emptyList();
        }
        String prefix = config.streamPrefix + "-";
        List<Event> events = new ArrayList<>();
        for (ResolvedEvent resolvedEvent : result.getEvents()) {
            RecordedEvent recordedEvent = resolvedEvent.getOriginalEvent();
            if (recordedEvent.getEventType().startsWith("$") || !recordedEvent.getStreamId().startsWith(prefix)) {
                continue;
            }
            Event event = toEvent(operation, recordedEvent);
            if (predicate.test(event)) {
                events.add(event);
            }
        }
        return Collections.unmodifiableList(events);
    }

    /**
     * Wait for the future to complete. A missing stream completes with {@code null}.
     */
    private <T> @Nullable T await(CompletableFuture<T> future, String operation, @Nullable String aggregateId, Function<Throwable, EventStoreException> translator) {
        try {
            return future.get(config.requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new EventStoreException(ErrorKind.CONNECTION_FAILURE, operation, aggregateId, "Interrupted while waiting for EventStoreDB", e);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new EventStoreException(ErrorKind.CONNECTION_FAILURE, operation, aggregateId, "Timed out after " + config.requestTimeout + " waiting for EventStoreDB", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof StreamNotFoundException) {
                return null;
            }
            throw translator.apply(cause);
        }
    }

    private static EventData toEventData(Event event) {
        final UUID eventId;
        try {
            eventId = UUID.fromString(event.getId());
        } catch (IllegalArgumentException e) {
            throw new EventStoreException(ErrorKind.SERIALIZATION_ERROR, "save", event.getAggregateId(), "Event id must be a UUID but was " + event.getId(), e);
        }
        final byte[] metadata;
        try {
            metadata = StructuralMetadataCodec.pack(event);
        } catch (RuntimeException e) {
            throw translateException("save", event.getAggregateId(), e);
        }
        return EventData.builderAsBinary(eventId, event.getType(), event.getPayload())
                .metadataAsBytes(metadata)
                .build();
    }

    private Event toEvent(String operation, RecordedEvent recordedEvent) {
        try {
            return StructuralMetadataCodec.unpack(config.streamPrefix, recordedEvent.getStreamId(), recordedEvent.getEventId().toString(),
                    recordedEvent.getEventType(), recordedEvent.getEventData(), recordedEvent.getUserMetadata(),
                    recordedEvent.getRevision(), recordedEvent.getCreated());
        } catch (RuntimeException e) {
            String aggregateId = StructuralMetadataCodec.aggregateIdFromStreamName(config.streamPrefix, recordedEvent.getStreamId());
            throw new EventStoreException(ErrorKind.SERIALIZATION_ERROR, operation, aggregateId, "Failed to read event " + recordedEvent.getEventId() + ": " + e.getMessage(), e);
        }
    }
}
