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
import org.eventum.eventstore.api.ErrorKind;
import org.eventum.eventstore.api.EventStore;
import org.eventum.eventstore.api.EventStoreException;
import org.eventum.eventstore.api.TimeRange;
import org.eventum.eventstore.api.VersionConflictException;
import org.eventum.eventstore.api.WriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static java.util.Comparator.comparingLong;
import static java.util.Objects.requireNonNull;
import static org.eventum.eventstore.api.internal.EventGroupValidator.lastVersion;
import static org.eventum.eventstore.api.internal.EventGroupValidator.validate;
import static org.eventum.eventstore.api.internal.EventGroupValidator.verifyFollows;

/**
 * This is an {@link EventStore} that stores events in-memory. This is mainly useful for testing
 * and/or demo purposes, and it's the reference for how the other implementations behave.
 * <p>
 * All events are kept in a single append-only list guarded by one read/write lock. Writes take the write lock
 * and reads take the read lock, locks are acquired interruptibly.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Event> events = new ArrayList<>();
    // Positions in "events" per aggregate id, in version order
    private final Map<String, List<Integer>> index = new HashMap<>();

    private final Consumer<List<Event>> listener;

    /**
     * Create an instance of {@link InMemoryEventStore}
     */
    public InMemoryEventStore() {
        // @formatter:off
        this(__ -> {});
        // @formatter:on
    }

    /**
     * Create an instance of {@link InMemoryEventStore} that has a <code>listener</code> that will be invoked
     * after events have been written to the event store.
     *
     * @param listener A listener that will be invoked with the saved events after they have been written (synchronously, outside the lock!)
     */
    public InMemoryEventStore(Consumer<List<Event>> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.listener = listener;
    }

    @Override
    public WriteResult save(List<Event> events) {
        String aggregateId = validate(events);
        List<Event> group = List.copyOf(events);
        long firstVersion = group.get(0).getVersion();
        withLock(lock.writeLock(), "save", aggregateId, () -> {
            List<Integer> positions = index.getOrDefault(aggregateId, Collections.emptyList());
            long currentVersion = currentVersion(positions);
            for (Integer position : positions) {
                long persistedVersion = this.events.get(position).getVersion();
                if (persistedVersion >= firstVersion) {
                    log.debug("Version {} of aggregate {} already exists", persistedVersion, aggregateId);
                    throw new VersionConflictException("save", aggregateId, currentVersion + 1, firstVersion);
                }
            }
            verifyFollows(group, currentVersion);
            // Only index aggregates that have been written
            List<Integer> indexed = index.computeIfAbsent(aggregateId, __ -> new ArrayList<>());
            for (Event event : group) {
                indexed.add(this.events.size());
                this.events.add(event);
            }
            return null;
        });
        log.debug("Saved {} event(s) for aggregate {}", group.size(), aggregateId);
        listener.accept(group);
        return new WriteResult(aggregateId, lastVersion(group));
    }

    @Override
    public List<Event> loadByAggregate(String aggregateId) {
        return loadByAggregateUpToVersion(aggregateId, Long.MAX_VALUE);
    }

    @Override
    public List<Event> loadByAggregateUpToVersion(String aggregateId, long version) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        return withLock(lock.readLock(), "loadByAggregate", aggregateId, () -> {
            List<Integer> positions = index.get(aggregateId);
            if (positions == null) {
                return Collections.emptyList();
            }
            List<Event> result = new ArrayList<>(positions.size());
            for (Integer position : positions) {
                Event event = events.get(position);
                if (event.getVersion() <= version) {
                    result.add(event);
                }
            }
            result.sort(comparingLong(Event::getVersion));
            return Collections.unmodifiableList(result);
        });
    }

    @Override
    public List<Event> loadByType(String type) {
        requireNonNull(type, "Type cannot be null");
        return filter("loadByType", event -> event.getType().equals(type));
    }

    @Override
    public List<Event> loadByTimeRange(TimeRange timeRange) {
        requireNonNull(timeRange, TimeRange.class.getSimpleName() + " cannot be null");
        return filter("loadByTimeRange", event -> timeRange.contains(event.getTimestamp()));
    }

    /**
     * @return The total number of events in the store
     */
    public int size() {
        return withLock(lock.readLock(), "size", null, events::size);
    }

    // Number of aggregates with at least one event
    int aggregateCount() {
        return withLock(lock.readLock(), "aggregateCount", null, index::size);
    }

    /**
     * Remove all events from the store
     */
    public void clear() {
        withLock(lock.writeLock(), "clear", null, () -> {
            events.clear();
            index.clear();
            return null;
        });
    }

    private List<Event> filter(String operation, Predicate<Event> predicate) {
        return withLock(lock.readLock(), operation, null, () -> {
            List<Event> result = new ArrayList<>();
            for (Event event : events) {
                if (predicate.test(event)) {
                    result.add(event);
                }
            }
            return Collections.unmodifiableList(result);
        });
    }

    private long currentVersion(List<Integer> positions) {
        return positions.isEmpty() ? 0 : events.get(positions.get(positions.size() - 1)).getVersion();
    }

    private static <T> T withLock(Lock lock, String operation, String aggregateId, Supplier<T> supplier) {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventStoreException(ErrorKind.STORAGE_ERROR, operation, aggregateId, "Interrupted while waiting for lock", e);
        }
        try {
            return supplier.get();
        } finally {
            lock.unlock();
        }
    }
}
