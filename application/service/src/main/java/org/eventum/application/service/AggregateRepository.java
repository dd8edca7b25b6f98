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

import org.eventum.aggregate.Aggregate;
import org.eventum.event.Event;
import org.eventum.eventstore.api.ErrorKind;
import org.eventum.eventstore.api.EventStore;
import org.eventum.eventstore.api.EventStoreException;
import org.eventum.eventstore.api.WriteResult;
import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Loads aggregates by replaying their history from an {@link EventStore} and saves the events they stage.
 *
 * @param <A> The type of aggregate
 */
@NullMarked
public class AggregateRepository<A extends Aggregate> {
    private static final Logger log = LoggerFactory.getLogger(AggregateRepository.class);

    private final EventStore eventStore;
    private final Function<String, A> aggregateFactory;

    /**
     * @param eventStore       The event store to use
     * @param aggregateFactory Creates an empty aggregate, at version {@code 0}, from an aggregate id
     */
    public AggregateRepository(EventStore eventStore, Function<String, A> aggregateFactory) {
        requireNonNull(eventStore, EventStore.class.getSimpleName() + " cannot be null");
        requireNonNull(aggregateFactory, "Aggregate factory cannot be null");
        this.eventStore = eventStore;
        this.aggregateFactory = aggregateFactory;
    }

    /**
     * @return The aggregate with its full history replayed, or an empty aggregate if it has no history
     */
    public A loadOrCreate(String aggregateId) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        return replay(aggregateId, eventStore.loadByAggregate(aggregateId));
    }

    public Optional<A> find(String aggregateId) {
        A aggregate = loadOrCreate(aggregateId);
        return aggregate.getVersion() == 0 ? Optional.empty() : Optional.of(aggregate);
    }

    /**
     * @throws EventStoreException with kind {@link ErrorKind#EVENT_NOT_FOUND} if the aggregate has no history
     */
    public A load(String aggregateId) {
        return find(aggregateId).orElseThrow(() -> new EventStoreException(ErrorKind.EVENT_NOT_FOUND, "load", aggregateId, "Aggregate " + aggregateId + " has no history"));
    }

    /**
     * Rebuild the state the aggregate had at the given version.
     *
     * @throws EventStoreException with kind {@link ErrorKind#EVENT_NOT_FOUND} if the aggregate has no history up to {@code version}
     */
    public A loadAsOf(String aggregateId, long version) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        A aggregate = replay(aggregateId, eventStore.loadByAggregateUpToVersion(aggregateId, version));
        if (aggregate.getVersion() == 0) {
            throw new EventStoreException(ErrorKind.EVENT_NOT_FOUND, "loadAsOf", aggregateId, "Aggregate " + aggregateId + " has no history up to version " + version);
        }
        return aggregate;
    }

    /**
     * Append the uncommitted events of the aggregate. When the event store has confirmed the append, the events are
     * applied to the aggregate and cleared. If the append fails, the aggregate is left untouched. If applying the
     * persisted events fails, they are still cleared and the aggregate should be reloaded.
     *
     * @return The result of the write, or the current version of the aggregate if nothing was staged
     */
    public WriteResult save(A aggregate) {
        requireNonNull(aggregate, "Aggregate cannot be null");
        List<Event> uncommittedEvents = aggregate.getUncommittedEvents();
        if (uncommittedEvents.isEmpty()) {
            return new WriteResult(aggregate.getId(), aggregate.getVersion());
        }
        WriteResult writeResult = eventStore.save(uncommittedEvents);
        try {
            uncommittedEvents.forEach(aggregate::applyEvent);
        } finally {
            // The events are persisted, staging them again would only conflict
            aggregate.clearUncommittedEvents();
        }
        log.debug("Saved {} event(s) for aggregate {}, version is now {}", uncommittedEvents.size(), aggregate.getId(), writeResult.getVersion());
        return writeResult;
    }

    private A replay(String aggregateId, List<Event> history) {
        A aggregate = requireNonNull(aggregateFactory.apply(aggregateId), "Aggregate factory returned null");
        aggregate.loadFromHistory(history);
        return aggregate;
    }
}
