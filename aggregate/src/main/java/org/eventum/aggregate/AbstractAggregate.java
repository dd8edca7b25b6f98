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

package org.eventum.aggregate;

import org.eventum.event.Event;
import org.eventum.event.MetadataValue;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Base class for aggregates that keeps track of identity, version and uncommitted events. Subclasses implement
 * {@link #when(Event)} to change their state for every type of event they produce, and stage new events from their
 * business operations using {@link #newEvent(String, Object)} and {@link #stage(Event)}.
 */
@NullMarked
public abstract class AbstractAggregate implements Aggregate {
    private final String id;
    private long version;
    private final List<Event> uncommittedEvents = new ArrayList<>();

    protected AbstractAggregate(String id) {
        requireNonNull(id, "Aggregate id cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Aggregate id cannot be blank");
        }
        this.id = id;
    }

    @Override
    public final String getId() {
        return id;
    }

    @Override
    public final long getVersion() {
        return version;
    }

    /**
     * Change the state of this aggregate according to the event.
     *
     * @throws UnrecognizedEventTypeException if the type of the event is unknown to this aggregate
     */
    protected abstract void when(Event event);

    @Override
    public final void applyEvent(Event event) {
        requireNonNull(event, Event.class.getSimpleName() + " cannot be null");
        verifyOwnership(event);
        if (event.getVersion() != version + 1) {
            throw new IllegalArgumentException(String.format("Event %s has version %d but aggregate %s is at version %d", event.getId(), event.getVersion(), id, version));
        }
        when(event);
        incrementVersion();
    }

    protected final void incrementVersion() {
        version++;
    }

    @Override
    public final void loadFromHistory(List<Event> history) {
        requireNonNull(history, "History cannot be null");
        history.forEach(this::verifyOwnership);
        for (Event event : history) {
            // Already folded
            if (event.getVersion() <= version) {
                continue;
            }
            applyEvent(event);
        }
    }

    /**
     * Stage an event created by a business operation. Preconditions are checked against folded state, so at most one
     * event can be staged until it has been saved and applied (or cleared).
     *
     * @throws IllegalStateException    if an event is already staged
     * @throws IllegalArgumentException if the version of the event isn't the version after the current one
     */
    protected final void stage(Event event) {
        requireNonNull(event, Event.class.getSimpleName() + " cannot be null");
        verifyOwnership(event);
        if (!uncommittedEvents.isEmpty()) {
            throw new IllegalStateException(String.format("Aggregate %s already has a staged %s event at version %d, save or clear it before staging %s", id, uncommittedEvents.get(0).getType(), uncommittedEvents.get(0).getVersion(), event.getType()));
        }
        long expectedVersion = nextVersion();
        if (event.getVersion() != expectedVersion) {
            throw new IllegalArgumentException(String.format("Expected staged event for aggregate %s to have version %d but was %d", id, expectedVersion, event.getVersion()));
        }
        uncommittedEvents.add(event);
    }

    /**
     * Create an event for this aggregate at the next version with the payload encoded as JSON.
     */
    protected final Event newEvent(String type, Object payload) {
        return newEvent(type, payload, null);
    }

    protected final Event newEvent(String type, Object payload, @Nullable Map<String, MetadataValue> metadata) {
        return Event.create(type, id, nextVersion(), JsonPayloads.toJson(payload), metadata);
    }

    /**
     * Decode the JSON payload of an event.
     */
    protected static <T> T payloadOf(Event event, Class<T> type) {
        return JsonPayloads.fromJson(event, type);
    }

    @Override
    public final List<Event> getUncommittedEvents() {
        return Collections.unmodifiableList(new ArrayList<>(uncommittedEvents));
    }

    @Override
    public final void clearUncommittedEvents() {
        uncommittedEvents.clear();
    }

    private long nextVersion() {
        return version + 1;
    }

    private void verifyOwnership(Event event) {
        if (!event.getAggregateId().equals(id)) {
            throw new MismatchedAggregateException(id, event.getAggregateId(), event.getId());
        }
    }
}
