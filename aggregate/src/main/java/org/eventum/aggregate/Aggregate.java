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

import java.util.List;

/**
 * An entity whose state is derived entirely by folding its event history in version order.
 * <p>
 * Business operations never change state directly. They validate the current folded state and stage a new {@link Event}
 * at the next version. The staged events are handed to an event store and folded into the aggregate with
 * {@link #applyEvent(Event)} once the store has confirmed the append, after which {@link #clearUncommittedEvents()} is called.
 *
 * @see AbstractAggregate
 */
public interface Aggregate {

    /**
     * @return The identity of the aggregate, equal to the aggregate id of every event it owns
     */
    String getId();

    /**
     * @return The version of the last applied event, {@code 0} for an aggregate without history
     */
    long getVersion();

    /**
     * Fold an event into the state of this aggregate.
     *
     * @param event The event, its version must be exactly {@code getVersion() + 1}
     * @throws UnrecognizedEventTypeException if this kind of aggregate doesn't produce events of the given type
     * @throws MismatchedAggregateException   if the event belongs to another aggregate
     */
    void applyEvent(Event event);

    /**
     * @return The events staged by business operations that are not yet appended to the event store, in version order
     */
    List<Event> getUncommittedEvents();

    /**
     * Forget the staged events. Only call this after the event store has confirmed that they're appended.
     */
    void clearUncommittedEvents();

    /**
     * Replay history into this aggregate. The events must be sorted by version in ascending order.
     *
     * @throws MismatchedAggregateException if any event belongs to another aggregate, in which case nothing is applied
     */
    void loadFromHistory(List<Event> history);
}
