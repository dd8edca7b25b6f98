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

package org.eventum.eventstore.api;

import org.eventum.event.Event;

import java.util.List;

/**
 * Append events to the history of an aggregate.
 */
public interface WriteEvents {

    /**
     * Atomically append all {@code events} or none of them. All events must belong to the same aggregate, their versions
     * must be contiguous and the first version must immediately follow the highest persisted version of the aggregate
     * (or be {@code 1} if the aggregate has no history).
     *
     * @param events The events to append, ordered by version
     * @return The aggregate id and its new version
     * @throws VersionConflictException if the versions don't follow the persisted history
     * @throws EventStoreException      with kind {@link ErrorKind#SERIALIZATION_ERROR} if {@code events} is empty or mixes aggregates
     */
    WriteResult save(List<Event> events);
}
