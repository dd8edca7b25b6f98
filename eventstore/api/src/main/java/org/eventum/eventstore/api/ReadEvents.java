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
 * Read the history of a single aggregate.
 */
public interface ReadEvents {

    /**
     * @return All events of the aggregate ordered by version, or an empty list if the aggregate has no history.
     */
    List<Event> loadByAggregate(String aggregateId);

    /**
     * @return The events of the aggregate with a version less than or equal to {@code version}, ordered by version.
     */
    List<Event> loadByAggregateUpToVersion(String aggregateId, long version);
}
