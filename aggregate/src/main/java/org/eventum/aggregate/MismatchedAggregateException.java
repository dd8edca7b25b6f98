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

/**
 * Thrown when an event is applied to, or staged on, an aggregate other than the one that owns it.
 */
public class MismatchedAggregateException extends RuntimeException {
    public final String aggregateId;
    public final String eventAggregateId;
    public final String eventId;

    public MismatchedAggregateException(String aggregateId, String eventAggregateId, String eventId) {
        super(String.format("Event %s belongs to aggregate %s and cannot be applied to aggregate %s", eventId, eventAggregateId, aggregateId));
        this.aggregateId = aggregateId;
        this.eventAggregateId = eventAggregateId;
        this.eventId = eventId;
    }
}
