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

import java.util.Objects;

/**
 * Thrown when an aggregate is asked to apply an event type that it doesn't produce.
 */
public class UnrecognizedEventTypeException extends RuntimeException {
    public final String aggregateKind;
    public final String eventType;

    public UnrecognizedEventTypeException(String aggregateKind, String eventType) {
        super(String.format("%s doesn't recognize event type \"%s\"", aggregateKind, eventType));
        this.aggregateKind = aggregateKind;
        this.eventType = eventType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnrecognizedEventTypeException)) return false;
        UnrecognizedEventTypeException that = (UnrecognizedEventTypeException) o;
        return Objects.equals(aggregateKind, that.aggregateKind) && Objects.equals(eventType, that.eventType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateKind, eventType);
    }
}
