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

class Counter extends AbstractAggregate {
    static final String STARTED = "CounterStarted";
    static final String INCREASED = "CounterIncreased";

    private String name;
    private int value;

    Counter(String id) {
        super(id);
    }

    void start(String name) {
        if (this.name != null) {
            throw new DomainRuleViolationException(getId(), "Counter " + getId() + " is already started");
        }
        stage(newEvent(STARTED, new Started(name)));
    }

    void increase(int amount) {
        if (name == null) {
            throw new DomainRuleViolationException(getId(), "Counter " + getId() + " is not started");
        }
        stage(newEvent(INCREASED, new Increased(amount)));
    }

    @Override
    protected void when(Event event) {
        switch (event.getType()) {
            case STARTED:
                name = payloadOf(event, Started.class).name();
                break;
            case INCREASED:
                value += payloadOf(event, Increased.class).amount();
                break;
            default:
                throw new UnrecognizedEventTypeException(Counter.class.getSimpleName(), event.getType());
        }
    }

    String name() {
        return name;
    }

    int value() {
        return value;
    }

    record Started(String name) {
    }

    record Increased(int amount) {
    }
}
