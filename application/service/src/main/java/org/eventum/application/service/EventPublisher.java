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

import org.eventum.event.Event;

/**
 * Hands committed events to a message bus. Delivery guarantees are up to the bus, events of one aggregate are
 * published in version order.
 */
@FunctionalInterface
public interface EventPublisher {

    /**
     * @param topic The topic to publish to, {@code topicPrefix + "." + event type}
     * @param event The committed event
     */
    void publish(String topic, Event event);

    static String topicOf(String topicPrefix, Event event) {
        return topicPrefix + "." + event.getType();
    }
}
