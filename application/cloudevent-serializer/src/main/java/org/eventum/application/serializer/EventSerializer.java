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

package org.eventum.application.serializer;

import org.eventum.event.Event;

/**
 * Converts an {@link Event} to and from bytes, for example to put it on a message bus. Every field of the event,
 * including payload bytes and metadata, survives a round trip.
 */
public interface EventSerializer {

    /**
     * @throws EventSerializationException if the event cannot be serialized
     */
    byte[] serialize(Event event);

    /**
     * @throws EventSerializationException if the bytes don't represent an event
     */
    Event deserialize(byte[] bytes);
}
