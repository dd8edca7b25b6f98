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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventum.event.Event;

import java.io.IOException;

import static java.util.Objects.requireNonNull;

/**
 * Encodes event payloads as JSON. The event store never looks inside a payload, only the aggregate that owns the event type does.
 */
public final class JsonPayloads {
    private static final ObjectMapper objectMapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonPayloads() {
    }

    public static byte[] toJson(Object payload) {
        requireNonNull(payload, "Payload cannot be null");
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new PayloadConversionException("Failed to encode payload of type " + payload.getClass().getName(), e);
        }
    }

    public static <T> T fromJson(Event event, Class<T> type) {
        requireNonNull(event, Event.class.getSimpleName() + " cannot be null");
        requireNonNull(type, "Type cannot be null");
        try {
            return objectMapper.readValue(event.getPayload(), type);
        } catch (IOException e) {
            throw new PayloadConversionException(String.format("Failed to decode payload of event %s (%s) as %s", event.getId(), event.getType(), type.getName()), e);
        }
    }
}
