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

import io.cloudevents.CloudEvent;
import io.cloudevents.CloudEventData;
import io.cloudevents.core.builder.CloudEventBuilder;
import io.cloudevents.core.format.EventFormat;
import io.cloudevents.core.provider.EventFormatProvider;
import io.cloudevents.jackson.JsonFormat;
import org.eventum.event.Event;
import org.eventum.event.MetadataValue;
import org.eventum.event.internal.MetadataJson;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.time.OffsetDateTime;
import java.util.Map;

import static java.time.ZoneOffset.UTC;
import static java.util.Objects.requireNonNull;

/**
 * An {@link EventSerializer} that writes an {@link Event} as a <a href="https://cloudevents.io">CloudEvent</a> in JSON format:
 * <ul>
 *     <li>{@code id}, {@code type} and {@code time} are taken from the event</li>
 *     <li>{@code source} is {@value #SOURCE}</li>
 *     <li>the payload is the data of the cloud event with content type {@value #CONTENT_TYPE}, i.e. it's written as {@code data_base64}</li>
 *     <li>aggregate id, version and metadata are written as the extensions {@value #AGGREGATE_ID}, {@value #AGGREGATE_VERSION} and {@value #EVENT_METADATA}</li>
 * </ul>
 */
@NullMarked
public class CloudEventEventSerializer implements EventSerializer {
    public static final String SOURCE = "urn:eventum:aggregate";
    public static final String CONTENT_TYPE = "application/octet-stream";
    public static final String AGGREGATE_ID = "aggregateid";
    public static final String AGGREGATE_VERSION = "aggregateversion";
    public static final String EVENT_METADATA = "eventmetadata";

    private static final URI SOURCE_URI = URI.create(SOURCE);

    private final EventFormat eventFormat;

    public CloudEventEventSerializer() {
        EventFormat format = EventFormatProvider.getInstance().resolveFormat(JsonFormat.CONTENT_TYPE);
        this.eventFormat = format == null ? new JsonFormat() : format;
    }

    @Override
    public byte[] serialize(Event event) {
        requireNonNull(event, Event.class.getSimpleName() + " cannot be null");
        CloudEvent cloudEvent = CloudEventBuilder.v1()
                .withId(event.getId())
                .withSource(SOURCE_URI)
                .withType(event.getType())
                .withTime(OffsetDateTime.ofInstant(event.getTimestamp(), UTC))
                .withDataContentType(CONTENT_TYPE)
                .withData(event.getPayload())
                .withExtension(AGGREGATE_ID, event.getAggregateId())
                .withExtension(AGGREGATE_VERSION, event.getVersion())
                .withExtension(EVENT_METADATA, MetadataJson.toJson(event.getMetadata()))
                .build();
        try {
            return eventFormat.serialize(cloudEvent);
        } catch (RuntimeException e) {
            throw new EventSerializationException("Failed to serialize event " + event.getId(), e);
        }
    }

    @Override
    public Event deserialize(byte[] bytes) {
        requireNonNull(bytes, "Bytes cannot be null");
        final CloudEvent cloudEvent;
        try {
            cloudEvent = eventFormat.deserialize(bytes);
        } catch (RuntimeException e) {
            throw new EventSerializationException("Failed to deserialize cloud event: " + e.getMessage(), e);
        }

        String aggregateId = stringExtension(cloudEvent, AGGREGATE_ID);
        long version = versionOf(cloudEvent);
        OffsetDateTime time = cloudEvent.getTime();
        if (time == null) {
            throw new EventSerializationException("Cloud event " + cloudEvent.getId() + " has no time");
        }
        CloudEventData data = cloudEvent.getData();
        byte[] payload = data == null ? new byte[0] : data.toBytes();
        try {
            Map<String, MetadataValue> metadata = MetadataJson.fromJson(stringExtension(cloudEvent, EVENT_METADATA));
            return new Event(cloudEvent.getId(), cloudEvent.getType(), aggregateId, version, time.toInstant(), payload, metadata);
        } catch (RuntimeException e) {
            throw new EventSerializationException("Cloud event " + cloudEvent.getId() + " is not a valid event: " + e.getMessage(), e);
        }
    }

    private static String stringExtension(CloudEvent cloudEvent, String name) {
        Object value = cloudEvent.getExtension(name);
        if (value == null) {
            throw new EventSerializationException("Cloud event " + cloudEvent.getId() + " is missing extension " + name);
        }
        return value.toString();
    }

    private static long versionOf(CloudEvent cloudEvent) {
        @Nullable Object value = cloudEvent.getExtension(AGGREGATE_VERSION);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(stringExtension(cloudEvent, AGGREGATE_VERSION));
        } catch (NumberFormatException e) {
            throw new EventSerializationException("Cloud event " + cloudEvent.getId() + " has an invalid " + AGGREGATE_VERSION + ": " + value, e);
        }
    }
}
