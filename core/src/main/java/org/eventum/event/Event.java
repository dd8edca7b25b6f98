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

package org.eventum.event;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.UUID;

import static java.time.temporal.ChronoUnit.MILLIS;
import static java.util.Objects.requireNonNull;

/**
 * An immutable record of one state transition of an aggregate. Events of one aggregate are versioned
 * {@code 1, 2, ..., N} without gaps. The {@code payload} is opaque to the event store, only the aggregate
 * that owns the {@code type} knows how to interpret it.
 */
@NullMarked
public final class Event {
    private final String id;
    private final String type;
    private final String aggregateId;
    private final long version;
    private final Instant timestamp;
    private final byte[] payload;
    private final Map<String, MetadataValue> metadata;

    /**
     * Rebuild an event from all of its fields, typically when reading it back from a backing store.
     *
     * @param id          The globally unique id of the event
     * @param type        The type of the event, e.g. {@code DiaryEntryCreated}
     * @param aggregateId The id of the aggregate that owns the event
     * @param version     The version of the event in the aggregate's history, starting at 1
     * @param timestamp   The time when the event was created (not when it was persisted)
     * @param payload     The serialized body of the event
     * @param metadata    Metadata carried alongside the payload, may be {@code null}
     */
    public Event(String id, String type, String aggregateId, long version, Instant timestamp, byte[] payload, @Nullable Map<String, MetadataValue> metadata) {
        requireNonNull(id, "Event id cannot be null");
        requireNonNull(type, "Event type cannot be null");
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        requireNonNull(timestamp, "Timestamp cannot be null");
        requireNonNull(payload, "Payload cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Event id cannot be blank");
        }
        if (type.isBlank()) {
            throw new IllegalArgumentException("Event type cannot be blank");
        }
        if (aggregateId.isBlank()) {
            throw new IllegalArgumentException("Aggregate id cannot be blank");
        }
        if (version < 1) {
            throw new IllegalArgumentException("Event version cannot be less than 1 but was " + version);
        }
        this.id = id;
        this.type = type;
        this.aggregateId = aggregateId;
        this.version = version;
        this.timestamp = timestamp;
        this.payload = payload.clone();
        this.metadata = metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Create a new event with a random id, stamped with the current time.
     */
    public static Event create(String type, String aggregateId, long version, byte[] payload, @Nullable Map<String, MetadataValue> metadata) {
        return new Event(UUID.randomUUID().toString(), type, aggregateId, version, Instant.now().truncatedTo(MILLIS), payload, metadata);
    }

    /**
     * Create a new event without metadata.
     *
     * @see #create(String, String, long, byte[], Map)
     */
    public static Event create(String type, String aggregateId, long version, byte[] payload) {
        return create(type, aggregateId, version, payload, null);
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getVersion() {
        return version;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return A copy of the payload bytes
     */
    public byte[] getPayload() {
        return payload.clone();
    }

    public Map<String, MetadataValue> getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Event)) return false;
        Event event = (Event) o;
        return version == event.version && id.equals(event.id) && type.equals(event.type) && aggregateId.equals(event.aggregateId)
                && timestamp.equals(event.timestamp) && Arrays.equals(payload, event.payload) && metadata.equals(event.metadata);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, type, aggregateId, version, timestamp, metadata);
        result = 31 * result + Arrays.hashCode(payload);
        return result;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", Event.class.getSimpleName() + "[", "]")
                .add("id='" + id + "'")
                .add("type='" + type + "'")
                .add("aggregateId='" + aggregateId + "'")
                .add("version=" + version)
                .add("timestamp=" + timestamp)
                .add("payload=" + new String(payload, StandardCharsets.UTF_8))
                .add("metadata=" + metadata)
                .toString();
    }
}
