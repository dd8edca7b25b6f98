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

package org.eventum.eventstore.eventstoredb.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.eventum.event.Event;
import org.eventum.event.MetadataValue;
import org.eventum.event.internal.MetadataJson;
import org.eventum.time.internal.RFC3339;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * EventStoreDB events only carry an id, a type, data and metadata. The structural fields of an {@link Event} are therefore
 * packed into the user metadata of the EventStoreDB event, next to the metadata of the event itself:
 * <pre>
 * {"type": "DiaryEntryCreated", "aggregate_id": "..", "version": 3, "timestamp": "2024-01-15T10:30:00.123Z", "correlation_id": ".."}
 * </pre>
 */
public class StructuralMetadataCodec {
    public static final String TYPE = "type";
    public static final String AGGREGATE_ID = "aggregate_id";
    public static final String VERSION = "version";
    public static final String TIMESTAMP = "timestamp";

    private static final Set<String> RESERVED_KEYS = Set.of(TYPE, AGGREGATE_ID, VERSION, TIMESTAMP);

    private StructuralMetadataCodec() {
    }

    /**
     * @throws IllegalArgumentException if the metadata of the event uses one of the structural keys
     */
    public static byte[] pack(Event event) {
        ObjectNode node = MetadataJson.newObjectNode();
        node.put(TYPE, event.getType());
        node.put(AGGREGATE_ID, event.getAggregateId());
        node.put(VERSION, event.getVersion());
        node.put(TIMESTAMP, RFC3339.format(event.getTimestamp()));
        for (Map.Entry<String, MetadataValue> entry : event.getMetadata().entrySet()) {
            if (RESERVED_KEYS.contains(entry.getKey())) {
                throw new IllegalArgumentException("Metadata key \"" + entry.getKey() + "\" is reserved");
            }
        }
        node.setAll(MetadataJson.toObjectNode(event.getMetadata()));
        return MetadataJson.writeBytes(node);
    }

    /**
     * Rebuild an event from what EventStoreDB returns. Structural fields missing from the user metadata fall back to
     * the values of EventStoreDB itself: the aggregate id is taken from the stream name, the version from the stream
     * revision and the timestamp from the created date.
     */
    public static Event unpack(String streamPrefix, String streamId, String eventId, String eventType, byte[] data,
                               byte @Nullable [] userMetadata, long revision, Instant created) {
        Map<String, MetadataValue> metadata = new LinkedHashMap<>();
        String aggregateId = null;
        Long version = null;
        Instant timestamp = null;
        if (userMetadata != null && userMetadata.length > 0) {
            JsonNode node = MetadataJson.readTree(new String(userMetadata, UTF_8));
            metadata.putAll(MetadataJson.fromJsonNode(withoutReservedKeys(node)));
            aggregateId = textOrNull(node.get(AGGREGATE_ID));
            JsonNode versionNode = node.get(VERSION);
            if (versionNode != null && versionNode.canConvertToLong()) {
                version = versionNode.longValue();
            }
            timestamp = parseTimestamp(textOrNull(node.get(TIMESTAMP)));
        }
        if (aggregateId == null) {
            aggregateId = aggregateIdFromStreamName(streamPrefix, streamId);
        }
        if (version == null) {
            version = revision + 1;
        }
        if (timestamp == null) {
            timestamp = created;
        }
        return new Event(eventId, eventType, aggregateId, version, timestamp, data, metadata);
    }

    public static String aggregateIdFromStreamName(String streamPrefix, String streamId) {
        String prefix = streamPrefix + "-";
        return streamId.startsWith(prefix) ? streamId.substring(prefix.length()) : streamId;
    }

    private static JsonNode withoutReservedKeys(JsonNode node) {
        if (!node.isObject()) {
            return node;
        }
        ObjectNode copy = ((ObjectNode) node).deepCopy();
        copy.remove(RESERVED_KEYS);
        return copy;
    }

    private static @Nullable String textOrNull(@Nullable JsonNode node) {
        return node == null || !node.isTextual() ? null : node.textValue();
    }

    private static @Nullable Instant parseTimestamp(@Nullable String timestamp) {
        if (timestamp == null) {
            return null;
        }
        try {
            return RFC3339.parse(timestamp);
        } catch (DateTimeParseException e) {
            // Falls back to the created date
            return null;
        }
    }
}
