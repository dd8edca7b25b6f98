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

package org.eventum.event.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.eventum.event.MetadataValue;
import org.eventum.event.MetadataValue.BooleanValue;
import org.eventum.event.MetadataValue.MapValue;
import org.eventum.event.MetadataValue.NumberValue;
import org.eventum.event.MetadataValue.StringValue;

import java.io.IOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;

import static java.util.Objects.requireNonNull;

/**
 * Converts event metadata to and from JSON. Shared by the event store implementations and the serializers, don't use it directly.
 */
public class MetadataJson {

    private static final JsonNodeFactory NODE_FACTORY = JsonNodeFactory.withExactBigDecimals(true);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setNodeFactory(NODE_FACTORY)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private MetadataJson() {
    }

    public static String toJson(Map<String, MetadataValue> metadata) {
        try {
            return OBJECT_MAPPER.writeValueAsString(toObjectNode(metadata));
        } catch (JsonProcessingException e) {
            throw new MalformedMetadataException("Failed to write metadata as JSON", e);
        }
    }

    public static Map<String, MetadataValue> fromJson(String json) {
        requireNonNull(json, "JSON cannot be null");
        if (json.isBlank()) {
            return Collections.emptyMap();
        }
        return fromJsonNode(readTree(json));
    }

    public static Map<String, MetadataValue> fromJson(byte[] json) {
        requireNonNull(json, "JSON cannot be null");
        if (json.length == 0) {
            return Collections.emptyMap();
        }
        try {
            return fromJsonNode(OBJECT_MAPPER.readTree(json));
        } catch (IOException e) {
            throw new MalformedMetadataException("Metadata is not valid JSON", e);
        }
    }

    public static JsonNode readTree(String json) {
        try {
            return OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedMetadataException("Metadata is not valid JSON", e);
        }
    }

    public static byte[] writeBytes(JsonNode node) {
        try {
            return OBJECT_MAPPER.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new MalformedMetadataException("Failed to write metadata as JSON", e);
        }
    }

    public static ObjectNode newObjectNode() {
        return NODE_FACTORY.objectNode();
    }

    public static ObjectNode toObjectNode(Map<String, MetadataValue> metadata) {
        requireNonNull(metadata, "Metadata cannot be null");
        ObjectNode node = NODE_FACTORY.objectNode();
        metadata.forEach((key, value) -> node.set(key, toJsonNode(value)));
        return node;
    }

    /**
     * Convert a JSON object into metadata. {@code null} members are skipped and arrays are rejected since they
     * cannot be represented as a {@link MetadataValue}.
     */
    public static Map<String, MetadataValue> fromJsonNode(JsonNode node) {
        requireNonNull(node, "JSON node cannot be null");
        if (node.isNull() || node.isMissingNode()) {
            return Collections.emptyMap();
        }
        if (!node.isObject()) {
            throw new MalformedMetadataException("Metadata must be a JSON object but was " + node.getNodeType());
        }
        Map<String, MetadataValue> metadata = new LinkedHashMap<>();
        Iterator<Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (!value.isNull()) {
                metadata.put(field.getKey(), toMetadataValue(field.getKey(), value));
            }
        }
        return metadata;
    }

    private static JsonNode toJsonNode(MetadataValue value) {
        final JsonNode node;
        if (value instanceof StringValue stringValue) {
            node = NODE_FACTORY.textNode(stringValue.value());
        } else if (value instanceof NumberValue numberValue) {
            node = NODE_FACTORY.numberNode(numberValue.value());
        } else if (value instanceof BooleanValue booleanValue) {
            node = NODE_FACTORY.booleanNode(booleanValue.value());
        } else if (value instanceof MapValue mapValue) {
            node = toObjectNode(mapValue.value());
        } else {
            throw new IllegalStateException("Internal error: Unrecognized metadata value " + value);
        }
        return node;
    }

    private static MetadataValue toMetadataValue(String key, JsonNode node) {
        final MetadataValue value;
        if (node.isTextual()) {
            value = MetadataValue.of(node.textValue());
        } else if (node.isNumber()) {
            value = MetadataValue.of(node.decimalValue());
        } else if (node.isBoolean()) {
            value = MetadataValue.of(node.booleanValue());
        } else if (node.isObject()) {
            value = MetadataValue.of(fromJsonNode(node));
        } else {
            throw new MalformedMetadataException("Metadata value for key \"" + key + "\" has unsupported type " + node.getNodeType());
        }
        return value;
    }

    /**
     * Thrown when metadata cannot be converted to or from JSON.
     */
    public static class MalformedMetadataException extends RuntimeException {
        public MalformedMetadataException(String message) {
            super(message);
        }

        public MalformedMetadataException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
