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

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Builds the conventional metadata of an {@link Event}: correlation id, causation id, an optional user id and
 * any number of extra entries.
 * <p>
 * <pre>
 * Map&lt;String, MetadataValue&gt; metadata = EventMetadata.correlatedBy(correlationId)
 *                 .causedBy(commandId)
 *                 .userId("johan")
 *                 .with("source", MetadataValue.of("mobile"))
 *                 .toMap();
 * </pre>
 */
@NullMarked
public class EventMetadata {
    public static final String CORRELATION_ID = "correlation_id";
    public static final String CAUSATION_ID = "causation_id";
    public static final String USER_ID = "user_id";

    private final String correlationId;
    private @Nullable String causationId;
    private @Nullable String userId;
    private final Map<String, MetadataValue> extra = new LinkedHashMap<>();

    private EventMetadata(String correlationId) {
        this.correlationId = requireNonNull(correlationId, "Correlation id cannot be null");
    }

    public static EventMetadata correlatedBy(String correlationId) {
        return new EventMetadata(correlationId);
    }

    public EventMetadata causedBy(String causationId) {
        this.causationId = requireNonNull(causationId, "Causation id cannot be null");
        return this;
    }

    public EventMetadata userId(String userId) {
        this.userId = requireNonNull(userId, "User id cannot be null");
        return this;
    }

    public EventMetadata with(String key, MetadataValue value) {
        requireNonNull(key, "Key cannot be null");
        requireNonNull(value, "Value cannot be null");
        extra.put(key, value);
        return this;
    }

    public Map<String, MetadataValue> toMap() {
        Map<String, MetadataValue> result = new LinkedHashMap<>();
        result.put(CORRELATION_ID, MetadataValue.of(correlationId));
        // A causation id defaults to the correlation id for the first event in a chain
        result.put(CAUSATION_ID, MetadataValue.of(causationId == null ? correlationId : causationId));
        if (userId != null && !userId.isEmpty()) {
            result.put(USER_ID, MetadataValue.of(userId));
        }
        result.putAll(extra);
        return result;
    }
}
