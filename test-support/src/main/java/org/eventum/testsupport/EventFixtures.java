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

package org.eventum.testsupport;

import org.eventum.event.Event;
import org.eventum.event.EventMetadata;
import org.eventum.event.MetadataValue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.time.temporal.ChronoUnit.MILLIS;

/**
 * Events used by the event store tests. Aggregate ids are UUIDs since some backing stores require it.
 */
public class EventFixtures {

    private EventFixtures() {
    }

    public static String newAggregateId() {
        return UUID.randomUUID().toString();
    }

    /**
     * @return A type that no other test uses, so that queries by type are isolated from other tests sharing the same store
     */
    public static String uniqueType(String prefix) {
        return prefix + UUID.randomUUID().toString().replace("-", "");
    }

    public static Event event(String aggregateId, long version) {
        return event(aggregateId, version, "SomethingHappened");
    }

    public static Event event(String aggregateId, long version, String type) {
        return Event.create(type, aggregateId, version, payload(type, version), EventMetadata.correlatedBy(UUID.randomUUID().toString()).toMap());
    }

    public static Event event(String aggregateId, long version, String type, Instant timestamp) {
        return new Event(UUID.randomUUID().toString(), type, aggregateId, version, timestamp.truncatedTo(MILLIS), payload(type, version), null);
    }

    public static Event event(String aggregateId, long version, String type, byte[] payload, Map<String, MetadataValue> metadata) {
        return Event.create(type, aggregateId, version, payload, metadata);
    }

    /**
     * @return {@code count} events for the aggregate with contiguous versions starting at {@code firstVersion}
     */
    public static List<Event> events(String aggregateId, long firstVersion, int count) {
        List<Event> events = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            events.add(event(aggregateId, firstVersion + i));
        }
        return events;
    }

    private static byte[] payload(String type, long version) {
        return ("{\"type\":\"" + type + "\",\"n\":" + version + "}").getBytes(UTF_8);
    }
}
