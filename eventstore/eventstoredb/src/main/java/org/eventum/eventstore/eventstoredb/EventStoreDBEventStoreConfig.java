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

package org.eventum.eventstore.eventstoredb;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Configuration for the {@link EventStoreDBEventStore}
 */
@NullMarked
public class EventStoreDBEventStoreConfig {
    public static final String DEFAULT_STREAM_PREFIX = "eventum";
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

    /**
     * Streams are named {@code streamPrefix + "-" + aggregateId}
     */
    public final String streamPrefix;
    public final Duration requestTimeout;

    public EventStoreDBEventStoreConfig() {
        this(DEFAULT_STREAM_PREFIX, DEFAULT_REQUEST_TIMEOUT);
    }

    private EventStoreDBEventStoreConfig(String streamPrefix, Duration requestTimeout) {
        requireNonNull(streamPrefix, "Stream prefix cannot be null");
        requireNonNull(requestTimeout, "Request timeout cannot be null");
        if (streamPrefix.isBlank() || streamPrefix.startsWith("$")) {
            throw new IllegalArgumentException("Stream prefix cannot be blank or start with $");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("Request timeout must be positive");
        }
        this.streamPrefix = streamPrefix;
        this.requestTimeout = requestTimeout;
    }

    public String streamNameOf(String aggregateId) {
        return streamPrefix + "-" + aggregateId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventStoreDBEventStoreConfig)) return false;
        EventStoreDBEventStoreConfig that = (EventStoreDBEventStoreConfig) o;
        return streamPrefix.equals(that.streamPrefix) && requestTimeout.equals(that.requestTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamPrefix, requestTimeout);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", EventStoreDBEventStoreConfig.class.getSimpleName() + "[", "]")
                .add("streamPrefix='" + streamPrefix + "'")
                .add("requestTimeout=" + requestTimeout)
                .toString();
    }

    @NullUnmarked
    public static final class Builder {
        private String streamPrefix = DEFAULT_STREAM_PREFIX;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

        @NullMarked
        public Builder streamPrefix(String streamPrefix) {
            this.streamPrefix = streamPrefix;
            return this;
        }

        /**
         * @param requestTimeout The max time to wait for each request to EventStoreDB before failing with a connection failure
         * @return The builder instance
         */
        @NullMarked
        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        @NullMarked
        public EventStoreDBEventStoreConfig build() {
            return new EventStoreDBEventStoreConfig(streamPrefix, requestTimeout);
        }
    }
}
