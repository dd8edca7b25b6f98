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

package org.eventum.eventstore.cassandra;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Configuration for the {@link CassandraEventStore}
 */
@NullMarked
public class CassandraEventStoreConfig {
    public static final String DEFAULT_KEYSPACE = "eventum";
    public static final String DEFAULT_TABLE = "events";
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

    public final String keyspace;
    public final String table;
    public final int replicationFactor;
    public final boolean initializeSchema;
    public final Duration requestTimeout;
    public final AggregateKindResolver aggregateKindResolver;

    /**
     * Create a config with default settings for the given keyspace. The schema is created if it doesn't exist.
     */
    public CassandraEventStoreConfig(String keyspace) {
        this(keyspace, DEFAULT_TABLE, 1, true, DEFAULT_REQUEST_TIMEOUT, AggregateKindResolver.constant());
    }

    private CassandraEventStoreConfig(String keyspace, String table, int replicationFactor, boolean initializeSchema, Duration requestTimeout, AggregateKindResolver aggregateKindResolver) {
        requireNonNull(keyspace, "Keyspace cannot be null");
        requireNonNull(table, "Table cannot be null");
        requireNonNull(requestTimeout, "Request timeout cannot be null");
        requireNonNull(aggregateKindResolver, AggregateKindResolver.class.getSimpleName() + " cannot be null");
        if (!isIdentifier(keyspace)) {
            throw new IllegalArgumentException("Invalid keyspace name: " + keyspace);
        }
        if (!isIdentifier(table)) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        if (replicationFactor < 1) {
            throw new IllegalArgumentException("Replication factor must be greater than or equal to 1");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("Request timeout must be positive");
        }
        this.keyspace = keyspace;
        this.table = table;
        this.replicationFactor = replicationFactor;
        this.initializeSchema = initializeSchema;
        this.requestTimeout = requestTimeout;
        this.aggregateKindResolver = aggregateKindResolver;
    }

    private static boolean isIdentifier(String name) {
        return name.matches("[a-zA-Z][a-zA-Z0-9_]{0,47}");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CassandraEventStoreConfig)) return false;
        CassandraEventStoreConfig that = (CassandraEventStoreConfig) o;
        return replicationFactor == that.replicationFactor && initializeSchema == that.initializeSchema && keyspace.equals(that.keyspace)
                && table.equals(that.table) && requestTimeout.equals(that.requestTimeout) && aggregateKindResolver.equals(that.aggregateKindResolver);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyspace, table, replicationFactor, initializeSchema, requestTimeout, aggregateKindResolver);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", CassandraEventStoreConfig.class.getSimpleName() + "[", "]")
                .add("keyspace='" + keyspace + "'")
                .add("table='" + table + "'")
                .add("replicationFactor=" + replicationFactor)
                .add("initializeSchema=" + initializeSchema)
                .add("requestTimeout=" + requestTimeout)
                .add("aggregateKindResolver=" + aggregateKindResolver)
                .toString();
    }

    @NullUnmarked
    public static final class Builder {
        private String keyspace = DEFAULT_KEYSPACE;
        private String table = DEFAULT_TABLE;
        private int replicationFactor = 1;
        private boolean initializeSchema = true;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private AggregateKindResolver aggregateKindResolver = AggregateKindResolver.constant();

        @NullMarked
        public Builder keyspace(String keyspace) {
            this.keyspace = keyspace;
            return this;
        }

        @NullMarked
        public Builder table(String table) {
            this.table = table;
            return this;
        }

        /**
         * @param replicationFactor The replication factor used when creating the keyspace (SimpleStrategy)
         * @return The builder instance
         */
        @NullMarked
        public Builder replicationFactor(int replicationFactor) {
            this.replicationFactor = replicationFactor;
            return this;
        }

        /**
         * @param initializeSchema {@code true} if the keyspace, table and indexes should be created if they don't exist. Default is {@code true}.
         * @return The builder instance
         */
        @NullMarked
        public Builder initializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
            return this;
        }

        /**
         * @param requestTimeout The max time to wait for each request to Cassandra before failing with a connection failure
         * @return The builder instance
         */
        @NullMarked
        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        @NullMarked
        public Builder aggregateKindResolver(AggregateKindResolver aggregateKindResolver) {
            this.aggregateKindResolver = aggregateKindResolver;
            return this;
        }

        @NullMarked
        public CassandraEventStoreConfig build() {
            return new CassandraEventStoreConfig(keyspace, table, replicationFactor, initializeSchema, requestTimeout, aggregateKindResolver);
        }
    }
}
