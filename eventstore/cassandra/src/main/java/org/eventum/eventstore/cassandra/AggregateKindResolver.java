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

/**
 * Resolves the kind of aggregate (e.g. {@code diary_entry}) from an aggregate id. The kind is the first component of the
 * partition key, so it must always resolve to the same value for the same aggregate id.
 */
@FunctionalInterface
public interface AggregateKindResolver {
    String DEFAULT_KIND = "default";
    AggregateKindResolver DEFAULT = __ -> DEFAULT_KIND;

    String resolve(String aggregateId);

    /**
     * @return A resolver that puts every aggregate under the kind {@value #DEFAULT_KIND}
     */
    static AggregateKindResolver constant() {
        return DEFAULT;
    }

    static AggregateKindResolver constant(String kind) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind cannot be blank");
        }
        return __ -> kind;
    }
}
