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

package org.eventum.eventstore.api;

import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * The result of a successful {@link WriteEvents#save(java.util.List)}.
 */
public class WriteResult {

    private final String aggregateId;
    private final long version;

    public WriteResult(String aggregateId, long version) {
        this.aggregateId = requireNonNull(aggregateId, "Aggregate id cannot be null");
        this.version = version;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    /**
     * @return The version of the last persisted event of the aggregate after the write
     */
    public long getVersion() {
        return version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WriteResult)) return false;
        WriteResult that = (WriteResult) o;
        return version == that.version && Objects.equals(aggregateId, that.aggregateId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, version);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", WriteResult.class.getSimpleName() + "[", "]")
                .add("aggregateId='" + aggregateId + "'")
                .add("version=" + version)
                .toString();
    }
}
