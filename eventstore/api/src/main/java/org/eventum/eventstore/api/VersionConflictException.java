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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when the events passed to {@link WriteEvents#save(java.util.List)} don't immediately follow the persisted
 * history of the aggregate, typically because another writer saved events for the same aggregate in between.
 * The caller should reload the aggregate, re-apply its business logic and save again.
 */
@NullMarked
public class VersionConflictException extends EventStoreException {
    /**
     * The version that the first event of the group was expected to have, i.e. the persisted max version + 1.
     * {@code -1} if unknown.
     */
    public final long expectedVersion;
    /**
     * The version of the first event in the rejected group.
     */
    public final long actualVersion;

    public VersionConflictException(String operation, String aggregateId, long expectedVersion, long actualVersion) {
        this(operation, aggregateId, expectedVersion, actualVersion, null);
    }

    public VersionConflictException(String operation, String aggregateId, long expectedVersion, long actualVersion, @Nullable Throwable cause) {
        super(ErrorKind.VERSION_CONFLICT, operation, aggregateId, message(aggregateId, expectedVersion, actualVersion), cause);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public static boolean isInstance(Throwable throwable) {
        return throwable instanceof VersionConflictException;
    }

    private static String message(String aggregateId, long expectedVersion, long actualVersion) {
        if (expectedVersion < 0) {
            return String.format("Version conflict for aggregate %s: version %d does not follow the persisted history.", aggregateId, actualVersion);
        }
        return String.format("Version conflict for aggregate %s: expected version %d but was %d.", aggregateId, expectedVersion, actualVersion);
    }
}
