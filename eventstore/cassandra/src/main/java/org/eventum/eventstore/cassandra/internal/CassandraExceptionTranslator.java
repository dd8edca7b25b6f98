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

package org.eventum.eventstore.cassandra.internal;

import com.datastax.oss.driver.api.core.AllNodesFailedException;
import com.datastax.oss.driver.api.core.DriverTimeoutException;
import com.datastax.oss.driver.api.core.connection.ClosedConnectionException;
import com.datastax.oss.driver.api.core.type.codec.CodecNotFoundException;
import org.eventum.event.internal.MetadataJson.MalformedMetadataException;
import org.eventum.eventstore.api.ErrorKind;
import org.eventum.eventstore.api.EventStoreException;
import org.jspecify.annotations.Nullable;

/**
 * Translates exceptions thrown by the DataStax driver into {@link EventStoreException}s. Anything that isn't a connection
 * or input problem is a storage error.
 */
public class CassandraExceptionTranslator {

    private CassandraExceptionTranslator() {
    }

    public static EventStoreException translateException(String operation, @Nullable String aggregateId, Throwable e) {
        if (e instanceof EventStoreException) {
            return (EventStoreException) e;
        }
        ErrorKind kind = errorKindOf(e);
        String message = String.format("Cassandra failed to %s%s: %s", operation, aggregateId == null ? "" : " for aggregate " + aggregateId, e.getMessage());
        return new EventStoreException(kind, operation, aggregateId, message, e);
    }

    static ErrorKind errorKindOf(Throwable e) {
        final ErrorKind kind;
        if (e instanceof AllNodesFailedException || e instanceof DriverTimeoutException || e instanceof ClosedConnectionException) {
            kind = ErrorKind.CONNECTION_FAILURE;
        } else if (e instanceof CodecNotFoundException || e instanceof MalformedMetadataException || e instanceof IllegalArgumentException) {
            kind = ErrorKind.SERIALIZATION_ERROR;
        } else {
            kind = ErrorKind.STORAGE_ERROR;
        }
        return kind;
    }
}
