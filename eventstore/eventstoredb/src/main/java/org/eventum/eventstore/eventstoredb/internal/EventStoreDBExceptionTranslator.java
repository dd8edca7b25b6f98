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

import com.eventstore.dbclient.ConnectionShutdownException;
import org.eventum.event.internal.MetadataJson.MalformedMetadataException;
import org.eventum.eventstore.api.ErrorKind;
import org.eventum.eventstore.api.EventStoreException;
import org.jspecify.annotations.Nullable;

import java.net.ConnectException;
import java.net.UnknownHostException;

/**
 * Translates exceptions thrown by the EventStoreDB client into {@link EventStoreException}s. Version conflicts are
 * handled where the append is made since they need the versions of the rejected events.
 */
public class EventStoreDBExceptionTranslator {

    private EventStoreDBExceptionTranslator() {
    }

    public static EventStoreException translateException(String operation, @Nullable String aggregateId, Throwable e) {
        if (e instanceof EventStoreException) {
            return (EventStoreException) e;
        }
        ErrorKind kind = errorKindOf(e);
        String message = String.format("EventStoreDB failed to %s%s: %s", operation, aggregateId == null ? "" : " for aggregate " + aggregateId, e.getMessage());
        return new EventStoreException(kind, operation, aggregateId, message, e);
    }

    static ErrorKind errorKindOf(Throwable e) {
        if (e instanceof MalformedMetadataException || e instanceof IllegalArgumentException) {
            return ErrorKind.SERIALIZATION_ERROR;
        }
        Throwable current = e;
        while (current != null) {
            if (current instanceof ConnectionShutdownException || current instanceof ConnectException || current instanceof UnknownHostException) {
                return ErrorKind.CONNECTION_FAILURE;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return ErrorKind.STORAGE_ERROR;
    }
}
