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

/**
 * The kind of failure of an {@link EventStore} operation. Every native failure of a backing store is mapped to one
 * of these kinds so that callers never need to inspect backend specific exceptions.
 */
public enum ErrorKind {
    /**
     * The backing store is unreachable, or the caller gave up waiting for it (interrupted or timed out).
     */
    CONNECTION_FAILURE,
    /**
     * The requested aggregate has no history. History reads return an empty list instead, this kind is used by operations that require existence.
     */
    EVENT_NOT_FOUND,
    /**
     * The events don't follow the persisted history of the aggregate. Reload the aggregate and try again.
     */
    VERSION_CONFLICT,
    /**
     * Malformed input, e.g. an invalid id, date-time or payload. Not retryable without correcting the input.
     */
    SERIALIZATION_ERROR,
    /**
     * The backing store failed to process an otherwise well-formed request.
     */
    STORAGE_ERROR
}
