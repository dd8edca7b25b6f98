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
 * An append-only event store with optimistic concurrency control, partitioned by aggregate id.
 * <p>
 * All operations are blocking. Native failures of the backing store are reported as {@link EventStoreException}s
 * whose {@link ErrorKind} callers can branch on. The store never retries by itself.
 */
public interface EventStore extends WriteEvents, ReadEvents, EventStoreQueries {
}
