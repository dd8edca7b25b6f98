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

package org.eventum.application.service;

import org.eventum.aggregate.Aggregate;
import org.eventum.eventstore.api.WriteResult;

import java.util.function.Consumer;

/**
 * Loads an aggregate, lets a command stage new events on it and saves them.
 *
 * @param <A> The type of aggregate
 */
public interface ApplicationService<A extends Aggregate> {

    /**
     * @param aggregateId The id of the aggregate, it's created empty if it has no history
     * @param command     Calls the business operations of the aggregate. It may be invoked more than once if the
     *                    write is retried, so it must not have side effects of its own.
     * @return The result of the write
     */
    WriteResult execute(String aggregateId, Consumer<A> command);
}
