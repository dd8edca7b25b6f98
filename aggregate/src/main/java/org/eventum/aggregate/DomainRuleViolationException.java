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

package org.eventum.aggregate;

/**
 * Thrown by a business operation whose precondition doesn't hold for the current state of the aggregate,
 * for example when creating something that already exists. No event is staged.
 */
public class DomainRuleViolationException extends RuntimeException {
    public final String aggregateId;

    public DomainRuleViolationException(String aggregateId, String message) {
        super(message);
        this.aggregateId = aggregateId;
    }
}
