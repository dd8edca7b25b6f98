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

import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Thrown by an {@link EventStore} when an operation fails. Branch on {@link #kind} rather than on the cause.
 */
@NullMarked
public class EventStoreException extends RuntimeException {
    public final ErrorKind kind;
    public final String operation;
    public final @Nullable String aggregateId;

    public EventStoreException(ErrorKind kind, String operation, @Nullable String aggregateId, String message) {
        this(kind, operation, aggregateId, message, null);
    }

    public EventStoreException(ErrorKind kind, String operation, @Nullable String aggregateId, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.kind = requireNonNull(kind, ErrorKind.class.getSimpleName() + " cannot be null");
        this.operation = requireNonNull(operation, "Operation cannot be null");
        this.aggregateId = aggregateId;
    }

    public boolean is(ErrorKind kind) {
        return this.kind == kind;
    }

    /**
     * @return {@code true} if {@code throwable} is an {@code EventStoreException} of the given {@code kind}
     */
    public static boolean isKind(Throwable throwable, ErrorKind kind) {
        return throwable instanceof EventStoreException && ((EventStoreException) throwable).kind == kind;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", getClass().getSimpleName() + "[", "]")
                .add("kind=" + kind)
                .add("operation='" + operation + "'")
                .add("aggregateId='" + aggregateId + "'")
                .add("message=" + getMessage())
                .toString();
    }
}
