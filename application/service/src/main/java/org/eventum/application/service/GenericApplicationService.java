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
import org.eventum.event.Event;
import org.eventum.eventstore.api.VersionConflictException;
import org.eventum.eventstore.api.WriteResult;
import org.eventum.retry.RetryStrategy;
import org.eventum.retry.RetryStrategy.Retry;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * An application service that works in many scenarios. The load, command and save steps are executed by a
 * {@link RetryStrategy} so that a {@link VersionConflictException} makes the command run again against fresh state.
 * Committed events are handed to an optional {@link EventPublisher} once the write has succeeded. A failing publisher
 * doesn't undo the write.
 *
 * @param <A> The type of aggregate
 */
@NullMarked
public class GenericApplicationService<A extends Aggregate> implements ApplicationService<A> {
    private static final Logger log = LoggerFactory.getLogger(GenericApplicationService.class);

    private final AggregateRepository<A> repository;
    private final RetryStrategy retryStrategy;
    private final @Nullable EventPublisher eventPublisher;
    private final String topicPrefix;

    /**
     * Create a GenericApplicationService that uses the {@link #defaultRetryStrategy()} and doesn't publish events.
     */
    public GenericApplicationService(AggregateRepository<A> repository) {
        this(repository, defaultRetryStrategy());
    }

    public GenericApplicationService(AggregateRepository<A> repository, RetryStrategy retryStrategy) {
        this(repository, retryStrategy, null, "");
    }

    /**
     * @param repository     The repository to load and save aggregates with
     * @param retryStrategy  The retry strategy to use
     * @param eventPublisher Receives every committed event, or {@code null} to not publish events
     * @param topicPrefix    Events are published to {@code topicPrefix + "." + event type}
     */
    public GenericApplicationService(AggregateRepository<A> repository, RetryStrategy retryStrategy, @Nullable EventPublisher eventPublisher, String topicPrefix) {
        requireNonNull(repository, AggregateRepository.class.getSimpleName() + " cannot be null");
        requireNonNull(retryStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
        requireNonNull(topicPrefix, "Topic prefix cannot be null");
        if (eventPublisher != null && topicPrefix.isBlank()) {
            throw new IllegalArgumentException("Topic prefix cannot be blank when an " + EventPublisher.class.getSimpleName() + " is defined");
        }
        this.repository = repository;
        this.retryStrategy = retryStrategy;
        this.eventPublisher = eventPublisher;
        this.topicPrefix = topicPrefix;
    }

    @Override
    public WriteResult execute(String aggregateId, Consumer<A> command) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        requireNonNull(command, "Command cannot be null");

        Committed committed = retryStrategy.execute(() -> {
            A aggregate = repository.loadOrCreate(aggregateId);
            command.accept(aggregate);
            List<Event> newEvents = aggregate.getUncommittedEvents();
            WriteResult writeResult = repository.save(aggregate);
            return new Committed(writeResult, newEvents);
        });

        if (eventPublisher != null) {
            for (Event event : committed.events) {
                eventPublisher.publish(EventPublisher.topicOf(topicPrefix, event), event);
            }
        }
        return committed.writeResult;
    }

    /**
     * @return A {@link RetryStrategy} with exponential backoff starting at 100 ms and going up to 2 seconds between attempts when a
     * {@link VersionConflictException} is caught. It gives up after 5 attempts, rethrowing the last exception.
     */
    public static Retry defaultRetryStrategy() {
        return RetryStrategy.exponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(2), 2.0)
                .maxAttempts(5)
                .retryIf(VersionConflictException::isInstance)
                .onRetryableError((info, throwable) -> log.warn("Attempt {} failed with {}, retrying in {} ms", info.attemptNumber(), throwable.getMessage(), info.backoff().toMillis()));
    }

    private static class Committed {
        private final WriteResult writeResult;
        private final List<Event> events;

        Committed(WriteResult writeResult, List<Event> events) {
            this.writeResult = writeResult;
            this.events = events;
        }
    }
}
