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

package org.eventum.retry;

import org.eventum.retry.internal.RetryImpl;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static org.eventum.retry.internal.RetryExecution.executeWithRetry;

/**
 * Retry strategy to use if an action throws an exception.
 * <p>
 * A {@code RetryStrategy} is thread-safe and immutable, so every configuration method returns a new instance:
 * <p>
 * <pre>
 * RetryStrategy retryStrategy = RetryStrategy.fixed(200).maxAttempts(5);
 * retryStrategy.execute(() -> something());
 * // Doesn't affect retryStrategy
 * retryStrategy.backoff(Backoff.fixed(600)).execute(() -> somethingElse());
 * </pre>
 */
public interface RetryStrategy {

    /**
     * Create a retry strategy without backoff that retries every exception an infinite number of times.
     */
    static Retry retry() {
        return new RetryImpl();
    }

    /**
     * Create a retry strategy that doesn't retry, the exception is rethrown immediately.
     */
    static DontRetry none() {
        return DontRetry.INSTANCE;
    }

    static Retry exponentialBackoff(Duration initial, Duration max, double multiplier) {
        return RetryStrategy.retry().backoff(Backoff.exponential(initial, max, multiplier));
    }

    static Retry fixed(Duration duration) {
        return RetryStrategy.retry().backoff(Backoff.fixed(duration));
    }

    static Retry fixed(long millis) {
        return RetryStrategy.retry().backoff(Backoff.fixed(millis));
    }

    /**
     * Execute a {@link Supplier} with the configured retry settings.
     * Rethrows the last exception from the supplier if the retry strategy is exhausted.
     *
     * @param supplier The supplier to execute
     * @return The result of the supplier, if successful.
     */
    default <T> T execute(Supplier<T> supplier) {
        Objects.requireNonNull(supplier, Supplier.class.getSimpleName() + " cannot be null");
        return executeWithRetry(supplier, this);
    }

    /**
     * Execute a {@link Runnable} with the configured retry settings.
     * Rethrows the last exception from the runnable if the retry strategy is exhausted.
     */
    default void execute(Runnable runnable) {
        Objects.requireNonNull(runnable, Runnable.class.getSimpleName() + " cannot be null");
        executeWithRetry(() -> {
            runnable.run();
            return null;
        }, this);
    }

    final class DontRetry implements RetryStrategy {
        private static final DontRetry INSTANCE = new DontRetry();

        private DontRetry() {
        }

        @Override
        public String toString() {
            return DontRetry.class.getSimpleName();
        }
    }

    interface Retry extends RetryStrategy {
        /**
         * @return A new instance of {@link Retry} with the backoff settings applied.
         */
        Retry backoff(Backoff backoff);

        /**
         * Retry an infinite number of times (this is default).
         */
        Retry infiniteAttempts();

        /**
         * Specify the max number of attempts, including the first one, before giving up.
         */
        Retry maxAttempts(int maxAttempts);

        /**
         * Only retry if the specified predicate is {@code true}. Overrides any previous retry predicate.
         */
        Retry retryIf(Predicate<Throwable> retryPredicate);

        /**
         * Add a listener that is invoked for every error that will be retried, i.e. errors that match the predicate
         * defined in {@link #retryIf(Predicate)} while there are attempts left.
         */
        Retry onRetryableError(BiConsumer<RetryInfo, Throwable> retryableErrorListener);

        /**
         * @see #onRetryableError(BiConsumer)
         */
        Retry onRetryableError(Consumer<Throwable> retryableErrorListener);
    }
}
