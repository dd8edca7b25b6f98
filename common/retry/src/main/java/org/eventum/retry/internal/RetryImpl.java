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

package org.eventum.retry.internal;

import org.eventum.retry.Backoff;
import org.eventum.retry.MaxAttempts;
import org.eventum.retry.RetryInfo;
import org.eventum.retry.RetryStrategy;
import org.jspecify.annotations.NullMarked;

import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * A retry strategy that does retry. By default, the following settings are used:
 *
 * <ul>
 *     <li>No backoff</li>
 *     <li>Infinite number of attempts</li>
 *     <li>Retries all exceptions</li>
 *     <li>No retryable error listener (will retry silently)</li>
 * </ul>
 */
@NullMarked
public final class RetryImpl implements RetryStrategy.Retry {
    private static final BiConsumer<RetryInfo, Throwable> NOOP_RETRYABLE_ERROR_LISTENER = (__, ___) -> {
    };

    final Backoff backoff;
    final MaxAttempts maxAttempts;
    final Predicate<Throwable> retryPredicate;
    final BiConsumer<RetryInfo, Throwable> retryableErrorListener;

    private RetryImpl(Backoff backoff, MaxAttempts maxAttempts, Predicate<Throwable> retryPredicate, BiConsumer<RetryInfo, Throwable> retryableErrorListener) {
        Objects.requireNonNull(backoff, Backoff.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(maxAttempts, MaxAttempts.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(retryPredicate, "Retry predicate cannot be null");
        Objects.requireNonNull(retryableErrorListener, "Retryable error listener cannot be null");
        this.backoff = backoff;
        this.maxAttempts = maxAttempts;
        this.retryPredicate = retryPredicate;
        this.retryableErrorListener = retryableErrorListener;
    }

    public RetryImpl() {
        this(Backoff.none(), MaxAttempts.infinite(), __ -> true, NOOP_RETRYABLE_ERROR_LISTENER);
    }

    @Override
    public Retry backoff(Backoff backoff) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, retryableErrorListener);
    }

    @Override
    public Retry infiniteAttempts() {
        return new RetryImpl(backoff, MaxAttempts.infinite(), retryPredicate, retryableErrorListener);
    }

    @Override
    public Retry maxAttempts(int maxAttempts) {
        return new RetryImpl(backoff, MaxAttempts.limit(maxAttempts), retryPredicate, retryableErrorListener);
    }

    @Override
    public Retry retryIf(Predicate<Throwable> retryPredicate) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, retryableErrorListener);
    }

    @Override
    public Retry onRetryableError(BiConsumer<RetryInfo, Throwable> retryableErrorListener) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, retryableErrorListener);
    }

    @Override
    public Retry onRetryableError(Consumer<Throwable> retryableErrorListener) {
        Objects.requireNonNull(retryableErrorListener, "Retryable error listener cannot be null");
        return onRetryableError((__, throwable) -> retryableErrorListener.accept(throwable));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryImpl that)) return false;
        return backoff.equals(that.backoff) && maxAttempts.equals(that.maxAttempts) && retryPredicate.equals(that.retryPredicate)
                && retryableErrorListener.equals(that.retryableErrorListener);
    }

    @Override
    public int hashCode() {
        return Objects.hash(backoff, maxAttempts, retryPredicate, retryableErrorListener);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", RetryImpl.class.getSimpleName() + "[", "]")
                .add("backoff=" + backoff)
                .add("maxAttempts=" + maxAttempts)
                .add("retryPredicate=" + retryPredicate)
                .add("retryableErrorListener=" + retryableErrorListener)
                .toString();
    }
}
