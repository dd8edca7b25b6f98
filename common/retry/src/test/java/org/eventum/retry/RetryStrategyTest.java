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

import org.eventum.retry.RetryStrategy.Retry;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
@Timeout(10)
public class RetryStrategyTest {

    @Test
    void does_not_retry_when_retry_strategy_is_none() {
        // Given
        RetryStrategy retryStrategy = RetryStrategy.none();

        AtomicInteger counter = new AtomicInteger(0);

        // When
        Throwable throwable = catchThrowable(() -> retryStrategy.execute(() -> {
            if (counter.incrementAndGet() == 1) {
                throw new IllegalArgumentException("expected");
            }
        }));

        // Then
        assertAll(
                () -> assertThat(counter).hasValue(1),
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("expected")
        );
    }

    @Test
    void returns_the_result_once_the_supplier_succeeds() {
        // Given
        Retry retryStrategy = RetryStrategy.retry().maxAttempts(5);
        AtomicInteger counter = new AtomicInteger(0);

        // When
        String result = retryStrategy.execute(() -> {
            if (counter.incrementAndGet() < 3) {
                throw new IllegalStateException("not yet");
            }
            return "done";
        });

        // Then
        assertAll(
                () -> assertThat(result).isEqualTo("done"),
                () -> assertThat(counter).hasValue(3)
        );
    }

    @Test
    void rethrows_the_last_exception_when_max_attempts_are_exhausted() {
        // Given
        Retry retryStrategy = RetryStrategy.fixed(1).maxAttempts(4);
        AtomicInteger counter = new AtomicInteger(0);

        // When
        Throwable throwable = catchThrowable(() -> retryStrategy.execute(() -> {
            throw new IllegalArgumentException("attempt " + counter.incrementAndGet());
        }));

        // Then
        assertAll(
                () -> assertThat(counter).hasValue(4),
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("attempt 4")
        );
    }

    @Test
    void does_not_retry_exceptions_that_do_not_match_the_retry_predicate() {
        // Given
        Retry retryStrategy = RetryStrategy.retry().maxAttempts(5).retryIf(IllegalStateException.class::isInstance);
        AtomicInteger counter = new AtomicInteger(0);

        // When
        Throwable throwable = catchThrowable(() -> retryStrategy.execute(() -> {
            counter.incrementAndGet();
            throw new IllegalArgumentException("expected");
        }));

        // Then
        assertAll(
                () -> assertThat(counter).hasValue(1),
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class)
        );
    }

    @Test
    void configuration_methods_return_new_instances() {
        // Given
        Retry original = RetryStrategy.retry();

        // When
        Retry withMaxAttempts = original.maxAttempts(2);

        // Then
        assertThat(withMaxAttempts).isNotSameAs(original);
        assertThat(withMaxAttempts).isNotEqualTo(original);
    }

    @Nested
    class RetryableErrorListener {

        @Test
        void is_invoked_for_every_error_that_will_be_retried() {
            // Given
            CopyOnWriteArrayList<RetryInfo> retryInfos = new CopyOnWriteArrayList<>();
            Retry retryStrategy = RetryStrategy.retry()
                    .maxAttempts(3)
                    .onRetryableError((info, __) -> retryInfos.add(info));

            // When
            Throwable throwable = catchThrowable(() -> retryStrategy.execute(() -> {
                throw new IllegalStateException("expected");
            }));

            // Then
            assertAll(
                    () -> assertThat(throwable).hasMessage("expected"),
                    () -> assertThat(retryInfos).extracting(RetryInfo::attemptNumber).containsExactly(1, 2),
                    () -> assertThat(retryInfos).extracting(RetryInfo::isFirstAttempt).containsExactly(true, false)
            );
        }
    }

    @Nested
    class ExponentialBackoff {

        @Test
        void delays_grow_by_the_multiplier_up_to_the_max() {
            // Given
            CopyOnWriteArrayList<Duration> backoffs = new CopyOnWriteArrayList<>();
            Retry retryStrategy = RetryStrategy.exponentialBackoff(Duration.ofMillis(10), Duration.ofMillis(30), 2.0)
                    .maxAttempts(5)
                    .onRetryableError((info, __) -> backoffs.add(info.backoff()));

            // When
            catchThrowable(() -> retryStrategy.execute(() -> {
                throw new IllegalStateException("expected");
            }));

            // Then
            assertThat(backoffs).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(30), Duration.ofMillis(30));
        }

        @Test
        void max_cannot_be_less_than_initial() {
            // When
            Throwable throwable = catchThrowable(() -> Backoff.exponential(Duration.ofSeconds(2), Duration.ofSeconds(1), 2.0));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
        }
    }
}
