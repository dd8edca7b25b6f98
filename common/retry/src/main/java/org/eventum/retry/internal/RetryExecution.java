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
import org.eventum.retry.RetryStrategy.DontRetry;

import java.time.Duration;
import java.util.Iterator;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Internal class for executing functions with retry capability. Never use this class directly from your own code!
 */
public class RetryExecution {

    private RetryExecution() {
    }

    public static <T> T executeWithRetry(Supplier<T> supplier, RetryStrategy retryStrategy) {
        if (retryStrategy instanceof DontRetry) {
            return supplier.get();
        }
        RetryImpl retry = (RetryImpl) retryStrategy;
        Iterator<Long> delay = convertToDelayStream(retry.backoff);
        int currentAttempt = 1;
        while (true) {
            try {
                return supplier.get();
            } catch (RuntimeException | Error e) {
                if (isExhausted(currentAttempt, retry.maxAttempts) || !retry.retryPredicate.test(e)) {
                    throw e;
                }
                long backoffMillis = delay.next();
                retry.retryableErrorListener.accept(new RetryInfo(currentAttempt, retry.maxAttempts, Duration.ofMillis(backoffMillis)), e);
                if (backoffMillis > 0) {
                    try {
                        TimeUnit.MILLISECONDS.sleep(backoffMillis);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        e.addSuppressed(ie);
                        throw e;
                    }
                }
                currentAttempt++;
            }
        }
    }

    private static boolean isExhausted(int attempt, MaxAttempts maxAttempts) {
        if (maxAttempts instanceof MaxAttempts.Limit limit) {
            return attempt >= limit.limit();
        }
        return false;
    }

    private static Iterator<Long> convertToDelayStream(Backoff backoff) {
        final Stream<Long> delay;
        if (backoff instanceof Backoff.None) {
            delay = Stream.iterate(0L, __ -> 0L);
        } else if (backoff instanceof Backoff.Fixed fixed) {
            long millis = fixed.millis;
            delay = Stream.iterate(millis, __ -> millis);
        } else if (backoff instanceof Backoff.Exponential strategy) {
            long initialMillis = strategy.initial.toMillis();
            long maxMillis = strategy.max.toMillis();
            double multiplier = strategy.multiplier;
            delay = Stream.iterate(initialMillis, current -> Math.min(maxMillis, Math.round(current * multiplier)));
        } else {
            throw new IllegalStateException("Invalid backoff: " + backoff.getClass().getName());
        }
        return delay.iterator();
    }
}
