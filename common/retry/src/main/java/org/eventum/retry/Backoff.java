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

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * How long to wait between two attempts.
 */
public sealed interface Backoff {

    static Backoff none() {
        return None.INSTANCE;
    }

    static Backoff fixed(long millis) {
        return new Fixed(millis);
    }

    static Backoff fixed(Duration duration) {
        requireNonNull(duration, Duration.class.getSimpleName() + " cannot be null");
        return new Fixed(duration.toMillis());
    }

    /**
     * Wait {@code initial} before the first retry and multiply the wait time by {@code multiplier} for every
     * subsequent retry, never waiting longer than {@code max}.
     */
    static Backoff exponential(Duration initial, Duration max, double multiplier) {
        return new Exponential(initial, max, multiplier);
    }

    final class None implements Backoff {
        private static final None INSTANCE = new None();

        private None() {
        }

        @Override
        public String toString() {
            return None.class.getSimpleName();
        }
    }

    final class Fixed implements Backoff {
        public final long millis;

        private Fixed(long millis) {
            if (millis < 0) {
                throw new IllegalArgumentException("millis cannot be negative");
            }
            this.millis = millis;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Fixed)) return false;
            Fixed fixed = (Fixed) o;
            return millis == fixed.millis;
        }

        @Override
        public int hashCode() {
            return Objects.hash(millis);
        }

        @Override
        public String toString() {
            return new StringJoiner(", ", Fixed.class.getSimpleName() + "[", "]")
                    .add("millis=" + millis)
                    .toString();
        }
    }

    final class Exponential implements Backoff {
        public final Duration initial;
        public final Duration max;
        public final double multiplier;

        private Exponential(Duration initial, Duration max, double multiplier) {
            requireNonNull(initial, "Initial duration cannot be null");
            requireNonNull(max, "Max duration cannot be null");
            if (initial.isNegative()) {
                throw new IllegalArgumentException("Initial duration cannot be negative");
            }
            if (max.compareTo(initial) < 0) {
                throw new IllegalArgumentException("Max duration cannot be less than initial duration");
            }
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier cannot be less than 1.0");
            }
            this.initial = initial;
            this.max = max;
            this.multiplier = multiplier;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Exponential)) return false;
            Exponential that = (Exponential) o;
            return Double.compare(that.multiplier, multiplier) == 0 && initial.equals(that.initial) && max.equals(that.max);
        }

        @Override
        public int hashCode() {
            return Objects.hash(initial, max, multiplier);
        }

        @Override
        public String toString() {
            return new StringJoiner(", ", Exponential.class.getSimpleName() + "[", "]")
                    .add("initial=" + initial)
                    .add("max=" + max)
                    .add("multiplier=" + multiplier)
                    .toString();
        }
    }
}
