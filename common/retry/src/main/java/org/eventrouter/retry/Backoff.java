/*
 * Copyright 2024 Johan Haleby
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

package org.eventrouter.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Specifies how long to wait between two attempts.
 */
public sealed interface Backoff {

    static Backoff none() {
        return None.INSTANCE;
    }

    static Backoff fixed(long millis) {
        return fixed(Duration.ofMillis(millis));
    }

    static Backoff fixed(Duration duration) {
        return new Fixed(duration);
    }

    /**
     * Exponential backoff that starts at {@code initial} and is multiplied by {@code multiplier} after each failed attempt,
     * never exceeding {@code max}.
     */
    static Backoff exponential(Duration initial, Duration max, double multiplier) {
        return new Exponential(initial, max, multiplier);
    }

    /**
     * The delay to wait after the given (1-based) failed attempt.
     */
    Duration delayAfterAttempt(int attempt);

    final class None implements Backoff {
        private static final None INSTANCE = new None();

        private None() {
        }

        @Override
        public Duration delayAfterAttempt(int attempt) {
            return Duration.ZERO;
        }

        @Override
        public String toString() {
            return None.class.getSimpleName();
        }
    }

    final class Fixed implements Backoff {
        public final Duration duration;

        private Fixed(Duration duration) {
            requireNonNull(duration, "duration cannot be null");
            if (duration.isNegative()) {
                throw new IllegalArgumentException("duration cannot be negative");
            }
            this.duration = duration;
        }

        @Override
        public Duration delayAfterAttempt(int attempt) {
            return duration;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Fixed)) return false;
            Fixed fixed = (Fixed) o;
            return Objects.equals(duration, fixed.duration);
        }

        @Override
        public int hashCode() {
            return Objects.hash(duration);
        }

        @Override
        public String toString() {
            return new StringJoiner(", ", Fixed.class.getSimpleName() + "[", "]")
                    .add("duration=" + duration)
                    .toString();
        }
    }

    final class Exponential implements Backoff {
        public final Duration initial;
        public final Duration max;
        public final double multiplier;

        private Exponential(Duration initial, Duration max, double multiplier) {
            requireNonNull(initial, "initial cannot be null");
            requireNonNull(max, "max cannot be null");
            if (initial.isNegative() || max.isNegative()) {
                throw new IllegalArgumentException("initial and max cannot be negative");
            } else if (max.compareTo(initial) < 0) {
                throw new IllegalArgumentException("max cannot be less than initial");
            } else if (multiplier < 1.0d) {
                throw new IllegalArgumentException("multiplier must be greater than or equal to 1");
            }
            this.initial = initial;
            this.max = max;
            this.multiplier = multiplier;
        }

        @Override
        public Duration delayAfterAttempt(int attempt) {
            double millis = initial.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
            return millis >= max.toMillis() ? max : Duration.ofMillis(Math.round(millis));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Exponential)) return false;
            Exponential that = (Exponential) o;
            return Double.compare(that.multiplier, multiplier) == 0 && Objects.equals(initial, that.initial) && Objects.equals(max, that.max);
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
