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

/**
 * The maximum number of times an action is invoked, including the first invocation.
 */
public sealed interface MaxAttempts {

    static MaxAttempts infinite() {
        return Infinite.INSTANCE;
    }

    static MaxAttempts limit(int limit) {
        return new Limit(limit);
    }

    boolean isExhausted(int attempt);

    record Limit(int limit) implements MaxAttempts {
        public Limit {
            if (limit < 1) {
                throw new IllegalArgumentException("Max attempts must be greater than 0");
            }
        }

        @Override
        public boolean isExhausted(int attempt) {
            return attempt >= limit;
        }
    }

    final class Infinite implements MaxAttempts {
        private static final Infinite INSTANCE = new Infinite();

        private Infinite() {
        }

        @Override
        public boolean isExhausted(int attempt) {
            return false;
        }

        @Override
        public String toString() {
            return Infinite.class.getSimpleName();
        }
    }
}
