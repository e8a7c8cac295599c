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

package org.eventrouter.router;

import java.math.BigInteger;

/**
 * How two position tokens are ordered. The source assigns tokens, so the ordering must match the source's format.
 * Every non-empty token can be ordered by both orderings.
 */
public enum PositionOrdering {
    /**
     * Unsigned decimal integers of any length are compared by value, so {@code "99"} comes before {@code "100"} and
     * {@code "007"} equals {@code "7"}. If either token is not a decimal integer the two are compared as raw strings.
     */
    NUMERIC {
        @Override
        int compareNonEmpty(String first, String second) {
            if (isDecimal(first) && isDecimal(second)) {
                return new BigInteger(first).compareTo(new BigInteger(second));
            }
            return first.compareTo(second);
        }
    },
    /**
     * Tokens are compared as raw strings. Only correct when the source guarantees fixed width tokens.
     */
    LEXICOGRAPHIC {
        @Override
        int compareNonEmpty(String first, String second) {
            return first.compareTo(second);
        }
    };

    abstract int compareNonEmpty(String first, String second);

    /**
     * Compare two tokens.
     *
     * @throws IllegalArgumentException If any of the tokens is empty.
     */
    public int compare(String first, String second) {
        requireNonEmpty(first);
        requireNonEmpty(second);
        return compareNonEmpty(first, second);
    }

    public boolean isAfter(String candidate, String current) {
        return compare(candidate, current) > 0;
    }

    /**
     * @return {@code true} if the token only consists of the ASCII digits {@code 0-9}.
     */
    static boolean isDecimal(String token) {
        if (token.isEmpty()) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static void requireNonEmpty(String token) {
        if (token == null || token.isEmpty()) {
            throw new IllegalArgumentException("Position token cannot be null or empty");
        }
    }
}
