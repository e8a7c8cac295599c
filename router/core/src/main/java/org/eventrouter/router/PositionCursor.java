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

import org.jspecify.annotations.Nullable;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Holds the last admitted position token. An empty cursor admits every non-empty token.
 * <p>
 * The cursor is not thread-safe on its own, the {@link ChangeRouter} that owns it performs the test-then-advance
 * sequence while holding a lock.
 * </p>
 */
public class PositionCursor {
    private final PositionOrdering ordering;
    private volatile @Nullable String current;

    public PositionCursor(PositionOrdering ordering) {
        this(ordering, null);
    }

    /**
     * @param ordering        The ordering to use when comparing tokens
     * @param initialPosition The position to start from, {@code null} or empty means that the cursor is empty.
     */
    public PositionCursor(PositionOrdering ordering, @Nullable String initialPosition) {
        requireNonNull(ordering, PositionOrdering.class.getSimpleName() + " cannot be null");
        this.ordering = ordering;
        if (initialPosition != null && !initialPosition.isEmpty()) {
            this.current = initialPosition;
        }
    }

    /**
     * Test whether a notification with the given token should be forwarded. Never changes the cursor.
     *
     * @return {@code false} if the token is empty, {@code true} if the cursor is empty, otherwise {@code true} iff the
     * token is strictly after the current position.
     */
    public boolean admit(@Nullable String candidateToken) {
        if (candidateToken == null || candidateToken.isEmpty()) {
            return false;
        }
        String position = current;
        return position == null || ordering.isAfter(candidateToken, position);
    }

    /**
     * Move the cursor to the given token.
     *
     * @throws IllegalArgumentException If the token would not be admitted, i.e. the cursor never moves backwards.
     */
    public void advanceTo(String token) {
        requireNonNull(token, "token cannot be null");
        if (!admit(token)) {
            throw new IllegalArgumentException("Cannot advance cursor from " + current + " to " + token);
        }
        current = token;
    }

    public Optional<String> current() {
        return Optional.ofNullable(current);
    }

    public boolean isEmpty() {
        return current == null;
    }

    public PositionOrdering ordering() {
        return ordering;
    }

    @Override
    public String toString() {
        return "PositionCursor[" + ordering + ", current=" + current + "]";
    }
}
