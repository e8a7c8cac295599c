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

package org.eventrouter.position;

import org.jspecify.annotations.Nullable;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.util.Objects.requireNonNull;

/**
 * Keeps positions in memory, they're lost when the process exits.
 */
public class InMemoryPositionStorage implements PositionStorage {
    private final ConcurrentMap<String, String> positions = new ConcurrentHashMap<>();

    @Override
    public @Nullable String read(String routerId) {
        requireNonNull(routerId, "Router id cannot be null");
        return positions.get(routerId);
    }

    @Override
    public String save(String routerId, String positionToken) {
        requireNonNull(routerId, "Router id cannot be null");
        requireNonNull(positionToken, "Position token cannot be null");
        positions.put(routerId, positionToken);
        return positionToken;
    }

    @Override
    public void delete(String routerId) {
        requireNonNull(routerId, "Router id cannot be null");
        positions.remove(routerId);
    }

    @Override
    public boolean exists(String routerId) {
        requireNonNull(routerId, "Router id cannot be null");
        return positions.containsKey(routerId);
    }
}
