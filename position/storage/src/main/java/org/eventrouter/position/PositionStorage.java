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

import org.eventrouter.api.PositionCheckpoint;
import org.jspecify.annotations.Nullable;

/**
 * A {@code PositionStorage} provides means to read and write the position of a router to storage, so that it can
 * continue where it left off after a restart.
 * <p>
 * For example:
 * <pre>
 * String position = storage.read(routerId);
 * ChangeRouterConfig config = ChangeRouterConfig.defaults()
 *          .initialPosition(position)
 *          .checkpoint(storage.checkpointFor(routerId));
 * </pre>
 * </p>
 */
public interface PositionStorage {

    /**
     * Read the position for a given router.
     *
     * @param routerId The id of the router whose position to find
     * @return The position token, or {@code null} if no position has been stored for the router.
     */
    @Nullable
    String read(String routerId);

    /*
     * Save the position for the supplied routerId to storage and then return it for easier chaining.
     */
    String save(String routerId, String positionToken);

    /**
     * Delete the position for the supplied {@code routerId}.
     *
     * @param routerId The id of the router to delete the position for.
     */
    void delete(String routerId);

    /**
     * Check if the router id has a stored position in this storage.
     *
     * @param routerId The id of the router to check.
     * @return <code>true</code> if storage contains a position for the router id, <code>false</code> otherwise.
     */
    boolean exists(String routerId);

    /**
     * @return A {@link PositionCheckpoint} that saves every position it receives under the given router id.
     */
    default PositionCheckpoint checkpointFor(String routerId) {
        if (routerId == null || routerId.isBlank()) {
            throw new IllegalArgumentException("routerId cannot be null or blank");
        }
        return positionToken -> save(routerId, positionToken);
    }
}
