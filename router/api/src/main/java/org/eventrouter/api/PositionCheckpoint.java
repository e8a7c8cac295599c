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

package org.eventrouter.api;

/**
 * Invoked with the new position token every time the router has delivered a notification and advanced its cursor.
 * The implementation is responsible for persisting the token so that it can be resumed from after a restart.
 */
@FunctionalInterface
public interface PositionCheckpoint {

    void checkpoint(String positionToken);

    static PositionCheckpoint none() {
        return __ -> {
        };
    }
}
