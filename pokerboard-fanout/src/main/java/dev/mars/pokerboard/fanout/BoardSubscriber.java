/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.pokerboard.fanout;

/**
 * Receives board traffic from the {@link BoardBroker}.
 *
 * <p>Callbacks run on the broker's calling thread and must not block; implementations
 * hand the message to their own context and return.
 *
 * @param <E> The board event type
 */
public interface BoardSubscriber<E> {

    void onUpdate(BoardUpdate<E> update);

    void onReplay(BoardReplay<E> replay);

    /**
     * A subscriber that reports itself closed is dropped on the next broadcast.
     */
    default boolean isOpen() {
        return true;
    }
}
