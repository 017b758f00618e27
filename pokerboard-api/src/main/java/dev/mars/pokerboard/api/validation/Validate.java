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

package dev.mars.pokerboard.api.validation;

import java.util.Optional;

/**
 * One validation rule for a command against a state.
 *
 * @param <S> The state type
 * @param <C> The command type
 * @param <R> The failure reason type
 */
@FunctionalInterface
public interface Validate<S, C, R> {

    /**
     * @return The failure reason, or empty if the rule passes
     */
    Optional<R> validate(S state, C command);
}
