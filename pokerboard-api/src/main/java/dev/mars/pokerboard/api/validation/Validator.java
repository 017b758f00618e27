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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs a list of rules against a command and collects every failure.
 *
 * Rules run in the order they were added; a failing rule does not stop the
 * following ones, so callers see all the reasons a command was rejected.
 *
 * <pre>
 * List&lt;Reason&gt; reasons = Validator.&lt;Board, Vote, Reason&gt;of()
 *     .should(VoteRules::beValidVote)
 *     .should(VoteRules::haveExistingParticipant)
 *     .validateAgainst(board, vote);
 * </pre>
 *
 * @param <S> The state type
 * @param <C> The command type
 * @param <R> The failure reason type
 */
public final class Validator<S, C, R> {

    private final List<Validate<S, C, R>> rules = new ArrayList<>();

    private Validator() {
    }

    public static <S, C, R> Validator<S, C, R> of() {
        return new Validator<>();
    }

    public Validator<S, C, R> should(Validate<S, C, R> rule) {
        rules.add(rule);
        return this;
    }

    /**
     * @return All failure reasons in rule order, empty if the command is valid
     */
    public List<R> validateAgainst(S state, C command) {
        List<R> reasons = new ArrayList<>();
        for (Validate<S, C, R> rule : rules) {
            rule.validate(state, command).ifPresent(reasons::add);
        }
        return Collections.unmodifiableList(reasons);
    }
}
