/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.fold.handlers;

/**
 * Outcome of {@link EventSourcingHandler#tryApply(Object, Object)}.
 */
public sealed interface EventSourcingResult<S> permits EventSourcingResult.Applied, EventSourcingResult.Unmatched {

    /**
     * @return the next state
     * @throws UnmatchedCaseException when no case matched
     */
    S orElseThrow();

    default boolean isApplied() {
        return this instanceof Applied<?>;
    }

    record Applied<S>(S state) implements EventSourcingResult<S> {
        @Override
        public S orElseThrow() {
            return state;
        }
    }

    record Unmatched<S>(Class<?> eventClass, Class<?> stateClass) implements EventSourcingResult<S> {
        @Override
        public S orElseThrow() {
            throw new UnmatchedCaseException(eventClass, stateClass);
        }
    }
}
