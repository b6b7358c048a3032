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

import jakarta.validation.constraints.NotNull;

/**
 * Folds a single event into the state of an aggregate. Used both when replaying the event log
 * and directly after a new event has been persisted.
 *
 * @see EventSourcingHandlerBuilder
 */
@FunctionalInterface
public interface EventSourcingHandler<S, E> {
    /**
     * @throws UnmatchedCaseException if no handler was registered for this combination of event and state
     */
    S apply(S state, @NotNull E event);

    default EventSourcingResult<S> tryApply(S state, @NotNull E event) {
        try {
            return new EventSourcingResult.Applied<>(apply(state, event));
        } catch (UnmatchedCaseException e) {
            return new EventSourcingResult.Unmatched<>(e.getEventClass(), e.getStateClass());
        }
    }
}
