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

import java.util.List;
import java.util.Objects;

final class DefaultEventSourcingHandler<S, E> implements EventSourcingHandler<S, E> {
    private final List<EventSourcingCase<S, E>> cases;

    DefaultEventSourcingHandler(List<EventSourcingCase<S, E>> cases) {
        this.cases = List.copyOf(cases);
    }

    @Override
    public S apply(S state, E event) {
        return tryApply(state, event).orElseThrow();
    }

    @Override
    public EventSourcingResult<S> tryApply(S state, E event) {
        Objects.requireNonNull(event, "event");
        for (EventSourcingCase<S, E> eventSourcingCase : cases) {
            if (eventSourcingCase.matches(state, event)) {
                return new EventSourcingResult.Applied<>(eventSourcingCase.apply(state, event));
            }
        }
        return new EventSourcingResult.Unmatched<>(event.getClass(), state != null ? state.getClass() : null);
    }

    List<EventSourcingCase<S, E>> getCases() {
        return cases;
    }
}
