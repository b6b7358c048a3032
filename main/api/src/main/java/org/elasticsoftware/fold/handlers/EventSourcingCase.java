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

import java.util.function.Predicate;

/**
 * A single entry of an {@link EventSourcingHandler}. The handler is only invoked when both predicates hold.
 */
public record EventSourcingCase<S, E>(@NotNull Predicate<E> eventPredicate,
                                      @NotNull Predicate<S> statePredicate,
                                      @NotNull EventSourcingHandlerFunction<S, E, S> handler) {

    public boolean matches(S state, E event) {
        return statePredicate.test(state) && eventPredicate.test(event);
    }

    public S apply(S state, E event) {
        return handler.apply(state, event);
    }

    static <S, E> EventSourcingCase<S, E> any(EventSourcingHandlerFunction<S, E, S> handler) {
        return new EventSourcingCase<>(event -> true, state -> true, handler);
    }
}
