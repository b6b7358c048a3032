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

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable builder for an {@link EventSourcingHandler}. Handlers are tried in the order they were added,
 * the first one whose event type (and, when given, state type) matches is applied. Type matching is
 * covariant: a handler registered for a type also matches all of its subtypes, so narrow handlers have
 * to be added before broad ones.
 * <p>
 * Not thread safe. {@link #build()} takes a snapshot, the builder stays usable afterwards and later
 * changes do not affect handlers that were already built.
 *
 * @param <S> the state type of the aggregate
 * @param <E> the event type of the aggregate
 */
public final class EventSourcingHandlerBuilder<S, E> {
    private final List<EventSourcingCase<S, E>> cases;

    private EventSourcingHandlerBuilder(List<EventSourcingCase<S, E>> cases) {
        this.cases = cases;
    }

    public static <S, E> EventSourcingHandlerBuilder<S, E> builder() {
        return new EventSourcingHandlerBuilder<>(new ArrayList<>());
    }

    /**
     * Match any event which is an instance of {@code X} or a subtype of {@code X}, regardless of the state
     * (which may be {@code null} when the aggregate does not exist yet).
     */
    public <X extends E> EventSourcingHandlerBuilder<S, E> withEventHandler(@NotNull Class<X> eventClass,
                                                                            @NotNull EventSourcingHandlerFunction<S, X, S> handler) {
        cases.add(new EventSourcingCase<S, E>(
                eventClass::isInstance,
                state -> true,
                (state, event) -> handler.apply(state, eventClass.cast(event))));
        return this;
    }

    /**
     * Match any event which is an instance of {@code X} or a subtype of {@code X} when the state is an
     * instance of {@code T} or a subtype of {@code T}. A {@code null} state never matches.
     */
    public <X extends E, T extends S> EventSourcingHandlerBuilder<S, E> withEventAndStateHandler(@NotNull Class<X> eventClass,
                                                                                                 @NotNull Class<T> stateClass,
                                                                                                 @NotNull EventSourcingHandlerFunction<T, X, S> handler) {
        cases.add(new EventSourcingCase<S, E>(
                eventClass::isInstance,
                stateClass::isInstance,
                (state, event) -> handler.apply(stateClass.cast(state), eventClass.cast(event))));
        return this;
    }

    /**
     * Match any event in any state.
     * <p>
     * Builds and returns the handler since no handler added after this one could ever be reached.
     */
    public EventSourcingHandler<S, E> withCatchAllHandler(@NotNull EventSourcingHandlerFunction<S, E, S> handler) {
        cases.add(EventSourcingCase.any(handler));
        return build();
    }

    /**
     * Compose this builder with another builder. The handlers in this builder will be tried first followed
     * by the handlers in {@code other}. Returns a new builder, neither this builder nor {@code other} is changed.
     */
    public EventSourcingHandlerBuilder<S, E> compose(@NotNull EventSourcingHandlerBuilder<S, E> other) {
        List<EventSourcingCase<S, E>> composed = new ArrayList<>(cases.size() + other.cases.size());
        composed.addAll(cases);
        composed.addAll(other.cases);
        return new EventSourcingHandlerBuilder<>(composed);
    }

    /**
     * Builds a handler from the cases added so far. The returned {@link EventSourcingHandler} throws an
     * {@link UnmatchedCaseException} when applied to an event and state that have no matching case.
     */
    public EventSourcingHandler<S, E> build() {
        return new DefaultEventSourcingHandler<>(cases);
    }

    public int size() {
        return cases.size();
    }
}
