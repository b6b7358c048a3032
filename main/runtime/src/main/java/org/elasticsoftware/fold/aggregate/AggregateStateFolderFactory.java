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

package org.elasticsoftware.fold.aggregate;

import org.elasticsoftware.fold.annotations.EventSourcedHandler;
import org.elasticsoftware.fold.beans.EventSourcingHandlerMethodAdapter;
import org.elasticsoftware.fold.events.DomainEvent;
import org.elasticsoftware.fold.handlers.EventSourcingHandlerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

public class AggregateStateFolderFactory {
    private static final Logger log = LoggerFactory.getLogger(AggregateStateFolderFactory.class);
    private static final Comparator<Method> HANDLER_ORDER =
            Comparator.comparingInt((Method method) -> method.getAnnotation(EventSourcedHandler.class).order())
                    .thenComparing(Method::getName)
                    .thenComparing(method -> Arrays.toString(method.getParameterTypes()));
    private final int replayLogInterval;

    public AggregateStateFolderFactory(int replayLogInterval) {
        if (replayLogInterval <= 0) {
            throw new IllegalArgumentException("fold.replay.log-interval must be positive, got " + replayLogInterval);
        }
        this.replayLogInterval = replayLogInterval;
    }

    public <S extends AggregateState> AggregateStateFolder<S> create(Aggregate<S> aggregate) {
        return create(aggregate, EventSourcingHandlerBuilder.builder());
    }

    /**
     * Creates a folder from the {@link EventSourcedHandler} methods of the aggregate, followed by the handlers
     * of {@code fallback}. The annotated handlers always take precedence.
     */
    public <S extends AggregateState> AggregateStateFolder<S> create(Aggregate<S> aggregate,
                                                                     EventSourcingHandlerBuilder<S, DomainEvent> fallback) {
        Class<S> stateClass = aggregate.getStateClass();
        List<Method> eventSourcedHandlers = Arrays.stream(aggregate.getClass().getMethods())
                .filter(method -> method.isAnnotationPresent(EventSourcedHandler.class))
                .filter(method -> !method.isBridge())
                .sorted(HANDLER_ORDER)
                .toList();
        EventSourcingHandlerBuilder<S, DomainEvent> builder = EventSourcingHandlerBuilder.builder();
        eventSourcedHandlers.forEach(method -> processEventSourcedHandler(aggregate, stateClass, method, builder));
        log.info("Registered {} EventSourcedHandlers and {} fallback handlers for {} Aggregate",
                eventSourcedHandlers.size(), fallback.size(), aggregate.getName());
        return new AggregateStateFolder<>(aggregate.getName(), builder.compose(fallback).build(), replayLogInterval);
    }

    @SuppressWarnings("unchecked")
    private <S extends AggregateState> void processEventSourcedHandler(Aggregate<S> aggregate,
                                                                       Class<S> stateClass,
                                                                       Method method,
                                                                       EventSourcingHandlerBuilder<S, DomainEvent> builder) {
        if (method.getParameterCount() == 2 &&
                DomainEvent.class.isAssignableFrom(method.getParameterTypes()[0]) &&
                stateClass.equals(method.getParameterTypes()[1]) &&
                stateClass.equals(method.getReturnType())) {
            EventSourcedHandler eventSourcedHandler = method.getAnnotation(EventSourcedHandler.class);
            registerEventSourcedHandler(aggregate,
                    stateClass,
                    (Class<? extends DomainEvent>) method.getParameterTypes()[0],
                    method,
                    eventSourcedHandler.create(),
                    builder);
        } else {
            throw new IllegalArgumentException("Invalid EventSourcedHandler method signature: " + method);
        }
    }

    private <S extends AggregateState, E extends DomainEvent> void registerEventSourcedHandler(Aggregate<S> aggregate,
                                                                                              Class<S> stateClass,
                                                                                              Class<E> eventClass,
                                                                                              Method method,
                                                                                              boolean create,
                                                                                              EventSourcingHandlerBuilder<S, DomainEvent> builder) {
        EventSourcingHandlerMethodAdapter<S, E> adapter =
                new EventSourcingHandlerMethodAdapter<>(aggregate, method, eventClass, stateClass, create);
        if (create) {
            builder.withEventHandler(eventClass, adapter);
        } else {
            builder.withEventAndStateHandler(eventClass, stateClass, adapter);
        }
        log.debug("Registered EventSourcedHandler {}", adapter);
    }

    public int getReplayLogInterval() {
        return replayLogInterval;
    }
}
